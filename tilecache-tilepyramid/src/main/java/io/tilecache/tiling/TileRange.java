/*
 * (c) Copyright 2025 Multiversio LLC. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *          http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.tilecache.tiling;

import static io.tilecache.tiling.Projection.TILE_SIZE;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * An inclusive rectangle of tile columns and rows at one zoom level.
 * <p>
 * Columns are unwrapped: they may run past either edge of the world when a viewport straddles the antimeridian.
 * Iterating the range yields every distinct {@link TileAddress} it covers exactly once, wrapping columns modulo
 * {@code 2^zoom} and skipping rows outside the map. Iteration is lazy and keeps no state in the range itself, so the
 * same range can be walked again on every frame.
 */
public record TileRange(int zoom, int minCol, int minRow, int maxCol, int maxRow) implements Iterable<TileAddress> {

    public TileRange {
        Projection.checkZoom(zoom);
        if (maxCol < minCol - 1 || maxRow < minRow - 1) {
            throw new IllegalArgumentException("Inverted range " + minCol + ".." + maxCol + ", " + minRow + ".." + maxRow);
        }
    }

    /**
     * The tiles intersecting {@code viewport}, grown by {@code margin} tiles on every side.
     */
    public static TileRange covering(Viewport viewport, int margin) {
        if (margin < 0) {
            throw new IllegalArgumentException("margin must be >= 0: " + margin);
        }
        double originX = viewport.originX();
        double originY = viewport.originY();
        int minCol = (int) Math.floor(originX / TILE_SIZE);
        int minRow = (int) Math.floor(originY / TILE_SIZE);
        int maxCol = (int) Math.floor((originX + viewport.width()) / TILE_SIZE);
        int maxRow = (int) Math.floor((originY + viewport.height()) / TILE_SIZE);
        return new TileRange(viewport.zoom(), minCol, minRow, maxCol, maxRow).expand(margin);
    }

    public TileRange expand(int margin) {
        return new TileRange(zoom, minCol - margin, minRow - margin, maxCol + margin, maxRow + margin);
    }

    public boolean contains(TileAddress tile) {
        if (tile.zoom() != zoom || tile.row() < minRow || tile.row() > maxRow) {
            return false;
        }
        if (wrapsWholeWorld()) {
            return true;
        }
        return Math.floorMod(tile.col() - minCol, 1 << zoom) <= maxCol - minCol;
    }

    /**
     * @return the number of distinct tiles this range yields
     */
    public int size() {
        return colCount() * Math.max(0, lastRow() - firstRow() + 1);
    }

    public Stream<TileAddress> stream() {
        return StreamSupport.stream(spliterator(), false);
    }

    @Override
    public Iterator<TileAddress> iterator() {
        return new TileIterator();
    }

    private boolean wrapsWholeWorld() {
        return (long) maxCol - minCol + 1 >= (1L << zoom);
    }

    private int colCount() {
        return wrapsWholeWorld() ? 1 << zoom : Math.max(0, maxCol - minCol + 1);
    }

    private int firstCol() {
        return wrapsWholeWorld() ? 0 : minCol;
    }

    private int firstRow() {
        return Math.max(0, minRow);
    }

    private int lastRow() {
        return Math.min((1 << zoom) - 1, maxRow);
    }

    /** Walks columns outer, rows inner. */
    private class TileIterator implements Iterator<TileAddress> {
        private final int n = 1 << zoom;
        private final int cols = colCount();
        private final int firstRow = firstRow();
        private final int lastRow = lastRow();
        private int colIndex = 0;
        private int row = firstRow;

        @Override
        public boolean hasNext() {
            return firstRow <= lastRow && colIndex < cols;
        }

        @Override
        public TileAddress next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            int col = Math.floorMod(firstCol() + colIndex, n);
            TileAddress next = new TileAddress(zoom, col, row);
            if (++row > lastRow) {
                row = firstRow;
                colIndex++;
            }
            return next;
        }
    }
}
