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

import java.util.Objects;

/**
 * The part of the map shown on screen: a center in world coordinates, a zoom level and a size in pixels.
 * <p>
 * Screen coordinates have their origin at the top-left corner of the viewport. The viewport's top-left corner sits at
 * {@code center * worldSize(zoom) - size / 2} world pixels, so a tile is drawn at
 * {@code tileWorldPos * worldSize(zoom) - origin}.
 */
public record Viewport(WorldCoordinate center, int zoom, int width, int height) {

    public Viewport {
        Objects.requireNonNull(center, "center");
        Projection.checkZoom(zoom);
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Viewport size must be positive: " + width + "x" + height);
        }
    }

    public static Viewport centeredOn(double lat, double lon, int zoom, int width, int height) {
        return new Viewport(Projection.project(lat, lon), zoom, width, height);
    }

    public double worldSize() {
        return Projection.worldSize(zoom);
    }

    /**
     * @return x of the viewport's left edge, in world pixels at the current zoom
     */
    public double originX() {
        return center.x() * worldSize() - width / 2d;
    }

    /**
     * @return y of the viewport's top edge, in world pixels at the current zoom
     */
    public double originY() {
        return center.y() * worldSize() - height / 2d;
    }

    /**
     * Screen position of the top-left corner of an unwrapped tile column/row at the current zoom.
     */
    public PixelCoordinate screenPosition(int col, int row) {
        return new PixelCoordinate((double) col * TILE_SIZE - originX(), (double) row * TILE_SIZE - originY());
    }

    /**
     * Screen position of {@code tile}, picking the copy of its column nearest to the viewport when the map repeats
     * across the antimeridian.
     */
    public PixelCoordinate screenPosition(TileAddress tile) {
        if (tile.zoom() != zoom) {
            throw new IllegalArgumentException("Tile " + tile + " is not at viewport zoom " + zoom);
        }
        final long n = tile.tilesAtZoom();
        double centerPx = originX() + width / 2d;
        long copies = Math.round((centerPx - (tile.col() + 0.5) * TILE_SIZE) / worldSize());
        return screenPosition((int) (tile.col() + copies * n), tile.row());
    }

    /**
     * Screen position of a world coordinate, used to draw overlays projected with
     * {@link Projection#project(double, double)}.
     */
    public PixelCoordinate screenPosition(WorldCoordinate world) {
        double size = worldSize();
        return new PixelCoordinate(world.x() * size - originX(), world.y() * size - originY());
    }

    /**
     * Moves the map by a drag of {@code dx, dy} screen pixels, the content following the pointer.
     */
    public Viewport pan(double dx, double dy) {
        double size = worldSize();
        double x = center.x() - dx / size;
        double y = center.y() - dy / size;
        x = x - Math.floor(x);
        y = Math.max(0d, Math.min(1d, y));
        return new Viewport(new WorldCoordinate(x, y), zoom, width, height);
    }

    public Viewport withZoom(int newZoom) {
        return new Viewport(center, newZoom, width, height);
    }
}
