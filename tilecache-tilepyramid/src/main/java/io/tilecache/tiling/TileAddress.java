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

/**
 * Identifies one tile of the standard quad-tree tiling scheme.
 * <p>
 * At zoom level {@code z} the world is divided into {@code 2^z x 2^z} tiles. Column {@code 0} is the western-most
 * column just east of the antimeridian and row {@code 0} is the northern-most row.
 * <p>
 * Instances are immutable and compared structurally, which makes them suitable as the canonical key of every cache
 * tier.
 *
 * @param zoom the zoom level, {@code 0 <= zoom <= }{@link Projection#MAX_ZOOM}
 * @param col  the column, {@code 0 <= col < 2^zoom}
 * @param row  the row, {@code 0 <= row < 2^zoom}
 */
public record TileAddress(int zoom, int col, int row) {

    public TileAddress {
        Projection.validate(zoom, col, row);
    }

    public static TileAddress of(int zoom, int col, int row) {
        return new TileAddress(zoom, col, row);
    }

    /**
     * @return the number of tiles along each axis at this address' zoom level
     */
    public int tilesAtZoom() {
        return 1 << zoom;
    }

    @Override
    public String toString() {
        return zoom + "/" + col + "/" + row;
    }
}
