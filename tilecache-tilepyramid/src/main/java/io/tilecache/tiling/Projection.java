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
 * Spherical Web Mercator math between latitude/longitude, normalized world coordinates and tile/pixel space.
 * <p>
 * World coordinates put the north-west corner of the map at {@code (0,0)} and the south-east corner at {@code (1,1)}.
 * At zoom {@code z} the world is {@code 2^z * }{@link #TILE_SIZE} pixels wide.
 * <p>
 * All functions are pure. Geographic inputs are clamped or wrapped so the result is always finite; the only rejected
 * inputs are malformed tile addresses.
 */
public final class Projection {

    /** Width and height of a tile in pixels. */
    public static final int TILE_SIZE = 256;

    /** Highest supported zoom level; {@code 2^MAX_ZOOM * TILE_SIZE} still fits in a {@code long}. */
    public static final int MAX_ZOOM = 24;

    /** Latitude at which Web Mercator maps the poles onto a square world, {@code atan(sinh(PI))}. */
    public static final double MAX_LATITUDE = Math.toDegrees(Math.atan(Math.sinh(Math.PI)));

    private Projection() {
        // static utility
    }

    /**
     * Projects a latitude/longitude pair to world coordinates.
     * <p>
     * Latitude is clamped to {@code [-MAX_LATITUDE, MAX_LATITUDE]}, longitude wrapped into {@code [-180, 180)}.
     * {@code NaN} or infinite longitudes and {@code NaN} latitudes are treated as {@code 0}.
     *
     * @return a world coordinate with {@code x} in {@code [0,1)} and {@code y} in {@code [0,1]}
     */
    public static WorldCoordinate project(double lat, double lon) {
        double x = (wrapLongitude(lon) + 180d) / 360d;
        double sin = Math.sin(Math.toRadians(clampLatitude(lat)));
        double y = 0.5 - Math.log((1 + sin) / (1 - sin)) / (4 * Math.PI);
        return new WorldCoordinate(x, clamp(y, 0d, 1d));
    }

    /**
     * Inverse of {@link #project(double, double)}.
     */
    public static LatLon unproject(WorldCoordinate world) {
        double lon = world.x() * 360d - 180d;
        double n = Math.PI - 2 * Math.PI * world.y();
        double lat = Math.toDegrees(Math.atan(Math.sinh(n)));
        return new LatLon(lat, lon);
    }

    /**
     * @return the width and height of the world in pixels at the given zoom level
     */
    public static double worldSize(int zoom) {
        checkZoom(zoom);
        return (double) (1L << zoom) * TILE_SIZE;
    }

    /**
     * Locates the tile containing {@code world} at {@code zoom}, and the pixel offset inside it.
     * <p>
     * {@code x} wraps around the antimeridian; {@code y} is clamped to the map, so {@code y == 1} lands on the last
     * row.
     */
    public static TilePosition worldToTile(WorldCoordinate world, int zoom) {
        checkZoom(zoom);
        final int n = 1 << zoom;
        double x = finiteOrZero(world.x());
        x = x - Math.floor(x);
        double y = clamp(finiteOrZero(world.y()), 0d, Math.nextDown(1d));

        double tileX = x * n;
        double tileY = y * n;
        int col = Math.min((int) Math.floor(tileX), n - 1);
        int row = Math.min((int) Math.floor(tileY), n - 1);
        double pixelX = (tileX - col) * TILE_SIZE;
        double pixelY = (tileY - row) * TILE_SIZE;
        return new TilePosition(new TileAddress(zoom, col, row), pixelX, pixelY);
    }

    /**
     * @return the world coordinate of the north-west corner of {@code tile}
     */
    public static WorldCoordinate tileToWorld(TileAddress tile) {
        final double n = tile.tilesAtZoom();
        return new WorldCoordinate(tile.col() / n, tile.row() / n);
    }

    /**
     * Inverse of {@link #worldToTile(WorldCoordinate, int)}.
     */
    public static WorldCoordinate tileToWorld(TilePosition position) {
        TileAddress tile = position.address();
        final double n = tile.tilesAtZoom();
        double x = (tile.col() + position.pixelX() / TILE_SIZE) / n;
        double y = (tile.row() + position.pixelY() / TILE_SIZE) / n;
        return new WorldCoordinate(x, y);
    }

    /**
     * Rejects tile coordinates that do not name a tile.
     *
     * @throws IllegalArgumentException if {@code zoom} is outside {@code [0, MAX_ZOOM]} or {@code col}/{@code row} are
     *                                  outside {@code [0, 2^zoom)}
     */
    public static void validate(int zoom, int col, int row) {
        checkZoom(zoom);
        final int n = 1 << zoom;
        if (col < 0 || col >= n || row < 0 || row >= n) {
            throw new IllegalArgumentException(
                    "Tile %d/%d/%d out of range, expected 0 <= col,row < %d".formatted(zoom, col, row, n));
        }
    }

    static void checkZoom(int zoom) {
        if (zoom < 0 || zoom > MAX_ZOOM) {
            throw new IllegalArgumentException("Zoom level " + zoom + " outside [0, " + MAX_ZOOM + "]");
        }
    }

    static double clampLatitude(double lat) {
        if (Double.isNaN(lat)) {
            return 0d;
        }
        return clamp(lat, -MAX_LATITUDE, MAX_LATITUDE);
    }

    static double wrapLongitude(double lon) {
        if (!Double.isFinite(lon)) {
            return 0d;
        }
        double wrapped = (lon + 180d) % 360d;
        if (wrapped < 0) {
            wrapped += 360d;
        }
        // -180 + 360 rounding can land exactly on 360
        return wrapped >= 360d ? -180d : wrapped - 180d;
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0d;
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
