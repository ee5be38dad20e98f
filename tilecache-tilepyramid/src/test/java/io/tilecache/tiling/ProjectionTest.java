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

import static io.tilecache.tiling.Projection.MAX_LATITUDE;
import static io.tilecache.tiling.Projection.TILE_SIZE;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.util.Random;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class ProjectionTest {

    private static final double EPSILON = 1e-9;

    @Test
    void project_originAndCorners() {
        WorldCoordinate origin = Projection.project(0, 0);
        assertThat(origin.x()).isCloseTo(0.5, within(EPSILON));
        assertThat(origin.y()).isCloseTo(0.5, within(EPSILON));

        WorldCoordinate northWest = Projection.project(MAX_LATITUDE, -180);
        assertThat(northWest.x()).isCloseTo(0, within(EPSILON));
        assertThat(northWest.y()).isCloseTo(0, within(1e-6));

        WorldCoordinate south = Projection.project(-MAX_LATITUDE, 0);
        assertThat(south.y()).isCloseTo(1, within(1e-6));
    }

    @ParameterizedTest
    @ValueSource(doubles = {85.06, 89.999, 90, 91, 1000, Double.MAX_VALUE, Double.POSITIVE_INFINITY})
    void project_clampsLatitudeBeyondMercatorRange(double lat) {
        WorldCoordinate north = Projection.project(lat, 10);
        WorldCoordinate south = Projection.project(-lat, 10);

        assertThat(north.y()).isFinite().isEqualTo(Projection.project(MAX_LATITUDE, 10).y());
        assertThat(south.y()).isFinite().isEqualTo(Projection.project(-MAX_LATITUDE, 10).y());
        assertThat(north.x()).isFinite();
    }

    @Test
    void project_nanAndInfiniteInputsStayFinite() {
        WorldCoordinate nan = Projection.project(Double.NaN, Double.NaN);
        assertThat(nan.x()).isCloseTo(0.5, within(EPSILON));
        assertThat(nan.y()).isCloseTo(0.5, within(EPSILON));

        WorldCoordinate inf = Projection.project(10, Double.NEGATIVE_INFINITY);
        assertThat(inf.x()).isFinite();
        assertThat(inf.y()).isFinite();
    }

    @Test
    void project_wrapsLongitude() {
        assertThat(Projection.project(0, 190).x())
                .isCloseTo(Projection.project(0, -170).x(), within(EPSILON));
        assertThat(Projection.project(0, 540).x()).isCloseTo(0, within(EPSILON));
        assertThat(Projection.project(0, -360).x()).isCloseTo(0.5, within(EPSILON));
        assertThat(Projection.project(0, 180).x()).isGreaterThanOrEqualTo(0).isLessThan(1);
    }

    @Test
    void unproject_invertsProject() {
        LatLon belfort = Projection.unproject(Projection.project(47.6386, 6.8631));
        assertThat(belfort.lat()).isCloseTo(47.6386, within(1e-9));
        assertThat(belfort.lon()).isCloseTo(6.8631, within(1e-9));
    }

    @Test
    void worldSize() {
        assertThat(Projection.worldSize(0)).isEqualTo(TILE_SIZE);
        assertThat(Projection.worldSize(3)).isEqualTo(8 * TILE_SIZE);
        assertThat(Projection.worldSize(Projection.MAX_ZOOM)).isEqualTo((double) (1L << 24) * TILE_SIZE);
    }

    @Test
    void worldToTile_locatesTileAndPixelOffset() {
        TilePosition position = Projection.worldToTile(new WorldCoordinate(0.3, 0.2), 3);

        assertThat(position.address()).isEqualTo(TileAddress.of(3, 2, 1));
        assertThat(position.pixelX()).isCloseTo(0.4 * TILE_SIZE, within(1e-6));
        assertThat(position.pixelY()).isCloseTo(0.6 * TILE_SIZE, within(1e-6));
    }

    @Test
    void worldToTile_clampsAndWrapsOutOfWorldInput() {
        assertThat(Projection.worldToTile(new WorldCoordinate(1.25, 1.0), 2).address())
                .isEqualTo(TileAddress.of(2, 1, 3));
        assertThat(Projection.worldToTile(new WorldCoordinate(-0.25, -3), 2).address())
                .isEqualTo(TileAddress.of(2, 3, 0));
    }

    @Test
    void tileToWorld_northWestCorner() {
        assertThat(Projection.tileToWorld(TileAddress.of(3, 2, 1))).isEqualTo(new WorldCoordinate(0.25, 0.125));
        assertThat(Projection.tileToWorld(TileAddress.of(0, 0, 0))).isEqualTo(new WorldCoordinate(0, 0));
    }

    @Test
    void roundTrip_worldToTileToWorld() {
        Random random = new Random(42);
        for (int zoom = 0; zoom <= Projection.MAX_ZOOM; zoom++) {
            for (int i = 0; i < 200; i++) {
                WorldCoordinate w = new WorldCoordinate(random.nextDouble(), random.nextDouble());
                WorldCoordinate back = Projection.tileToWorld(Projection.worldToTile(w, zoom));
                assertThat(back.x()).as("x at z%d", zoom).isCloseTo(w.x(), within(EPSILON));
                assertThat(back.y()).as("y at z%d", zoom).isCloseTo(w.y(), within(EPSILON));
            }
        }
    }

    @Test
    void validate_rejectsMalformedAddresses() {
        assertThatThrownBy(() -> TileAddress.of(3, 8, 0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("3/8/0");
        assertThatThrownBy(() -> TileAddress.of(3, 0, -1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TileAddress.of(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TileAddress.of(Projection.MAX_ZOOM + 1, 0, 0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Projection.worldSize(99)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void tileAddress_isValueKey() {
        assertThat(TileAddress.of(3, 2, 1)).isEqualTo(new TileAddress(3, 2, 1)).hasSameHashCodeAs(new TileAddress(3, 2, 1));
        assertThat(TileAddress.of(3, 2, 1)).hasToString("3/2/1");
        assertThat(TileAddress.of(3, 2, 1).tilesAtZoom()).isEqualTo(8);
    }
}
