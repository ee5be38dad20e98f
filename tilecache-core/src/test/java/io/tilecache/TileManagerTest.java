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
package io.tilecache;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.getRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathMatching;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.tilecache.image.ImageIOTileDecoder;
import io.tilecache.image.TileDecoder;
import io.tilecache.image.TileImage;
import io.tilecache.tiling.TileAddress;
import io.tilecache.tiling.TileRange;
import io.tilecache.tiling.Viewport;
import io.tilecache.tiling.WorldCoordinate;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.junit.jupiter.api.io.TempDir;

/**
 * Drives a {@link TileManager} against a mock tile server and a temporary disk cache.
 */
class TileManagerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final Duration COOLDOWN = Duration.ofSeconds(10);

    private static final TileAddress TILE = TileAddress.of(3, 2, 1);
    private static final String TILE_PATH = "/tiles/3/2/1.png";

    private static final int GREEN = 0xFF00AA00;

    /** z3 world, centered, covering tiles 3..4 on both axes. */
    private static final Viewport CENTER = new Viewport(new WorldCoordinate(0.5, 0.5), 3, 256, 256);

    @RegisterExtension
    static WireMockExtension wm = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @TempDir
    Path tempDir;

    private final FakeTicker ticker = new FakeTicker();

    /** Addresses in the order workers decoded them. */
    private final List<TileAddress> decoded = new CopyOnWriteArrayList<>();

    private final List<TileManager> managers = new ArrayList<>();

    private TileCacheConfig config;

    @BeforeEach
    void setUp() {
        config = TileCacheConfig.builder()
                .urlTemplate(wm.baseUrl() + "/tiles/{z}/{x}/{y}.png")
                .userAgent("tilecache-test")
                .timeout(Duration.ofSeconds(2))
                .workers(4)
                .diskRoot(tempDir.resolve("cache_tiles"))
                .failureCooldown(COOLDOWN)
                .preloadMargin(1)
                .build();
        wm.stubFor(get(urlPathMatching("/tiles/.*"))
                .willReturn(aResponse().withStatus(200).withBody(TestTiles.solidPng(4, GREEN))));
    }

    @AfterEach
    void tearDown() {
        managers.forEach(TileManager::close);
    }

    private TileManager newManager(TileCacheConfig config) {
        TileDecoder recording = (address, data) -> {
            decoded.add(address);
            return new ImageIOTileDecoder().decode(address, data);
        };
        TileManager manager = TileManager.builder()
                .config(config)
                .decoder(recording)
                .ticker(ticker)
                .build();
        managers.add(manager);
        return manager;
    }

    private static void awaitState(TileManager manager, TileAddress address, TileState expected)
            throws InterruptedException {
        long deadline = System.nanoTime() + TIMEOUT.toNanos();
        while (manager.state(address) != expected) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError(address + " never reached " + expected + ", is " + manager.state(address));
            }
            Thread.sleep(5);
        }
    }

    @Test
    void requestQueuesThenServesFromMemory() throws Exception {
        TileManager tiles = newManager(config);

        assertThat(tiles.state(TILE)).isEqualTo(TileState.UNREQUESTED);
        assertThat(tiles.request(TILE)).isEmpty();
        assertThat(tiles.state(TILE)).isIn(TileState.QUEUED, TileState.FETCHING, TileState.CACHED);

        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();

        Optional<TileImage> image = tiles.request(TILE);
        assertThat(image).isPresent();
        assertThat(image.get().width()).isEqualTo(4);
        assertThat(image.get().rgb(2, 2)).isEqualTo(GREEN);
        assertThat(tiles.state(TILE)).isEqualTo(TileState.CACHED);
        assertThat(Files.isRegularFile(tempDir.resolve("cache_tiles/3/2/1.png"))).isTrue();
        assertThat(tiles.cachedTiles()).isEqualTo(1);
    }

    @Test
    void cachedTileDoesNotHitNetworkAgain() throws Exception {
        TileManager tiles = newManager(config);
        tiles.request(TILE);
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();

        for (int i = 0; i < 10; i++) {
            assertThat(tiles.request(TILE)).isPresent();
        }

        assertThat(tiles.pending()).isZero();
        assertThat(tiles.networkRequests()).isEqualTo(1);
        wm.verify(1, getRequestedFor(urlEqualTo(TILE_PATH)));
    }

    @Test
    void concurrentRequestsFetchOnce() throws Exception {
        wm.stubFor(get(urlEqualTo(TILE_PATH))
                .willReturn(aResponse().withStatus(200).withBody(TestTiles.solidPng(4, GREEN)).withFixedDelay(200)));
        TileManager tiles = newManager(config);

        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Optional<TileImage>>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return tiles.request(TILE);
                }));
            }
            start.countDown();
            for (Future<Optional<TileImage>> result : results) {
                assertThat(result.get()).isNotNull();
            }
        } finally {
            executor.shutdownNow();
        }

        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();
        assertThat(tiles.request(TILE)).isPresent();
        wm.verify(1, getRequestedFor(urlEqualTo(TILE_PATH)));
    }

    @Test
    void failedTileIsRetriedAfterCooldown() throws Exception {
        wm.stubFor(get(urlEqualTo(TILE_PATH)).willReturn(aResponse().withStatus(500)));
        TileManager tiles = newManager(config);

        TileAddress neighbour = TileAddress.of(3, 2, 2);
        tiles.request(TILE);
        tiles.request(neighbour);
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();
        assertThat(tiles.state(TILE)).isEqualTo(TileState.FAILED);
        assertThat(tiles.state(neighbour)).isEqualTo(TileState.CACHED);

        assertThat(tiles.request(TILE)).isEmpty();
        assertThat(tiles.pending()).as("suppressed during cooldown").isZero();
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();
        wm.verify(1, getRequestedFor(urlEqualTo(TILE_PATH)));

        wm.stubFor(get(urlEqualTo(TILE_PATH))
                .willReturn(aResponse().withStatus(200).withBody(TestTiles.solidPng(4, GREEN))));
        ticker.advance(COOLDOWN);

        assertThat(tiles.state(TILE)).isEqualTo(TileState.UNREQUESTED);
        assertThat(tiles.request(TILE)).isEmpty();
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();

        assertThat(tiles.request(TILE)).isPresent();
        wm.verify(2, getRequestedFor(urlEqualTo(TILE_PATH)));
    }

    @Test
    void undecodableTileIsNotCachedOnDisk() throws Exception {
        wm.stubFor(get(urlEqualTo(TILE_PATH)).willReturn(aResponse().withStatus(200).withBody(TestTiles.garbage())));
        TileManager tiles = newManager(config);

        tiles.request(TILE);
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();

        assertThat(tiles.state(TILE)).isEqualTo(TileState.FAILED);
        assertThat(tiles.tileStore().exists(TILE)).isFalse();
    }

    @Test
    void diskCacheSurvivesManager() throws Exception {
        TileManager first = newManager(config);
        first.request(TILE);
        assertThat(first.awaitIdle(TIMEOUT)).isTrue();
        first.close();

        TileManager second = newManager(config);
        assertThat(second.request(TILE)).isEmpty();
        assertThat(second.awaitIdle(TIMEOUT)).isTrue();

        assertThat(second.request(TILE)).isPresent();
        assertThat(second.networkRequests()).isZero();
        wm.verify(1, getRequestedFor(urlEqualTo(TILE_PATH)));
    }

    @Test
    void preloadAroundQueuesRingOnly() throws Exception {
        TileManager tiles = newManager(config);

        Set<TileAddress> inside = TileRange.covering(CENTER, 0).stream().collect(Collectors.toSet());
        Set<TileAddress> ring = tiles.visibleTiles(CENTER).stream()
                .filter(tile -> !inside.contains(tile))
                .collect(Collectors.toSet());
        assertThat(ring).hasSize(12);

        assertThat(tiles.preloadAround(CENTER)).isEqualTo(12);
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();

        assertThat(Set.copyOf(decoded)).isEqualTo(ring);
        assertThat(inside).allSatisfy(tile -> assertThat(tiles.state(tile)).isEqualTo(TileState.UNREQUESTED));
        assertThat(tiles.preloadAround(CENTER)).as("already cached").isZero();
    }

    @Test
    void mostRecentRequestIsServedFirst() throws Exception {
        TileAddress slow = TileAddress.of(3, 3, 3);
        wm.stubFor(get(urlEqualTo("/tiles/3/3/3.png"))
                .willReturn(aResponse().withStatus(200).withBody(TestTiles.solidPng(4, GREEN)).withFixedDelay(300)));
        TileManager tiles = newManager(config.toBuilder().workers(1).build());

        tiles.request(slow);
        awaitState(tiles, slow, TileState.FETCHING);

        TileAddress a = TileAddress.of(3, 4, 3);
        TileAddress b = TileAddress.of(3, 4, 4);
        TileAddress c = TileAddress.of(3, 3, 4);
        tiles.request(a);
        tiles.request(b);
        tiles.request(c);
        assertThat(tiles.pending()).isEqualTo(3);

        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();
        assertThat(decoded).containsExactly(slow, c, b, a);
    }

    @Test
    void cancelStaleDropsTilesOutsideViewport() throws Exception {
        TileAddress slow = TileAddress.of(3, 3, 3);
        wm.stubFor(get(urlEqualTo("/tiles/3/3/3.png"))
                .willReturn(aResponse().withStatus(200).withBody(TestTiles.solidPng(4, GREEN)).withFixedDelay(300)));
        TileManager tiles = newManager(config.toBuilder().workers(1).build());

        tiles.request(slow);
        awaitState(tiles, slow, TileState.FETCHING);
        TileAddress farAway = TileAddress.of(3, 0, 0);
        TileAddress otherZoom = TileAddress.of(4, 8, 8);
        TileAddress visible = TileAddress.of(3, 4, 4);
        tiles.request(farAway);
        tiles.request(otherZoom);
        tiles.request(visible);

        assertThat(tiles.cancelStale(CENTER)).isEqualTo(2);
        assertThat(tiles.state(farAway)).isEqualTo(TileState.UNREQUESTED);
        assertThat(tiles.state(slow)).isEqualTo(TileState.FETCHING);

        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();
        assertThat(decoded).containsExactly(slow, visible);
    }

    @Test
    void shutdownStopsQueuingButKeepsMemory() throws Exception {
        TileManager tiles = newManager(config);
        tiles.request(TILE);
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();

        tiles.shutdown();
        tiles.shutdown();

        TileAddress other = TileAddress.of(3, 5, 5);
        assertThat(tiles.request(other)).isEmpty();
        assertThat(tiles.pending()).isZero();
        assertThat(tiles.state(other)).isEqualTo(TileState.UNREQUESTED);
        assertThat(tiles.request(TILE)).isPresent();
        assertThat(tiles.awaitIdle(Duration.ZERO)).isTrue();
    }

    @Test
    void stats() throws Exception {
        TileManager tiles = newManager(config);
        tiles.request(TILE);
        assertThat(tiles.awaitIdle(TIMEOUT)).isTrue();
        tiles.request(TILE);

        assertThat(tiles.stats()).containsKeys("tilecache-ram-images", "tilecache-ram-failures");
        assertThat(tiles.stats().get("tilecache-ram-images").hitCount()).isPositive();
    }
}
