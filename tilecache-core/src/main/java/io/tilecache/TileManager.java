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

import com.github.benmanes.caffeine.cache.Ticker;
import io.tilecache.cache.CacheManager;
import io.tilecache.cache.CacheStats;
import io.tilecache.fetch.FetchQueue;
import io.tilecache.fetch.MemoryTileTier;
import io.tilecache.fetch.TileWorkerPool;
import io.tilecache.http.HttpTileClient;
import io.tilecache.image.ImageIOTileDecoder;
import io.tilecache.image.TileDecoder;
import io.tilecache.image.TileImage;
import io.tilecache.store.FileSystemTileStore;
import io.tilecache.store.TileStore;
import io.tilecache.tiling.TileAddress;
import io.tilecache.tiling.TileRange;
import io.tilecache.tiling.Viewport;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point of the rendering side into the tile tiers.
 * <p>
 * Every frame the renderer asks for the {@link #visibleTiles(Viewport) visible tiles} and {@link #request requests}
 * each of them: a cached tile is returned immediately, anything else is queued for the background workers and the
 * call returns empty. Tiles show up on a later frame once a worker resolved them. No method blocks on I/O and no
 * fetch error reaches the caller; a failed tile simply stays absent until its cooldown expires.
 * <p>
 * Each instance owns its caches, queue and workers. Workers start on construction and stop on {@link #shutdown()}.
 *
 * <pre>{@code
 * try (TileManager tiles = TileManager.create(TileCacheConfig.defaults())) {
 *     for (TileAddress tile : tiles.visibleTiles(viewport)) {
 *         tiles.request(tile).ifPresent(image -> draw(image, viewport.screenPosition(tile)));
 *     }
 * }
 * }</pre>
 */
public class TileManager implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TileManager.class);

    static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    private final TileCacheConfig config;
    private final CacheManager cacheManager;
    private final MemoryTileTier memory;
    private final TileStore store;
    private final FetchQueue queue;
    private final TileWorkerPool workers;

    TileManager(Builder builder) {
        this.config = builder.config;
        this.cacheManager = CacheManager.newInstance();
        this.memory = new MemoryTileTier(cacheManager, config.failureCooldown(), builder.ticker);
        this.store = builder.store != null
                ? builder.store
                : new FileSystemTileStore(config.diskRoot(), config.diskExtension());
        this.queue = new FetchQueue();
        HttpTileClient client = HttpTileClient.builder()
                .urlTemplate(config.urlTemplate())
                .userAgent(config.userAgent())
                .timeout(config.timeout())
                .build();
        this.workers = new TileWorkerPool(config.workers(), queue, memory, store, client, builder.decoder);
        logger.info(
                "Tile manager started: {} workers, source {}, disk cache {}",
                config.workers(),
                config.urlTemplate(),
                store.identifier());
    }

    public static TileManager create(TileCacheConfig config) {
        return builder().config(config).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TileCacheConfig config() {
        return config;
    }

    /**
     * Returns the tile if it is in memory, otherwise queues it and returns empty.
     * <p>
     * Queuing is idempotent: a tile already queued or being fetched is not queued again, and a tile that failed
     * recently is not queued until its cooldown expires.
     *
     * @return the decoded tile, or empty if it is not available yet
     */
    public Optional<TileImage> request(TileAddress address) {
        Objects.requireNonNull(address);
        TileImage image = memory.get(address);
        if (image != null) {
            return Optional.of(image);
        }
        if (!memory.isSuppressed(address) && queue.push(address)) {
            logger.trace("Queued tile {}", address);
        }
        return Optional.empty();
    }

    /**
     * Queues tiles that are not in memory yet, without returning them. The last address is served first.
     *
     * @return the number of tiles queued
     */
    public int preload(Iterable<TileAddress> addresses) {
        List<TileAddress> missing = new ArrayList<>();
        for (TileAddress address : addresses) {
            if (!memory.contains(address) && !memory.isSuppressed(address)) {
                missing.add(address);
            }
        }
        return queue.pushAll(missing);
    }

    /**
     * Queues the ring of tiles within the configured margin around {@code viewport}, excluding the tiles inside it.
     *
     * @return the number of tiles queued
     */
    public int preloadAround(Viewport viewport) {
        TileRange inside = TileRange.covering(viewport, 0);
        List<TileAddress> ring = visibleTiles(viewport).stream()
                .filter(tile -> !inside.contains(tile))
                .toList();
        return preload(ring);
    }

    /**
     * @return the tiles intersecting {@code viewport} grown by the configured preload margin
     */
    public TileRange visibleTiles(Viewport viewport) {
        return visibleTiles(viewport, config.preloadMargin());
    }

    public TileRange visibleTiles(Viewport viewport, int margin) {
        return TileRange.covering(viewport, margin);
    }

    /**
     * Drops queued tiles outside {@link #visibleTiles(Viewport)}. Fetches already started run to completion.
     *
     * @return the number of tiles dropped
     */
    public int cancelStale(Viewport viewport) {
        TileRange visible = visibleTiles(viewport);
        int dropped = queue.cancelStale(tile -> !visible.contains(tile));
        if (dropped > 0) {
            logger.debug("Dropped {} stale tile requests", dropped);
        }
        return dropped;
    }

    public TileState state(TileAddress address) {
        if (memory.contains(address)) {
            return TileState.CACHED;
        }
        if (queue.isQueued(address)) {
            return TileState.QUEUED;
        }
        if (queue.isActive(address)) {
            return TileState.FETCHING;
        }
        if (memory.isSuppressed(address)) {
            return TileState.FAILED;
        }
        return TileState.UNREQUESTED;
    }

    /**
     * Waits until no tile is queued or being fetched.
     *
     * @return {@code false} if {@code timeout} elapsed first or the calling thread was interrupted
     */
    public boolean awaitIdle(Duration timeout) {
        try {
            return queue.awaitIdle(timeout);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * @return number of tiles queued and not yet picked up by a worker
     */
    public int pending() {
        return queue.size();
    }

    /**
     * @return number of decoded tiles held in memory
     */
    public long cachedTiles() {
        return memory.size();
    }

    /**
     * @return number of requests sent to the tile server so far
     */
    public long networkRequests() {
        return workers.client().requestCount();
    }

    public TileStore tileStore() {
        return store;
    }

    public Map<String, CacheStats> stats() {
        return cacheManager.stats();
    }

    /**
     * Stops the workers: queued tiles are dropped, fetches in progress complete. Cached tiles remain available through
     * {@link #request}, which no longer queues anything.
     */
    public void shutdown() {
        if (workers.isShutdown()) {
            return;
        }
        boolean stopped = workers.shutdown(SHUTDOWN_TIMEOUT);
        logger.info("Tile manager stopped{}", stopped ? "" : ", some workers did not terminate");
    }

    @Override
    public void close() {
        shutdown();
    }

    public static class Builder {

        private TileCacheConfig config = TileCacheConfig.defaults();

        private @Nullable TileStore store;

        private TileDecoder decoder = new ImageIOTileDecoder();

        private Ticker ticker = Ticker.systemTicker();

        public Builder config(TileCacheConfig config) {
            this.config = Objects.requireNonNull(config);
            return this;
        }

        /**
         * Replaces the {@link FileSystemTileStore} configured by {@link TileCacheConfig#DISK_ROOT}.
         */
        public Builder tileStore(TileStore store) {
            this.store = Objects.requireNonNull(store);
            return this;
        }

        public Builder decoder(TileDecoder decoder) {
            this.decoder = Objects.requireNonNull(decoder);
            return this;
        }

        /**
         * Time source of the failure cooldown.
         */
        public Builder ticker(Ticker ticker) {
            this.ticker = Objects.requireNonNull(ticker);
            return this;
        }

        public TileManager build() {
            return new TileManager(this);
        }
    }
}
