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
package io.tilecache.fetch;

import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import io.tilecache.cache.Cache;
import io.tilecache.cache.CacheManager;
import io.tilecache.cache.CacheStats;
import io.tilecache.cache.CaffeineCache;
import io.tilecache.image.TileImage;
import io.tilecache.tiling.TileAddress;
import java.time.Duration;
import java.util.Objects;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

/**
 * The in-process tier: decoded images, plus the failures that keep a tile from being re-queued until its cooldown
 * expires.
 * <p>
 * Images are never evicted. Reads are lock-free; an image becomes visible only once fully decoded.
 */
@NullMarked
public class MemoryTileTier {

    public static final String IMAGES_CACHE_NAME = "tilecache-ram-images";

    public static final String FAILURES_CACHE_NAME = "tilecache-ram-failures";

    private final Cache<TileAddress, TileImage> images;

    private final Cache<TileAddress, TileFailure> failures;

    /**
     * @param cacheManager owner of the underlying caches
     * @param cooldown     how long a transient failure suppresses new requests for the same tile
     * @param ticker       time source for the cooldown
     */
    public MemoryTileTier(CacheManager cacheManager, Duration cooldown, Ticker ticker) {
        Objects.requireNonNull(cacheManager);
        Objects.requireNonNull(ticker);
        if (cooldown.isNegative()) {
            throw new IllegalArgumentException("cooldown cannot be negative: " + cooldown);
        }
        this.images = cacheManager.getCache(IMAGES_CACHE_NAME, MemoryTileTier::buildImageCache);
        this.failures = cacheManager.getCache(FAILURES_CACHE_NAME, () -> buildFailureCache(cooldown, ticker));
    }

    private static Cache<TileAddress, TileImage> buildImageCache() {
        return CaffeineCache.<TileAddress, TileImage>newBuilder()
                .initialCapacity(256)
                .recordStats()
                .build();
    }

    private static Cache<TileAddress, TileFailure> buildFailureCache(Duration cooldown, Ticker ticker) {
        return CaffeineCache.<TileAddress, TileFailure>newBuilder()
                .expiry(new FailureExpiry(cooldown))
                .ticker(ticker)
                .recordStats()
                .build();
    }

    @Nullable
    public TileImage get(TileAddress address) {
        return images.getIfPresent(address);
    }

    public boolean contains(TileAddress address) {
        return images.getIfPresent(address) != null;
    }

    /**
     * Publishes a decoded image and clears any failure recorded for the tile.
     */
    public void put(TileAddress address, TileImage image) {
        images.put(address, image);
        failures.invalidate(address);
    }

    public void markFailed(TileAddress address, TileFailure failure) {
        failures.put(address, failure);
    }

    /**
     * @return the failure suppressing {@code address}, or {@code null} if there is none or its cooldown expired
     */
    @Nullable
    public TileFailure failure(TileAddress address) {
        return failures.getIfPresent(address);
    }

    public boolean isSuppressed(TileAddress address) {
        return failure(address) != null;
    }

    public long size() {
        return images.estimatedSize();
    }

    public CacheStats imageStats() {
        return images.stats();
    }

    /**
     * Transient failures live for the cooldown, measured from the latest failure; permanent ones for the session.
     */
    static class FailureExpiry implements Expiry<TileAddress, TileFailure> {

        private final long cooldownNanos;

        FailureExpiry(Duration cooldown) {
            this.cooldownNanos = cooldown.toNanos();
        }

        @Override
        public long expireAfterCreate(TileAddress key, TileFailure value, long currentTime) {
            return value.kind().permanent() ? Long.MAX_VALUE : cooldownNanos;
        }

        @Override
        public long expireAfterUpdate(TileAddress key, TileFailure value, long currentTime, long currentDuration) {
            return expireAfterCreate(key, value, currentTime);
        }

        @Override
        public long expireAfterRead(TileAddress key, TileFailure value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
