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
package io.tilecache.cache;

import static java.util.Objects.requireNonNull;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import java.time.Duration;
import java.util.Collection;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiConsumer;
import java.util.function.Function;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;

@NullMarked
public class CaffeineCache<K, V> implements Cache<K, V> {

    private static final ThreadFactory maintenanceThreadFactory = new ThreadFactory() {
        private static final AtomicInteger executorThreadId = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setDaemon(true);
            t.setName("tilecache-cache-maintenance-%d".formatted(executorThreadId.incrementAndGet()));
            return t;
        }
    };

    /**
     * Synchronous caches only use the executor for background maintenance (expiry and removal notifications), so all
     * caches built here can share it.
     */
    private static final ExecutorService MAINTENANCE_EXECUTOR = Executors.newFixedThreadPool(
            Math.max(1, (Runtime.getRuntime().availableProcessors() / 2)), maintenanceThreadFactory);

    protected final com.github.benmanes.caffeine.cache.Cache<K, V> cache;

    public CaffeineCache(com.github.benmanes.caffeine.cache.Cache<K, V> cache) {
        this.cache = requireNonNull(cache);
    }

    @Override
    public void forEach(BiConsumer<K, V> consumer) {
        this.cache.asMap().forEach(consumer);
    }

    @Override
    @Nullable
    public V getIfPresent(K key) {
        return cache.getIfPresent(key);
    }

    @Override
    @Nullable
    public V get(K key, Function<? super K, ? extends V> mappingFunction) {
        return cache.get(key, mappingFunction);
    }

    @Override
    public void put(K key, V value) {
        cache.put(key, value);
    }

    @Override
    public CacheStats stats() {
        return CaffeineCache.stats(cache);
    }

    public static CacheStats stats(com.github.benmanes.caffeine.cache.Cache<?, ?> c) {
        return CacheStats.fromCaffeine(c.stats(), c.estimatedSize());
    }

    @Override
    public long estimatedSize() {
        return cache.estimatedSize();
    }

    @Override
    public Cache<K, V> invalidateAll() {
        cache.invalidateAll();
        return this;
    }

    @Override
    public Collection<K> keys() {
        return cache.asMap().keySet();
    }

    @Override
    public void invalidate(K key) {
        cache.invalidate(key);
    }

    @Override
    public void invalidateAll(Iterable<? extends K> keys) {
        cache.invalidateAll(keys);
    }

    public static <K, V> Builder<K, V> newBuilder() {
        return new Builder<>();
    }

    public static class Builder<K, V> {

        Caffeine<Object, Object> caffeine = Caffeine.newBuilder();

        private @Nullable Executor customExecutor;

        public CaffeineCache<K, V> build() {
            Executor executor = customExecutor == null ? MAINTENANCE_EXECUTOR : customExecutor;
            caffeine.executor(executor);
            com.github.benmanes.caffeine.cache.Cache<K, V> cache = caffeine.build();
            return new CaffeineCache<>(cache);
        }

        public Builder<K, V> initialCapacity(int initialCapacity) {
            caffeine = caffeine.initialCapacity(initialCapacity);
            return this;
        }

        public Builder<K, V> expireAfterWrite(Duration duration) {
            caffeine = caffeine.expireAfterWrite(duration);
            return this;
        }

        /**
         * Per-entry expiration, mutually exclusive with {@link #expireAfterWrite(Duration)}.
         */
        @SuppressWarnings("unchecked")
        public Builder<K, V> expiry(Expiry<? super K, ? super V> expiry) {
            caffeine = (Caffeine<Object, Object>) (Caffeine<?, ?>) caffeine.expireAfter((Expiry<Object, Object>) expiry);
            return this;
        }

        /**
         * Time source for expiration, defaults to {@link Ticker#systemTicker()}.
         */
        public Builder<K, V> ticker(Ticker ticker) {
            caffeine = caffeine.ticker(ticker);
            return this;
        }

        public Builder<K, V> executor(Executor executor) {
            this.customExecutor = executor;
            return this;
        }

        public Builder<K, V> recordStats() {
            caffeine = caffeine.recordStats();
            return this;
        }
    }
}
