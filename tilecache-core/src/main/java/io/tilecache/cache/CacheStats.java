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

/**
 * Point-in-time statistics of a {@link Cache}.
 *
 * @param hitCount      number of lookups that found a value
 * @param missCount     number of lookups that found nothing
 * @param evictionCount number of entries removed by expiry or size policy
 * @param estimatedSize approximate number of entries at the time of the snapshot
 */
public record CacheStats(long hitCount, long missCount, long evictionCount, long estimatedSize) {

    public static final CacheStats EMPTY = new CacheStats(0, 0, 0, 0);

    public static CacheStats fromCaffeine(com.github.benmanes.caffeine.cache.stats.CacheStats stats, long size) {
        return new CacheStats(stats.hitCount(), stats.missCount(), stats.evictionCount(), size);
    }

    public long requestCount() {
        return hitCount + missCount;
    }

    public double hitRate() {
        long requests = requestCount();
        return requests == 0 ? 1.0 : (double) hitCount / requests;
    }
}
