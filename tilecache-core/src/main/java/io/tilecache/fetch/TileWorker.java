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

import io.tilecache.http.HttpTileClient;
import io.tilecache.http.TileFetchException;
import io.tilecache.image.TileDecodeException;
import io.tilecache.image.TileDecoder;
import io.tilecache.image.TileImage;
import io.tilecache.store.TileStore;
import io.tilecache.store.TileStoreException;
import io.tilecache.tiling.TileAddress;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Worker loop resolving queued tiles through the disk tier, then the network, publishing results to the
 * {@link MemoryTileTier}.
 * <p>
 * A failure never leaves the loop: it is logged and recorded in the memory tier, and the in-flight slot is always
 * released so a later request can retry the tile.
 */
public class TileWorker implements Runnable {

    private static final Logger logger = LoggerFactory.getLogger(TileWorker.class);

    private final FetchQueue queue;
    private final MemoryTileTier memory;
    private final TileStore store;
    private final HttpTileClient client;
    private final TileDecoder decoder;

    public TileWorker(
            FetchQueue queue, MemoryTileTier memory, TileStore store, HttpTileClient client, TileDecoder decoder) {
        this.queue = Objects.requireNonNull(queue);
        this.memory = Objects.requireNonNull(memory);
        this.store = Objects.requireNonNull(store);
        this.client = Objects.requireNonNull(client);
        this.decoder = Objects.requireNonNull(decoder);
    }

    @Override
    public void run() {
        logger.trace("Starting tile worker");
        try {
            TileAddress address;
            while ((address = queue.pop()) != null) {
                try {
                    resolve(address);
                } catch (RuntimeException e) {
                    logger.error("Unexpected error resolving tile {}", address, e);
                    memory.markFailed(address, TileFailure.of(FailureKind.UNEXPECTED, e));
                } finally {
                    queue.complete(address);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            logger.trace("Finished tile worker");
        }
    }

    /**
     * Resolves one tile: memory, then disk, then network.
     */
    void resolve(TileAddress address) {
        if (memory.contains(address)) {
            logger.trace("Tile {} already in memory", address);
            return;
        }
        if (resolveFromDisk(address)) {
            return;
        }
        resolveFromNetwork(address);
    }

    /**
     * @return {@code true} if the tile was resolved, or failed in a way the network can't fix
     */
    private boolean resolveFromDisk(TileAddress address) {
        final Optional<byte[]> cached;
        try {
            cached = store.get(address);
        } catch (TileStoreException e) {
            logger.warn("Disk tier can't read tile {}, giving up on it for this session: {}", address, e.getMessage());
            memory.markFailed(address, TileFailure.of(FailureKind.DISK_IO, e));
            return true;
        }
        if (cached.isEmpty()) {
            logger.debug("Disk miss for tile {}", address);
            return false;
        }
        try {
            memory.put(address, decoder.decode(address, cached.get()));
            logger.trace("Disk hit for tile {}", address);
            return true;
        } catch (TileDecodeException e) {
            logger.warn("Discarding corrupt cached tile {}: {}", address, e.getMessage());
            return !discard(address);
        }
    }

    private boolean discard(TileAddress address) {
        try {
            store.remove(address);
            return true;
        } catch (TileStoreException e) {
            logger.warn("Unable to delete corrupt tile {}, giving up on it for this session: {}", address, e.getMessage());
            memory.markFailed(address, TileFailure.of(FailureKind.DISK_IO, e));
            return false;
        }
    }

    private void resolveFromNetwork(TileAddress address) {
        final byte[] data;
        try {
            data = client.fetch(address);
        } catch (TileFetchException e) {
            logger.warn("Fetching tile {} failed: {}", address, e.getMessage());
            memory.markFailed(address, TileFailure.of(FailureKind.NETWORK, e));
            return;
        }

        final TileImage image;
        try {
            image = decoder.decode(address, data);
        } catch (TileDecodeException e) {
            logger.warn("Downloaded tile {} is not an image: {}", address, e.getMessage());
            memory.markFailed(address, TileFailure.of(FailureKind.DECODE, e));
            return;
        }

        try {
            store.put(address, data);
        } catch (TileStoreException e) {
            // the image is still good for this session
            logger.warn("Unable to cache tile {} on disk: {}", address, e.getMessage());
        }
        memory.put(address, image);
    }
}
