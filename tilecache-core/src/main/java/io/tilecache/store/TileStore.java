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
package io.tilecache.store;

import io.tilecache.tiling.TileAddress;
import java.util.Optional;

/**
 * Persistent storage of encoded tile blobs, keyed by {@link TileAddress}.
 * <p>
 * The store is a cache, never a source of truth: a missing entry only means the tile has to be fetched again.
 * Implementations must be safe for concurrent use and must publish each blob atomically, so a concurrent
 * {@link #get(TileAddress)} either sees the complete previous content, the complete new content, or nothing.
 * <p>
 * This is the seam for retention policies: the fetch workers only depend on this interface.
 */
public interface TileStore {

    /**
     * @return a human readable identifier of the storage location, used in logs
     */
    String identifier();

    /**
     * @return the stored blob, or empty if the store has no entry for {@code address}
     * @throws TileStoreException if an entry exists but can't be read
     */
    Optional<byte[]> get(TileAddress address) throws TileStoreException;

    /**
     * Stores {@code data} for {@code address}, replacing any previous entry.
     *
     * @throws TileStoreException if the blob can't be written; no partial entry is left behind
     */
    void put(TileAddress address, byte[] data) throws TileStoreException;

    boolean exists(TileAddress address);

    /**
     * Deletes the entry for {@code address}, if any.
     *
     * @return {@code true} if an entry was deleted
     * @throws TileStoreException if the entry exists but can't be deleted
     */
    boolean remove(TileAddress address) throws TileStoreException;
}
