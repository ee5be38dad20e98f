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
import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link TileStore} keeping one file per tile at {@code <root>/<zoom>/<col>/<row>.<extension>}.
 * <p>
 * Directories are created on first write. Each blob is written to a temporary file next to its target and then
 * moved into place, atomically where the file system supports it, so readers never observe a partially written tile.
 * Files are never evicted.
 */
public class FileSystemTileStore implements TileStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSystemTileStore.class);

    static final String TEMP_SUFFIX = ".tmp";

    private final Path root;
    private final String extension;

    /**
     * @param root      the cache root directory, created lazily
     * @param extension file name extension of stored tiles, with or without the leading dot
     */
    public FileSystemTileStore(Path root, String extension) {
        this.root = Objects.requireNonNull(root, "root directory cannot be null");
        Objects.requireNonNull(extension, "extension cannot be null");
        String ext = extension.startsWith(".") ? extension.substring(1) : extension;
        if (ext.isBlank()) {
            throw new IllegalArgumentException("extension cannot be empty");
        }
        this.extension = ext;
    }

    public Path root() {
        return root;
    }

    @Override
    public String identifier() {
        return root.toAbsolutePath().toString();
    }

    /**
     * @return the location of {@code address}' file, whether or not it exists
     */
    public Path path(TileAddress address) {
        return root.resolve(Integer.toString(address.zoom()))
                .resolve(Integer.toString(address.col()))
                .resolve(address.row() + "." + extension);
    }

    @Override
    public boolean exists(TileAddress address) {
        return Files.isRegularFile(path(address));
    }

    @Override
    public Optional<byte[]> get(TileAddress address) throws TileStoreException {
        Path file = path(address);
        try {
            return Optional.of(Files.readAllBytes(file));
        } catch (NoSuchFileException notCached) {
            return Optional.empty();
        } catch (IOException e) {
            throw new TileStoreException("Unable to read tile " + address + " from " + file, e);
        }
    }

    @Override
    public void put(TileAddress address, byte[] data) throws TileStoreException {
        Objects.requireNonNull(data);
        final Path target = path(address);
        final Path directory = target.getParent();
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = Files.createTempFile(directory, address.row() + ".", TEMP_SUFFIX);
            Files.write(temp, data);
            publish(temp, target);
            logger.debug("Stored tile {} ({} bytes) at {}", address, data.length, target);
        } catch (IOException e) {
            TileStoreException error = new TileStoreException("Unable to store tile " + address + " at " + target, e);
            if (temp != null) {
                try {
                    Files.deleteIfExists(temp);
                } catch (IOException suppressed) {
                    error.addSuppressed(suppressed);
                }
            }
            throw error;
        }
    }

    private void publish(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            logger.trace("Atomic move not supported for {}, replacing", target);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    @Override
    public boolean remove(TileAddress address) throws TileStoreException {
        Path file = path(address);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new TileStoreException("Unable to delete tile " + address + " at " + file, e);
        }
    }

    @Override
    public String toString() {
        return "FileSystemTileStore[" + identifier() + "]";
    }
}
