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
package io.tilecache.http;

import io.tilecache.tiling.TileAddress;
import java.io.IOException;
import java.util.OptionalInt;
import org.jspecify.annotations.Nullable;

/**
 * A tile could not be downloaded: connection error, timeout, or a response other than {@code 200 OK} with a body.
 * <p>
 * Always considered transient.
 */
public class TileFetchException extends IOException {
    private static final long serialVersionUID = 1L;

    static final int NO_STATUS = -1;

    private final TileAddress address;
    private final int statusCode;

    public TileFetchException(TileAddress address, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.address = address;
        this.statusCode = NO_STATUS;
    }

    public TileFetchException(TileAddress address, int statusCode, String message) {
        super(message);
        this.address = address;
        this.statusCode = statusCode;
    }

    public TileAddress address() {
        return address;
    }

    /**
     * @return the HTTP status of the response, empty if no response was received
     */
    public OptionalInt statusCode() {
        return statusCode == NO_STATUS ? OptionalInt.empty() : OptionalInt.of(statusCode);
    }
}
