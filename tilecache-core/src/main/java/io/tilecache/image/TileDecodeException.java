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
package io.tilecache.image;

import io.tilecache.tiling.TileAddress;
import java.io.IOException;

/**
 * Encoded bytes are not a decodable image.
 */
public class TileDecodeException extends IOException {
    private static final long serialVersionUID = 1L;

    private final TileAddress address;

    public TileDecodeException(TileAddress address, String message) {
        super(message);
        this.address = address;
    }

    public TileDecodeException(TileAddress address, String message, Throwable cause) {
        super(message, cause);
        this.address = address;
    }

    public TileAddress address() {
        return address;
    }
}
