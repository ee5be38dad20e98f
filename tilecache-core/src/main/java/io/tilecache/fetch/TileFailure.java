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

import java.util.Objects;

/**
 * The recorded outcome of a failed attempt to resolve a tile.
 */
public record TileFailure(FailureKind kind, String message) {

    public TileFailure {
        Objects.requireNonNull(kind);
        Objects.requireNonNull(message);
    }

    public static TileFailure of(FailureKind kind, Throwable cause) {
        String message = cause.getMessage();
        return new TileFailure(kind, message == null ? cause.getClass().getSimpleName() : message);
    }
}
