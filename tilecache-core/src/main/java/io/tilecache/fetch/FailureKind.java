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

/**
 * Why a tile could not be resolved.
 */
public enum FailureKind {
    /** Timeout, connection error or non-success HTTP status. */
    NETWORK(false),
    /** Corrupt or unexpected image bytes. */
    DECODE(false),
    /** The disk tier can't be read; retrying within the same session won't help. */
    DISK_IO(true),
    /** An unchecked exception escaped a collaborator. */
    UNEXPECTED(false);

    private final boolean permanent;

    FailureKind(boolean permanent) {
        this.permanent = permanent;
    }

    /**
     * @return {@code true} if the failure holds for the rest of the session instead of expiring after the cooldown
     */
    public boolean permanent() {
        return permanent;
    }
}
