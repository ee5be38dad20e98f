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
package io.tilecache.tiling;

/**
 * A normalized Web Mercator position where {@code (0,0)} is the north-west corner of the world and {@code (1,1)} the
 * south-east corner, independent of zoom level.
 */
public record WorldCoordinate(double x, double y) {

    public static WorldCoordinate of(double x, double y) {
        return new WorldCoordinate(x, y);
    }
}
