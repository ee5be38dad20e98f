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
 * The tile containing a world coordinate at some zoom level, and the offset in pixels of that coordinate from the
 * tile's north-west corner.
 *
 * @param address the containing tile
 * @param pixelX  offset from the tile's west edge, in {@code [0, TILE_SIZE)}
 * @param pixelY  offset from the tile's north edge, in {@code [0, TILE_SIZE)}
 */
public record TilePosition(TileAddress address, double pixelX, double pixelY) {}
