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

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * A decoded tile, ready to be drawn.
 * <p>
 * Instances are published to readers only once fully decoded and must not be mutated afterwards.
 */
public final class TileImage {

    private final BufferedImage image;
    private final int encodedSize;

    public TileImage(BufferedImage image, int encodedSize) {
        this.image = Objects.requireNonNull(image, "image");
        this.encodedSize = encodedSize;
    }

    public BufferedImage image() {
        return image;
    }

    public int width() {
        return image.getWidth();
    }

    public int height() {
        return image.getHeight();
    }

    /**
     * @return size in bytes of the encoded blob this image was decoded from
     */
    public int encodedSize() {
        return encodedSize;
    }

    /**
     * @return the ARGB pixel at {@code x, y}
     */
    public int rgb(int x, int y) {
        return image.getRGB(x, y);
    }

    @Override
    public String toString() {
        return "TileImage[%dx%d, %d bytes]".formatted(width(), height(), encodedSize);
    }
}
