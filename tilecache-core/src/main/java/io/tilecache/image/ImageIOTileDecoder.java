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
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import javax.imageio.ImageIO;

/**
 * Decodes any raster format with a registered {@link ImageIO} reader (PNG, JPEG, GIF, BMP out of the box).
 */
public class ImageIOTileDecoder implements TileDecoder {

    @Override
    public TileImage decode(TileAddress address, byte[] data) throws TileDecodeException {
        if (data.length == 0) {
            throw new TileDecodeException(address, "Tile " + address + " is empty");
        }
        final BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(data));
        } catch (IOException | RuntimeException e) {
            throw new TileDecodeException(address, "Unable to decode tile " + address + ": " + e.getMessage(), e);
        }
        if (image == null) {
            throw new TileDecodeException(address, "No image reader recognizes the " + data.length + " bytes of tile " + address);
        }
        return new TileImage(image, data.length);
    }
}
