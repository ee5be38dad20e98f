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
import java.net.URI;
import java.util.Objects;

/**
 * A tile URL pattern with {@code {z}}, {@code {x}} (column) and {@code {y}} (row) placeholders, e.g.
 * {@code https://a.basemaps.cartocdn.com/light_all/{z}/{x}/{y}.png}.
 */
public record TileUrlTemplate(String template) {

    public static final String DEFAULT_TEMPLATE = "https://a.basemaps.cartocdn.com/light_all/{z}/{x}/{y}.png";

    public TileUrlTemplate {
        Objects.requireNonNull(template, "template cannot be null");
        for (String placeholder : new String[] {"{z}", "{x}", "{y}"}) {
            if (!template.contains(placeholder)) {
                throw new IllegalArgumentException("Tile URL template " + template + " has no " + placeholder);
            }
        }
        // malformed URLs fail here
        URI.create(expand(template, 0, 0, 0));
    }

    public static TileUrlTemplate of(String template) {
        return new TileUrlTemplate(template);
    }

    public URI expand(TileAddress address) {
        return URI.create(expand(template, address.zoom(), address.col(), address.row()));
    }

    private static String expand(String template, int z, int x, int y) {
        return template.replace("{z}", Integer.toString(z))
                .replace("{x}", Integer.toString(x))
                .replace("{y}", Integer.toString(y));
    }

    @Override
    public String toString() {
        return template;
    }
}
