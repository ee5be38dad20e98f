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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.tilecache.tiling.TileAddress;
import java.net.URI;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class TileUrlTemplateTest {

    @Test
    void expand() {
        TileUrlTemplate template = TileUrlTemplate.of(TileUrlTemplate.DEFAULT_TEMPLATE);

        assertThat(template.expand(TileAddress.of(12, 2047, 1362)))
                .isEqualTo(URI.create("https://a.basemaps.cartocdn.com/light_all/12/2047/1362.png"));
    }

    @Test
    void placeholdersInAnyOrder() {
        TileUrlTemplate template = TileUrlTemplate.of("http://tiles.example.com/{y}.png?zoom={z}&col={x}");

        assertThat(template.expand(TileAddress.of(2, 3, 1)))
                .hasToString("http://tiles.example.com/1.png?zoom=2&col=3");
    }

    @ParameterizedTest
    @ValueSource(strings = {"http://example.com/{x}/{y}.png", "http://example.com/{z}/{y}.png", "http://example.com/{z}/{x}"})
    void missingPlaceholder(String template) {
        assertThatThrownBy(() -> TileUrlTemplate.of(template))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("has no");
    }

    @Test
    void malformed() {
        assertThatThrownBy(() -> TileUrlTemplate.of("http://example.com/{z} {x}/{y}.png"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
