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
package io.tilecache;

import io.tilecache.http.HttpTileClient;
import io.tilecache.http.TileUrlTemplate;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings of a {@link TileManager}, read from {@link Properties} or set programmatically.
 *
 * <pre>{@code
 * Properties config = new Properties();
 * config.setProperty("io.tilecache.http.url-template", "https://tile.openstreetmap.org/{z}/{x}/{y}.png");
 * config.setProperty("io.tilecache.workers", "8");
 * TileManager tiles = TileManager.create(TileCacheConfig.fromProperties(config));
 * }</pre>
 *
 * Values are validated on construction; an invalid value fails with {@link IllegalArgumentException}.
 */
public final class TileCacheConfig {

    /**
     * Tile URL with {@code {z}}, {@code {x}} and {@code {y}} placeholders.
     * <p><b>Key:</b> {@code io.tilecache.http.url-template}
     */
    public static final TileCacheParameter<String> URL_TEMPLATE = TileCacheParameter.builder()
            .key("io.tilecache.http.url-template")
            .title("Tile URL template")
            .description(
                    """
                    URL of a tile, where {z} is replaced by the zoom level, {x} by the column and {y} by the row.
                    """)
            .type(String.class)
            .defaultValue(TileUrlTemplate.DEFAULT_TEMPLATE)
            .build();

    /**
     * <p><b>Key:</b> {@code io.tilecache.http.user-agent}
     */
    public static final TileCacheParameter<String> USER_AGENT = TileCacheParameter.builder()
            .key("io.tilecache.http.user-agent")
            .title("HTTP User-Agent")
            .description("User-Agent header sent with every tile request. Most public tile servers require one.")
            .type(String.class)
            .defaultValue(HttpTileClient.Builder.DEFAULT_USER_AGENT)
            .build();

    /**
     * <p><b>Key:</b> {@code io.tilecache.http.timeout-millis}
     */
    public static final TileCacheParameter<Integer> TIMEOUT_MILLIS = TileCacheParameter.builder()
            .key("io.tilecache.http.timeout-millis")
            .title("HTTP timeout in milliseconds")
            .description(
                    """
                    Maximum time to wait when connecting to the tile server, and again for its response.
                    A timed out request counts as a network failure.
                    """)
            .type(Integer.class)
            .defaultValue((int) HttpTileClient.Builder.DEFAULT_TIMEOUT.toMillis())
            .build();

    /**
     * <p><b>Key:</b> {@code io.tilecache.workers}
     */
    public static final TileCacheParameter<Integer> WORKERS = TileCacheParameter.builder()
            .key("io.tilecache.workers")
            .title("Number of fetch workers")
            .description("Number of background threads resolving tiles in parallel.")
            .type(Integer.class)
            .defaultValue(4)
            .build();

    /**
     * <p><b>Key:</b> {@code io.tilecache.disk.root}
     */
    public static final TileCacheParameter<String> DISK_ROOT = TileCacheParameter.builder()
            .key("io.tilecache.disk.root")
            .title("Disk cache directory")
            .description("Root of the on-disk tile cache, laid out as <root>/<zoom>/<col>/<row>.<extension>.")
            .type(String.class)
            .defaultValue("cache_tiles")
            .build();

    /**
     * <p><b>Key:</b> {@code io.tilecache.disk.extension}
     */
    public static final TileCacheParameter<String> DISK_EXTENSION = TileCacheParameter.builder()
            .key("io.tilecache.disk.extension")
            .title("Disk cache file extension")
            .type(String.class)
            .defaultValue("png")
            .build();

    /**
     * <p><b>Key:</b> {@code io.tilecache.failure.cooldown-millis}
     */
    public static final TileCacheParameter<Integer> FAILURE_COOLDOWN_MILLIS = TileCacheParameter.builder()
            .key("io.tilecache.failure.cooldown-millis")
            .title("Failure cooldown in milliseconds")
            .description(
                    """
                    How long a tile that failed to download or decode is left alone before a new request
                    queues it again.
                    """)
            .type(Integer.class)
            .defaultValue(10_000)
            .build();

    /**
     * <p><b>Key:</b> {@code io.tilecache.preload.margin}
     */
    public static final TileCacheParameter<Integer> PRELOAD_MARGIN = TileCacheParameter.builder()
            .key("io.tilecache.preload.margin")
            .title("Preload margin in tiles")
            .description("Number of rings of tiles around the viewport requested ahead of time.")
            .type(Integer.class)
            .defaultValue(2)
            .build();

    public static final List<TileCacheParameter<?>> PARAMETERS = List.of(
            URL_TEMPLATE,
            USER_AGENT,
            TIMEOUT_MILLIS,
            WORKERS,
            DISK_ROOT,
            DISK_EXTENSION,
            FAILURE_COOLDOWN_MILLIS,
            PRELOAD_MARGIN);

    private final Map<String, Object> values;

    private TileCacheConfig(Map<String, Object> values) {
        this.values = Map.copyOf(values);
        validate();
    }

    public static TileCacheConfig defaults() {
        return new TileCacheConfig(Map.of());
    }

    /**
     * Reads every known parameter from {@code properties}; unknown keys are ignored.
     */
    public static TileCacheConfig fromProperties(Properties properties) {
        Map<String, Object> values = new HashMap<>();
        for (TileCacheParameter<?> parameter : PARAMETERS) {
            Object raw = properties.get(parameter.key());
            if (raw != null) {
                values.put(parameter.key(), parameter.parse(raw));
            }
        }
        return new TileCacheConfig(values);
    }

    public static Builder builder() {
        return new Builder(Map.of());
    }

    public Builder toBuilder() {
        return new Builder(values);
    }

    /**
     * @return the explicitly configured value of {@code parameter}, empty if it uses its default
     */
    public <T> Optional<T> getParameter(TileCacheParameter<T> parameter) {
        return Optional.ofNullable(values.get(parameter.key())).map(parameter.type()::cast);
    }

    /**
     * @return the configured value of {@code parameter}, or its default
     */
    public <T> T get(TileCacheParameter<T> parameter) {
        return getParameter(parameter)
                .or(() -> Optional.ofNullable(parameter.defaultValue()))
                .orElseThrow(() -> new IllegalStateException("No value for " + parameter.key()));
    }

    public TileUrlTemplate urlTemplate() {
        return TileUrlTemplate.of(get(URL_TEMPLATE));
    }

    public String userAgent() {
        return get(USER_AGENT);
    }

    public Duration timeout() {
        return Duration.ofMillis(get(TIMEOUT_MILLIS));
    }

    public int workers() {
        return get(WORKERS);
    }

    public Path diskRoot() {
        return Path.of(get(DISK_ROOT));
    }

    public String diskExtension() {
        return get(DISK_EXTENSION);
    }

    public Duration failureCooldown() {
        return Duration.ofMillis(get(FAILURE_COOLDOWN_MILLIS));
    }

    public int preloadMargin() {
        return get(PRELOAD_MARGIN);
    }

    private void validate() {
        urlTemplate();
        requireAtLeast(TIMEOUT_MILLIS, 1);
        requireAtLeast(WORKERS, 1);
        requireAtLeast(FAILURE_COOLDOWN_MILLIS, 0);
        requireAtLeast(PRELOAD_MARGIN, 0);
        if (get(DISK_ROOT).isBlank()) {
            throw new IllegalArgumentException(DISK_ROOT.key() + " cannot be empty");
        }
        if (get(DISK_EXTENSION).isBlank()) {
            throw new IllegalArgumentException(DISK_EXTENSION.key() + " cannot be empty");
        }
    }

    private void requireAtLeast(TileCacheParameter<Integer> parameter, int min) {
        int value = get(parameter);
        if (value < min) {
            throw new IllegalArgumentException("%s must be >= %d: %d".formatted(parameter.key(), min, value));
        }
    }

    @Override
    public String toString() {
        return "TileCacheConfig" + values;
    }

    public static class Builder {
        private final Map<String, Object> values;

        Builder(Map<String, Object> values) {
            this.values = new HashMap<>(values);
        }

        public <T> Builder set(TileCacheParameter<T> parameter, T value) {
            values.put(parameter.key(), Objects.requireNonNull(value));
            return this;
        }

        public Builder urlTemplate(String urlTemplate) {
            return set(URL_TEMPLATE, urlTemplate);
        }

        public Builder userAgent(String userAgent) {
            return set(USER_AGENT, userAgent);
        }

        public Builder timeout(Duration timeout) {
            return set(TIMEOUT_MILLIS, Math.toIntExact(timeout.toMillis()));
        }

        public Builder workers(int workers) {
            return set(WORKERS, workers);
        }

        public Builder diskRoot(Path root) {
            return set(DISK_ROOT, root.toString());
        }

        public Builder diskExtension(String extension) {
            return set(DISK_EXTENSION, extension);
        }

        public Builder failureCooldown(Duration cooldown) {
            return set(FAILURE_COOLDOWN_MILLIS, Math.toIntExact(cooldown.toMillis()));
        }

        public Builder preloadMargin(int margin) {
            return set(PRELOAD_MARGIN, margin);
        }

        public TileCacheConfig build() {
            return new TileCacheConfig(values);
        }
    }
}
