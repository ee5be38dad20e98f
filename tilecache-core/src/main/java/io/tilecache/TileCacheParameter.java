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

import java.util.Objects;
import org.jspecify.annotations.Nullable;

/**
 * A typed configuration key of {@link TileCacheConfig}.
 *
 * <pre>{@code
 * public static final TileCacheParameter<Integer> WORKERS = TileCacheParameter.builder()
 *         .key("io.tilecache.workers")
 *         .title("Number of fetch workers")
 *         .type(Integer.class)
 *         .defaultValue(4)
 *         .build();
 * }</pre>
 *
 * @param <T> the value type, one of {@link String}, {@link Integer} or {@link Boolean}
 */
public record TileCacheParameter<T>(
        String key, String title, String description, Class<T> type, @Nullable T defaultValue) {

    public TileCacheParameter {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(type, "type");
        if (type != String.class && type != Integer.class && type != Boolean.class) {
            throw new IllegalArgumentException("Unsupported parameter type " + type.getName());
        }
    }

    public static Builder<Object> builder() {
        return new Builder<>();
    }

    /**
     * Converts a raw property value, as found in {@link java.util.Properties}, to this parameter's type.
     *
     * @throws IllegalArgumentException if {@code raw} can't be converted
     */
    public T parse(Object raw) {
        Objects.requireNonNull(raw);
        if (type.isInstance(raw)) {
            return type.cast(raw);
        }
        String value = raw.toString().trim();
        if (type == String.class) {
            return type.cast(value);
        }
        if (type == Boolean.class) {
            if (!"true".equalsIgnoreCase(value) && !"false".equalsIgnoreCase(value)) {
                throw new IllegalArgumentException("Invalid boolean '%s' for %s".formatted(value, key));
            }
            return type.cast(Boolean.valueOf(value));
        }
        try {
            return type.cast(Integer.valueOf(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer '%s' for %s".formatted(value, key), e);
        }
    }

    public static class Builder<T> {
        private String key;
        private String title;
        private String description = "";
        private Class<T> type;
        private @Nullable T defaultValue;

        public Builder<T> key(String key) {
            this.key = key;
            return this;
        }

        public Builder<T> title(String title) {
            this.title = title;
            return this;
        }

        public Builder<T> description(String description) {
            this.description = description.strip();
            return this;
        }

        @SuppressWarnings("unchecked")
        public <U> Builder<U> type(Class<U> type) {
            Builder<U> self = (Builder<U>) this;
            self.type = type;
            return self;
        }

        @SuppressWarnings("unchecked")
        public <U> Builder<U> defaultValue(U defaultValue) {
            Builder<U> self = (Builder<U>) this;
            self.defaultValue = defaultValue;
            return self;
        }

        public TileCacheParameter<T> build() {
            return new TileCacheParameter<>(key, title == null ? key : title, description, type, defaultValue);
        }
    }
}
