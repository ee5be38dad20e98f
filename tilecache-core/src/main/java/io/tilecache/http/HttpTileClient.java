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
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads tiles from the network.
 * <p>
 * A single {@link HttpClient} is created per instance and shared by every caller, so connections are kept alive and
 * reused across requests. Instances are thread-safe and stateless apart from the request counter.
 */
public class HttpTileClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpTileClient.class);

    private final HttpClient client;
    private final TileUrlTemplate urlTemplate;
    private final String userAgent;
    private final Duration timeout;
    private final AtomicLong requestCount = new AtomicLong();

    HttpTileClient(Builder builder) {
        this.urlTemplate = builder.urlTemplate;
        this.userAgent = builder.userAgent;
        this.timeout = builder.timeout;
        this.client = HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(builder.timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public TileUrlTemplate urlTemplate() {
        return urlTemplate;
    }

    /**
     * @return the number of requests sent since creation, successful or not
     */
    public long requestCount() {
        return requestCount.get();
    }

    /**
     * Downloads the encoded bytes of {@code address}.
     *
     * @return the non-empty body of a {@code 200} response
     * @throws TileFetchException on connection errors, timeouts, non-{@code 200} status codes and empty bodies
     */
    public byte[] fetch(TileAddress address) throws TileFetchException {
        final URI uri = urlTemplate.expand(address);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(timeout)
                .header("User-Agent", userAgent)
                .GET()
                .build();

        requestCount.incrementAndGet();
        logger.debug("GET {}", uri);
        final HttpResponse<byte[]> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
        } catch (HttpTimeoutException e) {
            throw new TileFetchException(address, "Timed out after " + timeout.toMillis() + "ms fetching " + uri, e);
        } catch (IOException e) {
            throw new TileFetchException(address, "Error fetching " + uri + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TileFetchException(address, "Interrupted fetching " + uri, e);
        }

        final int status = response.statusCode();
        if (status != 200) {
            throw new TileFetchException(address, status, "GET " + uri + " returned status " + status);
        }
        byte[] body = response.body();
        if (body == null || body.length == 0) {
            throw new TileFetchException(address, status, "GET " + uri + " returned an empty body");
        }
        return body;
    }

    public static class Builder {

        public static final Duration DEFAULT_TIMEOUT = Duration.ofMillis(5_000);

        public static final String DEFAULT_USER_AGENT = "tilecache/1.0";

        private TileUrlTemplate urlTemplate = TileUrlTemplate.of(TileUrlTemplate.DEFAULT_TEMPLATE);

        private String userAgent = DEFAULT_USER_AGENT;

        private Duration timeout = DEFAULT_TIMEOUT;

        public Builder urlTemplate(TileUrlTemplate urlTemplate) {
            this.urlTemplate = Objects.requireNonNull(urlTemplate);
            return this;
        }

        public Builder urlTemplate(String urlTemplate) {
            return urlTemplate(TileUrlTemplate.of(urlTemplate));
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = Objects.requireNonNull(userAgent);
            return this;
        }

        /**
         * Applies to both connecting and waiting for a response.
         */
        public Builder timeout(Duration timeout) {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new IllegalArgumentException("timeout must be positive: " + timeout);
            }
            this.timeout = timeout;
            return this;
        }

        public HttpTileClient build() {
            return new HttpTileClient(this);
        }
    }
}
