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

import io.tilecache.http.HttpTileClient;
import io.tilecache.image.TileDecoder;
import io.tilecache.store.TileStore;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed number of long-lived {@link TileWorker} threads draining one {@link FetchQueue}.
 * <p>
 * The pool owns the {@link HttpTileClient}, whose connection pool is shared read-only by every worker. Workers start
 * on construction and stop on {@link #shutdown(Duration)}.
 */
public class TileWorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(TileWorkerPool.class);

    public static final int DEFAULT_WORKERS = 4;

    private final FetchQueue queue;
    private final HttpTileClient client;
    private final int workers;
    private final ExecutorService executor;
    private final AtomicBoolean shutdown = new AtomicBoolean();

    public TileWorkerPool(
            int workers,
            FetchQueue queue,
            MemoryTileTier memory,
            TileStore store,
            HttpTileClient client,
            TileDecoder decoder) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be positive: " + workers);
        }
        this.workers = workers;
        this.queue = Objects.requireNonNull(queue);
        this.client = Objects.requireNonNull(client);
        this.executor = Executors.newFixedThreadPool(workers, new NamedThreadFactory("tilecache-worker"));
        for (int i = 0; i < workers; i++) {
            executor.execute(new TileWorker(queue, memory, store, client, decoder));
        }
        executor.shutdown();
        logger.debug("Started {} tile workers", workers);
    }

    public int workers() {
        return workers;
    }

    public HttpTileClient client() {
        return client;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    /**
     * Closes the queue, dropping work not yet started, and waits for fetches in progress to finish. Workers still
     * running after {@code timeout} are interrupted.
     *
     * @return {@code true} if every worker stopped within {@code timeout}
     */
    public boolean shutdown(Duration timeout) {
        if (!shutdown.compareAndSet(false, true)) {
            return executor.isTerminated();
        }
        queue.close();
        try {
            if (executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                logger.debug("Tile workers stopped");
                return true;
            }
            logger.warn("Tile workers still busy after {}ms, interrupting them", timeout.toMillis());
            executor.shutdownNow();
            return executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /** A thread factory that prepends {@code name-} to all thread names. */
    private static class NamedThreadFactory implements ThreadFactory {

        private final AtomicInteger threadNumber = new AtomicInteger(1);
        private final String namePrefix;

        private NamedThreadFactory(String name) {
            namePrefix = name + "-";
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
