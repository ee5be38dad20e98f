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

import static org.assertj.core.api.Assertions.assertThat;

import io.tilecache.tiling.TileAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class FetchQueueTest {

    private static final TileAddress A = TileAddress.of(10, 1, 1);
    private static final TileAddress B = TileAddress.of(10, 1, 2);
    private static final TileAddress C = TileAddress.of(10, 1, 3);

    private final FetchQueue queue = new FetchQueue();

    @Test
    void popReturnsMostRecentlyPushed() throws InterruptedException {
        assertThat(queue.push(A)).isTrue();
        assertThat(queue.push(B)).isTrue();

        assertThat(queue.pop()).isEqualTo(B);
        assertThat(queue.pop()).isEqualTo(A);
    }

    @Test
    void pushIgnoresQueuedAddress() {
        assertThat(queue.push(A)).isTrue();
        assertThat(queue.push(A)).isFalse();

        assertThat(queue.size()).isEqualTo(1);
        assertThat(queue.isQueued(A)).isTrue();
    }

    @Test
    void pushIgnoresAddressBeingProcessed() throws InterruptedException {
        queue.push(A);
        assertThat(queue.pop()).isEqualTo(A);

        assertThat(queue.isActive(A)).isTrue();
        assertThat(queue.isQueued(A)).isFalse();
        assertThat(queue.push(A)).isFalse();
        assertThat(queue.size()).isZero();
        assertThat(queue.inFlightCount()).isEqualTo(1);

        queue.complete(A);
        assertThat(queue.isActive(A)).isFalse();
        assertThat(queue.push(A)).isTrue();
    }

    @Test
    void pushAllServesLastAddressFirst() throws InterruptedException {
        assertThat(queue.pushAll(List.of(A, B, C, A))).isEqualTo(3);

        assertThat(queue.snapshot()).containsExactly(C, B, A);
        assertThat(queue.pop()).isEqualTo(C);
    }

    @Test
    void cancelStaleDropsOnlyQueuedAddresses() throws InterruptedException {
        queue.push(A);
        queue.push(B);
        queue.push(C);
        assertThat(queue.pop()).isEqualTo(C);

        int dropped = queue.cancelStale(address -> address.row() != 2);

        assertThat(dropped).isEqualTo(1);
        assertThat(queue.snapshot()).containsExactly(B);
        assertThat(queue.isActive(C)).isTrue();
        assertThat(queue.push(A)).as("cancelled address can be queued again").isTrue();
    }

    @Test
    void clear() {
        queue.pushAll(List.of(A, B, C));

        assertThat(queue.clear()).isEqualTo(3);
        assertThat(queue.size()).isZero();
        assertThat(queue.inFlightCount()).isZero();
    }

    @Test
    void concurrentPushesOfSameAddressQueueItOnce() throws Exception {
        int threads = 16;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<CompletableFuture<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < threads; i++) {
                results.add(CompletableFuture.supplyAsync(
                        () -> {
                            try {
                                start.await();
                            } catch (InterruptedException e) {
                                Thread.currentThread().interrupt();
                            }
                            return queue.push(A);
                        },
                        executor));
            }
            start.countDown();
            long accepted = results.stream().filter(CompletableFuture::join).count();

            assertThat(accepted).isEqualTo(1);
            assertThat(queue.size()).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void popWaitsForPush() throws Exception {
        CompletableFuture<TileAddress> popped = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.pop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
        });
        Thread.sleep(50);
        assertThat(popped).isNotDone();

        queue.push(A);

        assertThat(popped.get(5, TimeUnit.SECONDS)).isEqualTo(A);
    }

    @Test
    void closeWakesUpWaitingPop() throws Exception {
        CompletableFuture<TileAddress> popped = CompletableFuture.supplyAsync(() -> {
            try {
                return queue.pop();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return A;
            }
        });
        Thread.sleep(50);

        queue.close();

        assertThat(popped.get(5, TimeUnit.SECONDS)).isNull();
    }

    @Test
    void closeDropsQueuedAddressesAndRejectsPushes() throws InterruptedException {
        queue.push(A);
        queue.push(B);
        assertThat(queue.pop()).isEqualTo(B);

        queue.close();

        assertThat(queue.isClosed()).isTrue();
        assertThat(queue.size()).isZero();
        assertThat(queue.inFlightCount()).as("B is still being processed").isEqualTo(1);
        assertThat(queue.push(C)).isFalse();
        assertThat(queue.pushAll(List.of(C))).isZero();
        assertThat(queue.pop()).isNull();
    }

    @Test
    void pollTimesOut() throws InterruptedException {
        assertThat(queue.poll(Duration.ofMillis(20))).isNull();

        queue.push(A);
        assertThat(queue.poll(Duration.ofMillis(20))).isEqualTo(A);
    }

    @Test
    void awaitIdle() throws Exception {
        assertThat(queue.awaitIdle(Duration.ZERO)).isTrue();

        queue.push(A);
        assertThat(queue.awaitIdle(Duration.ofMillis(20))).isFalse();

        TileAddress taken = queue.pop();
        CompletableFuture<Void> worker = CompletableFuture.runAsync(() -> {
            try {
                Thread.sleep(50);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            queue.complete(taken);
        });

        assertThat(queue.awaitIdle(Duration.ofSeconds(5))).isTrue();
        worker.get(5, TimeUnit.SECONDS);
    }
}
