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

import io.tilecache.tiling.TileAddress;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Pending tile requests, served most-recent-first.
 * <p>
 * Every address is tracked in an in-flight set from the moment it is pushed until a worker {@link #complete completes}
 * it, so the same tile is never queued twice nor queued while being fetched. The stack and the in-flight set are only
 * mutated together under a single lock.
 * <p>
 * Once {@link #close() closed}, pushes are ignored and {@link #pop()} returns {@code null}, which tells workers to
 * exit.
 */
public class FetchQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition notEmpty = lock.newCondition();
    private final Condition idle = lock.newCondition();

    /** Head is the most recently pushed address. */
    private final Deque<TileAddress> stack = new ArrayDeque<>();

    /** Queued or being processed. */
    private final Set<TileAddress> inFlight = new HashSet<>();

    private boolean closed;

    /**
     * Queues {@code address} ahead of everything already queued.
     *
     * @return {@code false} if the address is already queued or being fetched, or the queue is closed
     */
    public boolean push(TileAddress address) {
        Objects.requireNonNull(address);
        lock.lock();
        try {
            if (closed || !inFlight.add(address)) {
                return false;
            }
            stack.push(address);
            notEmpty.signal();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Pushes each address in iteration order, so the last one is served first.
     *
     * @return the number of addresses actually queued
     */
    public int pushAll(Iterable<TileAddress> addresses) {
        int queued = 0;
        lock.lock();
        try {
            for (TileAddress address : addresses) {
                if (!closed && inFlight.add(address)) {
                    stack.push(address);
                    queued++;
                }
            }
            if (queued > 0) {
                notEmpty.signalAll();
            }
        } finally {
            lock.unlock();
        }
        return queued;
    }

    /**
     * Takes the most recently pushed address, waiting while the queue is empty. The address stays in flight until
     * {@link #complete(TileAddress)}.
     *
     * @return the next address, or {@code null} once the queue is closed
     */
    @Nullable
    public TileAddress pop() throws InterruptedException {
        lock.lockInterruptibly();
        try {
            while (stack.isEmpty() && !closed) {
                notEmpty.await();
            }
            return closed ? null : stack.pop();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Like {@link #pop()}, giving up after {@code timeout}.
     *
     * @return the next address, or {@code null} on timeout or once closed
     */
    @Nullable
    public TileAddress poll(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (stack.isEmpty() && !closed) {
                if (nanos <= 0) {
                    return null;
                }
                nanos = notEmpty.awaitNanos(nanos);
            }
            return closed ? null : stack.pop();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the in-flight slot of an address taken with {@link #pop()}, allowing it to be pushed again.
     */
    public void complete(TileAddress address) {
        lock.lock();
        try {
            inFlight.remove(address);
            signalIfIdle();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops queued addresses matching {@code stale}. Addresses already taken by a worker are not affected.
     *
     * @return the number of addresses dropped
     */
    public int cancelStale(Predicate<TileAddress> stale) {
        int removed = 0;
        lock.lock();
        try {
            for (Iterator<TileAddress> it = stack.iterator(); it.hasNext(); ) {
                TileAddress address = it.next();
                if (stale.test(address)) {
                    it.remove();
                    inFlight.remove(address);
                    removed++;
                }
            }
            signalIfIdle();
        } finally {
            lock.unlock();
        }
        return removed;
    }

    /**
     * Drops every queued address.
     *
     * @return the number of addresses dropped
     */
    public int clear() {
        return cancelStale(address -> true);
    }

    /**
     * Stops accepting addresses, drops the queued ones and wakes up every waiting worker.
     */
    public void close() {
        lock.lock();
        try {
            closed = true;
            stack.forEach(inFlight::remove);
            stack.clear();
            notEmpty.signalAll();
            signalIfIdle();
        } finally {
            lock.unlock();
        }
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits until no address is queued or being processed.
     *
     * @return {@code false} if {@code timeout} elapsed first
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long nanos = timeout.toNanos();
        lock.lockInterruptibly();
        try {
            while (!inFlight.isEmpty()) {
                if (nanos <= 0) {
                    return false;
                }
                nanos = idle.awaitNanos(nanos);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean isQueued(TileAddress address) {
        lock.lock();
        try {
            return inFlight.contains(address) && stack.contains(address);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return {@code true} if a worker took {@code address} and hasn't completed it yet
     */
    public boolean isActive(TileAddress address) {
        lock.lock();
        try {
            return inFlight.contains(address) && !stack.contains(address);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of queued addresses not yet taken by a worker
     */
    public int size() {
        lock.lock();
        try {
            return stack.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of addresses queued or being processed
     */
    public int inFlightCount() {
        lock.lock();
        try {
            return inFlight.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return the queued addresses in the order they would be served
     */
    public List<TileAddress> snapshot() {
        lock.lock();
        try {
            return List.copyOf(stack);
        } finally {
            lock.unlock();
        }
    }

    private void signalIfIdle() {
        if (inFlight.isEmpty()) {
            idle.signalAll();
        }
    }
}
