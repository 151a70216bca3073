/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.nosqlbench.queuesim.engine;

import io.nosqlbench.queuesim.clock.CooperativeExecutor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/// The FIFO hand-off of customer ids from the arrival producer to the server
/// tasks.
///
/// Sending never suspends. An id goes straight to the receiver which has been
/// parked longest, or is buffered if every receiver is busy. A parked
/// receiver is resumed through the [CooperativeExecutor], never inline, so the
/// sender finishes its own transition before any server reacts to it.
///
/// Receiving completes at once from the buffer. Once the channel is closed
/// and the buffer is drained, receivers get an empty result, which is their
/// signal to exit.
public class AdmissionChannel {

    private final CooperativeExecutor executor;
    private final Deque<Integer> buffer = new ArrayDeque<>();
    private final Deque<CompletableFuture<Optional<Integer>>> parked = new ArrayDeque<>();
    private boolean closed;
    private int receivers;
    private long sent;

    public AdmissionChannel(CooperativeExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.executor = executor;
    }

    /// Register a task which will receive from this channel.
    public synchronized void attachReceiver() {
        receivers++;
    }

    /// Deregister a receiving task. Once no receiver remains, sends fail.
    public synchronized void detachReceiver() {
        if (receivers > 0) {
            receivers--;
        }
    }

    /// Offer a customer id.
    /// @param customerId the id to hand off
    /// @return false if the channel is closed or nobody is left to receive
    public synchronized boolean send(int customerId) {
        if (closed || receivers == 0) {
            return false;
        }
        CompletableFuture<Optional<Integer>> receiver = parked.pollFirst();
        if (receiver != null) {
            Optional<Integer> delivered = Optional.of(customerId);
            executor.execute(() -> receiver.complete(delivered));
        } else {
            buffer.addLast(customerId);
        }
        sent++;
        return true;
    }

    /// Take the next customer id.
    /// @return a future holding the next id, or empty once the channel is closed and drained
    public synchronized CompletableFuture<Optional<Integer>> receive() {
        Integer next = buffer.pollFirst();
        if (next != null) {
            return CompletableFuture.completedFuture(Optional.of(next));
        }
        if (closed) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        CompletableFuture<Optional<Integer>> receiver = new CompletableFuture<>();
        parked.addLast(receiver);
        return receiver;
    }

    /// Stop accepting ids. Buffered ids are still delivered; parked receivers
    /// are resumed with an empty result.
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        CompletableFuture<Optional<Integer>> receiver;
        while ((receiver = parked.pollFirst()) != null) {
            CompletableFuture<Optional<Integer>> resumed = receiver;
            executor.execute(() -> resumed.complete(Optional.empty()));
        }
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    public synchronized int getBufferedCount() {
        return buffer.size();
    }

    public synchronized int getParkedCount() {
        return parked.size();
    }

    public synchronized int getReceiverCount() {
        return receivers;
    }

    public synchronized long getSentCount() {
        return sent;
    }
}
