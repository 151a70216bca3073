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
import io.nosqlbench.queuesim.clock.VirtualClock;
import io.nosqlbench.queuesim.state.SharedSimulationState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/// One service window. Repeatedly takes the next customer from the admission
/// channel, starts service, sleeps for the service duration, and ends
/// service. Exits when the channel is closed and drained.
final class ServerWorker {
    private static final Logger logger = LogManager.getLogger(ServerWorker.class);

    private final int window;
    private final CooperativeExecutor executor;
    private final VirtualClock clock;
    private final SharedSimulationState state;
    private final AdmissionChannel channel;
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private int served;

    ServerWorker(int window, CooperativeExecutor executor, VirtualClock clock,
                 SharedSimulationState state, AdmissionChannel channel) {
        this.window = window;
        this.executor = executor;
        this.clock = clock;
        this.state = state;
        this.channel = channel;
    }

    /// Attach to the channel and schedule the first receive on the executor.
    /// @return a future which completes when this server exits
    CompletableFuture<Void> start() {
        channel.attachReceiver();
        executor.execute(this::awaitNext);
        return done;
    }

    int getServedCount() {
        return served;
    }

    private void awaitNext() {
        channel.receive()
            .thenAccept(this::onReceived)
            .exceptionally(this::fail);
    }

    private void onReceived(Optional<Integer> next) {
        if (next.isEmpty()) {
            logger.debug("window {} exiting after {} customers", window, served);
            channel.detachReceiver();
            done.complete(null);
            return;
        }
        int customerId = next.get();
        OptionalDouble duration = state.beginService(customerId, clock.now());
        if (duration.isEmpty()) {
            awaitNext();
            return;
        }
        clock.sleep(duration.getAsDouble())
            .thenRun(() -> finishService(customerId))
            .exceptionally(this::fail);
    }

    private void finishService(int customerId) {
        state.endService(customerId, clock.now());
        served++;
        awaitNext();
    }

    private Void fail(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (!done.isDone()) {
            logger.error("window {} failed after {} customers", window, served, cause);
            channel.detachReceiver();
            done.completeExceptionally(cause);
        }
        return null;
    }
}
