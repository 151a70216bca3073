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

import java.util.OptionalDouble;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/// The arrival task. Walks the sorted admission list, sleeping until each
/// arrival instant, hands the customer to the servers, and then records the
/// arrival. Closes the admission channel when it runs out of customers, hits
/// the time limit, or finds nobody left to receive.
final class ArrivalProducer {
    private static final Logger logger = LogManager.getLogger(ArrivalProducer.class);

    private final CooperativeExecutor executor;
    private final VirtualClock clock;
    private final SharedSimulationState state;
    private final AdmissionChannel channel;
    private final OptionalDouble timeLimit;
    private final int customerCount;
    private final CompletableFuture<Void> done = new CompletableFuture<>();

    private int nextCustomer;

    ArrivalProducer(CooperativeExecutor executor, VirtualClock clock, SharedSimulationState state,
                    AdmissionChannel channel, OptionalDouble timeLimit) {
        this.executor = executor;
        this.clock = clock;
        this.state = state;
        this.channel = channel;
        this.timeLimit = timeLimit;
        this.customerCount = state.getCustomerCount();
    }

    /// Schedule the first step on the executor.
    /// @return a future which completes when this producer stops
    CompletableFuture<Void> start() {
        executor.execute(this::produceNext);
        return done;
    }

    int getProducedCount() {
        return nextCustomer;
    }

    private void produceNext() {
        if (nextCustomer >= customerCount) {
            logger.debug("all {} arrivals produced", customerCount);
            finish();
            return;
        }
        int customerId = nextCustomer;
        double arrival = state.getCustomer(customerId).getArrivalTime();
        if (timeLimit.isPresent() && arrival > timeLimit.getAsDouble()) {
            logger.debug("{} arrivals fall after the time limit {}", customerCount - customerId,
                timeLimit.getAsDouble());
            finish();
            return;
        }
        clock.sleepUntil(arrival)
            .thenRun(() -> admit(customerId, arrival))
            .exceptionally(this::fail);
    }

    private void admit(int customerId, double arrival) {
        if (!channel.send(customerId)) {
            logger.warn("all servers shut down prematurely at T={}, {} arrivals not admitted",
                arrival, customerCount - customerId);
            finish();
            return;
        }
        state.admit(customerId, arrival);
        nextCustomer = customerId + 1;
        produceNext();
    }

    private void finish() {
        channel.close();
        done.complete(null);
    }

    private Void fail(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        if (!done.isDone()) {
            logger.error("arrival producer failed at customer {}", nextCustomer, cause);
            channel.close();
            done.completeExceptionally(cause);
        }
        return null;
    }
}
