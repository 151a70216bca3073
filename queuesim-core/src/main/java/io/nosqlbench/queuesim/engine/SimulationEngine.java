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
import io.nosqlbench.queuesim.events.SimulationEventSink;
import io.nosqlbench.queuesim.model.Customer;
import io.nosqlbench.queuesim.sinks.NoopEventSink;
import io.nosqlbench.queuesim.state.SharedSimulationState;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ThreadLocalRandom;

/// A discrete-event simulation of a queue served by several identical
/// windows.
///
/// The engine builds the admission list, then runs one arrival producer, one
/// server task per window, and a [SimulationDriver] which advances a
/// [VirtualClock]. All tasks are continuations on one [CooperativeExecutor],
/// so the whole run happens on the calling thread and is deterministic for a
/// given admission list.
///
/// ```java
/// SimulationEngine engine = new SimulationEngine(1);
/// engine.addCustomer(0, 100);
/// engine.addCustomer(10, 50);
/// SimulationReport report = engine.run(OptionalDouble.empty(), new MemoryEventSink());
/// ```
///
/// An engine runs once. Build a new one for every run.
public class SimulationEngine {
    private static final Logger logger = LogManager.getLogger(SimulationEngine.class);

    private final int numWindows;
    private final CooperativeExecutor executor = new CooperativeExecutor();
    private final VirtualClock clock = new VirtualClock(executor);
    private final SharedSimulationState state;
    private final int maxIdlePolls;
    private boolean started;

    /// @param numWindows the number of service windows, at least one
    public SimulationEngine(int numWindows) {
        this(numWindows, SimulationDriver.DEFAULT_MAX_IDLE_POLLS);
    }

    /// @param numWindows the number of service windows, at least one
    /// @param maxIdlePolls consecutive non-advancing driver turns tolerated before the run is abandoned
    public SimulationEngine(int numWindows, int maxIdlePolls) {
        if (numWindows <= 0) {
            throw new IllegalArgumentException("Number of windows must be greater than 0, got " + numWindows);
        }
        this.numWindows = numWindows;
        this.state = new SharedSimulationState(numWindows);
        this.maxIdlePolls = maxIdlePolls;
    }

    /// Add one customer to the admission list.
    /// @param arrivalTime when the customer arrives, non-negative
    /// @param serviceDuration how long service takes, positive
    public void addCustomer(double arrivalTime, double serviceDuration) {
        requireNotStarted();
        state.addCustomer(new Customer(arrivalTime, serviceDuration));
    }

    /// Add a Poisson stream of customers, using a fresh random source.
    /// @see #generateRandomCustomers(double, double, double, double, Random)
    public int generateRandomCustomers(double maxTime, double avgArrivalInterval,
                                       double minService, double maxService) {
        return generateRandomCustomers(maxTime, avgArrivalInterval, minService, maxService,
            new Random(ThreadLocalRandom.current().nextLong()));
    }

    /// Add a Poisson stream of customers.
    ///
    /// Inter-arrival times are exponential with mean `avgArrivalInterval`,
    /// drawn as `-ln(U) * avgArrivalInterval` with `U` uniform in `(0, 1]`.
    /// Service times are uniform in `[minService, maxService]`. Generation
    /// stops at the first arrival after `maxTime`.
    ///
    /// @param maxTime the last instant an arrival may fall on, positive
    /// @param avgArrivalInterval mean time between arrivals, positive
    /// @param minService shortest service time, positive
    /// @param maxService longest service time, at least `minService`
    /// @param random the source of randomness
    /// @return the number of customers added
    public int generateRandomCustomers(double maxTime, double avgArrivalInterval,
                                       double minService, double maxService, Random random) {
        requireNotStarted();
        if (!(maxTime > 0.0d) || Double.isInfinite(maxTime)) {
            throw new IllegalArgumentException("Max time must be positive, got " + maxTime);
        }
        if (!(avgArrivalInterval > 0.0d) || Double.isInfinite(avgArrivalInterval)) {
            throw new IllegalArgumentException("Average arrival interval must be positive, got " + avgArrivalInterval);
        }
        if (!(minService > 0.0d) || Double.isInfinite(minService)) {
            throw new IllegalArgumentException("Minimum service time must be positive, got " + minService);
        }
        if (!(maxService >= minService) || Double.isInfinite(maxService)) {
            throw new IllegalArgumentException(
                "Maximum service time must be >= minimum service time, got " + maxService + " < " + minService);
        }
        if (random == null) {
            throw new IllegalArgumentException("random must not be null");
        }

        int added = 0;
        double arrival = 0.0d;
        while (true) {
            double u = 1.0d - random.nextDouble();
            arrival += -Math.log(u) * avgArrivalInterval;
            if (arrival > maxTime) {
                break;
            }
            double service = minService + random.nextDouble() * (maxService - minService);
            state.addCustomer(new Customer(arrival, service));
            added++;
        }
        logger.debug("generated {} customers over {} time units", added, maxTime);
        return added;
    }

    /// Run until every customer is served, without event output.
    /// @return the report of the run
    public SimulationReport run() {
        return run(OptionalDouble.empty(), NoopEventSink.INSTANCE);
    }

    /// Run the simulation.
    ///
    /// With a time limit, arrivals after the limit are never admitted and the
    /// run stops once virtual time reaches it, with customers possibly still
    /// waiting or in service. Statistics are then carried to the limit. The
    /// sink is not closed by this method.
    ///
    /// @param timeLimit the instant to stop at, if any
    /// @param sink where transition events go
    /// @return the report of the run
    public SimulationReport run(OptionalDouble timeLimit, SimulationEventSink sink) {
        requireNotStarted();
        started = true;

        state.sortByArrival();
        state.setEventSink(sink);
        logger.info("starting simulation: {} customers, {} windows, limit {}",
            state.getCustomerCount(), numWindows,
            timeLimit.isPresent() ? String.valueOf(timeLimit.getAsDouble()) : "none");

        AdmissionChannel channel = new AdmissionChannel(executor);
        List<CompletableFuture<Void>> tasks = new ArrayList<>();
        List<ServerWorker> servers = new ArrayList<>(numWindows);
        for (int window = 0; window < numWindows; window++) {
            ServerWorker server = new ServerWorker(window, executor, clock, state, channel);
            servers.add(server);
            tasks.add(server.start());
        }
        ArrivalProducer producer = new ArrivalProducer(executor, clock, state, channel, timeLimit);
        tasks.add(producer.start());
        CompletableFuture<Void> allTasks = CompletableFuture.allOf(tasks.toArray(new CompletableFuture[0]));

        SimulationDriver driver = new SimulationDriver(executor, clock, allTasks::isDone,
            () -> state.snapshot().inSystem(), timeLimit, maxIdlePolls);
        RunOutcome outcome = driver.drive();

        double finalTime = timeLimit.isPresent() ? Math.max(timeLimit.getAsDouble(), clock.now()) : clock.now();
        if (outcome == RunOutcome.STALLED || outcome == RunOutcome.IDLE) {
            finalTime = clock.now();
        }
        state.finalizeAt(finalTime);

        channel.close();
        executor.runPending();

        if (logger.isDebugEnabled()) {
            for (int window = 0; window < servers.size(); window++) {
                logger.debug("window {} served {} customers", window, servers.get(window).getServedCount());
            }
            logger.debug("{} of {} arrivals produced, {} clock advances", producer.getProducedCount(),
                state.getCustomerCount(), driver.getAdvanceCount());
        }

        SimulationReport report = SimulationReport.of(state, outcome);
        if (report.customersInSystem() > 0) {
            logger.info("simulation stopped ({}) at T={} with {} customers still in system",
                outcome, report.finalTime(), report.customersInSystem());
        } else {
            logger.info("simulation finished ({}) at T={}", outcome, report.finalTime());
        }
        return report;
    }

    public int getNumWindows() {
        return numWindows;
    }

    /// @return the state of this simulation; read it only while no run is in progress
    public SharedSimulationState getState() {
        return state;
    }

    public VirtualClock getClock() {
        return clock;
    }

    public boolean isStarted() {
        return started;
    }

    private void requireNotStarted() {
        if (started) {
            throw new IllegalStateException("simulation has already run; create a new engine");
        }
    }
}
