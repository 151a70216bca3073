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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.OptionalDouble;
import java.util.function.BooleanSupplier;
import java.util.function.IntSupplier;

/// The loop which moves virtual time.
///
/// Each turn lets every runnable task run, then decides whether to stop, and
/// otherwise advances the clock to the next wake request. Since nothing
/// ticks on its own, a clock with nothing pending means either the work is
/// done or the tasks are stuck. The driver tells these apart by counting
/// consecutive turns without progress; past the bound it gives up rather
/// than spin forever.
public class SimulationDriver {
    private static final Logger logger = LogManager.getLogger(SimulationDriver.class);

    /// Consecutive turns without progress before the driver gives up
    public static final int DEFAULT_MAX_IDLE_POLLS = 100;

    private final CooperativeExecutor executor;
    private final VirtualClock clock;
    private final BooleanSupplier finished;
    private final IntSupplier customersInSystem;
    private final OptionalDouble timeLimit;
    private final int maxIdlePolls;

    private long advances;
    private int idlePolls;

    /// @param executor          the run queue holding all tasks
    /// @param clock             the clock to advance
    /// @param finished          true once every task has exited
    /// @param customersInSystem how many customers are waiting or in service
    /// @param timeLimit         the virtual instant to stop at, if any
    /// @param maxIdlePolls      consecutive non-advancing turns tolerated
    public SimulationDriver(CooperativeExecutor executor, VirtualClock clock, BooleanSupplier finished,
                            IntSupplier customersInSystem, OptionalDouble timeLimit, int maxIdlePolls) {
        if (maxIdlePolls < 1) {
            throw new IllegalArgumentException("maxIdlePolls must be at least 1, got " + maxIdlePolls);
        }
        if (timeLimit.isPresent() && !(timeLimit.getAsDouble() >= 0.0d)) {
            throw new IllegalArgumentException("time limit must be non-negative, got " + timeLimit.getAsDouble());
        }
        this.executor = executor;
        this.clock = clock;
        this.finished = finished;
        this.customersInSystem = customersInSystem;
        this.timeLimit = timeLimit;
        this.maxIdlePolls = maxIdlePolls;
    }

    /// Run until a stop condition fires.
    /// @return why the loop stopped
    public RunOutcome drive() {
        while (true) {
            executor.runPending();

            if (finished.getAsBoolean()) {
                logger.debug("all tasks finished at T={} after {} advances", clock.now(), advances);
                return RunOutcome.COMPLETED;
            }

            if (timeLimit.isPresent()) {
                double limit = timeLimit.getAsDouble();
                if (clock.now() >= limit) {
                    logger.debug("time limit {} reached", limit);
                    return RunOutcome.TIME_LIMIT;
                }
                OptionalDouble next = clock.nextDeadline();
                if (next.isPresent() && next.getAsDouble() > limit) {
                    clock.advanceTo(limit);
                    logger.debug("next wake at {} lies beyond time limit {}", next.getAsDouble(), limit);
                    return RunOutcome.TIME_LIMIT;
                }
            }

            if (clock.advance()) {
                advances++;
                idlePolls = 0;
                continue;
            }

            idlePolls++;
            if (idlePolls > maxIdlePolls) {
                int inSystem = customersInSystem.getAsInt();
                if (inSystem > 0) {
                    logger.error("deadlock detected with {} customers still in system at T={}",
                        inSystem, clock.now());
                    return RunOutcome.STALLED;
                }
                logger.warn("no task can make progress at T={}, stopping", clock.now());
                return RunOutcome.IDLE;
            }
        }
    }

    /// @return the number of successful clock advances so far
    public long getAdvanceCount() {
        return advances;
    }
}
