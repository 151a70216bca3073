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

package io.nosqlbench.queuesim.clock;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/// A single run queue on which all logical simulation tasks are multiplexed.
///
/// Tasks never run on their own threads. A task that is resumed has its
/// continuation enqueued here, and the continuation runs when the driver
/// drains the queue with [#runPending()]. Draining is what "yielding" means
/// for the driver: every task that became runnable gets to run before the
/// driver looks at the clock again.
///
/// This class is not thread safe. All calls are expected to come from the
/// thread that drives the simulation.
public class CooperativeExecutor implements Executor {
    private static final Logger logger = LogManager.getLogger(CooperativeExecutor.class);

    private final Deque<Runnable> ready = new ArrayDeque<>();
    private long executed;

    /// Enqueue a continuation to run on the next drain.
    /// @param continuation the work to run
    @Override
    public void execute(Runnable continuation) {
        if (continuation == null) {
            throw new IllegalArgumentException("continuation must not be null");
        }
        ready.addLast(continuation);
    }

    /// Defer the caller exactly once.
    /// @return a future which completes during the next drain
    public CompletableFuture<Void> yieldNow() {
        CompletableFuture<Void> resumed = new CompletableFuture<>();
        execute(() -> resumed.complete(null));
        return resumed;
    }

    /// Run queued continuations until the queue is empty, including any that
    /// are enqueued while draining.
    /// @return the number of continuations which ran
    public int runPending() {
        int ran = 0;
        Runnable next;
        while ((next = ready.pollFirst()) != null) {
            try {
                next.run();
            } catch (RuntimeException e) {
                logger.error("continuation failed", e);
            }
            ran++;
        }
        executed += ran;
        return ran;
    }

    /// @return true if no continuation is waiting to run
    public boolean isIdle() {
        return ready.isEmpty();
    }

    /// @return the number of continuations waiting to run
    public int readyCount() {
        return ready.size();
    }

    /// @return the number of continuations run since this executor was created
    public long executedCount() {
        return executed;
    }
}
