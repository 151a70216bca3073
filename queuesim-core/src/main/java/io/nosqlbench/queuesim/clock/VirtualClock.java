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

import java.util.OptionalDouble;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;

/// A clock which keeps virtual time and lets cooperating tasks suspend until
/// a virtual instant.
///
/// Virtual time never moves on its own. It only moves when the driver calls
/// [#advance()], which jumps directly to the earliest pending wake request and
/// resumes the task that made it. There is no ticking and no relation to
/// wall-clock time.
///
/// Suspension is expressed with [CompletableFuture]s. A call to
/// [#sleepUntil(double)] registers exactly one wake request and returns the
/// future which completes when that request is resumed. Chaining on that
/// future any number of times never registers another request. Resumption is
/// delegated to the [CooperativeExecutor], so continuations run when the
/// driver drains it, never inside [#advance()].
///
/// ```java
/// CooperativeExecutor executor = new CooperativeExecutor();
/// VirtualClock clock = new VirtualClock(executor);
/// clock.sleep(5.0).thenRun(() -> System.out.println("woke at " + clock.now()));
/// clock.advance();       // now == 5.0, continuation queued
/// executor.runPending(); // prints "woke at 5.0"
/// ```
public class VirtualClock {
    private static final Logger logger = LogManager.getLogger(VirtualClock.class);

    private final CooperativeExecutor executor;
    private final PriorityQueue<WakeEvent> pending = new PriorityQueue<>();
    private double now;
    private long nextSequence;

    /// Create a clock starting at time zero.
    /// @param executor the run queue which resumed tasks are handed to
    public VirtualClock(CooperativeExecutor executor) {
        if (executor == null) {
            throw new IllegalArgumentException("executor must not be null");
        }
        this.executor = executor;
    }

    /// @return the current virtual time
    public synchronized double now() {
        return now;
    }

    /// Suspend the caller for a virtual duration.
    ///
    /// A duration which is zero or negative yields exactly once without
    /// touching the schedule.
    /// @param duration how long to sleep in virtual time units
    /// @return the continuation handle of the caller
    public CompletableFuture<Void> sleep(double duration) {
        if (Double.isNaN(duration)) {
            throw new IllegalArgumentException("sleep duration must be a number");
        }
        if (duration <= 0.0d) {
            return executor.yieldNow();
        }
        return sleepUntil(now() + duration);
    }

    /// Suspend the caller until virtual time reaches the given instant.
    ///
    /// An instant at or before [#now()] yields exactly once without touching
    /// the schedule.
    /// @param time the instant to wake at
    /// @return the continuation handle of the caller
    public CompletableFuture<Void> sleepUntil(double time) {
        if (Double.isNaN(time)) {
            throw new IllegalArgumentException("wake time must be a number");
        }
        synchronized (this) {
            if (time > now) {
                CompletableFuture<Void> continuation = new CompletableFuture<>();
                pending.add(new WakeEvent(time, nextSequence++, continuation));
                return continuation;
            }
        }
        return executor.yieldNow();
    }

    /// Move virtual time to the earliest pending wake request and resume it,
    /// together with any other request whose deadline is not after the new
    /// time.
    /// @return false if there was nothing pending
    public boolean advance() {
        synchronized (this) {
            WakeEvent first = pending.poll();
            if (first == null) {
                return false;
            }
            if (first.deadline() > now) {
                now = first.deadline();
            }
            resume(first);
            resumeDue();
        }
        return true;
    }

    /// Move virtual time forward to an instant without waiting for a wake
    /// request there. Requests due by that instant are resumed.
    /// @param time the instant to move to; ignored if it is not after [#now()]
    public synchronized void advanceTo(double time) {
        if (Double.isNaN(time)) {
            throw new IllegalArgumentException("time must be a number");
        }
        if (time > now) {
            now = time;
            resumeDue();
        }
    }

    /// @return the earliest pending deadline, if any
    public synchronized OptionalDouble nextDeadline() {
        WakeEvent first = pending.peek();
        return first == null ? OptionalDouble.empty() : OptionalDouble.of(first.deadline());
    }

    /// @return the number of wake requests not yet resumed
    public synchronized int pendingCount() {
        return pending.size();
    }

    private void resumeDue() {
        WakeEvent due;
        while ((due = pending.peek()) != null && due.deadline() <= now) {
            pending.poll();
            logger.trace("catching up {} at {}", due, now);
            resume(due);
        }
    }

    private void resume(WakeEvent event) {
        CompletableFuture<Void> continuation = event.continuation();
        executor.execute(() -> continuation.complete(null));
    }
}
