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

import java.util.concurrent.CompletableFuture;

/// A pending request to resume a suspended task at a virtual instant.
///
/// Events are ordered by deadline, then by registration sequence, so that
/// tasks waking at the same instant resume in the order they went to sleep.
final class WakeEvent implements Comparable<WakeEvent> {

    private final double deadline;
    private final long sequence;
    private final CompletableFuture<Void> continuation;

    WakeEvent(double deadline, long sequence, CompletableFuture<Void> continuation) {
        this.deadline = deadline;
        this.sequence = sequence;
        this.continuation = continuation;
    }

    double deadline() {
        return deadline;
    }

    long sequence() {
        return sequence;
    }

    CompletableFuture<Void> continuation() {
        return continuation;
    }

    @Override
    public int compareTo(WakeEvent other) {
        int byTime = Double.compare(this.deadline, other.deadline);
        if (byTime != 0) {
            return byTime;
        }
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public String toString() {
        return String.format("WakeEvent[seq=%d, deadline=%.3f]", sequence, deadline);
    }
}
