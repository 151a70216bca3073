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

package io.nosqlbench.queuesim.sinks;

import io.nosqlbench.queuesim.events.SimulationEvent;
import io.nosqlbench.queuesim.events.SimulationEventSink;
import io.nosqlbench.queuesim.events.SimulationEventType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/// A sink which keeps every event in memory, in delivery order.
///
/// Useful for tests and for callers which want to inspect the full history
/// of a short run after it finishes. A long random run can produce a great
/// many events, so prefer a streaming sink there.
public class MemoryEventSink implements SimulationEventSink {

    private final List<SimulationEvent> events = new ArrayList<>();

    @Override
    public synchronized void onEvent(SimulationEvent event) {
        events.add(event);
    }

    /// @return an immutable copy of the events received so far
    public synchronized List<SimulationEvent> getEvents() {
        return List.copyOf(events);
    }

    /// @param type the transition to select
    /// @return the events of one type, in delivery order
    public synchronized List<SimulationEvent> getEvents(SimulationEventType type) {
        return events.stream().filter(e -> e.type() == type).collect(Collectors.toUnmodifiableList());
    }

    /// @param customerId the customer to select
    /// @return the events of one customer, in delivery order
    public synchronized List<SimulationEvent> getEventsFor(int customerId) {
        return events.stream().filter(e -> e.customerId() == customerId)
            .collect(Collectors.toUnmodifiableList());
    }

    /// @return the number of events received so far
    public synchronized int size() {
        return events.size();
    }

    /// Remove all received events.
    public synchronized void clear() {
        events.clear();
    }

    @Override
    public synchronized String toString() {
        return "MemoryEventSink[" + events.size() + " events]";
    }
}
