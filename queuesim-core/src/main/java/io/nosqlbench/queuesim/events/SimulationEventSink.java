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

package io.nosqlbench.queuesim.events;

/// A receiver of [SimulationEvent]s.
///
/// Events arrive in the order the transitions happened, with non-decreasing
/// time. They are delivered while the simulation state is locked, so an
/// implementation must return promptly and must not call back into the
/// simulation.
///
/// Delivery is best effort. A sink which cannot deliver should log the
/// problem and carry on; the simulation does not depend on its output.
public interface SimulationEventSink extends AutoCloseable {

    /// Receive one event.
    /// @param event the transition which just happened
    void onEvent(SimulationEvent event);

    /// Flush and release anything held by this sink. The default does nothing.
    @Override
    default void close() {
    }
}
