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

/// One customer state transition, with the queue and server counters as they
/// stood right after the transition.
///
/// @param time        the virtual instant of the transition
/// @param type        which transition happened
/// @param customerId  index of the customer in arrival order
/// @param queueLength customers waiting after the transition
/// @param busyServers servers occupied after the transition
/// @param numWindows  servers in the system
public record SimulationEvent(
    double time,
    SimulationEventType type,
    int customerId,
    int queueLength,
    int busyServers,
    int numWindows
) {
    public SimulationEvent {
        if (type == null) {
            throw new IllegalArgumentException("event type must not be null");
        }
    }
}
