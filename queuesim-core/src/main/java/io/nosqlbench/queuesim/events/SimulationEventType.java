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

/// The state transitions a customer goes through, in the order they occur.
public enum SimulationEventType {
    /// The customer joined the waiting queue
    ARRIVAL("Arrival"),
    /// A server took the customer from the queue
    SERVICE_START("ServiceStart"),
    /// The customer left the system
    SERVICE_END("ServiceEnd");

    private final String label;

    SimulationEventType(String label) {
        this.label = label;
    }

    /// @return the name used in event logs and console output
    public String getLabel() {
        return label;
    }

    @Override
    public String toString() {
        return label;
    }
}
