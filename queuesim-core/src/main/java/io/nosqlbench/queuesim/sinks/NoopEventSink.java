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

/**
 * A sink which discards every event. Used when a run needs no event output,
 * for example when only the final report matters.
 */
public final class NoopEventSink implements SimulationEventSink {

    /** The shared instance; this sink holds no state. */
    public static final NoopEventSink INSTANCE = new NoopEventSink();

    private NoopEventSink() {
    }

    @Override
    public void onEvent(SimulationEvent event) {
    }
}
