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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/// Fans each event out to several sinks, in the order they were added.
///
/// A sink which throws is logged and skipped for that event; the remaining
/// sinks still receive it.
public class CompositeEventSink implements SimulationEventSink {
    private static final Logger logger = LogManager.getLogger(CompositeEventSink.class);

    private final List<SimulationEventSink> sinks = new ArrayList<>();

    public CompositeEventSink(SimulationEventSink... sinks) {
        for (SimulationEventSink sink : sinks) {
            addSink(sink);
        }
    }

    /// @param sink another receiver; null is ignored
    /// @return this composite, for chaining
    public CompositeEventSink addSink(SimulationEventSink sink) {
        if (sink != null) {
            sinks.add(sink);
        }
        return this;
    }

    /// @return the sinks receiving events
    public List<SimulationEventSink> getSinks() {
        return List.copyOf(sinks);
    }

    @Override
    public void onEvent(SimulationEvent event) {
        for (SimulationEventSink sink : sinks) {
            try {
                sink.onEvent(event);
            } catch (RuntimeException e) {
                logger.warn("sink {} failed on {}: {}", sink, event, e.toString());
            }
        }
    }

    @Override
    public void close() {
        for (SimulationEventSink sink : sinks) {
            try {
                sink.close();
            } catch (Exception e) {
                logger.warn("sink {} failed to close: {}", sink, e.toString());
            }
        }
    }
}
