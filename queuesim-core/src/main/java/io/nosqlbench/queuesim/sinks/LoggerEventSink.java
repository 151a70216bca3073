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
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Locale;
import java.util.Objects;

/**
 * A sink which writes each event to a Log4j 2 logger. By default events go
 * to this class's logger at DEBUG, which keeps them out of normal console
 * output but available when the simulation logger is turned up.
 *
 * <p>Message format: {@code T=<time> <event> customer=<id> queue=<n> busy=<b>/<w>}</p>
 */
public class LoggerEventSink implements SimulationEventSink {

    private final Logger logger;
    private final Level level;

    public LoggerEventSink() {
        this(LogManager.getLogger(LoggerEventSink.class), Level.DEBUG);
    }

    public LoggerEventSink(Logger logger, Level level) {
        this.logger = Objects.requireNonNull(logger, "logger");
        this.level = Objects.requireNonNullElse(level, Level.DEBUG);
    }

    public LoggerEventSink(String loggerName, Level level) {
        this(LogManager.getLogger(loggerName), level);
    }

    @Override
    public void onEvent(SimulationEvent event) {
        if (logger.isEnabled(level)) {
            logger.log(level, "T={} {} customer={} queue={} busy={}/{}",
                formatTime(event.time()), event.type(), event.customerId(),
                event.queueLength(), event.busyServers(), event.numWindows());
        }
    }

    static String formatTime(double time) {
        return String.format(Locale.ROOT, "%.3f", time);
    }

    public Level getLevel() {
        return level;
    }
}
