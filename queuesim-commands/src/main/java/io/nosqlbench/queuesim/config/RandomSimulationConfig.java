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

package io.nosqlbench.queuesim.config;

import java.nio.file.Path;
import java.util.Optional;

/**
 * A simulation over a Poisson arrival stream, stopped at a time limit.
 * All durations are in seconds.
 *
 * @param enabled            whether this simulation runs
 * @param numWindows         the number of service windows
 * @param avgArrivalInterval mean time between arrivals
 * @param minServiceTime     shortest service time
 * @param maxServiceTime     longest service time
 * @param maxSimulationTime  the last instant an arrival may fall on, and the time limit of the run
 * @param historyFile        where to write the CSV history, or null for none
 */
public record RandomSimulationConfig(
    boolean enabled,
    int numWindows,
    double avgArrivalInterval,
    double minServiceTime,
    double maxServiceTime,
    double maxSimulationTime,
    Path historyFile
) {

    /** @return a configuration for a simulation which does not run */
    public static RandomSimulationConfig disabled() {
        return new RandomSimulationConfig(false, 1, 1.0d, 1.0d, 1.0d, 1.0d, null);
    }

    public Optional<Path> history() {
        return Optional.ofNullable(historyFile);
    }
}
