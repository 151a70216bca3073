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
import java.util.List;
import java.util.Optional;

/**
 * A simulation over an explicit list of customers, run until all of them
 * are served.
 *
 * @param enabled     whether this simulation runs
 * @param numWindows  the number of service windows
 * @param customers   the customers, sorted by arrival
 * @param historyFile where to write the CSV history, or null for none
 */
public record FixedSimulationConfig(
    boolean enabled,
    int numWindows,
    List<CustomerSpec> customers,
    Path historyFile
) {
    public FixedSimulationConfig {
        customers = List.copyOf(customers);
    }

    /** @return a configuration for a simulation which does not run */
    public static FixedSimulationConfig disabled() {
        return new FixedSimulationConfig(false, 1, List.of(), null);
    }

    public Optional<Path> history() {
        return Optional.ofNullable(historyFile);
    }
}
