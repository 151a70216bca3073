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

/**
 * A validated configuration file.
 *
 * @param source the file it was loaded from, or a description of its origin
 * @param fixed  the fixed-customer simulation
 * @param random the random-arrival simulation
 */
public record SimulationConfig(String source, FixedSimulationConfig fixed, RandomSimulationConfig random) {

    /** @return true if at least one simulation will run */
    public boolean anyEnabled() {
        return fixed.enabled() || random.enabled();
    }
}
