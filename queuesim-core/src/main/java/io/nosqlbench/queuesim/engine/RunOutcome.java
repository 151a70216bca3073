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

package io.nosqlbench.queuesim.engine;

/// Why a simulation run stopped.
public enum RunOutcome {
    /// Every task finished; all admitted customers were served
    COMPLETED,
    /// Virtual time reached the configured limit
    TIME_LIMIT,
    /// Nothing could advance while customers were still in the system
    STALLED,
    /// Nothing could advance, no customer was in the system, but tasks were still parked
    IDLE;

    /// @return true if the run stopped before every task finished
    public boolean isEarly() {
        return this != COMPLETED;
    }
}
