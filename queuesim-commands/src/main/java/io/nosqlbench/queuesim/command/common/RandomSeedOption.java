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

package io.nosqlbench.queuesim.command.common;

import picocli.CommandLine;

/**
 * Shared option for the seed of generated customer streams.
 */
public class RandomSeedOption {

    @CommandLine.Option(
        names = {"-s", "--seed"},
        paramLabel = "<long>",
        description = "Seed for the random customer stream (default: current time)"
    )
    private Long seed;

    /**
     * Gets the seed to use. Call once per run, since an unspecified seed
     * changes with the clock.
     */
    public long getSeed() {
        return seed != null ? seed : System.currentTimeMillis();
    }

    public boolean isSeedSpecified() {
        return seed != null;
    }
}
