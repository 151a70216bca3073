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

import java.nio.file.Path;

/// Selects the configuration file of a run.
public class ConfigFileOption {

    /// The file read when no other is named
    public static final String DEFAULT_CONFIG = "config.yaml";

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "Path to the configuration file (default: ${DEFAULT-VALUE})",
        defaultValue = DEFAULT_CONFIG
    )
    private Path configPath = Path.of(DEFAULT_CONFIG);

    /**
     * Gets the configuration file path.
     *
     * @return the path as given on the command line
     */
    public Path getConfigPath() {
        return configPath;
    }

    @Override
    public String toString() {
        return String.valueOf(configPath);
    }
}
