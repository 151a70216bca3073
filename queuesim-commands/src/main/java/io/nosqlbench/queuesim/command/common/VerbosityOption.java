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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared options for how much a command prints.
 */
public class VerbosityOption {

    /** The logger hierarchy raised or lowered by these options */
    public static final String LOGGER_ROOT = "io.nosqlbench.queuesim";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log debug detail from the simulation"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Do not print the event table"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Checks if the event table should be printed.
     *
     * @return true unless quiet was requested
     */
    public boolean showEvents() {
        return !quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException("Cannot specify both --verbose and --quiet options");
        }
    }

    /**
     * The log level these options ask for, or null to keep the configured one.
     */
    public Level logLevel() {
        if (verbose) {
            return Level.DEBUG;
        }
        return quiet ? Level.WARN : null;
    }

    /**
     * Apply {@link #logLevel()} to the simulation loggers.
     */
    public void applyLogLevel() {
        Level level = logLevel();
        if (level != null) {
            Configurator.setLevel(LOGGER_ROOT, level);
        }
    }
}
