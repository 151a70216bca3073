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

package io.nosqlbench.queuesim.command.validate;

import io.nosqlbench.queuesim.command.common.ConfigFileOption;
import io.nosqlbench.queuesim.config.ConfigException;
import io.nosqlbench.queuesim.config.FixedSimulationConfig;
import io.nosqlbench.queuesim.config.RandomSimulationConfig;
import io.nosqlbench.queuesim.config.SimulationConfig;
import io.nosqlbench.queuesim.config.SimulationConfigLoader;
import io.nosqlbench.queuesim.format.DurationFormat;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.util.concurrent.Callable;

/// Check a configuration file without running anything
@CommandLine.Command(name = "validate",
    header = "load and validate a configuration file",
    description = "Applies environment overrides, checks every setting, and prints what would run.",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: the configuration is valid",
        "2: the configuration is invalid",
    })
public class CMD_validate implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConfigFileOption configFile = new ConfigFileOption();

    private final SimulationConfigLoader loader;

    public CMD_validate() {
        this(new SimulationConfigLoader());
    }

    public CMD_validate(SimulationConfigLoader loader) {
        this.loader = loader;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        SimulationConfig config;
        try {
            config = loader.load(configFile.getConfigPath());
        } catch (ConfigException e) {
            PrintWriter err = spec.commandLine().getErr();
            err.println("Invalid configuration " + configFile.getConfigPath() + ": " + e.getMessage());
            err.flush();
            return 2;
        }

        out.println("Configuration " + config.source() + " is valid.");
        FixedSimulationConfig fixed = config.fixed();
        if (fixed.enabled()) {
            out.println("Fixed simulation: " + fixed.numWindows() + " window(s), "
                + fixed.customers().size() + " customer(s)"
                + fixed.history().map(p -> ", history " + p).orElse(""));
        } else {
            out.println("Fixed simulation: disabled");
        }
        RandomSimulationConfig random = config.random();
        if (random.enabled()) {
            out.println("Random simulation: " + random.numWindows() + " window(s), arrivals every "
                + DurationFormat.format(random.avgArrivalInterval()) + " on average, service "
                + DurationFormat.format(random.minServiceTime()) + " to "
                + DurationFormat.format(random.maxServiceTime()) + ", for "
                + DurationFormat.format(random.maxSimulationTime())
                + random.history().map(p -> ", history " + p).orElse(""));
        } else {
            out.println("Random simulation: disabled");
        }
        out.flush();
        return 0;
    }
}
