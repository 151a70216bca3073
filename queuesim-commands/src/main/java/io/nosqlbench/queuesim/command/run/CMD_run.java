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

package io.nosqlbench.queuesim.command.run;

import io.nosqlbench.queuesim.command.common.ConfigFileOption;
import io.nosqlbench.queuesim.command.common.RandomSeedOption;
import io.nosqlbench.queuesim.command.common.VerbosityOption;
import io.nosqlbench.queuesim.config.ConfigException;
import io.nosqlbench.queuesim.config.CustomerSpec;
import io.nosqlbench.queuesim.config.FixedSimulationConfig;
import io.nosqlbench.queuesim.config.RandomSimulationConfig;
import io.nosqlbench.queuesim.config.SimulationConfig;
import io.nosqlbench.queuesim.config.SimulationConfigLoader;
import io.nosqlbench.queuesim.engine.SimulationEngine;
import io.nosqlbench.queuesim.engine.SimulationReport;
import io.nosqlbench.queuesim.events.SimulationEventSink;
import io.nosqlbench.queuesim.report.ConsoleEventSink;
import io.nosqlbench.queuesim.report.ReportJsonWriter;
import io.nosqlbench.queuesim.report.ReportPrinter;
import io.nosqlbench.queuesim.sinks.CompositeEventSink;
import io.nosqlbench.queuesim.sinks.CsvHistorySink;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Random;
import java.util.concurrent.Callable;

/// Run the simulations enabled in a configuration file
@CommandLine.Command(name = "run",
    headerHeading = "Usage:%n%n",
    synopsisHeading = "%n",
    descriptionHeading = "%nDescription%n%n",
    optionListHeading = "%nOptions:%n",
    header = "run the fixed and random drive-through simulations",
    description = """
        Loads the configuration, then runs the fixed simulation over the listed
        customers until all are served, and the random simulation over a
        generated Poisson stream until max_simulation_time. Each transition is
        printed as a table row, followed by the statistics of the run.
        """,
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {
        "0: all enabled simulations ran",
        "1: a report could not be written",
        "2: invalid configuration or options",
    })
public class CMD_run implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_run.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_IO_ERROR = 1;
    public static final int EXIT_CONFIG_ERROR = 2;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ConfigFileOption configFile = new ConfigFileOption();

    @CommandLine.Mixin
    private RandomSeedOption seedOption = new RandomSeedOption();

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Option(names = {"--report-json"},
        description = "Also write the statistics of every run to this JSON file")
    private Path reportJson;

    private final SimulationConfigLoader loader;

    public CMD_run() {
        this(new SimulationConfigLoader());
    }

    /// @param loader reads the configuration, with its environment overrides
    public CMD_run(SimulationConfigLoader loader) {
        this.loader = loader;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        try {
            verbosity.validate();
        } catch (IllegalStateException e) {
            err.println(e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        verbosity.applyLogLevel();

        Path configPath = configFile.getConfigPath();
        SimulationConfig config;
        try {
            config = loader.load(configPath);
        } catch (ConfigException e) {
            logger.debug("configuration rejected", e);
            err.println("Failed to load " + configPath + ": " + e.getMessage());
            err.println("Please ensure the config file exists and at least one simulation is enabled.");
            err.flush();
            return EXIT_CONFIG_ERROR;
        }

        out.println("=== Drive-Through Simulation System ===");
        out.println("Using config file: " + configPath);
        out.println("Enabled simulations:");
        if (config.fixed().enabled()) {
            out.println("  + Fixed simulation");
        }
        if (config.random().enabled()) {
            out.println("  + Random simulation");
        }
        out.println();

        Map<String, SimulationReport> reports = new LinkedHashMap<>();
        if (config.fixed().enabled()) {
            out.println("=== Drive-Through Simulation (Fixed Data from Config) ===");
            reports.put("fixed", runFixed(config.fixed(), out));
            if (config.random().enabled()) {
                out.println();
                out.println();
            }
        }
        if (config.random().enabled()) {
            out.println("=== Drive-Through Simulation (Random Data from Config) ===");
            reports.put("random", runRandom(config.random(), out));
        }

        out.println();
        out.println("Simulation(s) completed.");
        out.flush();

        if (reportJson != null) {
            try {
                ReportJsonWriter.write(reportJson, reports);
            } catch (IOException e) {
                logger.error("unable to write report to {}", reportJson, e);
                err.println("Unable to write report " + reportJson + ": " + e.getMessage());
                return EXIT_IO_ERROR;
            }
        }
        return EXIT_OK;
    }

    private SimulationReport runFixed(FixedSimulationConfig fixed, PrintWriter out) {
        SimulationEngine engine = new SimulationEngine(fixed.numWindows());
        for (CustomerSpec customer : fixed.customers()) {
            engine.addCustomer(customer.arrival(), customer.service());
        }
        return runAndReport(engine, OptionalDouble.empty(), fixed.history(), out);
    }

    private SimulationReport runRandom(RandomSimulationConfig random, PrintWriter out) {
        long seed = seedOption.getSeed();
        logger.info("random simulation seed {}{}", seed, seedOption.isSeedSpecified() ? "" : " (time-based)");
        SimulationEngine engine = new SimulationEngine(random.numWindows());
        int generated = engine.generateRandomCustomers(random.maxSimulationTime(), random.avgArrivalInterval(),
            random.minServiceTime(), random.maxServiceTime(), new Random(seed));
        logger.debug("generated {} customers", generated);
        return runAndReport(engine, OptionalDouble.of(random.maxSimulationTime()), random.history(), out);
    }

    private SimulationReport runAndReport(SimulationEngine engine, OptionalDouble timeLimit,
                                          Optional<Path> history, PrintWriter out) {
        ConsoleEventSink console = new ConsoleEventSink(out);
        CompositeEventSink sinks = new CompositeEventSink();
        if (verbosity.showEvents()) {
            sinks.addSink(console);
        }
        history.map(CsvHistorySink::open).ifPresent(sinks::addSink);

        SimulationReport report;
        try (SimulationEventSink sink = sinks) {
            if (verbosity.showEvents()) {
                out.println("Starting simulation...");
                console.printHeader();
            }
            report = engine.run(timeLimit, sink);
        }
        if (verbosity.showEvents()) {
            console.printFooter(report.finalTime());
        }
        new ReportPrinter(out).print(report);
        return report;
    }
}
