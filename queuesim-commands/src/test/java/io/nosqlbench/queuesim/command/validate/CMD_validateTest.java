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

import io.nosqlbench.queuesim.config.SimulationConfigLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_validateTest {

    @TempDir
    Path tempDir;

    @Test
    public void testSummarizesValidConfig() throws IOException {
        Path config = tempDir.resolve("config.yaml");
        Files.writeString(config, """
            fixed_simulation:
              num_windows: 2
              customers:
                - { arrival: 0, service: "1m 30s" }
            random_simulation:
              num_windows: 3
              avg_arrival_interval: 1m
              min_service_time: 30s
              max_service_time: 2m
              max_simulation_time: 8h
              history_file: random_history.csv
            """);
        StringWriter out = new StringWriter();
        CommandLine commandLine = new CommandLine(new CMD_validate(new SimulationConfigLoader(Map.of())));
        commandLine.setOut(new PrintWriter(out));

        assertThat(commandLine.execute("--config", config.toString())).isZero();
        assertThat(out.toString())
            .contains("is valid")
            .contains("Fixed simulation: 2 window(s), 1 customer(s)")
            .contains("Random simulation: 3 window(s), arrivals every 1m on average, service 30s to 2m, for 8h, history random_history.csv");
    }

    @Test
    public void testRejectsInvalidConfig() throws IOException {
        Path config = tempDir.resolve("config.yaml");
        Files.writeString(config, "fixed_simulation: { num_windows: -1, customers: [] }\n");
        StringWriter err = new StringWriter();
        CommandLine commandLine = new CommandLine(new CMD_validate(new SimulationConfigLoader(Map.of())));
        commandLine.setErr(new PrintWriter(err));

        assertThat(commandLine.execute("-c", config.toString())).isEqualTo(2);
        assertThat(err.toString()).contains("fixed_simulation.num_windows");
    }
}
