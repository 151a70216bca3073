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

package io.nosqlbench.queuesim.report;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import io.nosqlbench.queuesim.engine.SimulationEngine;
import io.nosqlbench.queuesim.engine.SimulationReport;
import io.nosqlbench.queuesim.events.SimulationEvent;
import io.nosqlbench.queuesim.events.SimulationEventType;
import io.nosqlbench.queuesim.format.DurationFormat;
import io.nosqlbench.queuesim.sinks.NoopEventSink;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.OptionalDouble;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("report output")
class ReportOutputTest {

    private static SimulationReport singleWindowReport() {
        SimulationEngine engine = new SimulationEngine(1);
        engine.addCustomer(0, 100);
        engine.addCustomer(10, 50);
        engine.addCustomer(20, 50);
        return engine.run();
    }

    @Nested
    @DisplayName("ConsoleEventSink")
    class Console {

        @Test
        @DisplayName("should align each row in columns")
        void shouldFormatRow() {
            SimulationEvent event = new SimulationEvent(90.0d, SimulationEventType.SERVICE_END, 12, 3, 1, 2);

            assertThat(ConsoleEventSink.formatRow(event)).isEqualTo(
                DurationFormat.formatFixedWidth(90.0d) + " ServiceEnd      12         3          1/2");
        }

        @Test
        @DisplayName("should print header, rows and footer")
        void shouldPrintTable() {
            StringWriter buffer = new StringWriter();
            ConsoleEventSink sink = new ConsoleEventSink(new PrintWriter(buffer));
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 45);

            sink.printHeader();
            SimulationReport report = engine.run(OptionalDouble.empty(), sink);
            sink.printFooter(report.finalTime());

            String[] lines = buffer.toString().split("\\R");
            assertThat(lines).hasSize(7);
            assertThat(lines[0]).endsWith("Time Event           CustID     Queue      BusyServers");
            assertThat(lines[1]).isEqualTo(ConsoleEventSink.RULE);
            assertThat(lines[2]).contains("Arrival").endsWith("0/1");
            assertThat(lines[3]).contains("ServiceStart").endsWith("1/1");
            assertThat(lines[4]).contains("45s").contains("ServiceEnd");
            assertThat(lines[6]).isEqualTo("Simulation finished at T=45s");
        }
    }

    @Nested
    @DisplayName("ReportPrinter")
    class Printer {

        @Test
        @DisplayName("should describe a completed run")
        void shouldPrintStatistics() {
            StringWriter buffer = new StringWriter();
            new ReportPrinter(new PrintWriter(buffer)).print(singleWindowReport());

            assertThat(buffer.toString())
                .contains("Outcome: all customers served")
                .contains("Total customers processed: 3")
                .contains("Customers completed: 3")
                .contains("Average waiting time per customer: 1m 13s 333ms")
                .contains("Maximum waiting time: 2m 10s")
                .contains("Average service time per customer: 1m 6s 667ms")
                .contains("Average queue length (time-weighted): 1 customers")
                .contains("Maximum queue length: 2 customers")
                .contains("Average servers busy (time-weighted): 1 of 1 windows")
                .contains("Server utilization: 100.00%")
                .contains("Throughput: 54.00 customers/hour")
                .doesNotContain("still in system");
        }

        @Test
        @DisplayName("should note customers left in the system")
        void shouldNoteUnfinished() {
            SimulationEngine engine = new SimulationEngine(1);
            engine.addCustomer(0, 100);
            engine.addCustomer(10, 10);
            SimulationReport report = engine.run(OptionalDouble.of(50.0d), NoopEventSink.INSTANCE);

            StringWriter buffer = new StringWriter();
            new ReportPrinter(new PrintWriter(buffer)).print(report);

            assertThat(buffer.toString())
                .contains("Outcome: stopped at time limit T=50s")
                .contains("Customers completed: 0")
                .doesNotContain("Average waiting time")
                .contains("Note: 2 customers still in system (waiting or being served)");
        }
    }

    @Nested
    @DisplayName("ReportJsonWriter")
    class Json {

        @Test
        @DisplayName("should write every report under its name")
        void shouldWriteJson(@TempDir Path tempDir) throws IOException {
            Map<String, SimulationReport> reports = new LinkedHashMap<>();
            reports.put("fixed", singleWindowReport());
            Path file = tempDir.resolve("out/report.json");

            ReportJsonWriter.write(file, reports);

            JsonObject root = JsonParser.parseString(Files.readString(file)).getAsJsonObject();
            JsonObject fixed = root.getAsJsonObject("fixed");
            assertThat(fixed.get("outcome").getAsString()).isEqualTo("COMPLETED");
            assertThat(fixed.get("finalTime").getAsDouble()).isEqualTo(200.0d);
            assertThat(fixed.get("completedCustomers").getAsLong()).isEqualTo(3L);
            assertThat(fixed.get("averageWaitTime").getAsDouble()).isCloseTo(73.333d, within(0.001d));
            assertThat(fixed.get("utilizationPercent").getAsDouble()).isCloseTo(100.0d, within(1e-9));
            assertThat(fixed.get("unfinishedCustomers").getAsLong()).isZero();
        }
    }
}
