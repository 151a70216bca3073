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

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonObject;
import io.nosqlbench.queuesim.engine.SimulationReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/// Writes run reports as one pretty-printed JSON object, keyed by simulation name.
///
/// ```json
/// {
///   "fixed": { "outcome": "COMPLETED", "finalTime": 200.0, ... },
///   "random": { ... }
/// }
/// ```
public class ReportJsonWriter {
    private static final Logger logger = LogManager.getLogger(ReportJsonWriter.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().create();

    /// @param reports the reports by simulation name, in output order
    /// @return the JSON text
    public static String toJson(Map<String, SimulationReport> reports) {
        JsonObject root = new JsonObject();
        for (Map.Entry<String, SimulationReport> entry : reports.entrySet()) {
            JsonObject report = gson.toJsonTree(entry.getValue()).getAsJsonObject();
            report.addProperty("utilizationPercent", entry.getValue().utilizationPercent());
            report.addProperty("unfinishedCustomers", entry.getValue().unfinishedCustomers());
            root.add(entry.getKey(), report);
        }
        return gson.toJson(root);
    }

    /// @param path where to write; parent directories are created
    /// @param reports the reports by simulation name
    /// @throws IOException if the file cannot be written
    public static void write(Path path, Map<String, SimulationReport> reports) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            writer.write(toJson(reports));
            writer.write('\n');
        }
        logger.info("wrote {} report(s) to {}", reports.size(), path);
    }
}
