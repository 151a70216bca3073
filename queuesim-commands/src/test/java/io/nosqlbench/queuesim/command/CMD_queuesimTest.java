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

package io.nosqlbench.queuesim.command;

import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;

public class CMD_queuesimTest {

    private static String run(int expectedExit, String... args) {
        StringWriter out = new StringWriter();
        CommandLine commandLine = CMD_queuesim.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(new StringWriter()));
        assertThat(commandLine.execute(args)).isEqualTo(expectedExit);
        return out.toString();
    }

    @Test
    public void testPrintsUsageWithoutSubcommand() {
        assertThat(run(0)).contains("Usage: queuesim").contains("run").contains("validate");
    }

    @Test
    public void testHelpForSubcommand() {
        assertThat(run(0, "help", "run"))
            .contains("--config")
            .contains("--seed")
            .contains("--report-json")
            .contains("invalid configuration or options");
    }

    @Test
    public void testUnknownOptionIsUsageError() {
        run(2, "run", "--no-such-option");
    }
}
