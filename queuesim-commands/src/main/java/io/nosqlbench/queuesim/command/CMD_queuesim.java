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

import io.nosqlbench.queuesim.command.run.CMD_run;
import io.nosqlbench.queuesim.command.validate.CMD_validate;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Multi-window queue simulation in virtual time
///
/// This is the top level command which serves as the entry point for all sub-commands
@CommandLine.Command(name = "queuesim",
    mixinStandardHelpOptions = true,
    version = "queuesim 0.1.0",
    description = "Simulates customers queueing for a number of identical service windows.",
    subcommands = {CommandLine.HelpCommand.class, CMD_run.class, CMD_validate.class})
public class CMD_queuesim implements Callable<Integer> {

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /// run a queuesim command
    /// @param args
    ///     command line args
    public static void main(String[] args) {
        System.exit(newCommandLine().execute(args));
    }

    /// @return the command line with all sub-commands, as `main` runs it
    public static CommandLine newCommandLine() {
        return new CommandLine(new CMD_queuesim()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        spec.commandLine().usage(spec.commandLine().getOut());
        return 0;
    }
}
