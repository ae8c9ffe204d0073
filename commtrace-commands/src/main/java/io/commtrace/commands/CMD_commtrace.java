package io.commtrace.commands;

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

import io.commtrace.commands.analyze.CMD_analyze;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Tools for analyzing two-party communication logs
///
/// This is the top level command which serves as an entry point for all sub-commands
@CommandLine.Command(name = "commtrace",
    header = "Analyze response timing and reciprocity in communication logs",
    mixinStandardHelpOptions = true,
    version = "commtrace 0.1.0",
    subcommands = {
        CMD_analyze.class
    })
public class CMD_commtrace implements Callable<Integer> {

    /// run a commtrace command
    /// @param args command line args
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return a command line for the root command with the shared parser settings
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_commtrace())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
