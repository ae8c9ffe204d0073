package io.commtrace.commands.analyze;

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

import io.commtrace.commands.analyze.subcommands.CMD_analyze_patterns;
import io.commtrace.commands.analyze.subcommands.CMD_analyze_responses;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// The analyze command contains subcommands that analyze a communication log
///
/// This is an umbrella command for the analysis subcommands.
@CommandLine.Command(name = "analyze",
    header = "Analyze a communication log",
    description = "Contains subcommands for response timing, reciprocity and pattern detection",
    subcommands = {
        CMD_analyze_responses.class,
        CMD_analyze_patterns.class
    })
public class CMD_analyze implements Callable<Integer> {

    /// Run CMD_analyze
    ///
    /// @param args Command line arguments
    public static void main(String[] args) {
        System.exit(new CommandLine(new CMD_analyze()).execute(args));
    }

    /// Execute the analyze command
    ///
    /// @return 0 for success, 1 for error
    @Override
    public Integer call() {
        // Print help information if no subcommand is specified
        CommandLine.usage(this, System.out);
        return 0;
    }
}
