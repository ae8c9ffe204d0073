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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.StringJoiner;

/// Record files and command runs shared by the command tests.
public final class CommandFixtures {

    /// Two contacts: alice replies once after 3 minutes, bob twice after 1 hour and 90 minutes.
    public static final String[] TWO_BLOCKS = {
        "2023-01-02 10:00:00 alice sent",
        "2023-01-02 10:02:00 alice received",
        "2023-01-02 10:05:00 alice sent",
        "2023-01-02 10:07:00 alice received",
        "2023-01-02 14:00:00 bob received",
        "2023-01-02 15:00:00 bob sent",
        "2023-01-02 15:30:00 bob received",
        "2023-01-02 17:00:00 bob sent"
    };

    /// Busy Monday morning, then nothing until Thursday.
    public static final String[] QUIET_WEEKEND = {
        "2023-01-02 09:00:00 alice received",
        "2023-01-02 09:05:00 alice sent",
        "2023-01-02 10:00:00 bob received",
        "2023-01-02 10:10:00 bob sent",
        "2023-01-05 10:00:00 alice received",
        "2023-01-05 10:02:00 alice sent"
    };

    private CommandFixtures() {
    }

    /// Writes records as a JSON array with the standard column names.
    ///
    /// @param file target file
    /// @param lines records as `"yyyy-MM-dd HH:mm:ss counterparty direction"`
    /// @return the file
    public static Path writeJson(Path file, String... lines) throws IOException {
        StringJoiner rows = new StringJoiner(",\n  ", "[\n  ", "\n]\n");
        for (String line : lines) {
            String[] parts = line.split(" ");
            rows.add(String.format("{\"timestamp\": \"%s %s\", \"counterparty_id\": \"%s\", \"direction\": \"%s\"}",
                parts[0], parts[1], parts[2], parts[3]));
        }
        Files.writeString(file, rows.toString());
        return file;
    }

    /// Writes records as CSV with the header `when,contact,type`.
    public static Path writeAliasedCsv(Path file, String... lines) throws IOException {
        StringBuilder sb = new StringBuilder("when,contact,type\n");
        for (String line : lines) {
            String[] parts = line.split(" ");
            sb.append(parts[0]).append(' ').append(parts[1]).append(',')
                .append(parts[2]).append(',').append(parts[3]).append('\n');
        }
        Files.writeString(file, sb.toString());
        return file;
    }

    /// Result of one command run.
    ///
    /// @param exitCode the exit code
    /// @param stdout everything printed to standard output
    public record Run(int exitCode, String stdout) {
    }

    /// Runs the root command with the given arguments, capturing standard output.
    public static Run run(String... args) {
        ByteArrayOutputStream outContent = new ByteArrayOutputStream();
        PrintStream originalOut = System.out;
        System.setOut(new PrintStream(outContent, true, StandardCharsets.UTF_8));
        try {
            int exitCode = CMD_commtrace.commandLine().execute(args);
            return new Run(exitCode, outContent.toString(StandardCharsets.UTF_8));
        } finally {
            System.setOut(originalOut);
        }
    }
}
