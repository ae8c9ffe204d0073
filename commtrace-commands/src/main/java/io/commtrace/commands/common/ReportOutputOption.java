package io.commtrace.commands.common;

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

import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Shared report output options: the rendering format and an optional output file.
 */
public class ReportOutputOption {

    /**
     * Report renderings.
     */
    public enum Format {
        /** Full report as pretty-printed JSON. */
        json,
        /** Short human-readable digest. */
        summary
    }

    @CommandLine.Option(
        names = {"-f", "--format"},
        description = "Output format: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})",
        defaultValue = "json"
    )
    private Format format = Format.json;

    @CommandLine.Option(
        names = {"-o", "--output"},
        description = "Write the report to this file instead of standard output"
    )
    private Path output;

    @CommandLine.Option(
        names = {"--force"},
        description = "Overwrite the output file if it exists"
    )
    private boolean force = false;

    public Format getFormat() {
        return format;
    }

    public Path getOutputPath() {
        return output;
    }

    /**
     * Checks that the output file may be written.
     *
     * @throws IllegalStateException if the file exists and --force was not given
     */
    public void validate() {
        if (output != null && Files.exists(output) && !force) {
            throw new IllegalStateException("Output file already exists: " + output + " (use --force to overwrite)");
        }
    }

    /**
     * Writes rendered text to the output file, or to the given stream when no file was named.
     *
     * @param text the rendered report
     * @param stdout the stream used without an output file
     * @throws IOException if the file cannot be written
     */
    public void write(String text, PrintStream stdout) throws IOException {
        if (output == null) {
            stdout.println(text);
            return;
        }
        Path parent = output.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(output, text + System.lineSeparator(), StandardCharsets.UTF_8);
    }
}
