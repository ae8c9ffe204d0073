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

import io.commtrace.records.FieldAliases;
import io.commtrace.records.RecordTableReader;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared record input options: the record file and optional column aliases.
 *
 * <p>Aliases map a standard field name to the column that holds it, for example
 * {@code --alias counterparty_id=contact --alias direction=type}.
 */
public class RecordInputOption {

    @CommandLine.Option(
        names = {"-i", "--input"},
        description = "Record file to analyze (.json, .jsonl, .ndjson or .csv)",
        required = true
    )
    private Path input;

    @CommandLine.Option(
        names = {"--alias"},
        description = "Column alias as field=column, where field is one of timestamp, counterparty_id, direction",
        mapFallbackValue = ""
    )
    private Map<String, String> aliases = new LinkedHashMap<>();

    /**
     * Gets the input file path.
     */
    public Path getInputPath() {
        return input;
    }

    /**
     * Resolves the aliases given on the command line.
     *
     * @return the aliases, {@link FieldAliases#STANDARD} when none were given
     * @throws IllegalArgumentException if a field name is unknown or a column is empty
     */
    public FieldAliases getAliases() {
        for (Map.Entry<String, String> alias : aliases.entrySet()) {
            if (alias.getValue() == null || alias.getValue().isBlank()) {
                throw new IllegalArgumentException("Alias for '" + alias.getKey() + "' has no column name");
            }
        }
        return FieldAliases.of(aliases);
    }

    /**
     * Reads the raw rows of the input file without validating them.
     *
     * @param reader the reader to use
     * @return rows keyed by column name
     * @throws IOException if the file is missing or cannot be parsed
     */
    public List<Map<String, Object>> readRows(RecordTableReader reader) throws IOException {
        return reader.readRows(input, RecordTableReader.Format.forPath(input));
    }
}
