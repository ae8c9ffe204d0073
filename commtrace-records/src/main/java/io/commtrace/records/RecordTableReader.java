package io.commtrace.records;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Loads a {@link RecordTable} from a file on disk.
 *
 * <p>The format is chosen by file extension:
 * <ul>
 *   <li>{@code .json} - a JSON array of objects</li>
 *   <li>{@code .jsonl}, {@code .ndjson} - one JSON object per line</li>
 *   <li>{@code .csv} - comma separated values with a header row</li>
 * </ul>
 *
 * <p>Rows are handed to {@link RecordTable#fromRows(List, FieldAliases)} unchanged, so
 * column aliasing and validation behave the same for every format.
 */
public final class RecordTableReader {

    private static final Logger logger = LogManager.getLogger(RecordTableReader.class);

    private static final TypeReference<List<Map<String, Object>>> ROWS = new TypeReference<>() {};

    private final ObjectMapper jsonMapper;
    private final CsvMapper csvMapper;

    public RecordTableReader() {
        this.jsonMapper = new ObjectMapper();
        this.csvMapper = new CsvMapper();
    }

    /**
     * Supported input formats.
     */
    public enum Format {
        JSON, JSONL, CSV;

        /**
         * @param path the input path
         * @return the format implied by the file extension
         * @throws IllegalArgumentException if the extension is not recognized
         */
        public static Format forPath(Path path) {
            String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (name.endsWith(".json")) {
                return JSON;
            }
            if (name.endsWith(".jsonl") || name.endsWith(".ndjson")) {
                return JSONL;
            }
            if (name.endsWith(".csv")) {
                return CSV;
            }
            throw new IllegalArgumentException("Unsupported input file type: " + path.getFileName()
                + " (expected .json, .jsonl, .ndjson or .csv)");
        }
    }

    /**
     * Reads and validates a record file.
     *
     * @param path the file to read
     * @param aliases column aliases, or null for the standard names
     * @return the validated table
     * @throws IOException if the file cannot be read or parsed
     * @throws RecordValidationException if the rows are not valid records
     */
    public RecordTable read(Path path, FieldAliases aliases) throws IOException {
        List<Map<String, Object>> rows = readRows(path, Format.forPath(path));
        logger.debug("Read {} rows from {}", rows.size(), path);
        return RecordTable.fromRows(rows, aliases);
    }

    /**
     * Reads raw rows without validation.
     *
     * @param path the file to read
     * @param format the file format
     * @return the rows in file order
     * @throws IOException if the file cannot be read or parsed
     */
    public List<Map<String, Object>> readRows(Path path, Format format) throws IOException {
        if (!Files.exists(path)) {
            throw new IOException("Input file does not exist: " + path);
        }
        switch (format) {
            case JSON:
                return jsonMapper.readValue(path.toFile(), ROWS);
            case JSONL:
                return readJsonLines(path);
            case CSV:
                return readCsv(path);
            default:
                throw new IllegalStateException("Unhandled format: " + format);
        }
    }

    private List<Map<String, Object>> readJsonLines(Path path) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        int lineNumber = 0;
        for (String line : Files.readAllLines(path)) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            try {
                rows.add(jsonMapper.readValue(line, new TypeReference<Map<String, Object>>() {}));
            } catch (JsonProcessingException e) {
                throw new IOException("Malformed JSON on line " + lineNumber + " of " + path + ": "
                    + e.getOriginalMessage(), e);
            }
        }
        return rows;
    }

    private List<Map<String, Object>> readCsv(Path path) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader();
        List<Map<String, Object>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, Object>> iterator =
                 csvMapper.readerFor(new TypeReference<Map<String, Object>>() {})
                     .with(schema)
                     .readValues(path.toFile())) {
            while (iterator.hasNext()) {
                rows.add(iterator.next());
            }
        }
        return rows;
    }
}
