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

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

/// Immutable, ordered collection of [CommRecord]s: the input dataset of every analysis.
///
/// # Construction
///
/// ```java
/// // From loosely-typed rows, e.g. parsed JSON or CSV
/// RecordTable table = RecordTable.fromRows(rows, FieldAliases.of(Map.of("timestamp", "time")));
///
/// // From already typed records
/// RecordTable table = RecordTable.of(records);
/// ```
///
/// [#fromRows(List, FieldAliases)] is the validation boundary. It rejects rows with
/// missing fields, direction values other than `sent`/`received`, and unparsable
/// timestamps, so analyzers only ever see well-formed records.
///
/// # Ordering
///
/// The table keeps input order. [#sortedByTime()] and [#sortedByCounterpartyThenTime()]
/// return stable sorts: ties keep their original relative order.
public final class RecordTable {

    private static final Comparator<CommRecord> BY_TIME =
        Comparator.comparing(CommRecord::timestamp);

    private static final Comparator<CommRecord> BY_COUNTERPARTY_THEN_TIME =
        Comparator.comparing(CommRecord::counterparty).thenComparing(CommRecord::timestamp);

    private final List<CommRecord> records;

    private RecordTable(List<CommRecord> records) {
        this.records = Collections.unmodifiableList(records);
    }

    /// Wraps typed records. Records are kept in the given order.
    ///
    /// @param records the records, not null
    /// @return the table
    public static RecordTable of(List<CommRecord> records) {
        Objects.requireNonNull(records, "records cannot be null");
        return new RecordTable(new ArrayList<>(records));
    }

    /// @return a table with no records
    public static RecordTable empty() {
        return new RecordTable(new ArrayList<>());
    }

    /// Validates and converts raw rows into a table.
    ///
    /// Checks are applied to the whole dataset in this order, so that the first
    /// reported problem is always the most fundamental one:
    /// 1. every row present, with the required columns
    /// 2. direction values are exactly `sent` or `received`
    /// 3. every timestamp parses
    ///
    /// An empty row list produces an empty table; deciding whether emptiness is an
    /// error is left to the caller.
    ///
    /// @param rows source rows keyed by column name
    /// @param aliases mapping from standard fields to column names; null means [FieldAliases#STANDARD]
    /// @return the validated table
    /// @throws RecordValidationException describing the first class of problem found
    public static RecordTable fromRows(List<? extends Map<String, ?>> rows, FieldAliases aliases) {
        Objects.requireNonNull(rows, "rows cannot be null");
        FieldAliases fields = aliases != null ? aliases : FieldAliases.STANDARD;

        Set<String> missing = new TreeSet<>();
        for (int i = 0; i < rows.size(); i++) {
            Map<String, ?> row = rows.get(i);
            if (row == null) {
                throw new RecordValidationException("Missing required fields: row " + i + " is null");
            }
            for (Map.Entry<String, String> entry : fields.asMap().entrySet()) {
                if (row.get(entry.getValue()) == null) {
                    missing.add(entry.getKey());
                }
            }
        }
        if (!missing.isEmpty()) {
            throw new RecordValidationException("Missing required fields: " + missing);
        }

        Set<String> invalidDirections = new LinkedHashSet<>();
        List<Direction> directions = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            String raw = String.valueOf(row.get(fields.directionField()));
            Direction direction = Direction.fromLabel(raw).orElse(null);
            if (direction == null) {
                invalidDirections.add(raw);
            }
            directions.add(direction);
        }
        if (!invalidDirections.isEmpty()) {
            throw new RecordValidationException("Invalid message type(s): " + invalidDirections);
        }

        List<CommRecord> records = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            Map<String, ?> row = rows.get(i);
            LocalDateTime timestamp;
            try {
                timestamp = TimestampParser.parse(row.get(fields.timestampField()));
            } catch (RecordValidationException e) {
                throw new RecordValidationException(e.getMessage() + " (row " + i + ")", e);
            }
            String counterparty = String.valueOf(row.get(fields.counterpartyField()));
            records.add(new CommRecord(i, timestamp, counterparty, directions.get(i)));
        }
        return new RecordTable(records);
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    /// @return records in input order
    public List<CommRecord> records() {
        return records;
    }

    /// @return records stably sorted by timestamp
    public List<CommRecord> sortedByTime() {
        List<CommRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_TIME);
        return sorted;
    }

    /// @return records stably sorted by counterparty, then timestamp
    public List<CommRecord> sortedByCounterpartyThenTime() {
        List<CommRecord> sorted = new ArrayList<>(records);
        sorted.sort(BY_COUNTERPARTY_THEN_TIME);
        return sorted;
    }

    /// Groups records by counterparty. Keys are sorted; each group is stably time-sorted.
    ///
    /// @return counterparty to its time-ordered records
    public SortedMap<String, List<CommRecord>> byCounterparty() {
        SortedMap<String, List<CommRecord>> groups = new TreeMap<>();
        for (CommRecord record : sortedByTime()) {
            groups.computeIfAbsent(record.counterparty(), k -> new ArrayList<>()).add(record);
        }
        return groups;
    }

    /// @return a new table containing only the given counterparty's records, input order kept
    public RecordTable forCounterparty(String counterparty) {
        List<CommRecord> selected = new ArrayList<>();
        for (CommRecord record : records) {
            if (record.counterparty().equals(counterparty)) {
                selected.add(record);
            }
        }
        return new RecordTable(selected);
    }

    /// @return distinct counterparties, sorted
    public Set<String> counterparties() {
        Set<String> names = new TreeSet<>();
        for (CommRecord record : records) {
            names.add(record.counterparty());
        }
        return names;
    }

    /// @return the earliest timestamp, or null for an empty table
    public LocalDateTime firstTimestamp() {
        return records.stream().map(CommRecord::timestamp).min(Comparator.naturalOrder()).orElse(null);
    }

    /// @return the latest timestamp, or null for an empty table
    public LocalDateTime lastTimestamp() {
        return records.stream().map(CommRecord::timestamp).max(Comparator.naturalOrder()).orElse(null);
    }

    /// Content hash over every record, order-sensitive. Used for cache fingerprints.
    ///
    /// @return the hash
    public long contentHash() {
        long hash = 1125899906842597L;
        for (CommRecord record : records) {
            hash = 31 * hash + record.timestamp().hashCode();
            hash = 31 * hash + record.counterparty().hashCode();
            hash = 31 * hash + record.direction().ordinal();
        }
        return hash;
    }

    @Override
    public String toString() {
        return "RecordTable[size=" + records.size() + ", counterparties=" + counterparties().size() + "]";
    }
}
