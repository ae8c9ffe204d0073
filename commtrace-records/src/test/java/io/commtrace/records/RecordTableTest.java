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

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

@DisplayName("RecordTable")
class RecordTableTest {

    private static Map<String, Object> row(String time, String contact, String type) {
        Map<String, Object> row = new HashMap<>();
        row.put("time", time);
        row.put("contact", contact);
        row.put("msg_type", type);
        return row;
    }

    private static final FieldAliases ALIASES = FieldAliases.of(Map.of(
        "timestamp", "time",
        "counterparty_id", "contact",
        "direction", "msg_type"));

    @Nested
    @DisplayName("fromRows validation")
    class Validation {

        @Test
        @DisplayName("should build records through aliases")
        void shouldBuildThroughAliases() {
            RecordTable table = RecordTable.fromRows(List.of(
                row("2023-01-01 10:00:00", "alice", "sent"),
                row("2023-01-01T10:05:00", "alice", "received")), ALIASES);

            assertThat(table.size()).isEqualTo(2);
            CommRecord first = table.records().get(0);
            assertThat(first.ordinal()).isZero();
            assertThat(first.counterparty()).isEqualTo("alice");
            assertThat(first.direction()).isEqualTo(Direction.SENT);
            assertThat(first.timestamp()).isEqualTo(LocalDateTime.of(2023, 1, 1, 10, 0));
        }

        @Test
        @DisplayName("should reject direction values that are not exactly sent or received")
        void shouldRejectInvalidDirection() {
            List<Map<String, Object>> rows = List.of(
                row("2023-01-01 10:00:00", "alice", "Sent"),
                row("2023-01-01 10:01:00", "alice", "call"));

            assertThatThrownBy(() -> RecordTable.fromRows(rows, ALIASES))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("Invalid message type")
                .hasMessageContaining("Sent")
                .hasMessageContaining("call");
        }

        @Test
        @DisplayName("should reject a null row as a validation error")
        void shouldRejectNullRow() {
            List<Map<String, Object>> rows = Arrays.asList(row("2023-01-01 10:00:00", "alice", "sent"), null);

            assertThatThrownBy(() -> RecordTable.fromRows(rows, ALIASES))
                .isInstanceOf(RecordValidationException.class)
                .hasMessage("Missing required fields: row 1 is null");
        }

        @Test
        @DisplayName("should report missing standard fields by standard name")
        void shouldReportMissingFields() {
            Map<String, Object> incomplete = new HashMap<>();
            incomplete.put("time", "2023-01-01 10:00:00");
            incomplete.put("msg_type", "sent");

            assertThatThrownBy(() -> RecordTable.fromRows(List.of(incomplete), ALIASES))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("counterparty_id");
        }

        @Test
        @DisplayName("should reject malformed timestamps")
        void shouldRejectMalformedTimestamps() {
            List<Map<String, Object>> rows = List.of(
                row("2023-01-01 10:00:00", "alice", "sent"),
                row("not a date", "alice", "received"));

            assertThatThrownBy(() -> RecordTable.fromRows(rows, ALIASES))
                .isInstanceOf(RecordValidationException.class)
                .hasMessageContaining("Invalid timestamp format")
                .hasMessageContaining("row 1");
        }

        @Test
        @DisplayName("should accept an empty row list")
        void shouldAcceptEmpty() {
            assertThat(RecordTable.fromRows(List.of(), null).isEmpty()).isTrue();
        }
    }

    @Nested
    @DisplayName("ordering")
    class Ordering {

        @Test
        @DisplayName("time sort should keep input order among identical timestamps")
        void timeSortIsStable() {
            RecordTable table = RecordTable.fromRows(List.of(
                row("2023-01-01 10:05:00", "bob", "sent"),
                row("2023-01-01 10:00:00", "alice", "received"),
                row("2023-01-01 10:00:00", "carol", "sent"),
                row("2023-01-01 10:00:00", "alice", "sent")), ALIASES);

            List<Integer> ordinals = table.sortedByTime().stream()
                .map(CommRecord::ordinal).collect(Collectors.toList());

            assertThat(ordinals).containsExactly(1, 2, 3, 0);
        }

        @Test
        @DisplayName("counterparty grouping should be keyed in sorted order and time ordered within")
        void groupsAreSorted() {
            RecordTable table = RecordTable.fromRows(List.of(
                row("2023-01-01 12:00:00", "zed", "sent"),
                row("2023-01-01 11:00:00", "amy", "received"),
                row("2023-01-01 09:00:00", "amy", "sent")), ALIASES);

            assertThat(table.byCounterparty().keySet()).containsExactly("amy", "zed");
            assertThat(table.byCounterparty().get("amy"))
                .extracting(CommRecord::ordinal).containsExactly(2, 1);
            assertThat(table.firstTimestamp()).isEqualTo(LocalDateTime.of(2023, 1, 1, 9, 0));
            assertThat(table.lastTimestamp()).isEqualTo(LocalDateTime.of(2023, 1, 1, 12, 0));
        }
    }

    @Test
    @DisplayName("content hash should change when any record changes")
    void contentHashTracksContent() {
        RecordTable a = RecordTable.fromRows(List.of(row("2023-01-01 10:00:00", "alice", "sent")), ALIASES);
        RecordTable b = RecordTable.fromRows(List.of(row("2023-01-01 10:00:00", "alice", "sent")), ALIASES);
        RecordTable c = RecordTable.fromRows(List.of(row("2023-01-01 10:00:00", "alice", "received")), ALIASES);

        assertThat(a.contentHash()).isEqualTo(b.contentHash());
        assertThat(a.contentHash()).isNotEqualTo(c.contentHash());
    }

    @Test
    @DisplayName("FieldAliases should reject unknown standard names")
    void aliasesRejectUnknownKeys() {
        assertThatThrownBy(() -> FieldAliases.of(Map.of("phone", "contact")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("phone");
        assertThat(FieldAliases.of(null)).isEqualTo(FieldAliases.STANDARD);
    }
}
