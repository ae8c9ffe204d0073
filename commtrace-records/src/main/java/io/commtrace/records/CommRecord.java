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
import java.util.Objects;

/// One timestamped communication event.
///
/// Records are immutable and identified by their `ordinal`, the zero-based position
/// of the row in the original input. Sorting by time is always stable with respect
/// to the ordinal, so events with identical timestamps keep their input order.
///
/// @param ordinal position in the original input
/// @param timestamp local wall-clock time of the event
/// @param counterparty identifier of the other party
/// @param direction whether the user sent or received the event
public record CommRecord(int ordinal, LocalDateTime timestamp, String counterparty, Direction direction) {

    public CommRecord {
        Objects.requireNonNull(timestamp, "timestamp cannot be null");
        Objects.requireNonNull(counterparty, "counterparty cannot be null");
        Objects.requireNonNull(direction, "direction cannot be null");
        if (ordinal < 0) {
            throw new IllegalArgumentException("ordinal must be non-negative, got: " + ordinal);
        }
    }

    public boolean isSent() {
        return direction == Direction.SENT;
    }

    public boolean isReceived() {
        return direction == Direction.RECEIVED;
    }
}
