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

import java.util.Optional;

/// Direction of a communication event relative to the user whose log is analyzed.
///
/// Source data carries the direction as the exact lowercase strings `sent` and
/// `received`. Parsing happens once, when a [RecordTable] is built; every analyzer
/// downstream works with this enum only.
public enum Direction {
    /// An event the user sent to the counterparty.
    SENT("sent"),
    /// An event the user received from the counterparty.
    RECEIVED("received");

    private final String label;

    Direction(String label) {
        this.label = label;
    }

    /// @return the wire label, `sent` or `received`
    public String label() {
        return label;
    }

    /// Parses a wire label. Matching is exact and case-sensitive.
    ///
    /// @param value the raw value, may be null
    /// @return the direction, or empty when the value is not a valid label
    public static Optional<Direction> fromLabel(String value) {
        if (value == null) {
            return Optional.empty();
        }
        for (Direction direction : values()) {
            if (direction.label.equals(value)) {
                return Optional.of(direction);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
