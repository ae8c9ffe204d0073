package io.commtrace.analysis.cache;

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

import io.commtrace.records.RecordTable;

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/// Fingerprint of an (operation, input, parameters) triple.
///
/// The input contributes its record count, first and last timestamps and a content
/// hash over every record, so two tables with equal content map to the same key.
///
/// @param operation operation name, e.g. `analyze_response_patterns`
/// @param fingerprint the derived identity string
public record CacheKey(String operation, String fingerprint) {

    public CacheKey {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(fingerprint, "fingerprint cannot be null");
    }

    /// @param operation operation name
    /// @param table the input
    /// @param parameters operation parameters, may be null
    /// @return the key
    public static CacheKey of(String operation, RecordTable table, Map<String, ?> parameters) {
        StringBuilder sb = new StringBuilder(operation)
            .append('|').append(table.size())
            .append('|').append(table.firstTimestamp())
            .append('|').append(table.lastTimestamp())
            .append('|').append(Long.toHexString(table.contentHash()));
        if (parameters != null && !parameters.isEmpty()) {
            sb.append('|').append(new TreeMap<>(parameters));
        }
        return new CacheKey(operation, sb.toString());
    }
}
