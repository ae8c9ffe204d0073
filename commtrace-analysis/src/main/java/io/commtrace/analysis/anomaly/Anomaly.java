package io.commtrace.analysis.anomaly;

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

import io.commtrace.records.TimestampParser;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A notable irregularity in the communication log.
///
/// @param type anomaly kind, e.g. `response_time_outlier`
/// @param counterparty the counterparty concerned, may be null for dataset-wide anomalies
/// @param timestamp when it happened, null when not tied to one moment
/// @param severity in [0, 1]
/// @param description human readable summary
/// @param details supporting values
public record Anomaly(
    String type,
    String counterparty,
    LocalDateTime timestamp,
    double severity,
    String description,
    Map<String, Object> details
) {

    public static final String RESPONSE_TIME_OUTLIER = "response_time_outlier";
    public static final String RECIPROCITY_IMBALANCE = "reciprocity_imbalance";

    public Anomaly {
        Objects.requireNonNull(type, "type cannot be null");
        if (severity < 0 || severity > 1 || Double.isNaN(severity)) {
            throw new IllegalArgumentException("severity must be within [0, 1], got " + severity);
        }
        details = details == null ? Map.of() : details;
    }

    /// Converts an anomaly reported by a model service.
    ///
    /// `type` is required. `severity` defaults to 0.5, `counterparty` may also be given as
    /// `contact`, and `timestamp` accepts anything [TimestampParser] does. Keys other than
    /// these and `description` are kept as details, merged with a `details` map if present.
    ///
    /// @param values the model's anomaly entry
    /// @return the anomaly
    /// @throws IllegalArgumentException if the entry has no type, a non-numeric or out of range
    ///     severity, or an unparsable timestamp
    public static Anomaly fromMap(Map<String, ?> values) {
        if (values == null) {
            throw new IllegalArgumentException("anomaly entry is null");
        }
        Object type = values.get("type");
        if (type == null || String.valueOf(type).isBlank()) {
            throw new IllegalArgumentException("anomaly entry has no type: " + values);
        }
        Object severity = values.get("severity");
        if (severity != null && !(severity instanceof Number)) {
            throw new IllegalArgumentException("anomaly severity is not a number: " + severity);
        }
        Object counterparty = values.containsKey("counterparty") ? values.get("counterparty") : values.get("contact");
        LocalDateTime timestamp = null;
        if (values.get("timestamp") != null) {
            try {
                timestamp = TimestampParser.parse(values.get("timestamp"));
            } catch (RuntimeException e) {
                throw new IllegalArgumentException("anomaly timestamp is invalid: " + e.getMessage(), e);
            }
        }
        Object description = values.get("description");

        Map<String, Object> details = new LinkedHashMap<>();
        if (values.get("details") instanceof Map) {
            ((Map<?, ?>) values.get("details")).forEach((k, v) -> details.put(String.valueOf(k), v));
        }
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            switch (entry.getKey()) {
                case "type":
                case "severity":
                case "counterparty":
                case "contact":
                case "timestamp":
                case "description":
                case "details":
                    break;
                default:
                    details.put(entry.getKey(), entry.getValue());
            }
        }
        return new Anomaly(String.valueOf(type),
            counterparty == null ? null : String.valueOf(counterparty),
            timestamp,
            severity == null ? 0.5 : ((Number) severity).doubleValue(),
            description == null ? null : String.valueOf(description),
            details);
    }
}
