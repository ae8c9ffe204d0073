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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps the three standard record fields onto the column names of a concrete source.
 *
 * <p>Heterogeneous exports name their columns differently ("time", "contact",
 * "msg_type", ...). An alias map lets the loader adapt them without touching any
 * analysis code. Standard names that are not aliased map to themselves.
 *
 * <pre>{@code
 * FieldAliases aliases = FieldAliases.of(Map.of(
 *     "timestamp", "time",
 *     "counterparty_id", "contact",
 *     "direction", "msg_type"));
 * }</pre>
 *
 * @param timestampField source column holding the event time
 * @param counterpartyField source column holding the counterparty identifier
 * @param directionField source column holding {@code sent}/{@code received}
 */
public record FieldAliases(String timestampField, String counterpartyField, String directionField) {

    public static final String TIMESTAMP = "timestamp";
    public static final String COUNTERPARTY_ID = "counterparty_id";
    public static final String DIRECTION = "direction";

    private static final Set<String> STANDARD_NAMES = Set.of(TIMESTAMP, COUNTERPARTY_ID, DIRECTION);

    /** Identity mapping: every standard field is read from the column of the same name. */
    public static final FieldAliases STANDARD = new FieldAliases(TIMESTAMP, COUNTERPARTY_ID, DIRECTION);

    public FieldAliases {
        Objects.requireNonNull(timestampField, "timestampField cannot be null");
        Objects.requireNonNull(counterpartyField, "counterpartyField cannot be null");
        Objects.requireNonNull(directionField, "directionField cannot be null");
    }

    /**
     * Builds aliases from a map keyed by standard field name.
     *
     * @param aliases standard name to source column; may be null or partial
     * @return the resolved aliases
     * @throws IllegalArgumentException if a key is not a standard field name
     */
    public static FieldAliases of(Map<String, String> aliases) {
        if (aliases == null || aliases.isEmpty()) {
            return STANDARD;
        }
        for (String key : aliases.keySet()) {
            if (!STANDARD_NAMES.contains(key)) {
                throw new IllegalArgumentException("Unknown standard field '" + key
                    + "', expected one of " + STANDARD_NAMES);
            }
        }
        return new FieldAliases(
            aliases.getOrDefault(TIMESTAMP, TIMESTAMP),
            aliases.getOrDefault(COUNTERPARTY_ID, COUNTERPARTY_ID),
            aliases.getOrDefault(DIRECTION, DIRECTION));
    }

    /**
     * @return standard field name to source column, in standard order
     */
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        map.put(TIMESTAMP, timestampField);
        map.put(COUNTERPARTY_ID, counterpartyField);
        map.put(DIRECTION, directionField);
        return map;
    }
}
