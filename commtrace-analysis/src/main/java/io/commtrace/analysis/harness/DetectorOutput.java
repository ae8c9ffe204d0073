package io.commtrace.analysis.harness;

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

import io.commtrace.analysis.anomaly.Anomaly;
import io.commtrace.analysis.patterns.Pattern;

import java.util.List;
import java.util.Map;

/// What a [SiblingDetector] hands back to the orchestrator.
///
/// @param patterns patterns with confidence and occurrences set; scored later
/// @param anomalies detector specific anomalies
/// @param values raw results, kept under the detector's name in `advanced_analysis`
/// @param error set when the detector could not complete; other fields may be partial
public record DetectorOutput(
    List<Pattern> patterns,
    List<Anomaly> anomalies,
    Map<String, Object> values,
    String error
) {

    public DetectorOutput {
        patterns = patterns == null ? List.of() : List.copyOf(patterns);
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
        values = values == null ? Map.of() : values;
    }

    public static DetectorOutput of(List<Pattern> patterns, List<Anomaly> anomalies, Map<String, Object> values) {
        return new DetectorOutput(patterns, anomalies, values, null);
    }

    public static DetectorOutput failed(String error) {
        return new DetectorOutput(List.of(), List.of(), Map.of(), error);
    }

    public boolean hasError() {
        return error != null;
    }
}
