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
import io.commtrace.analysis.result.ResponseAnalysisReport;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/// Composite result of [PatternOrchestrator#detectAllPatterns].
///
/// A non-empty `errors` list means some producer degraded; the patterns and anomalies
/// of the producers that succeeded are still present.
///
/// @param detectedPatterns all patterns, scored and sorted by descending `pattern_significance`
/// @param anomalies anomalies from the response analyzer, then from each detector in registration order
/// @param errors `"<source>: <message>"` entries
/// @param advancedAnalysis `responses` and each detector name to its raw output
/// @param recordCount records analyzed
public record PatternReport(
    List<Pattern> detectedPatterns,
    List<Anomaly> anomalies,
    List<String> errors,
    Map<String, Object> advancedAnalysis,
    int recordCount
) {

    public static final String RESPONSES = "responses";

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    /// @return the response analyzer's report when it ran
    public Optional<ResponseAnalysisReport> responses() {
        Object value = advancedAnalysis.get(RESPONSES);
        return value instanceof ResponseAnalysisReport ? Optional.of((ResponseAnalysisReport) value) : Optional.empty();
    }
}
