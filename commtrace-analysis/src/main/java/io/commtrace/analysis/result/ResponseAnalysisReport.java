package io.commtrace.analysis.result;

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
import io.commtrace.analysis.flows.ConversationFlowSummary;
import io.commtrace.analysis.ml.Augmentation;
import io.commtrace.analysis.reciprocity.ReciprocityReport;
import io.commtrace.analysis.responses.ResponseTimeStatistics;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/// Output of [io.commtrace.analysis.ResponseAnalyzer].
///
/// ## Hard stop versus degradation
///
/// - [#failed(String)] reports: `error` is set and every section is absent. Nothing was
///   computed, usually because the input did not validate.
/// - Degraded reports: `error` is null but one or more sections are failure stubs.
///   If the timing section itself failed, `error` is also set and names it.
///
/// All error text is lower case.
public final class ResponseAnalysisReport {

    private final SubAnalysisResult<ResponseTimeStatistics> responseTimes;
    private final SubAnalysisResult<ReciprocityReport> reciprocityPatterns;
    private final SubAnalysisResult<ConversationFlowSummary> conversationFlows;
    private final SubAnalysisResult<List<Anomaly>> anomalies;
    private final Augmentation mlEnhanced;
    private final String mlError;
    private final String error;
    private final Integer recordCount;
    private final transient List<String> warnings;

    private ResponseAnalysisReport(SubAnalysisResult<ResponseTimeStatistics> responseTimes,
                                   SubAnalysisResult<ReciprocityReport> reciprocityPatterns,
                                   SubAnalysisResult<ConversationFlowSummary> conversationFlows,
                                   SubAnalysisResult<List<Anomaly>> anomalies,
                                   Augmentation mlEnhanced,
                                   String mlError,
                                   String error,
                                   Integer recordCount,
                                   List<String> warnings) {
        this.responseTimes = responseTimes;
        this.reciprocityPatterns = reciprocityPatterns;
        this.conversationFlows = conversationFlows;
        this.anomalies = anomalies;
        this.mlEnhanced = mlEnhanced;
        this.mlError = mlError;
        this.error = error == null ? null : error.toLowerCase(Locale.ROOT);
        this.recordCount = recordCount;
        this.warnings = List.copyOf(warnings);
    }

    /// @param message reason for the hard stop
    /// @return a report with only the error set
    public static ResponseAnalysisReport failed(String message) {
        return new ResponseAnalysisReport(null, null, null, null, null, null,
            message == null ? "unknown error" : message, null, List.of());
    }

    /// Assembles a computed report. The top-level error is set when timing failed.
    public static ResponseAnalysisReport of(SubAnalysisResult<ResponseTimeStatistics> responseTimes,
                                            SubAnalysisResult<ReciprocityReport> reciprocityPatterns,
                                            SubAnalysisResult<ConversationFlowSummary> conversationFlows,
                                            SubAnalysisResult<List<Anomaly>> anomalies,
                                            int recordCount) {
        String error = responseTimes.error()
            .map(e -> "error during response pattern analysis: " + e)
            .orElse(null);
        return new ResponseAnalysisReport(responseTimes, reciprocityPatterns, conversationFlows, anomalies,
            null, null, error, recordCount, List.of());
    }

    /// @return a copy carrying ML augmentation output
    public ResponseAnalysisReport withAugmentation(Augmentation augmentation) {
        return withAugmentation(augmentation, List.of());
    }

    /// Attaches ML output and appends the model's anomalies after the detected ones.
    /// A failed anomaly section keeps its failure stub.
    ///
    /// @param augmentation the model output
    /// @param modelAnomalies anomalies converted from the model output
    /// @return a copy carrying both
    public ResponseAnalysisReport withAugmentation(Augmentation augmentation, List<Anomaly> modelAnomalies) {
        SubAnalysisResult<List<Anomaly>> merged = anomalies;
        if (anomalies != null && anomalies.isSuccess() && !modelAnomalies.isEmpty()) {
            List<Anomaly> all = new ArrayList<>(anomalies.valueOrNull());
            all.addAll(modelAnomalies);
            merged = SubAnalysisResult.success(List.copyOf(all));
        }
        return new ResponseAnalysisReport(responseTimes, reciprocityPatterns, conversationFlows, merged,
            augmentation, null, error, recordCount, warnings);
    }

    /// @return a copy recording an ML failure
    public ResponseAnalysisReport withMlError(String message) {
        return new ResponseAnalysisReport(responseTimes, reciprocityPatterns, conversationFlows, anomalies,
            null, message.toLowerCase(Locale.ROOT), error, recordCount, warnings);
    }

    /// @param warning a collaborator problem that did not affect the result, e.g. a cache failure
    /// @return a copy with the warning appended
    public ResponseAnalysisReport withWarning(String warning) {
        List<String> next = new ArrayList<>(warnings);
        next.add(warning);
        return new ResponseAnalysisReport(responseTimes, reciprocityPatterns, conversationFlows, anomalies,
            mlEnhanced, mlError, error, recordCount, next);
    }

    /// @return collaborator problems collected while producing this report; not serialized
    public List<String> warnings() {
        return warnings;
    }

    /// @return true when the call stopped before any section was computed
    public boolean isHardStop() {
        return error != null && responseTimes == null;
    }

    public Optional<String> error() {
        return Optional.ofNullable(error);
    }

    public SubAnalysisResult<ResponseTimeStatistics> responseTimes() {
        return responseTimes;
    }

    public SubAnalysisResult<ReciprocityReport> reciprocityPatterns() {
        return reciprocityPatterns;
    }

    public SubAnalysisResult<ConversationFlowSummary> conversationFlows() {
        return conversationFlows;
    }

    /// @return the anomaly section, null for a hard stop
    public SubAnalysisResult<List<Anomaly>> anomalySection() {
        return anomalies;
    }

    /// @return detected anomalies; empty when the section is absent or failed
    public List<Anomaly> anomalies() {
        if (anomalies == null) {
            return List.of();
        }
        return anomalies.value().orElse(List.of());
    }

    public Optional<Augmentation> mlEnhanced() {
        return Optional.ofNullable(mlEnhanced);
    }

    public Optional<String> mlError() {
        return Optional.ofNullable(mlError);
    }

    /// @return records analyzed; 0 for a hard stop
    public int recordCount() {
        return recordCount == null ? 0 : recordCount;
    }

    /// @return the timing statistics when computed successfully
    public Optional<ResponseTimeStatistics> timing() {
        return responseTimes == null ? Optional.empty() : responseTimes.value();
    }

    public Optional<ReciprocityReport> reciprocity() {
        return reciprocityPatterns == null ? Optional.empty() : reciprocityPatterns.value();
    }

    public Optional<ConversationFlowSummary> flows() {
        return conversationFlows == null ? Optional.empty() : conversationFlows.value();
    }

    @Override
    public String toString() {
        if (isHardStop()) {
            return "ResponseAnalysisReport[error=" + error + "]";
        }
        return "ResponseAnalysisReport[records=" + recordCount + ", anomalies=" + anomalies().size()
            + (error != null ? ", error=" + error : "") + "]";
    }
}
