package io.commtrace.commands.analyze;

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

import io.commtrace.analysis.ResponsePrediction;
import io.commtrace.analysis.anomaly.Anomaly;
import io.commtrace.analysis.flows.ConversationFlowSummary;
import io.commtrace.analysis.harness.PatternReport;
import io.commtrace.analysis.patterns.Pattern;
import io.commtrace.analysis.reciprocity.ReciprocityReport;
import io.commtrace.analysis.reciprocity.ReciprocitySummary;
import io.commtrace.analysis.responses.ResponseTimeStatistics;
import io.commtrace.analysis.result.ResponseAnalysisReport;
import io.commtrace.analysis.result.SubAnalysisResult;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.BiConsumer;

/// Plain-text digests of analysis reports for `--format summary`.
///
/// Numbers are printed with [Locale#ROOT] so output does not vary by platform locale.
public final class ReportSummaryFormatter {

    /// Maximum number of patterns or anomalies listed in a pattern summary.
    static final int MAX_LISTED = 10;

    private ReportSummaryFormatter() {
    }

    public static String summarize(ResponseAnalysisReport report) {
        StringBuilder sb = new StringBuilder();
        if (report.isHardStop()) {
            line(sb, "Error: %s", report.error().orElse("unknown error"));
            return sb.toString().stripTrailing();
        }
        line(sb, "Records analyzed: %d", report.recordCount());
        report.error().ifPresent(e -> line(sb, "Error: %s", e));

        section(sb, "Response times", report.responseTimes(), ReportSummaryFormatter::timing);
        section(sb, "Reciprocity", report.reciprocityPatterns(), ReportSummaryFormatter::reciprocity);
        section(sb, "Conversations", report.conversationFlows(), ReportSummaryFormatter::flows);
        section(sb, "Anomalies", report.anomalySection(), ReportSummaryFormatter::anomalies);

        report.mlError().ifPresent(e -> line(sb, "ML augmentation: %s", e));
        for (String warning : report.warnings()) {
            line(sb, "Warning: %s", warning);
        }
        return sb.toString().stripTrailing();
    }

    public static String summarize(PatternReport report) {
        StringBuilder sb = new StringBuilder();
        line(sb, "Records analyzed: %d", report.recordCount());
        line(sb, "Patterns: %d", report.detectedPatterns().size());
        List<Pattern> patterns = report.detectedPatterns();
        for (Pattern p : patterns.subList(0, Math.min(MAX_LISTED, patterns.size()))) {
            double score = p.patternSignificance() == null ? 0.0 : p.patternSignificance();
            line(sb, "  [%.2f] %s: %s", score, p.key(), p.description());
        }
        anomalies(sb, report.anomalies());
        if (report.hasErrors()) {
            line(sb, "Errors:");
            for (String error : report.errors()) {
                line(sb, "  %s", error);
            }
        }
        return sb.toString().stripTrailing();
    }

    public static String summarize(ResponsePrediction prediction) {
        StringBuilder sb = new StringBuilder();
        if (!prediction.isSuccess()) {
            line(sb, "No prediction for %s: %s", prediction.counterparty(), prediction.error());
        } else {
            line(sb, "Prediction for %s: %s (%s, confidence %.2f)", prediction.counterparty(),
                seconds(prediction.expectedResponseTimeSeconds()), prediction.predictionMethod(),
                prediction.confidence());
        }
        return sb.toString().stripTrailing();
    }

    private static <T> void section(StringBuilder sb, String title, SubAnalysisResult<T> result,
                                    BiConsumer<StringBuilder, T> body) {
        if (result == null) {
            return;
        }
        if (result.isFailure()) {
            line(sb, "%s: %s", title, result.error().orElse("unknown error"));
            return;
        }
        body.accept(sb, result.valueOrNull());
    }

    private static void timing(StringBuilder sb, ResponseTimeStatistics stats) {
        if (!stats.hasPairs()) {
            line(sb, "Response times: no replies found");
            return;
        }
        line(sb, "Response times: %d replies, mean %s, median %s", stats.pairCount(),
            seconds(stats.averageResponseTimeSeconds()), seconds(stats.medianResponseTimeSeconds()));
        line(sb, "  quick: %d, delayed: %d", stats.quickResponseCount(), stats.delayedResponseCount());
        for (Map.Entry<String, Double> entry : stats.perCounterpartyAverage().entrySet()) {
            line(sb, "  %s: %s", entry.getKey(), seconds(entry.getValue()));
        }
    }

    private static void reciprocity(StringBuilder sb, ReciprocityReport report) {
        line(sb, "Reciprocity: %d contacts, you started %d of %d conversations", report.contacts().size(),
            report.userInitiations(), report.totalInitiations());
        for (ReciprocitySummary contact : report.contacts().values()) {
            line(sb, "  %s: %s (sent %d, received %d)", contact.counterparty(), contact.relationshipBalance(),
                contact.sentCount(), contact.receivedCount());
        }
    }

    private static void flows(StringBuilder sb, ConversationFlowSummary summary) {
        if (summary.conversationCount() == 0) {
            line(sb, "Conversations: 0");
            return;
        }
        line(sb, "Conversations: %d, mean %.1f messages over %s", summary.conversationCount(),
            summary.averageMessageCount(), seconds(summary.averageDurationSeconds()));
    }

    private static void anomalies(StringBuilder sb, List<Anomaly> anomalies) {
        line(sb, "Anomalies: %d", anomalies.size());
        for (Anomaly a : anomalies.subList(0, Math.min(MAX_LISTED, anomalies.size()))) {
            String subject = a.counterparty() != null ? a.type() + " " + a.counterparty() : a.type();
            line(sb, "  [%.2f] %s: %s", a.severity(), subject, a.description() != null ? a.description() : "-");
        }
    }

    private static String seconds(Double value) {
        return value == null ? "n/a" : String.format(Locale.ROOT, "%.1f s", value);
    }

    private static void line(StringBuilder sb, String format, Object... args) {
        sb.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
