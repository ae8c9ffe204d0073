package io.commtrace.analysis.patterns;

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

import io.commtrace.analysis.flows.ConversationFlowSummary;
import io.commtrace.analysis.reciprocity.ReciprocityReport;
import io.commtrace.analysis.responses.ResponseTimeStatistics;
import io.commtrace.analysis.result.ResponseAnalysisReport;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Converts a [ResponseAnalysisReport] into [Pattern] records with first-stage significance.
///
/// | Condition | Pattern | Significance |
/// |-----------|---------|--------------|
/// | average latency defined | `response_time/average` | see [#averageSignificance(double)] |
/// | quick ratio > 0.3 | `response_time/quick_responder` | min(3, ratio * 5) |
/// | delayed ratio > 0.2 | `response_time/delayed_responder` | min(3, ratio * 6) |
/// | initiation ratio < 0.3 or > 0.7 | `reciprocity/initiation_imbalance` | min(2.5, abs(0.5 - ratio) * 6) |
/// | more than 10 conversations averaging over 30 min | `conversation_flow/long_conversations` | min(2, duration / 3600) |
/// | more than 15 records per conversation | `conversation_flow/message_intensive` | min(2, count / 10) |
///
/// Quick and delayed ratios divide by the pair count, or by quick + delayed when the
/// pair count is 0. When that is also 0, no ratio pattern is produced. Every threshold
/// is strict. Sections that failed contribute nothing.
public final class PatternConverter {

    private static final Logger logger = LogManager.getLogger(PatternConverter.class);

    public static final String RESPONSE_TIME = "response_time";
    public static final String RECIPROCITY = "reciprocity";
    public static final String CONVERSATION_FLOW = "conversation_flow";

    static final double QUICK_RATIO_THRESHOLD = 0.3;
    static final double DELAYED_RATIO_THRESHOLD = 0.2;
    static final double LOW_INITIATION = 0.3;
    static final double HIGH_INITIATION = 0.7;
    static final int LONG_CONVERSATION_MIN_COUNT = 10;
    static final double LONG_CONVERSATION_MIN_SECONDS = 1800;
    static final double INTENSIVE_MIN_MESSAGES = 15;

    /// @param report a computed report; a hard-stop report yields no patterns
    /// @return patterns in production order: response time, reciprocity, conversation flow
    public List<Pattern> convert(ResponseAnalysisReport report) {
        List<Pattern> patterns = new ArrayList<>();
        report.timing().ifPresent(timing -> patterns.addAll(responseTimePatterns(timing)));
        report.reciprocity().ifPresent(reciprocity -> patterns.addAll(reciprocityPatterns(reciprocity)));
        report.flows().ifPresent(flows -> patterns.addAll(conversationPatterns(flows)));
        logger.debug("Converted response analysis into {} patterns", patterns.size());
        return patterns;
    }

    List<Pattern> responseTimePatterns(ResponseTimeStatistics timing) {
        List<Pattern> patterns = new ArrayList<>();
        Double average = timing.averageResponseTimeSeconds();
        if (average != null) {
            double significance = averageSignificance(average);
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("value_seconds", average);
            metadata.put("median_seconds", timing.medianResponseTimeSeconds());
            patterns.add(Pattern.of(RESPONSE_TIME, "average",
                "Average response time is " + humanDuration(average),
                significance, SignificanceScorer.confidenceFromSignificance(significance),
                timing.pairCount(), metadata));
        }

        int quick = timing.quickResponseCount();
        int delayed = timing.delayedResponseCount();
        int denominator = timing.pairCount() > 0 ? timing.pairCount() : quick + delayed;
        if (denominator == 0) {
            return patterns;
        }
        double quickRatio = (double) quick / denominator;
        if (quickRatio > QUICK_RATIO_THRESHOLD) {
            double significance = Math.min(3.0, quickRatio * 5);
            patterns.add(Pattern.of(RESPONSE_TIME, "quick_responder",
                String.format(Locale.ROOT, "%.0f%% of replies are sent quickly", quickRatio * 100),
                significance, SignificanceScorer.confidenceFromSignificance(significance),
                quick, Map.of("ratio", quickRatio, "count", quick)));
        }
        double delayedRatio = (double) delayed / denominator;
        if (delayedRatio > DELAYED_RATIO_THRESHOLD) {
            double significance = Math.min(3.0, delayedRatio * 6);
            patterns.add(Pattern.of(RESPONSE_TIME, "delayed_responder",
                String.format(Locale.ROOT, "%.0f%% of replies are delayed", delayedRatio * 100),
                significance, SignificanceScorer.confidenceFromSignificance(significance),
                delayed, Map.of("ratio", delayedRatio, "count", delayed)));
        }
        return patterns;
    }

    List<Pattern> reciprocityPatterns(ReciprocityReport reciprocity) {
        Double ratio = reciprocity.overallInitiationRatio();
        if (ratio == null || (ratio >= LOW_INITIATION && ratio <= HIGH_INITIATION)) {
            return List.of();
        }
        double significance = Math.min(2.5, Math.abs(0.5 - ratio) * 6);
        String description = ratio < LOW_INITIATION
            ? String.format(Locale.ROOT, "User rarely initiates conversations (%.0f%% of initiations)", ratio * 100)
            : String.format(Locale.ROOT, "User usually initiates conversations (%.0f%% of initiations)", ratio * 100);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("initiation_ratio", ratio);
        metadata.put("user_initiations", reciprocity.userInitiations());
        metadata.put("contact_initiations", reciprocity.contactInitiations());
        return List.of(Pattern.of(RECIPROCITY, "initiation_imbalance", description, significance,
            SignificanceScorer.confidenceFromSignificance(significance), reciprocity.totalInitiations(), metadata));
    }

    List<Pattern> conversationPatterns(ConversationFlowSummary flows) {
        List<Pattern> patterns = new ArrayList<>();
        int count = flows.conversationCount();
        Double duration = flows.averageDurationSeconds();
        if (count > LONG_CONVERSATION_MIN_COUNT && duration != null && duration > LONG_CONVERSATION_MIN_SECONDS) {
            double significance = Math.min(2.0, duration / 3600);
            patterns.add(Pattern.of(CONVERSATION_FLOW, "long_conversations",
                "Conversations last " + humanDuration(duration) + " on average",
                significance, SignificanceScorer.confidenceFromSignificance(significance), count,
                Map.of("average_duration_seconds", duration, "conversation_count", count)));
        }
        Double messages = flows.averageMessageCount();
        if (messages != null && messages > INTENSIVE_MIN_MESSAGES) {
            double significance = Math.min(2.0, messages / 10);
            patterns.add(Pattern.of(CONVERSATION_FLOW, "message_intensive",
                String.format(Locale.ROOT, "Conversations average %.1f messages", messages),
                significance, SignificanceScorer.confidenceFromSignificance(significance), count,
                Map.of("average_message_count", messages, "conversation_count", count)));
        }
        return patterns;
    }

    /// Significance of the average reply latency.
    ///
    /// - below one minute: `min(3, 3 * (60 - avg) / 50)`
    /// - above one hour: `min(3, 1.5 * avg / 3600)`
    /// - otherwise: distance from ten minutes, `abs(600 - avg) / 600` clamped to [0.5, 1.5]
    ///
    /// @param averageSeconds mean latency in seconds
    /// @return the first-stage significance
    public static double averageSignificance(double averageSeconds) {
        if (averageSeconds < 60) {
            return Math.min(3.0, 3.0 * (60 - averageSeconds) / 50);
        }
        if (averageSeconds > 3600) {
            return Math.min(3.0, 1.5 * averageSeconds / 3600);
        }
        return SignificanceScorer.clamp(Math.abs(600 - averageSeconds) / 600, 0.5, 1.5);
    }

    static String humanDuration(double seconds) {
        if (seconds < 60) {
            return String.format(Locale.ROOT, "%.0f seconds", seconds);
        }
        if (seconds < 3600) {
            return String.format(Locale.ROOT, "%.1f minutes", seconds / 60);
        }
        return String.format(Locale.ROOT, "%.1f hours", seconds / 3600);
    }
}
