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

import io.commtrace.analysis.reciprocity.ReciprocityReport;
import io.commtrace.analysis.reciprocity.ReciprocitySummary;
import io.commtrace.analysis.responses.ResponsePair;
import io.commtrace.analysis.responses.ResponseTimeStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Turns timing outliers and one-sided relationships into [Anomaly] records.
///
/// Response-time anomalies come first, reciprocity anomalies second. Each kind is
/// produced independently: if one fails, it contributes nothing and a warning is logged.
public class AnomalyDetector {

    private static final Logger logger = LogManager.getLogger(AnomalyDetector.class);

    static final double RECIPROCITY_SEVERITY = 0.6;

    /// @param timing timing statistics, null when that analysis failed
    /// @param reciprocity reciprocity report, null when that analysis failed
    /// @return anomalies in emission order
    public List<Anomaly> detect(ResponseTimeStatistics timing, ReciprocityReport reciprocity) {
        List<Anomaly> anomalies = new ArrayList<>();
        try {
            anomalies.addAll(responseTimeAnomalies(timing));
        } catch (RuntimeException e) {
            logger.warn("Response time anomaly detection failed: {}", e.getMessage(), e);
        }
        try {
            anomalies.addAll(reciprocityAnomalies(reciprocity));
        } catch (RuntimeException e) {
            logger.warn("Reciprocity anomaly detection failed: {}", e.getMessage(), e);
        }
        logger.debug("Detected {} anomalies", anomalies.size());
        return anomalies;
    }

    protected List<Anomaly> responseTimeAnomalies(ResponseTimeStatistics timing) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (timing == null || timing.outliers().isEmpty()) {
            return anomalies;
        }
        Double average = timing.averageResponseTimeSeconds();
        for (ResponsePair outlier : timing.outliers()) {
            double latency = outlier.latencySeconds();
            double severity = 1.0;
            if (average != null && average > 0) {
                severity = Math.min(1.0, Math.abs(latency / average - 1));
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("response_time_seconds", latency);
            details.put("received_timestamp", outlier.receivedAt());
            details.put("sent_timestamp", outlier.sentAt());
            anomalies.add(new Anomaly(
                Anomaly.RESPONSE_TIME_OUTLIER,
                outlier.counterparty(),
                outlier.sentAt(),
                severity,
                String.format(Locale.ROOT, "Response time outlier (%.0fs) for contact %s", latency,
                    outlier.counterparty()),
                details));
        }
        return anomalies;
    }

    protected List<Anomaly> reciprocityAnomalies(ReciprocityReport reciprocity) {
        List<Anomaly> anomalies = new ArrayList<>();
        if (reciprocity == null) {
            return anomalies;
        }
        for (ReciprocitySummary summary : reciprocity.contacts().values()) {
            if (!summary.relationshipBalance().isOneSided()) {
                continue;
            }
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("sent_count", summary.sentCount());
            details.put("received_count", summary.receivedCount());
            details.put("relationship_balance", summary.relationshipBalance().label());
            details.put("message_ratio", summary.messageRatio());
            anomalies.add(new Anomaly(
                Anomaly.RECIPROCITY_IMBALANCE,
                summary.counterparty(),
                null,
                RECIPROCITY_SEVERITY,
                "Communication with " + summary.counterparty() + " is highly unbalanced ("
                    + summary.relationshipBalance().label() + ").",
                details));
        }
        return anomalies;
    }
}
