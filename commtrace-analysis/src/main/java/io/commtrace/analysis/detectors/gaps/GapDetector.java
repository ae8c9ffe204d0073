package io.commtrace.analysis.detectors.gaps;

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

import io.commtrace.analysis.config.AnalysisConfig;
import io.commtrace.analysis.harness.DetectorName;
import io.commtrace.analysis.harness.DetectorOutput;
import io.commtrace.analysis.harness.PatternOrchestrator;
import io.commtrace.analysis.harness.SiblingDetector;
import io.commtrace.analysis.patterns.Pattern;
import io.commtrace.records.CommRecord;
import io.commtrace.records.RecordTable;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/// Finds silences between consecutive records across all counterparties.
///
/// A gap is any interval between time-adjacent records of at least `min_gap_hours`.
/// Its significance is its length relative to the typical interval, the median of
/// all intervals in the table. Gaps are reported longest first.
@DetectorName(GapDetector.NAME)
public class GapDetector implements SiblingDetector {

    private static final Logger logger = LogManager.getLogger(GapDetector.class);

    public static final String NAME = "gaps";
    public static final String PATTERN_TYPE = "time";
    public static final String SUBTYPE = "communication_gap";

    private static final DateTimeFormatter DESCRIPTION_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final double SECONDS_PER_HOUR = 3600.0;

    private final double defaultMinGapHours;

    public GapDetector() {
        this(AnalysisConfig.defaults().minGapHours());
    }

    public GapDetector(double defaultMinGapHours) {
        if (!(defaultMinGapHours > 0)) {
            throw new IllegalArgumentException("min gap hours must be positive, got " + defaultMinGapHours);
        }
        this.defaultMinGapHours = defaultMinGapHours;
    }

    /// One silence between two records.
    ///
    /// @param startTime timestamp of the record before the gap
    /// @param endTime timestamp of the record after the gap
    /// @param durationHours gap length
    /// @param significance gap length over the typical interval
    /// @param lastContact counterparty of the record before the gap
    /// @param nextContact counterparty of the record after the gap
    /// @param description human readable summary
    public record Gap(
        LocalDateTime startTime,
        LocalDateTime endTime,
        double durationHours,
        double significance,
        String lastContact,
        String nextContact,
        String description
    ) {
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public DetectorOutput analyze(RecordTable table, Map<String, Object> params) {
        double minGapHours;
        try {
            minGapHours = minGapHours(params);
        } catch (IllegalArgumentException e) {
            return DetectorOutput.failed(e.getMessage());
        }

        List<Gap> gaps = findGaps(table.sortedByTime(), minGapHours);
        List<Pattern> patterns = new ArrayList<>(gaps.size());
        for (Gap gap : gaps) {
            patterns.add(toPattern(gap));
        }

        Map<String, Object> values = new LinkedHashMap<>();
        values.put("min_gap_hours", minGapHours);
        values.put("gap_count", gaps.size());
        values.put("gaps", gaps);
        logger.debug("Found {} gaps of at least {} hours in {} records", gaps.size(), minGapHours, table.size());
        return DetectorOutput.of(patterns, List.of(), values);
    }

    /// @param sorted records in time order
    /// @param minGapHours the shortest interval reported
    /// @return gaps, longest first
    List<Gap> findGaps(List<CommRecord> sorted, double minGapHours) {
        if (sorted.size() < 2) {
            return List.of();
        }
        double[] intervals = new double[sorted.size() - 1];
        for (int i = 0; i < intervals.length; i++) {
            Duration between = Duration.between(sorted.get(i).timestamp(), sorted.get(i + 1).timestamp());
            intervals[i] = between.toMillis() / 1000.0 / SECONDS_PER_HOUR;
        }
        double typical = typicalInterval(intervals);

        List<Gap> gaps = new ArrayList<>();
        for (int i = 0; i < intervals.length; i++) {
            if (intervals[i] < minGapHours) {
                continue;
            }
            CommRecord before = sorted.get(i);
            CommRecord after = sorted.get(i + 1);
            double hours = intervals[i];
            gaps.add(new Gap(
                before.timestamp(),
                after.timestamp(),
                hours,
                hours / typical,
                before.counterparty(),
                after.counterparty(),
                String.format(Locale.ROOT, "Gap of %.1f hours from %s to %s", hours,
                    DESCRIPTION_FORMAT.format(before.timestamp()), DESCRIPTION_FORMAT.format(after.timestamp()))
            ));
        }
        gaps.sort(Comparator.comparingDouble(Gap::durationHours).reversed());
        return gaps;
    }

    // Median interval; the mean stands in when most records share a timestamp.
    static double typicalInterval(double[] intervals) {
        double[] sorted = intervals.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        double median = n % 2 == 1 ? sorted[n / 2] : (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
        if (median > 0) {
            return median;
        }
        return Arrays.stream(sorted).average().orElse(1.0);
    }

    private static Pattern toPattern(Gap gap) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("start_time", gap.startTime().toString());
        metadata.put("end_time", gap.endTime().toString());
        metadata.put("duration_hours", gap.durationHours());
        metadata.put("last_contact", gap.lastContact());
        metadata.put("next_contact", gap.nextContact());
        double confidence = Math.min(1.0, gap.significance() / 10.0);
        return Pattern.of(PATTERN_TYPE, SUBTYPE, gap.description(), gap.significance(), confidence, 1, metadata);
    }

    private double minGapHours(Map<String, Object> params) {
        Object value = params == null ? null : params.get(PatternOrchestrator.MIN_GAP_HOURS);
        if (value == null) {
            return defaultMinGapHours;
        }
        double hours;
        if (value instanceof Number) {
            hours = ((Number) value).doubleValue();
        } else {
            try {
                hours = Double.parseDouble(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid min_gap_hours: " + value, e);
            }
        }
        if (!(hours > 0) || Double.isInfinite(hours)) {
            throw new IllegalArgumentException("min_gap_hours must be positive, got " + value);
        }
        return hours;
    }
}
