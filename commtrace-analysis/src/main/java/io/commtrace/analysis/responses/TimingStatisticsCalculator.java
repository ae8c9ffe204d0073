package io.commtrace.analysis.responses;

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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.DayOfWeek;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

/// Aggregates response pairs into [ResponseTimeStatistics].
///
/// Outliers use the 1.5 x IQR rule over all pair latencies, with quartiles by linear
/// interpolation. Hour and day groupings use the timestamp of the reply.
public final class TimingStatisticsCalculator {

    private static final Logger logger = LogManager.getLogger(TimingStatisticsCalculator.class);

    private final double quickThresholdSeconds;
    private final double delayedThresholdSeconds;

    public TimingStatisticsCalculator(AnalysisConfig config) {
        this(config.quickThresholdSeconds(), config.delayedThresholdSeconds());
    }

    public TimingStatisticsCalculator(double quickThresholdSeconds, double delayedThresholdSeconds) {
        this.quickThresholdSeconds = quickThresholdSeconds;
        this.delayedThresholdSeconds = delayedThresholdSeconds;
    }

    /// @param pairs response pairs, possibly empty
    /// @return the statistics; [ResponseTimeStatistics#empty()] for no pairs
    public ResponseTimeStatistics compute(List<ResponsePair> pairs) {
        if (pairs.isEmpty()) {
            logger.debug("No response pairs, returning empty timing statistics");
            return ResponseTimeStatistics.empty();
        }

        double[] latencies = new double[pairs.size()];
        for (int i = 0; i < latencies.length; i++) {
            latencies[i] = pairs.get(i).latencySeconds();
        }
        LatencyDistribution distribution = LatencyDistribution.of(latencies);

        List<ResponsePair> classified = classify(pairs, distribution);
        List<ResponsePair> outliers = new ArrayList<>();
        int quick = 0;
        int delayed = 0;
        for (ResponsePair pair : classified) {
            if (pair.isOutlier()) {
                outliers.add(pair);
            }
            if (pair.isQuick()) {
                quick++;
            }
            if (pair.isDelayed()) {
                delayed++;
            }
        }

        Map<String, Double> perCounterparty = new TreeMap<>();
        meanBy(pairs, ResponsePair::counterparty, perCounterparty);
        Map<Integer, Double> byHour = new TreeMap<>();
        meanBy(pairs, p -> p.sentAt().getHour(), byHour);
        Map<DayOfWeek, Double> byDayOfWeek = new EnumMap<>(DayOfWeek.class);
        meanBy(pairs, p -> p.sentAt().getDayOfWeek(), byDayOfWeek);
        Map<String, Double> byDay = new LinkedHashMap<>();
        byDayOfWeek.forEach((day, mean) -> byDay.put(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH), mean));

        List<String> quickResponders = new ArrayList<>();
        List<String> delayedResponders = new ArrayList<>();
        perCounterparty.forEach((counterparty, mean) -> {
            if (mean < quickThresholdSeconds) {
                quickResponders.add(counterparty);
            } else if (mean > delayedThresholdSeconds) {
                delayedResponders.add(counterparty);
            }
        });

        ResponseTimeStatistics statistics = new ResponseTimeStatistics(
            distribution.mean(),
            distribution.p50(),
            pairs.size(),
            distribution,
            perCounterparty,
            byHour,
            byDay,
            timeOfDayEffects(byHour),
            bestHour(byHour),
            quick,
            delayed,
            quickResponders,
            delayedResponders,
            outliers);
        logger.debug("Timing statistics: {} pairs, mean {}s, {} outliers", pairs.size(),
            distribution.mean(), outliers.size());
        return statistics;
    }

    /// Flags each pair against the distribution fences and the quick/delayed thresholds.
    ///
    /// @param pairs the pairs the distribution was computed from
    /// @param distribution their distribution
    /// @return classified copies in the same order
    public List<ResponsePair> classify(List<ResponsePair> pairs, LatencyDistribution distribution) {
        List<ResponsePair> classified = new ArrayList<>(pairs.size());
        for (ResponsePair pair : pairs) {
            double latency = pair.latencySeconds();
            classified.add(pair.classified(
                distribution.isOutlier(latency),
                latency < quickThresholdSeconds,
                latency > delayedThresholdSeconds));
        }
        return classified;
    }

    private static Map<String, Double> timeOfDayEffects(Map<Integer, Double> byHour) {
        Map<String, double[]> sums = new LinkedHashMap<>();
        sums.put("morning", new double[2]);
        sums.put("afternoon", new double[2]);
        sums.put("evening", new double[2]);
        byHour.forEach((hour, mean) -> {
            double[] acc = sums.get(periodOf(hour));
            acc[0] += mean;
            acc[1]++;
        });
        Map<String, Double> effects = new LinkedHashMap<>();
        sums.forEach((period, acc) -> {
            if (acc[1] > 0) {
                effects.put(period, acc[0] / acc[1]);
            }
        });
        return effects;
    }

    static String periodOf(int hour) {
        if (hour >= 5 && hour < 12) {
            return "morning";
        }
        if (hour >= 12 && hour < 18) {
            return "afternoon";
        }
        return "evening";
    }

    private static Integer bestHour(Map<Integer, Double> byHour) {
        Integer best = null;
        double bestMean = Double.POSITIVE_INFINITY;
        for (Map.Entry<Integer, Double> entry : byHour.entrySet()) {
            if (entry.getValue() < bestMean) {
                best = entry.getKey();
                bestMean = entry.getValue();
            }
        }
        return best;
    }

    private static <K> void meanBy(List<ResponsePair> pairs, Function<ResponsePair, K> key,
                                   Map<K, Double> target) {
        Map<K, double[]> acc = new LinkedHashMap<>();
        for (ResponsePair pair : pairs) {
            double[] sum = acc.computeIfAbsent(key.apply(pair), k -> new double[2]);
            sum[0] += pair.latencySeconds();
            sum[1]++;
        }
        acc.forEach((k, sum) -> target.put(k, sum[0] / sum[1]));
    }
}
