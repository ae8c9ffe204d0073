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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shape of a latency sample.
 *
 * <h2>Statistics</h2>
 * <ul>
 *   <li><b>mean</b>, <b>stdDev</b> - sample standard deviation (n-1), 0 for a single value</li>
 *   <li><b>min</b>, <b>max</b></li>
 *   <li><b>p25 .. p95</b> - percentiles by linear interpolation between closest ranks</li>
 *   <li><b>skewness</b> - population skewness, 0 when the sample has no spread</li>
 *   <li><b>kurtosis</b> - raw kurtosis (3 = normal), 3 when the sample has no spread</li>
 *   <li><b>histogram</b> - counts per latency band, upper bound exclusive</li>
 * </ul>
 *
 * @param count number of latencies
 * @param mean arithmetic mean
 * @param stdDev sample standard deviation
 * @param min smallest latency
 * @param max largest latency
 * @param p25 25th percentile
 * @param p50 median
 * @param p75 75th percentile
 * @param p90 90th percentile
 * @param p95 95th percentile
 * @param skewness population skewness
 * @param kurtosis raw kurtosis
 * @param histogram band label to count, in ascending band order
 */
public record LatencyDistribution(
    int count,
    double mean,
    double stdDev,
    double min,
    double max,
    double p25,
    double p50,
    double p75,
    double p90,
    double p95,
    double skewness,
    double kurtosis,
    Map<String, Integer> histogram
) {

    /** Band edges in seconds. The last band is open ended. */
    static final double[] HISTOGRAM_EDGES = {0, 60, 300, 900, 1800, 3600, 7200, 86400};

    private static final String[] HISTOGRAM_LABELS = {
        "0-1m", "1-5m", "5-15m", "15-30m", "30m-1h", "1-2h", "2-24h", "24h+"
    };

    /**
     * Computes the distribution of a latency sample.
     *
     * @param latencies latencies in seconds, at least one
     * @return the distribution
     * @throws IllegalArgumentException if the sample is empty
     */
    public static LatencyDistribution of(double[] latencies) {
        if (latencies.length == 0) {
            throw new IllegalArgumentException("Cannot describe an empty latency sample");
        }
        double[] sorted = latencies.clone();
        Arrays.sort(sorted);
        int n = sorted.length;

        double sum = 0;
        for (double v : sorted) {
            sum += v;
        }
        double mean = sum / n;

        double m2 = 0;
        double m3 = 0;
        double m4 = 0;
        for (double v : sorted) {
            double diff = v - mean;
            double diff2 = diff * diff;
            m2 += diff2;
            m3 += diff2 * diff;
            m4 += diff2 * diff2;
        }
        double populationVariance = m2 / n;
        double stdDev = n > 1 ? Math.sqrt(m2 / (n - 1)) : 0.0;
        double skewness = 0;
        double kurtosis = 3;
        if (populationVariance > 0) {
            double populationStd = Math.sqrt(populationVariance);
            skewness = (m3 / n) / (populationStd * populationStd * populationStd);
            kurtosis = (m4 / n) / (populationVariance * populationVariance);
        }

        return new LatencyDistribution(
            n, mean, stdDev, sorted[0], sorted[n - 1],
            percentile(sorted, 25), percentile(sorted, 50), percentile(sorted, 75),
            percentile(sorted, 90), percentile(sorted, 95),
            skewness, kurtosis, histogram(sorted));
    }

    /**
     * Linear interpolation between the two closest ranks.
     *
     * @param sorted ascending values, not empty
     * @param p percentile in [0, 100]
     * @return the interpolated value
     */
    static double percentile(double[] sorted, double p) {
        double index = (p / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(index);
        int upper = (int) Math.ceil(index);
        if (lower == upper) {
            return sorted[lower];
        }
        double frac = index - lower;
        return sorted[lower] * (1 - frac) + sorted[upper] * frac;
    }

    private static Map<String, Integer> histogram(double[] sorted) {
        int[] counts = new int[HISTOGRAM_EDGES.length];
        for (double v : sorted) {
            int band = HISTOGRAM_EDGES.length - 1;
            for (int i = 1; i < HISTOGRAM_EDGES.length; i++) {
                if (v < HISTOGRAM_EDGES[i]) {
                    band = i - 1;
                    break;
                }
            }
            counts[band]++;
        }
        Map<String, Integer> histogram = new LinkedHashMap<>();
        for (int i = 0; i < counts.length; i++) {
            histogram.put(HISTOGRAM_LABELS[i], counts[i]);
        }
        return histogram;
    }

    /** @return the interquartile range */
    public double iqr() {
        return p75 - p25;
    }

    public double lowerFence() {
        return p25 - 1.5 * iqr();
    }

    public double upperFence() {
        return p75 + 1.5 * iqr();
    }

    /**
     * @param latency a latency in seconds
     * @return true when the latency lies outside the 1.5 x IQR fences
     */
    public boolean isOutlier(double latency) {
        return latency < lowerFence() || latency > upperFence();
    }
}
