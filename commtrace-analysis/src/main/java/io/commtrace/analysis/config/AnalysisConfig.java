package io.commtrace.analysis.config;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/// Tunable thresholds for the analysis engine.
///
/// ## Keys
///
/// | Key | Default | Used by |
/// |-----|---------|---------|
/// | `analysis.response.quick_threshold_sec` | 300 | quick pair count, quick responders |
/// | `analysis.response.delayed_threshold_sec` | 3600 | delayed pair count, delayed responders |
/// | `analysis.response.conversation_timeout_hours` | 1.0 | global conversation segmentation |
/// | `analysis.reciprocity.balance_low` | 0.4 | relationship balance |
/// | `analysis.reciprocity.balance_high` | 0.6 | relationship balance |
/// | `analysis.reciprocity.conversation_timeout_seconds` | 3600 | per-counterparty initiation segmentation |
/// | `analysis.cache.ttl_seconds` | 3600 | [io.commtrace.analysis.cache.TtlResultCache#TtlResultCache(AnalysisConfig)] |
/// | `analysis.gaps.min_gap_hours` | 24 | gap detector |
///
/// ## Loading
///
/// ```java
/// AnalysisConfig config = AnalysisConfig.load(Path.of("commtrace.yaml"));
/// ```
///
/// YAML may use flat dotted keys (`analysis.response.quick_threshold_sec: 120`) or nested
/// maps (`analysis: {response: {quick_threshold_sec: 120}}`). Unknown keys are logged and ignored.
public final class AnalysisConfig {

    private static final Logger logger = LogManager.getLogger(AnalysisConfig.class);

    public static final String QUICK_THRESHOLD_SEC = "analysis.response.quick_threshold_sec";
    public static final String DELAYED_THRESHOLD_SEC = "analysis.response.delayed_threshold_sec";
    public static final String CONVERSATION_TIMEOUT_HOURS = "analysis.response.conversation_timeout_hours";
    public static final String BALANCE_LOW = "analysis.reciprocity.balance_low";
    public static final String BALANCE_HIGH = "analysis.reciprocity.balance_high";
    public static final String RECIPROCITY_TIMEOUT_SECONDS = "analysis.reciprocity.conversation_timeout_seconds";
    public static final String CACHE_TTL_SECONDS = "analysis.cache.ttl_seconds";
    public static final String MIN_GAP_HOURS = "analysis.gaps.min_gap_hours";

    private static final Set<String> KNOWN_KEYS = Set.of(
        QUICK_THRESHOLD_SEC, DELAYED_THRESHOLD_SEC, CONVERSATION_TIMEOUT_HOURS,
        BALANCE_LOW, BALANCE_HIGH, RECIPROCITY_TIMEOUT_SECONDS, CACHE_TTL_SECONDS, MIN_GAP_HOURS);

    private final double quickThresholdSeconds;
    private final double delayedThresholdSeconds;
    private final Duration conversationTimeout;
    private final double balanceLow;
    private final double balanceHigh;
    private final Duration reciprocityTimeout;
    private final Duration cacheTtl;
    private final double minGapHours;

    private AnalysisConfig(Builder builder) {
        this.quickThresholdSeconds = builder.quickThresholdSeconds;
        this.delayedThresholdSeconds = builder.delayedThresholdSeconds;
        this.conversationTimeout = builder.conversationTimeout;
        this.balanceLow = builder.balanceLow;
        this.balanceHigh = builder.balanceHigh;
        this.reciprocityTimeout = builder.reciprocityTimeout;
        this.cacheTtl = builder.cacheTtl;
        this.minGapHours = builder.minGapHours;
    }

    /// @return configuration with every default
    public static AnalysisConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /// Loads a YAML configuration file. Keys not present keep their default.
    ///
    /// @param path the YAML file
    /// @return the configuration
    /// @throws IOException if the file cannot be read
    /// @throws IllegalArgumentException if a value is not numeric or violates a constraint
    public static AnalysisConfig load(Path path) throws IOException {
        String yaml = Files.readString(path);
        return fromYaml(yaml);
    }

    /// Parses YAML text into a configuration.
    ///
    /// @param yaml the YAML document
    /// @return the configuration
    /// @throws IllegalArgumentException if the text is not valid YAML or holds invalid values
    public static AnalysisConfig fromYaml(String yaml) {
        LoadSettings settings = LoadSettings.builder().build();
        Load load = new Load(settings);
        Object document;
        try {
            document = load.loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Invalid YAML configuration: " + e.getMessage(), e);
        }
        if (document == null) {
            return defaults();
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Configuration must be a YAML mapping, got "
                + document.getClass().getSimpleName());
        }
        Map<String, Object> flat = new LinkedHashMap<>();
        flatten("", (Map<?, ?>) document, flat);
        return fromMap(flat);
    }

    /// Builds a configuration from flat dotted keys.
    ///
    /// @param values dotted key to numeric value (numbers or numeric strings)
    /// @return the configuration
    public static AnalysisConfig fromMap(Map<String, ?> values) {
        Builder builder = builder();
        for (Map.Entry<String, ?> entry : values.entrySet()) {
            String key = entry.getKey();
            if (!KNOWN_KEYS.contains(key)) {
                logger.warn("Ignoring unknown configuration key '{}'", key);
                continue;
            }
            double value = toDouble(key, entry.getValue());
            switch (key) {
                case QUICK_THRESHOLD_SEC:
                    builder.quickThresholdSeconds(value);
                    break;
                case DELAYED_THRESHOLD_SEC:
                    builder.delayedThresholdSeconds(value);
                    break;
                case CONVERSATION_TIMEOUT_HOURS:
                    builder.conversationTimeout(Duration.ofMillis(Math.round(value * 3_600_000d)));
                    break;
                case BALANCE_LOW:
                    builder.balanceLow(value);
                    break;
                case BALANCE_HIGH:
                    builder.balanceHigh(value);
                    break;
                case RECIPROCITY_TIMEOUT_SECONDS:
                    builder.reciprocityTimeout(Duration.ofMillis(Math.round(value * 1000d)));
                    break;
                case CACHE_TTL_SECONDS:
                    builder.cacheTtl(Duration.ofMillis(Math.round(value * 1000d)));
                    break;
                case MIN_GAP_HOURS:
                    builder.minGapHours(value);
                    break;
                default:
                    throw new IllegalStateException("Unhandled key: " + key);
            }
        }
        return builder.build();
    }

    private static void flatten(String prefix, Map<?, ?> node, Map<String, Object> out) {
        for (Map.Entry<?, ?> entry : node.entrySet()) {
            String key = prefix.isEmpty() ? String.valueOf(entry.getKey()) : prefix + "." + entry.getKey();
            if (entry.getValue() instanceof Map) {
                flatten(key, (Map<?, ?>) entry.getValue(), out);
            } else {
                out.put(key, entry.getValue());
            }
        }
    }

    private static double toDouble(String key, Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        try {
            return Double.parseDouble(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration key '" + key + "' requires a number, got '"
                + value + "'", e);
        }
    }

    public double quickThresholdSeconds() {
        return quickThresholdSeconds;
    }

    public double delayedThresholdSeconds() {
        return delayedThresholdSeconds;
    }

    /// @return inactivity gap that separates globally segmented conversations
    public Duration conversationTimeout() {
        return conversationTimeout;
    }

    public double balanceLow() {
        return balanceLow;
    }

    public double balanceHigh() {
        return balanceHigh;
    }

    /// @return inactivity gap that separates conversations when counting initiations
    public Duration reciprocityTimeout() {
        return reciprocityTimeout;
    }

    public Duration cacheTtl() {
        return cacheTtl;
    }

    public double minGapHours() {
        return minGapHours;
    }

    /// @return the effective values keyed by their dotted names
    public Map<String, Object> asMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(QUICK_THRESHOLD_SEC, quickThresholdSeconds);
        map.put(DELAYED_THRESHOLD_SEC, delayedThresholdSeconds);
        map.put(CONVERSATION_TIMEOUT_HOURS, seconds(conversationTimeout) / 3600d);
        map.put(BALANCE_LOW, balanceLow);
        map.put(BALANCE_HIGH, balanceHigh);
        map.put(RECIPROCITY_TIMEOUT_SECONDS, seconds(reciprocityTimeout));
        map.put(CACHE_TTL_SECONDS, seconds(cacheTtl));
        map.put(MIN_GAP_HOURS, minGapHours);
        return map;
    }

    // Duration.toMillis overflows for unbounded timeouts.
    private static double seconds(Duration duration) {
        return duration.getSeconds() + duration.getNano() / 1e9;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AnalysisConfig)) {
            return false;
        }
        return asMap().equals(((AnalysisConfig) o).asMap());
    }

    @Override
    public int hashCode() {
        return asMap().hashCode();
    }

    @Override
    public String toString() {
        return "AnalysisConfig" + asMap();
    }

    /// Builder for [AnalysisConfig]. Every setting starts at its documented default.
    public static final class Builder {
        private double quickThresholdSeconds = 300;
        private double delayedThresholdSeconds = 3600;
        private Duration conversationTimeout = Duration.ofHours(1);
        private double balanceLow = 0.4;
        private double balanceHigh = 0.6;
        private Duration reciprocityTimeout = Duration.ofSeconds(3600);
        private Duration cacheTtl = Duration.ofSeconds(3600);
        private double minGapHours = 24;

        private Builder() {
        }

        public Builder quickThresholdSeconds(double seconds) {
            this.quickThresholdSeconds = seconds;
            return this;
        }

        public Builder delayedThresholdSeconds(double seconds) {
            this.delayedThresholdSeconds = seconds;
            return this;
        }

        public Builder conversationTimeout(Duration timeout) {
            this.conversationTimeout = Objects.requireNonNull(timeout, "timeout cannot be null");
            return this;
        }

        public Builder balanceLow(double low) {
            this.balanceLow = low;
            return this;
        }

        public Builder balanceHigh(double high) {
            this.balanceHigh = high;
            return this;
        }

        public Builder reciprocityTimeout(Duration timeout) {
            this.reciprocityTimeout = Objects.requireNonNull(timeout, "timeout cannot be null");
            return this;
        }

        public Builder cacheTtl(Duration ttl) {
            this.cacheTtl = Objects.requireNonNull(ttl, "ttl cannot be null");
            return this;
        }

        public Builder minGapHours(double hours) {
            this.minGapHours = hours;
            return this;
        }

        /// @return the configuration
        /// @throws IllegalArgumentException if thresholds are negative, the balance band is inverted, or
        ///     the cache ttl or minimum gap is not positive
        public AnalysisConfig build() {
            if (quickThresholdSeconds < 0 || delayedThresholdSeconds < 0) {
                throw new IllegalArgumentException("Response thresholds must be non-negative");
            }
            if (balanceLow < 0 || balanceHigh > 1 || balanceLow > balanceHigh) {
                throw new IllegalArgumentException("Balance thresholds must satisfy 0 <= low <= high <= 1, got low="
                    + balanceLow + ", high=" + balanceHigh);
            }
            if (conversationTimeout.isNegative() || reciprocityTimeout.isNegative()) {
                throw new IllegalArgumentException("Conversation timeouts must be non-negative");
            }
            if (cacheTtl.isNegative() || cacheTtl.isZero()) {
                throw new IllegalArgumentException("Cache ttl must be positive");
            }
            if (!(minGapHours > 0)) {
                throw new IllegalArgumentException("min_gap_hours must be positive");
            }
            return new AnalysisConfig(this);
        }
    }
}
