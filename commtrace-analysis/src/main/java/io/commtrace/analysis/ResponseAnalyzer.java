package io.commtrace.analysis;

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
import io.commtrace.analysis.anomaly.AnomalyDetector;
import io.commtrace.analysis.cache.CacheKey;
import io.commtrace.analysis.cache.NoOpResultCache;
import io.commtrace.analysis.cache.ResultCache;
import io.commtrace.analysis.cache.TtlResultCache;
import io.commtrace.analysis.config.AnalysisConfig;
import io.commtrace.analysis.flows.ConversationFlowAnalyzer;
import io.commtrace.analysis.flows.ConversationFlowSummary;
import io.commtrace.analysis.ml.Augmentation;
import io.commtrace.analysis.ml.AugmentationService;
import io.commtrace.analysis.ml.ModelNotTrainedException;
import io.commtrace.analysis.reciprocity.ReciprocityAnalyzer;
import io.commtrace.analysis.reciprocity.ReciprocityReport;
import io.commtrace.analysis.responses.ResponsePair;
import io.commtrace.analysis.responses.ResponsePairExtractor;
import io.commtrace.analysis.responses.ResponseTimeStatistics;
import io.commtrace.analysis.responses.TimingStatisticsCalculator;
import io.commtrace.analysis.result.ResponseAnalysisReport;
import io.commtrace.analysis.result.SubAnalysisResult;
import io.commtrace.records.FieldAliases;
import io.commtrace.records.RecordTable;
import io.commtrace.records.RecordValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Response timing, reciprocity, conversation flow and anomaly analysis of one record table.
///
/// ## Pipeline
///
/// ```
/// RecordTable ─┬─> ResponsePairExtractor ─> TimingStatisticsCalculator ──┐
///              ├─> ReciprocityAnalyzer ───────────────────────────────────┼─> AnomalyDetector
///              └─> ConversationFlowAnalyzer                               │
///                                                                         v
///                                                         ResponseAnalysisReport (+ ML augmentation)
/// ```
///
/// ## Error handling
///
/// | Failure | Outcome |
/// |---------|---------|
/// | empty table, invalid rows | [ResponseAnalysisReport#failed(String)], nothing computed |
/// | exception inside one sub-analysis | that section becomes a failure stub, the rest still computed |
/// | exception in timing statistics | additionally sets the report's top-level error |
/// | cache failure | logged and listed in [ResponseAnalysisReport#warnings()] |
/// | ML failure | recorded as `ml_error` |
///
/// No exception escapes [#analyze(RecordTable, FieldAliases)] or [#analyzeRows(List, FieldAliases)].
///
/// ## Usage
///
/// ```java
/// ResponseAnalyzer analyzer = ResponseAnalyzer.builder()
///     .config(AnalysisConfig.load(Path.of("commtrace.yaml")))
///     .cacheResults()
///     .build();
/// ResponseAnalysisReport report = analyzer.analyze(table, FieldAliases.STANDARD);
/// ```
public class ResponseAnalyzer {

    private static final Logger logger = LogManager.getLogger(ResponseAnalyzer.class);

    public static final String OPERATION = "analyze_response_patterns";

    private final AnalysisConfig config;
    private final ResultCache cache;
    private final AugmentationService augmentationService;

    private final ResponsePairExtractor pairExtractor;
    private final TimingStatisticsCalculator timingCalculator;
    private final ReciprocityAnalyzer reciprocityAnalyzer;
    private final ConversationFlowAnalyzer flowAnalyzer;
    private final AnomalyDetector anomalyDetector;

    protected ResponseAnalyzer(Builder builder) {
        this.config = builder.config;
        this.cache = builder.cacheFromConfig ? new TtlResultCache(config) : builder.cache;
        this.augmentationService = builder.augmentationService;
        this.pairExtractor = new ResponsePairExtractor();
        this.timingCalculator = new TimingStatisticsCalculator(config);
        this.reciprocityAnalyzer = new ReciprocityAnalyzer(config);
        this.flowAnalyzer = new ConversationFlowAnalyzer(config);
        this.anomalyDetector = builder.anomalyDetector != null ? builder.anomalyDetector : new AnomalyDetector();
    }

    public ResponseAnalyzer() {
        this(builder());
    }

    public static Builder builder() {
        return new Builder();
    }

    public AnalysisConfig config() {
        return config;
    }

    /// @return the cache results are stored in
    public ResultCache cache() {
        return cache;
    }

    /// Validates raw rows and analyzes them.
    ///
    /// @param rows rows keyed by column name
    /// @param aliases column aliases, null for the standard names
    /// @return the report; a failed report when the rows do not validate
    public ResponseAnalysisReport analyzeRows(List<? extends Map<String, ?>> rows, FieldAliases aliases) {
        RecordTable table;
        try {
            table = RecordTable.fromRows(rows, aliases);
        } catch (RecordValidationException | IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            return ResponseAnalysisReport.failed(SubAnalysisResult.describe(e));
        }
        return analyze(table, aliases);
    }

    /// @param table validated records
    /// @param aliases aliases the records were loaded with, passed on to the ML service
    /// @return the report
    public ResponseAnalysisReport analyze(RecordTable table, FieldAliases aliases) {
        if (table == null || table.isEmpty()) {
            logger.error("Cannot analyze empty data");
            return ResponseAnalysisReport.failed("cannot analyze empty data");
        }

        CacheKey key = CacheKey.of(OPERATION, table, config.asMap());
        String cacheWarning = null;
        try {
            Optional<ResponseAnalysisReport> cached = cache.get(key, ResponseAnalysisReport.class);
            if (cached.isPresent()) {
                logger.debug("Using cached response analysis for {} records", table.size());
                return cached.get();
            }
        } catch (RuntimeException e) {
            logger.warn("Cache lookup failed: {}", e.getMessage(), e);
            cacheWarning = "cache: " + SubAnalysisResult.describe(e);
        }

        ResponseAnalysisReport report = compute(table);
        report = augment(report, table, aliases);

        try {
            cache.put(key, report);
        } catch (RuntimeException e) {
            logger.warn("Cache store failed: {}", e.getMessage(), e);
            report = report.withWarning("cache: " + SubAnalysisResult.describe(e));
        }
        if (cacheWarning != null) {
            report = report.withWarning(cacheWarning);
        }
        logger.info("Response analysis complete: {} records, {} anomalies{}", table.size(),
            report.anomalies().size(), report.error().map(e -> " (" + e + ")").orElse(""));
        return report;
    }

    private ResponseAnalysisReport compute(RecordTable table) {
        SubAnalysisResult<ResponseTimeStatistics> timing = SubAnalysisResult.capture("response time analysis",
            () -> computeTiming(table));
        SubAnalysisResult<ReciprocityReport> reciprocity = SubAnalysisResult.capture("reciprocity analysis",
            () -> computeReciprocity(table));
        SubAnalysisResult<ConversationFlowSummary> flows = SubAnalysisResult.capture("conversation flow analysis",
            () -> computeFlows(table));
        SubAnalysisResult<List<Anomaly>> anomalies = SubAnalysisResult.capture("anomaly detection",
            () -> anomalyDetector.detect(timing.valueOrNull(), reciprocity.valueOrNull()));

        logFailure(timing);
        logFailure(reciprocity);
        logFailure(flows);
        logFailure(anomalies);
        return ResponseAnalysisReport.of(timing, reciprocity, flows, anomalies, table.size());
    }

    protected ResponseTimeStatistics computeTiming(RecordTable table) {
        return timingCalculator.compute(pairExtractor.extract(table));
    }

    protected ReciprocityReport computeReciprocity(RecordTable table) {
        return reciprocityAnalyzer.analyze(table);
    }

    protected ConversationFlowSummary computeFlows(RecordTable table) {
        return flowAnalyzer.analyze(table);
    }

    private static void logFailure(SubAnalysisResult<?> result) {
        result.error().ifPresent(e -> logger.warn("Sub-analysis degraded: {}", e));
    }

    private ResponseAnalysisReport augment(ResponseAnalysisReport report, RecordTable table, FieldAliases aliases) {
        if (augmentationService == null) {
            return report;
        }
        Optional<Augmentation> augmentation;
        try {
            augmentation = augmentationService.predict(AugmentationService.PATTERN_MODEL, table, aliases);
        } catch (ModelNotTrainedException | RuntimeException e) {
            logger.warn("ML augmentation unavailable: {}", e.getMessage());
            return report.withMlError(SubAnalysisResult.describe(e));
        }
        if (augmentation.isEmpty()) {
            return report;
        }
        return report.withAugmentation(augmentation.get(), modelAnomalies(augmentation.get()));
    }

    private static List<Anomaly> modelAnomalies(Augmentation augmentation) {
        List<Anomaly> converted = new ArrayList<>();
        for (Map<String, Object> entry : augmentation.anomalies()) {
            try {
                converted.add(Anomaly.fromMap(entry));
            } catch (IllegalArgumentException e) {
                logger.warn("Skipping malformed anomaly from {}: {}", augmentation.modelName(), e.getMessage());
            }
        }
        return converted;
    }

    /// Predicts the reply latency toward one counterparty.
    ///
    /// A trained response model is preferred when one is wired and it returns any predictions;
    /// a missing `expected_response_time` falls back to the counterparty's mean latency and a
    /// missing `confidence` to 0.5. Without a model the mean latency is used, with confidence
    /// growing with the counterparty's record count up to 0.5.
    ///
    /// @param table the records
    /// @param counterparty the counterparty
    /// @param aliases aliases the records were loaded with
    /// @return the prediction; a prediction with `error` set when none can be made
    public ResponsePrediction predictResponseBehavior(RecordTable table, String counterparty, FieldAliases aliases) {
        if (counterparty == null || counterparty.isBlank()) {
            return ResponsePrediction.failed(counterparty, "contact identifier cannot be empty");
        }
        if (table == null || table.isEmpty()) {
            logger.warn("Cannot predict with empty data");
            return ResponsePrediction.failed(counterparty, "cannot predict with empty data");
        }
        RecordTable contactTable = table.forCounterparty(counterparty);
        if (contactTable.isEmpty()) {
            return ResponsePrediction.failed(counterparty, "no data found for contact: " + counterparty);
        }

        List<ResponsePair> pairs = pairExtractor.extract(contactTable);
        ResponseTimeStatistics timing = timingCalculator.compute(pairs);
        Double average = timing.averageResponseTimeSeconds();
        if (average == null) {
            return new ResponsePrediction(counterparty, null, 0.1, null, null, "insufficient data for prediction");
        }

        if (augmentationService != null) {
            try {
                Optional<Augmentation> prediction =
                    augmentationService.predict(AugmentationService.RESPONSE_MODEL, contactTable, aliases);
                if (prediction.isPresent() && !prediction.get().predictions().isEmpty()) {
                    Map<String, Object> values = prediction.get().predictions();
                    double expected = toDouble(values.get("expected_response_time"), average);
                    double confidence = Math.max(0, Math.min(1, toDouble(values.get("confidence"), 0.5)));
                    String modelName = prediction.get().modelName() != null
                        ? prediction.get().modelName() : AugmentationService.RESPONSE_MODEL;
                    return new ResponsePrediction(counterparty, expected, confidence, ResponsePrediction.MODEL,
                        modelName, null);
                }
            } catch (ModelNotTrainedException | RuntimeException e) {
                logger.warn("ML prediction failed: {}. Using statistical prediction instead.", e.getMessage());
            }
        }

        double confidence = Math.min(0.1 + (contactTable.size() / 100.0) * 0.4, 0.5);
        return new ResponsePrediction(counterparty, average, confidence, ResponsePrediction.STATISTICAL, null, null);
    }

    private static double toDouble(Object value, double fallback) {
        return value instanceof Number ? ((Number) value).doubleValue() : fallback;
    }

    /// Builder for [ResponseAnalyzer].
    public static class Builder {
        private AnalysisConfig config = AnalysisConfig.defaults();
        private ResultCache cache = NoOpResultCache.INSTANCE;
        private AugmentationService augmentationService;
        private AnomalyDetector anomalyDetector;
        private boolean cacheFromConfig;

        protected Builder() {
        }

        public Builder config(AnalysisConfig config) {
            this.config = Objects.requireNonNull(config, "config cannot be null");
            return this;
        }

        /// @param cache shared cache; defaults to a cache that stores nothing
        public Builder cache(ResultCache cache) {
            this.cache = Objects.requireNonNull(cache, "cache cannot be null");
            this.cacheFromConfig = false;
            return this;
        }

        /// Caches results in a new [TtlResultCache] whose entry lifetime is the configured
        /// `analysis.cache.ttl_seconds`. Replaces any cache given to [#cache(ResultCache)].
        public Builder cacheResults() {
            this.cacheFromConfig = true;
            return this;
        }

        /// @param service optional model service, null to disable augmentation
        public Builder augmentationService(AugmentationService service) {
            this.augmentationService = service;
            return this;
        }

        public Builder anomalyDetector(AnomalyDetector detector) {
            this.anomalyDetector = detector;
            return this;
        }

        public ResponseAnalyzer build() {
            return new ResponseAnalyzer(this);
        }
    }
}
