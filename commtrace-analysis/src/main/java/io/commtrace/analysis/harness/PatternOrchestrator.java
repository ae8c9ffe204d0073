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

import io.commtrace.analysis.ResponseAnalyzer;
import io.commtrace.analysis.anomaly.Anomaly;
import io.commtrace.analysis.patterns.Pattern;
import io.commtrace.analysis.patterns.PatternConverter;
import io.commtrace.analysis.patterns.SignificanceScorer;
import io.commtrace.analysis.result.ResponseAnalysisReport;
import io.commtrace.analysis.result.SubAnalysisResult;
import io.commtrace.records.FieldAliases;
import io.commtrace.records.RecordTable;
import io.commtrace.records.RecordValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the response analyzer and every registered {@link SiblingDetector} over one record
 * table, and merges their output into a single ranked {@link PatternReport}.
 *
 * <p>Each producer runs in isolation. A failing producer contributes an
 * {@code "<name>: <message>"} entry to the report's errors and the others still run.
 * Nothing thrown by a producer escapes {@link #detectAllPatterns}.
 *
 * <h2>Usage</h2>
 *
 * <pre>{@code
 * PatternOrchestrator orchestrator = new PatternOrchestrator()
 *     .registerAllAvailable();
 *
 * PatternReport report = orchestrator.detectAllPatterns(table, FieldAliases.STANDARD, Map.of());
 * report.detectedPatterns().forEach(System.out::println);
 * }</pre>
 */
public final class PatternOrchestrator {

    private static final Logger logger = LogManager.getLogger(PatternOrchestrator.class);

    /// Source name used for response analyzer errors.
    public static final String RESPONSE_ANALYZER = "ResponseAnalyzer";

    /// Parameter key passed to detectors for the minimum gap length.
    public static final String MIN_GAP_HOURS = "min_gap_hours";

    private final ResponseAnalyzer responseAnalyzer;
    private final PatternConverter converter = new PatternConverter();
    private final List<SiblingDetector> detectors = new CopyOnWriteArrayList<>();

    /**
     * Creates an orchestrator around a response analyzer with default configuration.
     */
    public PatternOrchestrator() {
        this(new ResponseAnalyzer());
    }

    public PatternOrchestrator(ResponseAnalyzer responseAnalyzer) {
        this.responseAnalyzer = Objects.requireNonNull(responseAnalyzer, "responseAnalyzer cannot be null");
    }

    /**
     * Registers a detector to run after the response analyzer.
     *
     * @param detector the detector to register
     * @return this orchestrator for chaining
     */
    public PatternOrchestrator register(SiblingDetector detector) {
        Objects.requireNonNull(detector, "detector cannot be null");
        detectors.add(detector);
        return this;
    }

    /**
     * Registers a detector by name using SPI discovery.
     *
     * @param detectorName the name of the detector to register
     * @return this orchestrator for chaining
     * @throws IllegalArgumentException if no detector with the given name is found
     */
    public PatternOrchestrator register(String detectorName) {
        Optional<SiblingDetector> detector = SiblingDetectorIO.get(detectorName);
        if (detector.isEmpty()) {
            throw new IllegalArgumentException(
                "No detector found with name: " + detectorName +
                ". Available: " + SiblingDetectorIO.getAvailableNames());
        }
        detectors.add(detector.get());
        return this;
    }

    /**
     * Registers a detector by name if available; does nothing otherwise.
     *
     * @param detectorName the name of the detector to register
     * @return this orchestrator for chaining
     */
    public PatternOrchestrator registerIfAvailable(String detectorName) {
        SiblingDetectorIO.get(detectorName).ifPresent(detectors::add);
        return this;
    }

    /**
     * Registers all detectors available from SPI.
     *
     * @return this orchestrator for chaining
     */
    public PatternOrchestrator registerAllAvailable() {
        detectors.addAll(SiblingDetectorIO.getAll());
        return this;
    }

    /**
     * @return names of the registered detectors, in registration order
     */
    public List<String> getDetectorNames() {
        List<String> names = new ArrayList<>();
        for (SiblingDetector detector : detectors) {
            names.add(detector.name());
        }
        return names;
    }

    /**
     * Validates raw rows and detects patterns in them. Rows that do not validate produce a
     * report with a single {@code ResponseAnalyzer} error and nothing else.
     *
     * @param rows rows keyed by column name
     * @param aliases column aliases, null for the standard names
     * @param params detector parameters
     * @return the composite report
     */
    public PatternReport detectAllPatterns(List<? extends Map<String, ?>> rows, FieldAliases aliases,
                                           Map<String, Object> params) {
        RecordTable table;
        try {
            table = RecordTable.fromRows(rows, aliases);
        } catch (RecordValidationException | IllegalArgumentException e) {
            logger.error("Invalid input: {}", e.getMessage());
            return new PatternReport(List.of(), List.of(),
                List.of(RESPONSE_ANALYZER + ": " + SubAnalysisResult.describe(e).toLowerCase(Locale.ROOT)),
                Map.of(), 0);
        }
        return detectAllPatterns(table, aliases, params);
    }

    /**
     * Runs the response analyzer, then each registered detector, then ranks all patterns
     * by their second-stage significance.
     *
     * @param table validated records
     * @param aliases aliases the records were loaded with
     * @param params detector parameters; {@value #MIN_GAP_HOURS} defaults to the
     *               analyzer's configured value
     * @return the composite report
     */
    public PatternReport detectAllPatterns(RecordTable table, FieldAliases aliases, Map<String, Object> params) {
        Objects.requireNonNull(table, "table cannot be null");
        List<Pattern> patterns = new ArrayList<>();
        List<Anomaly> anomalies = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        Map<String, Object> advanced = new LinkedHashMap<>();

        Map<String, Object> effectiveParams = new LinkedHashMap<>();
        effectiveParams.put(MIN_GAP_HOURS, responseAnalyzer.config().minGapHours());
        if (params != null) {
            effectiveParams.putAll(params);
        }

        runResponseAnalyzer(table, aliases, patterns, anomalies, errors, advanced);
        for (SiblingDetector detector : detectors) {
            runDetector(detector, table, effectiveParams, patterns, anomalies, errors, advanced);
        }

        List<Pattern> ranked = SignificanceScorer.scoreAndRank(patterns, table.size());
        logger.info("Pattern detection complete: {} patterns, {} anomalies, {} errors",
            ranked.size(), anomalies.size(), errors.size());
        return new PatternReport(ranked, anomalies, errors, advanced, table.size());
    }

    private void runResponseAnalyzer(RecordTable table, FieldAliases aliases, List<Pattern> patterns,
                                     List<Anomaly> anomalies, List<String> errors, Map<String, Object> advanced) {
        ResponseAnalysisReport report;
        try {
            report = responseAnalyzer.analyze(table, aliases);
        } catch (RuntimeException e) {
            logger.warn("Response analyzer failed: {}", e.getMessage(), e);
            errors.add(RESPONSE_ANALYZER + ": " + SubAnalysisResult.describe(e));
            return;
        }
        advanced.put(PatternReport.RESPONSES, report);
        report.error().ifPresent(e -> errors.add(RESPONSE_ANALYZER + ": " + e));
        for (String warning : report.warnings()) {
            errors.add(warning);
        }
        report.mlError().ifPresent(e -> errors.add("ml: " + e));
        if (report.isHardStop()) {
            return;
        }
        try {
            patterns.addAll(converter.convert(report));
        } catch (RuntimeException e) {
            logger.warn("Pattern conversion failed: {}", e.getMessage(), e);
            errors.add(RESPONSE_ANALYZER + ": " + SubAnalysisResult.describe(e));
        }
        anomalies.addAll(report.anomalies());
    }

    private static void runDetector(SiblingDetector detector, RecordTable table, Map<String, Object> params,
                                    List<Pattern> patterns, List<Anomaly> anomalies, List<String> errors,
                                    Map<String, Object> advanced) {
        String name = safeName(detector);
        DetectorOutput output;
        try {
            output = detector.analyze(table, params);
        } catch (RuntimeException e) {
            logger.warn("Detector '{}' failed: {}", name, e.getMessage(), e);
            String message = SubAnalysisResult.describe(e);
            errors.add(name + ": " + message);
            advanced.put(name, DetectorOutput.failed(message));
            return;
        }
        if (output == null) {
            errors.add(name + ": no output");
            return;
        }
        if (output.hasError()) {
            logger.warn("Detector '{}' reported: {}", name, output.error());
            errors.add(name + ": " + output.error());
        }
        patterns.addAll(output.patterns());
        anomalies.addAll(output.anomalies());
        advanced.put(name, output);
        logger.debug("Detector '{}' produced {} patterns", name, output.patterns().size());
    }

    private static String safeName(SiblingDetector detector) {
        DetectorName annotation = detector.getClass().getAnnotation(DetectorName.class);
        if (annotation != null) {
            return annotation.value();
        }
        try {
            return detector.name();
        } catch (RuntimeException e) {
            logger.warn("Detector name unavailable: {}", e.getMessage());
            return detector.getClass().getSimpleName();
        }
    }
}
