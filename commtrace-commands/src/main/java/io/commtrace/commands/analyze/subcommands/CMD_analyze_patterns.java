package io.commtrace.commands.analyze.subcommands;

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
import io.commtrace.analysis.config.AnalysisConfig;
import io.commtrace.analysis.harness.PatternOrchestrator;
import io.commtrace.analysis.harness.PatternReport;
import io.commtrace.analysis.json.AnalysisGsonConfig;
import io.commtrace.commands.analyze.ReportSummaryFormatter;
import io.commtrace.commands.common.AnalysisConfigOption;
import io.commtrace.commands.common.RecordInputOption;
import io.commtrace.commands.common.ReportOutputOption;
import io.commtrace.commands.common.VerbosityOption;
import io.commtrace.records.FieldAliases;
import io.commtrace.records.RecordTableReader;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Detect and rank patterns in a record file
///
/// Runs the response analyzer and the sibling detectors found on the class path, then
/// ranks every pattern by significance. Detectors may be restricted with `--detector`.
///
/// Detector failures are listed in the report's `errors`. The command exits with 1 only
/// when the records could not be analyzed at all.
@CommandLine.Command(name = "patterns",
    header = "Detect and rank communication patterns",
    description = "Combines response analysis with the available pattern detectors",
    exitCodeList = {"0: success", "1: error reading input or analyzing records"})
public class CMD_analyze_patterns implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_analyze_patterns.class);

    @CommandLine.Mixin
    private RecordInputOption inputOption = new RecordInputOption();

    @CommandLine.Mixin
    private AnalysisConfigOption configOption = new AnalysisConfigOption();

    @CommandLine.Mixin
    private ReportOutputOption outputOption = new ReportOutputOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-d", "--detector"},
        description = "Detector to run, repeatable (default: all available)")
    private List<String> detectorNames = new ArrayList<>();

    @CommandLine.Option(names = {"--min-gap-hours"},
        description = "Minimum silence reported as a gap, overriding the configured value")
    private Double minGapHours;

    /// Execute the command
    ///
    /// @return 0 for success, 1 for error
    @Override
    public Integer call() {
        try {
            verbosityOption.validate();
            verbosityOption.apply();
            outputOption.validate();

            FieldAliases aliases = inputOption.getAliases();
            AnalysisConfig config = configOption.load();
            List<Map<String, Object>> rows = inputOption.readRows(new RecordTableReader());

            PatternOrchestrator orchestrator =
                new PatternOrchestrator(ResponseAnalyzer.builder().config(config).build());
            if (detectorNames.isEmpty()) {
                orchestrator.registerAllAvailable();
            } else {
                detectorNames.forEach(orchestrator::register);
            }
            logger.debug("Running detectors: {}", orchestrator.getDetectorNames());

            Map<String, Object> params = new LinkedHashMap<>();
            if (minGapHours != null) {
                params.put(PatternOrchestrator.MIN_GAP_HOURS, minGapHours);
            }

            PatternReport report = orchestrator.detectAllPatterns(rows, aliases, params);
            String rendered = outputOption.getFormat() == ReportOutputOption.Format.summary
                ? ReportSummaryFormatter.summarize(report)
                : AnalysisGsonConfig.gson().toJson(report);
            outputOption.write(rendered, System.out);

            boolean analyzed = report.responses().map(r -> !r.isHardStop()).orElse(false);
            return analyzed ? 0 : 1;
        } catch (IOException e) {
            logger.error("Error reading {}: {}", inputOption.getInputPath(), e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return 1;
        }
    }
}
