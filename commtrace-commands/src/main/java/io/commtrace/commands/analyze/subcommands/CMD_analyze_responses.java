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
import io.commtrace.analysis.ResponsePrediction;
import io.commtrace.analysis.config.AnalysisConfig;
import io.commtrace.analysis.json.AnalysisGsonConfig;
import io.commtrace.analysis.result.ResponseAnalysisReport;
import io.commtrace.commands.analyze.ReportSummaryFormatter;
import io.commtrace.commands.common.AnalysisConfigOption;
import io.commtrace.commands.common.RecordInputOption;
import io.commtrace.commands.common.ReportOutputOption;
import io.commtrace.commands.common.VerbosityOption;
import io.commtrace.records.FieldAliases;
import io.commtrace.records.RecordTable;
import io.commtrace.records.RecordTableReader;
import io.commtrace.records.RecordValidationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/// Analyze response timing, reciprocity and conversation flow in a record file
///
/// The full report is written as JSON by default. With `--predict` the command instead
/// predicts the reply latency toward one counterparty.
///
/// A report whose `error` is set, including a validation failure, is still written and
/// the command exits with 1.
@CommandLine.Command(name = "responses",
    header = "Analyze response timing and reciprocity",
    description = "Computes reply latencies, relationship balance, conversation flow and anomalies",
    exitCodeList = {"0: success", "1: error reading input or analyzing records"})
public class CMD_analyze_responses implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_analyze_responses.class);

    @CommandLine.Mixin
    private RecordInputOption inputOption = new RecordInputOption();

    @CommandLine.Mixin
    private AnalysisConfigOption configOption = new AnalysisConfigOption();

    @CommandLine.Mixin
    private ReportOutputOption outputOption = new ReportOutputOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-p", "--predict"},
        description = "Predict the reply latency toward this counterparty instead of writing the report")
    private String predictFor;

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
            ResponseAnalyzer analyzer = ResponseAnalyzer.builder().config(config).build();

            if (predictFor != null) {
                return predict(analyzer, RecordTable.fromRows(rows, aliases), aliases);
            }

            ResponseAnalysisReport report = analyzer.analyzeRows(rows, aliases);
            String rendered = outputOption.getFormat() == ReportOutputOption.Format.summary
                ? ReportSummaryFormatter.summarize(report)
                : AnalysisGsonConfig.gson().toJson(report);
            outputOption.write(rendered, System.out);
            return report.error().isPresent() ? 1 : 0;
        } catch (IOException e) {
            logger.error("Error reading {}: {}", inputOption.getInputPath(), e.getMessage());
            return 1;
        } catch (RecordValidationException e) {
            logger.error("Invalid records in {}: {}", inputOption.getInputPath(), e.getMessage());
            return 1;
        } catch (IllegalArgumentException | IllegalStateException e) {
            logger.error(e.getMessage());
            return 1;
        }
    }

    private int predict(ResponseAnalyzer analyzer, RecordTable table, FieldAliases aliases) throws IOException {
        ResponsePrediction prediction = analyzer.predictResponseBehavior(table, predictFor, aliases);
        String rendered = outputOption.getFormat() == ReportOutputOption.Format.summary
            ? ReportSummaryFormatter.summarize(prediction)
            : AnalysisGsonConfig.gson().toJson(prediction);
        outputOption.write(rendered, System.out);
        return prediction.isSuccess() ? 0 : 1;
    }
}
