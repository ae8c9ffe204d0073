package io.commtrace.commands.common;

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
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Shared option for loading analysis thresholds from a YAML file.
 */
public class AnalysisConfigOption {

    @CommandLine.Option(
        names = {"-c", "--config"},
        description = "YAML file with analysis settings (default: built-in thresholds)"
    )
    private Path configFile;

    /**
     * Loads the configuration.
     *
     * @return the configuration from the file, or the defaults when no file was given
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if the file holds invalid settings
     */
    public AnalysisConfig load() throws IOException {
        if (configFile == null) {
            return AnalysisConfig.defaults();
        }
        return AnalysisConfig.load(configFile);
    }

    public Path getConfigFile() {
        return configFile;
    }
}
