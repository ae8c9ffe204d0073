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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags that adjust the
 * log level of the {@code io.commtrace} loggers.
 */
public class VerbosityOption {

    static final String LOGGER_NAME = "io.commtrace";

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log analysis progress and collaborator problems"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Log errors only"
    )
    private boolean quiet = false;

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @throws IllegalStateException if both verbose and quiet are enabled
     */
    public void validate() {
        if (verbose && quiet) {
            throw new IllegalStateException(
                "Cannot specify both --verbose and --quiet options"
            );
        }
    }

    /**
     * @return the level implied by the flags, or null to keep the configured level
     */
    public Level level() {
        if (verbose) {
            return Level.DEBUG;
        }
        if (quiet) {
            return Level.ERROR;
        }
        return null;
    }

    /**
     * Applies the chosen level to the {@code io.commtrace} loggers.
     */
    public void apply() {
        Level level = level();
        if (level != null) {
            Configurator.setLevel(LOGGER_NAME, level);
        }
    }
}
