package io.commtrace.commands;

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

import io.commtrace.commands.CommandFixtures.Run;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class CMD_commtraceTest {

    @Test
    void withoutSubcommandPrintsUsage() {
        Run run = CommandFixtures.run();

        assertThat(run.exitCode()).isZero();
        assertThat(run.stdout()).contains("Usage: commtrace").contains("analyze");
    }

    @Test
    void analyzeListsItsSubcommands() {
        Run run = CommandFixtures.run("analyze");

        assertThat(run.exitCode()).isZero();
        assertThat(run.stdout()).contains("responses").contains("patterns");
    }

    @Test
    void missingInputIsAUsageError() {
        Run run = CommandFixtures.run("analyze", "responses");

        assertThat(run.exitCode()).isEqualTo(2);
    }
}
