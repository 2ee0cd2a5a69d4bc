package io.datamirror.command.common;

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
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import static org.assertj.core.api.Assertions.assertThat;

public class VerbosityOptionTest {

    @CommandLine.Command(name = "probe")
    static class Probe implements Runnable {
        @CommandLine.Mixin
        VerbosityOption verbosity = new VerbosityOption();

        @Override
        public void run() {
        }
    }

    private static VerbosityOption parse(String... args) {
        Probe probe = new Probe();
        new CommandLine(probe).parseArgs(args);
        return probe.verbosity;
    }

    @Test
    void testLevels() {
        assertThat(parse().logLevel()).isEqualTo(Level.INFO);
        assertThat(parse("-v").logLevel()).isEqualTo(Level.DEBUG);
        assertThat(parse("--quiet").logLevel()).isEqualTo(Level.WARN);
    }
}
