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
import picocli.CommandLine;

/**
 * Shared verbosity control options.
 * Provides standard {@code -v/--verbose} and {@code -q/--quiet} flags that set the level of
 * the run log.
 */
public class VerbosityOption {

    @CommandLine.Option(
        names = {"-v", "--verbose"},
        description = "Log debug detail, including retry waits"
    )
    private boolean verbose = false;

    @CommandLine.Option(
        names = {"-q", "--quiet"},
        description = "Log only warnings and errors"
    )
    private boolean quiet = false;

    /**
     * Gets the log level selected by the flags.
     *
     * @return DEBUG when verbose, WARN when quiet, otherwise INFO
     */
    public Level logLevel() {
        if (verbose) {
            return Level.DEBUG;
        }
        return quiet ? Level.WARN : Level.INFO;
    }

    /**
     * Validates that verbose and quiet are not both enabled.
     *
     * @param commandLine the command line, for reporting a usage error
     * @throws CommandLine.ParameterException if both verbose and quiet are enabled
     */
    public void validate(CommandLine commandLine) {
        if (verbose && quiet) {
            throw new CommandLine.ParameterException(commandLine,
                "Cannot specify both --verbose and --quiet options");
        }
    }
}
