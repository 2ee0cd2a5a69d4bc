package io.datamirror.command.mirror;

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
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.appender.FileAppender;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.layout.PatternLayout;

import java.nio.file.Path;

/// Attaches the per-run log file to the `io.datamirror` logger.
///
/// The console appender comes from `log4j2.xml`. The file appender is added here because
/// its location depends on the output directory chosen on the command line. Closing the
/// run log detaches and stops the appender.
public class RunLog implements AutoCloseable {
    public static final String LOGGER_NAME = "io.datamirror";
    public static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss,SSS} - %p - %m%n";
    private static final String APPENDER_NAME = "RunLogFile";

    private final LoggerContext context;
    private final LoggerConfig loggerConfig;
    private final FileAppender appender;
    private final Level previousLevel;

    private RunLog(LoggerContext context, LoggerConfig loggerConfig, FileAppender appender, Level previousLevel) {
        this.context = context;
        this.loggerConfig = loggerConfig;
        this.appender = appender;
        this.previousLevel = previousLevel;
    }

    /// Starts writing the `io.datamirror` logger to a file, appending to any earlier run.
    ///
    /// @param logFile The log file, its directory must exist
    /// @param level The level for the `io.datamirror` logger
    /// @return the attached run log
    public static RunLog attach(Path logFile, Level level) {
        LoggerContext context = (LoggerContext) LogManager.getContext(false);
        Configuration configuration = context.getConfiguration();

        PatternLayout layout = PatternLayout.newBuilder()
            .withPattern(PATTERN)
            .withConfiguration(configuration)
            .build();
        FileAppender appender = FileAppender.newBuilder()
            .setName(APPENDER_NAME)
            .withFileName(logFile.toString())
            .withAppend(true)
            .setLayout(layout)
            .setConfiguration(configuration)
            .build();
        appender.start();
        configuration.addAppender(appender);

        LoggerConfig loggerConfig = configuration.getLoggerConfig(LOGGER_NAME);
        if (!LOGGER_NAME.equals(loggerConfig.getName())) {
            loggerConfig = new LoggerConfig(LOGGER_NAME, level, true);
            configuration.addLogger(LOGGER_NAME, loggerConfig);
        }
        Level previousLevel = loggerConfig.getLevel();
        loggerConfig.addAppender(appender, null, null);
        loggerConfig.setLevel(level);
        context.updateLoggers();
        return new RunLog(context, loggerConfig, appender, previousLevel);
    }

    @Override
    public void close() {
        loggerConfig.removeAppender(APPENDER_NAME);
        loggerConfig.setLevel(previousLevel);
        context.updateLoggers();
        appender.stop();
    }
}
