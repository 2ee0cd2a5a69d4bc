package io.datamirror.events;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

import java.util.Map;

/// An EventSink that forwards to a Log4j 2 logger.
///
/// Typed events are logged with a marker named after the event, so appenders and
/// filters can select on it.
public class Log4jEventSink implements EventSink {
    private final Logger logger;

    /// Creates a sink that logs to the `io.datamirror` logger.
    public Log4jEventSink() {
        this(LogManager.getLogger("io.datamirror"));
    }

    /// Creates a sink that logs to the given logger.
    ///
    /// @param logger The destination logger
    public Log4jEventSink(Logger logger) {
        this.logger = logger;
    }

    @Override
    public void debug(String format, Object... args) {
        logger.debug(format, args);
    }

    @Override
    public void info(String format, Object... args) {
        logger.info(format, args);
    }

    @Override
    public void warn(String format, Object... args) {
        logger.warn(format, args);
    }

    @Override
    public void warn(String message, Throwable t) {
        logger.warn(message, t);
    }

    @Override
    public void error(String format, Object... args) {
        logger.error(format, args);
    }

    @Override
    public void error(String message, Throwable t) {
        logger.error(message, t);
    }

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        Marker marker = MarkerManager.getMarker(event.name());
        String message = formatEventMessage(event, params);
        switch (event.getLevel()) {
            case TRACE -> logger.trace(marker, message);
            case DEBUG -> logger.debug(marker, message);
            case INFO -> logger.info(marker, message);
            case WARN -> logger.warn(marker, message);
            case ERROR -> logger.error(marker, message);
        }
    }
}
