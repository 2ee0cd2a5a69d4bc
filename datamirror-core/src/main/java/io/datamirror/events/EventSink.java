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

import java.util.LinkedHashMap;
import java.util.Map;

/// Interface for handling mirror events and logging.
///
/// Every pipeline component receives an EventSink when it is constructed and reports
/// through it, instead of reaching for a shared, globally configured logger. This keeps
/// each component testable on its own: tests hand in a {@link MemoryEventSink} and
/// inspect what was reported.
public interface EventSink {
    /// Log a debug message.
    ///
    /// @param format The message format string, with `{}` placeholders
    /// @param args The arguments to be formatted
    void debug(String format, Object... args);

    /// Log an info message.
    ///
    /// @param format The message format string, with `{}` placeholders
    /// @param args The arguments to be formatted
    void info(String format, Object... args);

    /// Log a warning message.
    ///
    /// @param format The message format string, with `{}` placeholders
    /// @param args The arguments to be formatted
    void warn(String format, Object... args);

    /// Log a warning message with an exception.
    ///
    /// @param message The warning message
    /// @param t The throwable associated with the warning
    void warn(String message, Throwable t);

    /// Log an error message.
    ///
    /// @param format The message format string, with `{}` placeholders
    /// @param args The arguments to be formatted
    void error(String format, Object... args);

    /// Log an error message with an exception.
    ///
    /// @param message The error message
    /// @param t The throwable associated with the error
    void error(String message, Throwable t);

    /// Log a message with an EventType and named parameters.
    /// The logging level is determined by the event's level.
    ///
    /// @param event The EventType enum value
    /// @param params Map of parameter names to values
    default void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        String message = formatEventMessage(event, params);
        switch (event.getLevel()) {
            case TRACE, DEBUG -> debug("{}", message);
            case INFO -> info("{}", message);
            case WARN -> warn("{}", message);
            case ERROR -> error("{}", message);
        }
    }

    /// Convenience method to log a message with an EventType and varargs parameters.
    ///
    /// @param event The EventType enum value
    /// @param params Alternating parameter names and values
    default void log(EventType event, Object... params) {
        log(event, paramsToMap(params));
    }

    /// Validate that all required parameters are present and of the correct type.
    /// Null values are allowed.
    ///
    /// @param event The EventType enum value
    /// @param params Map of parameter names to values
    default void validateRequiredParams(EventType event, Map<String, Object> params) {
        for (Map.Entry<String, Class<?>> required : event.getRequiredParams().entrySet()) {
            String name = required.getKey();
            if (!params.containsKey(name)) {
                throw new IllegalArgumentException("Missing required parameter: " + name + " for event: " + event.name());
            }
            Object value = params.get(name);
            if (value != null && !required.getValue().isInstance(value)) {
                throw new IllegalArgumentException("Parameter " + name + " for event " + event.name()
                    + " must be of type " + required.getValue().getSimpleName()
                    + ", but was " + value.getClass().getSimpleName());
            }
        }
    }

    /// Format an event message with named parameters.
    ///
    /// Events with a template render it with each `{param}` replaced. Other events
    /// render as the level symbol and event name followed by `name:=value` pairs.
    ///
    /// @param event The EventType enum value
    /// @param params Map of parameter names to values
    /// @return Formatted message string
    default String formatEventMessage(EventType event, Map<String, Object> params) {
        String template = event.getTemplate();
        if (template != null) {
            String rendered = template;
            for (Map.Entry<String, Object> entry : params.entrySet()) {
                rendered = rendered.replace("{" + entry.getKey() + "}", String.valueOf(entry.getValue()));
            }
            return rendered;
        }
        StringBuilder sb = new StringBuilder();
        sb.append(event.getLevelSymbol()).append(event.name());
        for (Map.Entry<String, Object> entry : params.entrySet()) {
            sb.append(" ").append(entry.getKey()).append(":=").append(entry.getValue());
        }
        return sb.toString();
    }

    /// Convert varargs parameters to a map.
    ///
    /// @param params Alternating parameter names and values
    /// @return Map of parameter names to values, in the given order
    default Map<String, Object> paramsToMap(Object... params) {
        if (params.length % 2 != 0) {
            throw new IllegalArgumentException("Parameters must be provided as name-value pairs");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < params.length; i += 2) {
            if (!(params[i] instanceof String)) {
                throw new IllegalArgumentException("Parameter names must be strings");
            }
            map.put((String) params[i], params[i + 1]);
        }
        return map;
    }

    /// Substitute `{}` placeholders in order, the way SLF4J-style loggers do.
    ///
    /// @param format The format string
    /// @param args The arguments
    /// @return The formatted message
    static String substitute(String format, Object... args) {
        if (args == null || args.length == 0) {
            return format;
        }
        StringBuilder sb = new StringBuilder(format.length() + 16 * args.length);
        int argIndex = 0;
        int from = 0;
        int at;
        while (argIndex < args.length && (at = format.indexOf("{}", from)) >= 0) {
            sb.append(format, from, at).append(args[argIndex++]);
            from = at + 2;
        }
        sb.append(format.substring(from));
        return sb.toString();
    }
}
