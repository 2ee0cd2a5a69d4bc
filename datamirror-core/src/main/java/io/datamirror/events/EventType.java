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

import java.util.Map;

/// Interface for event types that can be logged through an {@link EventSink}.
///
/// Implement this as an enum where each constant is one kind of event, carrying its
/// logging level, the parameters it requires and, optionally, a message template in
/// which `{name}` is replaced by the parameter of that name.
public interface EventType {
    /// Logging levels for events
    enum Level {
        /// Fine-grained detail, normally only useful while developing
        TRACE,
        /// Detail useful for debugging
        DEBUG,
        /// Normal operation
        INFO,
        /// Something was skipped or fell back to a default, processing continues
        WARN,
        /// Something failed, processing of the affected item stops
        ERROR;

        /// Get the single character representation of this level
        ///
        /// @return A single character representing the level
        public char getSymbol() {
            return name().charAt(0);
        }
    }

    /// Get the effective logging level for this event
    ///
    /// @return The logging level
    Level getLevel();

    /// Get the required parameters and their types for this event
    ///
    /// @return Map of parameter names to their required types
    Map<String, Class<?>> getRequiredParams();

    /// Get the name of this event
    ///
    /// @return The event name
    String name();

    /// Get the message template for this event, or null to render name and parameters
    ///
    /// @return The template with `{param}` placeholders, or null
    default String getTemplate() {
        return null;
    }

    /// Get the symbolic character for the event level
    ///
    /// @return A single character representing the event level
    default char getLevelSymbol() {
        return getLevel().getSymbol();
    }
}
