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

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/// An in-memory implementation of EventSink.
///
/// Events are kept in arrival order, up to a configurable limit (default 10000). Once
/// the limit is reached, further events are written to System.err instead. Safe for
/// concurrent use by worker threads.
public class MemoryEventSink implements EventSink {
    private static final int DEFAULT_EVENT_LIMIT = 10000;

    private final int eventLimit;
    private final CopyOnWriteArrayList<LogEvent> events = new CopyOnWriteArrayList<>();

    /// A log event stored in memory.
    ///
    /// @param timestamp The time the event was recorded
    /// @param level The severity level
    /// @param message The rendered message
    /// @param eventType The typed event, or null for plain messages
    /// @param params The typed event parameters, or null for plain messages
    public record LogEvent(
        Instant timestamp,
        EventType.Level level,
        String message,
        EventType eventType,
        Map<String, Object> params
    ) {
    }

    /// Construct a MemoryEventSink with the default event limit (10000).
    public MemoryEventSink() {
        this(DEFAULT_EVENT_LIMIT);
    }

    /// Construct a MemoryEventSink with the specified event limit.
    ///
    /// @param eventLimit The maximum number of events to store in memory
    public MemoryEventSink(int eventLimit) {
        this.eventLimit = eventLimit;
    }

    @Override
    public void debug(String format, Object... args) {
        add(EventType.Level.DEBUG, EventSink.substitute(format, args), null, null);
    }

    @Override
    public void info(String format, Object... args) {
        add(EventType.Level.INFO, EventSink.substitute(format, args), null, null);
    }

    @Override
    public void warn(String format, Object... args) {
        add(EventType.Level.WARN, EventSink.substitute(format, args), null, null);
    }

    @Override
    public void warn(String message, Throwable t) {
        add(EventType.Level.WARN, withStackTrace(message, t), null, null);
    }

    @Override
    public void error(String format, Object... args) {
        add(EventType.Level.ERROR, EventSink.substitute(format, args), null, null);
    }

    @Override
    public void error(String message, Throwable t) {
        add(EventType.Level.ERROR, withStackTrace(message, t), null, null);
    }

    @Override
    public void log(EventType event, Map<String, Object> params) {
        validateRequiredParams(event, params);
        add(event.getLevel(), formatEventMessage(event, params), event, params);
    }

    private void add(EventType.Level level, String message, EventType eventType, Map<String, Object> params) {
        // Map.copyOf rejects null values, which events allow
        Map<String, Object> copy = params == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        LogEvent event = new LogEvent(Instant.now(), level, message, eventType, copy);
        if (events.size() >= eventLimit) {
            System.err.println(level.getSymbol() + " " + message);
            return;
        }
        events.add(event);
    }

    private static String withStackTrace(String message, Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return message + "\n" + sw;
    }

    /// Get all events in arrival order.
    ///
    /// @return A list of all events
    public List<LogEvent> getEvents() {
        return new ArrayList<>(events);
    }

    /// Get all events of a specific type.
    ///
    /// @param eventType The event type to filter by
    /// @return The matching events in arrival order
    public List<LogEvent> getEventsByType(EventType eventType) {
        return events.stream().filter(e -> e.eventType() == eventType).toList();
    }

    /// Count the events of a specific type.
    ///
    /// @param eventType The event type to count
    /// @return The number of matching events
    public long count(EventType eventType) {
        return events.stream().filter(e -> e.eventType() == eventType).count();
    }

    /// Count the events at a specific level.
    ///
    /// @param level The level to count
    /// @return The number of events at that level
    public long countAtLevel(EventType.Level level) {
        return events.stream().filter(e -> e.level() == level).count();
    }

    /// Get the number of events currently stored.
    ///
    /// @return The number of events
    public int getEventCount() {
        return events.size();
    }

    /// Clear all events from the buffer.
    public void clear() {
        events.clear();
    }
}
