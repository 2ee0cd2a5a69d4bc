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

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/// Tests for typed event rendering and parameter validation.
public class MirrorEventTest {

    @Test
    void testTemplateIsRenderedWithParams() {
        MemoryEventSink sink = new MemoryEventSink();

        sink.log(MirrorEvent.FD_ATTEMPT_FAILED, "assetId", "55", "attempt", 2, "retries", 3, "cause", "HTTP 503");

        MemoryEventSink.LogEvent event = sink.getEvents().get(0);
        assertThat(event.level()).isEqualTo(EventType.Level.ERROR);
        assertThat(event.message())
            .isEqualTo("Error downloading file asset 55 (attempt 2/3): HTTP 503");
        assertThat(event.params()).containsEntry("attempt", 2);
    }

    @Test
    void testMissingParamIsRejected() {
        MemoryEventSink sink = new MemoryEventSink();

        assertThatThrownBy(() -> sink.log(MirrorEvent.AS_NO_DETAILS, Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("assetId");
    }

    @Test
    void testWrongParamTypeIsRejected() {
        MemoryEventSink sink = new MemoryEventSink();

        assertThatThrownBy(() -> sink.log(MirrorEvent.MF_RECORD_NO_ID, "index", "zero"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("Integer");
    }

    @Test
    void testNullParamValuesAreAllowed() {
        MemoryEventSink sink = new MemoryEventSink();

        sink.log(MirrorEvent.AS_UNKNOWN_TYPE, "assetId", "x1", "assetType", null);

        assertThat(sink.getEvents()).extracting(MemoryEventSink.LogEvent::message)
            .containsExactly("Unknown asset type 'null' for x1");
    }

    @Test
    void testEventWithoutTemplateRendersNameAndParams() {
        EventType untemplated = new EventType() {
            @Override
            public Level getLevel() {
                return Level.INFO;
            }

            @Override
            public Map<String, Class<?>> getRequiredParams() {
                return Map.of();
            }

            @Override
            public String name() {
                return "PLAIN";
            }
        };
        MemoryEventSink sink = new MemoryEventSink();

        sink.log(untemplated, "a", 1);

        assertThat(sink.getEvents().get(0).message()).isEqualTo(EventType.Level.INFO.getSymbol() + "PLAIN a:=1");
    }

    @Test
    void testPlaceholderSubstitution() {
        assertThat(EventSink.substitute("{} of {}", 1, 3)).isEqualTo("1 of 3");
        assertThat(EventSink.substitute("no args")).isEqualTo("no args");
        assertThat(EventSink.substitute("{} and {}", "only")).isEqualTo("only and {}");
    }
}
