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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/// Tests for MemoryEventSink storage, limits and concurrent use.
public class MemoryEventSinkTest {

    private final PrintStream originalErr = System.err;
    private ByteArrayOutputStream errContent;

    @BeforeEach
    void setUpStreams() {
        errContent = new ByteArrayOutputStream();
        System.setErr(new PrintStream(errContent));
    }

    @AfterEach
    void restoreStreams() {
        System.setErr(originalErr);
    }

    @Test
    void testEventsAreKeptInOrderAndCounted() {
        MemoryEventSink sink = new MemoryEventSink();

        sink.info("plain {}", "message");
        sink.log(MirrorEvent.AS_ALREADY_DONE, "assetId", "a");
        sink.log(MirrorEvent.AS_NO_DETAILS, "assetId", "b");
        sink.log(MirrorEvent.AS_ALREADY_DONE, "assetId", "c");

        assertThat(sink.getEventCount()).isEqualTo(4);
        assertThat(sink.getEvents().get(0).message()).isEqualTo("plain message");
        assertThat(sink.getEvents().get(0).eventType()).isNull();
        assertThat(sink.count(MirrorEvent.AS_ALREADY_DONE)).isEqualTo(2);
        assertThat(sink.countAtLevel(EventType.Level.WARN)).isEqualTo(1);
        assertThat(sink.getEventsByType(MirrorEvent.AS_ALREADY_DONE))
            .extracting(e -> e.params().get("assetId"))
            .containsExactly("a", "c");
    }

    @Test
    void testOverflowGoesToStandardError() {
        MemoryEventSink sink = new MemoryEventSink(2);

        sink.warn("one");
        sink.warn("two");
        sink.warn("three");

        assertThat(sink.getEventCount()).isEqualTo(2);
        assertThat(errContent.toString()).contains("three");
    }

    @Test
    void testThrowableIsIncludedInMessage() {
        MemoryEventSink sink = new MemoryEventSink();

        sink.error("failed", new IllegalStateException("boom"));

        assertThat(sink.getEvents().get(0).message()).startsWith("failed\n").contains("boom");
    }

    @Test
    void testConcurrentLogging() throws InterruptedException {
        MemoryEventSink sink = new MemoryEventSink();
        ExecutorService executor = Executors.newFixedThreadPool(4);
        for (int i = 0; i < 200; i++) {
            int index = i;
            executor.submit(() -> sink.log(MirrorEvent.MF_RECORD_NO_ID, "index", index));
        }
        executor.shutdown();
        assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(sink.count(MirrorEvent.MF_RECORD_NO_ID)).isEqualTo(200);

        sink.clear();
        assertThat(sink.getEventCount()).isZero();
    }
}
