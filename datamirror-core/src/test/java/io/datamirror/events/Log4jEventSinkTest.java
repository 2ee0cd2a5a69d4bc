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

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.Logger;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/// Tests that Log4jEventSink forwards events with their level and marker.
public class Log4jEventSinkTest {

    private static final class CapturingAppender extends AbstractAppender {
        private final List<LogEvent> events = new CopyOnWriteArrayList<>();

        private CapturingAppender() {
            super("capture", null, null, true, Property.EMPTY_ARRAY);
        }

        @Override
        public void append(LogEvent event) {
            events.add(event.toImmutable());
        }
    }

    private Logger logger;
    private CapturingAppender appender;

    @BeforeEach
    void setUp() {
        logger = (Logger) LogManager.getLogger("io.datamirror.test.sink");
        appender = new CapturingAppender();
        appender.start();
        logger.addAppender(appender);
        logger.setLevel(Level.DEBUG);
    }

    @AfterEach
    void tearDown() {
        logger.removeAppender(appender);
        appender.stop();
    }

    @Test
    void testTypedEventCarriesLevelAndMarker() {
        Log4jEventSink sink = new Log4jEventSink(logger);

        sink.log(MirrorEvent.FD_RENAMED, "filename", "report.pdf", "target", "out/report_55.pdf");

        assertThat(appender.events).singleElement().satisfies(event -> {
            assertThat(event.getLevel()).isEqualTo(Level.WARN);
            assertThat(event.getMarker().getName()).isEqualTo("FD_RENAMED");
            assertThat(event.getMessage().getFormattedMessage())
                .isEqualTo("File report.pdf already exists. Renaming to out/report_55.pdf.");
        });
    }

    @Test
    void testPlainMessagesUsePlaceholders() {
        Log4jEventSink sink = new Log4jEventSink(logger);

        sink.info("{} of {}", 2, 3);
        sink.debug("detail");

        assertThat(appender.events).extracting(e -> e.getMessage().getFormattedMessage())
            .containsExactly("2 of 3", "detail");
    }
}
