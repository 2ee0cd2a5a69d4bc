package io.datamirror.config;

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

import io.datamirror.download.RetryPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class MirrorConfigTest {

    @Test
    void testDefaults() {
        MirrorConfig config = MirrorConfig.defaults();

        assertThat(config.outputDir()).isEqualTo(Path.of("cdc_data"));
        assertThat(config.logFile()).isEqualTo("socrata_downloader_log.txt");
        assertThat(config.concurrency()).isEqualTo(3);
        assertThat(config.endpoints().apiBaseUrl()).isEqualTo("https://data.cdc.gov/api");
        assertThat(config.retryPolicy()).isEqualTo(new RetryPolicy(3, Duration.ofSeconds(1)));
        assertThat(config.connectTimeout()).isEqualTo(Duration.ofSeconds(10));
        assertThat(config.readTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.logFilePath()).isEqualTo(Path.of("cdc_data", "socrata_downloader_log.txt"));
    }

    @Test
    void testBuilderOverrides() {
        MirrorConfig config = MirrorConfig.builder()
            .outputDir(Path.of("out"))
            .concurrency(8)
            .siteUrl("http://127.0.0.1:9999")
            .retries(5)
            .retryBaseDelay(Duration.ZERO)
            .build();

        assertThat(config.concurrency()).isEqualTo(8);
        assertThat(config.endpoints().downloadBaseUrl()).isEqualTo("http://127.0.0.1:9999/download");
        assertThat(config.retryPolicy().retries()).isEqualTo(5);
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> MirrorConfig.builder().concurrency(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("concurrency");
        assertThatThrownBy(() -> MirrorConfig.builder().retries(0).build())
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("retries");
        assertThatThrownBy(() -> MirrorConfig.builder().retryBaseDelay(Duration.ofSeconds(-1)).build())
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> MirrorConfig.builder().logFile("").build())
            .isInstanceOf(IllegalArgumentException.class);
    }
}
