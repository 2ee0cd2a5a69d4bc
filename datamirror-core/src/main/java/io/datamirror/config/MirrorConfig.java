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

import java.nio.file.Path;
import java.time.Duration;

/// Settings for one mirror run.
///
/// @param outputDir The directory receiving the manifest, details, payloads and log
/// @param logFile The log file name, resolved inside the output directory
/// @param concurrency The number of assets processed at the same time, at least 1
/// @param siteUrl The portal site URL, the API lives under `/api` and blobs under `/download`
/// @param retries The number of attempts for each file blob, at least 1
/// @param retryBaseDelay The delay after the first failed blob attempt, doubled after each further failure
/// @param connectTimeout The HTTP connect timeout
/// @param readTimeout The HTTP read timeout
public record MirrorConfig(
    Path outputDir,
    String logFile,
    int concurrency,
    String siteUrl,
    int retries,
    Duration retryBaseDelay,
    Duration connectTimeout,
    Duration readTimeout
) {
    public static final Path DEFAULT_OUTPUT_DIR = Path.of("cdc_data");
    public static final String DEFAULT_LOG_FILE = "socrata_downloader_log.txt";
    public static final int DEFAULT_CONCURRENCY = 3;
    public static final String DEFAULT_SITE_URL = "https://data.cdc.gov";
    public static final int DEFAULT_RETRIES = 3;
    public static final Duration DEFAULT_RETRY_BASE_DELAY = Duration.ofSeconds(1);
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);

    public MirrorConfig {
        if (outputDir == null) {
            throw new IllegalArgumentException("output directory is required");
        }
        if (logFile == null || logFile.isBlank()) {
            throw new IllegalArgumentException("log file name is required");
        }
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        if (siteUrl == null || siteUrl.isBlank()) {
            throw new IllegalArgumentException("site URL is required");
        }
        if (connectTimeout == null || connectTimeout.isNegative() || readTimeout == null || readTimeout.isNegative()) {
            throw new IllegalArgumentException("timeouts must not be negative");
        }
        // validates retries and delay
        new RetryPolicy(retries, retryBaseDelay);
    }

    /// @return a builder preset with the defaults
    public static Builder builder() {
        return new Builder();
    }

    /// @return the configuration with every default applied
    public static MirrorConfig defaults() {
        return builder().build();
    }

    /// @return the endpoints derived from the site URL
    public ApiEndpoints endpoints() {
        return ApiEndpoints.fromSiteUrl(siteUrl);
    }

    /// @return the retry policy for file blob downloads
    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retries, retryBaseDelay);
    }

    /// @return the log file location
    public Path logFilePath() {
        return outputDir.resolve(logFile);
    }

    /// Builder for {@link MirrorConfig}.
    public static class Builder {
        private Path outputDir = DEFAULT_OUTPUT_DIR;
        private String logFile = DEFAULT_LOG_FILE;
        private int concurrency = DEFAULT_CONCURRENCY;
        private String siteUrl = DEFAULT_SITE_URL;
        private int retries = DEFAULT_RETRIES;
        private Duration retryBaseDelay = DEFAULT_RETRY_BASE_DELAY;
        private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private Duration readTimeout = DEFAULT_READ_TIMEOUT;

        private Builder() {
        }

        public Builder outputDir(Path outputDir) {
            this.outputDir = outputDir;
            return this;
        }

        public Builder logFile(String logFile) {
            this.logFile = logFile;
            return this;
        }

        public Builder concurrency(int concurrency) {
            this.concurrency = concurrency;
            return this;
        }

        public Builder siteUrl(String siteUrl) {
            this.siteUrl = siteUrl;
            return this;
        }

        public Builder retries(int retries) {
            this.retries = retries;
            return this;
        }

        public Builder retryBaseDelay(Duration retryBaseDelay) {
            this.retryBaseDelay = retryBaseDelay;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder readTimeout(Duration readTimeout) {
            this.readTimeout = readTimeout;
            return this;
        }

        public MirrorConfig build() {
            return new MirrorConfig(outputDir, logFile, concurrency, siteUrl, retries, retryBaseDelay,
                connectTimeout, readTimeout);
        }
    }
}
