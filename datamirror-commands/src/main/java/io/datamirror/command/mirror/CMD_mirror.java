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

import io.datamirror.command.common.DurationConverter;
import io.datamirror.command.common.VerbosityOption;
import io.datamirror.config.MirrorConfig;
import io.datamirror.events.EventSink;
import io.datamirror.events.Log4jEventSink;
import io.datamirror.pipeline.BatchReport;
import io.datamirror.pipeline.ManifestFetchException;
import io.datamirror.pipeline.MirrorRunner;
import io.datamirror.transport.OkHttpTransportClient;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/// Mirror every asset of a Socrata-style open data portal into a local directory.
///
/// The run fetches the metadata manifest, then for each asset saves its details as
/// `{id}_metadata.json` and downloads its payload: file blobs under their published name,
/// datasets as `{id}.csv`. Assets whose details file already exists are skipped, so an
/// interrupted run can be repeated.
///
/// Usage:
/// ```
/// mirror [--output-dir dir] [--log-file name] [--concurrency n] [--api-url site]
///        [--retries n] [--retry-delay d] [--connect-timeout d] [--read-timeout d] [-v|-q]
/// ```
///
/// Exit codes: 0 when the manifest was obtained, whatever happened to individual assets;
/// 1 when the manifest or the output directory was unusable; 2 for invalid usage.
@CommandLine.Command(name = "mirror",
    header = "Mirror the assets of an open data portal",
    description = """
        Downloads the metadata manifest of a portal, then the details and payload
        of every asset it lists. Assets already mirrored are skipped.
        """,
    mixinStandardHelpOptions = true)
public class CMD_mirror implements Callable<Integer> {

    private static final Logger logger = LogManager.getLogger(CMD_mirror.class);

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Option(names = {"--output-dir"},
        description = "Directory to store downloaded assets (default: ${DEFAULT-VALUE})")
    private Path outputDir = MirrorConfig.DEFAULT_OUTPUT_DIR;

    @CommandLine.Option(names = {"--log-file"},
        description = "Log file name inside the output directory (default: ${DEFAULT-VALUE})")
    private String logFile = MirrorConfig.DEFAULT_LOG_FILE;

    @CommandLine.Option(names = {"--concurrency"},
        description = "Number of assets processed at once (default: ${DEFAULT-VALUE})")
    private int concurrency = MirrorConfig.DEFAULT_CONCURRENCY;

    @CommandLine.Option(names = {"--api-url"},
        description = "Site URL of the portal; the API is under /api (default: ${DEFAULT-VALUE})")
    private String siteUrl = MirrorConfig.DEFAULT_SITE_URL;

    @CommandLine.Option(names = {"--retries"},
        description = "Attempts per file download (default: ${DEFAULT-VALUE})")
    private int retries = MirrorConfig.DEFAULT_RETRIES;

    @CommandLine.Option(names = {"--retry-delay"}, converter = DurationConverter.class,
        description = "Wait after the first failed file download, doubled each retry,"
            + " as seconds or ISO-8601 (default: PT1S)")
    private Duration retryDelay = MirrorConfig.DEFAULT_RETRY_BASE_DELAY;

    @CommandLine.Option(names = {"--connect-timeout"}, converter = DurationConverter.class,
        description = "HTTP connect timeout, as seconds or ISO-8601 (default: PT10S)")
    private Duration connectTimeout = MirrorConfig.DEFAULT_CONNECT_TIMEOUT;

    @CommandLine.Option(names = {"--read-timeout"}, converter = DurationConverter.class,
        description = "HTTP read timeout, as seconds or ISO-8601 (default: PT1M)")
    private Duration readTimeout = MirrorConfig.DEFAULT_READ_TIMEOUT;

    @CommandLine.Mixin
    private VerbosityOption verbosity = new VerbosityOption();

    /// Run the mirror command directly
    public static void main(String[] args) {
        int exitCode = new CommandLine(new CMD_mirror()).execute(args);
        System.exit(exitCode);
    }

    /// Builds the run configuration from the options.
    ///
    /// @return the configuration
    /// @throws CommandLine.ParameterException if an option value is out of range
    MirrorConfig toConfig() {
        verbosity.validate(spec.commandLine());
        try {
            return MirrorConfig.builder()
                .outputDir(outputDir)
                .logFile(logFile)
                .concurrency(concurrency)
                .siteUrl(siteUrl)
                .retries(retries)
                .retryBaseDelay(retryDelay)
                .connectTimeout(connectTimeout)
                .readTimeout(readTimeout)
                .build();
        } catch (IllegalArgumentException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    @Override
    public Integer call() {
        MirrorConfig config = toConfig();
        try {
            Files.createDirectories(config.outputDir());
        } catch (IOException e) {
            logger.error("Cannot create output directory {}: {}", config.outputDir(), e.getMessage());
            return 1;
        }

        try (RunLog ignored = RunLog.attach(config.logFilePath(), verbosity.logLevel())) {
            return mirror(config);
        }
    }

    private int mirror(MirrorConfig config) {
        EventSink events = new Log4jEventSink();
        try (OkHttpTransportClient transport =
                 new OkHttpTransportClient(config.connectTimeout(), config.readTimeout())) {
            BatchReport report = new MirrorRunner(config, transport, events).run();
            if (report.manifestRejected()) {
                logger.warn("The manifest was not a list of assets, nothing was mirrored");
            }
            return 0;
        } catch (ManifestFetchException e) {
            logger.error("Cannot continue without the metadata manifest: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Mirror run failed: {}", e.getMessage(), e);
            return 1;
        }
    }
}
