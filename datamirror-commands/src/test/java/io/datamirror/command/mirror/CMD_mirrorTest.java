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

import com.fasterxml.jackson.databind.ObjectMapper;
import io.datamirror.jetty.testserver.JettyApiServerFixture;
import io.datamirror.jetty.testserver.ScriptedResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/// Runs the mirror command against the scripted Jetty API server.
public class CMD_mirrorTest {

    @TempDir
    Path tempDir;

    private JettyApiServerFixture server;
    private StringWriter err;

    @BeforeEach
    void setUp() throws IOException {
        server = new JettyApiServerFixture();
        server.start();
        err = new StringWriter();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private int run(String... args) {
        CommandLine commandLine = new CommandLine(new CMD_mirror());
        commandLine.setErr(new PrintWriter(err));
        return commandLine.execute(args);
    }

    private Path outputDir() {
        return tempDir.resolve("mirror");
    }

    @Test
    void testDatasetRunExitsZeroAndWritesLog() throws Exception {
        server.route("/api/views/metadata/v1", ScriptedResponse.json("[{\"id\":\"123\"}]"))
            .route("/api/views/123", ScriptedResponse.json("{\"assetType\":\"dataset\",\"name\":\"Counts\"}"))
            .route("/api/views/123/rows.csv", ScriptedResponse.csv("a,b\n1,2\n"));

        int exitCode = run("--output-dir", outputDir().toString(), "--api-url", server.getSiteUrl(),
            "--concurrency", "2");

        assertThat(exitCode).isZero();
        assertThat(outputDir().resolve("123.csv")).hasContent("a,b\n1,2\n");
        assertThat(new ObjectMapper().readTree(outputDir().resolve("123_metadata.json").toFile())
            .path("name").asText()).isEqualTo("Counts");
        String log = Files.readString(outputDir().resolve("socrata_downloader_log.txt"));
        assertThat(log).contains(" - INFO - Downloaded table asset 123");
        assertThat(log).contains("Final statistics");
    }

    @Test
    void testManifestFailureExitsOne() throws Exception {
        server.route("/api/views/metadata/v1", ScriptedResponse.status(500));

        int exitCode = run("--output-dir", outputDir().toString(), "--api-url", server.getSiteUrl(),
            "--log-file", "run.log");

        assertThat(exitCode).isEqualTo(1);
        assertThat(server.totalRequests()).isEqualTo(1);
        assertThat(Files.readString(outputDir().resolve("run.log")))
            .contains(" - ERROR - Error downloading metadata");
    }

    @Test
    void testFileRetriesHonorRetryOptions() {
        server.route("/api/views/metadata/v1", ScriptedResponse.json("[{\"id\":\"55\"}]"))
            .route("/api/views/55", ScriptedResponse.json(
                "{\"assetType\":\"file\",\"blobMimeType\":\"text/plain\",\"blobFilename\":\"n.txt\"}"))
            .route("/download/55/text/plain", ScriptedResponse.status(503));

        int exitCode = run("--output-dir", outputDir().toString(), "--api-url", server.getSiteUrl(),
            "--retries", "2", "--retry-delay", "0", "-q");

        assertThat(exitCode).isZero();
        assertThat(server.requestCount("/download/55/text/plain")).isEqualTo(2);
        assertThat(outputDir().resolve("55_metadata.json")).exists();
        assertThat(outputDir().resolve("n.txt")).doesNotExist();
    }

    @Test
    void testVerboseAndQuietTogetherIsUsageError() {
        int exitCode = run("--output-dir", outputDir().toString(), "-v", "-q");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("--verbose and --quiet");
        assertThat(server.totalRequests()).isZero();
    }

    @Test
    void testInvalidConcurrencyIsUsageError() {
        int exitCode = run("--output-dir", outputDir().toString(), "--concurrency", "0");

        assertThat(exitCode).isEqualTo(CommandLine.ExitCode.USAGE);
        assertThat(err.toString()).contains("concurrency");
    }

    @Test
    void testUnknownOptionIsUsageError() {
        assertThat(run("--no-such-option")).isEqualTo(CommandLine.ExitCode.USAGE);
    }
}
