package io.datamirror.pipeline;

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

import io.datamirror.config.ApiEndpoints;
import io.datamirror.config.MirrorConfig;
import io.datamirror.download.FileAssetDownloader;
import io.datamirror.download.Sleeper;
import io.datamirror.download.TableAssetDownloader;
import io.datamirror.events.EventSink;
import io.datamirror.output.OutputDirectory;
import io.datamirror.transport.TransportClient;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;

/// One complete mirror run: fetch the manifest, then process every asset in it.
///
/// The runner wires the pipeline components from a {@link MirrorConfig}. The transport
/// is owned by the caller.
public class MirrorRunner {
    private final MirrorConfig config;
    private final OutputDirectory output;
    private final ManifestFetcher manifestFetcher;
    private final BatchOrchestrator orchestrator;
    private final EventSink events;

    public MirrorRunner(MirrorConfig config, TransportClient transport, EventSink events) {
        this(config, transport, Clock.systemDefaultZone(), Sleeper.SYSTEM, events);
    }

    public MirrorRunner(MirrorConfig config, TransportClient transport, Clock clock, Sleeper sleeper,
                        EventSink events) {
        this.config = config;
        this.events = events;
        this.output = new OutputDirectory(config.outputDir());
        ApiEndpoints endpoints = config.endpoints();
        this.manifestFetcher = new ManifestFetcher(transport, endpoints, output, clock, events);
        AssetProcessor processor = new AssetProcessor(
            output,
            new AssetDetailsFetcher(transport, endpoints, events),
            new FileAssetDownloader(transport, endpoints, output, config.retryPolicy(), sleeper, events),
            new TableAssetDownloader(transport, endpoints, output, events),
            events);
        this.orchestrator = new BatchOrchestrator(processor, output.mapper(), events);
    }

    /// Runs the mirror.
    ///
    /// @return the batch report
    /// @throws ManifestFetchException if the manifest could not be obtained
    /// @throws IOException if the output directory cannot be created or the manifest
    ///     snapshot cannot be read back
    public BatchReport run() throws ManifestFetchException, IOException {
        output.ensureExists();
        events.info("Mirroring {} into {}", config.endpoints().apiBaseUrl(), output.root());
        Path manifest = manifestFetcher.fetchManifest();
        return orchestrator.processAssets(manifest, config.concurrency());
    }
}
