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

import com.fasterxml.jackson.databind.JsonNode;
import io.datamirror.config.ApiEndpoints;
import io.datamirror.events.EventSink;
import io.datamirror.events.MirrorEvent;
import io.datamirror.output.OutputDirectory;
import io.datamirror.transport.TransportClient;
import io.datamirror.transport.TransportResult;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/// Downloads the portal's metadata manifest and saves a timestamped snapshot of it.
public class ManifestFetcher {
    private static final DateTimeFormatter SNAPSHOT_TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final TransportClient transport;
    private final ApiEndpoints endpoints;
    private final OutputDirectory output;
    private final Clock clock;
    private final EventSink events;

    public ManifestFetcher(TransportClient transport, ApiEndpoints endpoints, OutputDirectory output, Clock clock,
                           EventSink events) {
        this.transport = transport;
        this.endpoints = endpoints;
        this.output = output;
        this.clock = clock;
        this.events = events;
    }

    /// Fetches the manifest and writes it to `metadata_{yyyyMMdd_HHmmss}.json`.
    ///
    /// @return the snapshot file
    /// @throws ManifestFetchException if the request failed or the snapshot could not be written
    public Path fetchManifest() throws ManifestFetchException {
        String url = endpoints.manifestUrl();
        TransportResult<JsonNode> response = transport.getJson(url);
        if (!response.isSuccess()) {
            events.log(MirrorEvent.MF_FETCH_FAILED, "url", url, "cause", response.failure());
            throw new ManifestFetchException(response.failure());
        }
        Path snapshot = snapshotPath();
        try {
            output.writeJson(snapshot, response.value());
        } catch (IOException e) {
            events.log(MirrorEvent.MF_FETCH_FAILED, "url", url, "cause", e.getMessage());
            throw new ManifestFetchException("Error writing metadata to " + snapshot, e);
        }
        events.log(MirrorEvent.MF_FETCHED, "path", snapshot);
        return snapshot;
    }

    /// @return the snapshot file name for the current time
    Path snapshotPath() {
        return output.resolve("metadata_" + LocalDateTime.now(clock).format(SNAPSHOT_TIMESTAMP) + ".json");
    }
}
