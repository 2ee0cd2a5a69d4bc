package io.datamirror.download;

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
import io.datamirror.events.EventSink;
import io.datamirror.events.MirrorEvent;
import io.datamirror.output.OutputDirectory;
import io.datamirror.transport.StreamingBody;
import io.datamirror.transport.TransportClient;
import io.datamirror.transport.TransportResult;

import java.io.IOException;
import java.nio.file.Path;

/// Downloads the CSV export of a dataset asset to `{id}.csv`, replacing any earlier copy.
/// A single attempt is made.
public class TableAssetDownloader {
    private final TransportClient transport;
    private final ApiEndpoints endpoints;
    private final OutputDirectory output;
    private final EventSink events;

    public TableAssetDownloader(TransportClient transport, ApiEndpoints endpoints, OutputDirectory output,
                                EventSink events) {
        this.transport = transport;
        this.endpoints = endpoints;
        this.output = output;
        this.events = events;
    }

    /// @param assetId The dataset asset id
    /// @return DOWNLOADED, or FAILED when the export could not be fetched or read
    /// @throws IOException if the CSV file cannot be written
    public DownloadResult downloadTableAsset(String assetId) throws IOException {
        String url = endpoints.tableExportUrl(assetId);
        Path target = output.tableFile(assetId);
        TransportResult<StreamingBody> response = transport.getStream(url);
        if (!response.isSuccess()) {
            events.log(MirrorEvent.TD_FAILED, "assetId", assetId, "cause", response.failure());
            return DownloadResult.failed(target, 1, response.failure());
        }
        try (StreamingBody body = response.value()) {
            TransportResult<Long> written = BodyWriter.write(body, target, url);
            if (!written.isSuccess()) {
                events.log(MirrorEvent.TD_FAILED, "assetId", assetId, "cause", written.failure());
                return DownloadResult.failed(target, 1, written.failure());
            }
            events.log(MirrorEvent.TD_DOWNLOADED, "assetId", assetId, "target", target, "bytes", written.value());
            return DownloadResult.downloaded(target, written.value(), 1);
        }
    }
}
