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

import io.datamirror.assets.AssetDetails;
import io.datamirror.config.ApiEndpoints;
import io.datamirror.events.EventSink;
import io.datamirror.events.MirrorEvent;
import io.datamirror.output.FileNaming;
import io.datamirror.output.OutputDirectory;
import io.datamirror.transport.StreamingBody;
import io.datamirror.transport.TransportClient;
import io.datamirror.transport.TransportFailure;
import io.datamirror.transport.TransportResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/// Downloads the blob of a file asset, retrying transport failures with backoff.
///
/// The blob is saved under its published file name. When a file of that name already
/// exists in the output directory, the blob is saved as `{stem}_{id}{suffix}` and the
/// existing file is left alone.
public class FileAssetDownloader {
    private final TransportClient transport;
    private final ApiEndpoints endpoints;
    private final OutputDirectory output;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final EventSink events;

    public FileAssetDownloader(
        TransportClient transport,
        ApiEndpoints endpoints,
        OutputDirectory output,
        RetryPolicy retryPolicy,
        Sleeper sleeper,
        EventSink events
    ) {
        this.transport = transport;
        this.endpoints = endpoints;
        this.output = output;
        this.retryPolicy = retryPolicy;
        this.sleeper = sleeper;
        this.events = events;
    }

    /// Downloads a file asset's blob.
    ///
    /// @param assetId The asset id
    /// @param details The asset's details, providing the mime type and file name
    /// @return SKIPPED without a request when the mime type is missing, otherwise
    ///     DOWNLOADED or, once every attempt failed, FAILED
    /// @throws IOException if the blob cannot be written to disk
    public DownloadResult downloadFileAsset(String assetId, AssetDetails details) throws IOException {
        String mimeType = details.blobMimeType().orElse(null);
        if (mimeType == null) {
            events.log(MirrorEvent.FD_NO_MIME_TYPE, "assetId", assetId);
            return DownloadResult.skipped();
        }
        String url = endpoints.fileBlobUrl(assetId, mimeType);
        int retries = retryPolicy.retries();

        Path target = null;
        TransportFailure lastFailure = null;
        for (int attempt = 0; attempt < retries; attempt++) {
            TransportResult<StreamingBody> response = transport.getStream(url);
            if (response.isSuccess()) {
                target = chooseTarget(assetId, details);
                try (StreamingBody body = response.value()) {
                    TransportResult<Long> written = BodyWriter.write(body, target, url);
                    if (written.isSuccess()) {
                        events.log(MirrorEvent.FD_DOWNLOADED,
                            "assetId", assetId, "target", target, "bytes", written.value());
                        return DownloadResult.downloaded(target, written.value(), attempt + 1);
                    }
                    lastFailure = written.failure();
                }
            } else {
                lastFailure = response.failure();
            }

            events.log(MirrorEvent.FD_ATTEMPT_FAILED,
                "assetId", assetId, "attempt", attempt + 1, "retries", retries, "cause", lastFailure);
            if (retryPolicy.hasAttemptAfter(attempt)) {
                Duration delay = retryPolicy.delayAfterAttempt(attempt);
                events.log(MirrorEvent.FD_BACKOFF, "assetId", assetId, "delay", delay);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    events.warn("Interrupted while waiting to retry file asset {}", assetId);
                    return DownloadResult.failed(target, attempt + 1, lastFailure);
                }
            }
        }
        events.log(MirrorEvent.FD_GAVE_UP, "assetId", assetId, "retries", retries);
        return DownloadResult.failed(target, retries, lastFailure);
    }

    private Path chooseTarget(String assetId, AssetDetails details) {
        String filename = details.blobFilename().flatMap(FileNaming::safeFileName).orElse(null);
        if (filename == null) {
            filename = assetId + ".file";
            events.log(MirrorEvent.FD_NO_FILENAME, "assetId", assetId, "fallback", filename);
        }
        Path target = output.resolve(filename);
        if (Files.exists(target)) {
            Path renamed = output.resolve(FileNaming.collisionName(filename, assetId));
            events.log(MirrorEvent.FD_RENAMED, "filename", filename, "target", renamed);
            return renamed;
        }
        return target;
    }
}
