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

import io.datamirror.assets.AssetDetails;
import io.datamirror.download.DownloadResult;
import io.datamirror.download.FileAssetDownloader;
import io.datamirror.download.TableAssetDownloader;
import io.datamirror.events.EventSink;
import io.datamirror.events.MirrorEvent;
import io.datamirror.output.OutputDirectory;

import java.io.IOException;
import java.util.Optional;

/// Processes a single asset: skip if done, fetch and persist its details, then download
/// its payload according to its type.
///
/// The details file is written before the payload. It is the marker a later run uses to
/// skip the asset, so an interrupted payload download is not resumed.
public class AssetProcessor implements AssetHandler {
    private final OutputDirectory output;
    private final AssetDetailsFetcher detailsFetcher;
    private final FileAssetDownloader fileDownloader;
    private final TableAssetDownloader tableDownloader;
    private final EventSink events;

    public AssetProcessor(
        OutputDirectory output,
        AssetDetailsFetcher detailsFetcher,
        FileAssetDownloader fileDownloader,
        TableAssetDownloader tableDownloader,
        EventSink events
    ) {
        this.output = output;
        this.detailsFetcher = detailsFetcher;
        this.fileDownloader = fileDownloader;
        this.tableDownloader = tableDownloader;
        this.events = events;
    }

    @Override
    public AssetOutcome processSingleAsset(String assetId) {
        try {
            if (output.isDone(assetId)) {
                events.log(MirrorEvent.AS_ALREADY_DONE, "assetId", assetId);
                return AssetOutcome.alreadyDone(assetId);
            }
            Optional<AssetDetails> found = detailsFetcher.getAssetDetails(assetId);
            if (found.isEmpty()) {
                events.log(MirrorEvent.AS_NO_DETAILS, "assetId", assetId);
                return AssetOutcome.noDetails(assetId);
            }
            AssetDetails details = found.get();
            output.writeJson(output.detailsFile(assetId), details.json());

            DownloadResult download = switch (details.kind()) {
                case FILE -> fileDownloader.downloadFileAsset(assetId, details);
                case DATASET -> tableDownloader.downloadTableAsset(assetId);
                case UNKNOWN -> {
                    events.log(MirrorEvent.AS_UNKNOWN_TYPE,
                        "assetId", assetId, "assetType", details.assetType().orElse(null));
                    yield null;
                }
            };
            return AssetOutcome.processed(assetId, download);
        } catch (IOException | RuntimeException e) {
            String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            events.log(MirrorEvent.AS_ERROR, "assetId", assetId, "reason", reason);
            return AssetOutcome.error(assetId, reason);
        }
    }
}
