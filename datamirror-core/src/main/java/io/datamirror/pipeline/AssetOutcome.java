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

import io.datamirror.download.DownloadResult;

import java.util.Optional;

/// What happened to one asset.
///
/// @param assetId The asset id
/// @param status The terminal state
/// @param reason The error description for PROCESSING_ERROR, otherwise null
/// @param download The payload result for PROCESSED_OK assets that had a known type, otherwise null
public record AssetOutcome(String assetId, OutcomeStatus status, String reason, DownloadResult download) {

    public static AssetOutcome alreadyDone(String assetId) {
        return new AssetOutcome(assetId, OutcomeStatus.ALREADY_DONE, null, null);
    }

    public static AssetOutcome noDetails(String assetId) {
        return new AssetOutcome(assetId, OutcomeStatus.NO_DETAILS, null, null);
    }

    public static AssetOutcome processed(String assetId, DownloadResult download) {
        return new AssetOutcome(assetId, OutcomeStatus.PROCESSED_OK, null, download);
    }

    public static AssetOutcome error(String assetId, String reason) {
        return new AssetOutcome(assetId, OutcomeStatus.PROCESSING_ERROR, reason, null);
    }

    /// @return the payload result, if a payload download was made or skipped
    public Optional<DownloadResult> downloadResult() {
        return Optional.ofNullable(download);
    }

    /// @return a one line description for the run log
    public String describe() {
        return switch (status) {
            case ALREADY_DONE -> "Asset " + assetId + " already processed";
            case NO_DETAILS -> "No details for asset " + assetId;
            case PROCESSED_OK -> "Asset " + assetId + " processed successfully"
                + (download == null ? "" : " (payload " + download.status() + ")");
            case PROCESSING_ERROR -> "Error processing asset " + assetId + ": " + reason;
        };
    }
}
