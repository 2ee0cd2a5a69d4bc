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

import io.datamirror.download.DownloadStatus;

import java.util.List;

/// Summary of a batch run over a manifest.
///
/// @param assetsFound The number of asset ids extracted from the manifest
/// @param skippedRecords The number of manifest records without a usable id
/// @param outcomes The outcome of each asset, in completion order
/// @param poolErrors The number of tasks that threw instead of returning an outcome
/// @param manifestRejected True if the manifest was not a readable JSON list
public record BatchReport(
    int assetsFound,
    int skippedRecords,
    List<AssetOutcome> outcomes,
    int poolErrors,
    boolean manifestRejected
) {

    public BatchReport {
        outcomes = List.copyOf(outcomes);
    }

    /// @return the report for a manifest that could not be used
    public static BatchReport rejected() {
        return new BatchReport(0, 0, List.of(), 0, true);
    }

    /// @param status An outcome status
    /// @return how many assets ended in that status
    public long count(OutcomeStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    /// @return how many payloads were written
    public long payloadsDownloaded() {
        return countPayloads(DownloadStatus.DOWNLOADED);
    }

    /// @return how many payload downloads failed
    public long payloadsFailed() {
        return countPayloads(DownloadStatus.FAILED);
    }

    private long countPayloads(DownloadStatus status) {
        return outcomes.stream()
            .filter(o -> o.download() != null && o.download().status() == status)
            .count();
    }
}
