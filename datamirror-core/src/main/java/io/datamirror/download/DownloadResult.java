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

import io.datamirror.transport.TransportFailure;

import java.nio.file.Path;

/// The result of downloading one asset payload.
///
/// @param path The file written or targeted, or null when no target was chosen
/// @param status The download status
/// @param bytes The number of bytes written
/// @param attempts The number of requests made
/// @param failure The last failure, or null unless the status is FAILED
public record DownloadResult(
    Path path,
    DownloadStatus status,
    long bytes,
    int attempts,
    TransportFailure failure
) {

    /// Creates a successful download result.
    ///
    /// @param path The path where the file was downloaded
    /// @param bytes The number of bytes downloaded
    /// @param attempts The number of requests it took
    /// @return A new DownloadResult with DOWNLOADED status
    public static DownloadResult downloaded(Path path, long bytes, int attempts) {
        return new DownloadResult(path, DownloadStatus.DOWNLOADED, bytes, attempts, null);
    }

    /// Creates a result for a download that was never attempted.
    ///
    /// @return A new DownloadResult with SKIPPED status
    public static DownloadResult skipped() {
        return new DownloadResult(null, DownloadStatus.SKIPPED, 0, 0, null);
    }

    /// Creates a failed download result.
    ///
    /// @param path The path where the download was attempted, may be null
    /// @param attempts The number of requests made
    /// @param failure The failure of the last attempt
    /// @return A new DownloadResult with FAILED status
    public static DownloadResult failed(Path path, int attempts, TransportFailure failure) {
        return new DownloadResult(path, DownloadStatus.FAILED, 0, attempts, failure);
    }

    /// @return true if the payload was written
    public boolean isSuccess() {
        return status == DownloadStatus.DOWNLOADED;
    }
}
