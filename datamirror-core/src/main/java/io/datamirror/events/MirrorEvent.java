package io.datamirror.events;

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

import java.util.LinkedHashMap;
import java.util.Map;

/// Events reported while mirroring a portal's assets.
///
/// Names are prefixed by the stage that reports them: `MF_` manifest, `AS_` single asset,
/// `FD_` file blob download, `TD_` table download and `BT_` batch.
public enum MirrorEvent implements EventType {
    MF_FETCHED(Level.INFO, "Downloaded metadata to {path}",
        param("path", Object.class)),
    MF_FETCH_FAILED(Level.ERROR, "Error downloading metadata from {url}: {cause}",
        param("url", String.class), param("cause", Object.class)),
    MF_UNREADABLE(Level.ERROR, "Error decoding metadata JSON in {path}: {cause}",
        param("path", Object.class), param("cause", Object.class)),
    MF_NOT_A_LIST(Level.ERROR, "Metadata file {path} does not contain a list, found {found}",
        param("path", Object.class), param("found", String.class)),
    MF_RECORD_NOT_OBJECT(Level.WARN, "Item {index} in the list is not an object, skipping",
        param("index", Integer.class)),
    MF_RECORD_NO_ID(Level.WARN, "Item {index} in the list does not contain an 'id' key, skipping",
        param("index", Integer.class)),

    AS_ALREADY_DONE(Level.INFO, "Metadata file already exists for asset {assetId}. Skipping.",
        param("assetId", String.class)),
    AS_DETAILS_FAILED(Level.ERROR, "Error getting details for asset {assetId}: {cause}",
        param("assetId", String.class), param("cause", Object.class)),
    AS_NO_DETAILS(Level.WARN, "No details found for asset {assetId}",
        param("assetId", String.class)),
    AS_UNKNOWN_TYPE(Level.WARN, "Unknown asset type '{assetType}' for {assetId}",
        param("assetId", String.class), param("assetType", String.class)),
    AS_ERROR(Level.ERROR, "Error processing asset {assetId}: {reason}",
        param("assetId", String.class), param("reason", String.class)),
    AS_OUTCOME(Level.INFO, "Asset {assetId}: {outcome}",
        param("assetId", String.class), param("outcome", Object.class)),

    FD_NO_MIME_TYPE(Level.WARN, "No blobMimeType found for file asset {assetId}",
        param("assetId", String.class)),
    FD_NO_FILENAME(Level.WARN, "blobFilename missing for asset {assetId}. Using {fallback} as filename.",
        param("assetId", String.class), param("fallback", String.class)),
    FD_RENAMED(Level.WARN, "File {filename} already exists. Renaming to {target}.",
        param("filename", String.class), param("target", Object.class)),
    FD_ATTEMPT_FAILED(Level.ERROR, "Error downloading file asset {assetId} (attempt {attempt}/{retries}): {cause}",
        param("assetId", String.class), param("attempt", Integer.class),
        param("retries", Integer.class), param("cause", Object.class)),
    FD_BACKOFF(Level.DEBUG, "Waiting {delay} before retrying file asset {assetId}",
        param("assetId", String.class), param("delay", Object.class)),
    FD_DOWNLOADED(Level.INFO, "Downloaded file asset {assetId} to {target} ({bytes} bytes)",
        param("assetId", String.class), param("target", Object.class), param("bytes", Long.class)),
    FD_GAVE_UP(Level.ERROR, "Failed to download file asset {assetId} after {retries} retries.",
        param("assetId", String.class), param("retries", Integer.class)),

    TD_DOWNLOADED(Level.INFO, "Downloaded table asset {assetId} to {target} ({bytes} bytes)",
        param("assetId", String.class), param("target", Object.class), param("bytes", Long.class)),
    TD_FAILED(Level.ERROR, "Error downloading table asset {assetId}: {cause}",
        param("assetId", String.class), param("cause", Object.class)),

    BT_FOUND(Level.INFO, "Found {count} assets to process.",
        param("count", Integer.class)),
    BT_TASK_FAILED(Level.ERROR, "A worker raised an exception: {cause}",
        param("cause", Object.class)),
    BT_SUMMARY(Level.INFO,
        "Final statistics: assets {found}, skipped records {skipped}, processed {processed}, already done {done}, "
            + "no details {noDetails}, errors {errors}, payloads downloaded {downloaded}, payloads failed {failed}",
        param("found", Integer.class), param("skipped", Integer.class), param("processed", Long.class),
        param("done", Long.class), param("noDetails", Long.class), param("errors", Long.class),
        param("downloaded", Long.class), param("failed", Long.class));

    private final Level level;
    private final String template;
    private final Map<String, Class<?>> requiredParams;

    @SafeVarargs
    MirrorEvent(Level level, String template, Map.Entry<String, Class<?>>... params) {
        this.level = level;
        this.template = template;
        Map<String, Class<?>> map = new LinkedHashMap<>();
        for (Map.Entry<String, Class<?>> param : params) {
            map.put(param.getKey(), param.getValue());
        }
        this.requiredParams = Map.copyOf(map);
    }

    private static Map.Entry<String, Class<?>> param(String name, Class<?> type) {
        return Map.entry(name, type);
    }

    @Override
    public Level getLevel() {
        return level;
    }

    @Override
    public Map<String, Class<?>> getRequiredParams() {
        return requiredParams;
    }

    @Override
    public String getTemplate() {
        return template;
    }
}
