package io.datamirror.assets;

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
import io.datamirror.events.EventSink;
import io.datamirror.events.MirrorEvent;

import java.util.ArrayList;
import java.util.List;

/// The asset ids listed by a metadata manifest.
///
/// Records that are not objects, or that carry no usable `id`, are reported and skipped.
/// Textual and numeric ids are accepted, numeric ones in their text form.
///
/// @param assetIds The ids in manifest order
/// @param skippedRecords How many records were skipped
public record AssetManifest(List<String> assetIds, int skippedRecords) {

    public AssetManifest {
        assetIds = List.copyOf(assetIds);
    }

    /// Extracts the asset ids from a manifest array.
    ///
    /// @param records The manifest array
    /// @param events Receives a warning for each skipped record
    /// @return the extracted ids
    public static AssetManifest fromRecords(JsonNode records, EventSink events) {
        if (records == null || !records.isArray()) {
            throw new IllegalArgumentException("manifest must be a JSON array");
        }
        List<String> ids = new ArrayList<>(records.size());
        int skipped = 0;
        for (int i = 0; i < records.size(); i++) {
            JsonNode record = records.get(i);
            if (!record.isObject()) {
                events.log(MirrorEvent.MF_RECORD_NOT_OBJECT, "index", i);
                skipped++;
                continue;
            }
            JsonNode id = record.get("id");
            if (id == null || !(id.isTextual() || id.isNumber()) || id.asText().isEmpty()) {
                events.log(MirrorEvent.MF_RECORD_NO_ID, "index", i);
                skipped++;
                continue;
            }
            ids.add(id.asText());
        }
        return new AssetManifest(ids, skipped);
    }

    /// @return the number of assets to process
    public int size() {
        return assetIds.size();
    }
}
