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
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/// The details document of one asset.
///
/// The raw object is kept as received so it can be persisted without loss. The accessors
/// expose the few fields the mirror acts on. A field that is missing, null, not textual or
/// empty reads as absent.
public final class AssetDetails {
    private final ObjectNode json;

    private AssetDetails(ObjectNode json) {
        this.json = json;
    }

    /// Wraps a details response.
    ///
    /// @param node The decoded response body
    /// @return the details, or empty when the body is not an object or is an empty object
    public static Optional<AssetDetails> from(JsonNode node) {
        if (node == null || !node.isObject() || node.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new AssetDetails((ObjectNode) node));
    }

    /// @return the raw details object
    public ObjectNode json() {
        return json;
    }

    public Optional<String> assetType() {
        return text("assetType");
    }

    public Optional<String> blobMimeType() {
        return text("blobMimeType");
    }

    public Optional<String> blobFilename() {
        return text("blobFilename");
    }

    /// @return the kind named by `assetType`
    public AssetKind kind() {
        return AssetKind.classify(this);
    }

    private Optional<String> text(String field) {
        JsonNode value = json.get(field);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.asText());
    }

    @Override
    public String toString() {
        return "AssetDetails{" + json + "}";
    }
}
