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

/// The kinds of asset a portal publishes, as named by the details `assetType` field.
public enum AssetKind {
    /// An uploaded file, downloaded as a blob
    FILE("file"),
    /// A tabular dataset, exported as CSV
    DATASET("dataset"),
    /// Anything else, including a missing type
    UNKNOWN(null);

    private final String typeName;

    AssetKind(String typeName) {
        this.typeName = typeName;
    }

    /// Classifies an asset by its details.
    ///
    /// @param details The asset details
    /// @return the kind named by the details' `assetType`
    public static AssetKind classify(AssetDetails details) {
        return fromAssetType(details.assetType().orElse(null));
    }

    /// Maps an `assetType` value to a kind. Matching is exact.
    ///
    /// @param assetType The value, may be null
    /// @return the matching kind, or UNKNOWN
    public static AssetKind fromAssetType(String assetType) {
        if (assetType == null) {
            return UNKNOWN;
        }
        for (AssetKind kind : values()) {
            if (assetType.equals(kind.typeName)) {
                return kind;
            }
        }
        return UNKNOWN;
    }
}
