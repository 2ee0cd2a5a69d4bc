package io.datamirror.config;

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

/// The URLs of the portal endpoints used by a mirror run.
///
/// Asset ids and mime types are inserted verbatim. Mime types contain a `/`, which
/// the blob endpoint expects as two path segments.
///
/// @param apiBaseUrl The API base, for example `https://data.cdc.gov/api`
/// @param downloadBaseUrl The blob download base, for example `https://data.cdc.gov/download`
public record ApiEndpoints(String apiBaseUrl, String downloadBaseUrl) {

    public ApiEndpoints {
        apiBaseUrl = trimTrailingSlashes(apiBaseUrl);
        downloadBaseUrl = trimTrailingSlashes(downloadBaseUrl);
    }

    /// Derives the API and download bases from a portal site URL.
    ///
    /// @param siteUrl The site URL, for example `https://data.cdc.gov`
    /// @return Endpoints under `{siteUrl}/api` and `{siteUrl}/download`
    public static ApiEndpoints fromSiteUrl(String siteUrl) {
        String site = trimTrailingSlashes(siteUrl);
        return new ApiEndpoints(site + "/api", site + "/download");
    }

    /// @return the URL of the metadata manifest listing every asset
    public String manifestUrl() {
        return apiBaseUrl + "/views/metadata/v1";
    }

    /// @param assetId The asset id
    /// @return the URL of one asset's details
    public String detailsUrl(String assetId) {
        return apiBaseUrl + "/views/" + assetId;
    }

    /// @param assetId The asset id
    /// @param mimeType The blob mime type
    /// @return the URL of a file asset's blob
    public String fileBlobUrl(String assetId, String mimeType) {
        return downloadBaseUrl + "/" + assetId + "/" + mimeType;
    }

    /// @param assetId The asset id
    /// @return the URL of a dataset asset's CSV export
    public String tableExportUrl(String assetId) {
        return apiBaseUrl + "/views/" + assetId + "/rows.csv";
    }

    private static String trimTrailingSlashes(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("URL cannot be null or empty");
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
