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

import com.fasterxml.jackson.databind.JsonNode;
import io.datamirror.assets.AssetDetails;
import io.datamirror.config.ApiEndpoints;
import io.datamirror.events.EventSink;
import io.datamirror.events.MirrorEvent;
import io.datamirror.transport.TransportClient;
import io.datamirror.transport.TransportResult;

import java.util.Optional;

/// Fetches the details document of an asset. One request, no retry.
public class AssetDetailsFetcher {
    private final TransportClient transport;
    private final ApiEndpoints endpoints;
    private final EventSink events;

    public AssetDetailsFetcher(TransportClient transport, ApiEndpoints endpoints, EventSink events) {
        this.transport = transport;
        this.endpoints = endpoints;
        this.events = events;
    }

    /// @param assetId The asset id
    /// @return the details, or empty when the request failed or returned no usable object
    public Optional<AssetDetails> getAssetDetails(String assetId) {
        TransportResult<JsonNode> response = transport.getJson(endpoints.detailsUrl(assetId));
        if (!response.isSuccess()) {
            events.log(MirrorEvent.AS_DETAILS_FAILED, "assetId", assetId, "cause", response.failure());
            return Optional.empty();
        }
        return AssetDetails.from(response.value());
    }
}
