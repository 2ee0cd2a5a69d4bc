package io.datamirror.transport;

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

/// Issues HTTP GET requests against the metadata API.
///
/// Implementations never retry on their own and never throw for network or status
/// problems; every failure comes back as a {@link TransportFailure} so that each
/// call site can apply its own retry, skip or propagate policy.
public interface TransportClient extends AutoCloseable {

    /// Fetches a URL and decodes its body as JSON.
    ///
    /// @param url The URL to fetch
    /// @return The parsed body, or a failure
    TransportResult<JsonNode> getJson(String url);

    /// Fetches a URL and hands back its body as a stream.
    ///
    /// The returned body must be closed by the caller.
    ///
    /// @param url The URL to fetch
    /// @return The open body, or a failure
    TransportResult<StreamingBody> getStream(String url);

    @Override
    default void close() {
    }
}
