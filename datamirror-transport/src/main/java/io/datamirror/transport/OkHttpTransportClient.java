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


import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/// OkHttp implementation of {@link TransportClient}.
///
/// A single client with a shared connection pool serves all worker threads. OkHttp's
/// own connection-failure retry is turned off, retry policy belongs to the callers.
public class OkHttpTransportClient implements TransportClient {
    private static final Logger logger = LogManager.getLogger(OkHttpTransportClient.class);

    /// Default connect timeout
    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    /// Default read timeout, applied per read on streamed bodies
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(60);

    private static final int MAX_ERROR_BODY = 512;

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;

    /// Creates a client with the default timeouts.
    public OkHttpTransportClient() {
        this(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT);
    }

    /// Creates a client with explicit timeouts.
    ///
    /// @param connectTimeout The connect timeout
    /// @param readTimeout The read timeout
    public OkHttpTransportClient(Duration connectTimeout, Duration readTimeout) {
        this(connectTimeout, readTimeout, new ObjectMapper());
    }

    /// Creates a client with explicit timeouts and JSON mapper.
    ///
    /// @param connectTimeout The connect timeout
    /// @param readTimeout The read timeout
    /// @param mapper The mapper used to decode JSON bodies
    public OkHttpTransportClient(Duration connectTimeout, Duration readTimeout, ObjectMapper mapper) {
        this.mapper = mapper;
        this.httpClient = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(16, 5, TimeUnit.MINUTES))
            .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
            .retryOnConnectionFailure(false)
            .build();
    }

    @Override
    public TransportResult<JsonNode> getJson(String url) {
        Request request;
        try {
            request = new Request.Builder().url(url).header("Accept", "application/json").get().build();
        } catch (IllegalArgumentException e) {
            return TransportResult.failed(TransportFailure.network(url, e));
        }

        logger.debug("GET {} (json)", url);
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                return TransportResult.failed(
                    TransportFailure.httpStatus(url, response.code(), readErrorBody(response)));
            }
            ResponseBody body = response.body();
            String content = body != null ? body.string() : "";
            try {
                JsonNode node = mapper.readTree(content);
                if (node == null || node.isMissingNode()) {
                    return TransportResult.failed(
                        TransportFailure.decode(url, new IOException("empty response body")));
                }
                return TransportResult.ok(node);
            } catch (JsonProcessingException e) {
                return TransportResult.failed(TransportFailure.decode(url, e));
            }
        } catch (IOException e) {
            return TransportResult.failed(TransportFailure.network(url, e));
        }
    }

    @Override
    public TransportResult<StreamingBody> getStream(String url) {
        Request request;
        try {
            request = new Request.Builder().url(url).get().build();
        } catch (IllegalArgumentException e) {
            return TransportResult.failed(TransportFailure.network(url, e));
        }

        logger.debug("GET {} (stream)", url);
        Response response;
        try {
            response = httpClient.newCall(request).execute();
        } catch (IOException e) {
            return TransportResult.failed(TransportFailure.network(url, e));
        }

        if (!response.isSuccessful()) {
            try (response) {
                return TransportResult.failed(
                    TransportFailure.httpStatus(url, response.code(), readErrorBody(response)));
            }
        }
        ResponseBody body = response.body();
        if (body == null) {
            response.close();
            return TransportResult.failed(
                TransportFailure.network(url, new IOException("response has no body")));
        }
        return TransportResult.ok(new StreamingBody(body.byteStream(), body.contentLength(), response));
    }

    private String readErrorBody(Response response) {
        try {
            ResponseBody body = response.body();
            if (body == null) {
                return "";
            }
            String text = body.string();
            return text.length() > MAX_ERROR_BODY ? text.substring(0, MAX_ERROR_BODY) + "..." : text;
        } catch (IOException e) {
            logger.debug("could not read error body from {}: {}", response.request().url(), e.getMessage());
            return "";
        }
    }

    @Override
    public void close() {
        httpClient.dispatcher().executorService().shutdown();
        httpClient.connectionPool().evictAll();
    }
}
