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


/// Describes why a transport call did not produce a usable response.
///
/// @param kind The failure category
/// @param url The requested URL
/// @param statusCode The HTTP status for {@link FailureKind#HTTP_STATUS}, otherwise -1
/// @param message A human readable description, including any error body the server sent
/// @param cause The underlying exception, or null when the failure is a status code
public record TransportFailure(
    FailureKind kind,
    String url,
    int statusCode,
    String message,
    Throwable cause
) {

    /// Creates a failure for a request that did not complete.
    ///
    /// @param url The requested URL
    /// @param cause The I/O error
    /// @return A {@link FailureKind#NETWORK} failure
    public static TransportFailure network(String url, Throwable cause) {
        String detail = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
        return new TransportFailure(FailureKind.NETWORK, url, -1, detail, cause);
    }

    /// Creates a failure for a non-success status.
    ///
    /// @param url The requested URL
    /// @param statusCode The HTTP status code
    /// @param errorBody Any body text returned with the status, may be empty
    /// @return A {@link FailureKind#HTTP_STATUS} failure
    public static TransportFailure httpStatus(String url, int statusCode, String errorBody) {
        String message = "HTTP " + statusCode + (errorBody == null || errorBody.isEmpty() ? "" : ": " + errorBody);
        return new TransportFailure(FailureKind.HTTP_STATUS, url, statusCode, message, null);
    }

    /// Creates a failure for a body that is not valid JSON.
    ///
    /// @param url The requested URL
    /// @param cause The parse error
    /// @return A {@link FailureKind#DECODE} failure
    public static TransportFailure decode(String url, Throwable cause) {
        return new TransportFailure(FailureKind.DECODE, url, -1, "invalid JSON body: " + cause.getMessage(), cause);
    }

    @Override
    public String toString() {
        return kind + " " + message + " (" + url + ")";
    }
}
