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

/// The outcome of a transport call: either a value or a {@link TransportFailure}.
///
/// @param value The response value, or null when the call failed
/// @param failure The failure, or null when the call succeeded
/// @param <T> The response value type
public record TransportResult<T>(T value, TransportFailure failure) {

    public TransportResult {
        if ((value == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of value or failure must be set");
        }
    }

    /// Creates a successful result.
    ///
    /// @param value The response value
    /// @param <T> The response value type
    /// @return A successful result
    public static <T> TransportResult<T> ok(T value) {
        return new TransportResult<>(value, null);
    }

    /// Creates a failed result.
    ///
    /// @param failure The failure description
    /// @param <T> The response value type
    /// @return A failed result
    public static <T> TransportResult<T> failed(TransportFailure failure) {
        return new TransportResult<>(null, failure);
    }

    /// @return true if the call produced a value
    public boolean isSuccess() {
        return failure == null;
    }

    /// Gets the value of a successful result.
    ///
    /// @return The value
    /// @throws IllegalStateException if the call failed
    public T getRequired() {
        if (failure != null) {
            throw new IllegalStateException("transport call failed: " + failure);
        }
        return value;
    }
}
