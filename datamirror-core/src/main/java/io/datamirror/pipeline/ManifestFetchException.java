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

import io.datamirror.transport.TransportFailure;

import java.io.IOException;
import java.util.Optional;

/// Thrown when the metadata manifest could not be obtained. A run cannot continue
/// without it.
public class ManifestFetchException extends Exception {
    private final TransportFailure failure;

    /// @param failure The failed manifest request
    public ManifestFetchException(TransportFailure failure) {
        super("Error downloading metadata: " + failure, failure.cause());
        this.failure = failure;
    }

    /// @param message What could not be done
    /// @param cause The local I/O error
    public ManifestFetchException(String message, IOException cause) {
        super(message, cause);
        this.failure = null;
    }

    /// @return the transport failure, if the request itself failed
    public Optional<TransportFailure> getFailure() {
        return Optional.ofNullable(failure);
    }
}
