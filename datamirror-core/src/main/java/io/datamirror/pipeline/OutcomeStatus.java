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

/// Terminal state of one asset in a batch.
public enum OutcomeStatus {
    /// The details marker existed, nothing was requested
    ALREADY_DONE,
    /// The details could not be fetched or were empty
    NO_DETAILS,
    /// Details were persisted and the payload handled, whether or not it downloaded
    PROCESSED_OK,
    /// An unexpected error stopped processing
    PROCESSING_ERROR
}
