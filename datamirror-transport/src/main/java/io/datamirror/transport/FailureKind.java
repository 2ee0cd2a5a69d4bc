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


/// The kind of failure a transport call ended with.
///
/// Callers use the kind, not an exception type, to decide whether to retry,
/// skip or give up on a request.
public enum FailureKind {
    /// The request never produced a complete response: connect, read or protocol error
    NETWORK,
    /// The server answered with a status outside of 2xx
    HTTP_STATUS,
    /// The server answered 2xx, but the body could not be decoded as JSON
    DECODE
}
