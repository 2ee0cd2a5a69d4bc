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


import java.io.ByteArrayInputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;

/// A response body that is read incrementally.
///
/// The body holds the underlying connection open until it is closed, so callers
/// must use it in a try-with-resources block.
public class StreamingBody implements Closeable {
    private final InputStream stream;
    private final long contentLength;
    private final Closeable release;

    /// Creates a streaming body.
    ///
    /// @param stream The body stream
    /// @param contentLength The declared length, or -1 if unknown
    /// @param release Releases the connection backing the stream
    public StreamingBody(InputStream stream, long contentLength, Closeable release) {
        this.stream = stream;
        this.contentLength = contentLength;
        this.release = release;
    }

    /// Wraps an in-memory byte array as a body.
    ///
    /// @param bytes The body bytes
    /// @return A body with a known length
    public static StreamingBody ofBytes(byte[] bytes) {
        ByteArrayInputStream in = new ByteArrayInputStream(bytes);
        return new StreamingBody(in, bytes.length, in);
    }

    /// @return the body stream, read it before closing this body
    public InputStream stream() {
        return stream;
    }

    /// @return the declared content length, or -1 if the server did not declare one
    public long contentLength() {
        return contentLength;
    }

    @Override
    public void close() throws IOException {
        try {
            stream.close();
        } finally {
            release.close();
        }
    }
}
