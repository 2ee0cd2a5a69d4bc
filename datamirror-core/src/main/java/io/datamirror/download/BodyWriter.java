package io.datamirror.download;

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

import io.datamirror.transport.StreamingBody;
import io.datamirror.transport.TransportFailure;
import io.datamirror.transport.TransportResult;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/// Copies a response body to a file.
///
/// Reading and writing fail differently: a read error is a transport failure the caller
/// may retry, a write error is a local fault and is thrown. Either way the partial file is
/// removed.
final class BodyWriter {
    static final int BUFFER_SIZE = 8192;

    private BodyWriter() {
    }

    /// @param body The response body, closed by the caller
    /// @param target The file to create or overwrite
    /// @param url The requested URL, for failure reports
    /// @return the number of bytes written, or a NETWORK failure if the body could not be read
    /// @throws IOException if the file cannot be written
    static TransportResult<Long> write(StreamingBody body, Path target, String url) throws IOException {
        long total = 0;
        IOException readError = null;
        byte[] buffer = new byte[BUFFER_SIZE];
        try (OutputStream out = Files.newOutputStream(target)) {
            InputStream in = body.stream();
            while (true) {
                int read;
                try {
                    read = in.read(buffer);
                } catch (IOException e) {
                    readError = e;
                    break;
                }
                if (read == -1) {
                    break;
                }
                out.write(buffer, 0, read);
                total += read;
            }
        } catch (IOException e) {
            deletePartial(target, e);
            throw e;
        }
        if (readError != null) {
            deletePartial(target, readError);
            return TransportResult.failed(TransportFailure.network(url, readError));
        }
        return TransportResult.ok(total);
    }

    private static void deletePartial(Path target, IOException cause) {
        try {
            Files.deleteIfExists(target);
        } catch (IOException e) {
            cause.addSuppressed(e);
        }
    }
}
