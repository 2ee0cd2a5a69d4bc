package io.datamirror.jetty.testserver;

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

import java.nio.charset.StandardCharsets;

/**
 * One canned HTTP response served by {@link JettyApiServerFixture}.
 *
 * @param status The HTTP status code
 * @param contentType The content type header value
 * @param body The body bytes
 */
public record ScriptedResponse(int status, String contentType, byte[] body) {

    /**
     * A 200 response with a JSON body.
     *
     * @param json The JSON text
     * @return The response
     */
    public static ScriptedResponse json(String json) {
        return new ScriptedResponse(200, "application/json", json.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * A 200 response with a plain text body, typed as CSV.
     *
     * @param csv The CSV text
     * @return The response
     */
    public static ScriptedResponse csv(String csv) {
        return new ScriptedResponse(200, "text/csv", csv.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * A 200 response with a binary body.
     *
     * @param contentType The content type
     * @param bytes The body
     * @return The response
     */
    public static ScriptedResponse bytes(String contentType, byte[] bytes) {
        return new ScriptedResponse(200, contentType, bytes);
    }

    /**
     * An error response with a short text body.
     *
     * @param status The HTTP status code
     * @return The response
     */
    public static ScriptedResponse status(int status) {
        return new ScriptedResponse(status, "text/plain",
            ("scripted status " + status).getBytes(StandardCharsets.UTF_8));
    }
}
