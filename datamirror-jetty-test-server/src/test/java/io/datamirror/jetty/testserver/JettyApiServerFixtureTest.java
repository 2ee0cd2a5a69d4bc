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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.HttpURLConnection;
import java.net.URI;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JettyApiServerFixture class.
 * This test verifies that scripted routes are served in order and counted.
 */
public class JettyApiServerFixtureTest {

    private JettyApiServerFixture server;

    @BeforeEach
    public void setUp() throws IOException {
        server = new JettyApiServerFixture();
        server.start();
    }

    @AfterEach
    public void tearDown() {
        server.close();
    }

    @Test
    public void testScriptedSequenceRepeatsLastResponse() throws IOException {
        server.route("/api/thing", ScriptedResponse.status(503), ScriptedResponse.json("{\"ok\":true}"));

        assertEquals(503, get("/api/thing").status);
        Fetched second = get("/api/thing");
        assertEquals(200, second.status);
        assertEquals("{\"ok\":true}", second.body);
        assertEquals(200, get("/api/thing").status, "last scripted response should repeat");

        assertEquals(3, server.requestCount("/api/thing"));
        assertEquals(3, server.totalRequests());
    }

    @Test
    public void testUnroutedPathAnswers404() throws IOException {
        assertEquals(404, get("/nothing/here").status);
        assertEquals(1, server.requestCount("/nothing/here"));
        assertTrue(server.requestedPaths().contains("/nothing/here"));
    }

    @Test
    public void testPathsWithSlashesInTheTail() throws IOException {
        server.route("/download/55/application/pdf",
            ScriptedResponse.bytes("application/pdf", new byte[]{1, 2, 3}));
        assertEquals(200, get("/download/55/application/pdf").status);
    }

    @Test
    public void testResetClearsRoutesAndCounts() throws IOException {
        server.route("/a", ScriptedResponse.json("[]"));
        get("/a");
        server.reset();
        assertEquals(0, server.totalRequests());
        assertEquals(404, get("/a").status);
    }

    private Fetched get(String path) throws IOException {
        HttpURLConnection connection = (HttpURLConnection) URI.create(server.url(path)).toURL().openConnection();
        try {
            int status = connection.getResponseCode();
            InputStream in = status >= 400 ? connection.getErrorStream() : connection.getInputStream();
            String body = "";
            if (in != null) {
                try (in) {
                    body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
            return new Fetched(status, body);
        } finally {
            connection.disconnect();
        }
    }

    private record Fetched(int status, String body) {
    }
}
