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

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.servlet.ServletHolder;

import java.io.IOException;
import java.io.OutputStream;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A test fixture that starts a Jetty web server impersonating the metadata API.
 * <p>
 * Each path is scripted with a sequence of responses. Requests consume the sequence
 * in order and the last response repeats once the sequence is exhausted, so a path
 * scripted as {@code 500, 500, 200} fails twice and then succeeds forever. Paths
 * without a script answer 404. Every request is counted per path.
 * <p>
 * Example usage:
 * ```java
 * try (JettyApiServerFixture server = new JettyApiServerFixture()) {
 *     server.start();
 *     server.route("/api/views/metadata/v1", ScriptedResponse.json("[]"));
 *     String siteUrl = server.getSiteUrl();
 *     // Use siteUrl in your tests
 * }
 * ```
 */
public class JettyApiServerFixture implements AutoCloseable {
    static {
        if (System.getProperty("log4j2.StatusLogger.level") == null) {
            System.setProperty("log4j2.StatusLogger.level", "FATAL");
        }
    }

    private static Logger logger() {
        return LazyLoggerHolder.LOGGER;
    }

    private static class LazyLoggerHolder {
        private static final Logger LOGGER = LogManager.getLogger(JettyApiServerFixture.class);
    }

    private final Map<String, Deque<ScriptedResponse>> routes = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> requestCounts = new ConcurrentHashMap<>();
    private final AtomicInteger totalRequests = new AtomicInteger();
    private Server server;
    private int port;

    /**
     * Starts the web server on a random available port.
     *
     * @throws IOException If the server cannot be started
     */
    public void start() throws IOException {
        this.port = findAvailablePort();

        server = new Server();

        ServerConnector connector = new ServerConnector(server);
        connector.setHost("127.0.0.1");
        connector.setPort(port);
        server.addConnector(connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        context.addServlet(new ServletHolder("scripted", new ScriptedApiServlet()), "/*");
        server.setHandler(context);

        try {
            server.start();
            logger().info("Jetty API test server started on port {}", port);
        } catch (Exception e) {
            throw new IOException("Failed to start Jetty server", e);
        }
    }

    /**
     * Scripts the responses for a path, replacing any earlier script.
     *
     * @param path The request path, starting with '/'
     * @param responses The responses in the order they are served, at least one
     * @return this fixture
     */
    public JettyApiServerFixture route(String path, ScriptedResponse... responses) {
        if (responses.length == 0) {
            throw new IllegalArgumentException("at least one response is required for " + path);
        }
        routes.put(path, new ArrayDeque<>(Arrays.asList(responses)));
        return this;
    }

    /**
     * Gets the number of requests received for a path.
     *
     * @param path The request path
     * @return The request count
     */
    public int requestCount(String path) {
        AtomicInteger count = requestCounts.get(path);
        return count == null ? 0 : count.get();
    }

    /**
     * @return the number of requests received on any path
     */
    public int totalRequests() {
        return totalRequests.get();
    }

    /**
     * @return the paths requested so far, in no particular order
     */
    public List<String> requestedPaths() {
        return List.copyOf(requestCounts.keySet());
    }

    /**
     * Clears all scripts and counters.
     */
    public void reset() {
        routes.clear();
        requestCounts.clear();
        totalRequests.set(0);
    }

    /**
     * Gets the site URL of the server, without a trailing slash.
     *
     * @return The site URL
     */
    public String getSiteUrl() {
        return "http://127.0.0.1:" + port;
    }

    /**
     * Resolves a path against the site URL.
     *
     * @param path The path, starting with '/'
     * @return The absolute URL
     */
    public String url(String path) {
        return getSiteUrl() + path;
    }

    /**
     * Stops the server and releases resources.
     */
    @Override
    public void close() {
        if (server != null) {
            try {
                server.stop();
                logger().info("Jetty API test server stopped");
            } catch (Exception e) {
                logger().error("Error stopping Jetty server", e);
            }
        }
    }

    private ScriptedResponse nextResponse(String path) {
        Deque<ScriptedResponse> script = routes.get(path);
        if (script == null) {
            return null;
        }
        synchronized (script) {
            return script.size() > 1 ? script.pollFirst() : script.peekFirst();
        }
    }

    /**
     * Finds an available port to use for the server.
     *
     * @return An available port number
     */
    private int findAvailablePort() {
        try (ServerSocket socket = new ServerSocket(0)) {
            socket.setReuseAddress(true);
            return socket.getLocalPort();
        } catch (IOException e) {
            throw new RuntimeException("Failed to find available port", e);
        }
    }

    private class ScriptedApiServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest request, HttpServletResponse response) throws IOException {
            String path = request.getRequestURI();
            totalRequests.incrementAndGet();
            requestCounts.computeIfAbsent(path, p -> new AtomicInteger()).incrementAndGet();

            ScriptedResponse scripted = nextResponse(path);
            if (scripted == null) {
                logger().debug("no route for {}", path);
                scripted = new ScriptedResponse(404, "text/plain",
                    ("no route for " + path).getBytes(StandardCharsets.UTF_8));
            }

            response.setStatus(scripted.status());
            response.setContentType(scripted.contentType());
            response.setContentLength(scripted.body().length);
            try (OutputStream out = response.getOutputStream()) {
                out.write(scripted.body());
            }
        }
    }
}
