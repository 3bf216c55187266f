/*
 *   Copyright Calrissian Hooks Contributors
 *
 *   Licensed under the Apache License, Version 2.0 (the "License").
 *   You may not use this file except in compliance with the License.
 *   You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *   Unless required by applicable law or agreed to in writing, software
 *   distributed under the License is distributed on an "AS IS" BASIS,
 *   WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *   See the License for the specific language governing permissions and
 *   limitations under the License.
 */

package org.eoepca.calrissian.testutil;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

/**
 * An embedded HTTP server standing in for the workspace API in unit tests.
 *
 * GET requests receive the configured lookup response; POST requests receive the configured registration status.
 * Every request is recorded.
 */
public class StubWorkspaceService implements AutoCloseable {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * A request received by the stub.
     */
    public static final class RecordedRequest {
        private final String method;
        private final String path;
        private final String authorization;
        private final String accept;
        private final String body;

        RecordedRequest(String method, String path, String authorization, String accept, String body) {
            this.method = method;
            this.path = path;
            this.authorization = authorization;
            this.accept = accept;
            this.body = body;
        }

        public String getMethod() {
            return method;
        }

        public String getPath() {
            return path;
        }

        public String getAuthorization() {
            return authorization;
        }

        public String getAccept() {
            return accept;
        }

        public String getBody() {
            return body;
        }
    }

    private final HttpServer server;
    private final List<RecordedRequest> requests = Collections.synchronizedList(new ArrayList<>());

    private volatile int lookupStatus = 200;
    private volatile String lookupBody = "{}";
    private volatile int registerStatus = 201;
    private volatile Runnable onRequest = () -> {};
    private boolean closed = false;

    private StubWorkspaceService(HttpServer server) {
        this.server = server;
    }

    public static StubWorkspaceService start() throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
        StubWorkspaceService stub = new StubWorkspaceService(server);
        server.createContext("/", stub::handle);
        server.start();
        return stub;
    }

    public String getUrl() {
        return "http://" + server.getAddress().getAddress().getHostAddress() + ":" + server.getAddress().getPort();
    }

    public void setLookupResponse(int status, String body) {
        this.lookupStatus = status;
        this.lookupBody = body;
    }

    /**
     * Makes workspace lookups succeed with the given storage credentials.
     */
    public void setStorageCredentials(String endpoint, String access, String secret, String region, String bucketName) {
        ObjectNode response = MAPPER.createObjectNode();
        ObjectNode credentials = response.putObject("storage").putObject("credentials");
        credentials.put("endpoint", endpoint);
        credentials.put("access", access);
        credentials.put("secret", secret);
        credentials.put("region", region);
        credentials.put("bucketname", bucketName);
        setLookupResponse(200, response.toString());
    }

    public void setRegisterStatus(int registerStatus) {
        this.registerStatus = registerStatus;
    }

    /**
     * Runs the given callback on the server thread for every request, before the response is sent.
     */
    public void onRequest(Runnable callback) {
        this.onRequest = callback;
    }

    public List<RecordedRequest> getRequests() {
        synchronized (requests) {
            return new ArrayList<>(requests);
        }
    }

    public List<RecordedRequest> getRequests(String method) {
        return getRequests().stream().filter(r -> r.getMethod().equals(method)).collect(Collectors.toList());
    }

    private void handle(HttpExchange exchange) throws IOException {
        String body;
        try (InputStream in = exchange.getRequestBody()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        requests.add(new RecordedRequest(exchange.getRequestMethod(), exchange.getRequestURI().getPath(),
                                         exchange.getRequestHeaders().getFirst("Authorization"),
                                         exchange.getRequestHeaders().getFirst("Accept"), body));
        onRequest.run();

        int status;
        String responseBody;
        if ("GET".equals(exchange.getRequestMethod())) {
            status = lookupStatus;
            responseBody = lookupBody;
        } else {
            status = registerStatus;
            responseBody = "{}";
        }
        byte[] bytes = responseBody.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            server.stop(0);
            closed = true;
        }
    }
}
