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

package org.eoepca.calrissian.eoepca.workspace;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.http.HttpClients;
import org.eoepca.calrissian.storage.StorageCredentials;
import org.eoepca.calrissian.util.UrlPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Client for the workspace REST API: storage credential lookup and registration of processing results.
 *
 * A new HttpClient is built for every call so that the proxy settings in effect at call time apply.
 */
public class WorkspaceClient {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceClient.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    static final String WORKSPACES_PATH = "workspaces";
    static final String REGISTER_JSON_PATH = "register-json";
    static final String REGISTER_PATH = "register";
    static final String STAC_ITEM_TYPE = "stac-item";
    static final String JSON_CONTENT_TYPE = "application/json";

    private final String workspaceUrl;
    private final EnvironmentVariables env;

    public WorkspaceClient(String workspaceUrl, EnvironmentVariables env) {
        if (workspaceUrl == null || workspaceUrl.isEmpty()) {
            throw new IllegalArgumentException("The workspace API url must be specified.");
        }
        this.workspaceUrl = workspaceUrl;
        this.env = env;
    }

    public String getWorkspaceEndpoint(String workspaceName) {
        return UrlPaths.join(workspaceUrl, WORKSPACES_PATH, workspaceName);
    }

    /**
     * Fetches the storage credentials of the workspace.
     * Returns an empty Optional when the API answers with a non-success status.
     */
    public Optional<StorageCredentials> lookupStorageCredentials(String workspaceName, String token)
            throws IOException, InterruptedException {
        String endpoint = getWorkspaceEndpoint(workspaceName);
        log.info("Using Workspace API endpoint {}", endpoint);

        HttpRequest request = HttpRequest.newBuilder(URI.create(endpoint))
                .header("Accept", JSON_CONTENT_TYPE)
                .header("Authorization", bearer(token))
                .GET()
                .build();
        HttpResponse<String> response = HttpClients.forEnvironment(env)
                .send(request, HttpResponse.BodyHandlers.ofString());

        if (!isSuccess(response.statusCode())) {
            log.error("Problem connecting with the Workspace API");
            log.info("  Response code = {}", response.statusCode());
            log.info("  Response text = \n{}", response.body());
            return Optional.empty();
        }
        return Optional.of(parseStorageCredentials(response.body()));
    }

    /**
     * Registers the collection document with the workspace catalog. Returns the HTTP status code.
     */
    public int registerCollection(String workspaceName, JsonNode collection, String token)
            throws IOException, InterruptedException {
        return post(UrlPaths.join(getWorkspaceEndpoint(workspaceName), REGISTER_JSON_PATH), collection, token);
    }

    /**
     * Registers the STAC document at the given url with the workspace catalog. Returns the HTTP status code.
     */
    public int registerResult(String workspaceName, String url, String token)
            throws IOException, InterruptedException {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("type", STAC_ITEM_TYPE);
        body.put("url", url);
        return post(UrlPaths.join(getWorkspaceEndpoint(workspaceName), REGISTER_PATH), body, token);
    }

    private int post(String url, JsonNode body, String token) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Accept", JSON_CONTENT_TYPE)
                .header("Content-Type", JSON_CONTENT_TYPE)
                .header("Authorization", bearer(token))
                .POST(HttpRequest.BodyPublishers.ofString(MAPPER.writeValueAsString(body)))
                .build();
        HttpResponse<String> response = HttpClients.forEnvironment(env)
                .send(request, HttpResponse.BodyHandlers.ofString());
        return response.statusCode();
    }

    // package-private for test visibility
    static StorageCredentials parseStorageCredentials(String body) throws IOException {
        JsonNode credentials = MAPPER.readTree(body).path("storage").path("credentials");
        if (!credentials.isObject()) {
            throw new IOException("The workspace description has no storage credentials.");
        }
        return new StorageCredentials(text(credentials, "endpoint"), text(credentials, "access"),
                                      text(credentials, "secret"), text(credentials, "region"),
                                      text(credentials, "bucketname"));
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.asText();
    }

    private static String bearer(String token) {
        return "Bearer " + token;
    }

    private static boolean isSuccess(int statusCode) {
        return statusCode >= 200 && statusCode < 300;
    }
}
