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
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.util.Optional;
import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.ex.HookExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads the workspace's ConfigMap from the Kubernetes API server, authenticating with the pod's service account.
 */
public class KubernetesWorkspaceConfigReader implements WorkspaceConfigReader {

    private static final Logger log = LoggerFactory.getLogger(KubernetesWorkspaceConfigReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String SERVICE_HOST_ENV = "KUBERNETES_SERVICE_HOST";
    public static final String SERVICE_PORT_ENV = "KUBERNETES_SERVICE_PORT";
    public static final Path SERVICE_ACCOUNT_DIR = Paths.get("/var/run/secrets/kubernetes.io/serviceaccount");

    static final String NAMESPACE_PREFIX = "ws-";
    static final String CONFIG_MAP_NAME = "workspace-config";
    static final String BUCKET_KEY = "S3_BUCKET_WORKSPACE";

    private final HttpClient http;
    private final String apiServerUrl;
    private final String token;

    // package-private for test visibility
    KubernetesWorkspaceConfigReader(HttpClient http, String apiServerUrl, String token) {
        this.http = http;
        this.apiServerUrl = apiServerUrl;
        this.token = token;
    }

    /**
     * Builds a reader from the in-cluster service account.
     * Throws HookExecutionException if the process is not running inside a cluster.
     */
    public static KubernetesWorkspaceConfigReader inCluster(EnvironmentVariables env) {
        return inCluster(env, SERVICE_ACCOUNT_DIR);
    }

    // package-private for test visibility
    static KubernetesWorkspaceConfigReader inCluster(EnvironmentVariables env, Path serviceAccountDir) {
        String host = env.get(SERVICE_HOST_ENV);
        String port = env.get(SERVICE_PORT_ENV);
        if (host == null || host.isEmpty() || port == null || port.isEmpty()) {
            throw new HookExecutionException("Service host/port is not set, unable to load in-cluster configuration.");
        }

        try {
            String token = Files.readString(serviceAccountDir.resolve("token"), StandardCharsets.UTF_8).trim();
            HttpClient http = HttpClient.newBuilder()
                    .sslContext(buildSslContext(serviceAccountDir.resolve("ca.crt")))
                    .proxy(HttpClient.Builder.NO_PROXY)
                    .build();
            String hostForUrl = host.contains(":") ? "[" + host + "]" : host;
            return new KubernetesWorkspaceConfigReader(http, "https://" + hostForUrl + ":" + port, token);
        } catch (IOException | GeneralSecurityException e) {
            throw new HookExecutionException("Unable to load in-cluster configuration.", e);
        }
    }

    private static SSLContext buildSslContext(Path caFile) throws IOException, GeneralSecurityException {
        KeyStore trustStore = KeyStore.getInstance(KeyStore.getDefaultType());
        trustStore.load(null, null);
        try (InputStream in = Files.newInputStream(caFile)) {
            int index = 0;
            for (Certificate certificate : CertificateFactory.getInstance("X.509").generateCertificates(in)) {
                trustStore.setCertificateEntry("ca-" + index++, certificate);
            }
        }
        TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagers.init(trustStore);
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, trustManagers.getTrustManagers(), null);
        return context;
    }

    @Override
    public Optional<String> readWorkspaceBucket(String workspaceName) {
        String namespace = NAMESPACE_PREFIX + workspaceName;
        String url = apiServerUrl + "/api/v1/namespaces/" + namespace + "/configmaps/" + CONFIG_MAP_NAME;
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
                .header("Accept", "application/json")
                .header("Authorization", "Bearer " + token)
                .GET()
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new HookExecutionException("Unable to reach the cluster API server at " + apiServerUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new HookExecutionException("Interrupted while reading " + CONFIG_MAP_NAME, e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            log.info("Exception when fetching {} in namespace {}: ({}) {}", CONFIG_MAP_NAME, namespace,
                     response.statusCode(), response.body());
            return Optional.empty();
        }

        try {
            JsonNode bucket = MAPPER.readTree(response.body()).path("data").get(BUCKET_KEY);
            if (bucket == null || bucket.isNull()) {
                log.info("No {} declared in {} of namespace {}", BUCKET_KEY, CONFIG_MAP_NAME, namespace);
                return Optional.empty();
            }
            log.info("Using workspace bucket {} as stage-out access point", bucket.asText());
            return Optional.of(bucket.asText());
        } catch (IOException e) {
            log.info("Unable to parse {} in namespace {}", CONFIG_MAP_NAME, namespace, e);
            return Optional.empty();
        }
    }
}
