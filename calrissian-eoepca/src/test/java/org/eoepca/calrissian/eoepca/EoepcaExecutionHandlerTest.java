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

package org.eoepca.calrissian.eoepca;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.eoepca.calrissian.conf.ServiceConf;
import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.eoepca.identity.MalformedTokenException;
import org.eoepca.calrissian.eoepca.output.ConsolidationResult;
import org.eoepca.calrissian.eoepca.workspace.WorkspaceConfigReader;
import org.eoepca.calrissian.ex.HookExecutionException;
import org.eoepca.calrissian.storage.StorageCredentials;
import org.eoepca.calrissian.testutil.InMemoryStacIo;
import org.eoepca.calrissian.testutil.StubWorkspaceService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class EoepcaExecutionHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String PROXY = "http://127.0.0.1:9";
    private static final String CATALOG_LOCATION = "ws-alice/processing-results/run-1/catalog.json";
    private static final String CATALOG_URI = "s3://" + CATALOG_LOCATION;
    private static final String COLLECTION_URI = "s3://ws-alice/processing-results/run-1/water-bodies/collection.json";

    private static final StorageCredentials WORKSPACE_STORAGE
            = new StorageCredentials("https://minio.develop.eoepca.org", "AKIA-WS", "secret-ws", "eu-west-2", "ws-alice");

    @TempDir
    public Path tempDir;

    private Map<String, Map<String, String>> conf;
    private Map<String, Map<String, String>> inputs;
    private EnvironmentVariables env;
    private StubWorkspaceService workspaceApi;
    private InMemoryStacIo stacIo;

    private final List<String> configReads = new ArrayList<>();
    private String workspaceBucket;
    private WorkspaceConfigReader configReader;

    private static String token(String payloadJson) {
        Base64.Encoder encoder = Base64.getUrlEncoder().withoutPadding();
        return encoder.encodeToString("{\"alg\":\"none\"}".getBytes(StandardCharsets.UTF_8)) + "."
               + encoder.encodeToString(payloadJson.getBytes(StandardCharsets.UTF_8)) + ".sig";
    }

    private static Map<String, String> section(String... keysAndValues) {
        Map<String, String> section = new HashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            section.put(keysAndValues[i], keysAndValues[i + 1]);
        }
        return section;
    }

    @BeforeEach
    public void setup() throws IOException {
        workspaceApi = StubWorkspaceService.start();
        stacIo = new InMemoryStacIo();

        conf = new HashMap<>();
        conf.put(ServiceConf.MAIN, section("tmpUrl", "https://zoo.develop.eoepca.org/temp", "tmpPath", tempDir.toString()));
        conf.put(ServiceConf.LENV, section("usid", "run-1", "Identifier", "water-bodies"));
        conf.put(EoepcaSettings.SECTION, section("domain", "develop.eoepca.org",
                                                 "workspace_url", workspaceApi.getUrl(),
                                                 "workspace_prefix", "ws"));
        conf.put(ServiceConf.AUTH_ENV, section("jwt", token("{\"preferred_username\":\"alice\"}")));

        inputs = new HashMap<>();
        inputs.put("workspace", section("value", "alice"));

        env = new EnvironmentVariables(section("HTTP_PROXY", PROXY));

        workspaceBucket = "ws-alice-bucket";
        configReader = workspaceName -> {
            configReads.add(workspaceName);
            return Optional.ofNullable(workspaceBucket);
        };
    }

    @AfterEach
    public void teardown() {
        workspaceApi.close();
    }

    private EoepcaExecutionHandler createHandler() {
        return new EoepcaExecutionHandler(conf, inputs, env, () -> configReader, stacIo.asFactory(),
                                          tempDir.resolve("pod_imagePullSecrets.yaml"));
    }

    private void putCatalogWithCollection() {
        stacIo.put(CATALOG_URI, "{\"type\": \"Catalog\", \"id\": \"catalog\", \"links\": ["
                                + "{\"rel\": \"self\", \"href\": \"" + CATALOG_URI + "\"}, "
                                + "{\"rel\": \"child\", \"href\": \"./water-bodies/collection.json\"}]}");
        stacIo.put(COLLECTION_URI, "{\"type\": \"Collection\", \"id\": \"water-bodies\", \"links\": []}");
    }

    private static Map<String, Object> workflowOutput() {
        Map<String, Object> output = new HashMap<>();
        output.put(EoepcaExecutionHandler.STAC_CATALOG_OUTPUT, CATALOG_LOCATION);
        return output;
    }

    @Test
    public void constructorInitialisesStorageDefaults() {
        EoepcaExecutionHandler handler = createHandler();

        Assertions.assertTrue(handler.isUsingWorkspace());
        Assertions.assertEquals("alice", handler.getWorkspaceName());
        Map<String, String> parameters = handler.getAdditionalParameters();
        Assertions.assertEquals("http://s3-service.zoo.svc.cluster.local:9000", parameters.get("STAGEOUT_AWS_SERVICEURL"));
        Assertions.assertEquals("eoepca", parameters.get("STAGEOUT_OUTPUT"));
        Assertions.assertEquals("default", parameters.get("STAGEOUT_WORKSPACE"));
    }

    @Test
    public void workspaceIsDisabledWithoutPrefix() {
        conf.get(EoepcaSettings.SECTION).remove("workspace_prefix");

        EoepcaExecutionHandler handler = createHandler();
        handler.preExecutionHook();

        Assertions.assertFalse(handler.isUsingWorkspace());
        Assertions.assertTrue(workspaceApi.getRequests().isEmpty());
    }

    @Test
    public void workspaceNameDefaults() {
        inputs.clear();
        Assertions.assertEquals("default", createHandler().getWorkspaceName());
    }

    @Test
    public void preHookUsesWorkspaceStorage() {
        workspaceApi.setStorageCredentials(WORKSPACE_STORAGE.getEndpoint(), WORKSPACE_STORAGE.getAccessKey(),
                                           WORKSPACE_STORAGE.getSecretKey(), WORKSPACE_STORAGE.getRegion(),
                                           WORKSPACE_STORAGE.getBucketName());
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();

        Assertions.assertTrue(handler.isUsingWorkspace());
        Assertions.assertEquals("alice", handler.getUsername());
        Assertions.assertEquals("ws-alice", handler.getUserWorkspace());
        Assertions.assertEquals(List.of("alice"), configReads);

        StubWorkspaceService.RecordedRequest lookup = workspaceApi.getRequests().get(0);
        Assertions.assertEquals("/workspaces/ws-alice", lookup.getPath());
        Assertions.assertEquals("Bearer " + conf.get(ServiceConf.AUTH_ENV).get("jwt"), lookup.getAuthorization());

        Map<String, String> parameters = handler.getAdditionalParameters();
        Assertions.assertEquals("https://minio.develop.eoepca.org", parameters.get("STAGEOUT_AWS_SERVICEURL"));
        Assertions.assertEquals("AKIA-WS", parameters.get("STAGEOUT_AWS_ACCESS_KEY_ID"));
        Assertions.assertEquals("secret-ws", parameters.get("STAGEOUT_AWS_SECRET_ACCESS_KEY"));
        Assertions.assertEquals("eu-west-2", parameters.get("STAGEOUT_AWS_REGION"));
        Assertions.assertEquals("ws-alice", parameters.get("STAGEOUT_OUTPUT"));
        Assertions.assertEquals("run-1", parameters.get("collection_id"));
        Assertions.assertEquals("processing-results", parameters.get("process"));
        Assertions.assertEquals("alice", parameters.get("STAGEOUT_WORKSPACE"));
        Assertions.assertEquals("ws-alice-bucket", parameters.get("STAGEOUT_ACCESS_POINT"));
        Assertions.assertEquals("http://s3-service.zoo.svc.cluster.local:9000", parameters.get("STAGEIN_AWS_SERVICEURL"));
    }

    @Test
    public void preHookFallsBackWhenWorkspaceIsUnknown() {
        workspaceApi.setLookupResponse(404, "{\"detail\":\"not found\"}");
        workspaceBucket = null;
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();

        Assertions.assertFalse(handler.isUsingWorkspace());
        Map<String, String> parameters = handler.getAdditionalParameters();
        Assertions.assertEquals("http://s3-service.zoo.svc.cluster.local:9000", parameters.get("STAGEOUT_AWS_SERVICEURL"));
        Assertions.assertEquals("minio-admin", parameters.get("STAGEOUT_AWS_ACCESS_KEY_ID"));
        Assertions.assertEquals("eoepca", parameters.get("STAGEOUT_OUTPUT"));
        Assertions.assertNull(parameters.get("STAGEOUT_ACCESS_POINT"));
        Assertions.assertEquals("run-1", parameters.get("collection_id"));
    }

    @Test
    public void proxyIsClearedDuringCallsAndRestoredAfterwards() {
        workspaceApi.setStorageCredentials("https://minio", "AK", "SK", "r", "b");
        List<String> observedProxies = new CopyOnWriteArrayList<>();
        workspaceApi.onRequest(() -> observedProxies.add(String.valueOf(env.get("HTTP_PROXY"))));
        putCatalogWithCollection();
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();
        Assertions.assertEquals(PROXY, env.get("HTTP_PROXY"));

        handler.postExecutionHook("calrissian.log", workflowOutput(), new HashMap<>(), Collections.emptyList());
        Assertions.assertEquals(PROXY, env.get("HTTP_PROXY"));

        Assertions.assertEquals(List.of("null", "null", "null"), observedProxies);
    }

    @Test
    public void preHookFailureIsRethrownAndProxyRestored() {
        configReader = workspaceName -> {
            throw new HookExecutionException("Service host/port is not set");
        };
        EoepcaExecutionHandler handler = createHandler();

        Assertions.assertThrows(HookExecutionException.class, handler::preExecutionHook);
        Assertions.assertEquals(PROXY, env.get("HTTP_PROXY"));
    }

    @Test
    public void malformedTokenFailsPreHook() {
        conf.put(ServiceConf.AUTH_ENV, section("jwt", "not-a-token"));
        EoepcaExecutionHandler handler = createHandler();

        Assertions.assertThrows(MalformedTokenException.class, handler::preExecutionHook);
        Assertions.assertEquals(PROXY, env.get("HTTP_PROXY"));
        Assertions.assertTrue(workspaceApi.getRequests().isEmpty());
    }

    @Test
    public void unreachableWorkspaceApiFailsPreHook() {
        workspaceApi.close();
        EoepcaExecutionHandler handler = createHandler();

        HookExecutionException e = Assertions.assertThrows(HookExecutionException.class, handler::preExecutionHook);
        Assertions.assertTrue(e.getCause() instanceof IOException);
        Assertions.assertEquals(PROXY, env.get("HTTP_PROXY"));
    }

    @Test
    public void missingTokenGivesEmptyUsername() {
        conf.remove(ServiceConf.AUTH_ENV);
        conf.get(EoepcaSettings.SECTION).remove("workspace_url");
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();

        Assertions.assertEquals("", handler.getUsername());
    }

    @Test
    public void postHookConsolidatesAndRegistersWithWorkspace() throws IOException {
        workspaceApi.setStorageCredentials(WORKSPACE_STORAGE.getEndpoint(), WORKSPACE_STORAGE.getAccessKey(),
                                           WORKSPACE_STORAGE.getSecretKey(), WORKSPACE_STORAGE.getRegion(),
                                           WORKSPACE_STORAGE.getBucketName());
        putCatalogWithCollection();
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();
        handler.postExecutionHook("calrissian.log", workflowOutput(), new HashMap<>(), Collections.emptyList());

        Assertions.assertEquals(WORKSPACE_STORAGE, stacIo.getCredentialsUsed());
        Assertions.assertEquals("ws-alice-bucket", stacIo.getAccessPointUsed());
        Assertions.assertTrue(stacIo.isClosed());

        Assertions.assertEquals(ConsolidationResult.Outcome.EXISTING_COLLECTION,
                                handler.getConsolidationResult().getOutcome());
        JsonNode collection = MAPPER.readTree(handler.getFeatureCollection());
        Assertions.assertEquals("run-1", collection.get("id").asText());
        Assertions.assertEquals("Collection", collection.get("type").asText());

        List<StubWorkspaceService.RecordedRequest> posts = workspaceApi.getRequests("POST");
        Assertions.assertEquals(2, posts.size());
        Assertions.assertEquals("/workspaces/ws-alice/register-json", posts.get(0).getPath());
        Assertions.assertEquals(collection, MAPPER.readTree(posts.get(0).getBody()));
        Assertions.assertEquals("/workspaces/ws-alice/register", posts.get(1).getPath());
        JsonNode registration = MAPPER.readTree(posts.get(1).getBody());
        Assertions.assertEquals("stac-item", registration.get("type").asText());
        Assertions.assertEquals(CATALOG_URI, registration.get("url").asText());
    }

    @Test
    public void registrationStatusIsNotInspected() {
        workspaceApi.setStorageCredentials("https://minio", "AK", "SK", "r", "ws-alice");
        workspaceApi.setRegisterStatus(500);
        putCatalogWithCollection();
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();
        handler.postExecutionHook("calrissian.log", workflowOutput(), new HashMap<>(), Collections.emptyList());

        Assertions.assertEquals(2, workspaceApi.getRequests("POST").size());
        Assertions.assertTrue(handler.getConsolidationResult().hasCollection());
    }

    @Test
    public void postHookSkipsRegistrationWithoutWorkspace() throws IOException {
        workspaceApi.setLookupResponse(403, "forbidden");
        putCatalogWithCollection();
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();
        handler.postExecutionHook("calrissian.log", workflowOutput(), new HashMap<>(), Collections.emptyList());

        Assertions.assertEquals("run-1", MAPPER.readTree(handler.getFeatureCollection()).get("id").asText());
        Assertions.assertTrue(workspaceApi.getRequests("POST").isEmpty());
        Assertions.assertEquals("minio-admin", stacIo.getCredentialsUsed().getAccessKey());
    }

    @Test
    public void emptyCatalogGivesEmptyCollectionAndNoRegistration() throws IOException {
        workspaceApi.setStorageCredentials("https://minio", "AK", "SK", "r", "ws-alice");
        stacIo.put(CATALOG_URI, "{\"type\": \"Catalog\", \"id\": \"catalog\", \"links\": []}");
        EoepcaExecutionHandler handler = createHandler();

        handler.preExecutionHook();
        handler.postExecutionHook("calrissian.log", workflowOutput(), new HashMap<>(), Collections.emptyList());

        Assertions.assertEquals(MAPPER.createObjectNode(), MAPPER.readTree(handler.getFeatureCollection()));
        Assertions.assertTrue(workspaceApi.getRequests("POST").isEmpty());
    }

    @Test
    public void unreadableCatalogGivesEmptyCollection() throws IOException {
        EoepcaExecutionHandler handler = createHandler();
        workspaceApi.setLookupResponse(404, "{}");

        handler.preExecutionHook();
        handler.postExecutionHook("calrissian.log", workflowOutput(), new HashMap<>(), Collections.emptyList());

        Assertions.assertEquals(ConsolidationResult.Outcome.CATALOG_UNREADABLE,
                                handler.getConsolidationResult().getOutcome());
        Assertions.assertEquals(MAPPER.createObjectNode(), MAPPER.readTree(handler.getFeatureCollection()));
    }

    @Test
    public void postHookRequiresCatalogOutput() {
        EoepcaExecutionHandler handler = createHandler();

        Assertions.assertThrows(HookExecutionException.class,
                () -> handler.postExecutionHook("calrissian.log", new HashMap<>(), new HashMap<>(), Collections.emptyList()));
        Assertions.assertEquals(PROXY, env.get("HTTP_PROXY"));
    }

    @Test
    public void handleOutputsPublishesToolLogs() {
        EoepcaExecutionHandler handler = createHandler();

        handler.handleOutputs("calrissian.log", workflowOutput(), new HashMap<>(), List.of("/tmp/node-crop.log"));

        Map<String, String> logs = conf.get(ServiceConf.SERVICE_LOGS);
        Assertions.assertEquals("https://zoo.develop.eoepca.org/temp/water-bodies-run-1/node-crop.log", logs.get("url"));
        Assertions.assertEquals("1", logs.get("length"));
    }

    @Test
    public void podCustomisationComesFromConfiguration() throws IOException {
        conf.put(ServiceConf.POD_ENV_VARS, section("A", "1", "B", "2"));
        Files.writeString(tempDir.resolve("pod_imagePullSecrets.yaml"), "imagePullSecrets:\n  - name: regcred\n");
        EoepcaExecutionHandler handler = createHandler();

        Assertions.assertEquals(Map.of("A", "1", "B", "2"), handler.getPodEnvVars());
        Assertions.assertTrue(handler.getPodNodeSelector().isEmpty());
        Assertions.assertTrue(handler.getSecrets().containsKey("imagePullSecrets"));
    }

    @Test
    public void secretsDefaultToEmpty() {
        Assertions.assertTrue(createHandler().getSecrets().isEmpty());
    }
}
