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
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

import org.eoepca.calrissian.ExecutionHandler;
import org.eoepca.calrissian.aws.S3StacIo;
import org.eoepca.calrissian.conf.ServiceConf;
import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.eoepca.identity.JwtClaims;
import org.eoepca.calrissian.eoepca.identity.UserNames;
import org.eoepca.calrissian.eoepca.output.CollectionConsolidator;
import org.eoepca.calrissian.eoepca.output.ConsolidationResult;
import org.eoepca.calrissian.eoepca.output.ServiceLogs;
import org.eoepca.calrissian.eoepca.workspace.KubernetesWorkspaceConfigReader;
import org.eoepca.calrissian.eoepca.workspace.WorkspaceClient;
import org.eoepca.calrissian.eoepca.workspace.WorkspaceConfigReader;
import org.eoepca.calrissian.ex.HookExecutionException;
import org.eoepca.calrissian.stac.StacIo;
import org.eoepca.calrissian.stac.StacIoFactory;
import org.eoepca.calrissian.storage.StorageCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * ExecutionHandler wiring a workflow execution into the EOEPCA platform.
 *
 * Before the workflow runs, it resolves where the outputs go: the user's workspace storage when the workspace API
 * knows the user, the pre-configured storage otherwise. After the workflow runs, it consolidates the output
 * catalog into one collection and registers it with the user's workspace.
 */
public class EoepcaExecutionHandler implements ExecutionHandler {

    private static final Logger log = LoggerFactory.getLogger(EoepcaExecutionHandler.class);

    public static final String WORKSPACE_INPUT = "workspace";
    public static final String DEFAULT_WORKSPACE = "default";
    public static final String STAC_CATALOG_OUTPUT = "StacCatalogUri";

    private final ServiceConf conf;
    private final EnvironmentVariables env;
    private final EoepcaSettings settings;
    private final AdditionalParameters parameters;
    private final HttpProxyGuard proxyGuard;
    private final Supplier<WorkspaceConfigReader> configReaderSupplier;
    private final StacIoFactory stacIoFactory;
    private final Path secretsFile;
    private final String workspaceName;
    private final String token;

    private boolean useWorkspace;
    private String username = "";
    private ConsolidationResult consolidationResult;
    private String featureCollection;

    public EoepcaExecutionHandler(Map<String, Map<String, String>> conf, Map<String, Map<String, String>> inputs) {
        this(conf, inputs, EnvironmentVariables.system());
    }

    EoepcaExecutionHandler(Map<String, Map<String, String>> conf, Map<String, Map<String, String>> inputs,
                           EnvironmentVariables env) {
        this(conf, inputs, env, () -> KubernetesWorkspaceConfigReader.inCluster(env), S3StacIo.factory(env),
             PodSecrets.DEFAULT_LOCATION);
    }

    // package-private for test visibility
    EoepcaExecutionHandler(Map<String, Map<String, String>> conf, Map<String, Map<String, String>> inputs,
                           EnvironmentVariables env, Supplier<WorkspaceConfigReader> configReaderSupplier,
                           StacIoFactory stacIoFactory, Path secretsFile) {
        this.conf = new ServiceConf(conf);
        this.env = env;
        this.settings = new EoepcaSettings(this.conf);
        this.parameters = new AdditionalParameters(this.conf);
        this.proxyGuard = new HttpProxyGuard(env);
        this.configReaderSupplier = configReaderSupplier;
        this.stacIoFactory = stacIoFactory;
        this.secretsFile = secretsFile;
        this.workspaceName = readWorkspaceName(inputs);
        this.token = this.conf.getAuthToken();
        this.useWorkspace = settings.isWorkspaceConfigured();

        parameters.initDefaults(env);
    }

    private static String readWorkspaceName(Map<String, Map<String, String>> inputs) {
        if (inputs == null || inputs.get(WORKSPACE_INPUT) == null) {
            return DEFAULT_WORKSPACE;
        }
        String value = inputs.get(WORKSPACE_INPUT).get("value");
        return value == null ? DEFAULT_WORKSPACE : value;
    }

    @Override
    public void preExecutionHook() {
        try {
            log.info("Pre execution hook");
            proxyGuard.unset();

            Optional<String> accessPoint = configReaderSupplier.get().readWorkspaceBucket(workspaceName);

            if (!token.isEmpty()) {
                username = UserNames.fromClaims(JwtClaims.decodeUnverified(token));
            }

            if (useWorkspace) {
                log.info("Lookup storage details in Workspace");
                Optional<StorageCredentials> credentials = newWorkspaceClient()
                        .lookupStorageCredentials(getUserWorkspace(), token);
                if (credentials.isPresent()) {
                    log.info("Set user bucket settings");
                    parameters.setStageOutCredentials(credentials.get());
                } else {
                    useWorkspace = false;
                    log.info("Using pre-configured storage details");
                }
            } else {
                log.info("Using pre-configured storage details");
            }

            parameters.setCollectionId(conf.getUsid());
            parameters.setProcess(AdditionalParameters.PROCESSING_RESULTS);
            parameters.setStageOutWorkspace(workspaceName);
            parameters.setStageOutAccessPoint(accessPoint.orElse(null));
        } catch (IOException e) {
            log.error("ERROR in pre_execution_hook...", e);
            throw new HookExecutionException("Unable to look up the workspace storage details.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("ERROR in pre_execution_hook...", e);
            throw new HookExecutionException("Interrupted while looking up the workspace storage details.", e);
        } catch (RuntimeException e) {
            log.error("ERROR in pre_execution_hook...", e);
            throw e;
        } finally {
            proxyGuard.restore();
        }
    }

    @Override
    public void postExecutionHook(String logFile, Map<String, Object> output, Map<String, Object> usageReport,
                                  List<String> toolLogs) {
        try {
            log.info("Post execution hook");
            proxyGuard.unset();

            StorageCredentials stageOut = parameters.getStageOutCredentials();
            String accessPoint = parameters.getStageOutAccessPoint();
            String collectionId = parameters.getCollectionId();

            try (StacIo io = stacIoFactory.create(stageOut, accessPoint)) {
                consolidationResult = new CollectionConsolidator(io)
                        .consolidate(getCatalogLocation(output), collectionId, stageOut);
            }
            featureCollection = consolidationResult.toJson();

            if (!consolidationResult.hasCollection()) {
                log.error("ABORT: The output collection is empty ({})", consolidationResult.getOutcome());
                return;
            }

            if (useWorkspace) {
                registerWithWorkspace();
            }
        } catch (IOException e) {
            log.error("ERROR in post_execution_hook...", e);
            throw new HookExecutionException("Unable to publish the processing results.", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("ERROR in post_execution_hook...", e);
            throw new HookExecutionException("Interrupted while publishing the processing results.", e);
        } catch (RuntimeException e) {
            log.error("ERROR in post_execution_hook...", e);
            throw e;
        } finally {
            proxyGuard.restore();
        }
    }

    private static String getCatalogLocation(Map<String, Object> output) {
        Object location = output.get(STAC_CATALOG_OUTPUT);
        if (location == null) {
            throw new HookExecutionException("The workflow output has no " + STAC_CATALOG_OUTPUT + ".");
        }
        return location.toString();
    }

    private void registerWithWorkspace() throws IOException, InterruptedException {
        WorkspaceClient client = newWorkspaceClient();
        String userWorkspace = getUserWorkspace();

        log.info("Register collection in workspace {}", userWorkspace);
        int status = client.registerCollection(userWorkspace, consolidationResult.getCollection(), token);
        log.info("Register collection response: {}", status);

        log.info("Register processing results to collection");
        status = client.registerResult(userWorkspace, consolidationResult.getCatalogSelfHref(), token);
        log.info("Register processing results response: {}", status);
    }

    @Override
    public Map<String, String> getPodEnvVars() {
        log.info("get_pod_env_vars");
        return conf.section(ServiceConf.POD_ENV_VARS).toMap();
    }

    @Override
    public Map<String, String> getPodNodeSelector() {
        log.info("get_pod_node_selector");
        return conf.section(ServiceConf.POD_NODE_SELECTOR).toMap();
    }

    @Override
    public Map<String, Object> getSecrets() {
        log.info("get_secrets");
        return PodSecrets.load(secretsFile);
    }

    @Override
    public Map<String, String> getAdditionalParameters() {
        log.info("get_additional_parameters");
        return parameters.toMap();
    }

    @Override
    public void handleOutputs(String logFile, Map<String, Object> output, Map<String, Object> usageReport,
                              List<String> toolLogs) {
        try {
            log.info("handle_outputs");
            ServiceLogs.publish(conf, toolLogs);
        } catch (RuntimeException e) {
            log.error("ERROR in handle_outputs...", e);
            throw e;
        }
    }

    private WorkspaceClient newWorkspaceClient() {
        return new WorkspaceClient(settings.getWorkspaceUrl(), env);
    }

    /**
     * The name of the user's workspace in the workspace API: the configured prefix followed by the user name.
     */
    public String getUserWorkspace() {
        return settings.getWorkspacePrefix() + "-" + username;
    }

    public String getWorkspaceName() {
        return workspaceName;
    }

    public String getUsername() {
        return username;
    }

    public boolean isUsingWorkspace() {
        return useWorkspace;
    }

    /**
     * The consolidated collection as pretty-printed JSON, "{}" when there is none.
     * Null until the post-execution hook has run.
     */
    public String getFeatureCollection() {
        return featureCollection;
    }

    public ConsolidationResult getConsolidationResult() {
        return consolidationResult;
    }
}
