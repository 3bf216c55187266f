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

import java.util.Map;

import org.eoepca.calrissian.conf.ConfSection;
import org.eoepca.calrissian.conf.ServiceConf;
import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.storage.StorageCredentials;

/**
 * Typed access to the "additional_parameters" section, the scratch area the execution engine forwards to the
 * stage-in and stage-out steps of the workflow.
 */
public class AdditionalParameters {

    public static final String STAGEIN_AWS_SERVICEURL = "STAGEIN_AWS_SERVICEURL";
    public static final String STAGEIN_AWS_ACCESS_KEY_ID = "STAGEIN_AWS_ACCESS_KEY_ID";
    public static final String STAGEIN_AWS_SECRET_ACCESS_KEY = "STAGEIN_AWS_SECRET_ACCESS_KEY";
    public static final String STAGEIN_AWS_REGION = "STAGEIN_AWS_REGION";
    public static final String STAGEOUT_AWS_SERVICEURL = "STAGEOUT_AWS_SERVICEURL";
    public static final String STAGEOUT_AWS_ACCESS_KEY_ID = "STAGEOUT_AWS_ACCESS_KEY_ID";
    public static final String STAGEOUT_AWS_SECRET_ACCESS_KEY = "STAGEOUT_AWS_SECRET_ACCESS_KEY";
    public static final String STAGEOUT_AWS_REGION = "STAGEOUT_AWS_REGION";
    public static final String STAGEOUT_OUTPUT = "STAGEOUT_OUTPUT";
    public static final String STAGEOUT_WORKSPACE = "STAGEOUT_WORKSPACE";
    public static final String STAGEOUT_PULSAR_URL = "STAGEOUT_PULSAR_URL";
    public static final String STAGEOUT_ACCESS_POINT = "STAGEOUT_ACCESS_POINT";
    public static final String WORKSPACE_DOMAIN = "WORKSPACE_DOMAIN";
    public static final String COLLECTION_ID = "collection_id";
    public static final String PROCESS = "process";

    public static final String PROCESSING_RESULTS = "processing-results";

    static final String DEFAULT_SERVICE_URL = "http://s3-service.zoo.svc.cluster.local:9000";
    static final String DEFAULT_ACCESS_KEY_ID = "minio-admin";
    static final String DEFAULT_SECRET_ACCESS_KEY = "minio-secret-password";
    static final String DEFAULT_REGION = "RegionOne";
    static final String DEFAULT_OUTPUT = "eoepca";
    static final String DEFAULT_WORKSPACE = "default";

    private final ConfSection section;

    public AdditionalParameters(ServiceConf conf) {
        this.section = conf.sectionForUpdate(ServiceConf.ADDITIONAL_PARAMETERS);
    }

    /**
     * Sets the storage defaults from the environment, falling back to the in-cluster object store.
     * Any value already present for these keys is overwritten.
     */
    public void initDefaults(EnvironmentVariables env) {
        String[][] defaults = {
            {STAGEIN_AWS_SERVICEURL, DEFAULT_SERVICE_URL},
            {STAGEIN_AWS_ACCESS_KEY_ID, DEFAULT_ACCESS_KEY_ID},
            {STAGEIN_AWS_SECRET_ACCESS_KEY, DEFAULT_SECRET_ACCESS_KEY},
            {STAGEIN_AWS_REGION, DEFAULT_REGION},
            {STAGEOUT_AWS_SERVICEURL, DEFAULT_SERVICE_URL},
            {STAGEOUT_AWS_ACCESS_KEY_ID, DEFAULT_ACCESS_KEY_ID},
            {STAGEOUT_AWS_SECRET_ACCESS_KEY, DEFAULT_SECRET_ACCESS_KEY},
            {STAGEOUT_AWS_REGION, DEFAULT_REGION},
            {STAGEOUT_OUTPUT, DEFAULT_OUTPUT},
            {STAGEOUT_WORKSPACE, DEFAULT_WORKSPACE},
            {STAGEOUT_PULSAR_URL, null},
            {STAGEOUT_ACCESS_POINT, null},
            {WORKSPACE_DOMAIN, null},
        };
        for (String[] entry : defaults) {
            section.put(entry[0], env.get(entry[0], entry[1]));
        }
    }

    public StorageCredentials getStageInCredentials() {
        return new StorageCredentials(section.get(STAGEIN_AWS_SERVICEURL), section.get(STAGEIN_AWS_ACCESS_KEY_ID),
                                      section.get(STAGEIN_AWS_SECRET_ACCESS_KEY), section.get(STAGEIN_AWS_REGION),
                                      null);
    }

    public StorageCredentials getStageOutCredentials() {
        return new StorageCredentials(section.get(STAGEOUT_AWS_SERVICEURL), section.get(STAGEOUT_AWS_ACCESS_KEY_ID),
                                      section.get(STAGEOUT_AWS_SECRET_ACCESS_KEY), section.get(STAGEOUT_AWS_REGION),
                                      section.get(STAGEOUT_OUTPUT));
    }

    public void setStageOutCredentials(StorageCredentials credentials) {
        section.put(STAGEOUT_AWS_SERVICEURL, credentials.getEndpoint());
        section.put(STAGEOUT_AWS_ACCESS_KEY_ID, credentials.getAccessKey());
        section.put(STAGEOUT_AWS_SECRET_ACCESS_KEY, credentials.getSecretKey());
        section.put(STAGEOUT_AWS_REGION, credentials.getRegion());
        section.put(STAGEOUT_OUTPUT, credentials.getBucketName());
    }

    public String getCollectionId() {
        return section.get(COLLECTION_ID, "");
    }

    public void setCollectionId(String collectionId) {
        section.put(COLLECTION_ID, collectionId);
    }

    public String getProcess() {
        return section.get(PROCESS);
    }

    public void setProcess(String process) {
        section.put(PROCESS, process);
    }

    public String getStageOutWorkspace() {
        return section.get(STAGEOUT_WORKSPACE);
    }

    public void setStageOutWorkspace(String workspace) {
        section.put(STAGEOUT_WORKSPACE, workspace);
    }

    public String getStageOutAccessPoint() {
        return section.get(STAGEOUT_ACCESS_POINT);
    }

    public void setStageOutAccessPoint(String accessPoint) {
        section.put(STAGEOUT_ACCESS_POINT, accessPoint);
    }

    public String getPulsarUrl() {
        return section.get(STAGEOUT_PULSAR_URL);
    }

    public String getWorkspaceDomain() {
        return section.get(WORKSPACE_DOMAIN);
    }

    public Map<String, String> toMap() {
        return section.toMap();
    }
}
