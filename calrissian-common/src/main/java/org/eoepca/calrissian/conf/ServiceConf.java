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

package org.eoepca.calrissian.conf;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed access to the configuration mapping the WPS host passes to a service.
 *
 * The mapping is a two-level structure of section name to key to value. This class exposes the host-defined
 * keys the hooks rely on; platform-specific sections are reached through section() and sectionForUpdate().
 */
public class ServiceConf {

    public static final String MAIN = "main";
    public static final String LENV = "lenv";
    public static final String AUTH_ENV = "auth_env";
    public static final String ADDITIONAL_PARAMETERS = "additional_parameters";
    public static final String POD_ENV_VARS = "pod_env_vars";
    public static final String POD_NODE_SELECTOR = "pod_node_selector";
    public static final String SERVICE_LOGS = "service_logs";

    static final String TMP_URL = "tmpUrl";
    static final String TMP_PATH = "tmpPath";
    static final String USID = "usid";
    static final String IDENTIFIER = "Identifier";
    static final String MESSAGE = "message";
    static final String JWT = "jwt";

    private final Map<String, Map<String, String>> conf;

    public ServiceConf(Map<String, Map<String, String>> conf) {
        if (conf == null) {
            throw new IllegalArgumentException("conf may not be null.");
        }
        this.conf = conf;
    }

    /**
     * Returns the underlying mapping, for handing back to the workflow engine.
     */
    public Map<String, Map<String, String>> asMap() {
        return conf;
    }

    /**
     * Returns a view over the named section. If the section does not exist, the view is empty and detached:
     * writes to it are not reflected in the configuration mapping.
     */
    public ConfSection section(String name) {
        Map<String, String> values = conf.get(name);
        if (values == null) {
            return new ConfSection(name, new LinkedHashMap<>());
        }
        return new ConfSection(name, values);
    }

    /**
     * Returns a view over the named section, creating the section if it does not exist.
     */
    public ConfSection sectionForUpdate(String name) {
        return new ConfSection(name, conf.computeIfAbsent(name, k -> new LinkedHashMap<>()));
    }

    public boolean hasSection(String name) {
        return conf.containsKey(name);
    }

    public String getTmpUrl() {
        return section(MAIN).getRequired(TMP_URL);
    }

    public String getTmpPath() {
        return section(MAIN).getRequired(TMP_PATH);
    }

    /**
     * The unique id the host assigned to this execution. Empty if the host did not provide one.
     */
    public String getUsid() {
        return section(LENV).get(USID, "");
    }

    public String getRequiredUsid() {
        return section(LENV).getRequired(USID);
    }

    /**
     * The identifier of the deployed service.
     */
    public String getServiceIdentifier() {
        return section(LENV).getRequired(IDENTIFIER);
    }

    /**
     * Sets the message the host reports to the client along with the execution status.
     */
    public void setStatusMessage(String message) {
        sectionForUpdate(LENV).put(MESSAGE, message);
    }

    public String getStatusMessage() {
        return section(LENV).get(MESSAGE);
    }

    /**
     * The caller's bearer token, or an empty string if the request was unauthenticated.
     */
    public String getAuthToken() {
        String token = section(AUTH_ENV).get(JWT);
        return token == null ? "" : token;
    }
}
