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

import org.eoepca.calrissian.conf.ConfSection;
import org.eoepca.calrissian.conf.ServiceConf;

/**
 * The platform settings from the "eoepca" section of the service configuration.
 */
public class EoepcaSettings {

    public static final String SECTION = "eoepca";

    static final String DOMAIN = "domain";
    static final String WORKSPACE_URL = "workspace_url";
    static final String WORKSPACE_PREFIX = "workspace_prefix";

    private final String domain;
    private final String workspaceUrl;
    private final String workspacePrefix;

    public EoepcaSettings(ServiceConf conf) {
        ConfSection section = conf.section(SECTION);
        this.domain = emptyIfNull(section.get(DOMAIN));
        this.workspaceUrl = emptyIfNull(section.get(WORKSPACE_URL));
        this.workspacePrefix = emptyIfNull(section.get(WORKSPACE_PREFIX));
    }

    public String getDomain() {
        return domain;
    }

    public String getWorkspaceUrl() {
        return workspaceUrl;
    }

    public String getWorkspacePrefix() {
        return workspacePrefix;
    }

    /**
     * Workspace integration is only possible when both the API location and the workspace prefix are known.
     */
    public boolean isWorkspaceConfigured() {
        return !workspaceUrl.isEmpty() && !workspacePrefix.isEmpty();
    }

    private static String emptyIfNull(String value) {
        return value == null ? "" : value;
    }
}
