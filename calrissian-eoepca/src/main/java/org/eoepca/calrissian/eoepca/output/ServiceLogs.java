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

package org.eoepca.calrissian.eoepca.output;

import java.util.List;

import org.eoepca.calrissian.conf.ConfSection;
import org.eoepca.calrissian.conf.ServiceConf;
import org.eoepca.calrissian.util.UrlPaths;

/**
 * Publishes links to the workflow's tool logs in the "service_logs" section, where the host runtime lists them
 * alongside the execution status.
 */
public final class ServiceLogs {

    static final String URL = "url";
    static final String TITLE = "title";
    static final String REL = "rel";
    static final String LENGTH = "length";
    static final String RELATED = "related";

    private ServiceLogs() {}

    public static void publish(ServiceConf conf, List<String> toolLogs) {
        ConfSection section = conf.sectionForUpdate(ServiceConf.SERVICE_LOGS);
        for (int i = 0; i < toolLogs.size(); i++) {
            String name = UrlPaths.basename(toolLogs.get(i));
            String runDirectory = conf.getServiceIdentifier() + "-" + conf.getRequiredUsid();
            String suffix = (i == 0 ? "" : "_" + i);
            section.put(URL + suffix, UrlPaths.join(conf.getTmpUrl(), runDirectory, name));
            section.put(TITLE + suffix, "Tool log " + name);
            section.put(REL + suffix, RELATED);
        }
        section.put(LENGTH, Integer.toString(toolLogs.size()));
    }
}
