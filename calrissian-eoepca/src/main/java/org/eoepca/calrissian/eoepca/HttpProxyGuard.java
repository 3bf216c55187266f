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

import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.http.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Clears HTTP_PROXY for the duration of a hook and puts back the value observed when the guard was created.
 */
public class HttpProxyGuard {

    private static final Logger log = LoggerFactory.getLogger(HttpProxyGuard.class);

    private final EnvironmentVariables env;
    private final String savedProxy;

    public HttpProxyGuard(EnvironmentVariables env) {
        this.env = env;
        this.savedProxy = env.get(HttpClients.HTTP_PROXY);
    }

    public void unset() {
        String current = env.remove(HttpClients.HTTP_PROXY);
        if (current != null) {
            log.info("Unsetting env HTTP_PROXY, whose value was {}", current);
        }
    }

    /**
     * Restores the saved value. An empty or absent saved value leaves the variable unset.
     */
    public void restore() {
        if (savedProxy != null && !savedProxy.isEmpty()) {
            log.info("Restoring env HTTP_PROXY, to value {}", savedProxy);
            env.set(HttpClients.HTTP_PROXY, savedProxy);
        }
    }
}
