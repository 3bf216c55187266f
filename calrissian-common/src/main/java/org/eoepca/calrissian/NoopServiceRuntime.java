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

package org.eoepca.calrissian;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A ServiceRuntime used when no WPS host runtime is available. Messages are logged and returned untranslated.
 */
public class NoopServiceRuntime implements ServiceRuntime {

    private static final Logger log = LoggerFactory.getLogger(NoopServiceRuntime.class);

    @Override
    public String translate(String message) {
        log.debug("Translation requested for message: {}", message);
        return message;
    }
}
