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

package org.eoepca.calrissian.ex;

/**
 * Thrown when the host's configuration mapping lacks a value the service needs.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String section, String key) {
        super(String.format("Missing required configuration value %s.%s", section, key));
    }

    public ConfigurationException(String message) {
        super(message);
    }
}
