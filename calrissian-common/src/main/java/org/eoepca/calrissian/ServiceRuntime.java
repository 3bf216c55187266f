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

/**
 * The capabilities the WPS host runtime offers to a service: its status codes and its message translation.
 *
 * When running outside of the host (e.g. in unit tests), use NoopServiceRuntime.
 */
public interface ServiceRuntime {

    int SERVICE_SUCCEEDED = 3;
    int SERVICE_FAILED = 4;

    /**
     * Translates a message into the language requested by the WPS client.
     */
    String translate(String message);
}
