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

package org.eoepca.calrissian.eoepca.identity;

import java.util.List;
import java.util.Map;

/**
 * Extracts the user name from token claims.
 */
public final class UserNames {

    /**
     * The claims that may carry the user name, in order of priority.
     */
    public static final List<String> USER_NAME_CLAIMS = List.of("username", "user_name", "preferred_username");

    private UserNames() {}

    /**
     * Returns the value of the first user-name claim present, or an empty string if there is none.
     */
    public static String fromClaims(Map<String, Object> claims) {
        for (String claim : USER_NAME_CLAIMS) {
            Object value = claims.get(claim);
            if (value != null) {
                return value.toString();
            }
        }
        return "";
    }
}
