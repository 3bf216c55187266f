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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.eoepca.calrissian.ex.ConfigurationException;

/**
 * A view over one section of the host's configuration mapping (e.g. "lenv" or "additional_parameters").
 *
 * Writes go straight through to the underlying mapping, since the workflow engine reads the same mapping.
 * Values may be null.
 */
public class ConfSection {

    private final String name;
    private final Map<String, String> values;

    ConfSection(String name, Map<String, String> values) {
        this.name = name;
        this.values = values;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns the value stored for the key, or null if the key is absent.
     */
    public String get(String key) {
        return values.get(key);
    }

    /**
     * Returns the value stored for the key, or defaultValue if the key is absent.
     * A key explicitly mapped to null is returned as null.
     */
    public String get(String key, String defaultValue) {
        if (!values.containsKey(key)) {
            return defaultValue;
        }
        return values.get(key);
    }

    /**
     * Returns the value stored for the key, throwing ConfigurationException if it is absent or null.
     */
    public String getRequired(String key) {
        String value = values.get(key);
        if (value == null) {
            throw new ConfigurationException(name, key);
        }
        return value;
    }

    public boolean contains(String key) {
        return values.containsKey(key);
    }

    public void put(String key, String value) {
        values.put(key, value);
    }

    /**
     * Returns an immutable copy of the section, preserving key order.
     */
    public Map<String, String> toMap() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
