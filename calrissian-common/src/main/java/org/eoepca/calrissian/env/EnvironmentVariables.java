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

package org.eoepca.calrissian.env;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A mutable view of the process environment.
 *
 * The JVM cannot modify its own environment, so variables that hooks unset or override (such as HTTP_PROXY)
 * live in this overlay, and every component that would otherwise read System.getenv() reads from here instead.
 * The shared instance returned by system() starts as a snapshot of the real environment.
 *
 * Not designed for concurrent executions sharing one instance.
 */
public final class EnvironmentVariables {

    private static final EnvironmentVariables SYSTEM = new EnvironmentVariables(System.getenv());

    private final Map<String, String> variables;

    public EnvironmentVariables() {
        this(Collections.emptyMap());
    }

    public EnvironmentVariables(Map<String, String> initialValues) {
        if (initialValues == null) {
            throw new IllegalArgumentException("initialValues may not be null.");
        }
        this.variables = new ConcurrentHashMap<>(initialValues);
    }

    public static EnvironmentVariables system() {
        return SYSTEM;
    }

    /**
     * Returns the variable's value, or null if it is not set.
     */
    public String get(String name) {
        return variables.get(name);
    }

    /**
     * Returns the variable's value, or defaultValue if it is not set.
     */
    public String get(String name, String defaultValue) {
        return variables.getOrDefault(name, defaultValue);
    }

    public boolean contains(String name) {
        return variables.containsKey(name);
    }

    /**
     * Sets the variable. A null value unsets it.
     */
    public void set(String name, String value) {
        if (value == null) {
            variables.remove(name);
        } else {
            variables.put(name, value);
        }
    }

    /**
     * Unsets the variable and returns its previous value, or null if it was not set.
     */
    public String remove(String name) {
        return variables.remove(name);
    }
}
