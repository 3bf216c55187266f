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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collections;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the image pull secrets mounted into the service pod.
 */
public final class PodSecrets {

    private static final Logger log = LoggerFactory.getLogger(PodSecrets.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    public static final Path DEFAULT_LOCATION = Paths.get("/assets/pod_imagePullSecrets.yaml");

    private PodSecrets() {}

    /**
     * Returns the secrets document, or an empty map if the file is missing, empty or not a YAML mapping.
     */
    public static Map<String, Object> load(Path file) {
        if (!Files.isRegularFile(file)) {
            log.debug("No pod secrets file at {}", file);
            return Collections.emptyMap();
        }
        try {
            Map<String, Object> secrets = YAML.readValue(file.toFile(), MAP_TYPE);
            return secrets == null ? Collections.emptyMap() : secrets;
        } catch (IOException e) {
            log.warn("Unable to load pod secrets from {}, ignoring them", file, e);
            return Collections.emptyMap();
        }
    }
}
