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

package org.eoepca.calrissian.stac;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.http.HttpClients;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * StacIo for local files and http(s) locations.
 */
public class DefaultStacIo implements StacIo {

    private static final Logger log = LoggerFactory.getLogger(DefaultStacIo.class);

    private final EnvironmentVariables env;

    public DefaultStacIo(EnvironmentVariables env) {
        this.env = env;
    }

    @Override
    public String readText(String href) throws IOException {
        if (isHttp(href)) {
            HttpRequest request = HttpRequest.newBuilder().uri(URI.create(href)).GET().build();
            HttpResponse<String> response;
            try {
                response = HttpClients.forEnvironment(env).send(request, HttpResponse.BodyHandlers.ofString());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IOException("Interrupted while reading " + href, e);
            }
            if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw new IOException(String.format("Reading %s returned status %d", href, response.statusCode()));
            }
            return response.body();
        }
        log.debug("Reading local file {}", href);
        return Files.readString(toPath(href), StandardCharsets.UTF_8);
    }

    @Override
    public void writeText(String href, String text) throws IOException {
        if (isHttp(href)) {
            throw new IOException("Writing STAC documents over http is not supported: " + href);
        }
        Path path = toPath(href);
        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        log.debug("Writing local file {}", href);
        Files.writeString(path, text, StandardCharsets.UTF_8);
    }

    private static boolean isHttp(String href) {
        return href.startsWith("http://") || href.startsWith("https://");
    }

    private static Path toPath(String href) {
        if (href.startsWith("file:")) {
            return Paths.get(URI.create(href));
        }
        return Paths.get(href);
    }
}
