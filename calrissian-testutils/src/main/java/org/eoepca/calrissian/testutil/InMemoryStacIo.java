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

package org.eoepca.calrissian.testutil;

import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eoepca.calrissian.stac.StacIo;
import org.eoepca.calrissian.stac.StacIoFactory;
import org.eoepca.calrissian.storage.StorageCredentials;

/**
 * A StacIo keeping documents in memory, keyed by href. Intended to be used by unit tests.
 */
public class InMemoryStacIo implements StacIo {

    private final Map<String, String> documents = new HashMap<>();
    private final List<String> reads = new ArrayList<>();
    private boolean closed = false;

    private StorageCredentials credentialsUsed;
    private String accessPointUsed;

    /**
     * Returns a factory that always hands out this instance, recording the settings it was created with.
     */
    public StacIoFactory asFactory() {
        return (credentials, accessPoint) -> {
            this.credentialsUsed = credentials;
            this.accessPointUsed = accessPoint;
            return this;
        };
    }

    public void put(String href, String text) {
        documents.put(href, text);
    }

    @Override
    public String readText(String href) throws IOException {
        reads.add(href);
        String text = documents.get(href);
        if (text == null) {
            throw new FileNotFoundException("No document stored at " + href);
        }
        return text;
    }

    @Override
    public void writeText(String href, String text) {
        documents.put(href, text);
    }

    @Override
    public void close() {
        closed = true;
    }

    public List<String> getReads() {
        return reads;
    }

    public boolean isClosed() {
        return closed;
    }

    public StorageCredentials getCredentialsUsed() {
        return credentialsUsed;
    }

    public String getAccessPointUsed() {
        return accessPointUsed;
    }
}
