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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads STAC documents through a StacIo and walks the catalog tree they form.
 *
 * Child and item links are followed lazily, in the order they appear in each document.
 */
public class StacCatalogReader {

    private static final Logger log = LoggerFactory.getLogger(StacCatalogReader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final StacIo io;

    public StacCatalogReader(StacIo io) {
        this.io = io;
    }

    /**
     * Reads and parses the document at the given href.
     *
     * @throws IOException if the document cannot be read or is not a json object.
     */
    public StacObject read(String href) throws IOException {
        String text = io.readText(href);
        JsonNode node = MAPPER.readTree(text);
        if (node == null || !node.isObject()) {
            throw new IOException("Expected a STAC json object at " + href);
        }
        return new StacObject(href, (ObjectNode) node);
    }

    public List<StacObject> getChildren(StacObject parent) throws IOException {
        return readAll(parent.getLinkHrefs(StacObject.REL_CHILD));
    }

    public List<StacObject> getItems(StacObject parent) throws IOException {
        return readAll(parent.getLinkHrefs(StacObject.REL_ITEM));
    }

    /**
     * Returns the first collection found below the given catalog. The catalog's direct children are checked first,
     * in link order; only if none of them is a collection is each child searched the same way, again in link order.
     * The catalog itself is not considered.
     */
    public Optional<StacObject> findFirstCollection(StacObject catalog) throws IOException {
        List<StacObject> children = new ArrayList<>();
        for (String childHref : catalog.getLinkHrefs(StacObject.REL_CHILD)) {
            StacObject child = read(childHref);
            if (child.isCollection()) {
                return Optional.of(child);
            }
            children.add(child);
        }
        for (StacObject child : children) {
            Optional<StacObject> nested = findFirstCollection(child);
            if (nested.isPresent()) {
                return nested;
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the catalog's own items followed by the items of all its descendants.
     */
    public List<StacObject> getAllItems(StacObject catalog) throws IOException {
        List<StacObject> items = new ArrayList<>(getItems(catalog));
        for (StacObject child : getChildren(catalog)) {
            items.addAll(getAllItems(child));
        }
        log.debug("Found {} items below {}", items.size(), catalog.getHref());
        return items;
    }

    private List<StacObject> readAll(List<String> hrefs) throws IOException {
        List<StacObject> objects = new ArrayList<>();
        for (String href : hrefs) {
            objects.add(read(href));
        }
        return objects;
    }
}
