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

package org.eoepca.calrissian.eoepca.output;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.eoepca.calrissian.aws.S3Uris;
import org.eoepca.calrissian.stac.StacCatalogReader;
import org.eoepca.calrissian.stac.StacIo;
import org.eoepca.calrissian.stac.StacObject;
import org.eoepca.calrissian.storage.StorageCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns the STAC catalog produced by a workflow into the single collection document that is returned to the
 * caller and registered with the workspace.
 */
public class CollectionConsolidator {

    private static final Logger log = LoggerFactory.getLogger(CollectionConsolidator.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String STORAGE_PLATFORM = "storage:platform";
    public static final String STORAGE_REQUESTER_PAYS = "storage:requester_pays";
    public static final String STORAGE_TIER = "storage:tier";
    public static final String STORAGE_REGION = "storage:region";
    public static final String STORAGE_ENDPOINT = "storage:endpoint";

    static final String PLATFORM_NAME = "EOEPCA";
    static final String STANDARD_TIER = "Standard";
    static final String FEATURE_COLLECTION_TYPE = "FeatureCollection";

    private final StacCatalogReader reader;

    public CollectionConsolidator(StacIo io) {
        this.reader = new StacCatalogReader(io);
    }

    /**
     * Consolidates the catalog at catalogLocation. The result's id is always collectionId.
     *
     * @param catalogLocation The catalog location, with or without the s3:// scheme.
     * @param collectionId    The id to give the consolidated collection.
     * @param storage         The storage the outputs were written to, recorded on every asset of collected items.
     */
    public ConsolidationResult consolidate(String catalogLocation, String collectionId, StorageCredentials storage) {
        String catalogUri = S3Uris.normalize(catalogLocation);
        log.info("Read catalog => STAC Catalog URI: {}", catalogUri);

        StacObject catalog;
        try {
            catalog = reader.read(catalogUri);
        } catch (IOException | RuntimeException e) {
            log.error("Unable to read the output catalog at {}", catalogUri, e);
            return ConsolidationResult.catalogUnreadable(e);
        }

        log.info("Create collection with ID {}", collectionId);
        Optional<StacObject> existing = findFirstCollection(catalog);
        if (existing.isPresent()) {
            log.info("Got collection {} from outputs", existing.get().getId());
            ObjectNode collection = existing.get().getJson().deepCopy();
            collection.put("id", collectionId);
            return ConsolidationResult.existingCollection(collection, catalog.getSelfHref());
        }

        List<StacObject> items;
        try {
            items = reader.getAllItems(catalog);
        } catch (IOException | RuntimeException e) {
            log.error("Unable to gather the items of the output catalog at {}", catalogUri, e);
            return ConsolidationResult.catalogUnreadable(e);
        }
        if (items.isEmpty()) {
            log.warn("The output catalog at {} contains neither a collection nor items", catalogUri);
            return ConsolidationResult.noOutputs(catalog.getSelfHref());
        }

        ObjectNode featureCollection = MAPPER.createObjectNode();
        featureCollection.put("type", FEATURE_COLLECTION_TYPE);
        ArrayNode features = featureCollection.putArray("features");
        for (StacObject item : items) {
            features.add(annotateItem(item.getJson().deepCopy(), collectionId, storage));
        }
        featureCollection.put("id", collectionId);
        log.info("Gathered {} items into collection {}", items.size(), collectionId);
        return ConsolidationResult.collectedItems(featureCollection, catalog.getSelfHref());
    }

    private Optional<StacObject> findFirstCollection(StacObject catalog) {
        try {
            return reader.findFirstCollection(catalog);
        } catch (IOException | RuntimeException e) {
            log.warn("Unable to search the output catalog for a collection, gathering its items instead", e);
            return Optional.empty();
        }
    }

    // package-private for test visibility
    static ObjectNode annotateItem(ObjectNode item, String collectionId, StorageCredentials storage) {
        JsonNode assets = item.get("assets");
        if (assets != null && assets.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = assets.fields();
            while (fields.hasNext()) {
                JsonNode asset = fields.next().getValue();
                if (asset.isObject()) {
                    ObjectNode extraFields = (ObjectNode)asset;
                    extraFields.put(STORAGE_PLATFORM, PLATFORM_NAME);
                    extraFields.put(STORAGE_REQUESTER_PAYS, false);
                    extraFields.put(STORAGE_TIER, STANDARD_TIER);
                    extraFields.put(STORAGE_REGION, storage.getRegion());
                    extraFields.put(STORAGE_ENDPOINT, storage.getEndpoint());
                }
            }
        }
        item.put("collection", collectionId);
        return item;
    }
}
