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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.eoepca.calrissian.ex.HookExecutionException;

/**
 * The outcome of consolidating a workflow's output catalog into a single collection document.
 */
public final class ConsolidationResult {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public enum Outcome {
        /** The catalog already contained a collection, which was adopted. */
        EXISTING_COLLECTION,
        /** The catalog's items were gathered into a new feature collection. */
        COLLECTED_ITEMS,
        /** The catalog could not be read or parsed. */
        CATALOG_UNREADABLE,
        /** The catalog contained neither a collection nor items. */
        NO_OUTPUTS,
    }

    private final Outcome outcome;
    private final ObjectNode collection;
    private final String catalogSelfHref;
    private final Exception cause;

    private ConsolidationResult(Outcome outcome, ObjectNode collection, String catalogSelfHref, Exception cause) {
        this.outcome = outcome;
        this.collection = collection;
        this.catalogSelfHref = catalogSelfHref;
        this.cause = cause;
    }

    public static ConsolidationResult existingCollection(ObjectNode collection, String catalogSelfHref) {
        return new ConsolidationResult(Outcome.EXISTING_COLLECTION, collection, catalogSelfHref, null);
    }

    public static ConsolidationResult collectedItems(ObjectNode featureCollection, String catalogSelfHref) {
        return new ConsolidationResult(Outcome.COLLECTED_ITEMS, featureCollection, catalogSelfHref, null);
    }

    public static ConsolidationResult catalogUnreadable(Exception cause) {
        return new ConsolidationResult(Outcome.CATALOG_UNREADABLE, null, null, cause);
    }

    public static ConsolidationResult noOutputs(String catalogSelfHref) {
        return new ConsolidationResult(Outcome.NO_OUTPUTS, null, catalogSelfHref, null);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean hasCollection() {
        return collection != null;
    }

    /**
     * Returns the consolidated document, or an empty object if there is none.
     */
    public ObjectNode getCollection() {
        return collection == null ? MAPPER.createObjectNode() : collection.deepCopy();
    }

    /**
     * The self href of the catalog the result was built from. Null if the catalog could not be read.
     */
    public String getCatalogSelfHref() {
        return catalogSelfHref;
    }

    public Exception getCause() {
        return cause;
    }

    public String toJson() {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(getCollection());
        } catch (JsonProcessingException e) {
            throw new HookExecutionException("Unable to serialize the consolidated collection.", e);
        }
    }
}
