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

import java.util.ArrayList;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.eoepca.calrissian.util.UrlPaths;

/**
 * A STAC catalog, collection or item, together with the href it was read from.
 */
public final class StacObject {

    public static final String TYPE_CATALOG = "Catalog";
    public static final String TYPE_COLLECTION = "Collection";
    public static final String TYPE_ITEM = "Feature";

    public static final String REL_SELF = "self";
    public static final String REL_CHILD = "child";
    public static final String REL_ITEM = "item";

    private final String href;
    private final ObjectNode json;

    public StacObject(String href, ObjectNode json) {
        if (json == null) {
            throw new IllegalArgumentException("json may not be null.");
        }
        this.href = href;
        this.json = json;
    }

    public String getHref() {
        return href;
    }

    /**
     * The document itself. Changes made to the returned node are visible through this object.
     */
    public ObjectNode getJson() {
        return json;
    }

    public String getType() {
        return textField("type");
    }

    public String getId() {
        return textField("id");
    }

    public boolean isCollection() {
        return TYPE_COLLECTION.equals(getType());
    }

    public boolean isItem() {
        return TYPE_ITEM.equals(getType());
    }

    /**
     * The href of the document's self link, or the href it was read from if it has none.
     */
    public String getSelfHref() {
        List<String> self = getLinkHrefs(REL_SELF);
        return self.isEmpty() ? href : self.get(0);
    }

    /**
     * The hrefs of all links with the given relation, in document order, resolved against this object's href.
     */
    public List<String> getLinkHrefs(String rel) {
        List<String> hrefs = new ArrayList<>();
        JsonNode links = json.get("links");
        if (links == null || !links.isArray()) {
            return hrefs;
        }
        for (JsonNode link : links) {
            JsonNode linkRel = link.get("rel");
            JsonNode linkHref = link.get("href");
            if (linkRel != null && rel.equals(linkRel.asText()) && linkHref != null && linkHref.isTextual()) {
                hrefs.add(UrlPaths.resolve(href, linkHref.asText()));
            }
        }
        return hrefs;
    }

    private String textField(String name) {
        JsonNode node = json.get(name);
        return node == null || !node.isTextual() ? null : node.asText();
    }
}
