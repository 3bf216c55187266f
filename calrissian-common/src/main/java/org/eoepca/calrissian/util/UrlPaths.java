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

package org.eoepca.calrissian.util;

import java.net.URI;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.regex.Pattern;

/**
 * Helpers for composing and resolving URLs and paths the way the platform's services expect them.
 */
public final class UrlPaths {

    private static final Pattern ABSOLUTE_URI = Pattern.compile("^[a-zA-Z][a-zA-Z0-9+.-]*://.*");

    private UrlPaths() {}

    /**
     * Joins path components with '/', inserting a separator only where one is missing.
     * A component that starts with '/' discards everything before it.
     */
    public static String join(String base, String... parts) {
        StringBuilder result = new StringBuilder(base == null ? "" : base);
        for (String part : parts) {
            if (part.startsWith("/")) {
                result.setLength(0);
                result.append(part);
            } else if (result.length() == 0 || result.charAt(result.length() - 1) == '/') {
                result.append(part);
            } else {
                result.append('/').append(part);
            }
        }
        return result.toString();
    }

    /**
     * Returns the final component of a '/'-separated path.
     */
    public static String basename(String path) {
        int idx = path.lastIndexOf('/');
        return idx < 0 ? path : path.substring(idx + 1);
    }

    public static boolean isAbsoluteUri(String href) {
        return href != null && ABSOLUTE_URI.matcher(href).matches();
    }

    /**
     * Resolves an href found in a document against the location the document was read from.
     * Absolute hrefs are returned unchanged.
     */
    public static String resolve(String baseHref, String href) {
        if (isAbsoluteUri(href) || baseHref == null) {
            return href;
        }
        if (isAbsoluteUri(baseHref)) {
            return URI.create(baseHref).resolve(href).toString();
        }
        Path base = Paths.get(baseHref);
        Path parent = base.getParent();
        Path resolved = parent == null ? Paths.get(href) : parent.resolve(href);
        return resolved.normalize().toString();
    }
}
