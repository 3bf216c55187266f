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

package org.eoepca.calrissian.aws;

import java.net.URI;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Uri;
import software.amazon.awssdk.services.s3.S3Utilities;

/**
 * Object storage locations look like this:
 *
 * <pre>
 * {@code
 *  s3://<bucket>/<key>
 * }
 * </pre>
 *
 * where the key may contain any number of '/'-separated components.
 *
 * The AWS SDK provides S3Utilities for parsing these values.
 *
 * This class provides helpers for extracting specific parts of such URIs, without needing to duplicate validation logic
 * everywhere.
 */
public final class S3Uris {

    private static final Logger log = LoggerFactory.getLogger(S3Uris.class);

    public static final String SCHEME_PREFIX = "s3://";

    // The region is only consulted when building URLs, not when parsing them.
    private static final S3Utilities UTILITIES = S3Utilities.builder().region(Region.US_EAST_1).build();

    private S3Uris() {}

    public static boolean isS3(String uri) {
        return uri != null && uri.startsWith(SCHEME_PREFIX);
    }

    /**
     * Prefixes the location with s3:// unless it already has that prefix.
     */
    public static String normalize(String location) {
        if (location == null) {
            throw new IllegalArgumentException("location may not be null.");
        }
        return isS3(location) ? location : SCHEME_PREFIX + location;
    }

    /**
     * Returns the bucket portion of the provided URI.
     * If the input is not a valid s3 URI, returns null.
     */
    public static String extractBucket(String uri) {
        S3Uri parsed = parse(uri);
        if (parsed == null) {
            return null;
        }
        return parsed.bucket().orElse(null);
    }

    /**
     * Returns the key portion of the provided URI, without a leading '/'.
     * Returns an empty string if the URI names only a bucket, and null if the input is not a valid s3 URI.
     */
    public static String extractKey(String uri) {
        S3Uri parsed = parse(uri);
        if (parsed == null || !parsed.bucket().isPresent()) {
            return null;
        }
        return parsed.key().orElse("");
    }

    private static S3Uri parse(String uri) {
        if (!isS3(uri)) {
            log.warn("The provided uri was not an s3 uri: {}", uri);
            return null;
        }
        try {
            return UTILITIES.parseUri(URI.create(uri));
        } catch (IllegalArgumentException e) {
            log.warn("The provided uri was invalid: {}", uri, e);
            return null;
        }
    }
}
