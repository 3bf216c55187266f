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

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.stac.DefaultStacIo;
import org.eoepca.calrissian.stac.StacIo;
import org.eoepca.calrissian.stac.StacIoFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

/**
 * StacIo that reads and writes s3:// locations through an S3Client, and delegates every other location to a
 * fallback StacIo.
 *
 * If an access point is configured, it replaces the bucket named in every s3 href.
 */
public class S3StacIo implements StacIo {

    private static final Logger log = LoggerFactory.getLogger(S3StacIo.class);

    static final String GEO_JSON_CONTENT_TYPE = "application/geo+json";

    private final S3Client s3;
    private final String accessPoint;
    private final StacIo fallback;

    public S3StacIo(S3Client s3, String accessPoint, StacIo fallback) {
        this.s3 = s3;
        this.accessPoint = accessPoint;
        this.fallback = fallback;
    }

    /**
     * Returns a factory building an S3StacIo (and its S3Client) from the active storage settings.
     */
    public static StacIoFactory factory(EnvironmentVariables env) {
        return (credentials, accessPoint) -> new S3StacIo(S3ClientFactory.create(credentials), accessPoint,
                                                          new DefaultStacIo(env));
    }

    @Override
    public String readText(String href) throws IOException {
        if (!S3Uris.isS3(href)) {
            return fallback.readText(href);
        }
        String bucket = resolveBucket(href);
        String key = S3Uris.extractKey(href);
        log.info("Reading file in bucket {} at location {}", bucket, key);
        try {
            GetObjectRequest request = GetObjectRequest.builder().bucket(bucket).key(key).build();
            return s3.getObjectAsBytes(request).asString(StandardCharsets.UTF_8);
        } catch (SdkException e) {
            throw new IOException("Unable to read " + href, e);
        }
    }

    @Override
    public void writeText(String href, String text) throws IOException {
        if (!S3Uris.isS3(href)) {
            fallback.writeText(href, text);
            return;
        }
        String bucket = resolveBucket(href);
        String key = S3Uris.extractKey(href);
        log.info("Writing file in bucket {} at location {}", bucket, key);
        try {
            PutObjectRequest request = PutObjectRequest.builder()
                    .bucket(bucket)
                    .key(key)
                    .contentType(GEO_JSON_CONTENT_TYPE)
                    .build();
            s3.putObject(request, RequestBody.fromString(text, StandardCharsets.UTF_8));
        } catch (SdkException e) {
            throw new IOException("Unable to write " + href, e);
        }
    }

    @Override
    public void close() throws IOException {
        s3.close();
        fallback.close();
    }

    private String resolveBucket(String href) throws IOException {
        if (accessPoint != null && !accessPoint.isEmpty()) {
            return accessPoint;
        }
        String bucket = S3Uris.extractBucket(href);
        if (bucket == null) {
            throw new IOException("Not a valid s3 location: " + href);
        }
        return bucket;
    }
}
