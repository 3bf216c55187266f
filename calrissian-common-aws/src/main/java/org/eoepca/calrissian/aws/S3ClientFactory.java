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

import org.eoepca.calrissian.storage.StorageCredentials;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.regions.providers.DefaultAwsRegionProviderChain;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.S3ClientBuilder;
import software.amazon.awssdk.services.s3.S3Configuration;

/**
 * Helper providing a factory method for building the S3Client used to read and write execution outputs.
 */
public final class S3ClientFactory {

    private static final Logger log = LoggerFactory.getLogger(S3ClientFactory.class);

    // S3-compatible stores ignore the region, but the SDK requires one.
    static final Region DEFAULT_REGION = Region.US_EAST_1;

    private S3ClientFactory() {}

    /**
     * Creates an S3Client with path-style addressing (requests are signed with SigV4, the SDK default).
     *
     * Two pathways are supported:
     * - If the credentials carry both an access key and a secret key, they are used together with the credentials'
     *   region and endpoint.
     * - Otherwise the SDK's default provider chain supplies credentials (e.g. from the pod's service account).
     *   The region is the credentials' region if set, then whatever the default region provider chain finds,
     *   then DEFAULT_REGION.
     */
    public static S3Client create(StorageCredentials credentials) {
        S3ClientBuilder builder = S3Client.builder()
                .serviceConfiguration(S3Configuration.builder().pathStyleAccessEnabled(true).build());

        if (credentials.hasStaticKeys()) {
            log.debug("Creating s3 client for endpoint {} using static credentials.", credentials.getEndpoint());
            builder.credentialsProvider(StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(credentials.getAccessKey(), credentials.getSecretKey())));
            builder.region(resolveRegion(credentials.getRegion()));
            if (credentials.getEndpoint() != null && !credentials.getEndpoint().isEmpty()) {
                builder.endpointOverride(URI.create(credentials.getEndpoint()));
            }
        } else {
            log.debug("Creating s3 client using the default credentials provider chain.");
            builder.credentialsProvider(DefaultCredentialsProvider.create());
            builder.region(resolveDefaultChainRegion(credentials.getRegion()));
        }
        return builder.build();
    }

    // package-private for test visibility
    static Region resolveRegion(String region) {
        if (region == null || region.isEmpty()) {
            return DEFAULT_REGION;
        }
        return Region.of(region);
    }

    // package-private for test visibility
    static Region resolveDefaultChainRegion(String region) {
        if (region != null && !region.isEmpty()) {
            return Region.of(region);
        }
        try {
            return new DefaultAwsRegionProviderChain().getRegion();
        } catch (SdkClientException e) {
            log.debug("No region found by the default region provider chain, using {}.", DEFAULT_REGION.id(), e);
            return DEFAULT_REGION;
        }
    }
}
