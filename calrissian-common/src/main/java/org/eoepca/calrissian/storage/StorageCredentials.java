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

package org.eoepca.calrissian.storage;

import java.util.Objects;

/**
 * The object storage location and credentials an execution stages its outputs to.
 */
public final class StorageCredentials {

    private final String endpoint;
    private final String accessKey;
    private final String secretKey;
    private final String region;
    private final String bucketName;

    public StorageCredentials(String endpoint, String accessKey, String secretKey, String region, String bucketName) {
        this.endpoint = endpoint;
        this.accessKey = accessKey;
        this.secretKey = secretKey;
        this.region = region;
        this.bucketName = bucketName;
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getAccessKey() {
        return accessKey;
    }

    public String getSecretKey() {
        return secretKey;
    }

    public String getRegion() {
        return region;
    }

    public String getBucketName() {
        return bucketName;
    }

    /**
     * True if both an access key and a secret key are present.
     */
    public boolean hasStaticKeys() {
        return accessKey != null && !accessKey.isEmpty() && secretKey != null && !secretKey.isEmpty();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other == null || getClass() != other.getClass()) {
            return false;
        }
        StorageCredentials that = (StorageCredentials) other;
        return Objects.equals(endpoint, that.endpoint)
                && Objects.equals(accessKey, that.accessKey)
                && Objects.equals(secretKey, that.secretKey)
                && Objects.equals(region, that.region)
                && Objects.equals(bucketName, that.bucketName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(endpoint, accessKey, secretKey, region, bucketName);
    }

    // omits the secret key.
    @Override
    public String toString() {
        return "StorageCredentials{endpoint=" + endpoint + ", accessKey=" + accessKey + ", region=" + region
               + ", bucketName=" + bucketName + "}";
    }
}
