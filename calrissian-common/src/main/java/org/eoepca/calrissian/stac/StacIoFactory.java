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

import org.eoepca.calrissian.storage.StorageCredentials;

/**
 * Creates the StacIo an execution reads its outputs with, from explicitly resolved storage settings.
 */
@FunctionalInterface
public interface StacIoFactory {

    /**
     * @param credentials The active stage-out credentials.
     * @param accessPoint The bucket to read from regardless of the bucket named in an href; may be null.
     */
    StacIo create(StorageCredentials credentials, String accessPoint);
}
