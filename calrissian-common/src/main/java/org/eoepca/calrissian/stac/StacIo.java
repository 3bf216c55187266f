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

import java.io.Closeable;
import java.io.IOException;

/**
 * Reads and writes the text of STAC documents at a location.
 *
 * Implementations holding connections release them on close().
 */
public interface StacIo extends Closeable {

    /**
     * Returns the content of the document at the given href.
     *
     * @throws IOException if the document cannot be read for any reason.
     */
    String readText(String href) throws IOException;

    void writeText(String href, String text) throws IOException;

    @Override
    default void close() throws IOException {
    }
}
