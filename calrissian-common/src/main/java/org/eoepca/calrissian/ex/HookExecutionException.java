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

package org.eoepca.calrissian.ex;

/**
 * Thrown when an execution hook cannot complete. Usually wraps the checked exception that caused it.
 */
public class HookExecutionException extends RuntimeException {

    public HookExecutionException(String message) {
        super(message);
    }

    public HookExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
