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

package org.eoepca.calrissian;

import java.util.Map;

/**
 * Creates the WorkflowRunner for a single WPS execution.
 */
@FunctionalInterface
public interface WorkflowRunnerFactory {

    /**
     * @param cwl     The parsed CWL document.
     * @param conf    The host's configuration mapping, shared with the handler.
     * @param inputs  The execution inputs, keyed by input name.
     * @param outputs The execution output slots, keyed by output name.
     * @param handler The handler whose hooks the runner must invoke.
     */
    WorkflowRunner create(Map<String, Object> cwl, Map<String, Map<String, String>> conf,
                          Map<String, Map<String, String>> inputs, Map<String, Map<String, String>> outputs,
                          ExecutionHandler handler);
}
