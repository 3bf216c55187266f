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

import java.util.List;
import java.util.Map;

/**
 * An interface marking a class as the execution handler of a workflow run (i.e. the code that is run before and after
 * the workflow engine executes the CWL document).
 *
 * The workflow engine (see WorkflowRunner) drives an execution in this order:
 * - preExecutionHook() runs before any pod is scheduled. It is the place to resolve credentials and to fill in
 *   the additional parameters that the stage-in and stage-out steps will see.
 * - getPodEnvVars(), getPodNodeSelector(), getSecrets() and getAdditionalParameters() are queried while the
 *   engine prepares the pods.
 * - postExecutionHook() runs after the workflow finished successfully, with the workflow's declared outputs.
 * - handleOutputs() runs last and may publish links to the execution's logs.
 *
 * Hooks are invoked sequentially on the engine's thread. Exceptions thrown by a hook abort the execution.
 */
public interface ExecutionHandler {

    void preExecutionHook();

    /**
     * @param logFile     The path of the application log file of the execution.
     * @param output      The workflow's declared outputs, keyed by output name.
     * @param usageReport The engine's resource usage report.
     * @param toolLogs    Paths to the individual workflow step logs.
     */
    void postExecutionHook(String logFile, Map<String, Object> output, Map<String, Object> usageReport,
                           List<String> toolLogs);

    Map<String, String> getPodEnvVars();

    Map<String, String> getPodNodeSelector();

    Map<String, Object> getSecrets();

    Map<String, String> getAdditionalParameters();

    /**
     * Handles the output files of the execution. Takes the same arguments as postExecutionHook().
     */
    void handleOutputs(String logFile, Map<String, Object> output, Map<String, Object> usageReport,
                       List<String> toolLogs);
}
