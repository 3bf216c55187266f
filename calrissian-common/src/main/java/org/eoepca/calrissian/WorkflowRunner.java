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

import java.nio.file.Path;

/**
 * The workflow engine that executes a CWL document on the cluster and calls back into an ExecutionHandler.
 *
 * Implementations are provided by the engine integration; Calrissian Hooks only decides which namespace and
 * working directory the engine uses.
 */
public interface WorkflowRunner {

    /**
     * The cluster namespace the engine will run the workflow pods in.
     */
    String getNamespaceName();

    void setNamespaceName(String namespaceName);

    /**
     * The local directory the engine stores the execution's outputs and logs in.
     */
    void setWorkingDirectory(Path workingDirectory);

    /**
     * Runs the workflow to completion, invoking the handler's hooks along the way.
     *
     * @return ServiceRuntime.SERVICE_SUCCEEDED or ServiceRuntime.SERVICE_FAILED.
     */
    int execute();
}
