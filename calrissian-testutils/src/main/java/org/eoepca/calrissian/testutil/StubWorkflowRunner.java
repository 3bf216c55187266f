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

package org.eoepca.calrissian.testutil;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eoepca.calrissian.ExecutionHandler;
import org.eoepca.calrissian.ServiceRuntime;
import org.eoepca.calrissian.WorkflowRunner;

/**
 * A stub WorkflowRunner intended to be used by unit tests.
 *
 * It drives the handler's hooks in the same order as the real engine, but instead of running a workflow it
 * hands the handler a fixed set of outputs.
 */
public class StubWorkflowRunner implements WorkflowRunner {

    public static final String DEFAULT_NAMESPACE = "calrissian-stub";
    public static final String LOG_FILE_NAME = "calrissian.log";

    private final ExecutionHandler handler;
    private final Map<String, Object> executionOutput;

    private String namespaceName = DEFAULT_NAMESPACE;
    private Path workingDirectory;
    private boolean workflowSucceeds = true;
    private List<String> toolLogs = new ArrayList<>();
    private boolean executed = false;
    private Map<String, String> additionalParametersSeen = Collections.emptyMap();

    public StubWorkflowRunner(ExecutionHandler handler, Map<String, Object> executionOutput) {
        this.handler = handler;
        this.executionOutput = new HashMap<>(executionOutput);
    }

    @Override
    public String getNamespaceName() {
        return namespaceName;
    }

    @Override
    public void setNamespaceName(String namespaceName) {
        this.namespaceName = namespaceName;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    @Override
    public void setWorkingDirectory(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    /**
     * If false, execute() reports a failed workflow after running the pre-execution hook.
     */
    public void setWorkflowSucceeds(boolean workflowSucceeds) {
        this.workflowSucceeds = workflowSucceeds;
    }

    public void setToolLogs(List<String> toolLogs) {
        this.toolLogs = new ArrayList<>(toolLogs);
    }

    public boolean wasExecuted() {
        return executed;
    }

    /**
     * The additional parameters the handler provided after its pre-execution hook ran.
     */
    public Map<String, String> getAdditionalParametersSeen() {
        return additionalParametersSeen;
    }

    @Override
    public int execute() {
        executed = true;
        handler.preExecutionHook();
        additionalParametersSeen = handler.getAdditionalParameters();

        if (!workflowSucceeds) {
            return ServiceRuntime.SERVICE_FAILED;
        }

        String logFile = workingDirectory == null ? LOG_FILE_NAME : workingDirectory.resolve(LOG_FILE_NAME).toString();
        Map<String, Object> usageReport = new HashMap<>();
        handler.postExecutionHook(logFile, executionOutput, usageReport, toolLogs);
        handler.handleOutputs(logFile, executionOutput, usageReport, toolLogs);
        return ServiceRuntime.SERVICE_SUCCEEDED;
    }
}
