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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eoepca.calrissian.ExecutionHandler;
import org.eoepca.calrissian.WorkflowRunner;
import org.eoepca.calrissian.WorkflowRunnerFactory;

/**
 * A WorkflowRunnerFactory producing StubWorkflowRunners, which remembers what it was asked to run.
 */
public class StubWorkflowRunnerFactory implements WorkflowRunnerFactory {

    private final Map<String, Object> executionOutput;

    private boolean workflowSucceeds = true;
    private List<String> toolLogs = new ArrayList<>();

    private StubWorkflowRunner lastRunner;
    private Map<String, Object> lastCwl;

    public StubWorkflowRunnerFactory(Map<String, Object> executionOutput) {
        this.executionOutput = new HashMap<>(executionOutput);
    }

    public void setWorkflowSucceeds(boolean workflowSucceeds) {
        this.workflowSucceeds = workflowSucceeds;
    }

    public void setToolLogs(List<String> toolLogs) {
        this.toolLogs = new ArrayList<>(toolLogs);
    }

    public StubWorkflowRunner getLastRunner() {
        return lastRunner;
    }

    public Map<String, Object> getLastCwl() {
        return lastCwl;
    }

    @Override
    public WorkflowRunner create(Map<String, Object> cwl, Map<String, Map<String, String>> conf,
                                 Map<String, Map<String, String>> inputs, Map<String, Map<String, String>> outputs,
                                 ExecutionHandler handler) {
        StubWorkflowRunner runner = new StubWorkflowRunner(handler, executionOutput);
        runner.setWorkflowSucceeds(workflowSucceeds);
        runner.setToolLogs(toolLogs);
        lastRunner = runner;
        lastCwl = cwl;
        return runner;
    }
}
