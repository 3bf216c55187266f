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

package org.eoepca.calrissian.eoepca;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Map;
import java.util.function.BiFunction;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.eoepca.calrissian.NoopServiceRuntime;
import org.eoepca.calrissian.ServiceRuntime;
import org.eoepca.calrissian.WorkflowRunner;
import org.eoepca.calrissian.WorkflowRunnerFactory;
import org.eoepca.calrissian.conf.ServiceConf;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The WPS service entry point: runs the service's application package through the workflow engine with the
 * EOEPCA execution hooks, and reports the consolidated collection as the service output.
 */
public class CalrissianService {

    private static final Logger log = LoggerFactory.getLogger(CalrissianService.class);

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<Map<String, Object>>() {};

    public static final String CWL_FILE_NAME = "app-package.cwl";

    static final String NAMESPACE_PREFIX = "ws-";
    static final String WORKING_DIRECTORY_PERMISSIONS = "rwxrwxrwx";

    private final Path cwlFile;
    private final WorkflowRunnerFactory runnerFactory;
    private final ServiceRuntime runtime;
    private final BiFunction<Map<String, Map<String, String>>, Map<String, Map<String, String>>,
                             EoepcaExecutionHandler> handlerFactory;

    public CalrissianService(Path serviceDirectory, WorkflowRunnerFactory runnerFactory, ServiceRuntime runtime) {
        this(serviceDirectory, runnerFactory, runtime, EoepcaExecutionHandler::new);
    }

    // package-private for test visibility
    CalrissianService(Path serviceDirectory, WorkflowRunnerFactory runnerFactory, ServiceRuntime runtime,
                      BiFunction<Map<String, Map<String, String>>, Map<String, Map<String, String>>,
                                 EoepcaExecutionHandler> handlerFactory) {
        if (serviceDirectory == null) {
            throw new IllegalArgumentException("The service directory must be specified.");
        }
        if (runnerFactory == null) {
            throw new IllegalArgumentException("A workflow runner factory must be specified.");
        }
        this.cwlFile = serviceDirectory.resolve(CWL_FILE_NAME);
        this.runnerFactory = runnerFactory;
        this.runtime = (runtime == null ? new NoopServiceRuntime() : runtime);
        this.handlerFactory = handlerFactory;
    }

    /**
     * Runs the service. Returns ServiceRuntime.SERVICE_SUCCEEDED or ServiceRuntime.SERVICE_FAILED; on failure the
     * reason is left in lenv.message.
     */
    public int execute(Map<String, Map<String, String>> conf, Map<String, Map<String, String>> inputs,
                       Map<String, Map<String, String>> outputs) {
        ServiceConf serviceConf = new ServiceConf(conf);
        try {
            Map<String, Object> cwl = loadCwl();

            EoepcaExecutionHandler handler = handlerFactory.apply(conf, inputs);
            WorkflowRunner runner = runnerFactory.create(cwl, conf, inputs, outputs, handler);

            Path workingDirectory = Paths.get(serviceConf.getTmpPath(), runner.getNamespaceName());
            createWorkingDirectory(workingDirectory);
            runner.setWorkingDirectory(workingDirectory);
            runner.setNamespaceName(NAMESPACE_PREFIX + handler.getWorkspaceName());

            int exitStatus = runner.execute();
            if (exitStatus == ServiceRuntime.SERVICE_SUCCEEDED) {
                String outputName = getFirstOutputName(outputs);
                log.info("Setting Collection into output key {}", outputName);
                outputs.get(outputName).put("value", handler.getFeatureCollection());
                return ServiceRuntime.SERVICE_SUCCEEDED;
            }

            serviceConf.setStatusMessage(runtime.translate("Execution failed"));
            return ServiceRuntime.SERVICE_FAILED;
        } catch (IOException | RuntimeException e) {
            log.error("ERROR in processing execution template...", e);
            StringWriter stackTrace = new StringWriter();
            e.printStackTrace(new PrintWriter(stackTrace));
            serviceConf.setStatusMessage(runtime.translate("Exception during execution...\n" + stackTrace + "\n"));
            return ServiceRuntime.SERVICE_FAILED;
        }
    }

    private Map<String, Object> loadCwl() throws IOException {
        Map<String, Object> cwl = YAML.readValue(cwlFile.toFile(), MAP_TYPE);
        if (cwl == null) {
            throw new IOException("The application package " + cwlFile + " is empty.");
        }
        return cwl;
    }

    private static void createWorkingDirectory(Path directory) throws IOException {
        Files.createDirectories(directory);
        try {
            Files.setPosixFilePermissions(directory, PosixFilePermissions.fromString(WORKING_DIRECTORY_PERMISSIONS));
        } catch (UnsupportedOperationException e) {
            log.debug("Unable to set permissions on {}, the file system is not POSIX", directory);
        }
    }

    private static String getFirstOutputName(Map<String, Map<String, String>> outputs) {
        if (outputs.isEmpty()) {
            throw new IllegalStateException("The service declares no outputs.");
        }
        return outputs.keySet().iterator().next();
    }
}
