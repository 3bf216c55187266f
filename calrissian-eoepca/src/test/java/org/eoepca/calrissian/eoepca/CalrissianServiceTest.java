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
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.easymock.EasyMock;
import org.easymock.IMocksControl;
import org.eoepca.calrissian.ServiceRuntime;
import org.eoepca.calrissian.conf.ServiceConf;
import org.eoepca.calrissian.env.EnvironmentVariables;
import org.eoepca.calrissian.testutil.InMemoryStacIo;
import org.eoepca.calrissian.testutil.StubWorkflowRunner;
import org.eoepca.calrissian.testutil.StubWorkflowRunnerFactory;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class CalrissianServiceTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final String CATALOG_URI = "s3://eoepca/processing-results/run-1/catalog.json";

    private static final String APP_PACKAGE = "cwlVersion: v1.0\n"
                                              + "$graph:\n"
                                              + "  - class: Workflow\n"
                                              + "    id: water-bodies\n"
                                              + "    inputs: {}\n"
                                              + "    outputs: []\n"
                                              + "    steps: {}\n";

    @TempDir
    public Path serviceDirectory;

    @TempDir
    public Path tmpPath;

    private Map<String, Map<String, String>> conf;
    private Map<String, Map<String, String>> inputs;
    private Map<String, Map<String, String>> outputs;
    private InMemoryStacIo stacIo;
    private StubWorkflowRunnerFactory runnerFactory;
    private IMocksControl mockery;
    private ServiceRuntime runtime;
    private CalrissianService service;

    @BeforeEach
    public void setup() throws IOException {
        Files.writeString(serviceDirectory.resolve(CalrissianService.CWL_FILE_NAME), APP_PACKAGE);

        conf = new HashMap<>();
        Map<String, String> main = new HashMap<>();
        main.put("tmpUrl", "https://zoo.develop.eoepca.org/temp");
        main.put("tmpPath", tmpPath.toString());
        conf.put(ServiceConf.MAIN, main);
        Map<String, String> lenv = new HashMap<>();
        lenv.put("usid", "run-1");
        lenv.put("Identifier", "water-bodies");
        conf.put(ServiceConf.LENV, lenv);

        inputs = new HashMap<>();
        Map<String, String> workspace = new HashMap<>();
        workspace.put("value", "alice");
        inputs.put("workspace", workspace);

        outputs = new LinkedHashMap<>();
        outputs.put("stac_catalog", new HashMap<>());
        outputs.put("other", new HashMap<>());

        stacIo = new InMemoryStacIo();
        stacIo.put(CATALOG_URI, "{\"type\": \"Catalog\", \"id\": \"catalog\", \"links\": ["
                                + "{\"rel\": \"child\", \"href\": \"./c/collection.json\"}]}");
        stacIo.put("s3://eoepca/processing-results/run-1/c/collection.json",
                   "{\"type\": \"Collection\", \"id\": \"c\", \"links\": []}");

        Map<String, Object> executionOutput = new HashMap<>();
        executionOutput.put("StacCatalogUri", CATALOG_URI);
        runnerFactory = new StubWorkflowRunnerFactory(executionOutput);
        runnerFactory.setToolLogs(List.of("/calrissian/node-crop.log"));

        mockery = EasyMock.createControl();
        runtime = mockery.createMock(ServiceRuntime.class);

        service = new CalrissianService(serviceDirectory, runnerFactory, runtime,
                (c, i) -> new EoepcaExecutionHandler(c, i, new EnvironmentVariables(),
                                                     () -> workspaceName -> Optional.empty(),
                                                     stacIo.asFactory(), tmpPath.resolve("no-secrets.yaml")));
    }

    @Test
    public void disallowMissingServiceDirectory() {
        Assertions.assertThrows(IllegalArgumentException.class,
                                () -> new CalrissianService(null, runnerFactory, runtime));
    }

    @Test
    public void successfulRunFillsFirstOutput() throws IOException {
        mockery.replay();

        int status = service.execute(conf, inputs, outputs);

        Assertions.assertEquals(ServiceRuntime.SERVICE_SUCCEEDED, status);
        JsonNode collection = MAPPER.readTree(outputs.get("stac_catalog").get("value"));
        Assertions.assertEquals("run-1", collection.get("id").asText());
        Assertions.assertNull(outputs.get("other").get("value"));

        StubWorkflowRunner runner = runnerFactory.getLastRunner();
        Assertions.assertTrue(runner.wasExecuted());
        Assertions.assertEquals("ws-alice", runner.getNamespaceName());
        Assertions.assertEquals(tmpPath.resolve(StubWorkflowRunner.DEFAULT_NAMESPACE), runner.getWorkingDirectory());
        Assertions.assertTrue(Files.isDirectory(runner.getWorkingDirectory()));
        Assertions.assertEquals("processing-results", runner.getAdditionalParametersSeen().get("process"));
        Assertions.assertEquals("v1.0", runnerFactory.getLastCwl().get("cwlVersion"));

        Assertions.assertEquals("1", conf.get(ServiceConf.SERVICE_LOGS).get("length"));
        mockery.verify();
    }

    @Test
    public void failedRunSetsTranslatedMessage() {
        runnerFactory.setWorkflowSucceeds(false);
        EasyMock.expect(runtime.translate("Execution failed")).andReturn("Echec de l'execution");
        mockery.replay();

        int status = service.execute(conf, inputs, outputs);

        Assertions.assertEquals(ServiceRuntime.SERVICE_FAILED, status);
        Assertions.assertEquals("Echec de l'execution", conf.get(ServiceConf.LENV).get("message"));
        Assertions.assertNull(outputs.get("stac_catalog").get("value"));
        mockery.verify();
    }

    @Test
    public void missingApplicationPackageFailsWithStackTrace() throws IOException {
        Files.delete(serviceDirectory.resolve(CalrissianService.CWL_FILE_NAME));
        EasyMock.expect(runtime.translate(EasyMock.startsWith("Exception during execution...\n")))
                .andAnswer(() -> (String)EasyMock.getCurrentArguments()[0]);
        mockery.replay();

        int status = service.execute(conf, inputs, outputs);

        Assertions.assertEquals(ServiceRuntime.SERVICE_FAILED, status);
        String message = conf.get(ServiceConf.LENV).get("message");
        Assertions.assertTrue(message.contains(CalrissianService.CWL_FILE_NAME));
        Assertions.assertTrue(message.endsWith("\n"));
        Assertions.assertNull(runnerFactory.getLastRunner());
        mockery.verify();
    }

    @Test
    public void hookFailureFailsTheService() {
        conf.get(ServiceConf.LENV).remove("Identifier");
        EasyMock.expect(runtime.translate(EasyMock.startsWith("Exception during execution...\n"))).andReturn("failed");
        mockery.replay();

        int status = service.execute(conf, inputs, outputs);

        Assertions.assertEquals(ServiceRuntime.SERVICE_FAILED, status);
        Assertions.assertEquals("failed", conf.get(ServiceConf.LENV).get("message"));
        mockery.verify();
    }

    @Test
    public void defaultRuntimeLeavesMessagesUntranslated() {
        runnerFactory.setWorkflowSucceeds(false);
        CalrissianService untranslated = new CalrissianService(serviceDirectory, runnerFactory, null,
                (c, i) -> new EoepcaExecutionHandler(c, i, new EnvironmentVariables(),
                                                     () -> workspaceName -> Optional.empty(),
                                                     stacIo.asFactory(), tmpPath.resolve("no-secrets.yaml")));

        Assertions.assertEquals(ServiceRuntime.SERVICE_FAILED, untranslated.execute(conf, inputs, outputs));
        Assertions.assertEquals("Execution failed", conf.get(ServiceConf.LENV).get("message"));
    }
}
