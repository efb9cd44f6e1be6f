/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.woozie.cli;

import dev.mars.woozie.config.WoozieConfiguration;
import dev.mars.woozie.core.exceptions.CyclicDependencyException;
import dev.mars.woozie.core.exceptions.MalformedConfigException;
import dev.mars.woozie.workflow.WorkflowParseException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowGenerationServiceTest {

    private static final String WORKFLOW_NS = "uri:oozie:workflow:1.0";

    @TempDir
    Path outputDir;

    private Properties properties;

    @BeforeEach
    void setUp() {
        properties = new Properties();
    }

    @Test
    void testGenerateWorkflow() throws Exception {
        WorkflowGenerationService service = new WorkflowGenerationService(new WoozieConfiguration(properties));

        WorkflowGenerationService.GenerationReport report =
                service.generate(sample("workflow.yaml"), sample("config.yaml"), outputDir);

        assertEquals("nightly-etl", report.getWorkflowName());
        assertEquals(outputDir.resolve("workflow.xml"), report.getWorkflowXml());
        assertEquals(1, report.getForkJoinPairs());
        assertTrue(report.getGraphFiles().isEmpty());

        Document document = parse(report.getWorkflowXml());
        Element root = document.getDocumentElement();
        assertEquals("nightly-etl", root.getAttribute("name"));

        NodeList actions = root.getElementsByTagNameNS(WORKFLOW_NS, "action");
        assertEquals(5, actions.getLength());
        Element publish = (Element) actions.item(3);
        assertEquals("publish", publish.getAttribute("name"));
        Element error = (Element) publish.getElementsByTagNameNS(WORKFLOW_NS, "error").item(0);
        assertEquals("error_handler", error.getAttribute("to"));

        NodeList queue = root.getElementsByTagNameNS("uri:oozie:shell-action:1.0", "value");
        assertEquals("etl", queue.item(0).getTextContent());
        NodeList files = root.getElementsByTagNameNS("uri:oozie:shell-action:1.0", "file");
        assertEquals("scripts/extract_orders.sh", files.item(0).getTextContent());
    }

    @Test
    void testCreatesMissingOutputDirectory() throws Exception {
        Path nested = outputDir.resolve("a").resolve("b");
        WorkflowGenerationService service = new WorkflowGenerationService(new WoozieConfiguration(properties));

        service.generate(sample("workflow.yaml"), sample("config.yaml"), nested);

        assertTrue(Files.exists(nested.resolve("workflow.xml")));
    }

    @Test
    void testGraphExport() throws Exception {
        properties.setProperty(WoozieConfiguration.GRAPH_EXPORT_ENABLED, "true");
        WorkflowGenerationService service = new WorkflowGenerationService(new WoozieConfiguration(properties));

        WorkflowGenerationService.GenerationReport report =
                service.generate(sample("workflow.yaml"), sample("config.yaml"), outputDir);

        assertEquals(2, report.getGraphFiles().size());
        String raw = Files.readString(outputDir.resolve("workflow-definition-dag.dot"));
        String structured = Files.readString(outputDir.resolve("oozie-workflow-dag.dot"));
        assertTrue(raw.contains("\"extract_orders\" -> \"join_tables\";"));
        assertFalse(raw.contains("fork-0"));
        assertTrue(structured.contains("\"fork-0\" [shape=diamond];"));
        assertTrue(structured.contains("\"error_handler\" -> \"end\";"));
    }

    @Test
    void testCustomOutputFileName() throws Exception {
        properties.setProperty(WoozieConfiguration.OUTPUT_FILE, "app.xml");
        WorkflowGenerationService service = new WorkflowGenerationService(new WoozieConfiguration(properties));

        WorkflowGenerationService.GenerationReport report =
                service.generate(sample("workflow.yaml"), sample("config.yaml"), outputDir);

        assertEquals(outputDir.resolve("app.xml"), report.getWorkflowXml());
        assertFalse(Files.exists(outputDir.resolve("workflow.xml")));
    }

    @Test
    void testCyclicWorkflowWritesNothing() throws Exception {
        WorkflowGenerationService service = new WorkflowGenerationService(new WoozieConfiguration(properties));

        assertThrows(CyclicDependencyException.class,
                () -> service.generate(sample("cyclic.yaml"), sample("config.yaml"), outputDir));
        assertFalse(Files.exists(outputDir.resolve("workflow.xml")));
    }

    @Test
    void testGraphWriteFailureDoesNotHideCompileFailure() throws Exception {
        Path workflow = outputDir.resolve("single.yaml");
        Files.writeString(workflow, "name: single\nactions:\n  a:\n    type: shell\n");
        Path config = outputDir.resolve("bad-payload.yaml");
        Files.writeString(config, """
                action_types:
                  shell:
                    shell:
                      xmlns: "uri:oozie:shell-action:1.0"
                    configuration: not-a-map
                """);
        properties.setProperty(WoozieConfiguration.GRAPH_EXPORT_ENABLED, "true");
        properties.setProperty(WoozieConfiguration.GRAPH_RAW_FILE, "absent-dir/raw.dot");
        WorkflowGenerationService service = new WorkflowGenerationService(new WoozieConfiguration(properties));

        MalformedConfigException e = assertThrows(MalformedConfigException.class,
                () -> service.generate(workflow, config, outputDir));

        assertEquals(1, e.getSuppressed().length);
        assertInstanceOf(IOException.class, e.getSuppressed()[0]);
        assertFalse(Files.exists(outputDir.resolve("workflow.xml")));
    }

    @Test
    void testMalformedConfiguration() throws Exception {
        Path config = outputDir.resolve("broken.yaml");
        Files.writeString(config, "action_types: nope\n");
        WorkflowGenerationService service = new WorkflowGenerationService(new WoozieConfiguration(properties));

        WorkflowParseException e = assertThrows(WorkflowParseException.class,
                () -> service.generate(sample("workflow.yaml"), config, outputDir));
        assertEquals(config.toString(), e.getSource());
    }

    static Path sample(String name) throws URISyntaxException {
        return Path.of(WorkflowGenerationServiceTest.class.getResource("/sample/" + name).toURI());
    }

    private static Document parse(Path file) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(file.toFile());
    }
}
