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

package dev.mars.woozie.emit;

import dev.mars.woozie.core.Action;
import dev.mars.woozie.core.Workflow;
import dev.mars.woozie.graph.WorkflowGraphBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import javax.xml.parsers.DocumentBuilderFactory;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowXmlWriterTest {

    private Document document;

    @BeforeEach
    void setUp() throws Exception {
        Map<String, Object> config = new LinkedHashMap<>();
        config.put("shell", Map.of("xmlns", "uri:oozie:shell-action:1.0"));
        config.put("exec", "run.sh");
        Workflow workflow = new Workflow("written", List.of(new Action("a", "shell", List.of(), config)));
        document = new TopologicalEmitter().emit(new WorkflowGraphBuilder().build(workflow));
    }

    @Test
    void testXmlDeclarationAndIndentation() throws Exception {
        String xml = new WorkflowXmlWriter(4).toXml(document);

        assertTrue(xml.startsWith("<?xml"));
        assertTrue(xml.contains("UTF-8"));
        assertTrue(xml.contains("\n    <start"));
    }

    @Test
    void testUnindentedOutput() throws Exception {
        String xml = new WorkflowXmlWriter(0).toXml(document);

        assertTrue(xml.contains("<start to=\"a\"/><action"));
    }

    @Test
    void testOutputParsesBackWithNamespaces() throws Exception {
        String xml = new WorkflowXmlWriter().toXml(document);
        Element root = parse(xml.getBytes(StandardCharsets.UTF_8)).getDocumentElement();

        assertEquals("workflow-app", root.getLocalName());
        assertEquals("uri:oozie:workflow:1.0", root.getNamespaceURI());
        Element shell = (Element) root.getElementsByTagNameNS("uri:oozie:shell-action:1.0", "shell").item(0);
        assertNotNull(shell);
        assertEquals("run.sh", shell.getElementsByTagNameNS("uri:oozie:shell-action:1.0", "exec")
                .item(0).getTextContent());
    }

    @Test
    void testWriteToFile(@TempDir Path tempDir) throws Exception {
        Path target = tempDir.resolve("workflow.xml");
        new WorkflowXmlWriter().write(document, target);

        assertTrue(Files.exists(target));
        Element root = parse(Files.readAllBytes(target)).getDocumentElement();
        assertEquals("written", root.getAttribute("name"));
    }

    private static Document parse(byte[] xml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(new ByteArrayInputStream(xml));
    }
}
