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

import org.w3c.dom.Document;

import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;
import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes workflow documents as UTF-8 XML with a declaration, indented when an
 * indent greater than zero is configured.
 */
public class WorkflowXmlWriter {

    private final int indent;

    public WorkflowXmlWriter() {
        this(2);
    }

    public WorkflowXmlWriter(int indent) {
        this.indent = Math.max(0, indent);
    }

    public String toXml(Document document) throws IOException {
        StringWriter writer = new StringWriter();
        transform(document, new StreamResult(writer));
        return writer.toString();
    }

    public void write(Document document, Path target) throws IOException {
        try (OutputStream out = Files.newOutputStream(target)) {
            transform(document, new StreamResult(out));
        }
    }

    private void transform(Document document, StreamResult result) throws IOException {
        try {
            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
            transformer.setOutputProperty(OutputKeys.METHOD, "xml");
            if (indent > 0) {
                transformer.setOutputProperty(OutputKeys.INDENT, "yes");
                transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", String.valueOf(indent));
            }
            transformer.transform(new DOMSource(document), result);
        } catch (TransformerException e) {
            throw new IOException("Failed to serialize workflow document", e);
        }
    }
}
