package com.panorama.converter.writer;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.Map;

import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.transform.OutputKeys;
import javax.xml.transform.Transformer;
import javax.xml.transform.TransformerException;
import javax.xml.transform.TransformerFactory;
import javax.xml.transform.dom.DOMSource;
import javax.xml.transform.stream.StreamResult;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import com.panorama.converter.model.ConfigNode;

/**
 * Serializes a {@link ConfigNode} tree as an XML document: XML declaration,
 * UTF-8, two-space indentation.
 */
public class ConfigTreeWriter {

    public String toXml(ConfigNode root) throws IOException {
        try {
            Document doc = DocumentBuilderFactory.newInstance().newDocumentBuilder().newDocument();
            doc.setXmlStandalone(true);
            doc.appendChild(toElement(doc, root));

            Transformer transformer = TransformerFactory.newInstance().newTransformer();
            transformer.setOutputProperty(OutputKeys.ENCODING, "UTF-8");
            transformer.setOutputProperty(OutputKeys.OMIT_XML_DECLARATION, "no");
            transformer.setOutputProperty(OutputKeys.INDENT, "yes");
            transformer.setOutputProperty("{http://xml.apache.org/xslt}indent-amount", "2");

            StringWriter out = new StringWriter();
            transformer.transform(new DOMSource(doc), new StreamResult(out));
            return out.toString();
        } catch (ParserConfigurationException | TransformerException e) {
            throw new IOException("Failed to serialize <" + root.getTag() + ">: " + e.getMessage(), e);
        }
    }

    public void write(ConfigNode root, Path file) throws IOException {
        FileWriteUtil.safeWriteString(file, toXml(root));
    }

    private static Element toElement(Document doc, ConfigNode node) {
        Element element = doc.createElement(node.getTag());
        for (Map.Entry<String, String> attr : node.getAttributes().entrySet()) {
            element.setAttribute(attr.getKey(), attr.getValue());
        }
        if (node.getText() != null) {
            element.appendChild(doc.createTextNode(node.getText()));
        }
        for (ConfigNode child : node.getChildren()) {
            element.appendChild(toElement(doc, child));
        }
        return element;
    }
}
