package com.panorama.converter.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.parser.exception.ParseException;

/**
 * Loads a Panorama XML export into an immutable {@link ConfigNode} tree.
 *
 * Loading only:
 * - Parses the XML with the JDK DOM parser
 * - Converts elements, attributes and text into ConfigNodes
 *
 * It does NOT interpret scopes or objects; that belongs to the resolvers.
 */
public class ConfigTreeLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigTreeLoader.class);

    public ConfigNode load(Path path) {
        String source = path.toString();
        log.info("Loading configuration document: {}", source);
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, source);
        } catch (IOException e) {
            throw new ParseException(source, "cannot read file (" + e.getMessage() + ")", e);
        }
    }

    public ConfigNode load(InputStream in, String source) {
        Document doc;
        try {
            DocumentBuilder builder = newDocumentBuilder();
            builder.setErrorHandler(new FailingErrorHandler(source));
            doc = builder.parse(in, source);
        } catch (SAXParseException e) {
            throw new ParseException(source, e.getLineNumber(), e.getColumnNumber(), e.getMessage(), e);
        } catch (SAXException e) {
            throw new ParseException(source, e.getMessage(), e);
        } catch (IOException e) {
            throw new ParseException(source, "cannot read input (" + e.getMessage() + ")", e);
        } catch (ParserConfigurationException e) {
            throw new ParseException(source, "XML parser unavailable (" + e.getMessage() + ")", e);
        }

        ConfigNode root = convert(doc.getDocumentElement());
        log.info("Loaded {} nodes from {} (root <{}>)", root.size(), source, root.getTag());
        return root;
    }

    private DocumentBuilder newDocumentBuilder() throws ParserConfigurationException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
        factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
        factory.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        return factory.newDocumentBuilder();
    }

    private ConfigNode convert(Element element) {
        ConfigNode.ConfigNodeBuilder builder = ConfigNode.builder().tag(element.getTagName());

        NamedNodeMap attrs = element.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node attr = attrs.item(i);
            builder.attribute(attr.getNodeName(), attr.getNodeValue());
        }

        StringBuilder text = new StringBuilder();
        NodeList nodes = element.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node n = nodes.item(i);
            switch (n.getNodeType()) {
                case Node.ELEMENT_NODE -> builder.child(convert((Element) n));
                case Node.TEXT_NODE, Node.CDATA_SECTION_NODE -> text.append(n.getNodeValue());
                default -> {
                    // comments and processing instructions carry no configuration
                }
            }
        }

        String trimmed = text.toString().trim();
        if (!trimmed.isEmpty()) {
            builder.text(trimmed);
        }
        return builder.build();
    }

    private static final class FailingErrorHandler implements ErrorHandler {
        private final String source;

        private FailingErrorHandler(String source) {
            this.source = source;
        }

        @Override
        public void warning(SAXParseException e) {
            log.warn("XML warning in {} at line {}: {}", source, e.getLineNumber(), e.getMessage());
        }

        @Override
        public void error(SAXParseException e) throws SAXException {
            throw e;
        }

        @Override
        public void fatalError(SAXParseException e) throws SAXException {
            throw e;
        }
    }
}
