package com.x4.projector.definition;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import com.x4.projector.definition.exception.MalformedDefinitionException;

/**
 * DOM helpers shared by the game document parsers.
 */
public final class XmlDocuments {

    private XmlDocuments() {
        // Utility class
    }

    /**
     * Parses a game XML document, rejecting DTDs and external entities.
     *
     * @throws MalformedDefinitionException if the bytes are not well-formed XML
     */
    public static Document parse(byte[] bytes, String sourcePath) {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setNamespaceAware(false);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);

            DocumentBuilder builder = factory.newDocumentBuilder();
            builder.setErrorHandler(new RethrowingErrorHandler());
            return builder.parse(new ByteArrayInputStream(bytes));
        } catch (SAXParseException e) {
            throw new MalformedDefinitionException(sourcePath,
                    "line " + e.getLineNumber() + " column " + e.getColumnNumber() + ": " + e.getMessage(), e);
        } catch (SAXException | IOException e) {
            throw new MalformedDefinitionException(sourcePath, e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser cannot be configured", e);
        }
    }

    /**
     * Direct element children of {@code parent} with the given tag name, in document order.
     */
    public static List<Element> children(Element parent, String tagName) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element element && (tagName == null || tagName.equals(element.getTagName()))) {
                result.add(element);
            }
        }
        return result;
    }

    /**
     * All direct element children of {@code parent}.
     */
    public static List<Element> children(Element parent) {
        return children(parent, null);
    }

    /**
     * Attribute value, or null when the attribute is absent.
     */
    public static String attribute(Element element, String name) {
        return element.hasAttribute(name) ? element.getAttribute(name) : null;
    }

    private static final class RethrowingErrorHandler implements ErrorHandler {

        @Override
        public void warning(SAXParseException exception) {
            // warnings do not make a document unusable
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    }
}
