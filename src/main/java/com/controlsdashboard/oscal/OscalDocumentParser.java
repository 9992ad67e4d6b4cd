package com.controlsdashboard.oscal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.w3c.dom.Document;
import org.xml.sax.SAXException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

@Component
public class OscalDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(OscalDocumentParser.class);

    private final DocumentBuilderFactory factory;

    public OscalDocumentParser() {
        factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setIgnoringComments(true);
        factory.setCoalescing(true);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    /**
     * Parses a whole document into memory.
     *
     * @param content    raw document bytes
     * @param sourceName used in log and error messages only
     * @throws CatalogParseException when the bytes are not well-formed XML
     */
    public Document parse(byte[] content, String sourceName) {
        if (content == null || content.length == 0) {
            throw new CatalogParseException("Document " + sourceName + " is empty");
        }
        return parse(new ByteArrayInputStream(content), sourceName);
    }

    public Document parse(String content, String sourceName) {
        return parse(content == null ? null : content.getBytes(StandardCharsets.UTF_8), sourceName);
    }

    public Document parse(InputStream in, String sourceName) {
        try {
            // DocumentBuilder is not thread-safe; one per parse
            DocumentBuilder builder;
            synchronized (factory) {
                builder = factory.newDocumentBuilder();
            }
            Document doc = builder.parse(in);
            // Merge text split around dropped comments so text/tail lookups see one run
            doc.getDocumentElement().normalize();
            logger.debug("Parsed {} (root element: {})", sourceName, doc.getDocumentElement().getLocalName());
            return doc;
        } catch (SAXException | IOException e) {
            throw new CatalogParseException("Failed to parse " + sourceName + ": " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser misconfigured", e);
        }
    }
}
