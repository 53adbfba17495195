package im.arun.legisindex.xml;

import im.arun.legisindex.exception.LegislationParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;
import org.xml.sax.helpers.DefaultHandler;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;

/**
 * Builds DOM trees from legislation XML.
 *
 * <p>Namespace processing is off so prefixed attributes such as {@code lims:id} and
 * {@code xml:lang} are read by their qualified name whether or not the file declares the
 * namespace. Published files carry a DOCTYPE, so DTDs are allowed but never fetched.
 *
 * <p>A loader may be shared between threads. Each thread parses with its own
 * {@link DocumentBuilder}, reset before every use.
 */
public class XmlDocumentLoader {
    private static final Logger logger = LoggerFactory.getLogger(XmlDocumentLoader.class);

    private final DocumentBuilderFactory factory;
    private final ThreadLocal<DocumentBuilder> builders;

    public XmlDocumentLoader() {
        this.factory = createFactory();
        this.builders = ThreadLocal.withInitial(this::newBuilder);
    }

    public Document load(String xml) throws LegislationParseException {
        if (xml == null || xml.isBlank()) {
            throw new LegislationParseException("Invalid XML: empty document");
        }
        try {
            DocumentBuilder builder = builders.get();
            builder.reset();
            builder.setEntityResolver((publicId, systemId) -> new InputSource(new StringReader("")));
            builder.setErrorHandler(new DefaultHandler() {
                @Override
                public void warning(SAXParseException e) {
                    logger.debug("XML warning at line {}: {}", e.getLineNumber(), e.getMessage());
                }

                @Override
                public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return builder.parse(new InputSource(new StringReader(xml)));
        } catch (SAXParseException e) {
            throw new LegislationParseException(
                    "Invalid XML at line " + e.getLineNumber() + ": " + e.getMessage(), e);
        } catch (SAXException e) {
            throw new LegislationParseException("Invalid XML: " + e.getMessage(), e);
        } catch (IOException e) {
            throw new LegislationParseException("Failed to read XML: " + e.getMessage(), e);
        }
    }

    // DocumentBuilderFactory is not thread-safe
    private DocumentBuilder newBuilder() {
        synchronized (factory) {
            try {
                return factory.newDocumentBuilder();
            } catch (ParserConfigurationException e) {
                throw new IllegalStateException("Failed to create XML parser", e);
            }
        }
    }

    private static DocumentBuilderFactory createFactory() {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(false);
        dbf.setValidating(false);
        dbf.setXIncludeAware(false);
        try {
            dbf.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            dbf.setFeature("http://xml.org/sax/features/external-general-entities", false);
            dbf.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            dbf.setFeature("http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
        return dbf;
    }
}
