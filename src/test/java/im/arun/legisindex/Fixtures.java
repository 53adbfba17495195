package im.arun.legisindex;

import im.arun.legisindex.exception.LegislationParseException;
import im.arun.legisindex.xml.XmlDocumentLoader;
import org.w3c.dom.Element;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

/**
 * Loads XML fixtures from {@code src/test/resources/fixtures}.
 */
public final class Fixtures {
    private static final XmlDocumentLoader LOADER = new XmlDocumentLoader();

    private Fixtures() {}

    public static String read(String name) {
        try (InputStream in = Fixtures.class.getClassLoader().getResourceAsStream("fixtures/" + name)) {
            if (in == null) {
                throw new IllegalArgumentException("Missing fixture " + name);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Parses an XML snippet and returns its root element.
     */
    public static Element element(String xml) {
        try {
            return LOADER.load(xml).getDocumentElement();
        } catch (LegislationParseException e) {
            throw new IllegalArgumentException(e);
        }
    }
}
