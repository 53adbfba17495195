package im.arun.legisindex.xml;

import im.arun.legisindex.exception.LegislationParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("XmlDocumentLoader Tests")
class XmlDocumentLoaderTest {

    private final XmlDocumentLoader loader = new XmlDocumentLoader();

    @Test
    @DisplayName("should read prefixed attributes by their qualified name")
    void shouldReadPrefixedAttributes_whenNamespaceIsUndeclared() throws LegislationParseException {
        Document document = loader.load("<Statute xml:lang=\"fr\" lims:id=\"5\"/>");

        assertThat(document.getDocumentElement().getAttribute("lims:id")).isEqualTo("5");
        assertThat(document.getDocumentElement().getAttribute("xml:lang")).isEqualTo("fr");
    }

    @Test
    @DisplayName("should reject empty and malformed input")
    void shouldFail_whenXmlIsEmptyOrMalformed() {
        assertThatThrownBy(() -> loader.load("  "))
                .isInstanceOf(LegislationParseException.class)
                .hasMessage("Invalid XML: empty document");
        assertThatThrownBy(() -> loader.load("<Statute><Body></Statute>"))
                .isInstanceOf(LegislationParseException.class)
                .hasMessageStartingWith("Invalid XML at line 1");
    }

    @Test
    @DisplayName("should keep parsing on the same thread after a malformed document")
    void shouldParse_afterPreviousDocumentFailed() throws LegislationParseException {
        assertThatThrownBy(() -> loader.load("<Regulation>"))
                .isInstanceOf(LegislationParseException.class);

        Document document = loader.load("<Regulation><Body/></Regulation>");

        assertThat(document.getDocumentElement().getTagName()).isEqualTo("Regulation");
    }

    @Test
    @DisplayName("should parse from many threads with one shared loader")
    void shouldParseConcurrently_whenLoaderIsShared() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        try {
            List<Callable<String>> tasks = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                String id = "A-" + i;
                tasks.add(() -> loader.load("<Statute><Identification><Chapter><ConsolidatedNumber>" + id
                        + "</ConsolidatedNumber></Chapter></Identification></Statute>")
                        .getDocumentElement().getTextContent());
            }

            List<String> ids = new ArrayList<>();
            for (Future<String> future : executor.invokeAll(tasks)) {
                ids.add(future.get());
            }

            assertThat(ids).hasSize(64).doesNotHaveDuplicates().contains("A-0", "A-63");
        } finally {
            executor.shutdown();
            executor.awaitTermination(5, TimeUnit.SECONDS);
        }
    }
}
