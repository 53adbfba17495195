package im.arun.legisindex.content;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import im.arun.legisindex.Fixtures;
import im.arun.legisindex.model.content.ContentNode;
import im.arun.legisindex.xml.TextExtractor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentTreeBuilder Tests")
class ContentTreeBuilderTest {

    private final ContentTreeBuilder builder = new ContentTreeBuilder();
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("should render back to the extracted text")
    void shouldRenderSameText_whenBuiltFromSameNodes() {
        Element section = Fixtures.element("""
                <Section>
                  <Subsection>
                    <Label>(1)</Label>
                    <Text>This Act applies despite the <XRefExternal reference-type="act" link="F-11">Financial
                      Administration Act</XRefExternal> and subject to section <XRefInternal>29</XRefInternal>.</Text>
                  </Subsection>
                  <Subsection>
                    <Label>(2)</Label>
                    <Text>The penalty is <math display="inline"><mi>x</mi><mo>+</mo><mn>1</mn></math> dollars.</Text>
                    <HistoricalNote>2019, c. 10</HistoricalNote>
                  </Subsection>
                </Section>
                """);
        List<Node> nodes = ContentTreeBuilder.childNodes(section);

        List<ContentNode> tree = builder.build(nodes);

        String expected = "(1) This Act applies despite the Financial Administration Act and subject to section 29. "
                + "(2) The penalty is x+1 dollars.";
        assertThat(TextExtractor.text(nodes)).isEqualTo(expected);
        assertThat(ContentTreeText.render(tree)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should drop whitespace between block elements")
    void shouldDropWhitespace_whenBetweenBlocks() {
        Element section = Fixtures.element("<Section>\n  <Label>1</Label>\n  <Text>Short title</Text>\n</Section>");

        List<ContentNode> tree = builder.build(ContentTreeBuilder.childNodes(section));

        assertThat(tree).extracting(ContentNode::getType).containsExactly("Label", "Text");
    }

    @Test
    @DisplayName("should keep a single space between inline elements")
    void shouldKeepSpace_whenBetweenInlineElements() {
        Element text = Fixtures.element("<Text><Emphasis style=\"italic\">Canada</Emphasis>   "
                + "<Emphasis style=\"bold\">Post</Emphasis></Text>");

        ContentNode node = builder.buildNode(text);

        assertThat(node.getChildren()).hasSize(3);
        assertThat(((ContentNode.Text) node.getChildren().get(1)).getValue()).isEqualTo(" ");
        assertThat(ContentTreeText.render(List.of(node))).isEqualTo("Canada Post");
    }

    @Test
    @DisplayName("should keep math as raw MathML with its namespace")
    void shouldSerializeMath_whenElementIsMath() {
        Element math = Fixtures.element("<math display=\"block\"><mi>a</mi><mo>&lt;</mo><mn>2</mn></math>");

        ContentNode node = builder.buildNode(math);

        assertThat(node).isInstanceOf(ContentNode.MathMarkup.class);
        ContentNode.MathMarkup markup = (ContentNode.MathMarkup) node;
        assertThat(markup.getRaw()).isEqualTo(
                "<math xmlns=\"http://www.w3.org/1998/Math/MathML\" display=\"block\">"
                        + "<mi>a</mi><mo>&lt;</mo><mn>2</mn></math>");
        assertThat(markup.getDisplay()).isEqualTo("block");
        assertThat(markup.getPlainText()).isEqualTo("a<2");
    }

    @Test
    @DisplayName("should write prefixed MathML in the default namespace")
    void shouldDropPrefixes_whenMathIsPrefixed() {
        Element math = Fixtures.element("<mml:math xmlns:mml=\"http://www.w3.org/1998/Math/MathML\" display=\"inline\">"
                + "<mml:mrow><mml:mi mathvariant=\"italic\">x</mml:mi><mml:mn>1</mml:mn></mml:mrow></mml:math>");

        ContentNode.MathMarkup markup = (ContentNode.MathMarkup) builder.buildNode(math);

        assertThat(markup.getRaw()).isEqualTo(
                "<math xmlns=\"http://www.w3.org/1998/Math/MathML\" display=\"inline\">"
                        + "<mrow><mi mathvariant=\"italic\">x</mi><mn>1</mn></mrow></math>");
        assertThat(markup.getPlainText()).isEqualTo("x1");
    }

    @Test
    @DisplayName("should skip marginal notes and empty form elements")
    void shouldSkipMetadataAndVoidContent() {
        Element text = Fixtures.element("<FormGroup><MarginalNote>Form</MarginalNote>"
                + "<Text>Name: <FormBlank width=\"2in\">ignored</FormBlank></Text></FormGroup>");

        ContentNode node = builder.buildNode(text);

        assertThat(node.getChildren()).hasSize(1);
        ContentNode formText = node.getChildren().get(0);
        assertThat(formText.getChildren().get(1)).isInstanceOf(ContentNode.FormBlank.class);
        assertThat(((ContentNode.FormBlank) formText.getChildren().get(1)).getWidth()).isEqualTo("2in");
        assertThat(ContentTreeText.render(List.of(node))).isEqualTo("Name:");
    }

    @Test
    @DisplayName("should write the node type as a discriminator in JSON")
    void shouldWriteTypeDiscriminator_whenSerialized() throws Exception {
        ContentNode node = builder.buildNode(Fixtures.element(
                "<XRefExternal reference-type=\"act\" link=\"F-11\">Financial Administration Act</XRefExternal>"));

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(node));

        assertThat(json.get("type").asText()).isEqualTo("XRefExternal");
        assertThat(json.get("link").asText()).isEqualTo("F-11");
        assertThat(json.get("refType").asText()).isEqualTo("act");
        assertThat(json.get("children").get(0).get("type").asText()).isEqualTo("text");
        assertThat(json.get("children").get(0).get("value").asText()).isEqualTo("Financial Administration Act");
    }
}
