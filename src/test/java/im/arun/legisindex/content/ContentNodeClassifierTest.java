package im.arun.legisindex.content;

import im.arun.legisindex.model.content.BlockKind;
import im.arun.legisindex.model.content.ContentNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ContentNodeClassifier Tests")
class ContentNodeClassifierTest {

    private static final List<ContentNode> TEXT = List.of(new ContentNode.Text("Act"));

    @Test
    @DisplayName("should keep link and reference type of external references")
    void shouldCreateExternalRef_whenTagIsXRefExternal() {
        ContentNode node = ContentNodeClassifier.classify("XRefExternal",
                Map.of("link", "F-11", "reference-type", "act"), TEXT);

        assertThat(node).isInstanceOf(ContentNode.ExternalRef.class);
        ContentNode.ExternalRef ref = (ContentNode.ExternalRef) node;
        assertThat(ref.getLink()).isEqualTo("F-11");
        assertThat(ref.getRefType()).isEqualTo("act");
        assertThat(ref.getChildren()).isEqualTo(TEXT);
    }

    @Test
    @DisplayName("should take the first present target attribute of internal references")
    void shouldUseIdref_whenInternalRefHasNoTarget() {
        ContentNode node = ContentNodeClassifier.classify("XRefInternal", Map.of("idref", "s29"), TEXT);

        assertThat(((ContentNode.InternalRef) node).getTarget()).isEqualTo("s29");
    }

    @Test
    @DisplayName("should drop marginal and historical notes")
    void shouldReturnNull_whenTagIsMetadata() {
        assertThat(ContentNodeClassifier.classify("MarginalNote", Map.of(), TEXT)).isNull();
        assertThat(ContentNodeClassifier.classify("HistoricalNote", Map.of(), TEXT)).isNull();
        assertThat(ContentNodeClassifier.classify("HistoricalNoteSubItem", Map.of(), TEXT)).isNull();
    }

    @Test
    @DisplayName("should map plain structural elements to blocks")
    void shouldCreateBlock_whenTagIsStructural() {
        ContentNode node = ContentNodeClassifier.classify("Paragraph", null, TEXT);

        assertThat(node).isInstanceOf(ContentNode.Block.class);
        assertThat(((ContentNode.Block) node).getKind()).isEqualTo(BlockKind.PARAGRAPH);
        assertThat(node.getType()).isEqualTo("Paragraph");
    }

    @Test
    @DisplayName("should match table parts regardless of case")
    void shouldMatchTablePartsCaseInsensitively() {
        ContentNode row = ContentNodeClassifier.classify("row", Map.of(), List.of());
        ContentNode table = ContentNodeClassifier.classify("Table", Map.of("frame", "all", "pgwide", "1"), List.of());
        ContentNode entry = ContentNodeClassifier.classify("entry", Map.of("morerows", "2", "align", "center"), TEXT);

        assertThat(((ContentNode.Block) row).getKind()).isEqualTo(BlockKind.ROW);
        assertThat(((ContentNode.Table) table).getFrame()).isEqualTo("all");
        assertThat(((ContentNode.Table) table).getPgWide()).isTrue();
        assertThat(((ContentNode.Entry) entry).getMoreRows()).isEqualTo(2);
        assertThat(((ContentNode.Entry) entry).getAlign()).isEqualTo("center");
    }

    @Test
    @DisplayName("should parse heading level and ignore a malformed one")
    void shouldParseHeadingLevel() {
        ContentNode heading = ContentNodeClassifier.classify("Heading", Map.of("level", "2"), TEXT);
        ContentNode malformed = ContentNodeClassifier.classify("Heading", Map.of("level", "two"), TEXT);

        assertThat(((ContentNode.Heading) heading).getLevel()).isEqualTo(2);
        assertThat(((ContentNode.Heading) malformed).getLevel()).isNull();
    }

    @Test
    @DisplayName("should keep unrecognized elements with their tag and children")
    void shouldCreateUnknown_whenTagIsNotRecognized() {
        ContentNode node = ContentNodeClassifier.classify("Signature", Map.of(), TEXT);

        assertThat(node).isInstanceOf(ContentNode.Unknown.class);
        assertThat(((ContentNode.Unknown) node).getTag()).isEqualTo("Signature");
        assertThat(node.getChildren()).isEqualTo(TEXT);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(BlockKind.class)
    @DisplayName("should map every plain block tag to its kind")
    void shouldCreateBlock_forEveryBlockKind(BlockKind kind) {
        ContentNode node = ContentNodeClassifier.classify(kind.getTag(), Map.of(), TEXT);

        assertThat(node).isInstanceOf(ContentNode.Block.class);
        assertThat(((ContentNode.Block) node).getKind()).isEqualTo(kind);
        assertThat(node.getType()).isEqualTo(kind.getTag());
        assertThat(node.getChildren()).isEqualTo(TEXT);
        assertThat(BlockKind.fromTag(kind.getTag())).isEqualTo(kind);
    }

    @ParameterizedTest(name = "{0}")
    @EnumSource(value = BlockKind.class, names = {"THEAD", "TBODY", "TFOOT", "ROW"})
    @DisplayName("should map lower-case table part tags to their kind")
    void shouldCreateBlock_whenTablePartTagIsLowerCase(BlockKind kind) {
        ContentNode node = ContentNodeClassifier.classify(kind.getTag().toLowerCase(Locale.ROOT), Map.of(), List.of());

        assertThat(((ContentNode.Block) node).getKind()).isEqualTo(kind);
    }

    @Test
    @DisplayName("should not treat other tags as case-insensitive blocks")
    void shouldCreateUnknown_whenBlockTagHasWrongCase() {
        assertThat(ContentNodeClassifier.classify("paragraph", Map.of(), TEXT))
                .isInstanceOf(ContentNode.Unknown.class);
    }

    @Test
    @DisplayName("should keep the emphasis style")
    void shouldCreateEmphasis_whenTagIsEmphasis() {
        ContentNode node = ContentNodeClassifier.classify("Emphasis", Map.of("style", "italic"), TEXT);

        assertThat(((ContentNode.Emphasis) node).getStyle()).isEqualTo("italic");
        assertThat(node.getType()).isEqualTo("Emphasis");
        assertThat(node.getChildren()).isEqualTo(TEXT);
    }

    @Test
    @DisplayName("should keep the language of a language span")
    void shouldCreateLanguageSpan_whenTagIsLanguage() {
        ContentNode node = ContentNodeClassifier.classify("Language", Map.of("xml:lang", "fr"), TEXT);

        assertThat(((ContentNode.LanguageSpan) node).getLang()).isEqualTo("fr");
        assertThat(node.getType()).isEqualTo("Language");
    }

    @Test
    @DisplayName("should keep the target of a footnote reference")
    void shouldCreateFootnoteRef_whenTagIsFootnoteRef() {
        ContentNode node = ContentNodeClassifier.classify("FootnoteRef", Map.of("idref", "fn1"), TEXT);

        assertThat(((ContentNode.FootnoteRef) node).getIdref()).isEqualTo("fn1");
        assertThat(node.getChildren()).isEqualTo(TEXT);
    }

    @Test
    @DisplayName("should keep id, placement and status of a footnote")
    void shouldCreateFootnote_whenTagIsFootnote() {
        ContentNode node = ContentNodeClassifier.classify("Footnote",
                Map.of("id", "fn1", "placement", "page", "status", "official"), TEXT);

        ContentNode.Footnote footnote = (ContentNode.Footnote) node;
        assertThat(footnote.getId()).isEqualTo("fn1");
        assertThat(footnote.getPlacement()).isEqualTo("page");
        assertThat(footnote.getStatus()).isEqualTo("official");
    }

    @Test
    @DisplayName("should keep the width of a form blank and give it no children")
    void shouldCreateFormBlank_whenTagIsFormBlank() {
        ContentNode node = ContentNodeClassifier.classify("FormBlank", Map.of("width", "2in"), TEXT);

        assertThat(((ContentNode.FormBlank) node).getWidth()).isEqualTo("2in");
        assertThat(node.getChildren()).isEmpty();
    }

    @Test
    @DisplayName("should keep the leader pattern")
    void shouldCreateLeader_whenTagIsLeader() {
        ContentNode node = ContentNodeClassifier.classify("Leader", Map.of("leader-pattern", "dot"), List.of());

        assertThat(((ContentNode.Leader) node).getPattern()).isEqualTo("dot");
    }

    @Test
    @DisplayName("should keep the list style")
    void shouldCreateListNode_whenTagIsList() {
        ContentNode node = ContentNodeClassifier.classify("List", Map.of("style", "lower-alpha"), TEXT);

        assertThat(((ContentNode.ListNode) node).getStyle()).isEqualTo("lower-alpha");
        assertThat(node.getChildren()).isEqualTo(TEXT);
    }

    @Test
    @DisplayName("should keep the image source")
    void shouldCreateImage_whenTagIsImage() {
        ContentNode node = ContentNodeClassifier.classify("Image", Map.of("source", "img001.gif"), List.of());

        assertThat(((ContentNode.Image) node).getSource()).isEqualTo("img001.gif");
    }

    @Test
    @DisplayName("should parse the column count of a table group")
    void shouldCreateTGroup_whenTagIsTgroup() {
        ContentNode node = ContentNodeClassifier.classify("tgroup", Map.of("cols", "3"), List.of());
        ContentNode malformed = ContentNodeClassifier.classify("TGroup", Map.of("cols", "x"), List.of());

        assertThat(((ContentNode.TGroup) node).getCols()).isEqualTo(3);
        assertThat(((ContentNode.TGroup) malformed).getCols()).isNull();
    }

    @Test
    @DisplayName("should keep name and width of a column specification")
    void shouldCreateColSpec_whenTagIsColspec() {
        ContentNode node = ContentNodeClassifier.classify("colspec",
                Map.of("colname", "c1", "colwidth", "2*"), List.of());

        assertThat(((ContentNode.ColSpec) node).getColName()).isEqualTo("c1");
        assertThat(((ContentNode.ColSpec) node).getColWidth()).isEqualTo("2*");
    }
}
