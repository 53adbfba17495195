package im.arun.legisindex.model.content;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;

/**
 * One node of a section's rendered content, in document order.
 *
 * <p>The hierarchy is closed: the constructor is package-private and every variant is a
 * final nested class. Elements without a dedicated variant become {@link Unknown}, which
 * keeps the source tag and children.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({"type"})
public abstract class ContentNode {

    ContentNode() {
    }

    /**
     * Discriminator written to JSON.
     */
    @JsonProperty("type")
    public abstract String getType();

    /**
     * Name of the XML element this node came from.
     */
    @JsonIgnore
    public abstract String getSourceTag();

    public List<ContentNode> getChildren() {
        return List.of();
    }

    @ToString
    @EqualsAndHashCode(callSuper = false)
    abstract static class Parent extends ContentNode {
        private final List<ContentNode> children;

        Parent(List<ContentNode> children) {
            this.children = children == null ? List.of() : List.copyOf(children);
        }

        @Override
        public List<ContentNode> getChildren() {
            return children;
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Text extends ContentNode {
        private final String value;

        public Text(String value) {
            this.value = value;
        }

        @Override
        public String getType() {
            return "text";
        }

        @Override
        public String getSourceTag() {
            return "#text";
        }
    }

    /**
     * Embedded MathML kept as raw markup for native rendering.
     */
    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class MathMarkup extends ContentNode {
        private final String raw;
        private final String display;
        @JsonIgnore
        private final String plainText;

        public MathMarkup(String raw, String display, String plainText) {
            this.raw = raw;
            this.display = display;
            this.plainText = plainText;
        }

        @Override
        public String getType() {
            return "MathML";
        }

        @Override
        public String getSourceTag() {
            return "math";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Block extends Parent {
        @JsonIgnore
        private final BlockKind kind;

        public Block(BlockKind kind, List<ContentNode> children) {
            super(children);
            this.kind = kind;
        }

        @Override
        public String getType() {
            return kind.getTag();
        }

        @Override
        public String getSourceTag() {
            return kind.getTag();
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class ExternalRef extends Parent {
        private final String link;
        private final String refType;

        public ExternalRef(String link, String refType, List<ContentNode> children) {
            super(children);
            this.link = link;
            this.refType = refType;
        }

        @Override
        public String getType() {
            return "XRefExternal";
        }

        @Override
        public String getSourceTag() {
            return "XRefExternal";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class InternalRef extends Parent {
        private final String target;

        public InternalRef(String target, List<ContentNode> children) {
            super(children);
            this.target = target;
        }

        @Override
        public String getType() {
            return "XRefInternal";
        }

        @Override
        public String getSourceTag() {
            return "XRefInternal";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Emphasis extends Parent {
        private final String style;

        public Emphasis(String style, List<ContentNode> children) {
            super(children);
            this.style = style;
        }

        @Override
        public String getType() {
            return "Emphasis";
        }

        @Override
        public String getSourceTag() {
            return "Emphasis";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class LanguageSpan extends Parent {
        private final String lang;

        public LanguageSpan(String lang, List<ContentNode> children) {
            super(children);
            this.lang = lang;
        }

        @Override
        public String getType() {
            return "Language";
        }

        @Override
        public String getSourceTag() {
            return "Language";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class FootnoteRef extends Parent {
        @JsonProperty("id")
        private final String idref;

        public FootnoteRef(String idref, List<ContentNode> children) {
            super(children);
            this.idref = idref;
        }

        @Override
        public String getType() {
            return "FootnoteRef";
        }

        @Override
        public String getSourceTag() {
            return "FootnoteRef";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Footnote extends Parent {
        private final String id;
        private final String placement;
        private final String status;

        public Footnote(String id, String placement, String status, List<ContentNode> children) {
            super(children);
            this.id = id;
            this.placement = placement;
            this.status = status;
        }

        @Override
        public String getType() {
            return "Footnote";
        }

        @Override
        public String getSourceTag() {
            return "Footnote";
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class FormBlank extends ContentNode {
        private final String width;

        public FormBlank(String width) {
            this.width = width;
        }

        @Override
        public String getType() {
            return "FormBlank";
        }

        @Override
        public String getSourceTag() {
            return "FormBlank";
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Leader extends ContentNode {
        @JsonProperty("style")
        private final String pattern;

        public Leader(String pattern) {
            this.pattern = pattern;
        }

        @Override
        public String getType() {
            return "Leader";
        }

        @Override
        public String getSourceTag() {
            return "Leader";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class ListNode extends Parent {
        private final String style;

        public ListNode(String style, List<ContentNode> children) {
            super(children);
            this.style = style;
        }

        @Override
        public String getType() {
            return "List";
        }

        @Override
        public String getSourceTag() {
            return "List";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Heading extends Parent {
        private final Integer level;

        public Heading(Integer level, List<ContentNode> children) {
            super(children);
            this.level = level;
        }

        @Override
        public String getType() {
            return "Heading";
        }

        @Override
        public String getSourceTag() {
            return "Heading";
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class Image extends ContentNode {
        private final String source;

        public Image(String source) {
            this.source = source;
        }

        @Override
        public String getType() {
            return "Image";
        }

        @Override
        public String getSourceTag() {
            return "Image";
        }
    }

    /**
     * CALS {@code table}.
     */
    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Table extends Parent {
        private final String frame;
        private final Boolean pgWide;
        private final String tabStyle;
        private final String orientation;

        public Table(String frame, Boolean pgWide, String tabStyle, String orientation,
                     List<ContentNode> children) {
            super(children);
            this.frame = frame;
            this.pgWide = pgWide;
            this.tabStyle = tabStyle;
            this.orientation = orientation;
        }

        @Override
        public String getType() {
            return "Table";
        }

        @Override
        public String getSourceTag() {
            return "table";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class TGroup extends Parent {
        private final Integer cols;

        public TGroup(Integer cols, List<ContentNode> children) {
            super(children);
            this.cols = cols;
        }

        @Override
        public String getType() {
            return "TGroup";
        }

        @Override
        public String getSourceTag() {
            return "tgroup";
        }
    }

    @Getter
    @ToString
    @EqualsAndHashCode(callSuper = false)
    public static final class ColSpec extends ContentNode {
        private final String colName;
        private final String colWidth;

        public ColSpec(String colName, String colWidth) {
            this.colName = colName;
            this.colWidth = colWidth;
        }

        @Override
        public String getType() {
            return "ColSpec";
        }

        @Override
        public String getSourceTag() {
            return "colspec";
        }
    }

    /**
     * CALS cell. {@code nameSt}/{@code nameEnd} give the column span, {@code moreRows}
     * the extra rows spanned.
     */
    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Entry extends Parent {
        private final String colName;
        private final String nameSt;
        private final String nameEnd;
        private final Integer moreRows;
        private final String align;
        private final String valign;

        public Entry(String colName, String nameSt, String nameEnd, Integer moreRows,
                     String align, String valign, List<ContentNode> children) {
            super(children);
            this.colName = colName;
            this.nameSt = nameSt;
            this.nameEnd = nameEnd;
            this.moreRows = moreRows;
            this.align = align;
            this.valign = valign;
        }

        @Override
        public String getType() {
            return "Entry";
        }

        @Override
        public String getSourceTag() {
            return "entry";
        }
    }

    @Getter
    @ToString(callSuper = true)
    @EqualsAndHashCode(callSuper = true)
    public static final class Unknown extends Parent {
        private final String tag;

        public Unknown(String tag, List<ContentNode> children) {
            super(children);
            this.tag = tag;
        }

        @Override
        public String getType() {
            return "Unknown";
        }

        @Override
        public String getSourceTag() {
            return tag;
        }
    }
}
