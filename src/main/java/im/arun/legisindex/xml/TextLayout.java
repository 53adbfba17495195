package im.arun.legisindex.xml;

import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Shared rules for turning legislative markup into plain text. Both the DOM text
 * extractor and the content-tree renderer apply them, which is what keeps a section's
 * {@code content} equal to the text of its content tree.
 */
public final class TextLayout {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /**
     * Elements that get a separating space on both sides. Compared in lower case.
     */
    private static final Set<String> BLOCK_TAGS = Set.of(
            "label", "text", "subsection", "paragraph", "subparagraph", "clause", "subclause",
            "subsubclause", "definition", "definitionenonly", "definitionfronly",
            "continued", "continuedsectionsubsection", "continuedparagraph",
            "continuedsubparagraph", "continuedclause", "continuedsubclause",
            "continueddefinition", "continuedformulaparagraph",
            "list", "item", "table", "tgroup", "thead", "tbody", "tfoot", "row", "entry",
            "formulagroup", "formula", "formulaparagraph", "formuladefinition",
            "imagegroup", "caption", "bilingualgroup", "bilingualitemen", "bilingualitemfr",
            "centeredtext", "formgroup", "oath", "readastext", "scheduleformheading",
            "heading", "titletext", "provision", "linebreak", "pagebreak", "footnote",
            "sectionpiece", "amendedtext", "amendedcontent", "order", "recommendation",
            "notice", "quotedtext", "section", "groupheading", "tableofprovisions");

    /**
     * Metadata elements that never contribute text, at any depth.
     */
    private static final Set<String> SKIPPED_TAGS = Set.of(
            "MarginalNote", "HistoricalNote", "HistoricalNoteSubItem");

    /**
     * Empty-content elements; anything inside them is ignored.
     */
    private static final Set<String> VOID_TAGS = Set.of("FormBlank", "Leader", "Image", "colspec", "ColSpec");

    private static final Set<String> MATH_TAGS = Set.of("math", "MathML");

    private TextLayout() {}

    public static boolean isBlock(String tag) {
        return tag != null && BLOCK_TAGS.contains(tag.toLowerCase(Locale.ROOT));
    }

    public static boolean isSkipped(String tag) {
        return SKIPPED_TAGS.contains(tag);
    }

    public static boolean isVoid(String tag) {
        return VOID_TAGS.contains(tag);
    }

    public static boolean isMath(String tag) {
        return MATH_TAGS.contains(tag);
    }

    /**
     * Collapses whitespace runs to one space and trims.
     */
    public static String normalize(CharSequence text) {
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    /**
     * Collapses whitespace runs without trimming, for text kept inside a tree.
     */
    public static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ");
    }
}
