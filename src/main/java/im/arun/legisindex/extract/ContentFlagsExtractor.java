package im.arun.legisindex.extract;

import im.arun.legisindex.model.ContentFlags;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Scans a record's subtree once and reports which kinds of content it contains.
 */
public final class ContentFlagsExtractor {

    private static final Set<String> LEADER_PATTERNS = Set.of("solid", "dot", "dash");

    private ContentFlagsExtractor() {}

    public static ContentFlags extract(Element root) {
        Scan scan = new Scan();
        scan.visit(root);
        if (scan.tags.isEmpty() && !scan.editorialNote) {
            return null;
        }
        Set<String> t = scan.tags;
        ContentFlags flags = ContentFlags.builder()
                .hasTable(flag(t.contains("TableGroup")))
                .hasFormula(flag(t.contains("FormulaGroup") || t.contains("MathML") || t.contains("math")))
                .hasImage(flag(!scan.imageSources.isEmpty()))
                .imageSources(nonEmpty(scan.imageSources))
                .hasRepealed(flag(t.contains("Repealed")))
                .hasEditorialNote(flag(scan.editorialNote))
                .hasReserved(flag(t.contains("Reserved")))
                .hasExplanatoryNote(flag(t.contains("ExplanatoryNote")))
                .hasSignatureBlock(flag(t.contains("SignatureBlock")))
                .hasBilingualGroup(flag(t.contains("BilingualGroup")))
                .hasQuotedText(flag(t.contains("QuotedText")))
                .hasReadAsText(flag(t.contains("ReadAsText")))
                .hasAmendedText(flag(t.contains("AmendedText")))
                .hasAlternateText(flag(t.contains("AlternateText")))
                .alternateTextContent(nonEmpty(scan.alternateTexts))
                .hasFormGroup(flag(t.contains("FormGroup")))
                .hasOath(flag(t.contains("Oath")))
                .hasCaption(flag(t.contains("Caption")))
                .hasLeader(flag(t.contains("Leader")))
                .leaderTypes(nonEmpty(new ArrayList<>(scan.leaderTypes)))
                .hasLineBreak(flag(t.contains("LineBreak")))
                .hasPageBreak(flag(t.contains("PageBreak")))
                .hasFormBlank(flag(t.contains("FormBlank")))
                .formBlankWidths(nonEmpty(scan.formBlankWidths))
                .hasSeparator(flag(t.contains("Separator")))
                .hasFraction(flag(t.contains("Fraction")))
                .hasIns(flag(t.contains("Ins")))
                .hasDel(flag(t.contains("Del")))
                .build();
        return flags.equals(ContentFlags.builder().build()) ? null : flags;
    }

    private static Boolean flag(boolean value) {
        return value ? Boolean.TRUE : null;
    }

    private static <T> List<T> nonEmpty(List<T> values) {
        return values.isEmpty() ? null : values;
    }

    private static final class Scan {
        private final Set<String> tags = new HashSet<>();
        private final List<String> imageSources = new ArrayList<>();
        private final List<String> alternateTexts = new ArrayList<>();
        private final Set<String> leaderTypes = new LinkedHashSet<>();
        private final List<String> formBlankWidths = new ArrayList<>();
        private boolean editorialNote;

        void visit(Element parent) {
            for (Element child : Elements.children(parent)) {
                String tag = Elements.localName(child);
                tags.add(tag);
                switch (tag) {
                    case "Image":
                        String source = Elements.attr(child, "source");
                        if (source != null) {
                            imageSources.add(source);
                        }
                        break;
                    case "AlternateText":
                        String alt = TextExtractor.text(child);
                        if (!alt.isEmpty()) {
                            alternateTexts.add(alt);
                        }
                        continue;
                    case "Leader":
                        String pattern = Elements.attr(child, "leader-pattern");
                        if (pattern == null) {
                            pattern = Elements.attr(child, "style");
                        }
                        if (pattern != null && LEADER_PATTERNS.contains(pattern)) {
                            leaderTypes.add(pattern);
                        }
                        break;
                    case "FormBlank":
                        String width = Elements.attr(child, "width");
                        if (width != null) {
                            formBlankWidths.add(width);
                        }
                        break;
                    case "Note":
                        String status = Elements.attr(child, "status");
                        if ("editorial".equals(status) || "unofficial".equals(status)) {
                            editorialNote = true;
                        }
                        break;
                    default:
                        break;
                }
                visit(child);
            }
        }
    }
}
