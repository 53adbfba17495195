package im.arun.legisindex.content;

import im.arun.legisindex.model.content.BlockKind;
import im.arun.legisindex.model.content.ContentNode;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Maps one element (tag, attributes, already-built children) to its content node.
 *
 * <p>Pure and stateless. Returns null for metadata elements that are dropped from
 * content trees; anything it does not recognize becomes {@link ContentNode.Unknown}.
 * Math is not handled here because its raw markup needs the DOM.
 */
public final class ContentNodeClassifier {

    private static final Set<String> DROPPED = Set.of("MarginalNote", "HistoricalNote", "HistoricalNoteSubItem");

    private ContentNodeClassifier() {}

    public static ContentNode classify(String tag, Map<String, String> attributes, List<ContentNode> children) {
        if (DROPPED.contains(tag)) {
            return null;
        }
        Map<String, String> attrs = attributes == null ? Map.of() : attributes;

        switch (tag) {
            case "XRefExternal":
                return new ContentNode.ExternalRef(attrs.get("link"), attrs.get("reference-type"), children);
            case "XRefInternal":
                return new ContentNode.InternalRef(firstPresent(attrs, "target", "idref", "link"), children);
            case "Emphasis":
                return new ContentNode.Emphasis(attrs.get("style"), children);
            case "Language":
                return new ContentNode.LanguageSpan(attrs.get("xml:lang"), children);
            case "FootnoteRef":
                return new ContentNode.FootnoteRef(attrs.get("idref"), children);
            case "Footnote":
                return new ContentNode.Footnote(attrs.get("id"), attrs.get("placement"), attrs.get("status"), children);
            case "FormBlank":
                return new ContentNode.FormBlank(attrs.get("width"));
            case "Leader":
                return new ContentNode.Leader(attrs.get("leader-pattern"));
            case "List":
                return new ContentNode.ListNode(attrs.get("style"), children);
            case "Heading":
                return new ContentNode.Heading(parseInt(attrs.get("level")), children);
            case "Image":
                return new ContentNode.Image(attrs.get("source"));
            default:
                break;
        }

        switch (tag.toLowerCase(Locale.ROOT)) {
            case "table":
                return new ContentNode.Table(attrs.get("frame"), yesNo(attrs.get("pgwide")),
                        attrs.get("tabstyle"), attrs.get("orientation"), children);
            case "tgroup":
                return new ContentNode.TGroup(parseInt(attrs.get("cols")), children);
            case "colspec":
                return new ContentNode.ColSpec(attrs.get("colname"), attrs.get("colwidth"));
            case "entry":
                return new ContentNode.Entry(attrs.get("colname"), attrs.get("namest"), attrs.get("nameend"),
                        parseInt(attrs.get("morerows")), attrs.get("align"), attrs.get("valign"), children);
            default:
                break;
        }

        BlockKind kind = BlockKind.fromTag(tag);
        if (kind != null) {
            return new ContentNode.Block(kind, children);
        }
        return new ContentNode.Unknown(tag, children);
    }

    private static String firstPresent(Map<String, String> attrs, String... names) {
        for (String name : names) {
            String value = attrs.get(name);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }

    private static Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Boolean yesNo(String value) {
        if (value == null) {
            return null;
        }
        return "1".equals(value) || "yes".equalsIgnoreCase(value) || "true".equalsIgnoreCase(value);
    }
}
