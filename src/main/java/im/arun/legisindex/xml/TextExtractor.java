package im.arun.legisindex.xml;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.List;

/**
 * Order-preserving plain text of DOM content.
 *
 * <p>Marginal notes and historical notes are skipped at every depth. Block elements
 * are padded with spaces so a label never fuses with the text that follows it.
 */
public final class TextExtractor {

    private TextExtractor() {}

    /**
     * Normalized text of an element and everything under it.
     */
    public static String text(Element element) {
        if (element == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendElement(element, sb);
        return TextLayout.normalize(sb);
    }

    /**
     * Text of an element's children. Unlike {@link #text(Element)} this also works on
     * elements that are themselves skipped, such as a historical note.
     */
    public static String innerText(Element element) {
        if (element == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendChildren(element, sb);
        return TextLayout.normalize(sb);
    }

    /**
     * Text of an element, or null when it is absent or blank.
     */
    public static String textOrNull(Element element) {
        String text = text(element);
        return text.isEmpty() ? null : text;
    }

    /**
     * Inner text of an element, or null when it is absent or blank. Used for fields such
     * as marginal notes whose elements are skipped in body text.
     */
    public static String innerTextOrNull(Element element) {
        String text = innerText(element);
        return text.isEmpty() ? null : text;
    }

    /**
     * Normalized text of a sequence of sibling nodes, as used for section content.
     */
    public static String text(List<Node> nodes) {
        StringBuilder sb = new StringBuilder();
        for (Node node : nodes) {
            append(node, sb);
        }
        return TextLayout.normalize(sb);
    }

    /**
     * Plain text of a math element: its character data with whitespace collapsed.
     */
    public static String mathText(Element math) {
        return TextLayout.normalize(math.getTextContent());
    }

    private static void append(Node node, StringBuilder sb) {
        switch (node.getNodeType()) {
            case Node.TEXT_NODE:
            case Node.CDATA_SECTION_NODE:
                sb.append(node.getNodeValue());
                break;
            case Node.ELEMENT_NODE:
                appendElement((Element) node, sb);
                break;
            case Node.ENTITY_REFERENCE_NODE:
                appendChildren(node, sb);
                break;
            default:
                break;
        }
    }

    private static void appendElement(Element element, StringBuilder sb) {
        String tag = Elements.localName(element);
        if (TextLayout.isSkipped(tag) || TextLayout.isVoid(tag)) {
            return;
        }
        if (TextLayout.isMath(tag)) {
            sb.append(mathText(element));
            return;
        }
        boolean block = TextLayout.isBlock(tag);
        if (block) {
            sb.append(' ');
        }
        appendChildren(element, sb);
        if (block) {
            sb.append(' ');
        }
    }

    private static void appendChildren(Node parent, StringBuilder sb) {
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            append(nodes.item(i), sb);
        }
    }
}
