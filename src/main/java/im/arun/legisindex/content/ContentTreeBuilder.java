package im.arun.legisindex.content;

import im.arun.legisindex.model.content.ContentNode;
import im.arun.legisindex.xml.Elements;
import im.arun.legisindex.xml.TextExtractor;
import im.arun.legisindex.xml.TextLayout;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts DOM content into ordered {@link ContentNode} trees.
 *
 * <p>Whitespace-only text is dropped where a neighbouring block, or the edge of a block
 * parent, already separates the words; elsewhere it survives as a single space so
 * adjacent inline elements keep their gap.
 */
public class ContentTreeBuilder {

    static final String MATHML_NS = "http://www.w3.org/1998/Math/MathML";

    /**
     * Builds the tree for a record's child nodes. The list is treated like the inside of
     * a block, so leading and trailing whitespace is dropped.
     */
    public List<ContentNode> build(List<Node> nodes) {
        return convert(nodes, true);
    }

    /**
     * Builds a single node for an element, or null when the element is dropped.
     */
    public ContentNode buildNode(Element element) {
        String tag = Elements.localName(element);
        if (TextLayout.isMath(tag)) {
            return toMath(element);
        }
        if (TextLayout.isSkipped(tag)) {
            return null;
        }
        List<ContentNode> children = TextLayout.isVoid(tag)
                ? List.of()
                : convert(childNodes(element), TextLayout.isBlock(tag));
        return ContentNodeClassifier.classify(tag, attributes(element), children);
    }

    private List<ContentNode> convert(List<Node> nodes, boolean blockParent) {
        List<ContentNode> result = new ArrayList<>();
        for (int i = 0; i < nodes.size(); i++) {
            Node node = nodes.get(i);
            switch (node.getNodeType()) {
                case Node.TEXT_NODE:
                case Node.CDATA_SECTION_NODE:
                    String value = node.getNodeValue();
                    if (value.isEmpty()) {
                        break;
                    }
                    if (value.isBlank()) {
                        if (droppable(nodes, i, blockParent)) {
                            break;
                        }
                        result.add(new ContentNode.Text(" "));
                    } else {
                        result.add(new ContentNode.Text(TextLayout.collapse(value)));
                    }
                    break;
                case Node.ELEMENT_NODE:
                    ContentNode child = buildNode((Element) node);
                    if (child != null) {
                        result.add(child);
                    }
                    break;
                default:
                    break;
            }
        }
        return result;
    }

    private boolean droppable(List<Node> nodes, int index, boolean blockParent) {
        boolean first = index == 0;
        boolean last = index == nodes.size() - 1;
        if (blockParent && (first || last)) {
            return true;
        }
        return (!first && isBlockElement(nodes.get(index - 1)))
                || (!last && isBlockElement(nodes.get(index + 1)));
    }

    private boolean isBlockElement(Node node) {
        return node.getNodeType() == Node.ELEMENT_NODE && TextLayout.isBlock(Elements.localName(node));
    }

    private ContentNode.MathMarkup toMath(Element math) {
        String display = Elements.attr(math, "display");
        StringBuilder raw = new StringBuilder("<math xmlns=\"").append(MATHML_NS).append('"');
        if (display != null) {
            raw.append(" display=\"").append(escapeAttribute(display)).append('"');
        }
        raw.append('>');
        NodeList nodes = math.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            serialize(nodes.item(i), raw);
        }
        raw.append("</math>");
        return new ContentNode.MathMarkup(raw.toString(), display, TextExtractor.mathText(math));
    }

    private void serialize(Node node, StringBuilder out) {
        switch (node.getNodeType()) {
            case Node.TEXT_NODE:
            case Node.CDATA_SECTION_NODE:
                out.append(escapeText(node.getNodeValue()));
                break;
            case Node.ELEMENT_NODE:
                // Prefixes are dropped; everything is written in the default MathML namespace
                String name = Elements.localName(node);
                out.append('<').append(name);
                NamedNodeMap attrs = node.getAttributes();
                for (int i = 0; i < attrs.getLength(); i++) {
                    Attr attr = (Attr) attrs.item(i);
                    if (isNamespaceDeclaration(attr.getName())) {
                        continue;
                    }
                    out.append(' ').append(attr.getName()).append("=\"")
                            .append(escapeAttribute(attr.getValue())).append('"');
                }
                NodeList children = node.getChildNodes();
                if (children.getLength() == 0) {
                    out.append("/>");
                } else {
                    out.append('>');
                    for (int i = 0; i < children.getLength(); i++) {
                        serialize(children.item(i), out);
                    }
                    out.append("</").append(name).append('>');
                }
                break;
            default:
                break;
        }
    }

    private static boolean isNamespaceDeclaration(String attributeName) {
        return "xmlns".equals(attributeName) || attributeName.startsWith("xmlns:");
    }

    private static String escapeText(String value) {
        return value.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;");
    }

    private static String escapeAttribute(String value) {
        return escapeText(value).replace("\"", "&quot;");
    }

    static Map<String, String> attributes(Element element) {
        NamedNodeMap attrs = element.getAttributes();
        if (attrs.getLength() == 0) {
            return Map.of();
        }
        Map<String, String> result = new LinkedHashMap<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr attr = (Attr) attrs.item(i);
            result.put(attr.getName(), attr.getValue());
        }
        return result;
    }

    static List<Node> childNodes(Node parent) {
        NodeList nodes = parent.getChildNodes();
        List<Node> result = new ArrayList<>(nodes.getLength());
        for (int i = 0; i < nodes.getLength(); i++) {
            result.add(nodes.item(i));
        }
        return result;
    }
}
