package im.arun.legisindex.xml;

import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/**
 * DOM navigation helpers. Names are compared on the local part, so {@code lims:Foo}
 * and {@code Foo} match the same lookup.
 */
public final class Elements {

    private Elements() {}

    public static String localName(Node node) {
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    public static boolean is(Node node, String name) {
        return node != null && node.getNodeType() == Node.ELEMENT_NODE && localName(node).equals(name);
    }

    public static List<Element> children(Element parent) {
        List<Element> result = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) node);
            }
        }
        return result;
    }

    public static List<Element> children(Element parent, String name) {
        List<Element> result = new ArrayList<>();
        for (Element child : children(parent)) {
            if (localName(child).equals(name)) {
                result.add(child);
            }
        }
        return result;
    }

    public static Element child(Element parent, String name) {
        if (parent == null) {
            return null;
        }
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (is(node, name)) {
                return (Element) node;
            }
        }
        return null;
    }

    /**
     * Follows a path of child names, for example {@code path(root, "Identification", "Chapter")}.
     */
    public static Element path(Element start, String... names) {
        Element current = start;
        for (String name : names) {
            current = child(current, name);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    /**
     * All descendants with the given local name, in document order. The start element
     * itself is not included.
     */
    public static List<Element> descendants(Element start, String name) {
        List<Element> result = new ArrayList<>();
        collect(start, name, result);
        return result;
    }

    private static void collect(Element parent, String name, List<Element> out) {
        for (Element child : children(parent)) {
            if (localName(child).equals(name)) {
                out.add(child);
            }
            collect(child, name, out);
        }
    }

    public static boolean hasDescendant(Element start, String name) {
        for (Element child : children(start)) {
            if (localName(child).equals(name) || hasDescendant(child, name)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Attribute value, or null when the attribute is absent or empty.
     */
    public static String attr(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        String value = element.getAttribute(name);
        return value.isEmpty() ? null : value;
    }

    public static Integer intAttr(Element element, String name) {
        String value = attr(element, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * {@code yes}/{@code no} attribute as a Boolean; null when absent.
     */
    public static Boolean yesNoAttr(Element element, String name) {
        String value = attr(element, name);
        if (value == null) {
            return null;
        }
        return "yes".equalsIgnoreCase(value) || "true".equalsIgnoreCase(value);
    }
}
