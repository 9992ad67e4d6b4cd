package com.controlsdashboard.oscal;

import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.ArrayList;
import java.util.List;

/**
 * Tree lookups over an OSCAL DOM.
 *
 * <p>Elements are matched by local name inside the OSCAL namespace; elements with no namespace
 * also match so hand-written fixtures and namespace-less exports read the same way. Text helpers
 * follow the element-tree model: an element's <em>text</em> is the character data before its first
 * child element, and its <em>tail</em> is the character data between its end tag and the next
 * sibling element.
 */
public final class OscalXml {

    public static final String NAMESPACE = "http://csrc.nist.gov/ns/oscal/1.0";

    private OscalXml() {
    }

    /**
     * Returns true when {@code node} is an OSCAL element with the given local name.
     */
    public static boolean is(Node node, String localName) {
        if (node == null || node.getNodeType() != Node.ELEMENT_NODE) {
            return false;
        }
        String ns = node.getNamespaceURI();
        if (ns != null && !NAMESPACE.equals(ns)) {
            return false;
        }
        String name = node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
        return localName.equals(name);
    }

    /**
     * Direct child elements with the given local name, in document order.
     */
    public static List<Element> children(Element parent, String localName) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, localName)) {
                result.add((Element) child);
            }
        }
        return result;
    }

    /**
     * All direct child elements regardless of name.
     */
    public static List<Element> childElements(Element parent) {
        List<Element> result = new ArrayList<>();
        if (parent == null) {
            return result;
        }
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                result.add((Element) child);
            }
        }
        return result;
    }

    public static Element firstChild(Element parent, String localName) {
        if (parent == null) {
            return null;
        }
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (is(child, localName)) {
                return (Element) child;
            }
        }
        return null;
    }

    /**
     * Descendant elements (excluding {@code root}) with the given local name, in document order.
     */
    public static List<Element> descendants(Element root, String localName) {
        List<Element> result = new ArrayList<>();
        if (root != null) {
            collectDescendants(root, localName, null, result);
        }
        return result;
    }

    /**
     * Like {@link #descendants(Element, String)} but does not enter elements named {@code barrier}.
     * A barrier element that itself matches {@code localName} is still returned.
     */
    public static List<Element> descendantsWithin(Element root, String localName, String barrier) {
        List<Element> result = new ArrayList<>();
        if (root != null) {
            collectDescendants(root, localName, barrier, result);
        }
        return result;
    }

    private static void collectDescendants(Element parent, String localName, String barrier, List<Element> out) {
        for (Node child = parent.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() != Node.ELEMENT_NODE) {
                continue;
            }
            Element element = (Element) child;
            if (is(element, localName)) {
                out.add(element);
            }
            if (barrier == null || !is(element, barrier)) {
                collectDescendants(element, localName, barrier, out);
            }
        }
    }

    /**
     * Nearest ancestor element with the given local name, or null.
     */
    public static Element nearestAncestor(Element element, String localName) {
        Node current = element == null ? null : element.getParentNode();
        while (current != null) {
            if (is(current, localName)) {
                return (Element) current;
            }
            current = current.getParentNode();
        }
        return null;
    }

    /**
     * Attribute value, or null when the attribute is absent.
     */
    public static String attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return null;
        }
        return element.getAttribute(name);
    }

    /**
     * Character data before the first child element, or null when there is none.
     */
    public static String text(Element element) {
        if (element == null) {
            return null;
        }
        StringBuilder sb = null;
        for (Node child = element.getFirstChild(); child != null; child = child.getNextSibling()) {
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                break;
            }
            if (isCharacterData(child)) {
                if (sb == null) {
                    sb = new StringBuilder();
                }
                sb.append(child.getNodeValue());
            }
        }
        return sb == null ? null : sb.toString();
    }

    /**
     * Character data following {@code node} up to the next sibling element, or null when there is none.
     */
    public static String tail(Node node) {
        if (node == null) {
            return null;
        }
        StringBuilder sb = null;
        for (Node sibling = node.getNextSibling(); sibling != null; sibling = sibling.getNextSibling()) {
            if (sibling.getNodeType() == Node.ELEMENT_NODE) {
                break;
            }
            if (isCharacterData(sibling)) {
                if (sb == null) {
                    sb = new StringBuilder();
                }
                sb.append(sibling.getNodeValue());
            }
        }
        return sb == null ? null : sb.toString();
    }

    /**
     * The element's own text, then for every child element its full text followed by its tail.
     */
    public static String fullText(Element element) {
        if (element == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        appendFullText(element, sb);
        return sb.toString();
    }

    private static void appendFullText(Element element, StringBuilder sb) {
        String text = text(element);
        if (text != null) {
            sb.append(text);
        }
        for (Element child : childElements(element)) {
            appendFullText(child, sb);
            String tail = tail(child);
            if (tail != null) {
                sb.append(tail);
            }
        }
    }

    /**
     * Text of the first direct child with the given name, or null when that child is absent.
     */
    public static String childText(Element parent, String localName) {
        Element child = firstChild(parent, localName);
        if (child == null) {
            return null;
        }
        String text = text(child);
        return text == null ? "" : text;
    }

    /**
     * Trimmed text of the first direct child, or null when the child is absent or has no text.
     */
    public static String trimmedChildText(Element parent, String localName) {
        Element child = firstChild(parent, localName);
        String text = text(child);
        return text == null ? null : text.strip();
    }

    /**
     * Positional path from {@code ancestor} down to {@code element}, e.g. {@code part[0]/part[2]/prop[1]}.
     * Indexes count same-named element siblings.
     */
    public static String elementPath(Element ancestor, Element element) {
        List<String> segments = new ArrayList<>();
        Node current = element;
        while (current != null && current != ancestor && current.getNodeType() == Node.ELEMENT_NODE) {
            segments.add(0, localName(current) + "[" + siblingIndex((Element) current) + "]");
            current = current.getParentNode();
        }
        return String.join("/", segments);
    }

    private static int siblingIndex(Element element) {
        int index = 0;
        String name = localName(element);
        for (Node prev = element.getPreviousSibling(); prev != null; prev = prev.getPreviousSibling()) {
            if (prev.getNodeType() == Node.ELEMENT_NODE && name.equals(localName(prev))) {
                index++;
            }
        }
        return index;
    }

    private static String localName(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static boolean isCharacterData(Node node) {
        short type = node.getNodeType();
        return type == Node.TEXT_NODE || type == Node.CDATA_SECTION_NODE;
    }
}
