package info.isaksson.erland.eaxmi.xmi;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;

/**
 * Namespace-tolerant DOM helpers.
 *
 * <p>EA exports vary in prefixes and casing, so elements are matched by lower-cased local name and
 * attributes by name, case-insensitive name, or {@code :name} suffix. Candidate attribute names are
 * kept as ordered lists by the callers and queried through {@link #attrAny(Element, List)}.</p>
 */
public final class XmlDom {

    private static final Logger LOG = LoggerFactory.getLogger(XmlDom.class);

    private XmlDom() {}

    /**
     * Parse a whole document into memory (namespace aware, no external entities).
     *
     * @throws SAXException on malformed XML
     */
    public static Document parse(String xml) throws SAXException {
        if (xml == null) throw new IllegalArgumentException("xml must not be null");
        DocumentBuilder builder = newBuilder();
        try {
            return builder.parse(new InputSource(new StringReader(stripBom(xml))));
        } catch (IOException e) {
            // StringReader does not fail; surface anything unexpected as a parse failure.
            throw new SAXException("Could not read XML text: " + e.getMessage(), e);
        }
    }

    private static DocumentBuilder newBuilder() throws SAXException {
        DocumentBuilderFactory dbf = DocumentBuilderFactory.newInstance();
        dbf.setNamespaceAware(true);
        dbf.setExpandEntityReferences(false);
        dbf.setXIncludeAware(false);
        setFeature(dbf, "http://xml.org/sax/features/external-general-entities", false);
        setFeature(dbf, "http://xml.org/sax/features/external-parameter-entities", false);
        setFeature(dbf, "http://apache.org/xml/features/nonvalidating/load-external-dtd", false);
        dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_DTD, "");
        dbf.setAttribute(XMLConstants.ACCESS_EXTERNAL_SCHEMA, "");
        try {
            DocumentBuilder b = dbf.newDocumentBuilder();
            b.setErrorHandler(new ErrorHandler() {
                @Override public void warning(SAXParseException e) {
                    LOG.debug("XML parser warning at line {}: {}", e.getLineNumber(), e.getMessage());
                }

                @Override public void error(SAXParseException e) throws SAXException {
                    throw e;
                }

                @Override public void fatalError(SAXParseException e) throws SAXException {
                    throw e;
                }
            });
            return b;
        } catch (ParserConfigurationException e) {
            throw new SAXException("XML parser is not available: " + e.getMessage(), e);
        }
    }

    private static void setFeature(DocumentBuilderFactory dbf, String feature, boolean value) {
        try {
            dbf.setFeature(feature, value);
        } catch (ParserConfigurationException e) {
            LOG.debug("XML parser does not support feature {}", feature);
        }
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '﻿' ? s.substring(1) : s;
    }

    /** Lower-cased local name (falls back to the tag name). */
    public static String localName(Element el) {
        if (el == null) return "";
        String ln = el.getLocalName();
        if (ln == null || ln.isEmpty()) ln = el.getTagName();
        return ln == null ? "" : ln.toLowerCase(Locale.ROOT);
    }

    /**
     * Attribute value by name: exact qualified name, then case-insensitive name, then any attribute
     * whose name ends with {@code ":" + name}. Returns null when absent.
     */
    public static String attr(Element el, String name) {
        if (el == null || name == null) return null;
        if (el.hasAttribute(name)) return el.getAttribute(name);
        String needle = name.toLowerCase(Locale.ROOT);
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            String an = a.getName().toLowerCase(Locale.ROOT);
            if (an.equals(needle) || an.endsWith(":" + needle)) return a.getValue();
        }
        return null;
    }

    /** Like {@link #attr} but without the namespace-suffix match ({@code "type"} never hits {@code xmi:type}). */
    public static String attrExact(Element el, String name) {
        if (el == null || name == null) return null;
        if (el.hasAttribute(name)) return el.getAttribute(name);
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            if (a.getName().equalsIgnoreCase(name)) return a.getValue();
        }
        return null;
    }

    /** Trimmed non-blank attribute value, or null. */
    public static String attrTrim(Element el, String name) {
        return blankToNull(attr(el, name));
    }

    /** First candidate name (in list order) with a non-blank value, trimmed; null if none. */
    public static String attrAny(Element el, List<String> names) {
        if (el == null || names == null) return null;
        for (String name : names) {
            String v = blankToNull(attr(el, name));
            if (v != null) return v;
        }
        return null;
    }

    /** {@link #attrAny} over {@link #attrExact}; used for the short diagram keys ({@code l}, {@code x}, {@code type}). */
    public static String attrAnyExact(Element el, List<String> names) {
        if (el == null || names == null) return null;
        for (String name : names) {
            String v = blankToNull(attrExact(el, name));
            if (v != null) return v;
        }
        return null;
    }

    /** Candidate name that {@link #attrAny} would pick, or null. */
    public static String attrAnyKey(Element el, List<String> names) {
        if (el == null || names == null) return null;
        for (String name : names) {
            if (blankToNull(attr(el, name)) != null) return name;
        }
        return null;
    }

    public static String xmiId(Element el) {
        return attrTrim(el, "xmi:id");
    }

    public static String xmiIdRef(Element el) {
        return attrTrim(el, "xmi:idref");
    }

    public static String xmiType(Element el) {
        return attrTrim(el, "xmi:type");
    }

    /** Direct element children in document order. */
    public static List<Element> children(Element parent) {
        List<Element> out = new ArrayList<>();
        if (parent == null) return out;
        NodeList kids = parent.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node n = kids.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) out.add((Element) n);
        }
        return out;
    }

    public static List<Element> childrenByLocalName(Element parent, String childName) {
        String want = childName.toLowerCase(Locale.ROOT);
        List<Element> out = new ArrayList<>();
        for (Element c : children(parent)) {
            if (localName(c).equals(want)) out.add(c);
        }
        return out;
    }

    public static Element childByLocalName(Element parent, String childName) {
        List<Element> all = childrenByLocalName(parent, childName);
        return all.isEmpty() ? null : all.get(0);
    }

    /** All descendant elements of {@code root}, depth-first in document order (root itself excluded). */
    public static List<Element> descendants(Node root) {
        List<Element> out = new ArrayList<>();
        if (root == null) return out;
        Deque<Node> stack = new ArrayDeque<>();
        pushChildrenReversed(stack, root);
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            out.add((Element) n);
            pushChildrenReversed(stack, n);
        }
        return out;
    }

    private static void pushChildrenReversed(Deque<Node> stack, Node parent) {
        NodeList kids = parent.getChildNodes();
        for (int i = kids.getLength() - 1; i >= 0; i--) {
            Node n = kids.item(i);
            if (n.getNodeType() == Node.ELEMENT_NODE) stack.push(n);
        }
    }

    /** Descendants with a matching local name (case-insensitive), in document order. */
    public static List<Element> descendantsByLocalName(Node root, String name) {
        String want = name.toLowerCase(Locale.ROOT);
        List<Element> out = new ArrayList<>();
        for (Element e : descendants(root)) {
            if (localName(e).equals(want)) out.add(e);
        }
        return out;
    }

    public static Element firstDescendantByLocalName(Node root, String name) {
        List<Element> all = descendantsByLocalName(root, name);
        return all.isEmpty() ? null : all.get(0);
    }

    /** Parent element, or null at the document element. */
    public static Element parentElement(Element el) {
        if (el == null) return null;
        Node p = el.getParentNode();
        return p != null && p.getNodeType() == Node.ELEMENT_NODE ? (Element) p : null;
    }

    /** True when any ancestor (not the element itself) has the given local name. */
    public static boolean hasAncestor(Element el, String ancestorLocalName) {
        String want = ancestorLocalName.toLowerCase(Locale.ROOT);
        for (Element p = parentElement(el); p != null; p = parentElement(p)) {
            if (localName(p).equals(want)) return true;
        }
        return false;
    }

    /** Trimmed text content, never null. */
    public static String text(Element el) {
        if (el == null) return "";
        String t = el.getTextContent();
        return t == null ? "" : t.trim();
    }

    /**
     * Text of the first direct child with a matching local name, preferring {@code xml:lang="en*"}
     * when several exist. Null when absent or blank.
     */
    public static String childText(Element el, String childTag) {
        List<Element> matches = childrenByLocalName(el, childTag);
        if (matches.isEmpty()) return null;
        Element pick = matches.get(0);
        for (Element m : matches) {
            String lang = attrAny(m, List.of("xml:lang", "lang"));
            if (lang != null && lang.toLowerCase(Locale.ROOT).startsWith("en")) {
                pick = m;
                break;
            }
        }
        return blankToNull(text(pick));
    }

    public static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
