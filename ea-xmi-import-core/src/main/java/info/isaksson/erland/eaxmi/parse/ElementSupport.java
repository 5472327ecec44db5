package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.SyntheticIds;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Attr;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Lookups shared by the element and relationship parsers (guid, stereotype, documentation, owner). */
public final class ElementSupport {

    public static final List<String> GUID_ATTRS = List.of("ea_guid", "ea:guid", "guid");
    public static final List<String> STEREOTYPE_ATTRS = List.of("stereotype", "stereotypes", "xmi:stereotype");
    public static final List<String> DOCUMENTATION_ATTRS = List.of("documentation", "doc", "notes", "note");
    public static final List<String> BASE_ATTRS = List.of(
            "base_Class", "base_Element", "base_Classifier", "base_Activity", "base_Action",
            "base_Package", "base_Event", "base_Node", "base");

    private static final Pattern HEX_ENTITY = Pattern.compile("&#x([0-9a-fA-F]+);");
    private static final Pattern DEC_ENTITY = Pattern.compile("&#(\\d+);");

    private ElementSupport() {}

    public static String guid(Element el) {
        return XmlDom.attrAny(el, GUID_ATTRS);
    }

    /** Metaclass part of an {@code xmi:type} ({@code uml:Class} gives {@code Class}). */
    public static String metaclassFromXmiType(String xmiType) {
        String t = XmlDom.blankToNull(xmiType);
        if (t == null) return null;
        int idx = t.indexOf(':');
        return XmlDom.blankToNull(idx >= 0 ? t.substring(idx + 1) : t);
    }

    /** True for {@code <package>} or a {@code packagedElement} typed as a UML package. */
    public static boolean isPackage(Element el) {
        String ln = XmlDom.localName(el);
        if (ln.equals("package")) return true;
        if (!ln.equals("packagedelement")) return false;
        String t = lower(XmlDom.xmiType(el));
        return t.equals("uml:package") || t.endsWith(":package") || t.equals("package");
    }

    public static boolean isInsideExtension(Element el) {
        return XmlDom.hasAncestor(el, "extension");
    }

    /** Folder id of the nearest package ancestor (its xmi:id or side-table id), or null. */
    public static String owningFolderId(Element el, SyntheticIds synthetic) {
        for (Element p = XmlDom.parentElement(el); p != null; p = XmlDom.parentElement(p)) {
            if (isPackage(p)) return synthetic.idOf(p);
        }
        return null;
    }

    /**
     * Stereotype from the element attributes, then a {@code properties} child, then the EA
     * extension index keyed by xmi:id.
     */
    public static String stereotype(Element el, Map<String, String> extensionStereotypes) {
        String direct = XmlDom.attrAny(el, STEREOTYPE_ATTRS);
        if (direct != null) return direct;
        for (Element props : XmlDom.childrenByLocalName(el, "properties")) {
            String st = XmlDom.attrAny(props, STEREOTYPE_ATTRS);
            if (st != null) return st;
        }
        String id = XmlDom.xmiId(el);
        if (id != null && extensionStereotypes != null) return extensionStereotypes.get(id);
        return null;
    }

    /**
     * Documentation in priority order: any child {@code ownedComment/body}, then a direct
     * {@code body}, the documentation attributes, a deeper {@code ownedComment}, a
     * {@code properties} child, then the EA extension index.
     */
    public static String documentation(Element el, Map<String, String> extensionDocs) {
        for (Element ch : XmlDom.children(el)) {
            String ln = XmlDom.localName(ch);
            if (ln.equals("ownedcomment") || ln.equals("comment")) {
                String body = commentBody(ch);
                if (body != null) return body;
            }
        }
        for (Element ch : XmlDom.children(el)) {
            if (XmlDom.localName(ch).equals("body")) {
                String t = XmlDom.blankToNull(XmlDom.text(ch));
                if (t != null) return t;
            }
        }

        String attrDoc = XmlDom.attrAny(el, DOCUMENTATION_ATTRS);
        if (attrDoc != null) return attrDoc;

        Element deep = XmlDom.firstDescendantByLocalName(el, "ownedComment");
        if (deep != null) {
            String body = commentBody(deep);
            if (body != null) return body;
        }

        for (Element props : XmlDom.childrenByLocalName(el, "properties")) {
            String pd = XmlDom.attrAny(props, DOCUMENTATION_ATTRS);
            if (pd != null) return pd;
        }

        String id = XmlDom.xmiId(el);
        if (id != null && extensionDocs != null) return extensionDocs.get(id);
        return null;
    }

    private static String commentBody(Element comment) {
        String body = XmlDom.childText(comment, "body");
        if (body != null) return body;
        return XmlDom.attrTrim(comment, "body");
    }

    /** {@code base_*} reference of a stereotype application, or null. */
    public static String baseRefId(Element el) {
        String direct = XmlDom.attrAny(el, BASE_ATTRS);
        if (direct != null) return direct;
        NamedNodeMap attrs = el.getAttributes();
        for (int i = 0; i < attrs.getLength(); i++) {
            Attr a = (Attr) attrs.item(i);
            String n = a.getName().toLowerCase(Locale.ROOT);
            if (n.equals("base") || n.startsWith("base_")) {
                String v = XmlDom.blankToNull(a.getValue());
                if (v != null) return v;
            }
        }
        return null;
    }

    /** Decodes {@code &#246;} / {@code &#xF6;} references that EA leaves in attribute text. */
    public static String decodeNumericEntities(String input) {
        if (input == null || input.indexOf("&#") < 0) return input;
        String out = replaceEntities(HEX_ENTITY, input, 16);
        return replaceEntities(DEC_ENTITY, out, 10);
    }

    private static String replaceEntities(Pattern p, String s, int radix) {
        Matcher m = p.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String repl;
            try {
                repl = new String(Character.toChars(Integer.parseInt(m.group(1), radix)));
            } catch (IllegalArgumentException e) {
                repl = m.group();
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(repl));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    /**
     * Index of {@code xmi:Extension//element[@xmi:idref]/properties} attribute values (first of
     * {@code attrNames} present), keyed by idref. First record per idref wins.
     */
    static Map<String, String> buildExtensionPropertyIndex(Document doc, List<String> attrNames) {
        Map<String, String> out = new LinkedHashMap<>();
        if (doc == null || doc.getDocumentElement() == null) return out;
        for (Element el : XmlDom.descendantsByLocalName(doc.getDocumentElement(), "element")) {
            if (!isInsideExtension(el)) continue;
            String idref = XmlDom.attrAny(el, List.of("xmi:idref", "idref"));
            if (idref == null || out.containsKey(idref)) continue;
            for (Element props : XmlDom.childrenByLocalName(el, "properties")) {
                String v = XmlDom.attrAny(props, attrNames);
                if (v != null) {
                    out.put(idref, decodeNumericEntities(v));
                    break;
                }
            }
        }
        return Collections.unmodifiableMap(out);
    }

    /** First line of {@code text}, at most {@code max} characters, trimmed; null when empty. */
    public static String firstLine(String text, int max) {
        if (text == null) return null;
        String line = text.split("\\r?\\n", 2)[0];
        if (line.length() > max) line = line.substring(0, max);
        return XmlDom.blankToNull(line);
    }

    static String lower(String s) {
        return s == null ? "" : s.toLowerCase(Locale.ROOT);
    }
}
