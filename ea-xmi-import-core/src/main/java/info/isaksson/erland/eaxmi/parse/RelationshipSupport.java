package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.SyntheticIds;
import info.isaksson.erland.eaxmi.xmi.XmiIdIndex;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Locale;

/** Endpoint and payload lookups shared by the relationship parsers. */
public final class RelationshipSupport {

    public static final List<String> EA_TYPE_ATTRS = List.of("ea_type", "ea:ea_type");
    public static final List<String> BASE_ATTRS = List.of(
            "base_Association", "base_Dependency", "base_Relationship", "base_Connector",
            "base_Abstraction", "base_Realization", "base_Usage", "base_ControlFlow", "base_InformationFlow", "base");

    private RelationshipSupport() {}

    /**
     * Ids for a reference key: the attribute as a whitespace separated list, else a child
     * {@code <key xmi:idref>} or {@code <key href="#id">}.
     */
    public static List<String> refIds(Element el, String key) {
        String direct = XmlDom.attrAny(el, List.of(key, key.toLowerCase(Locale.ROOT)));
        if (direct != null) return XmiIdIndex.parseIdRefList(direct);
        for (Element ch : XmlDom.childrenByLocalName(el, key)) {
            String ref = childRef(ch);
            if (ref != null) return List.of(ref);
        }
        return List.of();
    }

    /** First endpoint id over {@code keys}: attributes in key order, then matching children. */
    public static String endpointId(Element el, List<String> keys) {
        String direct = XmlDom.attrAny(el, keys);
        if (direct != null) return direct;
        for (Element ch : XmlDom.children(el)) {
            String ln = XmlDom.localName(ch);
            for (String k : keys) {
                if (ln.equals(k.toLowerCase(Locale.ROOT))) {
                    String ref = childRef(ch);
                    if (ref != null) return ref;
                }
            }
        }
        return null;
    }

    /** {@code xmi:idref} of a reference child, else the fragment of its href. */
    public static String childRef(Element ch) {
        String idref = XmlDom.xmiIdRef(ch);
        if (idref != null) return idref;
        return XmiIdIndex.resolveHrefId(XmlDom.attrTrim(ch, "href"));
    }

    /** EA connector type hint ({@code ea_type} on the element or a {@code properties} child). */
    public static String eaTypeHint(Element el) {
        String direct = XmlDom.attrAny(el, EA_TYPE_ATTRS);
        if (direct != null) return direct;
        for (Element props : XmlDom.childrenByLocalName(el, "properties")) {
            String v = XmlDom.attrAny(props, EA_TYPE_ATTRS);
            if (v != null) return v;
        }
        return null;
    }

    /** Guard text: attribute, {@code properties@guard|condition}, then {@code guard/specification}. */
    public static String guardText(Element edge) {
        String attrGuard = XmlDom.attrAny(edge, List.of("guard", "Guard"));
        if (attrGuard != null) return attrGuard;

        for (Element props : XmlDom.childrenByLocalName(edge, "properties")) {
            String g = XmlDom.attrAny(props, List.of("guard", "Guard", "condition", "Condition"));
            if (g != null) return g;
        }

        for (Element guard : XmlDom.childrenByLocalName(edge, "guard")) {
            for (Element spec : XmlDom.descendants(guard)) {
                String ln = XmlDom.localName(spec);
                if (!ln.equals("specification") && !ln.equals("body")) continue;
                String body = XmlDom.attrExact(spec, "body");
                if (XmlDom.blankToNull(body) != null) return body.trim();
                if (ln.equals("body")) {
                    String txt = XmlDom.blankToNull(XmlDom.text(spec));
                    if (txt != null) return txt;
                }
            }
            String text = XmlDom.blankToNull(XmlDom.text(guard));
            if (text != null) return text;
        }
        return null;
    }

    /** Nearest ancestor typed {@code uml:*} that is not a package (its xmi:id or side-table id). */
    public static String owningClassifierId(Element el, SyntheticIds synthetic) {
        for (Element p = XmlDom.parentElement(el); p != null; p = XmlDom.parentElement(p)) {
            String xmiType = XmlDom.xmiType(p);
            if (xmiType == null || !xmiType.toLowerCase(Locale.ROOT).startsWith("uml:")) continue;
            String metaclass = ElementSupport.metaclassFromXmiType(xmiType);
            if (metaclass != null && !metaclass.equalsIgnoreCase("package") && !metaclass.equalsIgnoreCase("model")) {
                return synthetic.idOf(p);
            }
        }
        return null;
    }

    /** {@code base_*} connector reference of a profile relationship record. */
    public static String baseConnectorRef(Element el) {
        String direct = XmlDom.attrAny(el, BASE_ATTRS);
        return direct != null ? direct : ElementSupport.baseRefId(el);
    }

    public static boolean inProfileNamespace(Element el) {
        String uri = el.getNamespaceURI();
        return uri != null && uri.toLowerCase(Locale.ROOT).contains("sparxsystems.com/profiles/");
    }
}
