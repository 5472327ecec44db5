package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.xmi.XmiIdIndex;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Resolves member type references to display names.
 *
 * <p>Order: primitive name from an href URL, name of the referenced element, type hints on the
 * member itself, then the raw token when it reads like a type name. Internal ids and
 * {@code uml:}/{@code xmi:} tokens are never returned.</p>
 */
public final class TypeNameResolver {

    /** Resolved type: the raw reference as found, and the display name when one was found. */
    public static final class Resolution {
        public final String ref;
        public final String name;

        Resolution(String ref, String name) {
            this.ref = ref;
            this.name = name;
        }
    }

    private static final List<String> INTERNAL_PREFIXES = List.of("_", "EAID_", "EAPK_", "eaEl_synth_", "EAGen_");
    private static final Set<String> METACLASS_TOKENS = Set.of(
            "Property", "Class", "Association", "Dependency", "Activity", "Artifact", "Generalization");
    private static final List<String> PROPERTY_TYPE_ATTRS = List.of(
            "type", "datatype", "dataType", "typename", "typeName", "classifier", "classifierName");
    private static final Set<String> TAG_KEYS = Set.of(
            "type", "datatype", "datatypename", "typename", "classifier", "classifiername");

    private final XmiIdIndex ids;
    private final Map<String, String> cache = new HashMap<>();

    public TypeNameResolver(XmiIdIndex ids) {
        this.ids = ids;
    }

    public Resolution resolve(Element member) {
        String ref = readTypeRef(member);
        String name = ref == null ? null : resolveRef(ref, member);
        return new Resolution(isWrongToken(ref) ? null : ref, isWrongToken(name) ? null : name);
    }

    /** Type reference from {@code type="..."}, {@code <type xmi:idref>} or {@code <type href>}. */
    static String readTypeRef(Element el) {
        String direct = XmlDom.blankToNull(XmlDom.attrExact(el, "type"));
        if (direct != null && !isWrongToken(direct)) return direct;
        Element typeChild = XmlDom.childByLocalName(el, "type");
        if (typeChild != null) {
            String idref = XmlDom.xmiIdRef(typeChild);
            if (idref != null) return idref;
            String href = XmlDom.attrTrim(typeChild, "href");
            if (href != null) return href;
        }
        return null;
    }

    String resolveRef(String rawRef, Element context) {
        String ref = rawRef.trim();
        if (ref.isEmpty() || isWrongToken(ref)) return null;

        String hrefId = XmiIdIndex.resolveHrefId(ref);
        String id = hrefId != null ? hrefId : ref;
        String resolved = cache.computeIfAbsent(ref, r -> {
            String primitive = primitiveFromHref(r);
            return primitive != null ? primitive : ids.name(id);
        });
        // Member-local hints are not cached.
        if (resolved == null && context != null) resolved = fromContext(context);
        if (resolved == null && isReadableToken(id)) resolved = id;
        return isWrongToken(resolved) ? null : resolved;
    }

    private static String primitiveFromHref(String href) {
        if (!href.contains("://")) return null;
        String tail;
        int hash = href.lastIndexOf('#');
        if (hash >= 0 && hash < href.length() - 1) {
            tail = href.substring(hash + 1).trim();
        } else {
            String[] parts = href.split("/");
            tail = "";
            for (int i = parts.length - 1; i >= 0; i--) {
                if (!parts[i].isBlank()) {
                    tail = parts[i].trim();
                    break;
                }
            }
        }
        if (tail.isEmpty() || METACLASS_TOKENS.contains(tail)) return null;
        return isReadableToken(tail) ? tail : null;
    }

    private static String fromContext(Element context) {
        Element props = XmlDom.childByLocalName(context, "properties");
        if (props != null) {
            String t = XmlDom.attrAny(props, PROPERTY_TYPE_ATTRS);
            if (isReadableToken(t)) return t;
        }
        Element typeChild = XmlDom.childByLocalName(context, "type");
        if (typeChild != null) {
            String n = XmlDom.attrAny(typeChild, List.of("name", "typename", "typeName"));
            if (isReadableToken(n)) return n;
        }
        for (Element el : XmlDom.descendants(context)) {
            String key = XmlDom.attrAny(el, List.of("tag", "name", "key"));
            if (key == null || !TAG_KEYS.contains(key.toLowerCase(Locale.ROOT))) continue;
            String val = XmlDom.attrAny(el, List.of("value", "val", "body", "text"));
            if (val == null) val = XmlDom.blankToNull(XmlDom.text(el));
            if (isReadableToken(val)) return val;
        }
        return null;
    }

    static boolean isReadableToken(String s) {
        String v = XmlDom.blankToNull(s);
        if (v == null || v.length() > 120) return false;
        if (v.contains("://")) return false;
        if (isWrongToken(v)) return false;
        for (String p : INTERNAL_PREFIXES) {
            if (v.startsWith(p)) return false;
        }
        return true;
    }

    private static boolean isWrongToken(String s) {
        if (s == null) return false;
        String v = s.trim();
        return v.startsWith("uml:") || v.startsWith("xmi:");
    }
}
