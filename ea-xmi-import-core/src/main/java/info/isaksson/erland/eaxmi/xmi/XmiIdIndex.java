package info.isaksson.erland.eaxmi.xmi;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Document-wide lookup tables keyed by {@code xmi:id} (or a plain {@code id}).
 *
 * <p>Built in one pass over all descendants. The first element carrying a given id wins, so
 * repeated builds over the same document give identical tables.</p>
 */
public final class XmiIdIndex {

    private final Map<String, Element> byId;
    private final Map<String, String> names;

    private XmiIdIndex(Map<String, Element> byId, Map<String, String> names) {
        this.byId = byId;
        this.names = names;
    }

    public static XmiIdIndex build(Document doc) {
        Map<String, Element> byId = new LinkedHashMap<>();
        Map<String, String> names = new LinkedHashMap<>();
        if (doc == null || doc.getDocumentElement() == null) return new XmiIdIndex(byId, names);

        List<Element> all = new ArrayList<>();
        all.add(doc.getDocumentElement());
        all.addAll(XmlDom.descendants(doc.getDocumentElement()));
        for (Element el : all) {
            String id = idOf(el);
            if (id == null || byId.containsKey(id)) continue;
            byId.put(id, el);
            String name = XmlDom.blankToNull(XmlDom.attrExact(el, "name"));
            if (name != null) names.put(id, name);
        }
        return new XmiIdIndex(Collections.unmodifiableMap(byId), Collections.unmodifiableMap(names));
    }

    private static String idOf(Element el) {
        String id = XmlDom.xmiId(el);
        return id != null ? id : XmlDom.blankToNull(XmlDom.attrExact(el, "id"));
    }

    /** Element for a (trimmed) id; null for blank or unknown ids. */
    public Element resolve(String id) {
        String key = XmlDom.blankToNull(id);
        return key == null ? null : byId.get(key);
    }

    /** Trimmed {@code name} of the element with this id, or null. */
    public String name(String id) {
        String key = XmlDom.blankToNull(id);
        return key == null ? null : names.get(key);
    }

    public boolean contains(String id) {
        return resolve(id) != null;
    }

    public Map<String, Element> asMap() {
        return byId;
    }

    public Map<String, String> names() {
        return names;
    }

    public int size() {
        return byId.size();
    }

    /** Whitespace separated id list (as in {@code memberEnd="a b"}); order and duplicates preserved. */
    public static List<String> parseIdRefList(String value) {
        if (value == null || value.isBlank()) return List.of();
        List<String> out = new ArrayList<>();
        for (String s : value.trim().split("\\s+")) {
            if (!s.isEmpty()) out.add(s);
        }
        return out;
    }

    /** Fragment after {@code #} of an href, or null. */
    public static String resolveHrefId(String href) {
        if (href == null) return null;
        int i = href.indexOf('#');
        if (i < 0) return null;
        return XmlDom.blankToNull(href.substring(i + 1));
    }
}
