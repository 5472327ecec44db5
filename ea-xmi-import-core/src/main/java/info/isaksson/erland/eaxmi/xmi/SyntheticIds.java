package info.isaksson.erland.eaxmi.xmi;

import org.w3c.dom.Element;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Side table of ids generated for source elements that carry none.
 *
 * <p>Keyed by DOM node identity, so later passes (folder lookup for contained elements, owner
 * lookup for relationships) see the same id without the document ever being modified. Counters are
 * per prefix and start at 1. One instance per import.</p>
 */
public final class SyntheticIds {

    private final Map<Element, String> assigned = new IdentityHashMap<>();
    private final Map<String, Integer> counters = new HashMap<>();

    /** Next value of the counter for {@code prefix}. */
    public int nextNumber(String prefix) {
        return counters.merge(prefix, 1, Integer::sum);
    }

    /** A fresh {@code <prefix>_<n>} id that is not bound to any node. */
    public String next(String prefix) {
        return prefix + "_" + nextNumber(prefix);
    }

    /** Id already assigned to {@code el}, or a new {@code <prefix>_<n>} bound to it. */
    public String assign(Element el, String prefix) {
        String existing = assigned.get(el);
        if (existing != null) return existing;
        String id = next(prefix);
        assigned.put(el, id);
        return id;
    }

    /** Binds a caller-built id to {@code el}; an existing binding is kept. */
    public String bind(Element el, String id) {
        String existing = assigned.putIfAbsent(el, id);
        return existing != null ? existing : id;
    }

    public String lookup(Element el) {
        return el == null ? null : assigned.get(el);
    }

    /** {@code xmi:id} of the element, else its side-table id, else null. */
    public String idOf(Element el) {
        String id = XmlDom.xmiId(el);
        return id != null ? id : lookup(el);
    }

    public int size() {
        return assigned.size();
    }
}
