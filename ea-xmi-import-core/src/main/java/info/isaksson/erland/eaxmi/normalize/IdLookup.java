package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrRelationship;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Token to IR id lookup in three tiers: exact ids, then exact external ids, then the
 * {@link RefTokens#variants} forms of both. Within a tier the first entity registering a token
 * keeps it; an exact id is never shadowed by another entity's external id or variant.
 */
public final class IdLookup {

    /** A lookup hit: the IR id and the raw candidate it was found from. */
    public static final class Hit {
        public final String id;
        public final String from;

        Hit(String id, String from) {
            this.id = id;
            this.from = from;
        }
    }

    private final Map<String, String> byId = new HashMap<>();
    private final Map<String, String> byExternalId = new HashMap<>();
    private final Map<String, String> byVariant = new HashMap<>();

    public static IdLookup ofElements(List<IrElement> elements) {
        IdLookup l = new IdLookup();
        for (IrElement e : elements) {
            if (e != null && e.id != null) l.add(e.id, e.externalIds);
        }
        return l;
    }

    public static IdLookup ofRelationships(List<IrRelationship> relationships) {
        IdLookup l = new IdLookup();
        for (IrRelationship r : relationships) {
            if (r != null && r.id != null) l.add(r.id, r.externalIds);
        }
        return l;
    }

    private void add(String id, List<IrExternalId> externalIds) {
        byId.putIfAbsent(id, id);
        putVariants(id, id);
        for (IrExternalId x : externalIds) {
            if (x == null || x.id == null) continue;
            byExternalId.putIfAbsent(x.id, id);
            putVariants(x.id, id);
        }
    }

    private void putVariants(String token, String id) {
        for (String v : RefTokens.variants(token)) byVariant.putIfAbsent(v, id);
    }

    /** IR id for {@code token}: exact id, exact external id, then any variant; or null. */
    public String get(String token) {
        if (token == null) return null;
        String t = token.trim();
        String hit = byId.get(t);
        if (hit != null) return hit;
        hit = byExternalId.get(t);
        if (hit != null) return hit;
        for (String v : RefTokens.variants(t)) {
            hit = byVariant.get(v);
            if (hit != null) return hit;
        }
        return null;
    }

    /** First candidate (in order) that resolves, or null. */
    public Hit first(List<String> candidates) {
        for (String c : candidates) {
            String hit = get(c);
            if (hit != null) return new Hit(hit, c);
        }
        return null;
    }

    public boolean containsAny(List<String> candidates) {
        return first(candidates) != null;
    }
}
