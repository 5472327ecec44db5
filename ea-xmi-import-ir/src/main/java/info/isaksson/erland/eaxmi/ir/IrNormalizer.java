package info.isaksson.erland.eaxmi.ir;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Produces a stable, deterministic ordering of the top-level IR lists so JSON output is reproducible.
 *
 * <p>Folders, elements and views are ordered by id; relationships by (type, sourceId, targetId, name, id);
 * tagged values by key.</p>
 *
 * <p>IMPORTANT: view nodes, connections, points, external ids and UML members keep their source order
 * (nodes are ordered containers-first for rendering, members as declared).</p>
 */
public final class IrNormalizer {

    private IrNormalizer() {}

    public static IrModel normalize(IrModel in) {
        if (in == null) return null;
        return new IrModel(
                normalizeFolders(in.folders),
                normalizeElements(in.elements),
                normalizeRelationships(in.relationships),
                normalizeViews(in.views),
                in.meta
        );
    }

    private static List<IrFolder> normalizeFolders(List<IrFolder> in) {
        if (in == null) return List.of();
        List<IrFolder> out = new ArrayList<>(in.size());
        for (IrFolder f : in) {
            if (f == null) continue;
            out.add(new IrFolder(f.id, f.name, f.parentId, f.documentation, f.externalIds,
                    normalizeTaggedValues(f.taggedValues), f.meta));
        }
        out.sort(Comparator
                .comparing((IrFolder f) -> safe(f.id))
                .thenComparing(f -> safe(f.name)));
        return List.copyOf(out);
    }

    private static List<IrElement> normalizeElements(List<IrElement> in) {
        if (in == null) return List.of();
        List<IrElement> out = new ArrayList<>(in.size());
        for (IrElement e : in) {
            if (e == null) continue;
            out.add(new IrElement(e.id, e.type, e.name, e.documentation, e.folderId, e.externalIds,
                    normalizeTaggedValues(e.taggedValues), e.attrs, e.meta));
        }
        out.sort(Comparator
                .comparing((IrElement e) -> safe(e.id))
                .thenComparing(e -> safe(e.type)));
        return List.copyOf(out);
    }

    private static List<IrRelationship> normalizeRelationships(List<IrRelationship> in) {
        if (in == null) return List.of();
        List<IrRelationship> out = new ArrayList<>(in.size());
        for (IrRelationship r : in) {
            if (r == null) continue;
            out.add(new IrRelationship(r.id, r.type, r.sourceId, r.targetId, r.name, r.documentation,
                    r.externalIds, normalizeTaggedValues(r.taggedValues), r.attrs, r.meta));
        }
        out.sort(Comparator
                .comparing((IrRelationship r) -> safe(r.type))
                .thenComparing(r -> safe(r.sourceId))
                .thenComparing(r -> safe(r.targetId))
                .thenComparing(r -> safe(r.name))
                .thenComparing(r -> safe(r.id)));
        return List.copyOf(out);
    }

    private static List<IrView> normalizeViews(List<IrView> in) {
        if (in == null) return List.of();
        List<IrView> out = new ArrayList<>(in.size());
        for (IrView v : in) {
            if (v != null) out.add(v);
        }
        out.sort(Comparator
                .comparing((IrView v) -> safe(v.id))
                .thenComparing(v -> safe(v.name)));
        return List.copyOf(out);
    }

    private static List<IrTaggedValue> normalizeTaggedValues(List<IrTaggedValue> in) {
        if (in == null) return List.of();
        List<IrTaggedValue> out = new ArrayList<>(in.size());
        for (IrTaggedValue t : in) {
            if (t == null) continue;
            out.add(new IrTaggedValue(t.key, t.value));
        }
        out.sort(Comparator
                .comparing((IrTaggedValue t) -> safe(t.key))
                .thenComparing(t -> safe(t.value)));
        return List.copyOf(out);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }
}
