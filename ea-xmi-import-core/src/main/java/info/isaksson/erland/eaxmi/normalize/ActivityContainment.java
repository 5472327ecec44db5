package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import info.isaksson.erland.eaxmi.parse.UmlTypes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Activity ownership derived from activity diagrams.
 *
 * <p>In a view whose viewpoint mentions {@code activity}, the {@code uml.activity} node with the
 * largest bounds is the container. Every activity node shown in that view gets
 * {@code attrs.activityId}; the activity gets {@code attrs.ownedNodeRefs}. A node claimed by
 * several activities keeps the first, and an existing {@code activityId} is never replaced.</p>
 */
final class ActivityContainment {

    static final String ATTR_ACTIVITY_ID = "activityId";
    static final String ATTR_OWNED_NODE_REFS = "ownedNodeRefs";

    private ActivityContainment() {}

    static List<IrElement> apply(List<IrElement> elements, List<IrView> views) {
        Map<String, IrElement> byId = new HashMap<>();
        for (IrElement e : elements) byId.put(e.id, e);

        Map<String, Set<String>> ownedByActivity = new LinkedHashMap<>();
        for (IrView v : views) {
            if (!isActivityView(v)) continue;
            String activityId = container(v, byId);
            if (activityId == null) continue;
            Set<String> owned = new LinkedHashSet<>();
            for (IrViewNode n : v.nodes) {
                IrElement el = n.elementId == null ? null : byId.get(n.elementId);
                if (el != null && UmlTypes.ACTIVITY_NODES.contains(el.type)) owned.add(el.id);
            }
            if (!owned.isEmpty()) ownedByActivity.computeIfAbsent(activityId, k -> new LinkedHashSet<>()).addAll(owned);
        }
        if (ownedByActivity.isEmpty()) return elements;

        Map<String, String> activityByNode = new HashMap<>();
        for (Map.Entry<String, Set<String>> e : ownedByActivity.entrySet()) {
            for (String nodeId : e.getValue()) activityByNode.putIfAbsent(nodeId, e.getKey());
        }

        List<IrElement> out = new ArrayList<>(elements.size());
        for (IrElement e : elements) {
            Set<String> owned = ownedByActivity.get(e.id);
            String activityId = activityByNode.get(e.id);
            if (owned != null && UmlTypes.ACTIVITY.equals(e.type)) {
                Map<String, Object> attrs = new LinkedHashMap<>(e.attrs);
                attrs.put(ATTR_OWNED_NODE_REFS, new ArrayList<>(owned));
                out.add(e.withAttrs(attrs));
            } else if (activityId != null && UmlTypes.ACTIVITY_NODES.contains(e.type) && !e.attrs.containsKey(ATTR_ACTIVITY_ID)) {
                Map<String, Object> attrs = new LinkedHashMap<>(e.attrs);
                attrs.put(ATTR_ACTIVITY_ID, activityId);
                out.add(e.withAttrs(attrs));
            } else {
                out.add(e);
            }
        }
        return out;
    }

    static boolean isActivityView(IrView v) {
        return v.viewpoint != null && v.viewpoint.toLowerCase(Locale.ROOT).contains("activity");
    }

    private static String container(IrView v, Map<String, IrElement> byId) {
        String best = null;
        double bestArea = -1;
        for (IrViewNode n : v.nodes) {
            IrElement el = n.elementId == null ? null : byId.get(n.elementId);
            if (el == null || !UmlTypes.ACTIVITY.equals(el.type)) continue;
            double area = n.bounds == null ? 0 : n.bounds.area();
            if (area > bestArea) {
                best = el.id;
                bestArea = area;
            }
        }
        return best;
    }
}
