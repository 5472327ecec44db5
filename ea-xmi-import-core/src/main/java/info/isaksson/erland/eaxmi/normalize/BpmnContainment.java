package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Pool and lane parents for BPMN nodes, from geometry.
 *
 * <p>A lane belongs to the smallest pool that contains it; any other BPMN node to the smallest
 * containing lane, else the smallest containing pool. Nodes are then ordered containers first
 * (pools, lanes, other BPMN, the rest), keeping source order within each group.</p>
 */
final class BpmnContainment {

    static final String POOL = "bpmn.pool";
    static final String LANE = "bpmn.lane";

    private BpmnContainment() {}

    static List<IrView> apply(List<IrView> views, Map<String, String> typeByElementId) {
        List<IrView> out = new ArrayList<>(views.size());
        for (IrView v : views) out.add(apply(v, typeByElementId));
        return out;
    }

    static IrView apply(IrView v, Map<String, String> typeByElementId) {
        List<IrViewNode> pools = new ArrayList<>();
        List<IrViewNode> lanes = new ArrayList<>();
        for (IrViewNode n : v.nodes) {
            if (n.bounds == null) continue;
            String type = type(n, typeByElementId);
            if (POOL.equals(type)) pools.add(n);
            else if (LANE.equals(type)) lanes.add(n);
        }
        if (pools.isEmpty() && lanes.isEmpty()) return v;

        Map<String, String> parentByNode = new HashMap<>();
        for (IrViewNode n : v.nodes) {
            if (n.bounds == null) continue;
            String type = type(n, typeByElementId);
            if (type == null || !type.startsWith("bpmn.") || POOL.equals(type)) continue;
            IrViewNode parent = LANE.equals(type) ? smallestContaining(n, pools) : smallestContaining(n, lanes);
            if (parent == null && !LANE.equals(type)) parent = smallestContaining(n, pools);
            if (parent != null) parentByNode.put(n.id, parent.id);
        }

        List<IrViewNode> nodes = new ArrayList<>(v.nodes.size());
        for (IrViewNode n : v.nodes) {
            String parent = parentByNode.get(n.id);
            nodes.add(parent == null ? n : n.withParentNodeId(parent));
        }
        // List.sort is stable.
        nodes.sort(Comparator.comparingInt(n -> rank(type(n, typeByElementId))));
        return v.withNodes(nodes);
    }

    private static IrViewNode smallestContaining(IrViewNode child, List<IrViewNode> containers) {
        IrViewNode best = null;
        for (IrViewNode c : containers) {
            if (c == child || !c.bounds.contains(child.bounds)) continue;
            if (best == null || c.bounds.area() < best.bounds.area()) best = c;
        }
        return best;
    }

    private static String type(IrViewNode n, Map<String, String> typeByElementId) {
        return n.elementId == null ? null : typeByElementId.get(n.elementId);
    }

    private static int rank(String type) {
        if (POOL.equals(type)) return 0;
        if (LANE.equals(type)) return 1;
        if (type != null && type.startsWith("bpmn.")) return 2;
        return 3;
    }
}
