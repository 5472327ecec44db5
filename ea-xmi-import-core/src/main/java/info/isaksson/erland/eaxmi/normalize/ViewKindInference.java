package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewConnection;
import info.isaksson.erland.eaxmi.ir.IrViewNode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Infers {@code meta.viewKind} ({@code archimate}, {@code uml} or {@code bpmn}) from what a view shows.
 *
 * <p>EA often stamps a default diagram type on diagrams whose content is UML or BPMN, so the placed
 * elements and relationships decide. The diagram type only adds a small bias once there is content
 * evidence. Ties prefer bpmn, then uml, then archimate.</p>
 */
final class ViewKindInference {

    static final String META_VIEW_KIND = "viewKind";

    private static final String[] KINDS = {"bpmn", "uml", "archimate"};

    private ViewKindInference() {}

    static List<IrView> apply(List<IrView> views, Map<String, String> elementTypes, Map<String, String> relationshipTypes) {
        List<IrView> out = new ArrayList<>(views.size());
        for (IrView v : views) {
            String kind = infer(v, elementTypes, relationshipTypes);
            if (kind == null) {
                out.add(v);
                continue;
            }
            Map<String, Object> meta = new LinkedHashMap<>(v.meta);
            meta.put(META_VIEW_KIND, kind);
            out.add(new IrView(v.id, v.name, v.viewpoint, v.folderId, v.documentation, v.nodes, v.connections, v.externalIds, meta));
        }
        return out;
    }

    static String infer(IrView v, Map<String, String> elementTypes, Map<String, String> relationshipTypes) {
        double[] score = new double[KINDS.length];
        int evidence = 0;
        for (IrViewNode n : v.nodes) {
            int k = kindIndex(n.elementId == null ? null : elementTypes.get(n.elementId));
            if (k < 0) continue;
            score[k]++;
            evidence++;
        }
        for (IrViewConnection c : v.connections) {
            int k = kindIndex(c.relationshipId == null ? null : relationshipTypes.get(c.relationshipId));
            if (k < 0) continue;
            score[k]++;
            evidence++;
        }
        if (evidence == 0) return null;

        Object eaType = v.meta.get("eaDiagramType");
        String diagramType = (eaType != null ? eaType.toString() : v.viewpoint == null ? "" : v.viewpoint).toLowerCase(Locale.ROOT);
        if (diagramType.contains("bpmn")) score[0] += 0.5;
        if (diagramType.contains("uml")) score[1] += 0.5;
        if (diagramType.contains("archimate")) score[2] += 0.25;

        int best = 0;
        for (int i = 1; i < KINDS.length; i++) {
            if (score[i] > score[best]) best = i;
        }
        return KINDS[best];
    }

    private static int kindIndex(String type) {
        if (type == null) return -1;
        String t = type.toLowerCase(Locale.ROOT);
        for (int i = 0; i < KINDS.length; i++) {
            if (t.startsWith(KINDS[i] + ".")) return i;
        }
        return -1;
    }
}
