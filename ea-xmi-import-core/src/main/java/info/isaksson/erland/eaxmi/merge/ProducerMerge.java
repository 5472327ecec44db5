package info.isaksson.erland.eaxmi.merge;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.report.ImportReport;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Deterministic merge of the element and relationship producers.
 *
 * <p>Both merges are a left fold over the tagged entries in precedence order. An entry whose id is
 * already taken either replaces the kept value (a non-UML type beats a UML type) or is dropped
 * (first occurrence wins); every collision is reported.</p>
 */
public final class ProducerMerge {

    private static final String UML_PREFIX = "uml.";

    private ProducerMerge() {}

    public static List<IrElement> mergeElements(List<Produced<IrElement>> entries, ImportReport report) {
        Map<String, IrElement> byId = new LinkedHashMap<>();
        for (Produced<IrElement> p : entries) {
            IrElement incoming = p.value;
            IrElement existing = byId.get(incoming.id);
            if (existing == null) {
                byId.put(incoming.id, incoming);
                continue;
            }
            Map<String, String> context = collisionContext("elementId", incoming.id);
            if (isUml(existing.type) && !isUml(incoming.type)) {
                context.put("keptType", incoming.type);
                context.put("droppedType", existing.type);
                String notation = p.producer == Producer.BPMN_PROFILE ? "BPMN" : "ArchiMate";
                report.warn("ea-xmi:element-id-collision",
                        "EA XMI: Element id collision between UML and " + notation + "; keeping " + notation + ".", context);
                byId.put(incoming.id, incoming);
            } else {
                context.put("keptType", existing.type);
                context.put("droppedType", incoming.type);
                report.warn("ea-xmi:duplicate-element-id",
                        "EA XMI: Duplicate element id encountered during merge; kept first occurrence.", context);
            }
        }
        return new ArrayList<>(byId.values());
    }

    /**
     * @param suppressUml drop every {@code uml.*} relationship (pure ArchiMate/BPMN exports without UML diagrams)
     */
    public static List<IrRelationship> mergeRelationships(List<Produced<IrRelationship>> entries, boolean suppressUml, ImportReport report) {
        Set<String> connectorIds = new HashSet<>();
        Set<String> connectorSignatures = new HashSet<>();
        for (Produced<IrRelationship> p : entries) {
            if (p.producer != Producer.EA_CONNECTOR) continue;
            connectorIds.add(p.value.id);
            connectorSignatures.add(signature(p.value));
        }

        Map<String, IrRelationship> byId = new LinkedHashMap<>();
        int suppressed = 0;
        for (Produced<IrRelationship> p : entries) {
            IrRelationship r = p.value;
            if (suppressUml && (p.producer.uml || isUml(r.type))) {
                suppressed++;
                continue;
            }

            boolean fromConnector = p.producer == Producer.EA_CONNECTOR;
            if (!fromConnector && connectorSignatures.contains(signature(r))) {
                report.warn("ea-xmi:relationship-dropped-duplicate",
                        "EA XMI: Dropped relationship because an EA connector relationship provides the same ArchiMate semantics.",
                        dropContext(r, p.producer));
                continue;
            }
            if (!fromConnector && connectorIds.contains(r.id)) {
                report.warn("ea-xmi:relationship-dropped-source-of-truth",
                        "EA XMI: Dropped relationship because EA connector stereotypes are the source of truth for ArchiMate.",
                        dropContext(r, p.producer));
                continue;
            }

            IrRelationship existing = byId.get(r.id);
            if (existing == null) {
                byId.put(r.id, r);
                continue;
            }
            Map<String, String> context = collisionContext("relationshipId", r.id);
            if (isUml(existing.type) && !isUml(r.type)) {
                context.put("keptType", r.type);
                context.put("droppedType", existing.type);
                context.put("keptSource", p.producer.label);
                report.warn("ea-xmi:relationship-id-collision",
                        "EA XMI: Relationship id collision between UML and another source; kept the non-UML relationship.", context);
                byId.put(r.id, r);
            } else {
                context.put("keptType", existing.type);
                context.put("droppedType", r.type);
                context.put("droppedSource", p.producer.label);
                report.warn("ea-xmi:duplicate-relationship-id",
                        "EA XMI: Duplicate relationship id encountered during merge; kept first occurrence.", context);
            }
        }
        if (suppressed > 0) {
            report.info("ea-xmi:uml-relationships-suppressed",
                    "EA XMI: Skipped " + suppressed + " UML relationship(s) because the export is ArchiMate/BPMN only.",
                    "count", Integer.toString(suppressed));
        }
        return new ArrayList<>(byId.values());
    }

    /** {@code source->target|type|lower-case name}. */
    public static String signature(IrRelationship r) {
        String name = r.name == null ? "" : r.name.trim().toLowerCase(Locale.ROOT);
        return r.sourceId + "->" + r.targetId + "|" + r.type + "|" + name;
    }

    static boolean isUml(String type) {
        return type != null && type.startsWith(UML_PREFIX);
    }

    private static Map<String, String> collisionContext(String key, String id) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put(key, id);
        return context;
    }

    private static Map<String, String> dropContext(IrRelationship r, Producer producer) {
        Map<String, String> context = collisionContext("relationshipId", r.id);
        context.put("type", r.type);
        context.put("source", producer.label);
        return context;
    }
}
