package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrRelationship;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * UML relationships from EA extension connectors that are neither ArchiMate nor BPMN.
 *
 * <p>Typed from {@code properties@ea_type}. Connectors with an
 * {@code extendedProperties@associationclass} link are kept even when untyped (as associations).</p>
 */
public final class UmlConnectorParser {

    private static final String SYNTH_PREFIX = "eaUmlConnectorRel_synth";

    private final EaParseContext ctx;

    public UmlConnectorParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    public List<IrRelationship> parse() {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (EaConnector c : EaConnector.read(ctx.doc)) {
            if (c.hasArchimateStereotype() || c.hasBpmnStereotype()) continue;
            String inferred = UmlTypes.linkType(c.eaType);
            if (inferred == null && c.associationClassRef == null) continue;

            String id = c.id;
            if (id == null) {
                id = ctx.synthetic.next(SYNTH_PREFIX);
                ctx.report.warn("ea-xmi:connector-missing-id",
                        "EA XMI: UML connector relationship missing id; generated synthetic relationship id \"" + id + "\".",
                        "relationshipId", id);
            }
            if (!seen.add(id)) {
                ctx.report.warn("ea-xmi:duplicate-relationship-id",
                        "EA XMI: Duplicate UML connector relationship id \"" + id + "\" encountered; skipping subsequent occurrence.",
                        "relationshipId", id);
                continue;
            }
            if (c.sourceId == null || c.targetId == null) {
                ctx.report.warn("ea-xmi:connector-unresolved-endpoints",
                        "EA XMI: Skipped UML connector relationship \"" + id + "\" because endpoints could not be resolved (source="
                                + ArchimateConnectorParser.orNone(c.sourceId) + ", target="
                                + ArchimateConnectorParser.orNone(c.targetId) + ").",
                        "relationshipId", id);
                continue;
            }

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("eaConnector", Boolean.TRUE);
            if (c.stereotype != null) meta.put("eaStereotype", c.stereotype);
            if (c.direction != null) meta.put("eaDirection", c.direction);
            if (c.eaType != null) meta.put("eaType", c.eaType);
            if (c.associationClassRef != null) meta.put("associationClassRef", c.associationClassRef);

            out.add(ArchimateConnectorParser.build(c, id, inferred != null ? inferred : "uml.association", meta));
        }
        return out;
    }
}
