package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrTaggedValue;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * ArchiMate relationships from EA extension connectors.
 *
 * <p>In many EA exports the ArchiMate relationship type only exists as
 * {@code <properties stereotype="ArchiMate_*">} on the connector record, which makes these the
 * preferred source for ArchiMate relationships.</p>
 */
public final class ArchimateConnectorParser {

    private static final String SYNTH_PREFIX = "eaConnectorRel_synth";

    private final EaParseContext ctx;
    private final Map<String, String> elementTypes;

    /**
     * @param elementTypes merged element id to type, used to recognise {@code ArchiMate_Realisation}
     *                     between UML elements
     */
    public ArchimateConnectorParser(EaParseContext ctx, Map<String, String> elementTypes) {
        this.ctx = ctx;
        this.elementTypes = elementTypes == null ? Map.of() : elementTypes;
    }

    public List<IrRelationship> parse() {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (EaConnector c : EaConnector.read(ctx.doc)) {
            if (!c.hasArchimateStereotype()) continue;

            String id = c.id;
            if (id == null) {
                id = ctx.synthetic.next(SYNTH_PREFIX);
                ctx.report.warn("ea-xmi:connector-missing-id",
                        "EA XMI: Connector relationship missing id; generated synthetic relationship id \"" + id + "\".",
                        "relationshipId", id);
            }
            if (!seen.add(id)) {
                ctx.report.warn("ea-xmi:duplicate-relationship-id",
                        "EA XMI: Duplicate connector relationship id \"" + id + "\" encountered; skipping subsequent occurrence.",
                        "relationshipId", id);
                continue;
            }
            if (c.sourceId == null || c.targetId == null) {
                ctx.report.warn("ea-xmi:connector-unresolved-endpoints",
                        "EA XMI: Skipped connector relationship \"" + id + "\" because endpoints could not be resolved (source="
                                + orNone(c.sourceId) + ", target=" + orNone(c.targetId) + ").",
                        "relationshipId", id);
                continue;
            }

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("eaConnector", Boolean.TRUE);
            meta.put("eaStereotype", c.stereotype);
            if (c.direction != null) meta.put("eaDirection", c.direction);
            if (c.eaType != null) meta.put("eaType", c.eaType);

            String type;
            if (isRealisation(c.stereotype) && linksUmlElements(c)) {
                type = "uml.dependency";
                meta.put("mappedFromArchiMateStereotype", Boolean.TRUE);
                meta.put("umlViaArchiMateStereotype", c.stereotype);
                Map<String, String> context = new LinkedHashMap<>();
                context.put("relationshipId", id);
                context.put("stereotype", c.stereotype);
                context.put("sourceType", String.valueOf(elementTypes.get(c.sourceId)));
                context.put("targetType", String.valueOf(elementTypes.get(c.targetId)));
                ctx.report.info("ea-xmi:archimate-realisation-as-uml",
                        "EA XMI: Interpreted ArchiMate_Realisation connector as UML dependency due to UML endpoints.", context);
            } else {
                type = ArchimateVocabulary.relationshipType(c.stereotype);
                if (type == null) {
                    ctx.report.warn("ea-xmi:connector-unmapped-stereotype",
                            "EA XMI: Connector relationship \"" + id + "\" has unmapped stereotype \"" + c.stereotype
                                    + "\"; imported as type \"Unknown\".",
                            "relationshipId", id, "profileTag", c.stereotype);
                    meta.put("sourceType", ArchimateVocabulary.sourceToken(c.stereotype));
                }
            }
            out.add(build(c, id, type, meta));
        }
        return out;
    }

    private boolean linksUmlElements(EaConnector c) {
        String s = elementTypes.get(c.sourceId);
        String t = elementTypes.get(c.targetId);
        boolean bothArchimate = ArchimateVocabulary.isArchimateType(s) && ArchimateVocabulary.isArchimateType(t);
        return (UmlTypes.isUmlType(s) || UmlTypes.isUmlType(t)) && !bothArchimate;
    }

    private static boolean isRealisation(String stereotype) {
        String token = ArchimateVocabulary.token(stereotype);
        return token.equals("realisation") || token.equals("realization");
    }

    static IrRelationship build(EaConnector c, String id, String type, Map<String, Object> meta) {
        List<IrExternalId> externalIds = new ArrayList<>();
        if (c.id != null) externalIds.add(IrExternalId.of("xmi", c.id, "xmi-id"));
        String guid = ElementSupport.guid(c.el);
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "relationship-guid"));

        List<IrTaggedValue> tagged = new ArrayList<>();
        if (c.stereotype != null) tagged.add(new IrTaggedValue(IrTaggedValue.STEREOTYPE, c.stereotype));
        if (c.eaType != null) tagged.add(new IrTaggedValue(IrTaggedValue.EA_TYPE, c.eaType));
        if (c.direction != null) tagged.add(new IrTaggedValue(IrTaggedValue.DIRECTION, c.direction));
        if (c.associationClassRef != null) tagged.add(new IrTaggedValue(IrTaggedValue.ASSOCIATION_CLASS, c.associationClassRef));

        Map<String, Object> attrs = new LinkedHashMap<>();
        if (c.associationClassRef != null) attrs.put("associationClassElementId", c.associationClassRef);

        String documentation = ElementSupport.documentation(c.el, null);
        return new IrRelationship(id, type, c.sourceId, c.targetId, c.name, documentation, externalIds, tagged, attrs, meta);
    }

    static String orNone(String s) {
        return s == null ? "(none)" : s;
    }
}
