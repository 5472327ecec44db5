package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Relationships from EA {@code <links>} blocks, e.g.
 * {@code <links><InformationFlow xmi:id="EAID_1" start="EAID_A" end="EAID_B"/></links>}.
 *
 * <p>Older exports only record some connectors this way; diagram connections referencing them
 * need a relationship to resolve to.</p>
 */
public final class EaLinksRelationshipParser {

    static final List<String> ID_ATTRS = List.of("xmi:id", "id", "ea_guid", "ea:guid", "guid", "uuid");
    static final List<String> NAME_ATTRS = List.of("name", "label", "role");
    static final List<String> START_ATTRS = List.of("start", "startid", "start_id", "source", "sourceid", "source_id", "client", "from");
    static final List<String> END_ATTRS = List.of("end", "endid", "end_id", "target", "targetid", "target_id", "supplier", "to");
    private static final List<String> GUID_ATTRS = List.of("ea_guid", "ea:guid", "guid", "uuid");

    private final EaParseContext ctx;

    public EaLinksRelationshipParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    public List<IrRelationship> parse() {
        Map<String, IrRelationship> byId = new LinkedHashMap<>();
        for (Element links : XmlDom.descendantsByLocalName(ctx.doc, "links")) {
            for (Element link : XmlDom.children(links)) {
                String tag = XmlDom.localName(link);
                String id = XmlDom.attrAny(link, ID_ATTRS);
                if (id == null || byId.containsKey(id)) continue;
                String start = XmlDom.attrAny(link, START_ATTRS);
                String end = XmlDom.attrAny(link, END_ATTRS);
                if (start == null || end == null) continue;

                List<IrExternalId> externalIds = new ArrayList<>();
                String xmiId = XmlDom.xmiId(link);
                String guid = XmlDom.attrAny(link, GUID_ATTRS);
                if (xmiId != null && !xmiId.equals(id)) externalIds.add(IrExternalId.of("xmi", xmiId, "xmi-id"));
                if (guid != null && !guid.equals(id)) externalIds.add(IrExternalId.of("sparx-ea", guid, "guid"));

                String type = UmlTypes.linkType(tag);
                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("sourceSystem", "sparx-ea");
                meta.put("source", "links");
                meta.put("eaLinkType", tag);
                if (type == null) meta.put("sourceType", tag);

                String name = XmlDom.attrAny(link, NAME_ATTRS);
                byId.put(id, new IrRelationship(id, type, start, end, name, null, externalIds, null, null, meta));
            }
        }
        if (!byId.isEmpty()) {
            ctx.report.info("ea-xmi:links-parsed",
                    "EA XMI: Parsed " + byId.size() + " relationship(s) from <links> blocks.");
        }
        return new ArrayList<>(byId.values());
    }
}
