package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrTaggedValue;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Relationship tags of an EA profile, e.g. {@code <BPMN2.0:SequenceFlow base_ControlFlow="X"/>}.
 *
 * <p>Endpoints come from the tag itself and fall back to the base connector it is applied to.</p>
 */
public abstract class ProfileRelationshipParser {

    static final List<String> SOURCE_KEYS = List.of("source", "client", "from", "src", "start");
    static final List<String> TARGET_KEYS = List.of("target", "supplier", "to", "tgt", "end");

    protected final EaParseContext ctx;

    protected ProfileRelationshipParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    protected abstract String namespaceMarker();

    /** IR type for the tag, or null when the tag is not a relationship. */
    protected abstract String relationshipType(Element el);

    protected abstract String synthPrefix();

    protected abstract String metaPrefix();

    protected abstract String label();

    public List<IrRelationship> parse() {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element el : XmlDom.descendants(ctx.doc)) {
            if (ElementSupport.isInsideExtension(el)) continue;
            String uri = el.getNamespaceURI();
            if (uri == null || !uri.toLowerCase(Locale.ROOT).contains(namespaceMarker())) continue;
            String type = relationshipType(el);
            if (type == null) continue;

            String xmiId = XmlDom.xmiId(el);
            String baseId = RelationshipSupport.baseConnectorRef(el);
            String id = baseId != null ? baseId : xmiId;
            if (id == null) {
                id = ctx.synthetic.assign(el, synthPrefix());
                ctx.report.warn("ea-xmi:relationship-missing-id",
                        "EA XMI: " + label() + " relationship missing xmi:id; generated synthetic relationship id \"" + id
                                + "\" (profileTag=\"" + el.getTagName() + "\").",
                        "relationshipId", id);
            }
            if (!seen.add(id)) {
                ctx.report.warn("ea-xmi:duplicate-relationship-id",
                        "EA XMI: Duplicate " + label() + " relationship id \"" + id + "\" encountered; skipping subsequent occurrence.",
                        "relationshipId", id);
                continue;
            }

            String sourceId = RelationshipSupport.endpointId(el, SOURCE_KEYS);
            String targetId = RelationshipSupport.endpointId(el, TARGET_KEYS);
            Element base = baseId == null ? null : ctx.ids.resolve(baseId);
            if (base != null) {
                if (sourceId == null) sourceId = RelationshipSupport.endpointId(base, SOURCE_KEYS);
                if (targetId == null) targetId = RelationshipSupport.endpointId(base, TARGET_KEYS);
            }
            if (sourceId == null || targetId == null) {
                ctx.report.warn("ea-xmi:relationship-unresolved-endpoints",
                        "EA XMI: Skipped " + label() + " relationship \"" + id + "\" (" + type
                                + ") because endpoints could not be resolved (source=" + ArchimateConnectorParser.orNone(sourceId)
                                + ", target=" + ArchimateConnectorParser.orNone(targetId) + ").",
                        "relationshipId", id);
                continue;
            }

            List<IrExternalId> externalIds = new ArrayList<>();
            if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "xmi-id"));
            if (baseId != null) externalIds.add(IrExternalId.of("xmi", baseId, "xmi-base-id"));
            String guid = ElementSupport.guid(el);
            if (guid == null && base != null) guid = ElementSupport.guid(base);
            if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "relationship-guid"));

            List<IrTaggedValue> tagged = new ArrayList<>();
            tagged.add(new IrTaggedValue(IrTaggedValue.PROFILE_TAG, el.getTagName()));
            String stereotype = ElementSupport.stereotype(el, null);
            if (stereotype != null) tagged.add(new IrTaggedValue(IrTaggedValue.STEREOTYPE, stereotype));

            String name = XmlDom.attrTrim(el, "name");
            if (name == null && base != null) name = XmlDom.attrTrim(base, "name");
            String documentation = ElementSupport.documentation(el, null);
            if (documentation == null && base != null) documentation = ElementSupport.documentation(base, null);

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put(metaPrefix() + "Uri", uri);
            meta.put(metaPrefix() + "LocalName", XmlDom.localName(el));
            meta.put(metaPrefix() + "Tag", el.getTagName());

            out.add(new IrRelationship(id, type, sourceId, targetId, name, documentation, externalIds, tagged, null, meta));
        }
        return out;
    }
}
