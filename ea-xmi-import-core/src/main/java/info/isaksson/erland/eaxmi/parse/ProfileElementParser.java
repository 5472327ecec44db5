package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
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
 * Stereotype applications of an EA profile (ArchiMate or BPMN) to IR elements.
 *
 * <p>A profile record such as {@code <ArchiMate3:ArchiMate_BusinessActor base_Class="X"/>} takes
 * the id of its base element, so relationships and diagrams that point at the base resolve to it.
 * Name, documentation and folder fall back to the base element.</p>
 */
public abstract class ProfileElementParser {

    protected final EaParseContext ctx;

    protected ProfileElementParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    /** Lower-case fragment the profile namespace URI contains. */
    protected abstract String namespaceMarker();

    /** Relationship tags are parsed elsewhere. */
    protected abstract boolean isRelationshipTag(Element el);

    /** IR type for the tag, or null when unknown. */
    protected abstract String elementType(Element el);

    protected abstract String sourceToken(Element el);

    protected abstract String synthPrefix();

    /** Prefix of the profile-specific meta keys, e.g. {@code archimateProfile}. */
    protected abstract String metaPrefix();

    /** Human-readable profile name for report messages. */
    protected abstract String label();

    public List<IrElement> parse() {
        List<IrElement> out = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (Element el : XmlDom.descendants(ctx.doc)) {
            if (ElementSupport.isInsideExtension(el)) continue;
            if (!inProfileNamespace(el)) continue;
            if (isRelationshipTag(el)) continue;

            IrElement element = toElement(el);
            if (!seen.add(element.id)) {
                ctx.report.warn("ea-xmi:duplicate-element-id",
                        "EA XMI: Duplicate " + label() + " element id \"" + element.id + "\" encountered; skipping subsequent occurrence.",
                        "elementId", element.id);
                continue;
            }
            out.add(element);
        }
        return out;
    }

    protected boolean inProfileNamespace(Element el) {
        String uri = el.getNamespaceURI();
        return uri != null && uri.toLowerCase(Locale.ROOT).contains(namespaceMarker());
    }

    private IrElement toElement(Element el) {
        String xmiId = XmlDom.xmiId(el);
        String baseId = ElementSupport.baseRefId(el);
        String id = baseId != null ? baseId : xmiId;
        if (id == null) {
            id = ctx.synthetic.assign(el, synthPrefix());
            ctx.report.warn("ea-xmi:element-missing-id",
                    "EA XMI: " + label() + " element missing xmi:id; generated synthetic element id \"" + id
                            + "\" (profileTag=\"" + el.getTagName() + "\").",
                    "elementId", id);
        }

        String name = XmlDom.attrTrim(el, "name");
        String documentation = ElementSupport.documentation(el, ctx.extensionDocs);
        String folderId = ElementSupport.owningFolderId(el, ctx.synthetic);

        Element base = baseId == null ? null : ctx.ids.resolve(baseId);
        if (base != null) {
            if (name == null) name = XmlDom.attrTrim(base, "name");
            if (documentation == null) documentation = ElementSupport.documentation(base, ctx.extensionDocs);
            if (folderId == null) folderId = ElementSupport.owningFolderId(base, ctx.synthetic);
        }

        String type = elementType(el);
        String token = sourceToken(el);
        if (name == null) name = token.isEmpty() ? "Element" : token;

        List<IrExternalId> externalIds = new ArrayList<>();
        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "xmi-id"));
        if (baseId != null) externalIds.add(IrExternalId.of("xmi", baseId, "xmi-base-id"));
        String guid = ElementSupport.guid(el);
        if (guid == null && base != null) guid = ElementSupport.guid(base);
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "element-guid"));

        List<IrTaggedValue> tagged = new ArrayList<>();
        tagged.add(new IrTaggedValue(IrTaggedValue.PROFILE_TAG, el.getTagName()));
        String stereotype = ElementSupport.stereotype(el, ctx.extensionStereotypes);
        if (stereotype == null && base != null) stereotype = ElementSupport.stereotype(base, ctx.extensionStereotypes);
        if (stereotype != null) tagged.add(new IrTaggedValue(IrTaggedValue.STEREOTYPE, stereotype));

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put(metaPrefix() + "Uri", el.getNamespaceURI());
        meta.put(metaPrefix() + "LocalName", XmlDom.localName(el));
        meta.put(metaPrefix() + "Tag", el.getTagName());
        if (type == null) meta.put("sourceType", token);

        return new IrElement(id, type, name, documentation, folderId, externalIds, tagged, null, meta);
    }
}
