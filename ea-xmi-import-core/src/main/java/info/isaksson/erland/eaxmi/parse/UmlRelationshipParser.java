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
 * Directed UML relationships: generalization, realization, dependency, include, extend and
 * activity edges.
 *
 * <p>Several clients/suppliers expand to one relationship per pair; the ids then get a
 * {@code _<n>} suffix in pair order.</p>
 */
public final class UmlRelationshipParser {

    public static final String SYNTH_PREFIX = "eaRel_synth";

    /** Source key and target key, tried in order until one side resolves. */
    private static final class EndpointKeys {
        final String source;
        final String target;

        EndpointKeys(String source, String target) {
            this.source = source;
            this.target = target;
        }
    }

    private static final Map<String, List<EndpointKeys>> ENDPOINTS = new LinkedHashMap<>();

    static {
        EndpointKeys clientSupplier = new EndpointKeys("client", "supplier");
        ENDPOINTS.put("Generalization", List.of(new EndpointKeys("specific", "general")));
        ENDPOINTS.put("Include", List.of(new EndpointKeys("includingCase", "addition"), clientSupplier));
        ENDPOINTS.put("Extend", List.of(new EndpointKeys("extension", "extendedCase"), clientSupplier));
        ENDPOINTS.put("Dependency", List.of(clientSupplier));
        ENDPOINTS.put("Realization", List.of(clientSupplier));
        ENDPOINTS.put("InterfaceRealization", List.of(clientSupplier));
        ENDPOINTS.put("ControlFlow", List.of(new EndpointKeys("source", "target"), clientSupplier));
        ENDPOINTS.put("ObjectFlow", List.of(new EndpointKeys("source", "target"), clientSupplier));
    }

    private static final Map<String, String> LOCAL_NAME_METACLASS = new LinkedHashMap<>();

    static {
        for (String m : ENDPOINTS.keySet()) LOCAL_NAME_METACLASS.put(m.toLowerCase(Locale.ROOT), m);
    }

    private final EaParseContext ctx;

    public UmlRelationshipParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    public List<IrRelationship> parse() {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Set<String> seenTriples = new HashSet<>();

        for (Element el : XmlDom.descendants(ctx.doc)) {
            if (RelationshipSupport.inProfileNamespace(el)) continue;
            if (XmlDom.localName(el).equals("properties")) continue;
            String xmiType = XmlDom.xmiType(el);
            String metaclass = ElementSupport.metaclassFromXmiType(xmiType);
            if (metaclass == null) metaclass = LOCAL_NAME_METACLASS.get(XmlDom.localName(el));
            boolean fromHint = false;
            String hint = RelationshipSupport.eaTypeHint(el);
            if ("ControlFlow".equals(hint) || "ObjectFlow".equals(hint)) {
                fromHint = !hint.equals(metaclass);
                metaclass = hint;
            }
            if (metaclass == null || !ENDPOINTS.containsKey(metaclass)) continue;
            // Extension records only count when EA marked them as activity edges.
            if (!fromHint && ElementSupport.isInsideExtension(el)) continue;

            String stereotype = ElementSupport.stereotype(el, null);
            String type = UmlTypes.relationshipType(metaclass);
            if ("Dependency".equals(metaclass)) {
                String byStereotype = UmlTypes.relationshipTypeFromStereotype(stereotype);
                if (byStereotype != null) type = byStereotype;
            }
            if (type == null) continue;

            List<String> sources = List.of();
            List<String> targets = List.of();
            for (EndpointKeys keys : ENDPOINTS.get(metaclass)) {
                sources = RelationshipSupport.refIds(el, keys.source);
                targets = RelationshipSupport.refIds(el, keys.target);
                if (!sources.isEmpty() || !targets.isEmpty()) break;
            }
            if (sources.isEmpty()) {
                String owner = RelationshipSupport.owningClassifierId(el, ctx.synthetic);
                if (owner != null) sources = List.of(owner);
            }

            if (sources.isEmpty() || targets.isEmpty()) {
                ctx.report.warn("ea-xmi:relationship-unresolved-endpoints",
                        "EA XMI: Skipped relationship (metaclass=" + metaclass + ") because endpoints could not be resolved (sources="
                                + joinOrEmpty(sources) + ", targets=" + joinOrEmpty(targets) + ").",
                        "metaclass", metaclass);
                continue;
            }

            String baseId = XmlDom.xmiId(el);
            if (baseId == null) baseId = XmlDom.xmiIdRef(el);
            boolean multi = sources.size() > 1 || targets.size() > 1;
            String name = XmlDom.attrTrim(el, "name");
            String documentation = ElementSupport.documentation(el, ctx.extensionDocs);
            String guard = "ControlFlow".equals(metaclass) || "ObjectFlow".equals(metaclass)
                    ? RelationshipSupport.guardText(el) : null;

            int pair = 0;
            for (String src : sources) {
                for (String tgt : targets) {
                    pair++;
                    String id = baseId;
                    if (id != null && multi) id = id + "_" + pair;
                    String triple = type + "|" + src + "|" + tgt;
                    if (id == null) {
                        // Synthetic ids only for pairs not seen before.
                        if (seenTriples.contains(triple)) continue;
                        id = ctx.synthetic.next(SYNTH_PREFIX);
                    }
                    if (!seenIds.add(id)) {
                        ctx.report.warn("ea-xmi:duplicate-relationship-id",
                                "EA XMI: Duplicate relationship id \"" + id + "\" encountered; skipping subsequent occurrence.",
                                "relationshipId", id);
                        continue;
                    }
                    seenTriples.add(triple);
                    out.add(build(el, id, type, src, tgt, name, documentation, stereotype, guard, xmiType, metaclass));
                }
            }
        }
        return out;
    }

    private static IrRelationship build(Element el, String id, String type, String src, String tgt, String name,
                                        String documentation, String stereotype, String guard,
                                        String xmiType, String metaclass) {
        List<IrExternalId> externalIds = new ArrayList<>();
        String xmiId = XmlDom.xmiId(el);
        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "xmi-id"));
        String guid = ElementSupport.guid(el);
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "relationship-guid"));

        List<IrTaggedValue> tagged = new ArrayList<>();
        if (stereotype != null) tagged.add(new IrTaggedValue(IrTaggedValue.STEREOTYPE, stereotype));

        Map<String, Object> attrs = new LinkedHashMap<>();
        if (guard != null) attrs.put("guard", guard);

        Map<String, Object> meta = new LinkedHashMap<>();
        if (xmiType != null) meta.put("xmiType", xmiType);
        meta.put("metaclass", metaclass);

        return new IrRelationship(id, type, src, tgt, name, documentation, externalIds, tagged, attrs, meta);
    }

    private static String joinOrEmpty(List<String> ids) {
        return ids.isEmpty() ? "(none)" : String.join(" ", ids);
    }
}
