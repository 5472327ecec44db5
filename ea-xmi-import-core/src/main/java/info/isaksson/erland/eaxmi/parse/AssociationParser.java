package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrTaggedValue;
import info.isaksson.erland.eaxmi.xmi.XmiIdIndex;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * UML associations and association classes, with end metadata in {@code meta.umlAttrs}.
 *
 * <p>Only binary associations are imported: extra ends are dropped with a warning. The relationship
 * of an association class gets the id suffix {@link #ASSOCIATION_CLASS_SUFFIX} so it does not collide
 * with the class element.</p>
 */
public final class AssociationParser {

    public static final String ASSOCIATION_CLASS_SUFFIX = "__association";
    public static final String UML_ATTRS = "umlAttrs";

    private static final String SYNTH_PREFIX = "eaAssoc_synth";

    /** Parsed association end. */
    static final class End {
        final String endId;
        final String classifierId;
        final String role;
        final String multiplicity;
        final boolean navigable;
        final String aggregation;

        End(String endId, String classifierId, String role, String multiplicity, boolean navigable, String aggregation) {
            this.endId = endId;
            this.classifierId = classifierId;
            this.role = role;
            this.multiplicity = multiplicity;
            this.navigable = navigable;
            this.aggregation = aggregation;
        }
    }

    private final EaParseContext ctx;

    public AssociationParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    public List<IrRelationship> parse() {
        List<IrRelationship> out = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();
        Map<String, List<Element>> propertiesByAssociation = indexPropertiesByAssociation();

        for (Element el : XmlDom.descendants(ctx.doc)) {
            if (ElementSupport.isInsideExtension(el) || RelationshipSupport.inProfileNamespace(el)) continue;
            String xmiType = ElementSupport.lower(XmlDom.xmiType(el));
            boolean isAssociationClass = xmiType.equals("uml:associationclass");
            boolean isAssociation = xmiType.equals("uml:association")
                    || (xmiType.isEmpty() && XmlDom.localName(el).equals("association"));
            if (!isAssociation && !isAssociationClass) continue;

            String ownId = XmlDom.xmiId(el);
            if (ownId == null) ownId = XmlDom.xmiIdRef(el);

            List<Element> endEls = collectEnds(el, isAssociationClass ? propertiesByAssociation.get(ownId) : null);
            if (endEls.size() < 2) {
                ctx.report.warn("ea-xmi:association-too-few-ends",
                        "EA XMI: Skipped Association because fewer than 2 ends could be resolved.",
                        "associationId", ownId);
                continue;
            }
            if (endEls.size() > 2) {
                ctx.report.warn("ea-xmi:association-too-many-ends",
                        "EA XMI: Association has " + endEls.size() + " ends; only the first 2 will be imported as a binary association.",
                        "associationId", ownId);
            }

            Set<String> navigableOwned = navigableOwnedEnds(el);
            End a = parseEnd(endEls.get(0), navigableOwned);
            End b = parseEnd(endEls.get(1), navigableOwned);
            if (a.classifierId == null || b.classifierId == null) {
                ctx.report.warn("ea-xmi:association-unresolved-endpoints",
                        "EA XMI: Skipped Association because classifier endpoints could not be resolved (endA="
                                + orNone(a.classifierId) + ", endB=" + orNone(b.classifierId) + ").",
                        "associationId", ownId);
                continue;
            }

            String id = ownId != null ? ownId : ctx.synthetic.next(SYNTH_PREFIX);
            if (isAssociationClass) id = id + ASSOCIATION_CLASS_SUFFIX;
            if (!seenIds.add(id)) {
                ctx.report.warn("ea-xmi:duplicate-relationship-id",
                        "EA XMI: Duplicate association id \"" + id + "\" encountered; skipping.",
                        "relationshipId", id);
                continue;
            }
            out.add(build(el, id, a, b, isAssociationClass));
        }
        return out;
    }

    private IrRelationship build(Element el, String id, End a, End b, boolean isAssociationClass) {
        String type = "composite".equals(a.aggregation) || "composite".equals(b.aggregation) ? "uml.composition"
                : "shared".equals(a.aggregation) || "shared".equals(b.aggregation) ? "uml.aggregation"
                : "uml.association";

        String stereotype = ElementSupport.stereotype(el, null);

        List<IrExternalId> externalIds = new ArrayList<>();
        String xmiId = XmlDom.xmiId(el);
        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "xmi-id"));
        String guid = ElementSupport.guid(el);
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "relationship-guid"));

        List<IrTaggedValue> tagged = new ArrayList<>();
        if (stereotype != null) tagged.add(new IrTaggedValue(IrTaggedValue.STEREOTYPE, stereotype));

        Map<String, Object> umlAttrs = new LinkedHashMap<>();
        if (a.role != null) umlAttrs.put("sourceRole", a.role);
        if (b.role != null) umlAttrs.put("targetRole", b.role);
        if (a.multiplicity != null) umlAttrs.put("sourceMultiplicity", a.multiplicity);
        if (b.multiplicity != null) umlAttrs.put("targetMultiplicity", b.multiplicity);
        umlAttrs.put("sourceNavigable", a.navigable);
        umlAttrs.put("targetNavigable", b.navigable);
        if (!"none".equals(a.aggregation)) umlAttrs.put("sourceAggregation", a.aggregation);
        if (!"none".equals(b.aggregation)) umlAttrs.put("targetAggregation", b.aggregation);
        if (stereotype != null) umlAttrs.put("stereotype", stereotype);

        Map<String, Object> meta = new LinkedHashMap<>();
        String xmiType = XmlDom.xmiType(el);
        if (xmiType != null) meta.put("xmiType", xmiType);
        meta.put("metaclass", isAssociationClass ? "AssociationClass" : "Association");
        meta.put(UML_ATTRS, umlAttrs);

        return new IrRelationship(id, type, a.classifierId, b.classifierId,
                XmlDom.attrTrim(el, "name"),
                ElementSupport.documentation(el, null),
                externalIds, tagged, null, meta);
    }

    /** memberEnd attribute, memberEnd children, ownedEnd children, then association-class properties; unique by end id. */
    private List<Element> collectEnds(Element assoc, List<Element> associationProperties) {
        List<Element> ends = new ArrayList<>();
        for (String endId : XmiIdIndex.parseIdRefList(XmlDom.attrAny(assoc, List.of("memberEnd", "memberend")))) {
            Element endEl = ctx.ids.resolve(endId);
            if (endEl != null) ends.add(endEl);
        }
        for (Element ch : XmlDom.childrenByLocalName(assoc, "memberEnd")) {
            Element endEl = ctx.ids.resolve(RelationshipSupport.childRef(ch));
            if (endEl != null) ends.add(endEl);
        }
        ends.addAll(XmlDom.childrenByLocalName(assoc, "ownedEnd"));
        if (associationProperties != null) ends.addAll(associationProperties);

        Map<String, Element> unique = new LinkedHashMap<>();
        for (Element endEl : ends) {
            String id = endId(endEl);
            if (id != null) unique.putIfAbsent(id, endEl);
        }
        return new ArrayList<>(unique.values());
    }

    private Map<String, List<Element>> indexPropertiesByAssociation() {
        Map<String, List<Element>> out = new LinkedHashMap<>();
        for (Element e : XmlDom.descendants(ctx.doc)) {
            String assoc = XmlDom.blankToNull(XmlDom.attrExact(e, "association"));
            if (assoc == null) continue;
            String ln = XmlDom.localName(e);
            boolean looksLikeProperty = "uml:property".equals(ElementSupport.lower(XmlDom.xmiType(e)))
                    || ln.equals("ownedattribute") || ln.equals("ownedend");
            if (looksLikeProperty) out.computeIfAbsent(assoc, k -> new ArrayList<>()).add(e);
        }
        return out;
    }

    private static Set<String> navigableOwnedEnds(Element assoc) {
        Set<String> out = new LinkedHashSet<>(XmiIdIndex.parseIdRefList(
                XmlDom.attrAny(assoc, List.of("navigableOwnedEnd", "navigableownedend"))));
        for (Element ch : XmlDom.childrenByLocalName(assoc, "navigableOwnedEnd")) {
            String ref = RelationshipSupport.childRef(ch);
            if (ref != null) out.add(ref);
        }
        return out;
    }

    private End parseEnd(Element endEl, Set<String> navigableOwned) {
        String endId = endId(endEl);
        String aggregation = ElementSupport.lower(XmlDom.attrTrim(endEl, "aggregation"));
        if (!aggregation.equals("composite") && !aggregation.equals("shared")) aggregation = "none";

        String isNav = XmlDom.attrAny(endEl, List.of("isNavigable", "isnavigable"));
        boolean navigable = isNav != null ? isNav.equalsIgnoreCase("true") : navigableOwned.contains(endId);

        return new End(endId, classifierId(endEl), XmlDom.attrTrim(endEl, "name"),
                multiplicity(endEl), navigable, aggregation);
    }

    private static String endId(Element endEl) {
        String id = XmlDom.xmiId(endEl);
        return id != null ? id : XmlDom.xmiIdRef(endEl);
    }

    private String classifierId(Element endEl) {
        String direct = XmlDom.attrExact(endEl, "type");
        List<String> ids = XmiIdIndex.parseIdRefList(direct);
        if (!ids.isEmpty()) return ids.get(0);

        for (Element ch : XmlDom.childrenByLocalName(endEl, "type")) {
            String ref = RelationshipSupport.childRef(ch);
            if (ref != null) return ref;
        }
        List<String> textIds = XmiIdIndex.parseIdRefList(XmlDom.childText(endEl, "type"));
        if (!textIds.isEmpty()) return textIds.get(0);

        List<String> maybe = XmiIdIndex.parseIdRefList(XmlDom.attrAny(endEl, List.of("classifier", "class")));
        if (!maybe.isEmpty() && ctx.ids.contains(maybe.get(0))) return maybe.get(0);
        return null;
    }

    /** {@code lower..upper}, collapsed to one value when equal; lower defaults to 0, upper to lower. */
    static String multiplicity(Element endEl) {
        String lower = null;
        String upper = null;
        Element lv = XmlDom.childByLocalName(endEl, "lowerValue");
        if (lv != null) lower = XmlDom.attrAny(lv, List.of("value", "xmi:value"));
        Element uv = XmlDom.childByLocalName(endEl, "upperValue");
        if (uv != null) upper = XmlDom.attrAny(uv, List.of("value", "xmi:value"));
        if (lower == null) lower = XmlDom.attrTrim(endEl, "lower");
        if (upper == null) upper = XmlDom.attrTrim(endEl, "upper");
        if (lower == null && upper == null) return null;
        String l = lower != null ? lower : "0";
        String u = upper != null ? upper : l;
        return l.equals(u) ? l : l + ".." + u;
    }

    private static String orNone(String s) {
        return s == null ? "(none)" : s;
    }
}
