package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.parse.AssociationParser;
import info.isaksson.erland.eaxmi.parse.UmlTypes;
import info.isaksson.erland.eaxmi.report.ImportReport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Links each {@code uml.associationClass} element (the box) to its association relationship (the line).
 *
 * <p>The relationship is the parser's {@code <class>__association} one, unless an EA connector
 * names the class through {@code attrs.associationClassElementId}; the connector wins and the
 * synthetic relationship is dropped. Both sides get the back-link attribute.</p>
 */
final class AssociationClassLinks {

    static final String ATTR_CLASS_ELEMENT_ID = "associationClassElementId";
    static final String ATTR_RELATIONSHIP_ID = "associationRelationshipId";

    private static final String SUFFIX = AssociationParser.ASSOCIATION_CLASS_SUFFIX;

    final List<IrElement> elements;
    final List<IrRelationship> relationships;

    private AssociationClassLinks(List<IrElement> elements, List<IrRelationship> relationships) {
        this.elements = elements;
        this.relationships = relationships;
    }

    static AssociationClassLinks apply(List<IrElement> elements, List<IrRelationship> relationships, ImportReport report) {
        Set<String> classIds = new HashSet<>();
        for (IrElement e : elements) {
            if (UmlTypes.ASSOCIATION_CLASS.equals(e.type)) classIds.add(e.id);
        }
        if (classIds.isEmpty() || relationships.isEmpty()) return new AssociationClassLinks(elements, relationships);

        Map<String, String> relationshipByClass = new LinkedHashMap<>();
        for (IrRelationship r : relationships) {
            String base = suffixBase(r.id);
            if (base != null && classIds.contains(base)) relationshipByClass.put(base, r.id);
        }
        for (IrRelationship r : relationships) {
            String explicit = MemberSanitizer.trim(r.attrs.get(ATTR_CLASS_ELEMENT_ID));
            if (explicit != null && classIds.contains(explicit)) relationshipByClass.put(explicit, r.id);
        }
        if (relationshipByClass.isEmpty()) return new AssociationClassLinks(elements, relationships);

        Map<String, String> classByRelationship = new HashMap<>();
        Set<String> connectorLinked = new HashSet<>();
        for (Map.Entry<String, String> e : relationshipByClass.entrySet()) {
            classByRelationship.put(e.getValue(), e.getKey());
            if (!e.getValue().endsWith(SUFFIX)) connectorLinked.add(e.getKey());
        }

        List<IrRelationship> nextRelationships = new ArrayList<>(relationships.size());
        for (IrRelationship r : relationships) {
            String base = suffixBase(r.id);
            if (base != null && connectorLinked.contains(base)) continue;

            String classId = base != null && classIds.contains(base) ? base : classByRelationship.get(r.id);
            if (classId == null || classId.equals(r.attrs.get(ATTR_CLASS_ELEMENT_ID))) {
                nextRelationships.add(r);
                continue;
            }
            Map<String, Object> attrs = new LinkedHashMap<>(r.attrs);
            attrs.put(ATTR_CLASS_ELEMENT_ID, classId);
            nextRelationships.add(r.withAttrs(attrs));
        }

        Set<String> keptIds = new HashSet<>();
        for (IrRelationship r : nextRelationships) keptIds.add(r.id);

        List<IrElement> nextElements = new ArrayList<>(elements.size());
        for (IrElement e : elements) {
            String relId = relationshipByClass.get(e.id);
            if (!UmlTypes.ASSOCIATION_CLASS.equals(e.type) || relId == null || !keptIds.contains(relId)
                    || relId.equals(e.attrs.get(ATTR_RELATIONSHIP_ID))) {
                nextElements.add(e);
                continue;
            }
            Map<String, Object> attrs = new LinkedHashMap<>(e.attrs);
            attrs.put(ATTR_RELATIONSHIP_ID, relId);
            nextElements.add(e.withAttrs(attrs));
            report.info("ea-xmi:uml-associationclass-link", "EA XMI Normalize: Linked AssociationClass " + e.id + " -> " + relId,
                    "elementId", e.id);
        }
        return new AssociationClassLinks(nextElements, nextRelationships);
    }

    private static String suffixBase(String id) {
        return id != null && id.endsWith(SUFFIX) ? id.substring(0, id.length() - SUFFIX.length()) : null;
    }
}
