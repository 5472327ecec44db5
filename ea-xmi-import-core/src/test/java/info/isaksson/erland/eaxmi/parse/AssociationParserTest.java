package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class AssociationParserTest {

    private static final String CLASSES =
            "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"C1\" name=\"Customer\"/>"
                    + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"C2\" name=\"Order\"/>"
                    + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"C3\" name=\"Invoice\"/>";

    @Test
    public void binaryAssociationCarriesEndMetadata() {
        String xml = Xmi.document(CLASSES
                + "<packagedElement xmi:type=\"uml:Association\" xmi:id=\"AS1\" name=\"places\" memberEnd=\"E1 E2\" navigableOwnedEnd=\"E2\">"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E1\" name=\"customer\" association=\"AS1\" type=\"C1\">"
                + "    <lowerValue xmi:type=\"uml:LiteralInteger\" xmi:id=\"E1L\" value=\"1\"/>"
                + "    <upperValue xmi:type=\"uml:LiteralUnlimitedNatural\" xmi:id=\"E1U\" value=\"1\"/>"
                + "  </ownedEnd>"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E2\" name=\"orders\" association=\"AS1\" type=\"C2\" aggregation=\"composite\">"
                + "    <lowerValue xmi:type=\"uml:LiteralInteger\" xmi:id=\"E2L\" value=\"0\"/>"
                + "    <upperValue xmi:type=\"uml:LiteralUnlimitedNatural\" xmi:id=\"E2U\" value=\"*\"/>"
                + "  </ownedEnd>"
                + "</packagedElement>", null);

        List<IrRelationship> rels = new AssociationParser(Xmi.context(xml)).parse();

        assertEquals(1, rels.size());
        IrRelationship rel = rels.get(0);
        assertEquals("AS1", rel.id);
        assertEquals("uml.composition", rel.type);
        assertEquals("C1", rel.sourceId);
        assertEquals("C2", rel.targetId);
        assertEquals("places", rel.name);

        @SuppressWarnings("unchecked")
        Map<String, Object> attrs = (Map<String, Object>) rel.meta.get(AssociationParser.UML_ATTRS);
        assertEquals("customer", attrs.get("sourceRole"));
        assertEquals("orders", attrs.get("targetRole"));
        assertEquals("1", attrs.get("sourceMultiplicity"));
        assertEquals("0..*", attrs.get("targetMultiplicity"));
        assertEquals(Boolean.FALSE, attrs.get("sourceNavigable"));
        assertEquals(Boolean.TRUE, attrs.get("targetNavigable"));
        assertEquals("composite", attrs.get("targetAggregation"));
        assertFalse(attrs.containsKey("sourceAggregation"));
    }

    @Test
    public void extraEndsAreTruncatedAndShortAssociationsDropped() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        String xml = Xmi.document(CLASSES
                + "<packagedElement xmi:type=\"uml:Association\" xmi:id=\"AS2\" memberEnd=\"E3 E4 E5\">"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E3\" type=\"C1\"/>"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E4\" type=\"C2\"/>"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E5\" type=\"C3\"/>"
                + "</packagedElement>"
                + "<packagedElement xmi:type=\"uml:Association\" xmi:id=\"AS3\">"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E6\" type=\"C1\"/>"
                + "</packagedElement>"
                + "<packagedElement xmi:type=\"uml:Association\" xmi:id=\"AS4\">"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E7\" type=\"C1\"/>"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E8\"/>"
                + "</packagedElement>", null);

        List<IrRelationship> rels = new AssociationParser(Xmi.context(xml, report)).parse();

        assertEquals(1, rels.size());
        assertEquals("AS2", rels.get(0).id);
        assertEquals("uml.association", rels.get(0).type);
        assertEquals("C2", rels.get(0).targetId);
        assertEquals(List.of("ea-xmi:association-too-many-ends", "ea-xmi:association-too-few-ends",
                "ea-xmi:association-unresolved-endpoints"), Xmi.codes(report));
    }

    @Test
    public void associationClassRelationshipIsSuffixed() {
        String xml = Xmi.document(CLASSES
                + "<packagedElement xmi:type=\"uml:AssociationClass\" xmi:id=\"AC1\" name=\"Enrollment\" memberEnd=\"E9 E10\">"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E9\" association=\"AC1\" type=\"C1\"/>"
                + "  <ownedEnd xmi:type=\"uml:Property\" xmi:id=\"E10\" association=\"AC1\" type=\"C2\"/>"
                + "</packagedElement>", null);

        IrRelationship rel = new AssociationParser(Xmi.context(xml)).parse().get(0);

        assertEquals("AC1" + AssociationParser.ASSOCIATION_CLASS_SUFFIX, rel.id);
        assertEquals("AssociationClass", rel.meta.get("metaclass"));
        assertEquals("C1", rel.sourceId);
    }
}
