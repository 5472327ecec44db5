package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class UmlRelationshipParserTest {

    private static final String CLASSES =
            "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"A\" name=\"A\"/>"
                    + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"B\" name=\"B\"/>"
                    + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"C\" name=\"C\"/>"
                    + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"D\" name=\"D\"/>";

    @Test
    public void multiClientDependencyExpandsPerPair() {
        String xml = Xmi.document(CLASSES
                + "<packagedElement xmi:type=\"uml:Dependency\" xmi:id=\"DEP1\" client=\"A B\" supplier=\"C D\"/>", null);

        List<IrRelationship> rels = new UmlRelationshipParser(Xmi.context(xml)).parse();

        assertEquals(List.of("DEP1_1", "DEP1_2", "DEP1_3", "DEP1_4"), ids(rels));
        assertEquals(List.of("A->C", "A->D", "B->C", "B->D"),
                rels.stream().map(r -> r.sourceId + "->" + r.targetId).collect(Collectors.toList()));
        assertTrue(rels.stream().allMatch(r -> "uml.dependency".equals(r.type)));
    }

    @Test
    public void generalizationTakesOwnerAsSpecific() {
        String xml = Xmi.document(
                "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"BASE\" name=\"Base\"/>"
                        + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"SUB\" name=\"Sub\">"
                        + "  <generalization xmi:type=\"uml:Generalization\" xmi:id=\"GEN1\" general=\"BASE\"/>"
                        + "</packagedElement>", null);

        IrRelationship gen = new UmlRelationshipParser(Xmi.context(xml)).parse().get(0);

        assertEquals("GEN1", gen.id);
        assertEquals("uml.generalization", gen.type);
        assertEquals("SUB", gen.sourceId);
        assertEquals("BASE", gen.targetId);
        assertEquals("Generalization", gen.meta.get("metaclass"));
    }

    @Test
    public void stereotypedDependencyBecomesInclude() {
        String xml = Xmi.document(CLASSES
                + "<packagedElement xmi:type=\"uml:Dependency\" xmi:id=\"DEP2\" client=\"A\" supplier=\"B\" stereotype=\"include\"/>", null);

        IrRelationship rel = new UmlRelationshipParser(Xmi.context(xml)).parse().get(0);

        assertEquals("uml.include", rel.type);
        assertEquals("include", rel.taggedValues.get(0).value);
    }

    @Test
    public void controlFlowCarriesGuard() {
        String xml = Xmi.document(
                "<packagedElement xmi:type=\"uml:Activity\" xmi:id=\"ACT\" name=\"Checkout\">"
                        + "  <node xmi:type=\"uml:OpaqueAction\" xmi:id=\"N1\" name=\"Pay\"/>"
                        + "  <node xmi:type=\"uml:ActivityFinalNode\" xmi:id=\"N2\"/>"
                        + "  <edge xmi:type=\"uml:ControlFlow\" xmi:id=\"CF1\" source=\"N1\" target=\"N2\">"
                        + "    <guard xmi:type=\"uml:OpaqueExpression\" xmi:id=\"G1\"><body>paid</body></guard>"
                        + "  </edge>"
                        + "</packagedElement>", null);

        IrRelationship flow = new UmlRelationshipParser(Xmi.context(xml)).parse().get(0);

        assertEquals("uml.controlFlow", flow.type);
        assertEquals("N1", flow.sourceId);
        assertEquals("N2", flow.targetId);
        assertEquals("paid", flow.attrs.get("guard"));
    }

    @Test
    public void unresolvedEndpointsAreSkippedWithWarning() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        String xml = Xmi.document(CLASSES
                + "<packagedElement xmi:type=\"uml:Realization\" xmi:id=\"REAL1\" client=\"A\"/>", null);

        assertTrue(new UmlRelationshipParser(Xmi.context(xml, report)).parse().isEmpty());
        assertEquals(List.of("ea-xmi:relationship-unresolved-endpoints"), Xmi.codes(report));
        assertTrue(report.warnings().get(0).message.contains("metaclass=Realization"));
    }

    @Test
    public void repeatedAnonymousPairGetsOneSyntheticId() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        String xml = Xmi.document(CLASSES
                + "<packagedElement xmi:type=\"uml:Generalization\" specific=\"A\" general=\"B\"/>"
                + "<packagedElement xmi:type=\"uml:Generalization\" specific=\"A\" general=\"B\"/>", null);

        List<IrRelationship> rels = new UmlRelationshipParser(Xmi.context(xml, report)).parse();

        assertEquals(List.of("eaRel_synth_1"), ids(rels));
        assertFalse(report.hasWarnings());
    }

    private static List<String> ids(List<IrRelationship> rels) {
        return rels.stream().map(r -> r.id).collect(Collectors.toList());
    }
}
