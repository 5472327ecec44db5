package info.isaksson.erland.eaxmi.merge;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.report.ImportIssue;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ProducerMergeTest {

    private static IrElement element(String id, String type) {
        return new IrElement(id, type, id, null, null, null, null, null, null);
    }

    private static IrRelationship rel(String id, String type, String src, String tgt) {
        return new IrRelationship(id, type, src, tgt, null, null, null, null, null, null);
    }

    @Test
    public void notationTypeReplacesUmlOnCollision() {
        ImportReport report = new ImportReport("ea-xmi-archimate");
        List<Produced<IrElement>> entries = new ArrayList<>();
        entries.addAll(Produced.all(Producer.UML, List.of(element("E1", "uml.class"), element("E2", "uml.class"))));
        entries.addAll(Produced.all(Producer.ARCHIMATE_PROFILE, List.of(element("E1", "archimate.businessActor"))));
        entries.addAll(Produced.all(Producer.BPMN_PROFILE, List.of(element("E2", "bpmn.task"))));

        List<IrElement> merged = ProducerMerge.mergeElements(entries, report);

        assertEquals(List.of("archimate.businessActor", "bpmn.task"),
                merged.stream().map(e -> e.type).collect(Collectors.toList()));
        List<ImportIssue> warnings = report.warnings();
        assertEquals(2, warnings.size());
        assertEquals("EA XMI: Element id collision between UML and ArchiMate; keeping ArchiMate.", warnings.get(0).message);
        assertTrue(warnings.get(1).message.contains("between UML and BPMN"));
        assertEquals("uml.class", warnings.get(0).context.get("droppedType"));
    }

    @Test
    public void firstOccurrenceWinsOtherwise() {
        ImportReport report = new ImportReport("ea-xmi-archimate");
        List<Produced<IrElement>> entries = new ArrayList<>();
        entries.addAll(Produced.all(Producer.ARCHIMATE_PROFILE, List.of(element("E1", "archimate.node"))));
        entries.addAll(Produced.all(Producer.UML, List.of(element("E1", "uml.node"))));

        List<IrElement> merged = ProducerMerge.mergeElements(entries, report);

        assertEquals("archimate.node", merged.get(0).type);
        assertEquals(List.of("ea-xmi:duplicate-element-id"), Xmi.codes(report));
    }

    @Test
    public void connectorRelationshipsAreTheSourceOfTruth() {
        ImportReport report = new ImportReport("ea-xmi-archimate");
        List<Produced<IrRelationship>> entries = new ArrayList<>();
        entries.addAll(Produced.all(Producer.EA_CONNECTOR, List.of(
                rel("R1", "archimate.serving", "A", "B"),
                rel("R2", "archimate.flow", "B", "C"))));
        entries.addAll(Produced.all(Producer.ARCHIMATE_PROFILE, List.of(
                rel("R1", "archimate.serving", "A", "B"),
                rel("X2", "archimate.flow", "B", "C"),
                rel("R3", "archimate.access", "C", "D"))));

        List<IrRelationship> merged = ProducerMerge.mergeRelationships(entries, false, report);

        assertEquals(List.of("R1", "R2", "R3"), merged.stream().map(r -> r.id).collect(Collectors.toList()));
        assertEquals(List.of("ea-xmi:relationship-dropped-duplicate", "ea-xmi:relationship-dropped-duplicate"),
                Xmi.codes(report));
    }

    @Test
    public void sameIdDifferentSemanticsIsDroppedAsSourceOfTruth() {
        ImportReport report = new ImportReport("ea-xmi-archimate");
        List<Produced<IrRelationship>> entries = new ArrayList<>();
        entries.addAll(Produced.all(Producer.EA_CONNECTOR, List.of(rel("R1", "archimate.serving", "A", "B"))));
        entries.addAll(Produced.all(Producer.ARCHIMATE_PROFILE, List.of(rel("R1", "archimate.triggering", "A", "B"))));

        List<IrRelationship> merged = ProducerMerge.mergeRelationships(entries, false, report);

        assertEquals(1, merged.size());
        assertEquals("archimate.serving", merged.get(0).type);
        assertEquals(List.of("ea-xmi:relationship-dropped-source-of-truth"), Xmi.codes(report));
    }

    @Test
    public void umlRelationshipsSuppressedForPureNotationExports() {
        ImportReport report = new ImportReport("ea-xmi-archimate");
        List<Produced<IrRelationship>> entries = new ArrayList<>();
        entries.addAll(Produced.all(Producer.UML, List.of(rel("U1", "uml.dependency", "A", "B"))));
        entries.addAll(Produced.all(Producer.EA_CONNECTOR, List.of(
                rel("R1", "archimate.serving", "A", "B"),
                rel("R9", "uml.dependency", "X", "Y"))));
        entries.addAll(Produced.all(Producer.UML_ASSOCIATION, List.of(rel("AS1", "uml.association", "A", "B"))));

        List<IrRelationship> merged = ProducerMerge.mergeRelationships(entries, true, report);

        assertEquals(List.of("R1"), merged.stream().map(r -> r.id).collect(Collectors.toList()));
        assertEquals(List.of("ea-xmi:uml-relationships-suppressed"), Xmi.codes(report));
        assertEquals("3", report.infos().get(0).context.get("count"));
    }

    @Test
    public void nonUmlRelationshipReplacesUmlOnIdCollision() {
        ImportReport report = new ImportReport("ea-xmi-bpmn");
        List<Produced<IrRelationship>> entries = new ArrayList<>();
        entries.addAll(Produced.all(Producer.UML, List.of(rel("F1", "uml.controlFlow", "A", "B"))));
        entries.addAll(Produced.all(Producer.BPMN_PROFILE, List.of(rel("F1", "bpmn.sequenceFlow", "A", "B"))));
        entries.addAll(Produced.all(Producer.UML_LINKS, List.of(rel("F1", "uml.controlFlow", "A", "B"))));

        List<IrRelationship> merged = ProducerMerge.mergeRelationships(entries, false, report);

        assertEquals("bpmn.sequenceFlow", merged.get(0).type);
        assertEquals(List.of("ea-xmi:relationship-id-collision", "ea-xmi:duplicate-relationship-id"), Xmi.codes(report));
    }

    @Test
    public void signatureIgnoresNameCase() {
        IrRelationship a = new IrRelationship("1", "archimate.flow", "A", "B", " Orders ", null, null, null, null, null);
        IrRelationship b = new IrRelationship("2", "archimate.flow", "A", "B", "orders", null, null, null, null, null);
        assertEquals(ProducerMerge.signature(a), ProducerMerge.signature(b));
    }
}
