package info.isaksson.erland.eaxmi.merge;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrView;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class NotationSignalsTest {

    private static IrView view(String viewpoint, String eaType) {
        return new IrView("V", "V", viewpoint, null, null, null, null, null,
                eaType == null ? null : Map.of("eaDiagramType", eaType));
    }

    @Test
    public void umlDiagramTypes() {
        assertTrue(NotationSignals.isUmlDiagramType("Class"));
        assertTrue(NotationSignals.isUmlDiagramType("Use Case"));
        assertTrue(NotationSignals.isUmlDiagramType("UML Structural"));
        assertFalse(NotationSignals.isUmlDiagramType("ArchiMate3::Application"));
        assertFalse(NotationSignals.isUmlDiagramType("BPMN2.0::Business Process"));
        assertFalse(NotationSignals.isUmlDiagramType("Logical"));
        assertFalse(NotationSignals.isUmlDiagramType(" "));
    }

    @Test
    public void viewsAreJudgedByViewpointOrEaType() {
        assertTrue(NotationSignals.hasUmlViews(List.of(view(null, "Sequence"))));
        assertTrue(NotationSignals.hasUmlViews(List.of(view("ArchiMate3::Layered", null), view("Activity", null))));
        assertFalse(NotationSignals.hasUmlViews(List.of(view("ArchiMate3::Layered", "ArchiMate3::Layered"))));
        assertFalse(NotationSignals.hasUmlViews(List.of()));
    }

    @Test
    public void notationDetection() {
        IrElement actor = new IrElement("A", "archimate.businessActor", "A", null, null, null, null, null, null);
        IrElement unknown = new IrElement("U", null, "U", null, null, null, null, null, null);
        IrRelationship flow = new IrRelationship("F", "bpmn.sequenceFlow", "A", "B", null, null, null, null, null, null);

        assertTrue(NotationSignals.looksLikeArchimate(List.of(), List.of(actor), List.of()));
        assertFalse(NotationSignals.looksLikeArchimate(List.of(), List.of(unknown), List.of()));
        assertTrue(NotationSignals.looksLikeArchimate(List.of(flow), List.of(), List.of()));
        assertTrue(NotationSignals.looksLikeBpmn(List.of(), List.of(flow)));
        assertFalse(NotationSignals.looksLikeBpmn(List.of(actor), List.of()));
    }
}
