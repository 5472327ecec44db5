package info.isaksson.erland.eaxmi.merge;

import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrView;

import java.util.List;
import java.util.Locale;

/**
 * Decides whether raw UML relationships are noise in an export.
 *
 * <p>A file that carries ArchiMate or BPMN content but no UML diagram is a pure notation export;
 * EA still writes UML relationships for every connector there, which would duplicate the notation
 * relationships.</p>
 */
public final class NotationSignals {

    private static final List<String> UML_DIAGRAM_HINTS = List.of(
            "class", "activity", "sequence", "use case", "usecase", "state", "component", "deployment",
            "package", "object", "communication", "composite", "interaction", "timing");

    private NotationSignals() {}

    /** True when any view is a UML diagram, judged by its viewpoint or EA diagram type. */
    public static boolean hasUmlViews(List<IrView> views) {
        for (IrView v : views) {
            if (isUmlDiagramType(v.viewpoint)) return true;
            Object eaType = v.meta.get("eaDiagramType");
            if (eaType != null && isUmlDiagramType(eaType.toString())) return true;
        }
        return false;
    }

    static boolean isUmlDiagramType(String raw) {
        if (raw == null) return false;
        String t = raw.trim().toLowerCase(Locale.ROOT);
        if (t.isEmpty() || t.contains("archimate") || t.contains("bpmn")) return false;
        if (t.contains("uml")) return true;
        for (String hint : UML_DIAGRAM_HINTS) {
            if (t.contains(hint)) return true;
        }
        return false;
    }

    public static boolean looksLikeArchimate(List<IrRelationship> connectorRelationships, List<IrElement> archimateElements,
                                             List<IrRelationship> archimateProfileRelationships) {
        return !connectorRelationships.isEmpty()
                || anyElementTyped(archimateElements, "archimate.")
                || anyRelationshipTyped(archimateProfileRelationships, "archimate.");
    }

    public static boolean looksLikeBpmn(List<IrElement> bpmnElements, List<IrRelationship> bpmnRelationships) {
        return !bpmnRelationships.isEmpty() || anyElementTyped(bpmnElements, "bpmn.");
    }

    private static boolean anyElementTyped(List<IrElement> elements, String prefix) {
        for (IrElement e : elements) {
            if (e.type.startsWith(prefix)) return true;
        }
        return false;
    }

    private static boolean anyRelationshipTyped(List<IrRelationship> relationships, String prefix) {
        for (IrRelationship r : relationships) {
            if (r.type.startsWith(prefix)) return true;
        }
        return false;
    }
}
