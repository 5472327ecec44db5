package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrBounds;
import info.isaksson.erland.eaxmi.ir.IrElement;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class ActivityContainmentTest {

    private static IrElement element(String id, String type, Map<String, Object> attrs) {
        return new IrElement(id, type, id, null, null, null, null, attrs, null);
    }

    private static IrViewNode placed(String id, String elementId, IrBounds bounds) {
        return new IrViewNode(id, null, elementId, bounds, null, null, null, null);
    }

    private static final List<IrElement> ELEMENTS = List.of(
            element("ACT", "uml.activity", null),
            element("ACT_SMALL", "uml.activity", null),
            element("A1", "uml.action", null),
            element("D1", "uml.decisionNode", null),
            element("A2", "uml.action", Map.of("activityId", "ELSEWHERE")),
            element("C1", "uml.class", null));

    private static IrView view(String viewpoint) {
        return new IrView("V", "Checkout", viewpoint, null, null, List.of(
                placed("n0", "ACT_SMALL", new IrBounds(10, 10, 50, 50)),
                placed("n1", "ACT", new IrBounds(0, 0, 600, 400)),
                placed("n2", "A1", new IrBounds(40, 40, 80, 30)),
                placed("n3", "D1", new IrBounds(140, 40, 20, 20)),
                placed("n4", "A2", new IrBounds(200, 40, 80, 30)),
                placed("n5", "C1", new IrBounds(300, 40, 80, 30))),
                null, null, null);
    }

    @Test
    public void largestActivityOwnsTheNodesOnItsDiagram() {
        Map<String, IrElement> out = ActivityContainment.apply(ELEMENTS, List.of(view("Activity"))).stream()
                .collect(Collectors.toMap(e -> e.id, Function.identity()));

        assertEquals(List.of("A1", "D1", "A2"), out.get("ACT").attrs.get("ownedNodeRefs"));
        assertEquals("ACT", out.get("A1").attrs.get("activityId"));
        assertEquals("ACT", out.get("D1").attrs.get("activityId"));
        assertEquals("ELSEWHERE", out.get("A2").attrs.get("activityId"));
        assertTrue(out.get("C1").attrs.isEmpty());
        assertTrue(out.get("ACT_SMALL").attrs.isEmpty());
    }

    @Test
    public void otherDiagramsAreIgnored() {
        assertSame(ELEMENTS, ActivityContainment.apply(ELEMENTS, List.of(view("Logical"))));
    }
}
