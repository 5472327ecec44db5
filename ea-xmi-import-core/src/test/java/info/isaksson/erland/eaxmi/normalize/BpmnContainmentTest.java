package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrBounds;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

public class BpmnContainmentTest {

    private static final Map<String, String> TYPES = Map.of(
            "POOL", "bpmn.pool",
            "LANE", "bpmn.lane",
            "T1", "bpmn.task",
            "T2", "bpmn.userTask",
            "C", "uml.class");

    private static IrViewNode placed(String id, String elementId, IrBounds bounds) {
        return new IrViewNode(id, null, elementId, bounds, null, null, null, null);
    }

    @Test
    public void nodesNestIntoSmallestContainer() {
        IrView view = new IrView("V", "Process", "BPMN2.0::Business Process", null, null, List.of(
                placed("t1", "T1", new IrBounds(100, 50, 100, 60)),
                placed("c", "C", new IrBounds(2000, 2000, 10, 10)),
                placed("lane", "LANE", new IrBounds(30, 0, 970, 250)),
                placed("pool", "POOL", new IrBounds(0, 0, 1000, 500)),
                placed("t2", "T2", new IrBounds(100, 300, 100, 60))),
                null, null, null);

        IrView out = BpmnContainment.apply(view, TYPES);

        assertEquals(List.of("pool", "lane", "t1", "t2", "c"),
                out.nodes.stream().map(n -> n.id).collect(Collectors.toList()));
        Map<String, String> parents = out.nodes.stream().filter(n -> n.parentNodeId != null)
                .collect(Collectors.toMap(n -> n.id, n -> n.parentNodeId));
        assertEquals(Map.of("lane", "pool", "t1", "lane", "t2", "pool"), parents);
    }

    @Test
    public void viewWithoutContainersIsUnchanged() {
        IrView view = new IrView("V", "Tasks", null, null, null, List.of(
                placed("t1", "T1", new IrBounds(0, 0, 10, 10))), null, null, null);

        assertSame(view, BpmnContainment.apply(view, TYPES));
    }
}
