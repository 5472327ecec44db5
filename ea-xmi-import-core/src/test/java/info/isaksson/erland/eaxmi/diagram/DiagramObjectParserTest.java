package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrBounds;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import info.isaksson.erland.eaxmi.ir.IrViewNodeKind;
import info.isaksson.erland.eaxmi.parse.EaParseContext;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramObjectParserTest {

    @Test
    public void elementRecordsBecomeNodesKeyedByDuid() {
        EaParseContext ctx = Xmi.context(DiagramFixtures.document());
        List<IrView> views = new DiagramObjectParser(ctx).parse(new DiagramCatalogParser(ctx).parse());

        List<IrViewNode> nodes = views.get(0).nodes;
        assertEquals(2, nodes.size());
        IrViewNode first = nodes.get(0);
        assertEquals("AAA111", first.id);
        assertEquals(IrViewNodeKind.ELEMENT, first.kind);
        assertNull(first.elementId);
        assertEquals(new IrBounds(100, 50, 120, 70), first.bounds);
        assertEquals(Map.of("subject", "EAID_C1"), first.refRaw());
        assertTrue(first.externalIds.contains(IrExternalId.of("sparx-ea", "AAA111", "diagram-object-duid")));
        assertEquals("Logical", first.meta.get("eaDiagramType"));
        assertEquals("BBB222", nodes.get(1).id);
    }

    @Test
    public void duplicateObjectIdsAreDisambiguated() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        EaParseContext ctx = Xmi.context(DiagramFixtures.document(), report);
        List<IrView> views = new DiagramObjectParser(ctx).parse(new DiagramCatalogParser(ctx).parse());

        List<IrViewNode> nodes = views.get(1).nodes;
        assertEquals(2, nodes.size());
        assertEquals("OBJ1", nodes.get(0).id);
        assertEquals(IrViewNodeKind.NOTE, nodes.get(0).kind);
        assertEquals(new IrBounds(0, 0, 50, 40), nodes.get(0).bounds);
        assertTrue(nodes.get(1).id.startsWith("OBJ1__dup_"));
        assertEquals(new IrBounds(60, 0, 50, 40), nodes.get(1).bounds);
        assertEquals(List.of("ea-xmi:duplicate-diagram-object-id"), Xmi.codes(report));
    }

    @Test
    public void nodeKinds() {
        assertEquals(IrViewNodeKind.GROUP, DiagramObjectParser.kind(Xmi.parse("<o type=\"Boundary\"/>").getDocumentElement()));
        assertEquals(IrViewNodeKind.IMAGE, DiagramObjectParser.kind(Xmi.parse("<o kind=\"image\"/>").getDocumentElement()));
        assertEquals(IrViewNodeKind.NOTE, DiagramObjectParser.kind(Xmi.parse("<noteObject/>").getDocumentElement()));
        assertEquals(IrViewNodeKind.ELEMENT, DiagramObjectParser.kind(Xmi.parse("<o/>").getDocumentElement()));
    }
}
