package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrPoint;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewConnection;
import info.isaksson.erland.eaxmi.parse.EaParseContext;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramConnectionParserTest {

    @Test
    public void connectorElementUsesSubjectAndStyleEnds() {
        EaParseContext ctx = Xmi.context(DiagramFixtures.document());
        List<IrView> views = new DiagramConnectionParser(ctx).parse(new DiagramCatalogParser(ctx).parse());

        List<IrViewConnection> conns = views.get(0).connections;
        assertEquals(1, conns.size());
        IrViewConnection c = conns.get(0);
        assertEquals("EAID_A1", c.id);
        assertNull(c.relationshipId);
        assertTrue(c.externalIds.contains(IrExternalId.of("sparx-ea", "EAID_A1", "diagram-link-subject")));

        Map<String, String> expected = new LinkedHashMap<>();
        expected.put("connector", "EAID_A1");
        expected.put("source", "AAA111");
        expected.put("target", "BBB222");
        assertEquals(expected, c.refRaw());
        assertEquals(List.of(new IrPoint(220, 85), new IrPoint(300, 85)), c.points);
    }

    @Test
    public void diagramLinkChildrenProvideEnds() {
        EaParseContext ctx = Xmi.context(DiagramFixtures.document());
        List<IrView> views = new DiagramConnectionParser(ctx).parse(new DiagramCatalogParser(ctx).parse());

        IrViewConnection c = views.get(1).connections.get(0);
        assertEquals("LNK1", c.id);
        assertEquals("EAID_A1", c.refRaw().get("connector"));
        assertEquals("OBJ1", c.refRaw().get("source"));
        assertEquals("OBJ1__dup_2", c.refRaw().get("target"));
        assertNull(c.points);
    }

    @Test
    public void connectionMetaDoesNotInheritViewMeta() {
        EaParseContext ctx = Xmi.context(DiagramFixtures.document());
        List<IrView> views = new DiagramConnectionParser(ctx).parse(new DiagramCatalogParser(ctx).parse());

        IrView view = views.get(0);
        assertEquals("EAPK_DOMAIN", view.meta.get("owningPackageId"));
        IrViewConnection c = view.connections.get(0);
        assertEquals("sparx-ea", c.meta.get("sourceSystem"));
        assertFalse(c.meta.containsKey("owningPackageId"));
        assertFalse(c.meta.containsKey("eaDiagramType"));
        assertEquals(2, c.meta.size());
    }

    @Test
    public void linkWithoutAnyIdIsSynthesized() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        String xml = Xmi.withEaExtension("", "<diagrams><diagram xmi:id=\"D1\">"
                + "<diagramLink connector=\"R1\"/></diagram></diagrams>");
        EaParseContext ctx = Xmi.context(xml, report);

        List<IrView> views = new DiagramConnectionParser(ctx).parse(new DiagramCatalogParser(ctx).parse());

        assertEquals("eaDiagramLink_synth_1", views.get(0).connections.get(0).id);
        assertEquals(List.of("ea-xmi:diagram-link-missing-id"), Xmi.codes(report));
    }

    @Test
    public void nodeShapedElementIsNotAConnector() {
        assertFalse(DiagramConnectionParser.isConnectorElement(Xmi.parse(
                "<element subject=\"X\" style=\"DUID=1;\" geometry=\"Left=0;Top=0;Right=1;Bottom=1;\"/>").getDocumentElement()));
    }
}
