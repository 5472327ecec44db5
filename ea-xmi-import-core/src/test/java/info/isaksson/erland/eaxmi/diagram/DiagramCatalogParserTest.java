package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagramCatalogParserTest {

    @Test
    public void diagramsBecomeEmptyViews() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        List<IrView> views = new DiagramCatalogParser(Xmi.context(DiagramFixtures.document(), report)).parse();

        assertEquals(2, views.size());
        IrView logical = views.get(0);
        assertEquals("EAID_DIAG1", logical.id);
        assertEquals("Domain Classes", logical.name);
        assertEquals("Logical", logical.viewpoint);
        assertEquals("EAPK_DOMAIN", logical.folderId);
        assertEquals("Core types", logical.documentation);
        assertEquals("sparx-ea", logical.meta.get("sourceSystem"));
        assertEquals("EAPK_DOMAIN", logical.meta.get("owningPackageId"));
        assertTrue(logical.nodes.isEmpty());

        IrView activity = views.get(1);
        assertEquals("{G-2}", activity.id);
        assertEquals("Order flow", activity.name);
        assertEquals("Activity", activity.viewpoint);
        assertEquals("EAPK_X", activity.folderId);
        assertTrue(activity.externalIds.contains(IrExternalId.of("sparx-ea", "{G-2}", "diagram-guid")));

        assertFalse(report.hasWarnings());
    }

    @Test
    public void missingIdGetsSlugSuffix() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        String xml = Xmi.withEaExtension("", "<diagrams><diagram name=\"My Big Diagram!\"/></diagrams>");

        List<IrView> views = new DiagramCatalogParser(Xmi.context(xml, report)).parse();

        assertEquals("eaDiagram_synth_1_my-big-diagram", views.get(0).id);
        assertEquals(List.of("ea-xmi:diagram-missing-id"), Xmi.codes(report));
    }

    @Test
    public void noExtensionMeansNoViews() {
        ImportReport report = new ImportReport("ea-xmi-uml");

        assertTrue(new DiagramCatalogParser(Xmi.context(Xmi.document("", null), report)).parse().isEmpty());
        assertEquals(List.of("ea-xmi:no-ea-extension"), Xmi.codes(report));
    }

    @Test
    public void unnamedDiagramsAreNumbered() {
        String xml = Xmi.withEaExtension("", "<diagrams><diagram xmi:id=\"D1\"/><diagram xmi:id=\"D2\"/></diagrams>");

        List<IrView> views = new DiagramCatalogParser(Xmi.context(xml)).parse();

        assertEquals("Diagram 1", views.get(0).name);
        assertEquals("Diagram 2", views.get(1).name);
    }
}
