package info.isaksson.erland.eaxmi.parse;

import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EaLinksRelationshipParserTest {

    @Test
    public void linksBecomeRelationships() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        String body = "<elements><element xmi:idref=\"A\"><links>"
                + "<InformationFlow xmi:id=\"L1\" start=\"A\" end=\"B\" name=\"orders\"/>"
                + "<Mystery xmi:id=\"L2\" start=\"B\" end=\"A\"/>"
                + "<Dependency xmi:id=\"L3\" start=\"A\"/>"
                + "</links></element>"
                + "<element xmi:idref=\"B\"><links>"
                + "<InformationFlow xmi:id=\"L1\" start=\"A\" end=\"B\"/>"
                + "</links></element></elements>";

        List<IrRelationship> rels = new EaLinksRelationshipParser(Xmi.context(Xmi.withEaExtension("", body), report)).parse();

        assertEquals(2, rels.size());
        IrRelationship flow = rels.get(0);
        assertEquals("L1", flow.id);
        assertEquals("uml.informationFlow", flow.type);
        assertEquals("A", flow.sourceId);
        assertEquals("B", flow.targetId);
        assertEquals("orders", flow.name);
        assertEquals("links", flow.meta.get("source"));

        IrRelationship unknown = rels.get(1);
        assertEquals("Unknown", unknown.type);
        assertEquals("mystery", unknown.meta.get("sourceType"));

        assertEquals(List.of("ea-xmi:links-parsed"), Xmi.codes(report));
        assertFalse(report.hasWarnings());
    }

    @Test
    public void noLinksNoReport() {
        ImportReport report = new ImportReport("ea-xmi-uml");
        assertTrue(new EaLinksRelationshipParser(Xmi.context(Xmi.withEaExtension("", ""), report)).parse().isEmpty());
        assertEquals(0, report.size());
    }
}
