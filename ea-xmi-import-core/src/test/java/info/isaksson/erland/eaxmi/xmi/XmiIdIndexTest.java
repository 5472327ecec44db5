package info.isaksson.erland.eaxmi.xmi;

import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class XmiIdIndexTest {

    @Test
    public void indexesIdsAndNamesFirstOccurrenceWins() {
        XmiIdIndex index = XmiIdIndex.build(Xmi.parse(Xmi.document(
                "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"C1\" name=\" Customer \"/>"
                        + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"C1\" name=\"Other\"/>"
                        + "<packagedElement xmi:type=\"uml:Class\" xmi:id=\"C2\"/>",
                null)));

        assertTrue(index.contains("C1"));
        assertTrue(index.contains(" C1 "));
        assertEquals("Customer", index.name("C1"));
        assertNull(index.name("C2"));
        assertNull(index.resolve("missing"));
        assertNull(index.resolve("  "));
    }

    @Test
    public void repeatedBuildsOverOneDocumentAgree() {
        org.w3c.dom.Document doc = Xmi.parse(Xmi.withEaExtension(
                "<packagedElement xmi:type=\"uml:Package\" xmi:id=\"P1\" name=\"Root\">"
                        + "  <packagedElement xmi:type=\"uml:Class\" xmi:id=\"C1\" name=\"A\"/>"
                        + "  <packagedElement xmi:type=\"uml:Class\" id=\"C2\" name=\"B\"/>"
                        + "</packagedElement>",
                "<elements><element xmi:idref=\"C1\"/></elements>"));

        XmiIdIndex first = XmiIdIndex.build(doc);
        XmiIdIndex second = XmiIdIndex.build(doc);

        assertEquals(first.asMap().keySet(), second.asMap().keySet());
        assertEquals(List.copyOf(first.asMap().keySet()), List.copyOf(second.asMap().keySet()));
        assertEquals(first.names(), second.names());
        assertTrue(first.contains("C2"));
        assertEquals(first.size(), second.size());
    }

    @Test
    public void parsesIdRefListsAndHrefs() {
        assertEquals(List.of("A", "B", "A"), XmiIdIndex.parseIdRefList("  A  B\tA "));
        assertEquals(List.of(), XmiIdIndex.parseIdRefList(" "));
        assertEquals("String", XmiIdIndex.resolveHrefId("http://www.omg.org/spec/UML/20131001/PrimitiveTypes.xmi#String"));
        assertNull(XmiIdIndex.resolveHrefId("no-fragment"));
        assertNull(XmiIdIndex.resolveHrefId("trailing#"));
    }
}
