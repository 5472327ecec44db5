package info.isaksson.erland.eaxmi.xmi;

import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import static org.junit.jupiter.api.Assertions.*;

public class SyntheticIdsTest {

    @Test
    public void assignmentIsStablePerNodeAndCountersArePerPrefix() {
        Document doc = Xmi.parse("<root><a/><b xmi:id=\"B1\" xmlns:xmi=\"" + Xmi.XMI_NS + "\"/></root>");
        Element a = XmlDom.childByLocalName(doc.getDocumentElement(), "a");
        Element b = XmlDom.childByLocalName(doc.getDocumentElement(), "b");

        SyntheticIds ids = new SyntheticIds();
        assertEquals("pkg_1", ids.assign(a, "pkg"));
        assertEquals("pkg_1", ids.assign(a, "pkg"));
        assertEquals("el_1", ids.next("el"));
        assertEquals("pkg_2", ids.next("pkg"));

        assertEquals("pkg_1", ids.idOf(a));
        assertEquals("B1", ids.idOf(b));
        assertNull(ids.lookup(b));
        assertEquals(1, ids.size());
        assertFalse(a.hasAttribute("xmi:id"), "source document must not be modified");
    }

    @Test
    public void bindKeepsExistingBinding() {
        Document doc = Xmi.parse("<root><a/></root>");
        Element a = XmlDom.childByLocalName(doc.getDocumentElement(), "a");
        SyntheticIds ids = new SyntheticIds();
        assertEquals("first", ids.bind(a, "first"));
        assertEquals("first", ids.bind(a, "second"));
    }
}
