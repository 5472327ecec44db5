package info.isaksson.erland.eaxmi.core;

import info.isaksson.erland.eaxmi.testutil.Xmi;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

public class EaXmiSnifferTest {

    @Test
    public void xmiExtensionIsEnough() {
        assertTrue(EaXmiSniffer.sniff(SniffContext.of(new byte[0], "Model.XMI")));
    }

    @Test
    public void eaExportIsRecognisedByContent() {
        byte[] bytes = Xmi.resourceBytes("/xmi/ea-uml-mini.xmi");
        assertTrue(EaXmiSniffer.sniff(SniffContext.of(bytes, "export.xml")));
    }

    @Test
    public void plainUmlXmiWithoutEaMarkersIsRejected() {
        String xml = "<xmi:XMI xmlns:xmi=\"http://www.omg.org/spec/XMI/20131001\" xmlns:uml=\"http://www.omg.org/spec/UML/20131001\">"
                + "<uml:Model name=\"m\"/></xmi:XMI>";
        assertFalse(EaXmiSniffer.sniff(SniffContext.of(xml.getBytes(StandardCharsets.UTF_8), "model.xml")));
    }

    @Test
    public void unrelatedXmlIsRejected() {
        String xml = "<project><name>Enterprise Architect notes</name></project>";
        assertFalse(EaXmiSniffer.sniff(SniffContext.of(xml.getBytes(StandardCharsets.UTF_8), "pom.xml")));
        assertFalse(EaXmiSniffer.sniff(null));
    }

    @Test
    public void asciiProjectionCatchesUndecodableText() {
        String xml = "<xmi:XMI xmlns:uml=\"http://www.omg.org/spec/UML/2.1\"><uml:Model ea_guid=\"{X}\"/></xmi:XMI>";
        byte[] bytes = xml.getBytes(StandardCharsets.UTF_8);
        assertTrue(EaXmiSniffer.sniff(new SniffContext("", bytes, "bin")));
    }

    @Test
    public void extensionIsTakenFromTheLastDot() {
        assertEquals("xmi", SniffContext.extensionOf("a.b.xmi"));
        assertEquals("", SniffContext.extensionOf("README"));
        assertEquals("", SniffContext.extensionOf("trailing."));
        assertEquals("", SniffContext.extensionOf(null));
    }
}
