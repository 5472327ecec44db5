package info.isaksson.erland.eaxmi.testutil;

import info.isaksson.erland.eaxmi.parse.EaParseContext;
import info.isaksson.erland.eaxmi.report.ImportReport;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Document;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;

/** Small XMI documents for tests. */
public final class Xmi {

    public static final String XMI_NS = "http://schema.omg.org/spec/XMI/2.1";
    public static final String UML_NS = "http://schema.omg.org/spec/UML/2.1";
    public static final String ARCHIMATE_NS = "http://www.sparxsystems.com/profiles/ArchiMate3/1.0";
    public static final String BPMN_NS = "http://www.sparxsystems.com/profiles/BPMN2.0/1.0";

    private Xmi() {}

    /** An {@code xmi:XMI} document with {@code model} inside a {@code uml:Model} and {@code extension} after it. */
    public static String document(String model, String extension) {
        return "<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n"
                + "<xmi:XMI xmi:version=\"2.1\" xmlns:xmi=\"" + XMI_NS + "\" xmlns:uml=\"" + UML_NS + "\""
                + " xmlns:ArchiMate3=\"" + ARCHIMATE_NS + "\" xmlns:BPMN2.0=\"" + BPMN_NS + "\">\n"
                + "<uml:Model xmi:type=\"uml:Model\" name=\"EA_Model\">\n"
                + (model == null ? "" : model) + "\n"
                + "</uml:Model>\n"
                + (extension == null ? "" : extension) + "\n"
                + "</xmi:XMI>\n";
    }

    /** {@link #document} with the extension wrapped in an EA {@code xmi:Extension}. */
    public static String withEaExtension(String model, String extensionBody) {
        return document(model, eaExtension(extensionBody));
    }

    public static String eaExtension(String body) {
        return "<xmi:Extension extender=\"Enterprise Architect\" extenderID=\"6.5\">\n"
                + (body == null ? "" : body) + "\n</xmi:Extension>";
    }

    public static Document parse(String xml) {
        try {
            return XmlDom.parse(xml);
        } catch (Exception e) {
            throw new IllegalStateException("Test fixture is not well-formed: " + e.getMessage(), e);
        }
    }

    public static EaParseContext context(String xml, ImportReport report) {
        return new EaParseContext(parse(xml), report);
    }

    public static EaParseContext context(String xml) {
        return context(xml, new ImportReport("ea-xmi-uml"));
    }

    /** Classpath resource as text. */
    public static String resource(String path) {
        try (InputStream in = Xmi.class.getResourceAsStream(path)) {
            if (in == null) throw new IllegalArgumentException("Missing test resource: " + path);
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public static byte[] resourceBytes(String path) {
        try (InputStream in = Xmi.class.getResourceAsStream(path)) {
            if (in == null) throw new IllegalArgumentException("Missing test resource: " + path);
            return in.readAllBytes();
        } catch (IOException e) {
            throw new IllegalStateException(e);
        }
    }

    public static List<String> codes(ImportReport report) {
        return report.issues().stream().map(i -> i.code).collect(Collectors.toList());
    }
}
