package info.isaksson.erland.eaxmi.xmi;

import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/** Locates {@code <xmi:Extension extender="Enterprise Architect">} blocks. */
public final class EaExtensions {

    private EaExtensions() {}

    public static boolean isEaExtension(Element el) {
        if (!XmlDom.localName(el).equals("extension")) return false;
        String extender = XmlDom.attrExact(el, "extender");
        if (extender == null) extender = XmlDom.attr(el, "extender");
        return extender != null && extender.toLowerCase(Locale.ROOT).contains("enterprise architect");
    }

    /** All EA extension elements in document order. */
    public static List<Element> find(Document doc) {
        List<Element> out = new ArrayList<>();
        if (doc == null || doc.getDocumentElement() == null) return out;
        for (Element el : XmlDom.descendantsByLocalName(doc.getDocumentElement(), "extension")) {
            if (isEaExtension(el)) out.add(el);
        }
        return out;
    }

    /** Direct {@code <blockName>} children of every EA extension, e.g. {@code connectors} or {@code diagrams}. */
    public static List<Element> blocks(Document doc, String blockName) {
        List<Element> out = new ArrayList<>();
        for (Element ext : find(doc)) {
            out.addAll(XmlDom.childrenByLocalName(ext, blockName));
        }
        return out;
    }
}
