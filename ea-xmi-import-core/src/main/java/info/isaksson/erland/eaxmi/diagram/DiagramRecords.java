package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.xmi.EaExtensions;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Diagram records found under the EA extension blocks, with a key lookup back from views. */
final class DiagramRecords {

    private final List<Element> diagrams;
    private final Map<String, Element> byKey = new HashMap<>();

    private DiagramRecords(List<Element> diagrams) {
        this.diagrams = diagrams;
        for (Element d : diagrams) {
            for (String k : keys(d)) byKey.putIfAbsent(k, d);
        }
    }

    /** Null when the document has no EA extension at all. */
    static DiagramRecords scan(Document doc) {
        List<Element> extensions = EaExtensions.find(doc);
        if (extensions.isEmpty()) return null;
        List<Element> diagrams = new ArrayList<>();
        for (Element ext : extensions) {
            for (Element el : XmlDom.descendants(ext)) {
                if (isDiagram(el)) diagrams.add(el);
            }
        }
        return new DiagramRecords(diagrams);
    }

    List<Element> diagrams() {
        return diagrams;
    }

    /** Diagram element for a view, matched on its id or any external id. */
    Element find(IrView view) {
        Set<String> keys = new LinkedHashSet<>();
        keys.add(view.id);
        for (IrExternalId ex : view.externalIds) keys.add(ex.id);
        for (String k : keys) {
            Element hit = byKey.get(k);
            if (hit != null) return hit;
        }
        return null;
    }

    static boolean isDiagram(Element el) {
        String ln = XmlDom.localName(el);
        if (ln.equals("diagram")) return true;
        return ln.endsWith("diagram") && !ln.contains("diagramobject") && !ln.contains("diagramlink");
    }

    /** guid, xmi:id, then any other id attribute; distinct and in that order. */
    static List<String> keys(Element diagram) {
        Set<String> out = new LinkedHashSet<>();
        for (String v : new String[] {
                DiagramKeys.first(diagram, DiagramKeys.GUID),
                XmlDom.xmiId(diagram),
                DiagramKeys.first(diagram, DiagramKeys.DIAGRAM_ID)}) {
            if (v != null) out.add(v);
        }
        return new ArrayList<>(out);
    }
}
