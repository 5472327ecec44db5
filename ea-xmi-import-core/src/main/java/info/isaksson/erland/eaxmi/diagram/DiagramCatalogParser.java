package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.parse.EaParseContext;
import info.isaksson.erland.eaxmi.xmi.XmlDom;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Discovers the diagrams in the EA extension and turns each into an empty {@link IrView}.
 * Nodes and connections are filled in by {@link DiagramObjectParser} and {@link DiagramConnectionParser}.
 */
public final class DiagramCatalogParser {

    private static final String SYNTH_PREFIX = "eaDiagram_synth";

    private final EaParseContext ctx;

    public DiagramCatalogParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    public List<IrView> parse() {
        List<IrView> views = new ArrayList<>();
        DiagramRecords records = DiagramRecords.scan(ctx.doc);
        if (records == null) {
            ctx.report.warn("ea-xmi:no-ea-extension",
                    "EA XMI: No Enterprise Architect <xmi:Extension> element found; skipping diagram import.");
            return views;
        }

        Set<String> seen = new HashSet<>();
        for (Element el : records.diagrams()) {
            List<IrExternalId> externalIds = new ArrayList<>();
            String id = pickId(el, externalIds);
            if (!seen.add(id)) {
                ctx.report.warn("ea-xmi:duplicate-diagram-id",
                        "EA XMI: Duplicate diagram id \"" + id + "\" encountered; skipping subsequent occurrence.",
                        "viewId", id);
                continue;
            }

            String name = name(el);
            if (name == null) name = "Diagram " + (views.size() + 1);
            String diagramType = diagramType(el);
            String packageRef = owningPackageRef(el);
            String notes = notes(el);

            Map<String, Object> meta = new LinkedHashMap<>();
            meta.put("sourceSystem", "sparx-ea");
            if (diagramType != null) meta.put("eaDiagramType", diagramType);
            if (packageRef != null) meta.put("owningPackageId", packageRef);

            views.add(new IrView(id, name, diagramType, packageRef, notes, null, null, externalIds, meta));
        }
        return views;
    }

    private String pickId(Element el, List<IrExternalId> externalIds) {
        String guid = DiagramKeys.first(el, DiagramKeys.GUID);
        String xmiId = XmlDom.xmiId(el);
        String anyId = DiagramKeys.first(el, DiagramKeys.DIAGRAM_ID);
        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "xmi-id"));
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "diagram-guid"));
        if (anyId != null && !anyId.equals(xmiId) && !anyId.equals(guid)) {
            externalIds.add(IrExternalId.of("sparx-ea", anyId, "diagram-id"));
        }
        if (guid != null) return guid;
        if (xmiId != null) return xmiId;
        if (anyId != null) return anyId;

        String name = name(el);
        String id = SYNTH_PREFIX + "_" + ctx.synthetic.nextNumber(SYNTH_PREFIX) + "_" + slug(name == null ? "diagram" : name);
        ctx.report.warn("ea-xmi:diagram-missing-id",
                "EA XMI: Diagram missing id/guid; generated synthetic diagram id \"" + id + "\" (name=\"" + name + "\").",
                "viewId", id);
        return id;
    }

    /** Direct attribute, {@code <name>} child, then EA's {@code <properties name="..">}. */
    static String name(Element el) {
        String direct = DiagramKeys.first(el, DiagramKeys.DIAGRAM_NAME);
        if (direct != null) return direct;
        String child = XmlDom.blankToNull(XmlDom.childText(el, "name"));
        if (child != null) return child;
        Element props = XmlDom.childByLocalName(el, "properties");
        return props == null ? null : DiagramKeys.first(props, DiagramKeys.DIAGRAM_NAME);
    }

    static String diagramType(Element el) {
        String direct = DiagramKeys.first(el, DiagramKeys.DIAGRAM_TYPE);
        if (direct != null) return direct;
        for (Element props : XmlDom.childrenByLocalName(el, "properties")) {
            String t = DiagramKeys.first(props, DiagramKeys.DIAGRAM_TYPE);
            if (t != null) return t;
        }
        return null;
    }

    /** Owning package: direct attribute, a {@code package/owner/parent} child, then {@code <model package="..">}. */
    static String owningPackageRef(Element el) {
        String direct = DiagramKeys.first(el, DiagramKeys.DIAGRAM_PACKAGE);
        if (direct != null) return direct;
        for (Element ch : XmlDom.children(el)) {
            String ln = XmlDom.localName(ch);
            if (ln.equals("package") || ln.equals("owner") || ln.equals("parent")) {
                String ref = DiagramKeys.first(ch, DiagramKeys.CHILD_REF);
                if (ref != null) return ref;
            }
        }
        Element model = XmlDom.childByLocalName(el, "model");
        return model == null ? null : DiagramKeys.first(model, List.of("package", "owner"));
    }

    static String notes(Element el) {
        String direct = DiagramKeys.first(el, DiagramKeys.DIAGRAM_NOTES);
        if (direct != null) return direct;
        for (String tag : List.of("notes", "documentation", "description")) {
            String child = XmlDom.blankToNull(XmlDom.childText(el, tag));
            if (child != null) return child;
        }
        Element props = XmlDom.childByLocalName(el, "properties");
        return props == null ? null : DiagramKeys.first(props, List.of("documentation", "notes"));
    }

    static String slug(String s) {
        String out = s.toLowerCase(Locale.ROOT).replaceAll("\\s+", "-").replaceAll("[^a-z0-9_-]", "");
        return out.length() > 40 ? out.substring(0, 40) : out;
    }
}
