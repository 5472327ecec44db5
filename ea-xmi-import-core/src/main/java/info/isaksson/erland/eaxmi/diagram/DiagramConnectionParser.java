package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrPoint;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewConnection;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
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
 * Adds diagram links to each view: waypoints plus the raw relationship and endpoint references.
 * Matching them to relationships and nodes happens during normalization.
 */
public final class DiagramConnectionParser {

    private static final String SYNTH_PREFIX = "eaDiagramLink_synth";
    private static final List<String> SOURCE_CHILDREN = List.of("source", "from", "start");
    private static final List<String> TARGET_CHILDREN = List.of("target", "to", "end");
    private static final List<String> CONNECTOR_CHILDREN = List.of("connector", "relationship");

    private final EaParseContext ctx;

    public DiagramConnectionParser(EaParseContext ctx) {
        this.ctx = ctx;
    }

    public List<IrView> parse(List<IrView> views) {
        if (views.isEmpty()) return views;
        DiagramRecords records = DiagramRecords.scan(ctx.doc);
        if (records == null) return views;

        List<IrView> out = new ArrayList<>(views.size());
        for (IrView view : views) {
            Element diagram = records.find(view);
            if (diagram == null) {
                out.add(view);
                continue;
            }

            List<IrViewConnection> connections = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (Element link : XmlDom.descendants(diagram)) {
                if (!isLink(link)) continue;
                int n = ctx.synthetic.nextNumber(SYNTH_PREFIX);
                List<IrExternalId> externalIds = new ArrayList<>();
                String id = pickId(link, n, externalIds);
                String connId = seen.contains(id) ? id + "__dup_" + n : id;
                if (!connId.equals(id)) {
                    ctx.report.warn("ea-xmi:duplicate-diagram-link-id",
                            "EA XMI: Duplicate diagram link id \"" + id + "\" in view \"" + view.name + "\"; disambiguated to \"" + connId + "\".",
                            "viewId", view.id, "connectionId", connId);
                }
                seen.add(connId);

                Map<String, Object> meta = new LinkedHashMap<>();
                meta.put("sourceSystem", "sparx-ea");
                meta.put(IrViewNode.META_REF_RAW, refRaw(link));

                List<IrPoint> points = GeometryDecoder.linkPoints(link);
                connections.add(new IrViewConnection(connId, null, null, null, null, null, points, externalIds, meta));
            }
            out.add(view.withConnections(connections));
        }
        return out;
    }

    /**
     * {@code *diagramlink}/{@code *diagramconnector} tags, {@code *link} tags with a relationship
     * reference or waypoints, and connector-shaped {@code <element>} records.
     */
    static boolean isLink(Element el) {
        String ln = XmlDom.localName(el);
        if (ln.endsWith("diagramlink") || ln.endsWith("diagramconnector")) return true;
        if (ln.equals("element")) return isConnectorElement(el);
        if (ln.endsWith("link")) {
            return DiagramKeys.first(el, DiagramKeys.LINK_RELATIONSHIP) != null
                    || DiagramKeys.first(el, DiagramKeys.LINK_POINTS) != null
                    || DiagramKeys.first(el, List.of("geometry")) != null;
        }
        return false;
    }

    /** {@code <element subject=".." style="SOID=..;EOID=.." geometry="SX=..;EDGE=..">}. */
    static boolean isConnectorElement(Element el) {
        if (!XmlDom.localName(el).equals("element")) return false;
        String subject = DiagramKeys.first(el, List.of("subject"));
        String style = DiagramKeys.first(el, List.of("style"));
        String geometry = DiagramKeys.first(el, List.of("geometry"));
        if (subject == null || style == null || geometry == null) return false;
        boolean hasEnds = GeometryDecoder.styleValue(style, "SOID") != null && GeometryDecoder.styleValue(style, "EOID") != null;
        String g = geometry.toLowerCase(Locale.ROOT);
        return hasEnds && (g.contains("edge=") || g.contains("sx=") || g.contains("sy="));
    }

    private String pickId(Element el, int n, List<IrExternalId> externalIds) {
        String guid = DiagramKeys.first(el, DiagramKeys.GUID);
        String xmiId = XmlDom.xmiId(el);
        String anyId = DiagramKeys.first(el, DiagramKeys.LINK_ID);
        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "diagram-link-xmi-id"));
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "diagram-link-guid"));
        if (anyId != null && !anyId.equals(xmiId) && !anyId.equals(guid)) {
            externalIds.add(IrExternalId.of("sparx-ea", anyId, "diagram-link-id"));
        }
        if (guid != null) return guid;
        if (xmiId != null) return xmiId;
        if (anyId != null) return anyId;

        String subject = DiagramKeys.first(el, List.of("subject"));
        if (subject != null) {
            externalIds.add(IrExternalId.of("sparx-ea", subject, "diagram-link-subject"));
            return subject;
        }
        String id = SYNTH_PREFIX + "_" + n;
        ctx.report.warn("ea-xmi:diagram-link-missing-id",
                "EA XMI: Diagram link missing id; generated synthetic link id \"" + id + "\".",
                "connectionId", id);
        return id;
    }

    /** Relationship and endpoint references, normalized to {@code connector/source/target} where the record form implies them. */
    static Map<String, String> refRaw(Element el) {
        Map<String, String> out = new LinkedHashMap<>();
        out.putAll(DiagramKeys.capture(el, DiagramKeys.LINK_RELATIONSHIP));
        out.putAll(DiagramKeys.capture(el, DiagramKeys.LINK_SOURCE));
        out.putAll(DiagramKeys.capture(el, DiagramKeys.LINK_TARGET));

        if (XmlDom.localName(el).equals("element")) {
            String subject = DiagramKeys.first(el, List.of("subject"));
            if (subject != null) out.put("connector", subject);
            String style = DiagramKeys.first(el, List.of("style"));
            String soid = GeometryDecoder.styleValue(style, "SOID");
            String eoid = GeometryDecoder.styleValue(style, "EOID");
            if (soid != null) out.put("source", soid);
            if (eoid != null) out.put("target", eoid);
        }

        for (Element ch : XmlDom.children(el)) {
            String ln = XmlDom.localName(ch);
            String ref = DiagramKeys.first(ch, DiagramKeys.CHILD_REF);
            if (ref == null) continue;
            if (SOURCE_CHILDREN.contains(ln)) out.put("source", ref);
            else if (TARGET_CHILDREN.contains(ln)) out.put("target", ref);
            else if (CONNECTOR_CHILDREN.contains(ln)) out.put("connector", ref);
        }
        return out;
    }
}
