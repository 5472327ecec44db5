package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrBounds;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import info.isaksson.erland.eaxmi.ir.IrViewNodeKind;
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
 * Adds placed objects with their decoded bounds to each view. Element references are copied
 * verbatim to {@code meta.refRaw}; resolving them is left to normalization.
 */
public final class DiagramObjectParser {

    private static final String SYNTH_PREFIX = "eaDiagramObject_synth";

    private final EaParseContext ctx;

    public DiagramObjectParser(EaParseContext ctx) {
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
                ctx.report.warn("ea-xmi:diagram-not-found",
                        "EA XMI: Could not find diagram element for view \"" + view.name + "\" (id=\"" + view.id + "\"); leaving it empty.",
                        "viewId", view.id);
                out.add(view);
                continue;
            }

            List<IrViewNode> nodes = new ArrayList<>();
            Set<String> seen = new HashSet<>();
            for (Element obj : XmlDom.descendants(diagram)) {
                if (!isObject(obj)) continue;
                int n = ctx.synthetic.nextNumber(SYNTH_PREFIX);
                List<IrExternalId> externalIds = new ArrayList<>();
                String id = pickId(obj, n, externalIds);
                String nodeId = seen.contains(id) ? id + "__dup_" + n : id;
                if (!nodeId.equals(id)) {
                    ctx.report.warn("ea-xmi:duplicate-diagram-object-id",
                            "EA XMI: Duplicate diagram object id \"" + id + "\" in view \"" + view.name + "\"; disambiguated to \"" + nodeId + "\".",
                            "viewId", view.id, "nodeId", nodeId);
                }
                seen.add(nodeId);

                Map<String, Object> meta = new LinkedHashMap<>(view.meta);
                meta.put("sourceSystem", "sparx-ea");
                meta.put(IrViewNode.META_REF_RAW, DiagramKeys.capture(obj, DiagramKeys.NODE_REF));

                IrBounds bounds = GeometryDecoder.bounds(obj);
                String label = DiagramKeys.first(obj, DiagramKeys.NODE_LABEL);
                nodes.add(new IrViewNode(nodeId, kind(obj), null, bounds, null, label, externalIds, meta));
            }
            out.add(view.withNodes(nodes));
        }
        return out;
    }

    /**
     * {@code *diagramobject} tags, {@code *object} tags carrying geometry or a reference, and EA's
     * {@code <elements><element subject=".." geometry="Left=..">} records that are not connectors.
     */
    static boolean isObject(Element el) {
        String ln = XmlDom.localName(el);
        if (ln.endsWith("diagramobject")) return true;
        if (ln.endsWith("object")) {
            return DiagramKeys.first(el, DiagramKeys.LEFT) != null
                    || DiagramKeys.first(el, DiagramKeys.X) != null
                    || DiagramKeys.first(el, DiagramKeys.BOUNDS_STRING) != null
                    || DiagramKeys.first(el, DiagramKeys.NODE_REF) != null;
        }
        if (ln.equals("element") && XmlDom.hasAncestor(el, "elements")) {
            return DiagramKeys.first(el, List.of("subject")) != null
                    && DiagramKeys.first(el, DiagramKeys.BOUNDS_STRING) != null
                    && !DiagramConnectionParser.isConnectorElement(el);
        }
        return false;
    }

    static IrViewNodeKind kind(Element el) {
        String ln = XmlDom.localName(el);
        String t = DiagramKeys.first(el, DiagramKeys.NODE_KIND);
        t = t == null ? "" : t.toLowerCase(Locale.ROOT);
        if (ln.contains("note") || t.contains("note")) return IrViewNodeKind.NOTE;
        if (t.contains("group") || t.contains("boundary") || t.contains("container")) return IrViewNodeKind.GROUP;
        if (t.contains("image") || t.contains("bitmap") || t.contains("icon")) return IrViewNodeKind.IMAGE;
        if (t.contains("shape") || t.contains("rectangle") || t.contains("line")) return IrViewNodeKind.SHAPE;
        return IrViewNodeKind.ELEMENT;
    }

    /** guid, xmi:id, other id attribute, the style {@code DUID}, else synthetic. */
    private static String pickId(Element el, int n, List<IrExternalId> externalIds) {
        String guid = DiagramKeys.first(el, DiagramKeys.GUID);
        String xmiId = XmlDom.xmiId(el);
        String anyId = DiagramKeys.first(el, DiagramKeys.OBJECT_ID);
        String duid = GeometryDecoder.styleValue(DiagramKeys.first(el, List.of("style")), "DUID");

        if (xmiId != null) externalIds.add(IrExternalId.of("xmi", xmiId, "diagram-object-xmi-id"));
        if (guid != null) externalIds.add(IrExternalId.of("sparx-ea", guid, "diagram-object-guid"));
        if (anyId != null && !anyId.equals(xmiId) && !anyId.equals(guid)) {
            externalIds.add(IrExternalId.of("sparx-ea", anyId, "diagram-object-id"));
        }
        if (duid != null) externalIds.add(IrExternalId.of("sparx-ea", duid, "diagram-object-duid"));

        if (guid != null) return guid;
        if (xmiId != null) return xmiId;
        if (anyId != null) return anyId;
        if (duid != null) return duid;
        return SYNTH_PREFIX + "_" + n;
    }
}
