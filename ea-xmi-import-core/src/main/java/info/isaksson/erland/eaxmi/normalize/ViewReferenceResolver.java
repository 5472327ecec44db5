package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.diagram.DiagramKeys;
import info.isaksson.erland.eaxmi.ir.IrExternalId;
import info.isaksson.erland.eaxmi.ir.IrRelationship;
import info.isaksson.erland.eaxmi.ir.IrView;
import info.isaksson.erland.eaxmi.ir.IrViewConnection;
import info.isaksson.erland.eaxmi.ir.IrViewNode;
import info.isaksson.erland.eaxmi.ir.IrViewNodeKind;
import info.isaksson.erland.eaxmi.report.ImportReport;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves the {@code refRaw} placeholders of view nodes and connections to IR ids.
 *
 * <p>Nothing is dropped: a node or connection that cannot be resolved keeps its {@code refRaw} and
 * stays without ids, with a warning.</p>
 */
final class ViewReferenceResolver {

    static final String META_RESOLVED_FROM = "resolvedFrom";

    private final IdLookup elements;
    private final IdLookup relationships;
    private final List<IrRelationship> relationshipList;
    private final ImportReport report;

    ViewReferenceResolver(IdLookup elements, IdLookup relationships, List<IrRelationship> relationshipList, ImportReport report) {
        this.elements = elements;
        this.relationships = relationships;
        this.relationshipList = relationshipList;
        this.report = report;
    }

    IrView resolve(IrView view) {
        List<IrViewNode> nodes = new ArrayList<>(view.nodes.size());
        for (IrViewNode n : view.nodes) nodes.add(resolveNode(view, n));

        NodeKeys keys = new NodeKeys(nodes);
        List<IrViewConnection> connections = new ArrayList<>(view.connections.size());
        for (IrViewConnection c : view.connections) connections.add(resolveConnection(view, c, keys));

        return view.withNodes(nodes).withConnections(connections);
    }

    private IrViewNode resolveNode(IrView view, IrViewNode n) {
        if (n.elementId != null || n.kind != IrViewNodeKind.ELEMENT) return n;

        List<String> candidates = RefTokens.candidatesThenRest(n.refRaw(), DiagramKeys.NODE_REF);
        IdLookup.Hit hit = elements.first(candidates);
        if (hit != null) {
            Map<String, Object> meta = new LinkedHashMap<>(n.meta);
            meta.put(META_RESOLVED_FROM, hit.from);
            return n.withElementId(hit.id).withMeta(meta);
        }

        // Connector-shaped objects carry a relationship ref; they are not element placeholders.
        if (!candidates.isEmpty() && relationships.containsAny(candidates)) return n;

        Map<String, String> context = context(view, "nodeId", n.id);
        if (candidates.isEmpty()) {
            report.warn("ea-xmi:view-node-missing-ref",
                    "EA XMI Normalize: View node had no resolvable reference; kept without element.", context);
        } else {
            context.put("refCandidates", String.join(", ", head(candidates)));
            report.warn("ea-xmi:view-node-unresolved-element",
                    "EA XMI Normalize: Could not resolve referenced element for a view node; kept without element.", context);
        }
        return n;
    }

    private IrViewConnection resolveConnection(IrView view, IrViewConnection c, NodeKeys keys) {
        if (c.relationshipId != null) return c;

        Map<String, String> refRaw = c.refRaw();
        List<String> relCandidates = RefTokens.candidates(refRaw, DiagramKeys.CONNECTION_RELATIONSHIP);
        List<String> srcCandidates = RefTokens.candidates(refRaw, DiagramKeys.LINK_SOURCE);
        List<String> tgtCandidates = RefTokens.candidates(refRaw, DiagramKeys.LINK_TARGET);

        Endpoint src = resolveEndpoint(srcCandidates, keys);
        Endpoint tgt = resolveEndpoint(tgtCandidates, keys);

        String relationshipId = null;
        String resolvedFrom = null;
        boolean reversed = false;
        boolean ambiguous = false;
        IdLookup.Hit relHit = relationships.first(relCandidates);
        if (relHit != null) {
            relationshipId = relHit.id;
            resolvedFrom = relHit.from;
        } else if (src != null && tgt != null) {
            List<IrRelationship> direct = byEndpoints(src.elementId, tgt.elementId);
            List<IrRelationship> back = direct.isEmpty() ? byEndpoints(tgt.elementId, src.elementId) : List.of();
            if (direct.size() > 1 || back.size() > 1) {
                ambiguous = true;
                Map<String, String> context = context(view, "connectionId", c.id);
                context.put("sourceElementId", src.elementId);
                context.put("targetElementId", tgt.elementId);
                report.warn("ea-xmi:view-connection-ambiguous-relationship",
                        "EA XMI Normalize: View connection matched multiple relationships; kept without relationship.", context);
            } else if (direct.size() == 1) {
                relationshipId = direct.get(0).id;
                resolvedFrom = "endpoints";
            } else if (back.size() == 1) {
                relationshipId = back.get(0).id;
                resolvedFrom = "endpoints";
                reversed = true;
            }
        }

        if (relationshipId == null && !ambiguous) {
            Map<String, String> context = context(view, "connectionId", c.id);
            context.put("relCandidates", String.join(", ", head(relCandidates)));
            context.put("sourceCandidates", String.join(", ", head(srcCandidates)));
            context.put("targetCandidates", String.join(", ", head(tgtCandidates)));
            report.warn("ea-xmi:view-connection-unresolved-relationship",
                    "EA XMI Normalize: Could not resolve relationship for a view connection; kept without relationship.", context);
        }

        Map<String, Object> meta = new LinkedHashMap<>(c.meta);
        if (resolvedFrom != null) meta.put(META_RESOLVED_FROM, resolvedFrom);
        if (reversed) meta.put("resolvedReversed", Boolean.TRUE);
        if (src != null) meta.put("resolvedSourceFrom", src.from);
        if (tgt != null) meta.put("resolvedTargetFrom", tgt.from);

        return c.withResolution(relationshipId,
                src == null ? null : src.nodeId,
                tgt == null ? null : tgt.nodeId,
                src == null ? null : src.elementId,
                tgt == null ? null : tgt.elementId,
                meta);
    }

    /** Node key first, then the element the keyed node refers to, then a direct element id. */
    private Endpoint resolveEndpoint(List<String> candidates, NodeKeys keys) {
        for (String cand : candidates) {
            for (String tok : RefTokens.variants(cand)) {
                IrViewNode node = keys.byKey.get(tok);
                if (node != null && node.elementId != null) return new Endpoint(node.elementId, node.id, cand);
                if (node != null) {
                    IdLookup.Hit viaRef = elements.first(RefTokens.candidatesThenRest(node.refRaw(), DiagramKeys.NODE_REF));
                    if (viaRef != null) return new Endpoint(viaRef.id, node.id, cand);
                }
                String el = elements.get(tok);
                if (el != null) return new Endpoint(el, keys.nodeForElement(el), cand);
            }
        }
        return null;
    }

    private List<IrRelationship> byEndpoints(String sourceId, String targetId) {
        List<IrRelationship> out = new ArrayList<>();
        for (IrRelationship r : relationshipList) {
            if (Objects.equals(r.sourceId, sourceId) && Objects.equals(r.targetId, targetId)) out.add(r);
        }
        return out;
    }

    private static Map<String, String> context(IrView view, String key, String id) {
        Map<String, String> context = new LinkedHashMap<>();
        context.put("viewId", view.id);
        if (view.name != null) context.put("viewName", view.name);
        context.put(key, id);
        return context;
    }

    private static List<String> head(List<String> values) {
        return values.size() <= 5 ? values : values.subList(0, 5);
    }

    private static final class Endpoint {
        final String elementId;
        final String nodeId;
        final String from;

        Endpoint(String elementId, String nodeId, String from) {
            this.elementId = elementId;
            this.nodeId = nodeId;
            this.from = from;
        }
    }

    /** Node ids and node external ids (diagram object DUIDs, GUIDs) in every token variant. */
    private static final class NodeKeys {
        final Map<String, IrViewNode> byKey = new HashMap<>();
        final Map<String, String> nodeByElement = new HashMap<>();

        NodeKeys(List<IrViewNode> nodes) {
            for (IrViewNode n : nodes) {
                if (n.id == null) continue;
                put(n.id, n);
                for (IrExternalId x : n.externalIds) {
                    if (x != null && x.id != null) put(x.id, n);
                }
                if (n.elementId != null) nodeByElement.putIfAbsent(n.elementId, n.id);
            }
        }

        private void put(String key, IrViewNode n) {
            for (String v : RefTokens.variants(key)) byKey.putIfAbsent(v, n);
        }

        /** The node showing {@code elementId} in this view, or null. */
        String nodeForElement(String elementId) {
            return nodeByElement.get(elementId);
        }
    }
}
