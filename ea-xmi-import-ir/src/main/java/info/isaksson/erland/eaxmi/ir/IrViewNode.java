package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A diagram object placed on a view.
 *
 * <p>{@code elementId} stays null until normalization resolves the node. {@code meta.refRaw}
 * keeps the source reference attributes verbatim either way.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id","kind","elementId","bounds","parentNodeId","label","externalIds","meta"})
public final class IrViewNode {
    public static final String META_REF_RAW = "refRaw";

    public final String id;
    public final IrViewNodeKind kind;
    public final String elementId;
    public final IrBounds bounds;
    public final String parentNodeId;
    public final String label;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrViewNode(
            @JsonProperty("id") String id,
            @JsonProperty("kind") IrViewNodeKind kind,
            @JsonProperty("elementId") String elementId,
            @JsonProperty("bounds") IrBounds bounds,
            @JsonProperty("parentNodeId") String parentNodeId,
            @JsonProperty("label") String label,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.kind = kind == null ? IrViewNodeKind.ELEMENT : kind;
        this.elementId = elementId;
        this.bounds = bounds;
        this.parentNodeId = parentNodeId;
        this.label = label;
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.meta = IrMaps.copy(meta);
    }

    public IrViewNode withElementId(String elementId) {
        return new IrViewNode(id, kind, elementId, bounds, parentNodeId, label, externalIds, meta);
    }

    public IrViewNode withParentNodeId(String parentNodeId) {
        return new IrViewNode(id, kind, elementId, bounds, parentNodeId, label, externalIds, meta);
    }

    public IrViewNode withMeta(Map<String, Object> meta) {
        return new IrViewNode(id, kind, elementId, bounds, parentNodeId, label, externalIds, meta);
    }

    /** Non-blank string entries of {@code meta.refRaw}, in stored order. */
    public Map<String, String> refRaw() {
        return stringEntries(meta.get(META_REF_RAW));
    }

    static Map<String, String> stringEntries(Object raw) {
        if (!(raw instanceof Map)) return Collections.emptyMap();
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) raw).entrySet()) {
            if (e.getKey() == null || !(e.getValue() instanceof String)) continue;
            String v = ((String) e.getValue()).trim();
            if (!v.isEmpty()) out.put(e.getKey().toString(), v);
        }
        return out;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrViewNode)) return false;
        IrViewNode that = (IrViewNode) o;
        return Objects.equals(id, that.id) &&
                kind == that.kind &&
                Objects.equals(elementId, that.elementId) &&
                Objects.equals(bounds, that.bounds) &&
                Objects.equals(parentNodeId, that.parentNodeId) &&
                Objects.equals(label, that.label) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, kind, elementId, bounds, parentNodeId, label, externalIds, meta);
    }

    @Override public String toString() {
        return "IrViewNode{" + id + ", " + kind.jsonValue + ", elementId=" + elementId + "}";
    }
}
