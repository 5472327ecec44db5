package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A diagram link. Same contract as {@link IrViewNode}: ids stay null until resolved and
 * {@code meta.refRaw} keeps the original references. {@code points} is null when the source
 * carries no usable waypoint list.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id","relationshipId","sourceNodeId","targetNodeId","sourceElementId","targetElementId","points","externalIds","meta"})
public final class IrViewConnection {
    public final String id;
    public final String relationshipId;
    public final String sourceNodeId;
    public final String targetNodeId;
    public final String sourceElementId;
    public final String targetElementId;
    public final List<IrPoint> points;
    public final List<IrExternalId> externalIds;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrViewConnection(
            @JsonProperty("id") String id,
            @JsonProperty("relationshipId") String relationshipId,
            @JsonProperty("sourceNodeId") String sourceNodeId,
            @JsonProperty("targetNodeId") String targetNodeId,
            @JsonProperty("sourceElementId") String sourceElementId,
            @JsonProperty("targetElementId") String targetElementId,
            @JsonProperty("points") List<IrPoint> points,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.relationshipId = relationshipId;
        this.sourceNodeId = sourceNodeId;
        this.targetNodeId = targetNodeId;
        this.sourceElementId = sourceElementId;
        this.targetElementId = targetElementId;
        this.points = points == null || points.isEmpty() ? null : List.copyOf(points);
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.meta = IrMaps.copy(meta);
    }

    public IrViewConnection withResolution(
            String relationshipId,
            String sourceNodeId,
            String targetNodeId,
            String sourceElementId,
            String targetElementId,
            Map<String, Object> meta
    ) {
        return new IrViewConnection(id, relationshipId, sourceNodeId, targetNodeId, sourceElementId, targetElementId, points, externalIds, meta);
    }

    /** Non-blank string entries of {@code meta.refRaw}, in stored order. */
    public Map<String, String> refRaw() {
        return IrViewNode.stringEntries(meta.get(IrViewNode.META_REF_RAW));
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrViewConnection)) return false;
        IrViewConnection that = (IrViewConnection) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(relationshipId, that.relationshipId) &&
                Objects.equals(sourceNodeId, that.sourceNodeId) &&
                Objects.equals(targetNodeId, that.targetNodeId) &&
                Objects.equals(sourceElementId, that.sourceElementId) &&
                Objects.equals(targetElementId, that.targetElementId) &&
                Objects.equals(points, that.points) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, relationshipId, sourceNodeId, targetNodeId, sourceElementId, targetElementId, points, externalIds, meta);
    }

    @Override public String toString() {
        return "IrViewConnection{" + id + ", relationshipId=" + relationshipId + "}";
    }
}
