package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id","type","sourceId","targetId","name","documentation","externalIds","taggedValues","attrs","meta"})
public final class IrRelationship {
    public final String id;
    public final String type;
    public final String sourceId;
    public final String targetId;
    public final String name;
    public final String documentation;
    public final List<IrExternalId> externalIds;
    public final List<IrTaggedValue> taggedValues;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, Object> attrs;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrRelationship(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("sourceId") String sourceId,
            @JsonProperty("targetId") String targetId,
            @JsonProperty("name") String name,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("attrs") Map<String, Object> attrs,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.type = type == null ? "Unknown" : type;
        this.sourceId = sourceId;
        this.targetId = targetId;
        this.name = name;
        this.documentation = documentation;
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.attrs = IrMaps.copy(attrs);
        this.meta = IrMaps.copy(meta);
    }

    public IrRelationship withEndpoints(String sourceId, String targetId) {
        return new IrRelationship(id, type, sourceId, targetId, name, documentation, externalIds, taggedValues, attrs, meta);
    }

    public IrRelationship withText(String name, String documentation) {
        return new IrRelationship(id, type, sourceId, targetId, name, documentation, externalIds, taggedValues, attrs, meta);
    }

    public IrRelationship withAttrs(Map<String, Object> attrs) {
        return new IrRelationship(id, type, sourceId, targetId, name, documentation, externalIds, taggedValues, attrs, meta);
    }

    public IrRelationship withMeta(Map<String, Object> meta) {
        return new IrRelationship(id, type, sourceId, targetId, name, documentation, externalIds, taggedValues, attrs, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrRelationship)) return false;
        IrRelationship that = (IrRelationship) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(type, that.type) &&
                Objects.equals(sourceId, that.sourceId) &&
                Objects.equals(targetId, that.targetId) &&
                Objects.equals(name, that.name) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(attrs, that.attrs) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, type, sourceId, targetId, name, documentation, externalIds, taggedValues, attrs, meta);
    }

    @Override public String toString() {
        return "IrRelationship{" + id + ", " + type + ", " + sourceId + " -> " + targetId + "}";
    }
}
