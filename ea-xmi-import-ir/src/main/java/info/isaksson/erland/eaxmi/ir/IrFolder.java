package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Folder (UML package) in the organisation tree; {@code parentId == null} means root. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id","name","parentId","documentation","externalIds","taggedValues","meta"})
public final class IrFolder {
    public final String id;
    public final String name;
    public final String parentId;
    public final String documentation;
    public final List<IrExternalId> externalIds;
    public final List<IrTaggedValue> taggedValues;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrFolder(
            @JsonProperty("id") String id,
            @JsonProperty("name") String name,
            @JsonProperty("parentId") String parentId,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.name = name;
        this.parentId = parentId;
        this.documentation = documentation;
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.meta = IrMaps.copy(meta);
    }

    public IrFolder withText(String name, String documentation) {
        return new IrFolder(id, name, parentId, documentation, externalIds, taggedValues, meta);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrFolder)) return false;
        IrFolder that = (IrFolder) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(name, that.name) &&
                Objects.equals(parentId, that.parentId) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, name, parentId, documentation, externalIds, taggedValues, meta);
    }
}
