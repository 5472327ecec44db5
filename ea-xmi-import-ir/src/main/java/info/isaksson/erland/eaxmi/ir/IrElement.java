package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A model element.
 *
 * <p>{@code type} is profile qualified ({@code uml.class}, {@code archimate.businessActor},
 * {@code bpmn.pool}) or {@code Unknown}. {@code attrs} carries element-specific attributes such as
 * ownership hints; {@code meta} carries source payload such as {@code umlMembers}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id","type","name","documentation","folderId","externalIds","taggedValues","attrs","meta"})
public final class IrElement {
    public final String id;
    public final String type;
    public final String name;
    public final String documentation;
    public final String folderId;
    public final List<IrExternalId> externalIds;
    public final List<IrTaggedValue> taggedValues;
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public final Map<String, Object> attrs;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrElement(
            @JsonProperty("id") String id,
            @JsonProperty("type") String type,
            @JsonProperty("name") String name,
            @JsonProperty("documentation") String documentation,
            @JsonProperty("folderId") String folderId,
            @JsonProperty("externalIds") List<IrExternalId> externalIds,
            @JsonProperty("taggedValues") List<IrTaggedValue> taggedValues,
            @JsonProperty("attrs") Map<String, Object> attrs,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.id = id;
        this.type = type == null ? "Unknown" : type;
        this.name = name;
        this.documentation = documentation;
        this.folderId = folderId;
        this.externalIds = externalIds == null ? List.of() : List.copyOf(externalIds);
        this.taggedValues = taggedValues == null ? List.of() : List.copyOf(taggedValues);
        this.attrs = IrMaps.copy(attrs);
        this.meta = IrMaps.copy(meta);
    }

    public IrElement withFolderId(String folderId) {
        return new IrElement(id, type, name, documentation, folderId, externalIds, taggedValues, attrs, meta);
    }

    public IrElement withText(String name, String documentation) {
        return new IrElement(id, type, name, documentation, folderId, externalIds, taggedValues, attrs, meta);
    }

    public IrElement withAttrs(Map<String, Object> attrs) {
        return new IrElement(id, type, name, documentation, folderId, externalIds, taggedValues, attrs, meta);
    }

    public IrElement withMeta(Map<String, Object> meta) {
        return new IrElement(id, type, name, documentation, folderId, externalIds, taggedValues, attrs, meta);
    }

    /** Value of a tagged value by key, or null. */
    public String taggedValue(String key) {
        return IrTaggedValue.find(taggedValues, key);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrElement)) return false;
        IrElement that = (IrElement) o;
        return Objects.equals(id, that.id) &&
                Objects.equals(type, that.type) &&
                Objects.equals(name, that.name) &&
                Objects.equals(documentation, that.documentation) &&
                Objects.equals(folderId, that.folderId) &&
                Objects.equals(externalIds, that.externalIds) &&
                Objects.equals(taggedValues, that.taggedValues) &&
                Objects.equals(attrs, that.attrs) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(id, type, name, documentation, folderId, externalIds, taggedValues, attrs, meta);
    }

    @Override public String toString() {
        return "IrElement{" + id + ", " + type + ", " + name + "}";
    }
}
