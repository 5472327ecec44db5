package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Root of the import IR: the single output contract handed to the downstream applier.
 */
@JsonPropertyOrder({"folders","elements","relationships","views","meta"})
public final class IrModel {
    public final List<IrFolder> folders;
    public final List<IrElement> elements;
    public final List<IrRelationship> relationships;
    public final List<IrView> views;
    public final Map<String, Object> meta;

    @JsonCreator
    public IrModel(
            @JsonProperty("folders") List<IrFolder> folders,
            @JsonProperty("elements") List<IrElement> elements,
            @JsonProperty("relationships") List<IrRelationship> relationships,
            @JsonProperty("views") List<IrView> views,
            @JsonProperty("meta") Map<String, Object> meta
    ) {
        this.folders = folders == null ? List.of() : List.copyOf(folders);
        this.elements = elements == null ? List.of() : List.copyOf(elements);
        this.relationships = relationships == null ? List.of() : List.copyOf(relationships);
        this.views = views == null ? List.of() : List.copyOf(views);
        this.meta = IrMaps.copy(meta);
    }

    public IrElement findElement(String id) {
        for (IrElement e : elements) {
            if (e != null && Objects.equals(e.id, id)) return e;
        }
        return null;
    }

    public IrRelationship findRelationship(String id) {
        for (IrRelationship r : relationships) {
            if (r != null && Objects.equals(r.id, id)) return r;
        }
        return null;
    }

    public IrView findView(String id) {
        for (IrView v : views) {
            if (v != null && Objects.equals(v.id, id)) return v;
        }
        return null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrModel)) return false;
        IrModel that = (IrModel) o;
        return Objects.equals(folders, that.folders) &&
                Objects.equals(elements, that.elements) &&
                Objects.equals(relationships, that.relationships) &&
                Objects.equals(views, that.views) &&
                Objects.equals(meta, that.meta);
    }

    @Override public int hashCode() {
        return Objects.hash(folders, elements, relationships, views, meta);
    }
}
