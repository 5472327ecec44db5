package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/** Attributes and operations of a class-like element, stored as {@code meta.umlMembers}. */
@JsonPropertyOrder({"attributes","operations"})
public final class IrUmlMembers {
    public static final String META_KEY = "umlMembers";

    public final List<IrUmlAttribute> attributes;
    public final List<IrUmlOperation> operations;

    @JsonCreator
    public IrUmlMembers(
            @JsonProperty("attributes") List<IrUmlAttribute> attributes,
            @JsonProperty("operations") List<IrUmlOperation> operations
    ) {
        this.attributes = attributes == null ? List.of() : List.copyOf(attributes);
        this.operations = operations == null ? List.of() : List.copyOf(operations);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return attributes.isEmpty() && operations.isEmpty();
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrUmlMembers)) return false;
        IrUmlMembers that = (IrUmlMembers) o;
        return Objects.equals(attributes, that.attributes) && Objects.equals(operations, that.operations);
    }

    @Override public int hashCode() {
        return Objects.hash(attributes, operations);
    }
}
