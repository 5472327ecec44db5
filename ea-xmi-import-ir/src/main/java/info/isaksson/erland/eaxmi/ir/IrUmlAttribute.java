package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * A classifier attribute. {@code type} is the human-readable type name, {@code typeRef} the raw
 * source reference it was resolved from.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","type","typeRef","visibility","isStatic","multiplicity","defaultValue"})
public final class IrUmlAttribute {
    public final String name;
    public final String type;
    public final String typeRef;
    public final String visibility;
    public final Boolean isStatic;
    public final IrMultiplicity multiplicity;
    public final String defaultValue;

    @JsonCreator
    public IrUmlAttribute(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type,
            @JsonProperty("typeRef") String typeRef,
            @JsonProperty("visibility") String visibility,
            @JsonProperty("isStatic") Boolean isStatic,
            @JsonProperty("multiplicity") IrMultiplicity multiplicity,
            @JsonProperty("defaultValue") String defaultValue
    ) {
        this.name = name;
        this.type = type;
        this.typeRef = typeRef;
        this.visibility = visibility;
        this.isStatic = isStatic;
        this.multiplicity = multiplicity;
        this.defaultValue = defaultValue;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrUmlAttribute)) return false;
        IrUmlAttribute that = (IrUmlAttribute) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(type, that.type) &&
                Objects.equals(typeRef, that.typeRef) &&
                Objects.equals(visibility, that.visibility) &&
                Objects.equals(isStatic, that.isStatic) &&
                Objects.equals(multiplicity, that.multiplicity) &&
                Objects.equals(defaultValue, that.defaultValue);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type, typeRef, visibility, isStatic, multiplicity, defaultValue);
    }

    @Override public String toString() {
        return "IrUmlAttribute{" + name + ": " + type + "}";
    }
}
