package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","type"})
public final class IrUmlParameter {
    public final String name;
    public final String type;

    @JsonCreator
    public IrUmlParameter(
            @JsonProperty("name") String name,
            @JsonProperty("type") String type
    ) {
        this.name = name;
        this.type = type;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrUmlParameter)) return false;
        IrUmlParameter that = (IrUmlParameter) o;
        return Objects.equals(name, that.name) && Objects.equals(type, that.type);
    }

    @Override public int hashCode() {
        return Objects.hash(name, type);
    }
}
