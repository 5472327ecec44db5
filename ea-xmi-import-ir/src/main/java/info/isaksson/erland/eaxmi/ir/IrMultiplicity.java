package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/** Raw multiplicity bounds as written in the source ("0", "1", "*"). */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"lower","upper"})
public final class IrMultiplicity {
    public final String lower;
    public final String upper;

    @JsonCreator
    public IrMultiplicity(
            @JsonProperty("lower") String lower,
            @JsonProperty("upper") String upper
    ) {
        this.lower = lower;
        this.upper = upper;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrMultiplicity)) return false;
        IrMultiplicity that = (IrMultiplicity) o;
        return Objects.equals(lower, that.lower) && Objects.equals(upper, that.upper);
    }

    @Override public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override public String toString() {
        return (lower == null ? "" : lower) + ".." + (upper == null ? "" : upper);
    }
}
