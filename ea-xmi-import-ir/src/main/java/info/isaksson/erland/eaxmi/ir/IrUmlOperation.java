package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name","returnType","visibility","isStatic","isAbstract","params"})
public final class IrUmlOperation {
    public final String name;
    public final String returnType;
    public final String visibility;
    public final Boolean isStatic;
    public final Boolean isAbstract;
    public final List<IrUmlParameter> params;

    @JsonCreator
    public IrUmlOperation(
            @JsonProperty("name") String name,
            @JsonProperty("returnType") String returnType,
            @JsonProperty("visibility") String visibility,
            @JsonProperty("isStatic") Boolean isStatic,
            @JsonProperty("isAbstract") Boolean isAbstract,
            @JsonProperty("params") List<IrUmlParameter> params
    ) {
        this.name = name;
        this.returnType = returnType;
        this.visibility = visibility;
        this.isStatic = isStatic;
        this.isAbstract = isAbstract;
        this.params = params == null ? List.of() : List.copyOf(params);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrUmlOperation)) return false;
        IrUmlOperation that = (IrUmlOperation) o;
        return Objects.equals(name, that.name) &&
                Objects.equals(returnType, that.returnType) &&
                Objects.equals(visibility, that.visibility) &&
                Objects.equals(isStatic, that.isStatic) &&
                Objects.equals(isAbstract, that.isAbstract) &&
                Objects.equals(params, that.params);
    }

    @Override public int hashCode() {
        return Objects.hash(name, returnType, visibility, isStatic, isAbstract, params);
    }

    @Override public String toString() {
        return "IrUmlOperation{" + name + "(" + params.size() + ")" + (returnType == null ? "" : ": " + returnType) + "}";
    }
}
