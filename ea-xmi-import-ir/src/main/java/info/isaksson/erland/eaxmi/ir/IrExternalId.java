package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.Objects;

/**
 * An identifier the source tool uses for an IR entity.
 *
 * <p>{@code system} names the id scheme owner (e.g. "sparx-ea", "xmi"), {@code kind} what the id
 * refers to (e.g. "element-guid", "package-eaid").</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"system","id","kind"})
public final class IrExternalId {
    public final String system;
    public final String id;
    public final String kind;

    @JsonCreator
    public IrExternalId(
            @JsonProperty("system") String system,
            @JsonProperty("id") String id,
            @JsonProperty("kind") String kind
    ) {
        this.system = system;
        this.id = id;
        this.kind = kind;
    }

    public static IrExternalId of(String system, String id, String kind) {
        return new IrExternalId(system, id, kind);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrExternalId)) return false;
        IrExternalId that = (IrExternalId) o;
        return Objects.equals(system, that.system) && Objects.equals(id, that.id) && Objects.equals(kind, that.kind);
    }

    @Override public int hashCode() {
        return Objects.hash(system, id, kind);
    }

    @Override public String toString() {
        return "IrExternalId{" + system + ":" + kind + "=" + id + "}";
    }
}
