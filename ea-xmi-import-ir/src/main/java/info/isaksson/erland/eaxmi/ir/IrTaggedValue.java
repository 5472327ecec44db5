package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;
import java.util.Objects;

/**
 * A key/value pair carried over from the source model: EA stereotypes, profile tag names and
 * connector properties. Keys are trimmed; values are kept verbatim.
 */
@JsonPropertyOrder({"key","value"})
public final class IrTaggedValue {
    public static final String STEREOTYPE = "stereotype";
    public static final String PROFILE_TAG = "profileTag";
    public static final String EA_TYPE = "ea_type";
    public static final String DIRECTION = "direction";
    public static final String ASSOCIATION_CLASS = "associationclass";

    public final String key;
    public final String value;

    @JsonCreator
    public IrTaggedValue(
            @JsonProperty("key") String key,
            @JsonProperty("value") String value
    ) {
        this.key = key == null ? null : key.trim();
        this.value = value;
    }

    /** Value of the first entry with {@code key}, or null. */
    public static String find(List<IrTaggedValue> values, String key) {
        if (values == null) return null;
        for (IrTaggedValue t : values) {
            if (t != null && Objects.equals(t.key, key)) return t.value;
        }
        return null;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof IrTaggedValue)) return false;
        IrTaggedValue that = (IrTaggedValue) o;
        return Objects.equals(key, that.key) && Objects.equals(value, that.value);
    }

    @Override public int hashCode() {
        return Objects.hash(key, value);
    }

    @Override public String toString() {
        return key + "=" + value;
    }
}
