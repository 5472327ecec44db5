package info.isaksson.erland.eaxmi.ir;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IrViewNodeKind {
    ELEMENT("element"),
    NOTE("note"),
    GROUP("group"),
    SHAPE("shape"),
    IMAGE("image");

    public final String jsonValue;

    IrViewNodeKind(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String jsonValue() {
        return jsonValue;
    }

    @JsonCreator
    public static IrViewNodeKind fromJson(String v) {
        if (v == null) return ELEMENT;
        String s = v.trim().toLowerCase();
        for (IrViewNodeKind k : values()) {
            if (k.jsonValue.equals(s)) return k;
        }
        return ELEMENT;
    }
}
