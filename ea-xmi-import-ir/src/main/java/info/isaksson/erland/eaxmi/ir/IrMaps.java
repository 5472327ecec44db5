package info.isaksson.erland.eaxmi.ir;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Copy helpers for the free-form {@code attrs}/{@code meta} payloads (null values allowed, insertion order kept). */
final class IrMaps {

    private IrMaps() {}

    static Map<String, Object> copy(Map<String, Object> in) {
        if (in == null || in.isEmpty()) return Collections.emptyMap();
        return Collections.unmodifiableMap(new LinkedHashMap<>(in));
    }
}
