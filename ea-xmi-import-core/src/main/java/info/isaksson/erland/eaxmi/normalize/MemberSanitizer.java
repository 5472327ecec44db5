package info.isaksson.erland.eaxmi.normalize;

import info.isaksson.erland.eaxmi.ir.IrMultiplicity;
import info.isaksson.erland.eaxmi.ir.IrUmlAttribute;
import info.isaksson.erland.eaxmi.ir.IrUmlMembers;
import info.isaksson.erland.eaxmi.ir.IrUmlOperation;
import info.isaksson.erland.eaxmi.ir.IrUmlParameter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Cleans the nested member and association-end payloads.
 *
 * <p>Accepts both the typed {@link IrUmlMembers} the parsers emit and the plain map form an IR read
 * back from JSON carries.</p>
 */
final class MemberSanitizer {

    private static final List<String> REL_STRING_KEYS = List.of(
            "sourceRole", "targetRole", "sourceMultiplicity", "targetMultiplicity",
            "sourceAggregation", "targetAggregation", "stereotype");
    private static final List<String> REL_BOOLEAN_KEYS = List.of("sourceNavigable", "targetNavigable");

    private MemberSanitizer() {}

    /** Sanitized members, or null when {@code raw} is not a members payload. */
    static IrUmlMembers members(Object raw) {
        if (raw instanceof IrUmlMembers) return members((IrUmlMembers) raw);
        if (!(raw instanceof Map)) return null;
        Map<?, ?> m = (Map<?, ?>) raw;

        List<IrUmlAttribute> attributes = new ArrayList<>();
        for (Map<?, ?> a : maps(m.get("attributes"))) {
            attributes.add(new IrUmlAttribute(trim(a.get("name")), trim(a.get("type")), trim(a.get("typeRef")),
                    trim(a.get("visibility")), bool(a.get("isStatic")), multiplicity(a.get("multiplicity")),
                    trim(a.get("defaultValue"))));
        }
        List<IrUmlOperation> operations = new ArrayList<>();
        for (Map<?, ?> o : maps(m.get("operations"))) {
            List<IrUmlParameter> params = new ArrayList<>();
            for (Map<?, ?> p : maps(o.get("params"))) {
                params.add(new IrUmlParameter(trim(p.get("name")), trim(p.get("type"))));
            }
            operations.add(new IrUmlOperation(trim(o.get("name")), trim(o.get("returnType")), trim(o.get("visibility")),
                    bool(o.get("isStatic")), bool(o.get("isAbstract")), params));
        }
        return members(new IrUmlMembers(attributes, operations));
    }

    private static IrUmlMembers members(IrUmlMembers in) {
        List<IrUmlAttribute> attributes = new ArrayList<>();
        for (IrUmlAttribute a : in.attributes) {
            if (a == null || trim(a.name) == null) continue;
            attributes.add(new IrUmlAttribute(trim(a.name), trim(a.type), trim(a.typeRef), trim(a.visibility),
                    a.isStatic, a.multiplicity, trim(a.defaultValue)));
        }
        List<IrUmlOperation> operations = new ArrayList<>();
        for (IrUmlOperation o : in.operations) {
            if (o == null || trim(o.name) == null) continue;
            List<IrUmlParameter> params = new ArrayList<>();
            for (IrUmlParameter p : o.params) {
                if (p == null || trim(p.name) == null) continue;
                params.add(new IrUmlParameter(trim(p.name), trim(p.type)));
            }
            operations.add(new IrUmlOperation(trim(o.name), trim(o.returnType), trim(o.visibility),
                    o.isStatic, o.isAbstract, params));
        }
        return new IrUmlMembers(attributes, operations);
    }

    /** Sanitized association-end attributes, or null when nothing usable remains. */
    static Map<String, Object> relationshipAttrs(Object raw) {
        if (!(raw instanceof Map)) return null;
        Map<?, ?> m = (Map<?, ?>) raw;
        Map<String, Object> out = new LinkedHashMap<>();
        for (String k : REL_STRING_KEYS) {
            String v = trim(m.get(k));
            if (v != null) out.put(k, v);
        }
        for (String k : REL_BOOLEAN_KEYS) {
            Boolean v = bool(m.get(k));
            if (v != null) out.put(k, v);
        }
        return out.isEmpty() ? null : out;
    }

    static String trim(Object v) {
        if (v == null) return null;
        String s = v.toString().trim();
        return s.isEmpty() ? null : s;
    }

    /** true/1/yes and false/0/no, case-insensitive; anything else is null. */
    static Boolean bool(Object v) {
        if (v instanceof Boolean) return (Boolean) v;
        if (v instanceof Number) {
            int i = ((Number) v).intValue();
            return i == 1 ? Boolean.TRUE : i == 0 ? Boolean.FALSE : null;
        }
        if (v == null) return null;
        String t = v.toString().trim().toLowerCase(Locale.ROOT);
        switch (t) {
            case "true": case "1": case "yes": return Boolean.TRUE;
            case "false": case "0": case "no": return Boolean.FALSE;
            default: return null;
        }
    }

    private static IrMultiplicity multiplicity(Object raw) {
        if (raw instanceof IrMultiplicity) return (IrMultiplicity) raw;
        if (!(raw instanceof Map)) return null;
        Map<?, ?> m = (Map<?, ?>) raw;
        String lower = trim(m.get("lower"));
        String upper = trim(m.get("upper"));
        return lower == null && upper == null ? null : new IrMultiplicity(lower, upper);
    }

    private static List<Map<?, ?>> maps(Object raw) {
        List<Map<?, ?>> out = new ArrayList<>();
        if (!(raw instanceof List)) return out;
        for (Object o : (List<?>) raw) {
            if (o instanceof Map) out.add((Map<?, ?>) o);
        }
        return out;
    }
}
