package info.isaksson.erland.eaxmi.normalize;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/** Lookup variants of a raw reference token and ordered candidate extraction from {@code refRaw}. */
public final class RefTokens {

    private RefTokens() {}

    /**
     * The trimmed token, its lower-case form, and for a {@code {GUID}} token the unbraced value and
     * its lower-case form. Empty for blank input.
     */
    public static List<String> variants(String raw) {
        if (raw == null) return List.of();
        String s = raw.trim();
        if (s.isEmpty()) return List.of();
        Set<String> out = new LinkedHashSet<>();
        out.add(s);
        out.add(s.toLowerCase(Locale.ROOT));
        if (s.length() > 2 && s.startsWith("{") && s.endsWith("}")) {
            String inner = s.substring(1, s.length() - 1).trim();
            if (!inner.isEmpty()) {
                out.add(inner);
                out.add(inner.toLowerCase(Locale.ROOT));
            }
        }
        return new ArrayList<>(out);
    }

    /** Distinct values of {@code refRaw} for {@code keys}, in key order. */
    public static List<String> candidates(Map<String, String> refRaw, List<String> keys) {
        Set<String> out = new LinkedHashSet<>();
        for (String k : keys) {
            String v = refRaw.get(k);
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return new ArrayList<>(out);
    }

    /** Like {@link #candidates} followed by every other value of {@code refRaw}. */
    public static List<String> candidatesThenRest(Map<String, String> refRaw, List<String> keys) {
        Set<String> out = new LinkedHashSet<>(candidates(refRaw, keys));
        for (String v : refRaw.values()) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return new ArrayList<>(out);
    }
}
