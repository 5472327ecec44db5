package info.isaksson.erland.eaxmi.materialize;

/**
 * Policy controlling which UML packages (imported as folders) also become {@code uml.package}
 * elements.
 */
public enum PackageElementPolicy {
    /** Packages stay folders only. */
    NEVER("never"),
    /** Packages placed on a diagram (default). */
    DIAGRAM_REFERENCED("diagram"),
    /** Packages placed on a diagram or used as a relationship endpoint. */
    REFERENCED("referenced"),
    /** Every package. */
    ALWAYS("always");

    public final String cliValue;

    PackageElementPolicy(String cliValue) {
        this.cliValue = cliValue;
    }

    public static PackageElementPolicy parseCli(String v) {
        if (v == null) return DIAGRAM_REFERENCED;
        String s = v.trim().toLowerCase();
        for (PackageElementPolicy p : values()) {
            if (p.cliValue.equals(s)) return p;
        }
        throw new IllegalArgumentException("Invalid value for --package-elements: " + v + " (expected one of: never|diagram|referenced|always)");
    }
}
