package info.isaksson.erland.eaxmi.report;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** A non-fatal issue recorded during import. */
public final class ImportIssue {

    public enum Level { WARNING, INFO }

    public final Level level;

    /** Issue code stable across versions (e.g. {@code ea-xmi:duplicate-element-id}). */
    public final String code;

    /** Human-readable message. */
    public final String message;

    /** Optional structured context (stable keys recommended). */
    public final Map<String, String> context;

    public ImportIssue(Level level, String code, String message, Map<String, String> context) {
        this.level = Objects.requireNonNull(level, "level must not be null");
        this.code = Objects.requireNonNull(code, "code must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        if (context == null || context.isEmpty()) {
            this.context = Collections.emptyMap();
        } else {
            this.context = Collections.unmodifiableMap(new LinkedHashMap<>(context));
        }
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ImportIssue)) return false;
        ImportIssue that = (ImportIssue) o;
        return level == that.level && code.equals(that.code) && message.equals(that.message) && context.equals(that.context);
    }

    @Override public int hashCode() {
        return Objects.hash(level, code, message, context);
    }

    @Override public String toString() {
        return level + " [" + code + "] " + message;
    }
}
