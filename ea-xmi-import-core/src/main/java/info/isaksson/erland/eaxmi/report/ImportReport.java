package info.isaksson.erland.eaxmi.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only issue log for one import run.
 *
 * <p>Every pass receives the same instance by reference. Issues are kept in the order they were
 * added and are never removed. A report is not thread-safe; each import owns its own.</p>
 */
public final class ImportReport {

    private final String source;
    private final String messagePrefix;
    private final List<ImportIssue> issues = new ArrayList<>();

    public ImportReport(String source) {
        this(source, null);
    }

    /**
     * @param source        format id recorded on the report (e.g. {@code ea-xmi-uml})
     * @param messagePrefix optional label prepended to every message (e.g. a file name)
     */
    public ImportReport(String source, String messagePrefix) {
        this.source = source;
        this.messagePrefix = messagePrefix == null || messagePrefix.isBlank() ? "" : messagePrefix.trim() + ": ";
    }

    public String source() {
        return source;
    }

    public void warn(String code, String message) {
        warn(code, message, null);
    }

    public void warn(String code, String message, Map<String, String> context) {
        add(ImportIssue.Level.WARNING, code, message, context);
    }

    public void warn(String code, String message, String k1, String v1) {
        warn(code, message, ctx(k1, v1));
    }

    public void warn(String code, String message, String k1, String v1, String k2, String v2) {
        warn(code, message, ctx(k1, v1, k2, v2));
    }

    public void info(String code, String message) {
        info(code, message, null);
    }

    public void info(String code, String message, Map<String, String> context) {
        add(ImportIssue.Level.INFO, code, message, context);
    }

    public void info(String code, String message, String k1, String v1) {
        info(code, message, ctx(k1, v1));
    }

    private void add(ImportIssue.Level level, String code, String message, Map<String, String> context) {
        issues.add(new ImportIssue(level, code, messagePrefix + message, context));
    }

    /** All issues in insertion order. */
    public List<ImportIssue> issues() {
        return Collections.unmodifiableList(new ArrayList<>(issues));
    }

    /** Warning-level issues in insertion order. */
    public List<ImportIssue> warnings() {
        return byLevel(ImportIssue.Level.WARNING);
    }

    public List<ImportIssue> infos() {
        return byLevel(ImportIssue.Level.INFO);
    }

    /** Warning messages in insertion order. */
    public List<String> warningMessages() {
        List<String> out = new ArrayList<>();
        for (ImportIssue i : issues) {
            if (i.level == ImportIssue.Level.WARNING) out.add(i.message);
        }
        return Collections.unmodifiableList(out);
    }

    public boolean hasWarnings() {
        for (ImportIssue i : issues) {
            if (i.level == ImportIssue.Level.WARNING) return true;
        }
        return false;
    }

    public int size() {
        return issues.size();
    }

    /** Issue counts per code, ordered by code. */
    public Map<String, Integer> countsByCode() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (ImportIssue i : toDeterministicList()) {
            out.merge(i.code, 1, Integer::sum);
        }
        return out;
    }

    /** Issues sorted by (level, code, message, contextString); insertion order is not significant here. */
    public List<ImportIssue> toDeterministicList() {
        List<ImportIssue> out = new ArrayList<>(issues);
        out.sort(Comparator
                .comparing((ImportIssue i) -> i.level)
                .thenComparing(i -> i.code)
                .thenComparing(i -> i.message)
                .thenComparing(i -> contextString(i.context)));
        return Collections.unmodifiableList(out);
    }

    private List<ImportIssue> byLevel(ImportIssue.Level level) {
        List<ImportIssue> out = new ArrayList<>();
        for (ImportIssue i : issues) {
            if (i.level == level) out.add(i);
        }
        return Collections.unmodifiableList(out);
    }

    private static Map<String, String> ctx(String... kv) {
        Map<String, String> ctx = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) {
            ctx.put(kv[i], kv[i + 1] == null ? "" : kv[i + 1]);
        }
        return ctx;
    }

    private static String contextString(Map<String, String> ctx) {
        if (ctx == null || ctx.isEmpty()) return "";
        // stable serialization: key-sorted
        List<String> keys = new ArrayList<>(ctx.keySet());
        keys.sort(String::compareTo);
        StringBuilder sb = new StringBuilder();
        for (String k : keys) {
            sb.append(k).append('=').append(ctx.get(k)).append(';');
        }
        return sb.toString();
    }
}
