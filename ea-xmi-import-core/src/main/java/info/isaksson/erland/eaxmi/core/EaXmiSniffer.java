package info.isaksson.erland.eaxmi.core;

import info.isaksson.erland.eaxmi.xmi.XmlDecoding;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Cheap detection of Sparx EA UML XMI exports.
 *
 * <p>An {@code .xmi} extension is accepted as is. Otherwise the text needs an XMI root, a UML
 * marker and an EA marker. When the decoded text says nothing, the printable-ASCII projection of
 * the first 64 KiB is checked the same way.</p>
 */
public final class EaXmiSniffer {

    private static final int I = Pattern.CASE_INSENSITIVE;

    private static final List<Pattern> XMI_ROOT = List.of(
            Pattern.compile("<\\s*(?:[\\w.-]+:)?xmi\\s*:\\s*xmi\\b", I),
            Pattern.compile("<\\s*xmi\\b[^>]*xmlns", I));

    private static final List<Pattern> UML_MARKERS = List.of(
            Pattern.compile("xmlns\\s*:\\s*uml\\s*=", I),
            Pattern.compile("http://www\\.omg\\.org/spec/uml", I),
            Pattern.compile("\\buml\\s*:\\s*model\\b", I),
            Pattern.compile("\\bxmi\\s*:\\s*type\\s*=\\s*\"\\s*uml\\s*:\\s*package\\b", I),
            Pattern.compile("\\bxmi\\s*:\\s*type\\s*=\\s*\"\\s*uml\\s*:\\s*class\\b", I),
            Pattern.compile("\\bpackagedelement\\b", I));

    private static final List<Pattern> EA_MARKERS = List.of(
            Pattern.compile("\\bea_guid\\b", I),
            Pattern.compile("\\beaid[_:]", I),
            Pattern.compile("enterprise architect", I),
            Pattern.compile("extender\\s*=\\s*\"\\s*enterprise architect\\s*\"", I),
            Pattern.compile("<\\s*(?:[\\w.-]+:)?xmi\\s*:\\s*extension\\b", I),
            Pattern.compile("xmlns\\s*:\\s*ea\\s*=", I));

    private EaXmiSniffer() {}

    public static boolean sniff(SniffContext ctx) {
        if (ctx == null) return false;
        if ("xmi".equals(ctx.extension.toLowerCase(Locale.ROOT))) return true;
        if (looksLikeEaXmi(ctx.sniffText)) return true;
        return looksLikeEaXmi(XmlDecoding.asciiProjection(ctx.sniffBytes, SniffContext.SNIFF_LIMIT));
    }

    static boolean looksLikeEaXmi(String text) {
        if (text == null || text.indexOf('<') < 0) return false;
        return any(XMI_ROOT, text) && any(UML_MARKERS, text) && any(EA_MARKERS, text);
    }

    private static boolean any(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            if (p.matcher(text).find()) return true;
        }
        return false;
    }
}
