package info.isaksson.erland.eaxmi.diagram;

import info.isaksson.erland.eaxmi.ir.IrBounds;
import info.isaksson.erland.eaxmi.ir.IrPoint;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Decodes the EA geometry encodings: explicit attributes, {@code Left=..;Top=..} strings, bare
 * numeric lists and connector {@code Path=x:y;x:y} segments.
 *
 * <p>Every method returns null rather than failing on input it cannot read.</p>
 */
public final class GeometryDecoder {

    private static final Pattern KEY_VALUE = Pattern.compile("^([a-zA-Z]+)\\s*=\\s*(-?\\d+(?:\\.\\d+)?)$");
    private static final Pattern NUMBER_SPLIT = Pattern.compile("[^0-9.+-]+");
    private static final Pattern PATH_PREFIX = Pattern.compile("^Path\\s*=\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern COORD_PAIR = Pattern.compile("(-?\\d+(?:\\.\\d+)?)\\s*[: ,]\\s*(-?\\d+(?:\\.\\d+)?)");
    private static final int MAX_PATH_POINTS = 2000;

    private GeometryDecoder() {}

    /** Bounds from l/r/t/b attributes, then x/y/w/h attributes, then a geometry string attribute. */
    public static IrBounds bounds(Element el) {
        Double l = number(DiagramKeys.first(el, DiagramKeys.LEFT));
        Double r = number(DiagramKeys.first(el, DiagramKeys.RIGHT));
        Double t = number(DiagramKeys.first(el, DiagramKeys.TOP));
        Double b = number(DiagramKeys.first(el, DiagramKeys.BOTTOM));
        if (l != null && r != null && t != null && b != null) {
            IrBounds ltrb = fromLtrb(l, t, r, b);
            if (ltrb != null) return ltrb;
        }

        Double x = number(DiagramKeys.first(el, DiagramKeys.X));
        Double y = number(DiagramKeys.first(el, DiagramKeys.Y));
        Double w = number(DiagramKeys.first(el, DiagramKeys.WIDTH));
        Double h = number(DiagramKeys.first(el, DiagramKeys.HEIGHT));
        if (x != null && y != null && w != null && h != null && w > 0 && h > 0) {
            return new IrBounds(x, y, w, h);
        }

        String raw = DiagramKeys.first(el, DiagramKeys.BOUNDS_STRING);
        return raw == null ? null : boundsFromString(raw);
    }

    /**
     * Parses {@code "Left=10;Top=20;Right=110;Bottom=70;"} style key/value strings (LTRB, else
     * XYWH). Strings without any numeric key fall back to a bare numeric list: LTRB when the 3rd and 4th numbers exceed the
     * 1st and 2nd, otherwise XYWH.
     */
    public static IrBounds boundsFromString(String raw) {
        String s = raw == null ? "" : raw.trim();
        if (s.isEmpty()) return null;

        if (s.contains("=")) {
            Map<String, Double> kv = new HashMap<>();
            for (String part : s.split("[;,\\s]+")) {
                Matcher m = KEY_VALUE.matcher(part.trim());
                if (m.matches()) kv.put(m.group(1).toLowerCase(Locale.ROOT), Double.parseDouble(m.group(2)));
            }
            Double l = either(kv, "l", "left");
            Double r = either(kv, "r", "right");
            Double t = either(kv, "t", "top");
            Double b = either(kv, "b", "bottom");
            if (l != null && r != null && t != null && b != null) {
                return fromLtrb(l, t, r, b);
            }
            Double x = kv.get("x");
            Double y = kv.get("y");
            Double w = either(kv, "w", "width");
            Double h = either(kv, "h", "height");
            if (x != null && y != null && w != null && h != null && w > 0 && h > 0) {
                return new IrBounds(x, y, w, h);
            }
            // Recognised keys that do not form a rectangle are not reread as a bare list.
            if (!kv.isEmpty()) return null;
        }

        List<Double> nums = numbers(s);
        if (nums.size() >= 4) {
            double a = nums.get(0), b = nums.get(1), c = nums.get(2), d = nums.get(3);
            if (c > a && d > b) {
                IrBounds ltrb = fromLtrb(a, b, c, d);
                if (ltrb != null) return ltrb;
            }
            if (c > 0 && d > 0) return new IrBounds(a, b, c, d);
        }
        return null;
    }

    /** Waypoints from an explicit point-list attribute, else from the {@code Path=} segment of {@code geometry}. */
    public static List<IrPoint> linkPoints(Element link) {
        for (String key : DiagramKeys.LINK_POINTS) {
            String v = DiagramKeys.first(link, List.of(key));
            if (v != null) return pointList(v);
        }
        return pathPoints(DiagramKeys.first(link, List.of("geometry")));
    }

    /** Numbers paired as x,y; null unless at least two points come out. */
    public static List<IrPoint> pointList(String raw) {
        List<Double> nums = numbers(raw == null ? "" : raw.trim());
        if (nums.size() < 4) return null;
        List<IrPoint> pts = new ArrayList<>();
        for (int i = 0; i + 1 < nums.size(); i += 2) {
            pts.add(new IrPoint(nums.get(i), nums.get(i + 1)));
        }
        return pts.size() < 2 ? null : pts;
    }

    /**
     * Points of the {@code Path=} segment of an EA connector geometry string. The path itself is
     * {@code ;}-separated, so tokens are collected until the next {@code key=value} token.
     */
    public static List<IrPoint> pathPoints(String geometry) {
        String s = geometry == null ? "" : geometry.trim();
        if (s.isEmpty()) return null;

        List<String> tokens = new ArrayList<>();
        for (String t : s.split(";")) {
            if (!t.trim().isEmpty()) tokens.add(t.trim());
        }
        StringBuilder path = new StringBuilder();
        for (int i = 0; i < tokens.size(); i++) {
            Matcher prefix = PATH_PREFIX.matcher(tokens.get(i));
            if (!prefix.find()) continue;
            String first = tokens.get(i).substring(prefix.end()).trim();
            if (!first.isEmpty()) path.append(first);
            for (int j = i + 1; j < tokens.size(); j++) {
                String next = tokens.get(j);
                if (next.contains("=")) break;
                if (path.length() > 0) path.append(';');
                path.append(next);
            }
            break;
        }
        if (path.length() == 0) return null;

        List<IrPoint> pts = new ArrayList<>();
        Matcher m = COORD_PAIR.matcher(path);
        while (m.find() && pts.size() <= MAX_PATH_POINTS) {
            pts.add(new IrPoint(Double.parseDouble(m.group(1)), Double.parseDouble(m.group(2))));
        }
        if (pts.size() >= 2) return pts;
        return pointList(path.toString());
    }

    /** Value of {@code key} in a {@code K=V;K=V} style string (key case-insensitive), or null. */
    public static String styleValue(String style, String key) {
        if (style == null) return null;
        for (String part : style.split(";")) {
            String p = part.trim();
            int eq = p.indexOf('=');
            if (eq <= 0) continue;
            if (!p.substring(0, eq).trim().equalsIgnoreCase(key)) continue;
            String v = p.substring(eq + 1).trim();
            if (!v.isEmpty()) return v;
        }
        return null;
    }

    static IrBounds fromLtrb(double l, double t, double r, double b) {
        double w = r - l;
        double h = b - t;
        if (!Double.isFinite(w) || !Double.isFinite(h) || w <= 0 || h <= 0) return null;
        return new IrBounds(l, t, w, h);
    }

    static Double number(String v) {
        if (v == null || v.isBlank()) return null;
        try {
            double d = Double.parseDouble(v.trim());
            return Double.isFinite(d) ? d : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static List<Double> numbers(String s) {
        List<Double> out = new ArrayList<>();
        for (String part : NUMBER_SPLIT.split(s)) {
            Double d = number(part);
            if (d != null) out.add(d);
        }
        return out;
    }

    private static Double either(Map<String, Double> kv, String a, String b) {
        Double v = kv.get(a);
        return v != null ? v : kv.get(b);
    }
}
