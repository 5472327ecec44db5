package info.isaksson.erland.eaxmi.xmi;

import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Byte to text decoding for XMI files: byte order mark first, then the encoding declared in the
 * XML prolog, else UTF-8.
 */
public final class XmlDecoding {

    private static final Pattern DECLARED_ENCODING =
            Pattern.compile("<\\?xml[^>]*\\bencoding\\s*=\\s*[\"']([A-Za-z0-9._:-]+)[\"']");

    private XmlDecoding() {}

    public static String decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) return "";
        int b0 = bytes[0] & 0xff;
        int b1 = bytes.length > 1 ? bytes[1] & 0xff : -1;
        int b2 = bytes.length > 2 ? bytes[2] & 0xff : -1;

        if (b0 == 0xEF && b1 == 0xBB && b2 == 0xBF) {
            return new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8);
        }
        if (b0 == 0xFE && b1 == 0xFF) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE);
        }
        if (b0 == 0xFF && b1 == 0xFE) {
            return new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE);
        }
        // UTF-16 without BOM: "<" interleaved with zero bytes.
        if (b0 == 0x00 && b1 == 0x3C) return new String(bytes, StandardCharsets.UTF_16BE);
        if (b0 == 0x3C && b1 == 0x00) return new String(bytes, StandardCharsets.UTF_16LE);

        Charset declared = declaredCharset(bytes);
        return new String(bytes, declared == null ? StandardCharsets.UTF_8 : declared);
    }

    /** Charset named in the XML declaration, or null when absent or unsupported. */
    static Charset declaredCharset(byte[] bytes) {
        String head = asciiProjection(bytes, 512);
        Matcher m = DECLARED_ENCODING.matcher(head);
        if (!m.find()) return null;
        try {
            return Charset.forName(m.group(1));
        } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
            return null;
        }
    }

    /**
     * Printable ASCII view of the first {@code limit} bytes; every other byte becomes a space.
     * Used for declaration lookup and content sniffing without committing to a charset.
     */
    public static String asciiProjection(byte[] bytes, int limit) {
        if (bytes == null) return "";
        int n = Math.min(bytes.length, Math.max(0, limit));
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; i++) {
            int b = bytes[i] & 0xff;
            sb.append(b >= 0x20 && b <= 0x7e ? (char) b : ' ');
        }
        return sb.toString();
    }
}
