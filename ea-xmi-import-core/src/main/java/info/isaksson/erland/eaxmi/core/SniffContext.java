package info.isaksson.erland.eaxmi.core;

import info.isaksson.erland.eaxmi.xmi.XmlDecoding;

import java.nio.file.Path;
import java.util.Locale;

/**
 * What a format detector gets to look at: the head of the file as text and as bytes, and the
 * lower-case file extension without the dot.
 */
public final class SniffContext {

    /** How much of a file is read for sniffing. */
    public static final int SNIFF_LIMIT = 64 * 1024;

    public final String sniffText;
    public final byte[] sniffBytes;
    public final String extension;

    public SniffContext(String sniffText, byte[] sniffBytes, String extension) {
        this.sniffText = sniffText == null ? "" : sniffText;
        this.sniffBytes = sniffBytes == null ? new byte[0] : sniffBytes;
        this.extension = extension == null ? "" : extension.toLowerCase(Locale.ROOT);
    }

    /** Context over the head of {@code bytes}; {@code fileName} may be null. */
    public static SniffContext of(byte[] bytes, String fileName) {
        byte[] head = bytes == null ? new byte[0] : bytes;
        if (head.length > SNIFF_LIMIT) {
            byte[] cut = new byte[SNIFF_LIMIT];
            System.arraycopy(head, 0, cut, 0, SNIFF_LIMIT);
            head = cut;
        }
        return new SniffContext(XmlDecoding.decode(head), head, extensionOf(fileName));
    }

    public static SniffContext of(byte[] bytes, Path file) {
        return of(bytes, file == null || file.getFileName() == null ? null : file.getFileName().toString());
    }

    static String extensionOf(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        return dot < 0 || dot == fileName.length() - 1 ? "" : fileName.substring(dot + 1);
    }
}
