package info.isaksson.erland.eaxmi.core;

/**
 * The input cannot be imported at all: it is not well-formed XML or not an XMI document.
 * Everything short of that is reported on the {@link info.isaksson.erland.eaxmi.report.ImportReport}.
 */
public class EaXmiImportException extends RuntimeException {

    public EaXmiImportException(String message) {
        super(message);
    }

    public EaXmiImportException(String message, Throwable cause) {
        super(message, cause);
    }
}
