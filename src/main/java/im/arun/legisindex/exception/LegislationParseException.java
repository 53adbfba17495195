package im.arun.legisindex.exception;

/**
 * Raised when a document cannot be parsed at all: malformed XML, an unexpected root
 * element, or a missing primary identifier.
 */
public class LegislationParseException extends Exception {

    public LegislationParseException(String message) {
        super(message);
    }

    public LegislationParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
