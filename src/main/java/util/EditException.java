package util;

/**
 * Recoverable failure of an edit operation. The {@link Kind} tells callers
 * which rule was violated; an I/O or codec failure is kept as the cause.
 */
public class EditException extends Exception {

    public enum Kind {
        DECODE,
        IO,
        BOUNDS,
        INVALID_DIMENSION,
        UNDO_UNAVAILABLE,
        REDO_UNAVAILABLE,
        UNKNOWN_FILTER,
        NO_IMAGE
    }

    private final Kind kind;

    public EditException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public EditException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }
}
