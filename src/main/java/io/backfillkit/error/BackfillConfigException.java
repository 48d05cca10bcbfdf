package io.backfillkit.error;

/**
 * Malformed input: bad window, chunk size, time column, options or missing state. Raised before any
 * persistence or execution and never retried.
 */
public final class BackfillConfigException extends BackfillException {
    public BackfillConfigException(ErrorKind kind, String message) {
        super(requireCategory(kind, ErrorCategory.CONFIG), message);
    }

    public BackfillConfigException(ErrorKind kind, String message, Throwable cause) {
        super(requireCategory(kind, ErrorCategory.CONFIG), message, cause);
    }

    static ErrorKind requireCategory(ErrorKind kind, ErrorCategory expected) {
        if (kind.category() != expected) {
            throw new IllegalArgumentException(kind + " is not a " + expected.label() + " error");
        }
        return kind;
    }
}
