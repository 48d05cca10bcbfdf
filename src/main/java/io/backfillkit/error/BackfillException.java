package io.backfillkit.error;

public class BackfillException extends RuntimeException {
    private final ErrorKind kind;

    public BackfillException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public BackfillException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind kind() {
        return kind;
    }

    public ErrorCategory category() {
        return kind.category();
    }

    public int exitCode() {
        return kind.category().exitCode();
    }
}
