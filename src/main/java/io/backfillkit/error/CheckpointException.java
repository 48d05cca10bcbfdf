package io.backfillkit.error;

public final class CheckpointException extends BackfillException {
    public CheckpointException(ErrorKind kind, String message, Throwable cause) {
        super(BackfillConfigException.requireCategory(kind, ErrorCategory.PERSISTENCE), message, cause);
    }
}
