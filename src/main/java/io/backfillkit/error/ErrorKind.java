package io.backfillkit.error;

public enum ErrorKind {
    INVALID_WINDOW(ErrorCategory.CONFIG),
    WINDOW_TOO_LARGE(ErrorCategory.CONFIG),
    CHUNK_TOO_SMALL(ErrorCategory.CONFIG),
    NO_TIME_COLUMN_FOUND(ErrorCategory.CONFIG),
    AMBIGUOUS_TIME_COLUMN(ErrorCategory.CONFIG),
    INVALID_TARGET(ErrorCategory.CONFIG),
    INVALID_OPTION(ErrorCategory.CONFIG),
    UNSUPPORTED_VIEW_QUERY(ErrorCategory.CONFIG),
    INVALID_SCHEMA(ErrorCategory.CONFIG),
    PLAN_NOT_FOUND(ErrorCategory.CONFIG),
    PLAN_ALREADY_EXISTS(ErrorCategory.CONFIG),
    RUN_NOT_FOUND(ErrorCategory.CONFIG),
    STORE_NOT_CONFIGURED(ErrorCategory.CONFIG),

    EXPLICIT_WINDOW_REQUIRED(ErrorCategory.POLICY),
    DRY_RUN_REQUIRED(ErrorCategory.POLICY),
    OVERLAPPING_RUN(ErrorCategory.POLICY),
    RUN_CANCELLED(ErrorCategory.POLICY),
    RUN_ALREADY_COMPLETED(ErrorCategory.POLICY),
    COMPATIBILITY_MISMATCH(ErrorCategory.POLICY),
    ENVIRONMENT_MISMATCH(ErrorCategory.POLICY),

    CHECKPOINT_WRITE_FAILED(ErrorCategory.PERSISTENCE),
    CHECKPOINT_READ_FAILED(ErrorCategory.PERSISTENCE);

    private final ErrorCategory category;

    ErrorKind(ErrorCategory category) {
        this.category = category;
    }

    public ErrorCategory category() {
        return category;
    }

    public String code() {
        return name().toLowerCase();
    }
}
