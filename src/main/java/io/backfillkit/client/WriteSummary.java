package io.backfillkit.client;

/**
 * What the store reported about an executed statement. {@code rowsWritten} is null when the store
 * did not say.
 */
public record WriteSummary(Long rowsWritten) {
    private static final WriteSummary UNKNOWN = new WriteSummary(null);

    public static WriteSummary unknown() {
        return UNKNOWN;
    }

    public static WriteSummary rows(long rowsWritten) {
        return new WriteSummary(rowsWritten);
    }
}
