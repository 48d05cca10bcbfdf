package io.backfillkit.error;

/**
 * A statement failed inside the analytical store. Checked, because every caller has to decide
 * between retrying and recording the failure.
 */
public class StoreException extends Exception {
    private final int statusCode;

    public StoreException(String message) {
        this(message, -1, null);
    }

    public StoreException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public StoreException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
