package io.backfillkit.error;

public enum ErrorCategory {
    CONFIG("config", 2),
    POLICY("policy", 2),
    PERSISTENCE("persistence", 1);

    private final String label;
    private final int exitCode;

    ErrorCategory(String label, int exitCode) {
        this.label = label;
        this.exitCode = exitCode;
    }

    public String label() {
        return label;
    }

    public int exitCode() {
        return exitCode;
    }
}
