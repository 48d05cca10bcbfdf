package io.backfillkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    NOT_STARTED("not_started"),
    RUNNING("running"),
    PAUSED("paused"),
    COMPLETED("completed"),
    COMPLETED_WITH_FAILURES("completed_with_failures"),
    CANCELLED("cancelled");

    private final String wireName;

    RunStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == COMPLETED_WITH_FAILURES || this == CANCELLED;
    }

    /**
     * Whether a process may be writing to the target under this run. A paused run is resumable but
     * idle.
     */
    public boolean isActive() {
        return this == NOT_STARTED || this == RUNNING;
    }

    @JsonCreator
    public static RunStatus fromString(String raw) {
        for (RunStatus value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown run status: " + raw);
    }
}
