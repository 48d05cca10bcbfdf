package io.backfillkit.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum EventKind {
    PLAN_CREATED("plan_created"),
    PLAN_OVERWRITTEN("plan_overwritten"),
    RUN_STARTED("run_started"),
    CHUNK_STARTED("chunk_started"),
    CHUNK_SUCCEEDED("chunk_succeeded"),
    CHUNK_RETRY_SCHEDULED("chunk_retry_scheduled"),
    CHUNK_FAILED("chunk_failed"),
    RUN_COMPLETED("run_completed"),
    RUN_COMPLETED_WITH_FAILURES("run_completed_with_failures"),
    RUN_CANCELLED("run_cancelled"),
    RUN_PAUSED("run_paused"),
    RUN_ARCHIVED("run_archived"),
    POLICY_OVERRIDDEN("policy_overridden");

    private final String wireName;

    EventKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static EventKind fromString(String raw) {
        for (EventKind value : values()) {
            if (value.wireName.equalsIgnoreCase(raw) || value.name().equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown event kind: " + raw);
    }
}
