package io.backfillkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackfillEvent(
        Instant ts,
        String runId,
        EventKind kind,
        Integer chunkIndex,
        Map<String, Object> detail
) {
    public BackfillEvent {
        detail = detail == null ? Map.of() : detail;
    }

    public static BackfillEvent of(Instant ts, String runId, EventKind kind, Map<String, Object> detail) {
        return new BackfillEvent(ts, runId, kind, null, detail);
    }

    public static BackfillEvent ofChunk(Instant ts, String runId, EventKind kind, int chunkIndex, Map<String, Object> detail) {
        return new BackfillEvent(ts, runId, kind, chunkIndex, detail);
    }
}
