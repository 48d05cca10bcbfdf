package io.backfillkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChunkState(
        int index,
        ChunkStatus status,
        int attempts,
        String lastError,
        String idempotencyToken,
        Instant startedAt,
        Instant completedAt,
        Long rowsWritten
) {
    public static ChunkState pending(int index, String idempotencyToken) {
        return new ChunkState(index, ChunkStatus.PENDING, 0, null, idempotencyToken, null, null, null);
    }

    public ChunkState startAttempt(Instant now) {
        return new ChunkState(index, ChunkStatus.RUNNING, attempts + 1, lastError, idempotencyToken, now, null, null);
    }

    /**
     * @param rowsWritten as reported by the store, or null
     */
    public ChunkState succeeded(Instant now, Long rowsWritten) {
        return new ChunkState(index, ChunkStatus.SUCCEEDED, attempts, null, idempotencyToken, startedAt, now, rowsWritten);
    }

    public ChunkState failed(ChunkStatus failureStatus, String error, Instant now) {
        Instant completed = failureStatus == ChunkStatus.FAILED_EXHAUSTED ? now : null;
        return new ChunkState(index, failureStatus, attempts, error, idempotencyToken, startedAt, completed, null);
    }

    public ChunkState resetForReplay() {
        return new ChunkState(index, ChunkStatus.PENDING, 0, null, idempotencyToken, null, null, null);
    }
}
