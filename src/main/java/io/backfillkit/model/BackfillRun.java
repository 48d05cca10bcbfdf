package io.backfillkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Checkpoint of one execution of a plan. {@code chunkStates} holds exactly one entry per plan
 * chunk, at the same index.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackfillRun(
        String planId,
        TargetDescriptor target,
        RunStatus status,
        List<ChunkState> chunkStates,
        String compatibilityToken,
        Instant startedAt,
        Instant updatedAt,
        Instant completedAt,
        String lastError
) {
    public BackfillRun {
        chunkStates = chunkStates == null ? List.of() : List.copyOf(chunkStates);
    }

    public ChunkState chunkState(int index) {
        return chunkStates.get(index);
    }

    public BackfillRun withChunkState(ChunkState state, Instant now) {
        List<ChunkState> next = new ArrayList<>(chunkStates);
        next.set(state.index(), state);
        return new BackfillRun(planId, target, status, next, compatibilityToken, startedAt, now, completedAt, lastError);
    }

    public BackfillRun withStatus(RunStatus nextStatus, Instant now) {
        Instant completed = nextStatus.isTerminal() ? now : null;
        return new BackfillRun(planId, target, nextStatus, chunkStates, compatibilityToken, startedAt, now, completed, lastError);
    }

    public BackfillRun cancelled(Instant requestedAt, String reason) {
        return new BackfillRun(planId, target, RunStatus.CANCELLED, chunkStates, compatibilityToken, startedAt, updatedAt,
                requestedAt, reason);
    }

    public BackfillRun withLastError(String error) {
        return new BackfillRun(planId, target, status, chunkStates, compatibilityToken, startedAt, updatedAt, completedAt, error);
    }

    public BackfillRun withCompatibilityToken(String token) {
        return new BackfillRun(planId, target, status, chunkStates, token, startedAt, updatedAt, completedAt, lastError);
    }

    public long count(ChunkStatus chunkStatus) {
        return chunkStates.stream().filter(s -> s.status() == chunkStatus).count();
    }
}
