package io.backfillkit.model;

public record PlanOptions(
        int maxRetriesPerChunk,
        int maxParallelChunks,
        boolean requireIdempotencyToken,
        long retryDelayMs
) {
}
