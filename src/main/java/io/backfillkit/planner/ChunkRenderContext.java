package io.backfillkit.planner;

import io.backfillkit.model.Chunk;

public record ChunkRenderContext(
        String planId,
        Chunk chunk,
        String idempotencyToken,
        boolean attachDeduplicationToken
) {
}
