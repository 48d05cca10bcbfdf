package io.backfillkit.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.backfillkit.planner.QueryTemplate;

import java.util.List;

/**
 * Written once by {@code plan}; never mutated afterwards. Two plans built from the same inputs
 * compare equal, which is how a repeated {@code plan} call is recognised as a no-op.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackfillPlan(
        String planId,
        TargetDescriptor target,
        TimeWindow window,
        double chunkHours,
        String timeColumn,
        Strategy strategy,
        QueryTemplate template,
        PlanOptions options,
        StoreEnvironment environment,
        List<Chunk> chunks
) {
    public BackfillPlan {
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public Chunk chunk(int index) {
        return chunks.get(index);
    }
}
