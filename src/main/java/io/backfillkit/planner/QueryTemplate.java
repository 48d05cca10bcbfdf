package io.backfillkit.planner;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Chunk statement shape chosen at planning time. Rendering is pure: the same context always
 * yields the same SQL.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TableTemplate.class, name = "table"),
        @JsonSubTypes.Type(value = MvReplayTemplate.class, name = "mv_replay")
})
public interface QueryTemplate {
    String render(ChunkRenderContext context);
}
