package io.backfillkit.planner;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Replays a materialized view's SELECT into its destination table for one chunk.
 *
 * <p>The window predicate goes into the view's own WHERE, at the same nesting depth as the stored
 * query. Wrapping the SELECT in an outer CTE and filtering there is avoided on purpose: it changes
 * how the store infers nullability of array-typed aggregate results and can turn a valid
 * aggregation into an illegal one. This is a workaround for that inference behaviour, not a
 * general rewriting rule.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MvReplayTemplate(
        String target,
        String view,
        String timeColumn,
        String head,
        String condition,
        String tail
) implements QueryTemplate {

    static MvReplayTemplate of(String target, String view, String timeColumn, String select) {
        SelectSplicer.SplicePoint point = SelectSplicer.locate(select);
        return new MvReplayTemplate(target, view, timeColumn, point.head(), point.condition(), point.tail());
    }

    @Override
    public String render(ChunkRenderContext ctx) {
        String predicate = SqlFragments.windowPredicate(timeColumn, ctx.chunk().start(), ctx.chunk().end());
        StringBuilder select = new StringBuilder(head.stripTrailing());
        if (condition == null) {
            select.append("\nWHERE ").append(predicate);
        } else {
            select.append(' ').append(predicate).append("\n  AND (").append(condition.strip()).append(')');
        }
        String rest = tail == null ? "" : tail.strip();
        if (!rest.isEmpty()) {
            select.append('\n').append(rest);
        }
        return String.join("\n",
                SqlFragments.header(ctx),
                "INSERT INTO " + target,
                select.toString(),
                SqlFragments.settings(ctx));
    }
}
