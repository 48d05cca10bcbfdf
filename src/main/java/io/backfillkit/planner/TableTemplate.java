package io.backfillkit.planner;

/**
 * Re-inserts the target's own rows for the chunk window into the target.
 */
public record TableTemplate(String target, String timeColumn) implements QueryTemplate {

    @Override
    public String render(ChunkRenderContext ctx) {
        return String.join("\n",
                SqlFragments.header(ctx),
                "INSERT INTO " + target,
                "SELECT *",
                "FROM " + target,
                "WHERE " + SqlFragments.windowPredicate(timeColumn, ctx.chunk().start(), ctx.chunk().end()),
                SqlFragments.settings(ctx));
    }
}
