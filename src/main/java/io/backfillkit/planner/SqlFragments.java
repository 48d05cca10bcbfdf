package io.backfillkit.planner;

import io.backfillkit.util.Timestamps;

import java.time.Instant;

final class SqlFragments {
    private SqlFragments() {
    }

    static String header(ChunkRenderContext ctx) {
        return "/* backfill plan=" + ctx.planId()
                + " chunk=" + ctx.chunk().index()
                + " token=" + ctx.idempotencyToken() + " */";
    }

    static String windowPredicate(String timeColumn, Instant start, Instant end) {
        return timeColumn + " >= parseDateTimeBestEffort(" + literal(Timestamps.format(start)) + ")"
                + " AND " + timeColumn + " < parseDateTimeBestEffort(" + literal(Timestamps.format(end)) + ")";
    }

    static String settings(ChunkRenderContext ctx) {
        StringBuilder sb = new StringBuilder("SETTINGS async_insert=0");
        if (ctx.attachDeduplicationToken()) {
            sb.append(", insert_deduplication_token=").append(literal(ctx.idempotencyToken()));
        }
        return sb.toString();
    }

    static String literal(String value) {
        return "'" + value.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }
}
