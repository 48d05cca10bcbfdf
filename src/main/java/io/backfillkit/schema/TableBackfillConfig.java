package io.backfillkit.schema;

/**
 * Per-table backfill settings declared next to the table definition.
 */
public record TableBackfillConfig(String timeColumn) {
}
