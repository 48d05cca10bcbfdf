package io.backfillkit.schema;

public record TableRef(String database, String name) {
}
