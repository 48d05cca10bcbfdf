package io.backfillkit.schema;

/**
 * A materialized view writing into {@code to}; {@code as} is the stored SELECT text.
 */
public record MaterializedViewSchema(String database, String name, TableRef to, String as) {

    public String qualifiedName() {
        return database + "." + name;
    }
}
