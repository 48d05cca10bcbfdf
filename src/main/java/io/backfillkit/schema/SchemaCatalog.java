package io.backfillkit.schema;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.TargetDescriptor;
import io.backfillkit.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Already-loaded table and materialized-view metadata. Planning only reads from it.
 */
public record SchemaCatalog(List<TableSchema> tables, List<MaterializedViewSchema> materializedViews) {
    public SchemaCatalog {
        tables = tables == null ? List.of() : List.copyOf(tables);
        materializedViews = materializedViews == null ? List.of() : List.copyOf(materializedViews);
    }

    public static SchemaCatalog empty() {
        return new SchemaCatalog(List.of(), List.of());
    }

    public static SchemaCatalog fromFile(Path file) {
        if (!Files.exists(file)) {
            throw new BackfillConfigException(ErrorKind.INVALID_SCHEMA, "Schema file not found: " + file);
        }
        try {
            SchemaCatalog catalog = Jsons.mapper().readValue(file.toFile(), SchemaCatalog.class);
            return catalog == null ? empty() : catalog;
        } catch (UnrecognizedPropertyException e) {
            throw new BackfillConfigException(ErrorKind.INVALID_SCHEMA,
                    "Unknown schema key '" + e.getPropertyName() + "' in " + file, e);
        } catch (IOException e) {
            throw new BackfillConfigException(ErrorKind.INVALID_SCHEMA,
                    "Failed to read schema file " + file + ": " + e.getMessage(), e);
        }
    }

    public Optional<TableSchema> findTable(String database, String name) {
        return tables.stream()
                .filter(t -> t.database().equals(database) && t.name().equals(name))
                .findFirst();
    }

    public Optional<TableSchema> findTable(TargetDescriptor target) {
        return findTable(target.database(), target.table());
    }

    public List<MaterializedViewSchema> viewsWritingTo(TargetDescriptor target) {
        return materializedViews.stream()
                .filter(v -> v.to() != null && target.matches(v.to().database(), v.to().name()))
                .toList();
    }
}
