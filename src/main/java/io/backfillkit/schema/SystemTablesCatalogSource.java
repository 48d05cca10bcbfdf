package io.backfillkit.schema;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.backfillkit.client.StoreClient;
import io.backfillkit.error.StoreException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link SchemaCatalog} for one database from the live store's {@code system.tables}
 * and {@code system.columns}.
 */
public final class SystemTablesCatalogSource {
    private static final Pattern MV_TARGET = Pattern.compile(
            "(?is)^\\s*CREATE\\s+MATERIALIZED\\s+VIEW\\s+.*?\\bTO\\s+`?([A-Za-z0-9_]+)`?\\s*\\.\\s*`?([A-Za-z0-9_]+)`?");
    private static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    private final StoreClient client;

    public SystemTablesCatalogSource(StoreClient client) {
        this.client = client;
    }

    public SchemaCatalog load(String database) throws StoreException {
        if (database == null || !SAFE_IDENTIFIER.matcher(database).matches()) {
            throw new IllegalArgumentException("Invalid database name: " + database);
        }
        List<TableRow> tableRows = client.query(
                "SELECT database, name, engine, sorting_key, create_table_query, as_select "
                        + "FROM system.tables WHERE database = '" + database + "'",
                TableRow.class
        );
        List<ColumnRow> columnRows = client.query(
                "SELECT database, table, name, type FROM system.columns "
                        + "WHERE database = '" + database + "' ORDER BY table, position",
                ColumnRow.class
        );

        Map<String, List<ColumnSchema>> columnsByTable = new LinkedHashMap<>();
        for (ColumnRow row : columnRows) {
            columnsByTable.computeIfAbsent(row.table(), k -> new ArrayList<>())
                    .add(new ColumnSchema(row.name(), row.type()));
        }

        List<TableSchema> tables = new ArrayList<>();
        List<MaterializedViewSchema> views = new ArrayList<>();
        for (TableRow row : tableRows) {
            if ("MaterializedView".equals(row.engine())) {
                TableRef to = parseViewTarget(row.createTableQuery());
                if (to != null && row.asSelect() != null && !row.asSelect().isBlank()) {
                    views.add(new MaterializedViewSchema(row.database(), row.name(), to, row.asSelect()));
                }
                continue;
            }
            tables.add(new TableSchema(
                    row.database(),
                    row.name(),
                    columnsByTable.getOrDefault(row.name(), List.of()),
                    splitSortingKey(row.sortingKey()),
                    null
            ));
        }
        return new SchemaCatalog(tables, views);
    }

    static TableRef parseViewTarget(String createQuery) {
        if (createQuery == null) {
            return null;
        }
        Matcher matcher = MV_TARGET.matcher(createQuery);
        if (!matcher.find()) {
            return null;
        }
        return new TableRef(matcher.group(1), matcher.group(2));
    }

    // Commas inside function arguments, e.g. toStartOfInterval(ts, toIntervalHour(1)), do not separate keys.
    static List<String> splitSortingKey(String sortingKey) {
        if (sortingKey == null || sortingKey.isBlank()) {
            return List.of();
        }
        List<String> keys = new ArrayList<>();
        int depth = 0;
        int start = 0;
        for (int i = 0; i < sortingKey.length(); i++) {
            char ch = sortingKey.charAt(i);
            if (ch == '(') {
                depth++;
            } else if (ch == ')') {
                depth = Math.max(0, depth - 1);
            } else if (ch == ',' && depth == 0) {
                addKey(keys, sortingKey.substring(start, i));
                start = i + 1;
            }
        }
        addKey(keys, sortingKey.substring(start));
        return keys;
    }

    private static void addKey(List<String> keys, String raw) {
        String key = raw.trim();
        if (!key.isEmpty()) {
            keys.add(key);
        }
    }

    record TableRow(
            String database,
            String name,
            String engine,
            @JsonProperty("sorting_key") String sortingKey,
            @JsonProperty("create_table_query") String createTableQuery,
            @JsonProperty("as_select") String asSelect
    ) {
    }

    record ColumnRow(String database, String table, String name, String type) {
    }
}
