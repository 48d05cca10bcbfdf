package io.backfillkit.planner;

import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.schema.ColumnSchema;
import io.backfillkit.schema.TableSchema;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the column used for window filtering. First match wins: explicit flag, the table's own
 * backfill config, the global default, then auto-detection over the ordering key and a fixed list
 * of common timestamp names.
 */
public final class TimeColumnResolver {
    static final List<String> COMMON_TIME_COLUMN_NAMES = List.of(
            "event_time",
            "timestamp",
            "created_at",
            "ingested_at",
            "event_at",
            "occurred_at"
    );

    private static final Pattern WRAPPED_COLUMN = Pattern.compile("(?s)^[A-Za-z0-9_]+\\(\\s*([A-Za-z_][A-Za-z0-9_]*)\\s*(,.*)?\\)$");

    private TimeColumnResolver() {
    }

    public static Resolution resolve(String explicitFlag, String schemaTableConfig, String globalDefault, TableSchema table) {
        String explicit = trimToNull(explicitFlag);
        if (explicit != null) {
            return new Resolution(explicit, Source.EXPLICIT);
        }
        String fromSchema = trimToNull(schemaTableConfig);
        if (fromSchema == null && table != null) {
            fromSchema = trimToNull(table.schemaTimeColumn());
        }
        if (fromSchema != null) {
            return new Resolution(fromSchema, Source.SCHEMA);
        }
        String global = trimToNull(globalDefault);
        if (global != null && (table == null || table.column(global).isPresent())) {
            return new Resolution(global, Source.GLOBAL_DEFAULT);
        }
        if (table == null) {
            throw new BackfillConfigException(ErrorKind.NO_TIME_COLUMN_FOUND,
                    "No time column found: no --time-column given, no configured default, and no table metadata to detect one from.");
        }
        return detect(table);
    }

    static Resolution detect(TableSchema table) {
        for (String key : table.orderBy()) {
            String columnName = orderingColumn(key);
            Optional<ColumnSchema> column = table.column(columnName);
            if (column.isPresent() && column.get().dateTimeTyped()) {
                return new Resolution(columnName, Source.ORDER_BY);
            }
        }
        List<String> matches = new ArrayList<>();
        for (String name : COMMON_TIME_COLUMN_NAMES) {
            table.column(name)
                    .filter(ColumnSchema::dateTimeTyped)
                    .ifPresent(c -> matches.add(c.name()));
        }
        if (matches.size() == 1) {
            return new Resolution(matches.get(0), Source.COLUMN_SCAN);
        }
        String qualified = table.database() + "." + table.name();
        if (matches.size() > 1) {
            throw new BackfillConfigException(ErrorKind.AMBIGUOUS_TIME_COLUMN,
                    "Ambiguous time column for " + qualified + ": candidates " + matches
                            + ". Pass --time-column or set backfill.timeColumn on the table.");
        }
        List<String> present = dateTimeColumns(table);
        String hint = present.isEmpty() ? "" : " Date/time columns on the table: " + present + ".";
        throw new BackfillConfigException(ErrorKind.NO_TIME_COLUMN_FOUND,
                "No DateTime column found in the ordering key or common timestamp columns of " + qualified
                        + "." + hint + " Pass --time-column.");
    }

    // Any name qualifies here; these are only suggestions for the error message.
    private static List<String> dateTimeColumns(TableSchema table) {
        List<String> out = new ArrayList<>();
        for (ColumnSchema column : table.columns()) {
            if (column.dateTimeTyped()) {
                out.add(column.name());
            }
        }
        return out;
    }

    // toStartOfHour(event_time) or toStartOfInterval(event_time, INTERVAL 1 HOUR) still order by event_time.
    private static String orderingColumn(String key) {
        String value = key == null ? "" : key.trim();
        Matcher matcher = WRAPPED_COLUMN.matcher(value);
        if (matcher.matches()) {
            return matcher.group(1);
        }
        return value;
    }

    private static String trimToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }

    public enum Source {
        EXPLICIT,
        SCHEMA,
        GLOBAL_DEFAULT,
        ORDER_BY,
        COLUMN_SCAN
    }

    public record Resolution(String column, Source source) {
    }
}
