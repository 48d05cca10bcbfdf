package io.backfillkit.model;

import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;

import java.util.regex.Pattern;

public record TargetDescriptor(String database, String table) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9_]+");

    public static TargetDescriptor parse(String raw) {
        String value = raw == null ? "" : raw.trim();
        int dot = value.indexOf('.');
        if (dot <= 0 || dot != value.lastIndexOf('.') || dot == value.length() - 1) {
            throw new BackfillConfigException(ErrorKind.INVALID_TARGET,
                    "Invalid target '" + raw + "'. Expected <database.table>.");
        }
        String database = value.substring(0, dot);
        String table = value.substring(dot + 1);
        if (!IDENTIFIER.matcher(database).matches() || !IDENTIFIER.matcher(table).matches()) {
            throw new BackfillConfigException(ErrorKind.INVALID_TARGET,
                    "Invalid target '" + raw + "'. Database and table must match [A-Za-z0-9_]+.");
        }
        return new TargetDescriptor(database, table);
    }

    public String qualifiedName() {
        return database + "." + table;
    }

    public boolean matches(String otherDatabase, String otherTable) {
        return database.equals(otherDatabase) && table.equals(otherTable);
    }

    @Override
    public String toString() {
        return qualifiedName();
    }
}
