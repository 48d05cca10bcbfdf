package io.backfillkit.schema;

import java.util.List;
import java.util.Optional;

public record TableSchema(
        String database,
        String name,
        List<ColumnSchema> columns,
        List<String> orderBy,
        TableBackfillConfig backfill
) {
    public TableSchema {
        columns = columns == null ? List.of() : List.copyOf(columns);
        orderBy = orderBy == null ? List.of() : List.copyOf(orderBy);
    }

    public Optional<ColumnSchema> column(String columnName) {
        return columns.stream().filter(c -> c.name().equals(columnName)).findFirst();
    }

    public String schemaTimeColumn() {
        return backfill == null ? null : backfill.timeColumn();
    }
}
