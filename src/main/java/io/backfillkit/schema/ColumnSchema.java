package io.backfillkit.schema;

public record ColumnSchema(String name, String type) {

    public boolean dateTimeTyped() {
        return isDateTimeType(type);
    }

    static boolean isDateTimeType(String rawType) {
        if (rawType == null) {
            return false;
        }
        String type = unwrap(rawType.trim());
        return type.equals("DateTime")
                || type.equals("DateTime64")
                || type.equals("Date")
                || type.equals("Date32")
                || type.startsWith("DateTime(")
                || type.startsWith("DateTime64(");
    }

    private static String unwrap(String type) {
        String current = type;
        for (String wrapper : new String[]{"Nullable(", "LowCardinality("}) {
            if (current.startsWith(wrapper) && current.endsWith(")")) {
                current = current.substring(wrapper.length(), current.length() - 1).trim();
            }
        }
        return current;
    }
}
