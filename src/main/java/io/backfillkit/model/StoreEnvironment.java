package io.backfillkit.model;

public record StoreEnvironment(String url, String database) {

    public boolean sameAs(StoreEnvironment other) {
        if (other == null) {
            return false;
        }
        return normalizeUrl(url).equals(normalizeUrl(other.url)) && database.equals(other.database);
    }

    private static String normalizeUrl(String raw) {
        String value = raw == null ? "" : raw.trim().toLowerCase();
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
