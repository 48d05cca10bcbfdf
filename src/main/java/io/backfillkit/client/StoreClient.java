package io.backfillkit.client;

import io.backfillkit.error.StoreException;
import io.backfillkit.model.StoreEnvironment;

import java.util.List;

/**
 * Boundary to the analytical store. Deduplication settings travel inside the statement text
 * ({@code SETTINGS insert_deduplication_token=...}), so {@link #execute(String)} needs no side channel.
 */
public interface StoreClient {
    WriteSummary execute(String sql) throws StoreException;

    <T> List<T> query(String sql, Class<T> rowType) throws StoreException;

    /**
     * The endpoint this client talks to, or {@code null} when unknown.
     */
    default StoreEnvironment environment() {
        return null;
    }
}
