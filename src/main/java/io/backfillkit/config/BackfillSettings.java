package io.backfillkit.config;

import com.fasterxml.jackson.databind.exc.UnrecognizedPropertyException;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.StoreEnvironment;
import io.backfillkit.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Effective options after layering built-in defaults, the settings file and command-line
 * overrides. Every layer has its own merge step; only {@link #validate()}d values reach the
 * planner and the engine.
 */
public record BackfillSettings(
        Defaults defaults,
        Policy policy,
        Limits limits,
        Store store
) {
    public static final double DEFAULT_CHUNK_HOURS = 6d;
    public static final int DEFAULT_MAX_PARALLEL_CHUNKS = 1;
    public static final int DEFAULT_MAX_RETRIES_PER_CHUNK = 3;
    public static final long DEFAULT_RETRY_DELAY_MS = 1_000L;
    public static final double DEFAULT_MAX_WINDOW_HOURS = 24d * 30d;
    public static final double DEFAULT_MIN_CHUNK_MINUTES = 15d;
    public static final long DEFAULT_STORE_TIMEOUT_MS = 300_000L;

    public static BackfillSettings builtIn() {
        return new BackfillSettings(
                new Defaults(
                        DEFAULT_CHUNK_HOURS,
                        DEFAULT_MAX_PARALLEL_CHUNKS,
                        DEFAULT_MAX_RETRIES_PER_CHUNK,
                        DEFAULT_RETRY_DELAY_MS,
                        true,
                        null
                ),
                new Policy(true, true, true, true),
                new Limits(DEFAULT_MAX_WINDOW_HOURS, DEFAULT_MIN_CHUNK_MINUTES),
                new Store(null, "default", null, null, DEFAULT_STORE_TIMEOUT_MS)
        );
    }

    /**
     * Defaults, then the settings file when it exists. A missing file is not an error.
     */
    public static BackfillSettings load(Path settingsFile) {
        BackfillSettings base = builtIn();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return base;
        }
        return base.mergeFile(readFile(settingsFile));
    }

    static SettingsFile readFile(Path settingsFile) {
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return file == null ? SettingsFile.EMPTY : file;
        } catch (UnrecognizedPropertyException e) {
            throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                    "Unknown settings key '" + e.getPropertyName() + "' in " + settingsFile, e);
        } catch (IOException e) {
            throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                    "Failed to read settings file " + settingsFile + ": " + e.getMessage(), e);
        }
    }

    public BackfillSettings mergeFile(SettingsFile file) {
        if (file == null) {
            return this;
        }
        Defaults d = defaults;
        if (file.defaults() != null) {
            DefaultsFile f = file.defaults();
            d = new Defaults(
                    f.chunkHours() != null ? f.chunkHours() : d.chunkHours(),
                    f.maxParallelChunks() != null ? f.maxParallelChunks() : d.maxParallelChunks(),
                    f.maxRetriesPerChunk() != null ? f.maxRetriesPerChunk() : d.maxRetriesPerChunk(),
                    f.retryDelayMs() != null ? f.retryDelayMs() : d.retryDelayMs(),
                    f.requireIdempotencyToken() != null ? f.requireIdempotencyToken() : d.requireIdempotencyToken(),
                    blankToNull(f.timeColumn()) != null ? f.timeColumn().trim() : d.timeColumn()
            );
        }
        Policy p = policy;
        if (file.policy() != null) {
            PolicyFile f = file.policy();
            p = new Policy(
                    f.requireDryRunBeforeRun() != null ? f.requireDryRunBeforeRun() : p.requireDryRunBeforeRun(),
                    f.requireExplicitWindow() != null ? f.requireExplicitWindow() : p.requireExplicitWindow(),
                    f.blockOverlappingRuns() != null ? f.blockOverlappingRuns() : p.blockOverlappingRuns(),
                    f.failCheckOnRequiredPendingBackfill() != null
                            ? f.failCheckOnRequiredPendingBackfill()
                            : p.failCheckOnRequiredPendingBackfill()
            );
        }
        Limits l = limits;
        if (file.limits() != null) {
            LimitsFile f = file.limits();
            l = new Limits(
                    f.maxWindowHours() != null ? f.maxWindowHours() : l.maxWindowHours(),
                    f.minChunkMinutes() != null ? f.minChunkMinutes() : l.minChunkMinutes()
            );
        }
        Store s = store;
        if (file.store() != null) {
            StoreFile f = file.store();
            s = new Store(
                    blankToNull(f.url()) != null ? f.url().trim() : s.url(),
                    blankToNull(f.database()) != null ? f.database().trim() : s.database(),
                    blankToNull(f.user()) != null ? f.user().trim() : s.user(),
                    f.password() != null ? f.password() : s.password(),
                    f.requestTimeoutMs() != null ? f.requestTimeoutMs() : s.requestTimeoutMs()
            );
        }
        return new BackfillSettings(d, p, l, s);
    }

    public BackfillSettings mergeOverrides(Overrides overrides) {
        if (overrides == null) {
            return this;
        }
        Defaults d = new Defaults(
                overrides.chunkHours() != null ? overrides.chunkHours() : defaults.chunkHours(),
                defaults.maxParallelChunks(),
                defaults.maxRetriesPerChunk(),
                defaults.retryDelayMs(),
                defaults.requireIdempotencyToken(),
                defaults.timeColumn()
        );
        Store s = new Store(
                blankToNull(overrides.storeUrl()) != null ? overrides.storeUrl().trim() : store.url(),
                blankToNull(overrides.storeDatabase()) != null ? overrides.storeDatabase().trim() : store.database(),
                blankToNull(overrides.storeUser()) != null ? overrides.storeUser().trim() : store.user(),
                overrides.storePassword() != null ? overrides.storePassword() : store.password(),
                store.requestTimeoutMs()
        );
        return new BackfillSettings(d, policy, limits, s);
    }

    public BackfillSettings validate() {
        requirePositive(defaults.chunkHours(), "defaults.chunkHours");
        requirePositive(defaults.maxParallelChunks(), "defaults.maxParallelChunks");
        requirePositive(defaults.maxRetriesPerChunk(), "defaults.maxRetriesPerChunk");
        if (defaults.retryDelayMs() < 0) {
            throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                    "Invalid option \"defaults.retryDelayMs\". Expected a non-negative number.");
        }
        requirePositive(limits.maxWindowHours(), "limits.maxWindowHours");
        requirePositive(limits.minChunkMinutes(), "limits.minChunkMinutes");
        requirePositive(store.requestTimeoutMs(), "store.requestTimeoutMs");
        if (defaults.chunkHours() * 60d < limits.minChunkMinutes()) {
            throw new BackfillConfigException(ErrorKind.CHUNK_TOO_SMALL,
                    "defaults.chunkHours (" + defaults.chunkHours() + ") must be >= limits.minChunkMinutes ("
                            + limits.minChunkMinutes() + "m).");
        }
        return this;
    }

    public StoreEnvironment storeEnvironment() {
        if (store.url() == null) {
            return null;
        }
        return new StoreEnvironment(store.url(), store.database());
    }

    private static void requirePositive(double value, String key) {
        if (!(value > 0d) || Double.isInfinite(value)) {
            throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                    "Invalid option \"" + key + "\". Expected a positive number.");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    public record Defaults(
            double chunkHours,
            int maxParallelChunks,
            int maxRetriesPerChunk,
            long retryDelayMs,
            boolean requireIdempotencyToken,
            String timeColumn
    ) {
    }

    public record Policy(
            boolean requireDryRunBeforeRun,
            boolean requireExplicitWindow,
            boolean blockOverlappingRuns,
            boolean failCheckOnRequiredPendingBackfill
    ) {
    }

    public record Limits(double maxWindowHours, double minChunkMinutes) {
    }

    public record Store(String url, String database, String user, String password, long requestTimeoutMs) {
        @Override
        public String toString() {
            return "Store[url=" + url + ", database=" + database + ", user=" + user
                    + ", password=" + (password == null ? "null" : "***") + ", requestTimeoutMs=" + requestTimeoutMs + "]";
        }
    }

    public record Overrides(
            Double chunkHours,
            String storeUrl,
            String storeDatabase,
            String storeUser,
            String storePassword
    ) {
    }

    public record SettingsFile(DefaultsFile defaults, PolicyFile policy, LimitsFile limits, StoreFile store) {
        static final SettingsFile EMPTY = new SettingsFile(null, null, null, null);
    }

    public record DefaultsFile(
            Double chunkHours,
            Integer maxParallelChunks,
            Integer maxRetriesPerChunk,
            Long retryDelayMs,
            Boolean requireIdempotencyToken,
            String timeColumn
    ) {
    }

    public record PolicyFile(
            Boolean requireDryRunBeforeRun,
            Boolean requireExplicitWindow,
            Boolean blockOverlappingRuns,
            Boolean failCheckOnRequiredPendingBackfill
    ) {
    }

    public record LimitsFile(Double maxWindowHours, Double minChunkMinutes) {
    }

    public record StoreFile(String url, String database, String user, String password, Long requestTimeoutMs) {
    }
}
