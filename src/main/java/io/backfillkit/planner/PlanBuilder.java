package io.backfillkit.planner;

import io.backfillkit.config.BackfillSettings;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.BackfillPlan;
import io.backfillkit.model.Chunk;
import io.backfillkit.model.PlanOptions;
import io.backfillkit.model.StoreEnvironment;
import io.backfillkit.model.Strategy;
import io.backfillkit.model.TargetDescriptor;
import io.backfillkit.model.TimeWindow;
import io.backfillkit.schema.MaterializedViewSchema;
import io.backfillkit.schema.SchemaCatalog;
import io.backfillkit.schema.TableSchema;
import io.backfillkit.util.Hashing;
import io.backfillkit.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns a target and a window into an immutable plan. Only reads the already-loaded catalog, so
 * the same inputs always produce an equal plan.
 */
public final class PlanBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(PlanBuilder.class);
    private static final Pattern TIME_COLUMN = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?$");
    private static final long MILLIS_PER_HOUR = 3_600_000L;
    static final int PLAN_ID_LENGTH = 16;
    static final int TOKEN_LENGTH = 32;

    private final BackfillSettings settings;

    public PlanBuilder(BackfillSettings settings) {
        this.settings = settings;
    }

    public BackfillPlan build(PlanRequest request, SchemaCatalog catalog) {
        TimeWindow window = request.window();
        if (window == null || window.from() == null || window.to() == null) {
            throw new BackfillConfigException(ErrorKind.INVALID_WINDOW, "A backfill window needs both --from and --to.");
        }
        if (window.emptyOrInverted()) {
            throw new BackfillConfigException(ErrorKind.INVALID_WINDOW,
                    "Invalid window: --to (" + Timestamps.format(window.to()) + ") must be after --from ("
                            + Timestamps.format(window.from()) + ").");
        }

        double chunkHours = request.chunkHours() != null ? request.chunkHours() : settings.defaults().chunkHours();
        if (!(chunkHours > 0d) || Double.isInfinite(chunkHours)) {
            throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                    "Invalid --chunk-hours " + chunkHours + ". Expected a positive number.");
        }
        double minChunkMinutes = settings.limits().minChunkMinutes();
        if (chunkHours * 60d < minChunkMinutes) {
            throw new BackfillConfigException(ErrorKind.CHUNK_TOO_SMALL,
                    "Chunk size " + Timestamps.formatHours(chunkHours) + "h is below the minimum of "
                            + Timestamps.formatHours(minChunkMinutes) + " minutes.");
        }
        double maxWindowHours = settings.limits().maxWindowHours();
        if (window.hours() > maxWindowHours) {
            if (!request.forceLargeWindow()) {
                throw new BackfillConfigException(ErrorKind.WINDOW_TOO_LARGE,
                        "Window of " + Timestamps.formatHours(window.hours()) + "h exceeds limits.maxWindowHours ("
                                + Timestamps.formatHours(maxWindowHours) + "h). Pass --force-large-window to override.");
            }
            LOG.warn("Window of {}h for {} exceeds limits.maxWindowHours ({}h); continuing because --force-large-window was given",
                    Timestamps.formatHours(window.hours()), request.target(), Timestamps.formatHours(maxWindowHours));
        }

        TargetDescriptor target = request.target();
        SchemaCatalog metadata = catalog == null ? SchemaCatalog.empty() : catalog;
        List<MaterializedViewSchema> views = metadata.viewsWritingTo(target);
        if (views.size() > 1) {
            throw new BackfillConfigException(ErrorKind.UNSUPPORTED_VIEW_QUERY,
                    "Target " + target + " is written by more than one materialized view ("
                            + views.stream().map(MaterializedViewSchema::qualifiedName).toList()
                            + "); replay one view at a time is not supported.");
        }
        MaterializedViewSchema view = views.isEmpty() ? null : views.get(0);

        TableSchema table = metadata.findTable(target).orElse(null);
        if (table == null && view != null) {
            table = sourceTable(metadata, view);
        }
        TimeColumnResolver.Resolution resolution = TimeColumnResolver.resolve(
                request.timeColumn(),
                null,
                settings.defaults().timeColumn(),
                table
        );
        String timeColumn = resolution.column();
        if (!TIME_COLUMN.matcher(timeColumn).matches()) {
            throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                    "Invalid time column '" + timeColumn + "'. Expected an identifier such as event_time.");
        }
        LOG.debug("Resolved time column {} for {} from {}", timeColumn, target, resolution.source());

        Strategy strategy;
        QueryTemplate template;
        if (view != null) {
            if (!settings.defaults().requireIdempotencyToken()) {
                throw new BackfillConfigException(ErrorKind.INVALID_OPTION,
                        "Target " + target + " is fed by materialized view " + view.qualifiedName()
                                + "; mv_replay requires defaults.requireIdempotencyToken=true.");
            }
            strategy = Strategy.MV_REPLAY;
            template = MvReplayTemplate.of(target.qualifiedName(), view.qualifiedName(), timeColumn, view.as());
        } else {
            strategy = Strategy.TABLE;
            template = new TableTemplate(target.qualifiedName(), timeColumn);
        }

        String planId = planId(target, window, chunkHours, timeColumn);
        PlanOptions options = new PlanOptions(
                settings.defaults().maxRetriesPerChunk(),
                settings.defaults().maxParallelChunks(),
                settings.defaults().requireIdempotencyToken(),
                settings.defaults().retryDelayMs()
        );
        return new BackfillPlan(
                planId,
                target,
                window,
                chunkHours,
                timeColumn,
                strategy,
                template,
                options,
                request.environment(),
                partition(window, chunkHours)
        );
    }

    public static String planId(TargetDescriptor target, TimeWindow window, double chunkHours, String timeColumn) {
        String identity = String.join("|",
                target.qualifiedName(),
                Timestamps.format(window.from()),
                Timestamps.format(window.to()),
                Timestamps.formatHours(chunkHours),
                timeColumn);
        return Hashing.sha256Hex(identity, PLAN_ID_LENGTH);
    }

    /**
     * Contiguous {@code [start, end)} chunks covering the window exactly; only the last one may be shorter.
     */
    public static List<Chunk> partition(TimeWindow window, double chunkHours) {
        long chunkMillis = Math.round(chunkHours * MILLIS_PER_HOUR);
        if (chunkMillis <= 0) {
            throw new BackfillConfigException(ErrorKind.CHUNK_TOO_SMALL, "Chunk size rounds to zero milliseconds.");
        }
        List<Chunk> chunks = new ArrayList<>();
        Instant cursor = window.from();
        int index = 0;
        while (cursor.isBefore(window.to())) {
            Instant next = cursor.plusMillis(chunkMillis);
            Instant end = next.isAfter(window.to()) ? window.to() : next;
            chunks.add(new Chunk(index++, cursor, end));
            cursor = end;
        }
        return chunks;
    }

    public static String idempotencyToken(String planId, Chunk chunk) {
        String identity = String.join("|",
                planId,
                Integer.toString(chunk.index()),
                Timestamps.format(chunk.start()),
                Timestamps.format(chunk.end()));
        return Hashing.sha256Hex(identity, TOKEN_LENGTH);
    }

    private static TableSchema sourceTable(SchemaCatalog catalog, MaterializedViewSchema view) {
        String source = SelectSplicer.sourceTable(view.as());
        if (source == null) {
            return null;
        }
        int dot = source.indexOf('.');
        String database = dot < 0 ? view.database() : source.substring(0, dot);
        String name = dot < 0 ? source : source.substring(dot + 1);
        return catalog.findTable(database, name).orElse(null);
    }

    public record PlanRequest(
            TargetDescriptor target,
            TimeWindow window,
            Double chunkHours,
            String timeColumn,
            boolean forceLargeWindow,
            StoreEnvironment environment
    ) {
    }
}
