package io.backfillkit.planner;

import io.backfillkit.config.BackfillSettings;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.BackfillPlan;
import io.backfillkit.model.Chunk;
import io.backfillkit.model.Strategy;
import io.backfillkit.model.TargetDescriptor;
import io.backfillkit.model.TimeWindow;
import io.backfillkit.schema.ColumnSchema;
import io.backfillkit.schema.MaterializedViewSchema;
import io.backfillkit.schema.SchemaCatalog;
import io.backfillkit.schema.TableRef;
import io.backfillkit.schema.TableSchema;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

final class PlanBuilderTest {
    private static final TargetDescriptor EVENTS = TargetDescriptor.parse("analytics.events");
    private static final TimeWindow THIRTEEN_HOURS = new TimeWindow(
            Instant.parse("2025-01-01T00:00:00Z"),
            Instant.parse("2025-01-01T13:00:00Z")
    );

    private static SchemaCatalog tableCatalog() {
        TableSchema events = new TableSchema("analytics", "events",
                List.of(new ColumnSchema("event_time", "DateTime"), new ColumnSchema("user_id", "UInt64")),
                List.of("event_time", "user_id"),
                null);
        return new SchemaCatalog(List.of(events), List.of());
    }

    private static PlanBuilder.PlanRequest request(TimeWindow window, Double chunkHours) {
        return new PlanBuilder.PlanRequest(EVENTS, window, chunkHours, null, false, null);
    }

    @Test
    void thirteenHourWindowInSixHourChunksEndsWithAShortChunk() {
        BackfillPlan plan = new PlanBuilder(BackfillSettings.builtIn()).build(request(THIRTEEN_HOURS, 6d), tableCatalog());

        Assertions.assertEquals(3, plan.chunks().size());
        Assertions.assertEquals(new Chunk(0, Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-01-01T06:00:00Z")), plan.chunk(0));
        Assertions.assertEquals(new Chunk(1, Instant.parse("2025-01-01T06:00:00Z"), Instant.parse("2025-01-01T12:00:00Z")), plan.chunk(1));
        Assertions.assertEquals(new Chunk(2, Instant.parse("2025-01-01T12:00:00Z"), Instant.parse("2025-01-01T13:00:00Z")), plan.chunk(2));
        Assertions.assertEquals(Strategy.TABLE, plan.strategy());
        Assertions.assertEquals("event_time", plan.timeColumn());
        Assertions.assertEquals(16, plan.planId().length());
    }

    @Test
    void replanningIsDeterministicAndChunkSizeChangesTheId() {
        PlanBuilder builder = new PlanBuilder(BackfillSettings.builtIn());

        BackfillPlan first = builder.build(request(THIRTEEN_HOURS, 6d), tableCatalog());
        BackfillPlan second = builder.build(request(THIRTEEN_HOURS, 6d), tableCatalog());
        BackfillPlan fourHours = builder.build(request(THIRTEEN_HOURS, 4d), tableCatalog());

        Assertions.assertEquals(first, second);
        Assertions.assertEquals(first.planId(), second.planId());
        Assertions.assertNotEquals(first.planId(), fourHours.planId());
        Assertions.assertEquals(4, fourHours.chunks().size());
        Assertions.assertEquals(Instant.parse("2025-01-01T08:00:00Z"), fourHours.chunk(2).start());
        Assertions.assertEquals(Instant.parse("2025-01-01T13:00:00Z"), fourHours.chunk(3).end());
    }

    @Test
    void chunksCoverUnevenWindowsWithoutGaps() {
        TimeWindow window = new TimeWindow(Instant.parse("2025-03-01T00:17:00Z"), Instant.parse("2025-03-04T05:43:12Z"));
        for (double chunkHours : new double[]{0.25, 1, 1.5, 7, 24, 100}) {
            List<Chunk> chunks = PlanBuilder.partition(window, chunkHours);
            Assertions.assertEquals(window.from(), chunks.get(0).start());
            Assertions.assertEquals(window.to(), chunks.get(chunks.size() - 1).end());
            Assertions.assertEquals((int) Math.ceil(window.hours() / chunkHours), chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                Chunk chunk = chunks.get(i);
                Assertions.assertEquals(i, chunk.index());
                Assertions.assertTrue(chunk.end().isAfter(chunk.start()));
                if (i > 0) {
                    Assertions.assertEquals(chunks.get(i - 1).end(), chunk.start());
                }
                if (i < chunks.size() - 1) {
                    Assertions.assertEquals(Duration.ofMillis(Math.round(chunkHours * 3_600_000L)),
                            Duration.between(chunk.start(), chunk.end()));
                }
            }
        }
    }

    @Test
    void idempotencyTokenDependsOnlyOnPlanAndChunk() {
        Chunk chunk = new Chunk(1, Instant.parse("2025-01-01T06:00:00Z"), Instant.parse("2025-01-01T12:00:00Z"));

        String token = PlanBuilder.idempotencyToken("0123456789abcdef", chunk);

        Assertions.assertEquals(token, PlanBuilder.idempotencyToken("0123456789abcdef", chunk));
        Assertions.assertEquals(32, token.length());
        Assertions.assertNotEquals(token, PlanBuilder.idempotencyToken("fedcba9876543210", chunk));
    }

    @Test
    void invertedWindowIsRejected() {
        TimeWindow inverted = new TimeWindow(THIRTEEN_HOURS.to(), THIRTEEN_HOURS.from());

        BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                () -> new PlanBuilder(BackfillSettings.builtIn()).build(request(inverted, 6d), tableCatalog()));

        Assertions.assertEquals(ErrorKind.INVALID_WINDOW, error.kind());
    }

    @Test
    void chunksBelowTheMinimumAreRejected() {
        BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                () -> new PlanBuilder(BackfillSettings.builtIn()).build(request(THIRTEEN_HOURS, 0.1), tableCatalog()));

        Assertions.assertEquals(ErrorKind.CHUNK_TOO_SMALL, error.kind());
    }

    @Test
    void largeWindowsNeedTheOverride() {
        TimeWindow fortyDays = new TimeWindow(Instant.parse("2025-01-01T00:00:00Z"), Instant.parse("2025-02-10T00:00:00Z"));
        PlanBuilder builder = new PlanBuilder(BackfillSettings.builtIn());

        BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                () -> builder.build(request(fortyDays, 24d), tableCatalog()));
        Assertions.assertEquals(ErrorKind.WINDOW_TOO_LARGE, error.kind());

        BackfillPlan plan = builder.build(new PlanBuilder.PlanRequest(EVENTS, fortyDays, 24d, null, true, null), tableCatalog());
        Assertions.assertEquals(40, plan.chunks().size());
    }

    @Test
    void materializedViewTargetsGetTheReplayStrategy() {
        TableSchema daily = new TableSchema("analytics", "daily_users",
                List.of(new ColumnSchema("day", "Date"), new ColumnSchema("users", "AggregateFunction(uniq, UInt64)")),
                List.of("day"),
                null);
        MaterializedViewSchema view = new MaterializedViewSchema("analytics", "daily_users_mv",
                new TableRef("analytics", "daily_users"),
                "SELECT toDate(event_time) AS day, uniqState(user_id) AS users FROM analytics.events GROUP BY day");
        SchemaCatalog catalog = new SchemaCatalog(List.of(daily), List.of(view));

        BackfillPlan plan = new PlanBuilder(BackfillSettings.builtIn()).build(new PlanBuilder.PlanRequest(
                TargetDescriptor.parse("analytics.daily_users"), THIRTEEN_HOURS, 6d, "event_time", false, null), catalog);

        Assertions.assertEquals(Strategy.MV_REPLAY, plan.strategy());
        MvReplayTemplate template = Assertions.assertInstanceOf(MvReplayTemplate.class, plan.template());
        Assertions.assertEquals("analytics.daily_users_mv", template.view());
        Assertions.assertTrue(plan.options().requireIdempotencyToken());
    }

    @Test
    void replayWithoutIdempotencyTokensIsRejected() {
        BackfillSettings settings = BackfillSettings.builtIn().mergeFile(new BackfillSettings.SettingsFile(
                new BackfillSettings.DefaultsFile(null, null, null, null, false, null), null, null, null));
        MaterializedViewSchema view = new MaterializedViewSchema("analytics", "daily_users_mv",
                new TableRef("analytics", "daily_users"),
                "SELECT toDate(event_time) AS day, count() AS c FROM analytics.events GROUP BY day");

        BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                () -> new PlanBuilder(settings).build(new PlanBuilder.PlanRequest(
                        TargetDescriptor.parse("analytics.daily_users"), THIRTEEN_HOURS, 6d, "event_time", false, null),
                        new SchemaCatalog(List.of(), List.of(view))));

        Assertions.assertEquals(ErrorKind.INVALID_OPTION, error.kind());
    }

    @Test
    void viewTargetsWithoutOwnMetadataDetectTheColumnOnTheSourceTable() {
        MaterializedViewSchema view = new MaterializedViewSchema("analytics", "daily_users_mv",
                new TableRef("analytics", "daily_users"),
                "SELECT toDate(event_time) AS day, count() AS c FROM events GROUP BY day");

        BackfillPlan plan = new PlanBuilder(BackfillSettings.builtIn()).build(new PlanBuilder.PlanRequest(
                TargetDescriptor.parse("analytics.daily_users"), THIRTEEN_HOURS, 6d, null, false, null),
                new SchemaCatalog(tableCatalog().tables(), List.of(view)));

        Assertions.assertEquals("event_time", plan.timeColumn());
    }

    @Test
    void oddTimeColumnNamesAreRejected() {
        BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                () -> new PlanBuilder(BackfillSettings.builtIn()).build(new PlanBuilder.PlanRequest(
                        EVENTS, THIRTEEN_HOURS, 6d, "event_time; DROP TABLE x", false, null), tableCatalog()));

        Assertions.assertEquals(ErrorKind.INVALID_OPTION, error.kind());
    }
}
