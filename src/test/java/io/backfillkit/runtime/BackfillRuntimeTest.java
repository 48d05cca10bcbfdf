package io.backfillkit.runtime;

import io.backfillkit.client.StoreClient;
import io.backfillkit.client.WriteSummary;
import io.backfillkit.config.BackfillConfig;
import io.backfillkit.config.BackfillSettings;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.BackfillPolicyException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.error.StoreException;
import io.backfillkit.model.BackfillEvent;
import io.backfillkit.model.BackfillRun;
import io.backfillkit.model.EventKind;
import io.backfillkit.model.RunStatus;
import io.backfillkit.model.StoreEnvironment;
import io.backfillkit.schema.SchemaCatalog;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

final class BackfillRuntimeTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2025-02-01T10:42:17Z"), ZoneOffset.UTC);
    private static final Sleeper NO_SLEEP = millis -> {
    };
    private static final long ROWS_PER_CHUNK = 1_000L;

    private static BackfillRuntime runtime(Path root, BackfillSettings settings) {
        BackfillRuntime runtime = new BackfillRuntime(BackfillConfig.fromRoot(root.toString()), settings, NO_SLEEP, CLOCK);
        runtime.init();
        return runtime;
    }

    private static BackfillSettings relaxedPolicy() {
        return BackfillSettings.builtIn().mergeFile(new BackfillSettings.SettingsFile(
                null,
                new BackfillSettings.PolicyFile(false, false, null, false),
                null,
                null
        ));
    }

    private static BackfillRuntime.PlanInput planInput(String from, String to, boolean force) {
        return new BackfillRuntime.PlanInput("analytics.events", from, to, 6d, "event_time", false, force);
    }

    private static BackfillRuntime.RunInput runInput(String planId) {
        return new BackfillRuntime.RunInput(planId, false, false, false, false, false);
    }

    @Test
    void planThenRunCompletesAndSecondRunIsANoop() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-happy-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            BackfillRuntime.PlanOutcome plan = runtime.plan(
                    planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false), SchemaCatalog.empty());
            Assertions.assertEquals("created", plan.write());
            Assertions.assertEquals(3, plan.chunkCount());
            Assertions.assertEquals("2025-01-01T12:00:00.000Z", plan.chunks().get(2).start());
            Assertions.assertTrue(plan.firstChunkSql().startsWith("/* backfill plan=" + plan.planId() + " chunk=0 "));

            BackfillRuntime.PlanOutcome again = runtime.plan(
                    planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false), SchemaCatalog.empty());
            Assertions.assertEquals("unchanged", again.write());
            Assertions.assertEquals(plan.planId(), again.planId());

            FakeClient client = new FakeClient(sql -> false);
            BackfillRuntime.RunOutcome run = runtime.run(runInput(plan.planId()), client);
            Assertions.assertEquals("completed", run.status());
            Assertions.assertEquals(3, run.totals().succeeded());

            BackfillRuntime.RunOutcome rerun = runtime.run(runInput(plan.planId()), client);
            Assertions.assertTrue(rerun.noop());
            Assertions.assertEquals(3, client.statements.size());

            BackfillRuntime.StatusOutcome status = runtime.status(plan.planId());
            Assertions.assertEquals("completed", status.status());
            Assertions.assertEquals(3, status.attempts());
            Assertions.assertEquals(3 * ROWS_PER_CHUNK, status.totals().rowsWritten());
            Assertions.assertEquals(ROWS_PER_CHUNK, status.chunks().get(1).rowsWritten());
            Assertions.assertEquals(List.of("No remediation required."), runtime.doctor(plan.planId()).recommendations());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void statusOfAnUnrunPlanShowsPendingChunks() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-status-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            String planId = runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();

            BackfillRuntime.StatusOutcome status = runtime.status(planId);

            Assertions.assertEquals("not_started", status.status());
            Assertions.assertEquals(3, status.totals().pending());
            Assertions.assertTrue(status.chunks().stream().allMatch(c -> c.status().equals("pending")));
            BackfillRuntime.DoctorOutcome doctor = runtime.doctor(planId);
            Assertions.assertEquals(List.of("plan_not_run"), doctor.issueCodes());
            Assertions.assertFalse(doctor.ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownPlanIsAConfigurationError() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-missing-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());

            BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                    () -> runtime.run(runInput("0123456789abcdef"), new FakeClient(sql -> false)));

            Assertions.assertEquals(ErrorKind.PLAN_NOT_FOUND, error.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void inlineRunNeedsAPriorPlanUnderTheDefaultPolicy() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-dry-run-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            BackfillRuntime.PlanInput input = planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false);
            FakeClient client = new FakeClient(sql -> false);

            BackfillPolicyException error = Assertions.assertThrows(BackfillPolicyException.class,
                    () -> runtime.runInline(input, runInput(null), SchemaCatalog.empty(), client));
            Assertions.assertEquals(ErrorKind.DRY_RUN_REQUIRED, error.kind());
            Assertions.assertTrue(client.statements.isEmpty());

            runtime.plan(input, SchemaCatalog.empty());
            BackfillRuntime.RunOutcome run = runtime.runInline(input, runInput(null), SchemaCatalog.empty(), client);
            Assertions.assertEquals("completed", run.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void relaxedPolicyAllowsImplicitWindowAndInlineRun() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-relaxed-");
        try {
            BackfillRuntime runtime = runtime(root, relaxedPolicy());
            BackfillRuntime.PlanInput implicit = planInput(null, null, false);

            BackfillRuntime.RunOutcome run = runtime.runInline(implicit, runInput(null), SchemaCatalog.empty(),
                    new FakeClient(sql -> false));

            Assertions.assertEquals("completed", run.status());
            BackfillRuntime.StatusOutcome status = runtime.status(run.planId());
            Assertions.assertEquals(4, status.chunks().size());
            Assertions.assertEquals("2025-01-31T10:00:00.000Z", status.chunks().get(0).start());
            Assertions.assertEquals("2025-02-01T10:00:00.000Z", status.chunks().get(3).end());
            List<EventKind> kinds = runtime.store().readEvents(run.planId()).stream().map(BackfillEvent::kind).toList();
            Assertions.assertTrue(kinds.contains(EventKind.POLICY_OVERRIDDEN));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void implicitWindowIsRejectedByDefault() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-explicit-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());

            BackfillPolicyException error = Assertions.assertThrows(BackfillPolicyException.class,
                    () -> runtime.plan(planInput("2025-01-01T00:00:00Z", null, false), SchemaCatalog.empty()));

            Assertions.assertEquals(ErrorKind.EXPLICIT_WINDOW_REQUIRED, error.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unparseableTimestampIsAnInvalidWindow() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-bad-ts-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());

            BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                    () -> runtime.plan(planInput("yesterday", "2025-01-01T13:00:00Z", false), SchemaCatalog.empty()));

            Assertions.assertEquals(ErrorKind.INVALID_WINDOW, error.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeConvergesAfterPartialFailure() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-resume-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            String planId = runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();

            BackfillRuntime.RunOutcome partial = runtime.run(runInput(planId), new FakeClient(sql -> sql.contains(" chunk=2 ")));
            Assertions.assertEquals("completed_with_failures", partial.status());
            Assertions.assertEquals(1, partial.totals().failedExhausted());

            BackfillRuntime.DoctorOutcome doctor = runtime.doctor(planId);
            Assertions.assertTrue(doctor.issueCodes().contains("chunk_failed_retry_exhausted"));
            Assertions.assertEquals(List.of(2), doctor.failedChunks());
            Assertions.assertTrue(doctor.recommendations().contains("Retry failed chunks: backfill resume --plan-id " + planId));

            FakeClient healthy = new FakeClient(sql -> false);
            BackfillRuntime.RunOutcome resumed = runtime.resume(runInput(planId), healthy);
            Assertions.assertEquals("completed", resumed.status());
            Assertions.assertEquals(1, healthy.statements.size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void resumeWithoutARunIsRejected() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-resume-missing-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            String planId = runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();

            BackfillConfigException error = Assertions.assertThrows(BackfillConfigException.class,
                    () -> runtime.resume(runInput(planId), new FakeClient(sql -> false)));

            Assertions.assertEquals(ErrorKind.RUN_NOT_FOUND, error.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void changedSettingsNeedTheCompatibilityOverride() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-compat-");
        try {
            BackfillRuntime first = runtime(root, BackfillSettings.builtIn());
            String planId = first.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            first.run(runInput(planId), new FakeClient(sql -> sql.contains(" chunk=0 ")));

            BackfillSettings changed = BackfillSettings.builtIn().mergeFile(new BackfillSettings.SettingsFile(
                    new BackfillSettings.DefaultsFile(null, null, 7, null, null, null), null, null, null));
            BackfillRuntime second = runtime(root, changed);

            BackfillPolicyException error = Assertions.assertThrows(BackfillPolicyException.class,
                    () -> second.resume(runInput(planId), new FakeClient(sql -> false)));
            Assertions.assertEquals(ErrorKind.COMPATIBILITY_MISMATCH, error.kind());

            BackfillRuntime.RunOutcome forced = second.resume(
                    new BackfillRuntime.RunInput(planId, false, false, false, true, false), new FakeClient(sql -> false));
            Assertions.assertEquals("completed", forced.status());
            Assertions.assertEquals(List.of("compatibility"), forced.overriddenPolicies());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void overlappingRunOnTheSameTargetIsBlocked() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-overlap-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            String busy = runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            String next = runtime.plan(planInput("2025-01-02T00:00:00Z", "2025-01-02T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            BackfillRun active = ExecutionEngine.initialRun(runtime.store().requirePlan(busy), null, CLOCK.instant())
                    .withStatus(RunStatus.RUNNING, CLOCK.instant());
            runtime.store().saveRun(active);

            BackfillPolicyException error = Assertions.assertThrows(BackfillPolicyException.class,
                    () -> runtime.run(runInput(next), new FakeClient(sql -> false)));
            Assertions.assertEquals(ErrorKind.OVERLAPPING_RUN, error.kind());

            BackfillRuntime.RunOutcome forced = runtime.run(
                    new BackfillRuntime.RunInput(next, false, false, true, false, false), new FakeClient(sql -> false));
            Assertions.assertEquals("completed", forced.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void planBoundToAStoreRefusesAnotherOne() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-env-");
        try {
            BackfillSettings settings = BackfillSettings.builtIn()
                    .mergeOverrides(new BackfillSettings.Overrides(null, "http://prod:8123", "analytics", null, null));
            BackfillRuntime runtime = runtime(root, settings);
            String planId = runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            Assertions.assertNotNull(runtime.store().requirePlan(planId).environment());

            FakeClient staging = new FakeClient(sql -> false);
            staging.environment = new StoreEnvironment("http://staging:8123", "analytics");
            BackfillPolicyException error = Assertions.assertThrows(BackfillPolicyException.class,
                    () -> runtime.run(runInput(planId), staging));
            Assertions.assertEquals(ErrorKind.ENVIRONMENT_MISMATCH, error.kind());

            FakeClient prod = new FakeClient(sql -> false);
            prod.environment = new StoreEnvironment("http://prod:8123/", "analytics");
            Assertions.assertEquals("completed", runtime.run(runInput(planId), prod).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelledRunStaysCancelledUntilThePlanIsForced() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-cancel-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            BackfillRuntime.PlanInput input = planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false);
            String planId = runtime.plan(input, SchemaCatalog.empty()).planId();

            BackfillConfigException noRun = Assertions.assertThrows(BackfillConfigException.class,
                    () -> runtime.cancel(planId));
            Assertions.assertEquals(ErrorKind.RUN_NOT_FOUND, noRun.kind());

            runtime.run(runInput(planId), new FakeClient(sql -> sql.contains(" chunk=1 ")));
            BackfillRuntime.CancelOutcome cancelled = runtime.cancel(planId);
            Assertions.assertTrue(cancelled.cancelled());
            Assertions.assertEquals("completed_with_failures", cancelled.previousStatus());
            Assertions.assertFalse(runtime.cancel(planId).cancelled());

            BackfillPolicyException error = Assertions.assertThrows(BackfillPolicyException.class,
                    () -> runtime.resume(runInput(planId), new FakeClient(sql -> false)));
            Assertions.assertEquals(ErrorKind.RUN_CANCELLED, error.kind());
            BackfillRuntime.DoctorOutcome doctor = runtime.doctor(planId);
            Assertions.assertTrue(doctor.issueCodes().contains("run_cancelled"));

            runtime.plan(new BackfillRuntime.PlanInput("analytics.events", "2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z",
                    6d, "event_time", false, true), SchemaCatalog.empty());
            Assertions.assertTrue(runtime.store().loadRun(planId).isEmpty());
            Assertions.assertFalse(Files.exists(runtime.store().config().cancelFile(planId)));
            Assertions.assertEquals("completed", runtime.run(runInput(planId), new FakeClient(sql -> false)).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pausedRunIsResumableAndDoesNotBlockTheTarget() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-paused-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            String paused = runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            String next = runtime.plan(planInput("2025-01-02T00:00:00Z", "2025-01-02T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            runtime.store().saveRun(ExecutionEngine.initialRun(runtime.store().requirePlan(paused), null, CLOCK.instant())
                    .withStatus(RunStatus.PAUSED, CLOCK.instant()));

            Assertions.assertEquals("completed", runtime.run(runInput(next), new FakeClient(sql -> false)).status());

            BackfillRuntime.DoctorOutcome doctor = runtime.doctor(paused);
            Assertions.assertEquals(List.of("required_pending"), doctor.issueCodes());
            Assertions.assertTrue(doctor.recommendations().get(0).endsWith("backfill resume --plan-id " + paused));
            Assertions.assertEquals("completed", runtime.resume(runInput(paused), new FakeClient(sql -> false)).status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void shutdownWaitEndsWhenThePassSettles() throws Exception {
        StopSignal stop = new StopSignal();
        stop.settle();
        long started = System.nanoTime();

        BackfillRuntime.stopOnShutdown("p1", stop, Duration.ofMinutes(5));

        Assertions.assertTrue(stop.requested());
        Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - started).compareTo(Duration.ofMinutes(1)) < 0);
    }

    @Test
    void shutdownWaitGivesUpAfterTheGracePeriod() throws Exception {
        StopSignal stop = new StopSignal();

        BackfillRuntime.stopOnShutdown("p1", stop, Duration.ofMillis(20));

        Assertions.assertTrue(stop.requested());
        Assertions.assertFalse(stop.awaitSettled(Duration.ZERO));
    }

    @Test
    void completedRunCannotBeCancelled() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-cancel-done-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            String planId = runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            runtime.run(runInput(planId), new FakeClient(sql -> false));

            BackfillPolicyException error = Assertions.assertThrows(BackfillPolicyException.class,
                    () -> runtime.cancel(planId));

            Assertions.assertEquals(ErrorKind.RUN_ALREADY_COMPLETED, error.kind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void checkReportsPendingAndFailedBackfills() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-check-");
        try {
            BackfillRuntime runtime = runtime(root, BackfillSettings.builtIn());
            Assertions.assertTrue(runtime.check().ok());

            runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false), SchemaCatalog.empty());
            String failing = runtime.plan(planInput("2025-01-02T00:00:00Z", "2025-01-02T13:00:00Z", false),
                    SchemaCatalog.empty()).planId();
            runtime.run(runInput(failing), new FakeClient(sql -> sql.contains(" chunk=0 ")));

            BackfillRuntime.CheckOutcome check = runtime.check();

            Assertions.assertFalse(check.ok());
            Assertions.assertEquals(2, check.metadata().requiredCount());
            Assertions.assertEquals(1, check.metadata().failedRuns());
            List<String> codes = check.findings().stream().map(BackfillRuntime.Finding::code).toList();
            Assertions.assertEquals(List.of("required_pending", "chunk_failed_retry_exhausted"), codes);
            Assertions.assertEquals(BackfillRuntime.Severity.ERROR, check.findings().get(0).severity());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void relaxedCheckOnlyWarnsAboutPendingBackfills() throws Exception {
        Path root = Files.createTempDirectory("backfill-test-runtime-check-relaxed-");
        try {
            BackfillRuntime runtime = runtime(root, relaxedPolicy());
            runtime.plan(planInput("2025-01-01T00:00:00Z", "2025-01-01T13:00:00Z", false), SchemaCatalog.empty());

            BackfillRuntime.CheckOutcome check = runtime.check();

            Assertions.assertTrue(check.ok());
            Assertions.assertEquals(BackfillRuntime.Severity.WARN, check.findings().get(0).severity());
            Assertions.assertEquals("policy_relaxed", check.findings().get(1).code());
            Assertions.assertEquals(BackfillRuntime.Severity.INFO, check.findings().get(1).severity());
        } finally {
            deleteRecursively(root);
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class FakeClient implements StoreClient {
        private final Predicate<String> fails;
        private final List<String> statements = new ArrayList<>();
        private StoreEnvironment environment;

        private FakeClient(Predicate<String> fails) {
            this.fails = fails;
        }

        @Override
        public WriteSummary execute(String sql) throws StoreException {
            statements.add(sql);
            if (fails.test(sql)) {
                throw new StoreException("Code: 241. DB::Exception: Memory limit exceeded");
            }
            return WriteSummary.rows(ROWS_PER_CHUNK);
        }

        @Override
        public <T> List<T> query(String sql, Class<T> rowType) {
            return List.of();
        }

        @Override
        public StoreEnvironment environment() {
            return environment;
        }
    }
}
