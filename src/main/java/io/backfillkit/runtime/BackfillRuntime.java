package io.backfillkit.runtime;

import com.fasterxml.jackson.annotation.JsonValue;
import io.backfillkit.client.StoreClient;
import io.backfillkit.config.BackfillConfig;
import io.backfillkit.config.BackfillSettings;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.BackfillEvent;
import io.backfillkit.model.BackfillPlan;
import io.backfillkit.model.BackfillRun;
import io.backfillkit.model.Chunk;
import io.backfillkit.model.ChunkState;
import io.backfillkit.model.ChunkStatus;
import io.backfillkit.model.EventKind;
import io.backfillkit.model.RunStatus;
import io.backfillkit.model.StoreEnvironment;
import io.backfillkit.model.TargetDescriptor;
import io.backfillkit.model.TimeWindow;
import io.backfillkit.planner.ChunkRenderContext;
import io.backfillkit.planner.PlanBuilder;
import io.backfillkit.policy.PolicyGuard;
import io.backfillkit.schema.SchemaCatalog;
import io.backfillkit.storage.CheckpointStore;
import io.backfillkit.util.Hashing;
import io.backfillkit.util.Jsons;
import io.backfillkit.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class BackfillRuntime {
    private static final Logger LOG = LoggerFactory.getLogger(BackfillRuntime.class);
    private static final Duration IMPLICIT_WINDOW = Duration.ofHours(24);
    private static final String CANCELLED_BY_OPERATOR = "Cancelled by operator";
    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final BackfillConfig config;
    private final BackfillSettings settings;
    private final CheckpointStore store;
    private final PolicyGuard guard;
    private final ExecutionEngine engine;
    private final Clock clock;

    public BackfillRuntime(BackfillConfig config, BackfillSettings settings) {
        this(config, settings, Sleeper.system(), Clock.systemUTC());
    }

    public BackfillRuntime(BackfillConfig config, BackfillSettings settings, Sleeper sleeper, Clock clock) {
        this.config = config;
        this.settings = settings;
        this.store = new CheckpointStore(config);
        this.guard = new PolicyGuard(settings.policy());
        this.engine = new ExecutionEngine(store, sleeper, clock);
        this.clock = clock;
    }

    public void init() {
        store.init();
    }

    public CheckpointStore store() {
        return store;
    }

    public PlanOutcome plan(PlanInput input, SchemaCatalog catalog) {
        BackfillPlan plan = buildPlan(input, catalog);
        BackfillRun cancelledRun = store.loadRun(plan.planId())
                .filter(r -> r.status() == RunStatus.CANCELLED)
                .orElse(null);
        CheckpointStore.PlanWrite write = store.savePlan(plan, input.force());
        Instant now = clock.instant();
        if (write == CheckpointStore.PlanWrite.CREATED) {
            store.appendEvent(BackfillEvent.of(now, plan.planId(), EventKind.PLAN_CREATED, planDetail(plan)));
            LOG.info("Created plan {} for {} ({} chunks, strategy {})",
                    plan.planId(), plan.target(), plan.chunks().size(), plan.strategy().wireName());
        } else if (write == CheckpointStore.PlanWrite.OVERWRITTEN) {
            store.appendEvent(BackfillEvent.of(now, plan.planId(), EventKind.PLAN_OVERWRITTEN, planDetail(plan)));
        } else {
            LOG.info("Plan {} already exists with identical content", plan.planId());
        }
        if (input.force() && cancelledRun != null) {
            String archived = store.archiveRun(plan.planId(), now.toEpochMilli()).toString();
            store.appendEvent(BackfillEvent.of(now, plan.planId(), EventKind.RUN_ARCHIVED, detail(
                    "previousStatus", cancelledRun.status().wireName(),
                    "archivedTo", archived
            )));
            LOG.info("Archived cancelled run of plan {} to {}", plan.planId(), archived);
        }
        if (plan.window().hours() > settings.limits().maxWindowHours()) {
            policyOverridden(plan.planId(), "limits.maxWindowHours", "plan");
        }

        List<ChunkPreview> chunks = new ArrayList<>();
        for (Chunk chunk : plan.chunks()) {
            chunks.add(new ChunkPreview(
                    chunk.index(),
                    Timestamps.format(chunk.start()),
                    Timestamps.format(chunk.end()),
                    PlanBuilder.idempotencyToken(plan.planId(), chunk)
            ));
        }
        String firstChunkSql = plan.chunks().isEmpty() ? null : plan.template().render(new ChunkRenderContext(
                plan.planId(),
                plan.chunk(0),
                PlanBuilder.idempotencyToken(plan.planId(), plan.chunk(0)),
                plan.options().requireIdempotencyToken()
        ));
        return new PlanOutcome(
                plan.planId(),
                plan.target().qualifiedName(),
                plan.strategy().wireName(),
                plan.timeColumn(),
                plan.chunkHours(),
                Timestamps.format(plan.window().from()),
                Timestamps.format(plan.window().to()),
                plan.chunks().size(),
                write.name().toLowerCase(),
                config.planFile(plan.planId()).toString(),
                chunks,
                firstChunkSql
        );
    }

    public RunOutcome run(RunInput input, StoreClient client) {
        BackfillPlan plan = store.requirePlan(input.planId());
        return execute("run", plan, input, input.replayFailed(), client);
    }

    /**
     * {@code run --target --from --to}: builds the plan in place. With
     * {@code requireDryRunBeforeRun} the identical plan must already be on disk.
     */
    public RunOutcome runInline(PlanInput planInput, RunInput flags, SchemaCatalog catalog, StoreClient client) {
        BackfillPlan candidate = buildPlan(planInput, catalog);
        BackfillPlan stored = store.loadPlan(candidate.planId()).orElse(null);
        guard.checkDryRun(candidate, stored);
        if (stored == null) {
            store.savePlan(candidate, false);
            store.appendEvent(BackfillEvent.of(clock.instant(), candidate.planId(), EventKind.PLAN_CREATED, planDetail(candidate)));
            policyOverridden(candidate.planId(), "policy.requireDryRunBeforeRun", "run");
        }
        BackfillPlan plan = stored == null ? candidate : stored;
        RunInput input = new RunInput(plan.planId(), flags.replayDone(), flags.replayFailed(),
                flags.forceOverlap(), flags.forceCompatibility(), flags.forceEnvironment());
        return execute("run", plan, input, input.replayFailed(), client);
    }

    public RunOutcome resume(RunInput input, StoreClient client) {
        BackfillPlan plan = store.requirePlan(input.planId());
        if (store.loadRun(plan.planId()).isEmpty()) {
            throw new BackfillConfigException(ErrorKind.RUN_NOT_FOUND,
                    "No run checkpoint for plan " + plan.planId() + ". Start it with `run` first.");
        }
        RunInput resumeInput = new RunInput(plan.planId(), false, true,
                input.forceOverlap(), input.forceCompatibility(), input.forceEnvironment());
        return execute("resume", plan, resumeInput, true, client);
    }

    public StatusOutcome status(String planId) {
        BackfillPlan plan = store.requirePlan(planId);
        BackfillRun run = store.loadRun(plan.planId())
                .orElseGet(() -> ExecutionEngine.initialRun(plan, null, null));
        List<ChunkView> chunks = new ArrayList<>();
        int attempts = 0;
        for (Chunk chunk : plan.chunks()) {
            ChunkState state = run.chunkState(chunk.index());
            attempts += state.attempts();
            chunks.add(new ChunkView(
                    chunk.index(),
                    Timestamps.format(chunk.start()),
                    Timestamps.format(chunk.end()),
                    state.status().wireName(),
                    state.attempts(),
                    state.lastError(),
                    state.idempotencyToken(),
                    state.rowsWritten()
            ));
        }
        return new StatusOutcome(
                plan.planId(),
                plan.target().qualifiedName(),
                plan.strategy().wireName(),
                run.status().wireName(),
                Totals.of(run),
                attempts,
                run.lastError(),
                run.startedAt(),
                run.updatedAt(),
                run.completedAt(),
                config.runFile(plan.planId()).toString(),
                config.eventFile(plan.planId()).toString(),
                chunks
        );
    }

    /**
     * Marks the run cancelled. Chunk states are left as they are; the engine stops at its next
     * chunk boundary. The cancel request file is written before the run checkpoint, so an engine
     * that rewrites the checkpoint concurrently cannot drop it.
     */
    public CancelOutcome cancel(String planId) {
        BackfillPlan plan = store.requirePlan(planId);
        BackfillRun run = store.loadRun(plan.planId()).orElseThrow(() -> new BackfillConfigException(
                ErrorKind.RUN_NOT_FOUND,
                "No run checkpoint for plan " + plan.planId() + ". Start it with `run` before cancelling."));
        guard.checkCancellable(run);
        if (run.status() == RunStatus.CANCELLED) {
            return new CancelOutcome(plan.planId(), run.status().wireName(), run.status().wireName(), false,
                    config.runFile(plan.planId()).toString());
        }
        Instant now = clock.instant();
        BackfillRun cancelled = run.withStatus(RunStatus.CANCELLED, now).withLastError(CANCELLED_BY_OPERATOR);
        store.requestCancel(plan.planId(), new CheckpointStore.CancelRequest(now, CANCELLED_BY_OPERATOR));
        store.saveRun(cancelled);
        store.appendEvent(BackfillEvent.of(now, plan.planId(), EventKind.RUN_CANCELLED, detail(
                "source", "operator",
                "previousStatus", run.status().wireName()
        )));
        LOG.info("Cancelled run of plan {} (was {})", plan.planId(), run.status().wireName());
        return new CancelOutcome(plan.planId(), run.status().wireName(), cancelled.status().wireName(), true,
                config.runFile(plan.planId()).toString());
    }

    public DoctorOutcome doctor(String planId) {
        BackfillPlan plan = store.requirePlan(planId);
        BackfillRun run = store.loadRun(plan.planId()).orElse(null);
        List<String> issueCodes = new ArrayList<>();
        List<String> recommendations = new ArrayList<>();
        List<Integer> failedChunks = new ArrayList<>();
        String id = plan.planId();

        if (run == null) {
            issueCodes.add("plan_not_run");
            recommendations.add("Run: backfill run --plan-id " + id);
            return new DoctorOutcome(id, RunStatus.NOT_STARTED.wireName(), false, issueCodes, recommendations, failedChunks);
        }
        for (ChunkState state : run.chunkStates()) {
            if (state.status() == ChunkStatus.FAILED_EXHAUSTED) {
                failedChunks.add(state.index());
            }
        }
        if (!failedChunks.isEmpty()) {
            issueCodes.add("chunk_failed_retry_exhausted");
            recommendations.add("Inspect status: backfill status --plan-id " + id);
            if (run.status() != RunStatus.CANCELLED) {
                recommendations.add("Retry failed chunks: backfill resume --plan-id " + id);
            }
        }
        switch (run.status()) {
            case CANCELLED:
                issueCodes.add("run_cancelled");
                issueCodes.add("required_pending");
                recommendations.add("Cancelled runs are not resumed. Archive it and start over: " + replanCommand(plan));
                break;
            case RUNNING:
            case NOT_STARTED:
                issueCodes.add("required_pending");
                recommendations.add("Monitor progress: backfill status --plan-id " + id);
                recommendations.add("If no process is executing it, continue with: backfill resume --plan-id " + id);
                break;
            case PAUSED:
                issueCodes.add("required_pending");
                recommendations.add("The last process stopped on a shutdown signal. Continue with: backfill resume --plan-id " + id);
                break;
            case COMPLETED_WITH_FAILURES:
                issueCodes.add("required_pending");
                break;
            default:
                break;
        }
        if (issueCodes.isEmpty()) {
            recommendations.add("No remediation required.");
        }
        return new DoctorOutcome(id, run.status().wireName(), issueCodes.isEmpty(), issueCodes, recommendations, failedChunks);
    }

    /**
     * CI hook over every known plan.
     */
    public CheckOutcome check() {
        int requiredCount = 0;
        int activeRuns = 0;
        int failedRuns = 0;
        List<String> pendingPlans = new ArrayList<>();
        for (String planId : store.listPlanIds()) {
            BackfillRun run = store.loadRun(planId).orElse(null);
            if (run == null) {
                requiredCount++;
                pendingPlans.add(planId);
                continue;
            }
            if (run.status() == RunStatus.RUNNING) {
                activeRuns++;
            }
            if (run.count(ChunkStatus.FAILED_EXHAUSTED) > 0) {
                failedRuns++;
            }
            if (run.status() != RunStatus.COMPLETED) {
                requiredCount++;
                pendingPlans.add(planId);
            }
        }

        boolean strict = settings.policy().failCheckOnRequiredPendingBackfill();
        List<Finding> findings = new ArrayList<>();
        if (requiredCount > 0) {
            findings.add(new Finding(
                    "required_pending",
                    strict ? Severity.ERROR : Severity.WARN,
                    "Required backfills pending completion: " + requiredCount,
                    detail("requiredCount", requiredCount, "planIds", pendingPlans)
            ));
        }
        if (failedRuns > 0) {
            findings.add(new Finding(
                    "chunk_failed_retry_exhausted",
                    Severity.ERROR,
                    "Backfill runs with chunks that exhausted their retry budget: " + failedRuns,
                    detail("failedRuns", failedRuns)
            ));
        }
        if (!strict) {
            findings.add(new Finding(
                    "policy_relaxed",
                    Severity.INFO,
                    "Backfill check policy is relaxed: failCheckOnRequiredPendingBackfill=false.",
                    Map.of()
            ));
        }
        boolean ok = findings.stream().noneMatch(f -> f.severity() == Severity.ERROR);
        return new CheckOutcome(ok, findings, new CheckMetadata(requiredCount, activeRuns, failedRuns));
    }

    String compatibilityToken(BackfillPlan plan) {
        Map<String, Object> identity = new LinkedHashMap<>();
        identity.put("planId", plan.planId());
        identity.put("planOptions", plan.options());
        identity.put("maxRetriesPerChunk", settings.defaults().maxRetriesPerChunk());
        identity.put("maxParallelChunks", settings.defaults().maxParallelChunks());
        identity.put("retryDelayMs", settings.defaults().retryDelayMs());
        identity.put("requireIdempotencyToken", settings.defaults().requireIdempotencyToken());
        identity.put("policy", settings.policy());
        identity.put("limits", settings.limits());
        return Hashing.sha256Hex(Jsons.toCompactJson(identity));
    }

    private RunOutcome execute(String command, BackfillPlan plan, RunInput input, boolean replayFailed, StoreClient client) {
        BackfillRun existing = store.loadRun(plan.planId()).orElse(null);
        guard.checkNotCancelled(existing);
        if (existing != null && existing.status() == RunStatus.COMPLETED && !input.replayDone()) {
            LOG.info("Run for plan {} already completed; nothing to do", plan.planId());
            return RunOutcome.of(command, plan, existing, true, List.of(), config);
        }

        List<String> overridden = new ArrayList<>();
        StoreEnvironment active = client.environment() != null ? client.environment() : settings.storeEnvironment();
        if (guard.checkEnvironment(plan, active, input.forceEnvironment())) {
            overridden.add("environment");
        }
        String token = compatibilityToken(plan);
        if (guard.checkCompatibility(existing, token, input.forceCompatibility())) {
            overridden.add("compatibility");
        }
        if (guard.checkNoOverlap(plan, store.listRuns(), input.forceOverlap())) {
            overridden.add("policy.blockOverlappingRuns");
        }
        for (String policy : overridden) {
            policyOverridden(plan.planId(), policy, command);
        }

        ExecutionOptions options = new ExecutionOptions(
                input.replayDone(),
                replayFailed,
                plan.options().maxRetriesPerChunk(),
                plan.options().retryDelayMs(),
                plan.options().requireIdempotencyToken(),
                token
        );
        StopSignal stop = new StopSignal();
        Thread hook = new Thread(() -> stopOnShutdown(plan.planId(), stop, SHUTDOWN_GRACE),
                "backfill-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(hook);
        BackfillRun result;
        try {
            result = engine.run(plan, existing, client, options, stop);
        } finally {
            removeShutdownHook(hook);
        }
        return RunOutcome.of(command, plan, result, false, overridden, config);
    }

    /**
     * SIGINT/SIGTERM: asks the engine to stop at its next chunk boundary and holds the JVM until
     * the paused checkpoint is written or {@code grace} runs out.
     */
    static void stopOnShutdown(String planId, StopSignal stop, Duration grace) {
        stop.request();
        LOG.info("Shutdown requested; waiting up to {} ms for plan {} to checkpoint", grace.toMillis(), planId);
        try {
            if (!stop.awaitSettled(grace)) {
                LOG.warn("Plan {} did not checkpoint within {} ms; resume will re-run the chunk in flight",
                        planId, grace.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException e) {
            LOG.debug("JVM is shutting down; shutdown hook stays registered", e);
        }
    }

    private BackfillPlan buildPlan(PlanInput input, SchemaCatalog catalog) {
        guard.checkExplicitWindow(!isBlank(input.from()), !isBlank(input.to()));
        TargetDescriptor target = TargetDescriptor.parse(input.target());
        TimeWindow window = resolveWindow(input.from(), input.to());
        PlanBuilder builder = new PlanBuilder(settings);
        return builder.build(new PlanBuilder.PlanRequest(
                target,
                window,
                input.chunkHours(),
                input.timeColumn(),
                input.forceLargeWindow(),
                settings.storeEnvironment()
        ), catalog);
    }

    // Only reachable with requireExplicitWindow=false: the last full 24 hours.
    private TimeWindow resolveWindow(String from, String to) {
        Instant end = isBlank(to)
                ? clock.instant().truncatedTo(ChronoUnit.HOURS)
                : parseTimestamp(to, "--to");
        Instant begin = isBlank(from) ? end.minus(IMPLICIT_WINDOW) : parseTimestamp(from, "--from");
        return new TimeWindow(begin, end);
    }

    private static Instant parseTimestamp(String raw, String flag) {
        try {
            return Timestamps.parse(raw);
        } catch (IllegalArgumentException e) {
            throw new BackfillConfigException(ErrorKind.INVALID_WINDOW,
                    "Invalid " + flag + " value '" + raw + "'. Expected an ISO-8601 timestamp such as 2025-01-01T00:00:00Z.", e);
        }
    }

    private void policyOverridden(String planId, String policy, String command) {
        store.appendEvent(BackfillEvent.of(clock.instant(), planId, EventKind.POLICY_OVERRIDDEN, detail(
                "policy", policy,
                "command", command
        )));
    }

    private static String replanCommand(BackfillPlan plan) {
        return "backfill plan --target " + plan.target().qualifiedName()
                + " --from " + Timestamps.format(plan.window().from())
                + " --to " + Timestamps.format(plan.window().to())
                + " --chunk-hours " + Timestamps.formatHours(plan.chunkHours())
                + " --time-column " + plan.timeColumn()
                + " --force";
    }

    private static Map<String, Object> planDetail(BackfillPlan plan) {
        return detail(
                "target", plan.target().qualifiedName(),
                "strategy", plan.strategy().wireName(),
                "chunks", plan.chunks().size(),
                "timeColumn", plan.timeColumn()
        );
    }

    private static Map<String, Object> detail(Object... pairs) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            out.put(String.valueOf(pairs[i]), pairs[i + 1]);
        }
        return out;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    public record PlanInput(
            String target,
            String from,
            String to,
            Double chunkHours,
            String timeColumn,
            boolean forceLargeWindow,
            boolean force
    ) {
    }

    public record RunInput(
            String planId,
            boolean replayDone,
            boolean replayFailed,
            boolean forceOverlap,
            boolean forceCompatibility,
            boolean forceEnvironment
    ) {
    }

    public record ChunkPreview(int index, String start, String end, String idempotencyToken) {
    }

    public record PlanOutcome(
            String planId,
            String target,
            String strategy,
            String timeColumn,
            double chunkHours,
            String from,
            String to,
            int chunkCount,
            String write,
            String planFile,
            List<ChunkPreview> chunks,
            String firstChunkSql
    ) {
    }

    public record RunOutcome(
            String command,
            String planId,
            String target,
            String status,
            boolean noop,
            Totals totals,
            String lastError,
            List<String> overriddenPolicies,
            String runFile,
            String eventFile
    ) {
        static RunOutcome of(String command, BackfillPlan plan, BackfillRun run, boolean noop,
                             List<String> overridden, BackfillConfig config) {
            return new RunOutcome(
                    command,
                    plan.planId(),
                    plan.target().qualifiedName(),
                    run.status().wireName(),
                    noop,
                    Totals.of(run),
                    run.lastError(),
                    List.copyOf(overridden),
                    config.runFile(plan.planId()).toString(),
                    config.eventFile(plan.planId()).toString()
            );
        }
    }

    public record Totals(
            int total,
            long pending,
            long running,
            long succeeded,
            long failedRetrying,
            long failedExhausted,
            long rowsWritten
    ) {
        static Totals of(BackfillRun run) {
            long rows = 0L;
            for (ChunkState state : run.chunkStates()) {
                if (state.rowsWritten() != null) {
                    rows += state.rowsWritten();
                }
            }
            return new Totals(
                    run.chunkStates().size(),
                    run.count(ChunkStatus.PENDING),
                    run.count(ChunkStatus.RUNNING),
                    run.count(ChunkStatus.SUCCEEDED),
                    run.count(ChunkStatus.FAILED_RETRYING),
                    run.count(ChunkStatus.FAILED_EXHAUSTED),
                    rows
            );
        }
    }

    public record ChunkView(
            int index,
            String start,
            String end,
            String status,
            int attempts,
            String lastError,
            String idempotencyToken,
            Long rowsWritten
    ) {
    }

    public record StatusOutcome(
            String planId,
            String target,
            String strategy,
            String status,
            Totals totals,
            int attempts,
            String lastError,
            Instant startedAt,
            Instant updatedAt,
            Instant completedAt,
            String runFile,
            String eventFile,
            List<ChunkView> chunks
    ) {
    }

    public record CancelOutcome(
            String planId,
            String previousStatus,
            String status,
            boolean cancelled,
            String runFile
    ) {
    }

    public record DoctorOutcome(
            String planId,
            String status,
            boolean ok,
            List<String> issueCodes,
            List<String> recommendations,
            List<Integer> failedChunks
    ) {
    }

    public enum Severity {
        ERROR,
        WARN,
        INFO;

        @JsonValue
        public String wireName() {
            return name().toLowerCase();
        }
    }

    public record Finding(String code, Severity severity, String message, Map<String, Object> metadata) {
    }

    public record CheckMetadata(int requiredCount, int activeRuns, int failedRuns) {
    }

    public record CheckOutcome(boolean ok, List<Finding> findings, CheckMetadata metadata) {
    }
}
