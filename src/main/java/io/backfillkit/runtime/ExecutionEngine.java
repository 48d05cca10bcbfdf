package io.backfillkit.runtime;

import io.backfillkit.client.StoreClient;
import io.backfillkit.client.WriteSummary;
import io.backfillkit.error.BackfillPolicyException;
import io.backfillkit.error.CheckpointException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.error.StoreException;
import io.backfillkit.model.BackfillEvent;
import io.backfillkit.model.BackfillPlan;
import io.backfillkit.model.BackfillRun;
import io.backfillkit.model.Chunk;
import io.backfillkit.model.ChunkState;
import io.backfillkit.model.ChunkStatus;
import io.backfillkit.model.EventKind;
import io.backfillkit.model.RunStatus;
import io.backfillkit.planner.ChunkRenderContext;
import io.backfillkit.planner.PlanBuilder;
import io.backfillkit.storage.CheckpointStore;
import io.backfillkit.util.Timestamps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Walks a plan's chunks in index order against a store client. The run checkpoint is persisted
 * after every chunk transition, before the next statement is sent, so a crash loses at most the
 * outcome of the chunk in flight.
 *
 * <p>Dispatch is sequential: chunk {@code i + 1} starts only after chunk {@code i} succeeded or
 * ran out of attempts. Cancellation is cooperative and is read from the stored checkpoint at every
 * chunk boundary and before each backoff sleep. A {@link StopSignal} is honoured at the same points
 * and leaves the run {@code paused}.
 */
public final class ExecutionEngine {
    private static final Logger LOG = LoggerFactory.getLogger(ExecutionEngine.class);
    private static final int MAX_BACKOFF_SHIFT = 30;
    private static final int MAX_ERROR_LENGTH = 2_000;

    private final CheckpointStore store;
    private final Sleeper sleeper;
    private final Clock clock;

    public ExecutionEngine(CheckpointStore store, Sleeper sleeper, Clock clock) {
        this.store = store;
        this.sleeper = sleeper;
        this.clock = clock;
    }

    public static BackfillRun initialRun(BackfillPlan plan, String compatibilityToken, Instant now) {
        List<ChunkState> states = new ArrayList<>();
        for (Chunk chunk : plan.chunks()) {
            states.add(ChunkState.pending(chunk.index(), PlanBuilder.idempotencyToken(plan.planId(), chunk)));
        }
        return new BackfillRun(plan.planId(), plan.target(), RunStatus.NOT_STARTED, states, compatibilityToken,
                now, now, null, null);
    }

    public BackfillRun run(BackfillPlan plan, BackfillRun existing, StoreClient client, ExecutionOptions options) {
        return run(plan, existing, client, options, new StopSignal());
    }

    public BackfillRun run(BackfillPlan plan, BackfillRun existing, StoreClient client, ExecutionOptions options,
                           StopSignal stop) {
        Instant now = clock.instant();
        BackfillRun start;
        if (existing == null) {
            start = initialRun(plan, options.compatibilityToken(), now);
        } else {
            if (existing.chunkStates().size() != plan.chunks().size()) {
                throw new CheckpointException(ErrorKind.CHECKPOINT_READ_FAILED,
                        "Run checkpoint for plan " + plan.planId() + " has " + existing.chunkStates().size()
                                + " chunk states but the plan has " + plan.chunks().size() + " chunks.", null);
            }
            if (existing.status() == RunStatus.CANCELLED) {
                throw new BackfillPolicyException(ErrorKind.RUN_CANCELLED,
                        "Run for plan " + plan.planId() + " is cancelled.");
            }
            start = existing.withCompatibilityToken(options.compatibilityToken());
        }
        if (plan.options() != null && plan.options().maxParallelChunks() > 1) {
            LOG.info("maxParallelChunks={} for plan {}; dispatch remains sequential",
                    plan.options().maxParallelChunks(), plan.planId());
        }
        Pass pass = new Pass(plan, client, options, start, stop);
        try {
            return pass.execute(existing != null);
        } finally {
            stop.settle();
        }
    }

    static long backoffDelay(long retryDelayMs, int attempts) {
        if (retryDelayMs <= 0) {
            return 0L;
        }
        int shift = Math.min(Math.max(0, attempts - 1), MAX_BACKOFF_SHIFT);
        if (retryDelayMs > (Long.MAX_VALUE >> shift)) {
            return Long.MAX_VALUE;
        }
        return retryDelayMs << shift;
    }

    private static String describe(StoreException e) {
        String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
        return message.length() > MAX_ERROR_LENGTH ? message.substring(0, MAX_ERROR_LENGTH) : message;
    }

    private enum ChunkOutcome {
        SUCCEEDED,
        EXHAUSTED,
        CANCELLED,
        STOPPED,
        INTERRUPTED
    }

    /**
     * One invocation over a plan; owns the in-memory copy of the run.
     */
    private final class Pass {
        private final BackfillPlan plan;
        private final StoreClient client;
        private final ExecutionOptions options;
        private final StopSignal stop;
        private BackfillRun run;

        private Pass(BackfillPlan plan, StoreClient client, ExecutionOptions options, BackfillRun run, StopSignal stop) {
            this.plan = plan;
            this.client = client;
            this.options = options;
            this.run = run;
            this.stop = stop;
        }

        BackfillRun execute(boolean resumed) {
            run = persist(run.withStatus(RunStatus.RUNNING, clock.instant()).withLastError(null));
            event(EventKind.RUN_STARTED, null, detail(
                    "chunks", plan.chunks().size(),
                    "resumed", resumed,
                    "replayDone", options.replayDone(),
                    "replayFailed", options.replayFailed()
            ));
            LOG.info("Run started for plan {} on {} ({} chunks, strategy {})",
                    plan.planId(), plan.target(), plan.chunks().size(), plan.strategy().wireName());

            for (Chunk chunk : plan.chunks()) {
                if (cancelRequested()) {
                    return finishCancelled();
                }
                if (stop.requested()) {
                    return finishPaused();
                }
                ChunkState state = run.chunkState(chunk.index());
                Optional<ChunkState> next = prepare(state);
                if (next.isEmpty()) {
                    continue;
                }
                ChunkOutcome outcome = executeChunk(chunk, next.get());
                if (outcome == ChunkOutcome.CANCELLED) {
                    return finishCancelled();
                }
                if (outcome == ChunkOutcome.STOPPED) {
                    return finishPaused();
                }
                if (outcome == ChunkOutcome.INTERRUPTED) {
                    LOG.warn("Run for plan {} interrupted at chunk {}; checkpoint left resumable",
                            plan.planId(), chunk.index());
                    return run;
                }
            }
            return finish();
        }

        private Optional<ChunkState> prepare(ChunkState state) {
            switch (state.status()) {
                case SUCCEEDED:
                    return options.replayDone() ? Optional.of(state.resetForReplay()) : Optional.empty();
                case FAILED_EXHAUSTED:
                    return options.replayFailed() ? Optional.of(state.resetForReplay()) : Optional.empty();
                case RUNNING:
                case FAILED_RETRYING:
                    LOG.info("Chunk {} of plan {} was left {} by an earlier invocation; executing it again",
                            state.index(), plan.planId(), state.status().wireName());
                    return Optional.of(state.resetForReplay());
                default:
                    return Optional.of(state);
            }
        }

        private ChunkOutcome executeChunk(Chunk chunk, ChunkState initial) {
            ChunkState state = initial;
            String sql = plan.template().render(new ChunkRenderContext(
                    plan.planId(),
                    chunk,
                    state.idempotencyToken(),
                    options.attachDeduplicationToken()
            ));
            while (true) {
                state = state.startAttempt(clock.instant());
                update(state);
                event(EventKind.CHUNK_STARTED, chunk.index(), detail(
                        "attempt", state.attempts(),
                        "start", Timestamps.format(chunk.start()),
                        "end", Timestamps.format(chunk.end()),
                        "idempotencyToken", state.idempotencyToken()
                ));
                LOG.debug("Chunk {} of plan {} attempt {} started", chunk.index(), plan.planId(), state.attempts());
                try {
                    WriteSummary summary = client.execute(sql);
                    state = state.succeeded(clock.instant(), summary == null ? null : summary.rowsWritten());
                    update(state);
                    Map<String, Object> succeeded = detail("attempts", state.attempts());
                    if (state.rowsWritten() != null) {
                        succeeded.put("rowsWritten", state.rowsWritten());
                    }
                    event(EventKind.CHUNK_SUCCEEDED, chunk.index(), succeeded);
                    LOG.debug("Chunk {} of plan {} succeeded", chunk.index(), plan.planId());
                    return ChunkOutcome.SUCCEEDED;
                } catch (StoreException e) {
                    // Checkpoint writes would fail on the interrupted thread and hide why the send stopped.
                    if (Thread.currentThread().isInterrupted()) {
                        return ChunkOutcome.INTERRUPTED;
                    }
                    String error = describe(e);
                    if (state.attempts() < options.maxRetriesPerChunk()) {
                        long delay = backoffDelay(options.retryDelayMs(), state.attempts());
                        state = state.failed(ChunkStatus.FAILED_RETRYING, error, clock.instant());
                        update(state);
                        event(EventKind.CHUNK_RETRY_SCHEDULED, chunk.index(), detail(
                                "attempt", state.attempts(),
                                "delayMs", delay,
                                "error", error
                        ));
                        LOG.warn("Chunk {} of plan {} failed on attempt {}/{}; retrying in {} ms: {}",
                                chunk.index(), plan.planId(), state.attempts(), options.maxRetriesPerChunk(), delay, error);
                        if (cancelRequested()) {
                            return ChunkOutcome.CANCELLED;
                        }
                        if (stop.requested()) {
                            return ChunkOutcome.STOPPED;
                        }
                        try {
                            sleeper.sleep(delay);
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            return ChunkOutcome.INTERRUPTED;
                        }
                        continue;
                    }
                    state = state.failed(ChunkStatus.FAILED_EXHAUSTED, error, clock.instant());
                    update(state);
                    event(EventKind.CHUNK_FAILED, chunk.index(), detail(
                            "attempts", state.attempts(),
                            "error", error
                    ));
                    LOG.warn("Chunk {} of plan {} exhausted {} attempts; continuing with the next chunk: {}",
                            chunk.index(), plan.planId(), state.attempts(), error);
                    return ChunkOutcome.EXHAUSTED;
                }
            }
        }

        private BackfillRun finish() {
            long exhausted = run.count(ChunkStatus.FAILED_EXHAUSTED);
            long succeeded = run.count(ChunkStatus.SUCCEEDED);
            Instant now = clock.instant();
            if (exhausted > 0) {
                run = persist(run.withStatus(RunStatus.COMPLETED_WITH_FAILURES, now)
                        .withLastError(exhausted + " chunk(s) exhausted their retry budget"));
                event(EventKind.RUN_COMPLETED_WITH_FAILURES, null, detail(
                        "succeeded", succeeded,
                        "failed", exhausted
                ));
            } else if (succeeded == plan.chunks().size()) {
                run = persist(run.withStatus(RunStatus.COMPLETED, now));
                event(EventKind.RUN_COMPLETED, null, detail("succeeded", succeeded));
            }
            LOG.info("Run for plan {} finished with status {} ({} succeeded, {} failed)",
                    plan.planId(), run.status().wireName(), succeeded, exhausted);
            return run;
        }

        private BackfillRun finishCancelled() {
            if (run.status() != RunStatus.CANCELLED) {
                run = persist(run.withStatus(RunStatus.CANCELLED, clock.instant()));
            }
            long pending = run.count(ChunkStatus.PENDING);
            event(EventKind.RUN_CANCELLED, null, detail("pendingChunks", pending, "source", "engine"));
            LOG.info("Run for plan {} stopped by cancellation; {} chunk(s) left pending", plan.planId(), pending);
            return run;
        }

        private BackfillRun finishPaused() {
            for (ChunkState state : run.chunkStates()) {
                if (state.status() == ChunkStatus.RUNNING) {
                    run = run.withChunkState(state.resetForReplay(), clock.instant());
                }
            }
            run = persist(run.withStatus(RunStatus.PAUSED, clock.instant()));
            if (run.status() == RunStatus.CANCELLED) {
                return finishCancelled();
            }
            long pending = run.chunkStates().size() - run.count(ChunkStatus.SUCCEEDED) - run.count(ChunkStatus.FAILED_EXHAUSTED);
            event(EventKind.RUN_PAUSED, null, detail("reason", "shutdown_signal", "pendingChunks", pending));
            LOG.info("Run for plan {} paused on a stop request; {} chunk(s) left for resume", plan.planId(), pending);
            return run;
        }

        private void update(ChunkState state) {
            run = persist(run.withChunkState(state, clock.instant()));
        }

        private boolean cancelRequested() {
            if (run.status() == RunStatus.CANCELLED) {
                return true;
            }
            return store.loadRun(plan.planId())
                    .map(stored -> stored.status() == RunStatus.CANCELLED)
                    .orElse(false);
        }

        // loadRun applies the cancel request file, so a cancel issued since the last write is kept.
        private BackfillRun persist(BackfillRun next) {
            BackfillRun toWrite = next;
            if (next.status() != RunStatus.CANCELLED) {
                Optional<BackfillRun> stored = store.loadRun(next.planId());
                if (stored.isPresent() && stored.get().status() == RunStatus.CANCELLED) {
                    toWrite = new BackfillRun(next.planId(), next.target(), RunStatus.CANCELLED, next.chunkStates(),
                            next.compatibilityToken(), next.startedAt(), next.updatedAt(),
                            stored.get().completedAt(), stored.get().lastError());
                }
            }
            store.saveRun(toWrite);
            return toWrite;
        }

        private void event(EventKind kind, Integer chunkIndex, Map<String, Object> detail) {
            Instant now = clock.instant();
            BackfillEvent event = chunkIndex == null
                    ? BackfillEvent.of(now, plan.planId(), kind, detail)
                    : BackfillEvent.ofChunk(now, plan.planId(), kind, chunkIndex, detail);
            store.appendEvent(event);
        }
    }

    private static Map<String, Object> detail(Object... pairs) {
        Map<String, Object> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < pairs.length; i += 2) {
            out.put(String.valueOf(pairs[i]), pairs[i + 1]);
        }
        return out;
    }
}
