package io.backfillkit.storage;

import io.backfillkit.config.BackfillConfig;
import io.backfillkit.error.BackfillConfigException;
import io.backfillkit.error.CheckpointException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.BackfillEvent;
import io.backfillkit.model.BackfillPlan;
import io.backfillkit.model.BackfillRun;
import io.backfillkit.model.RunStatus;
import io.backfillkit.observability.EventLogger;
import io.backfillkit.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * File-backed checkpoints under the state root:
 * <pre>
 *   plans/&lt;planId&gt;.json      written once
 *   runs/&lt;planId&gt;.json       rewritten after every chunk transition
 *   runs/&lt;planId&gt;.cancel     created once by cancel, never rewritten
 *   events/&lt;planId&gt;.ndjson   append-only
 * </pre>
 * Plan and run files are replaced through a synced temp file and an atomic rename, so a crash
 * leaves either the old or the new content on disk.
 */
public final class CheckpointStore {
    private static final Logger LOG = LoggerFactory.getLogger(CheckpointStore.class);

    private final BackfillConfig config;

    public CheckpointStore(BackfillConfig config) {
        this.config = config;
    }

    public BackfillConfig config() {
        return config;
    }

    public void init() {
        try {
            Files.createDirectories(config.plansDir());
            Files.createDirectories(config.runsDir());
            Files.createDirectories(config.eventsDir());
        } catch (IOException e) {
            throw new CheckpointException(ErrorKind.CHECKPOINT_WRITE_FAILED,
                    "Failed to initialize state root: " + config.rootDir(), e);
        }
    }

    public Optional<BackfillPlan> loadPlan(String planId) {
        return read(config.planFile(planId), BackfillPlan.class);
    }

    public BackfillPlan requirePlan(String planId) {
        return loadPlan(planId).orElseThrow(() -> new BackfillConfigException(ErrorKind.PLAN_NOT_FOUND,
                "Plan not found: " + planId + ". Run `plan` first."));
    }

    /**
     * Writes a plan once. Saving an equal plan again is a no-op; a different plan under the same id
     * needs {@code force}.
     */
    public PlanWrite savePlan(BackfillPlan plan, boolean force) {
        Path file = config.planFile(plan.planId());
        Optional<BackfillPlan> existing = read(file, BackfillPlan.class);
        if (existing.isPresent()) {
            if (existing.get().equals(plan)) {
                return PlanWrite.UNCHANGED;
            }
            if (!force) {
                throw new BackfillConfigException(ErrorKind.PLAN_ALREADY_EXISTS,
                        "Plan " + plan.planId() + " already exists with different content. Pass --force to overwrite it.");
            }
            writeAtomically(file, Jsons.toJson(plan));
            LOG.info("Overwrote plan {} for {}", plan.planId(), plan.target());
            return PlanWrite.OVERWRITTEN;
        }
        writeAtomically(file, Jsons.toJson(plan));
        return PlanWrite.CREATED;
    }

    /**
     * Reads the run checkpoint with any cancel request applied on top, so a run file rewritten
     * after {@link #requestCancel} still loads as cancelled.
     */
    public Optional<BackfillRun> loadRun(String planId) {
        Optional<BackfillRun> run = read(config.runFile(planId), BackfillRun.class);
        if (run.isEmpty() || run.get().status() == RunStatus.CANCELLED) {
            return run;
        }
        Optional<CancelRequest> cancel = read(config.cancelFile(planId), CancelRequest.class);
        return cancel.isPresent()
                ? Optional.of(run.get().cancelled(cancel.get().requestedAt(), cancel.get().reason()))
                : run;
    }

    /**
     * Last write wins. A cancel is kept apart in its own file, which this never touches.
     */
    public void saveRun(BackfillRun run) {
        writeAtomically(config.runFile(run.planId()), Jsons.toJson(run));
    }

    /**
     * @return false when the run already had a cancel request
     */
    public boolean requestCancel(String planId, CancelRequest request) {
        Path file = config.cancelFile(planId);
        try {
            Files.createDirectories(file.getParent());
            try (FileChannel channel = FileChannel.open(file, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(Jsons.toJson(request).getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            return true;
        } catch (FileAlreadyExistsException e) {
            LOG.debug("Cancel already requested for plan {}", planId);
            return false;
        } catch (IOException e) {
            throw new CheckpointException(ErrorKind.CHECKPOINT_WRITE_FAILED,
                    "Failed to write cancel request " + file, e);
        }
    }

    /**
     * Moves a run checkpoint out of the way so the plan can be executed again from scratch. The
     * archived file keeps its content for later inspection.
     */
    public Path archiveRun(String planId, long epochMillis) {
        Path runFile = config.runFile(planId);
        Path archived = runFile.resolveSibling(runFile.getFileName() + ".archived-" + epochMillis);
        try {
            Files.move(runFile, archived, StandardCopyOption.ATOMIC_MOVE);
            Files.deleteIfExists(config.cancelFile(planId));
        } catch (IOException e) {
            throw new CheckpointException(ErrorKind.CHECKPOINT_WRITE_FAILED,
                    "Failed to archive run checkpoint " + runFile, e);
        }
        return archived;
    }

    public void appendEvent(BackfillEvent event) {
        eventLogger(event.runId()).append(event);
    }

    public List<BackfillEvent> readEvents(String planId) {
        return eventLogger(planId).readAll();
    }

    public EventLogger eventLogger(String planId) {
        return new EventLogger(config.eventFile(planId));
    }

    public List<String> listPlanIds() {
        return listIds(config.plansDir(), ".json");
    }

    public List<BackfillRun> listRuns() {
        List<BackfillRun> runs = new ArrayList<>();
        for (String planId : listIds(config.runsDir(), ".json")) {
            loadRun(planId).ifPresent(runs::add);
        }
        return runs;
    }

    private List<String> listIds(Path dir, String suffix) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + suffix)) {
            for (Path p : stream) {
                String name = p.getFileName().toString();
                ids.add(name.substring(0, name.length() - suffix.length()));
            }
        } catch (IOException e) {
            throw new CheckpointException(ErrorKind.CHECKPOINT_READ_FAILED, "Failed to list " + dir, e);
        }
        ids.sort(String::compareTo);
        return ids;
    }

    private <T> Optional<T> read(Path file, Class<T> type) {
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(Jsons.mapper().readValue(file.toFile(), type));
        } catch (IOException e) {
            throw new CheckpointException(ErrorKind.CHECKPOINT_READ_FAILED,
                    "Failed to read checkpoint " + file + ": " + e.getMessage(), e);
        }
    }

    private void writeAtomically(Path target, String content) {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp-" + UUID.randomUUID());
        try {
            Files.createDirectories(target.getParent());
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content.getBytes(StandardCharsets.UTF_8));
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            CheckpointException failure = new CheckpointException(ErrorKind.CHECKPOINT_WRITE_FAILED,
                    "Failed to write checkpoint " + target, e);
            try {
                Files.deleteIfExists(tmp);
            } catch (IOException cleanup) {
                failure.addSuppressed(cleanup);
            }
            LOG.error("Checkpoint write failed for {}", target, e);
            throw failure;
        }
    }

    public record CancelRequest(Instant requestedAt, String reason) {
    }

    public enum PlanWrite {
        CREATED,
        UNCHANGED,
        OVERWRITTEN
    }
}
