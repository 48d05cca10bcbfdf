package io.backfillkit.observability;

import io.backfillkit.error.CheckpointException;
import io.backfillkit.error.ErrorKind;
import io.backfillkit.model.BackfillEvent;
import io.backfillkit.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only NDJSON event log of one plan. Lines are never rewritten; a failed append is an error,
 * never a silent drop.
 */
public final class EventLogger {
    private final Path eventFile;

    public EventLogger(Path eventFile) {
        this.eventFile = eventFile;
    }

    public synchronized void append(BackfillEvent event) {
        String line = Jsons.toCompactJson(event) + "\n";
        try {
            ensureFile();
            Files.writeString(eventFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE,
                    StandardOpenOption.DSYNC);
        } catch (IOException e) {
            throw new CheckpointException(ErrorKind.CHECKPOINT_WRITE_FAILED,
                    "Failed to append event " + event.kind().wireName() + " to " + eventFile, e);
        }
    }

    public List<BackfillEvent> readAll() {
        if (!Files.exists(eventFile)) {
            return List.of();
        }
        List<BackfillEvent> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(eventFile, StandardCharsets.UTF_8)) {
                if (line == null || line.isBlank()) {
                    continue;
                }
                out.add(Jsons.compactMapper().readValue(line, BackfillEvent.class));
            }
        } catch (IOException e) {
            throw new CheckpointException(ErrorKind.CHECKPOINT_READ_FAILED,
                    "Failed to read event log " + eventFile, e);
        }
        return out;
    }

    private void ensureFile() throws IOException {
        Files.createDirectories(eventFile.getParent());
        if (!Files.exists(eventFile)) {
            try {
                Files.createFile(eventFile);
            } catch (FileAlreadyExistsException ignored) {
                // Another process created it between exists() and createFile().
            }
        }
    }
}
