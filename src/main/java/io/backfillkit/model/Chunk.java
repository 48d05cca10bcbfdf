package io.backfillkit.model;

import java.time.Instant;

public record Chunk(int index, Instant start, Instant end) {
}
