package io.backfillkit.runtime;

/**
 * Per-invocation knobs of the engine. {@code replayFailed} is what makes {@code resume} retry
 * exhausted chunks without an explicit flag.
 */
public record ExecutionOptions(
        boolean replayDone,
        boolean replayFailed,
        int maxRetriesPerChunk,
        long retryDelayMs,
        boolean attachDeduplicationToken,
        String compatibilityToken
) {
}
