package io.backfillkit.runtime;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Asks a running pass to stop at its next chunk boundary. The pass settles the signal once its
 * last checkpoint write is on disk, which is what a shutdown hook waits for.
 */
public final class StopSignal {
    private final AtomicBoolean requested = new AtomicBoolean(false);
    private final CountDownLatch settled = new CountDownLatch(1);

    public void request() {
        requested.set(true);
    }

    public boolean requested() {
        return requested.get();
    }

    /**
     * @return false when the pass did not settle within {@code timeout}
     */
    public boolean awaitSettled(Duration timeout) throws InterruptedException {
        return settled.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    void settle() {
        settled.countDown();
    }
}
