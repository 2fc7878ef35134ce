package com.eainde.literature.stage;

import java.util.concurrent.CancellationException;
import java.util.function.Supplier;

/**
 * Write gate for one stage run.
 *
 * <p>Stage bodies persist their payload through {@link #commit}. Once the executor
 * abandons the run (timeout or cancellation) no further commit is admitted, and
 * {@link #abandon()} returns only after a commit already in progress has finished,
 * so nothing is written after the run's status has been decided.</p>
 */
public final class StageContext {

    private boolean abandoned;

    public static StageContext open() {
        return new StageContext();
    }

    public synchronized <T> T commit(Supplier<T> write) {
        ensureActive();
        return write.get();
    }

    public synchronized void commit(Runnable write) {
        ensureActive();
        write.run();
    }

    /**
     * Throws when the run was abandoned. Bodies call this before expensive work.
     */
    public synchronized void ensureActive() {
        if (abandoned) {
            throw new CancellationException("stage run abandoned, result discarded");
        }
    }

    public synchronized boolean isAbandoned() {
        return abandoned;
    }

    synchronized void abandon() {
        abandoned = true;
    }
}
