package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.exception.SynthesisException;

import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Bounds concurrent engine invocations with a semaphore and a bounded wait.
 *
 * <p><b>Usage Pattern:</b>
 * <pre>{@code
 * guard.acquire(); // Blocks until permit available or timeout
 * try {
 *     // ... run synthesis ...
 * } finally {
 *     guard.release();
 * }
 * }</pre>
 */
final class ConcurrencyGuard {

    private final Semaphore semaphore;
    private final long timeoutMs;
    private final String engineName;

    ConcurrencyGuard(int permits, long timeoutMs, String engineName) {
        this.semaphore = new Semaphore(Math.max(1, permits), true);
        this.timeoutMs = Math.max(0, timeoutMs);
        this.engineName = engineName;
    }

    /**
     * Acquires a permit, blocking up to the configured timeout.
     *
     * @throws SynthesisException if no permit became available in time or the thread was interrupted
     */
    void acquire() {
        try {
            if (!semaphore.tryAcquire(timeoutMs, TimeUnit.MILLISECONDS)) {
                throw new SynthesisException(
                        engineName + " concurrency limit reached after " + timeoutMs + "ms wait", engineName);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SynthesisException(
                    engineName + " synthesis interrupted while waiting for a permit", engineName, e);
        }
    }

    void release() {
        semaphore.release();
    }

    int availablePermits() {
        return semaphore.availablePermits();
    }
}
