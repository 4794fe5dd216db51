package com.phillippitts.ttsbatch.util;

import java.time.Duration;

/**
 * Standard timeout values for subprocess and reader-thread management.
 *
 * @see com.phillippitts.ttsbatch.service.synthesis.PiperProcessManager
 * @since 1.0
 */
public final class ProcessTimeouts {

    /**
     * Time for stream reader threads to flush buffered output after process completion.
     * Stdout carries the whole PCM payload, so this is longer than a text-only reader needs.
     */
    public static final Duration READER_FLUSH_TIMEOUT = Duration.ofSeconds(2);

    /**
     * Time for stream reader threads to stop during cleanup (best-effort; they are daemons).
     */
    public static final Duration READER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /**
     * Timeout for graceful process shutdown via {@link Process#destroy()}.
     */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /**
     * Timeout for forceful process termination via {@link Process#destroyForcibly()}.
     */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
