package com.phillippitts.ttsbatch.exception;

/**
 * Thrown by cache store adapters when the cache backend cannot be reached or times out.
 *
 * <p>Internal only: the orchestrator treats it as a cache miss (reads) or ignores it (writes).
 * It is never mapped to an HTTP response.
 */
public class CacheUnavailableException extends TtsBatchException {

    private final String operation;

    public CacheUnavailableException(String operation, Throwable cause) {
        super("Cache " + operation + " failed: " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
