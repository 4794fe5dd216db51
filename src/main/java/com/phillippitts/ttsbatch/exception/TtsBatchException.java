package com.phillippitts.ttsbatch.exception;

/**
 * Base exception for all tts-batch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class TtsBatchException extends RuntimeException {

    public TtsBatchException(String message) {
        super(message);
    }

    public TtsBatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public TtsBatchException(Throwable cause) {
        super(cause);
    }
}
