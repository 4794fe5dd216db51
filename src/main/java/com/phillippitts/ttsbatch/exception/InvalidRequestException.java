package com.phillippitts.ttsbatch.exception;

/**
 * Thrown when a synthesis request is rejected before any model or engine work starts:
 * empty or oversized text, malformed model id, or a sample rate outside the supported range.
 */
public class InvalidRequestException extends TtsBatchException {

    private final String field;

    public InvalidRequestException(String field, String reason) {
        super("Invalid request (" + field + "): " + reason);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
