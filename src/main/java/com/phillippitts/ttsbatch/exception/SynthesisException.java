package com.phillippitts.ttsbatch.exception;

/**
 * Thrown when the synthesis engine fails to turn text into audio.
 * This may occur due to engine errors, timeout, or unusable engine output.
 */
public class SynthesisException extends TtsBatchException {

    private final String engineName;

    public SynthesisException(String message) {
        super(message);
        this.engineName = "unknown";
    }

    public SynthesisException(String message, String engineName) {
        super(message + " (engine: " + engineName + ")");
        this.engineName = engineName;
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
        this.engineName = "unknown";
    }

    public SynthesisException(String message, String engineName, Throwable cause) {
        super(message + " (engine: " + engineName + ")", cause);
        this.engineName = engineName;
    }

    public String getEngineName() {
        return engineName;
    }
}
