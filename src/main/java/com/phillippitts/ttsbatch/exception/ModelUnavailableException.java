package com.phillippitts.ttsbatch.exception;

/**
 * Thrown when a voice model cannot be resolved to a loaded, ready-to-use state.
 *
 * <p>The {@link Reason} distinguishes a model the caller may not use (or that does not exist)
 * from a model that exists but could not be downloaded or loaded.
 */
public class ModelUnavailableException extends TtsBatchException {

    /** Why the model could not be resolved. */
    public enum Reason {
        /** Id is not in the configured allowlist. */
        NOT_PERMITTED,
        /** Model source has no artifact for this id. */
        NOT_FOUND,
        /** Resident model bound reached. */
        CAPACITY,
        /** Download, publish or engine load failed. */
        LOAD_FAILED
    }

    private final String modelId;
    private final Reason reason;

    public ModelUnavailableException(String modelId, Reason reason, String message) {
        super("Model '" + modelId + "' unavailable: " + message);
        this.modelId = modelId;
        this.reason = reason;
    }

    public ModelUnavailableException(String modelId, Reason reason, String message, Throwable cause) {
        super("Model '" + modelId + "' unavailable: " + message, cause);
        this.modelId = modelId;
        this.reason = reason;
    }

    public String getModelId() {
        return modelId;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Returns true when the failure means the id itself is unknown to this service,
     * as opposed to a transient download or load failure.
     */
    public boolean isUnknownModel() {
        return reason == Reason.NOT_PERMITTED || reason == Reason.NOT_FOUND;
    }
}
