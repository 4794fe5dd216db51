package com.phillippitts.ttsbatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for constructing {@link SynthesisException} with contextual information.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw SynthesisExceptionBuilder.create("Process failed")
 *         .engine("piper")
 *         .exitCode(1)
 *         .durationMs(1500)
 *         .metadata("modelId", voice.modelId())
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class SynthesisExceptionBuilder {

    private final String message;
    private String engineName;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private SynthesisExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static SynthesisExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new SynthesisExceptionBuilder(message);
    }

    public SynthesisExceptionBuilder engine(String engineName) {
        this.engineName = engineName;
        return this;
    }

    public SynthesisExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public SynthesisExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public SynthesisExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are skipped.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public SynthesisExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (engine: {engine})
     * </pre>
     *
     * @return constructed SynthesisException
     */
    public SynthesisException build() {
        String detailedMessage = buildDetailedMessage();
        String engine = engineName != null ? engineName : "unknown";

        if (cause != null) {
            return new SynthesisException(detailedMessage, engine, cause);
        }
        return new SynthesisException(detailedMessage, engine);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;

        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append("=").append(entry.getValue());
            first = false;
        }

        return sb.append(")").toString();
    }
}
