package com.phillippitts.ttsbatch.config.tts;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Piper synthesis binary.
 * Binds to properties prefixed with "tts.piper".
 *
 * <p>Example application.properties:
 * <pre>
 * tts.piper.binary-path=/usr/local/bin/piper
 * tts.piper.timeout-seconds=30
 * tts.piper.max-output-bytes=52428800
 * </pre>
 *
 * @param binaryPath path to the piper executable
 * @param timeoutSeconds maximum time for one synthesis
 * @param maxOutputBytes cap on PCM read from stdout (about 27 minutes at 16 kHz)
 */
@ConfigurationProperties(prefix = "tts.piper")
@Validated
public record PiperConfig(
        @NotBlank(message = "Piper binary path must not be blank")
        String binaryPath,

        @Positive(message = "Timeout must be positive")
        Integer timeoutSeconds,

        @Positive(message = "Max output bytes must be positive")
        Integer maxOutputBytes
) {
    public PiperConfig {
        binaryPath = (binaryPath == null || binaryPath.isBlank()) ? "piper" : binaryPath;
        timeoutSeconds = timeoutSeconds == null ? 30 : timeoutSeconds;
        maxOutputBytes = maxOutputBytes == null ? 50 * 1024 * 1024 : maxOutputBytes;
    }

    public static PiperConfig defaults() {
        return new PiperConfig(null, null, null);
    }
}
