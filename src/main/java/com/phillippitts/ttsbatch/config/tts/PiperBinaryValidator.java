package com.phillippitts.ttsbatch.config.tts;

import com.phillippitts.ttsbatch.exception.SynthesisException;
import jakarta.annotation.PostConstruct;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Validates at startup that the Piper binary can be executed.
 *
 * Fail-fast: aborts startup with an actionable message if the binary is missing or not
 * executable. A bare command name (the default {@code piper}) is looked up on {@code PATH}.
 */
@Component
@ConditionalOnProperty(name = "tts.validation.enabled", havingValue = "true", matchIfMissing = true)
class PiperBinaryValidator {

    private static final Logger LOG = LogManager.getLogger(PiperBinaryValidator.class);

    private final PiperConfig piper;
    private final String searchPath;

    @Autowired
    PiperBinaryValidator(PiperConfig piper) {
        this(piper, System.getenv("PATH"));
    }

    // Visible for tests
    PiperBinaryValidator(PiperConfig piper, String searchPath) {
        this.piper = piper;
        this.searchPath = searchPath == null ? "" : searchPath;
    }

    @PostConstruct
    void validateOnStartup() {
        LOG.info("Validating Piper binary... os={}, arch={}",
                System.getProperty("os.name"), System.getProperty("os.arch"));
        Path binary = resolveBinary();
        LOG.info("Piper validation OK: binary='{}'", binary);
    }

    // Visible for tests
    Path resolveBinary() {
        String configured = piper.binaryPath();
        Path candidate = Path.of(configured);
        if (candidate.getNameCount() > 1 || candidate.isAbsolute()) {
            return requireExecutable(candidate.toAbsolutePath().normalize(), configured);
        }
        return findOnPath(configured)
                .orElseThrow(() -> new SynthesisException("Piper binary '" + configured
                        + "' not found on PATH (set tts.piper.binary-path)", "piper"));
    }

    private Optional<Path> findOnPath(String name) {
        for (String dir : searchPath.split(File.pathSeparator)) {
            if (dir.isBlank()) {
                continue;
            }
            Path p = Path.of(dir, name);
            if (Files.isRegularFile(p) && Files.isExecutable(p)) {
                return Optional.of(p);
            }
        }
        return Optional.empty();
    }

    private static Path requireExecutable(Path binary, String configured) {
        if (!Files.exists(binary)) {
            throw new SynthesisException("Piper binary not found: " + binary
                    + " (configured as: " + configured + ")", "piper");
        }
        if (!Files.isRegularFile(binary)) {
            throw new SynthesisException("Piper binary is not a regular file: " + binary, "piper");
        }
        if (!Files.isExecutable(binary)) {
            throw new SynthesisException("Piper binary not executable: " + binary
                    + " (try: chmod +x '" + binary + "')", "piper");
        }
        return binary;
    }
}
