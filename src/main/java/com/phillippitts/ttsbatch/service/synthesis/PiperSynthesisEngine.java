package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.config.properties.SynthesisProperties;
import com.phillippitts.ttsbatch.config.tts.PiperConfig;
import com.phillippitts.ttsbatch.domain.VoiceHandle;
import com.phillippitts.ttsbatch.exception.SynthesisException;
import com.phillippitts.ttsbatch.service.audio.AudioFormat;
import com.phillippitts.ttsbatch.service.model.ModelArtifact;
import com.phillippitts.ttsbatch.util.TimeUtils;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.util.Objects;

/**
 * Piper-based implementation of {@link SynthesisEngine} using the external {@code piper} binary.
 *
 * <p><b>Architecture:</b>
 * <ul>
 *   <li>{@link #load} validates the model files and reads the native rate from the model config</li>
 *   <li>{@link #synthesize} runs one Piper process per call via {@link PiperProcessManager}</li>
 *   <li>A semaphore bounds concurrent processes to avoid CPU saturation</li>
 * </ul>
 *
 * <p><b>Privacy:</b> never logs request text above DEBUG, and then only as a short preview.
 *
 * @see PiperProcessManager
 * @see PiperConfig
 */
@Component
public class PiperSynthesisEngine implements SynthesisEngine {

    private static final Logger LOG = LogManager.getLogger(PiperSynthesisEngine.class);

    static final String ENGINE = "piper";

    private final PiperConfig cfg;
    private final PiperProcessManager manager;
    private final ConcurrencyGuard concurrencyGuard;
    private volatile boolean closed;

    @Autowired
    public PiperSynthesisEngine(PiperConfig cfg, SynthesisProperties synthesisProperties, PiperProcessManager manager) {
        this(cfg, manager, synthesisProperties.getMaxConcurrent(), synthesisProperties.getAcquireTimeoutMs());
    }

    PiperSynthesisEngine(PiperConfig cfg, PiperProcessManager manager, int maxConcurrent, long acquireTimeoutMs) {
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.manager = Objects.requireNonNull(manager, "manager");
        this.concurrencyGuard = new ConcurrencyGuard(maxConcurrent, acquireTimeoutMs, ENGINE);
    }

    @Override
    public VoiceHandle load(ModelArtifact artifact) {
        Objects.requireNonNull(artifact, "artifact");
        if (!Files.isRegularFile(artifact.modelFile())) {
            throw new SynthesisException("Model file missing: " + artifact.modelFile(), ENGINE);
        }
        PiperVoiceConfig voiceConfig = PiperVoiceConfig.read(artifact.configFile());
        if (voiceConfig.speakers() > 1) {
            LOG.info("Model {} has {} speakers; using the default speaker", artifact.modelId(), voiceConfig.speakers());
        }
        PiperVoice voice = new PiperVoice(artifact.modelId(), voiceConfig.sampleRate(),
                artifact.modelFile(), artifact.configFile());
        LOG.info("Loaded Piper voice {} ({} Hz, quality={})", voice.modelId(), voice.sampleRate(),
                voiceConfig.quality().isEmpty() ? "unknown" : voiceConfig.quality());
        return voice;
    }

    @Override
    public byte[] synthesize(VoiceHandle voice, String text) {
        if (closed) {
            throw new SynthesisException(ENGINE + " engine closed", ENGINE);
        }
        if (!(voice instanceof PiperVoice piperVoice)) {
            throw new SynthesisException("Voice " + (voice == null ? "null" : voice.modelId())
                    + " was not loaded by this engine", ENGINE);
        }
        if (text == null || text.isEmpty()) {
            throw new SynthesisException("Text must not be empty", ENGINE);
        }

        concurrencyGuard.acquire();
        long start = System.nanoTime();
        try {
            byte[] pcm = manager.synthesize(piperVoice, text, cfg);
            if (pcm.length == 0) {
                throw new SynthesisException("Piper produced no audio for model " + piperVoice.modelId(), ENGINE);
            }
            if (pcm.length % AudioFormat.BLOCK_ALIGN != 0) {
                throw new SynthesisException("Piper produced a truncated sample (" + pcm.length + " bytes)", ENGINE);
            }
            LOG.debug("Synthesized {} chars -> {} bytes with {} in {} ms", text.length(), pcm.length,
                    piperVoice.modelId(), TimeUtils.elapsedMillis(start));
            return pcm;
        } finally {
            concurrencyGuard.release();
        }
    }

    @Override
    public String getEngineName() {
        return ENGINE;
    }

    @Override
    public boolean isHealthy() {
        return !closed;
    }

    @PreDestroy
    public void close() {
        closed = true;
    }
}
