package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.config.tts.PiperConfig;
import com.phillippitts.ttsbatch.domain.VoiceHandle;
import com.phillippitts.ttsbatch.exception.SynthesisException;
import com.phillippitts.ttsbatch.service.model.ModelArtifact;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.phillippitts.ttsbatch.service.synthesis.PiperTestDoubles.ProcessBehavior;
import static com.phillippitts.ttsbatch.service.synthesis.PiperTestDoubles.StubProcessFactory;
import static com.phillippitts.ttsbatch.service.synthesis.PiperTestDoubles.TestProcess;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PiperSynthesisEngineTest {

    @TempDir
    Path dir;

    private static PiperSynthesisEngine engineProducing(byte[] stdout) {
        PiperProcessManager mgr = new PiperProcessManager(new StubProcessFactory(
                new TestProcess(ProcessBehavior.success(stdout))));
        return new PiperSynthesisEngine(PiperConfig.defaults(), mgr, 2, 1000);
    }

    private ModelArtifact writeModel(String id, int sampleRate) throws IOException {
        ModelArtifact artifact = ModelArtifact.in(dir, id);
        Files.write(artifact.modelFile(), new byte[]{1});
        Files.writeString(artifact.configFile(),
                "{\"audio\":{\"sample_rate\":" + sampleRate + ",\"quality\":\"low\"},\"num_speakers\":1}");
        return artifact;
    }

    @Test
    void loadReadsNativeRateFromModelConfig() throws IOException {
        VoiceHandle voice = engineProducing(new byte[2]).load(writeModel("en_US-amy-low", 16000));

        assertThat(voice).isInstanceOf(PiperVoice.class);
        assertThat(voice.modelId()).isEqualTo("en_US-amy-low");
        assertThat(voice.sampleRate()).isEqualTo(16000);
    }

    @Test
    void loadFailsWhenModelFileMissing() throws IOException {
        ModelArtifact artifact = writeModel("en_US-amy-low", 16000);
        Files.delete(artifact.modelFile());

        assertThatThrownBy(() -> engineProducing(new byte[2]).load(artifact))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("Model file missing");
    }

    @Test
    void synthesizeReturnsPiperOutput() throws IOException {
        PiperSynthesisEngine engine = engineProducing(new byte[]{10, 0, 20, 0});
        VoiceHandle voice = engine.load(writeModel("en_US-amy-low", 22050));

        assertThat(engine.synthesize(voice, "hi")).containsExactly(10, 0, 20, 0);
        assertThat(engine.isHealthy()).isTrue();
        assertThat(engine.getEngineName()).isEqualTo("piper");
    }

    @Test
    void rejectsEmptyOutput() throws IOException {
        PiperSynthesisEngine engine = engineProducing(new byte[0]);
        VoiceHandle voice = engine.load(writeModel("en_US-amy-low", 22050));

        assertThatThrownBy(() -> engine.synthesize(voice, "hi"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("no audio");
    }

    @Test
    void rejectsTruncatedSample() throws IOException {
        PiperSynthesisEngine engine = engineProducing(new byte[]{1, 0, 2});
        VoiceHandle voice = engine.load(writeModel("en_US-amy-low", 22050));

        assertThatThrownBy(() -> engine.synthesize(voice, "hi"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("truncated sample (3 bytes)");
    }

    @Test
    void rejectsForeignVoiceHandleAndEmptyText() throws IOException {
        PiperSynthesisEngine engine = engineProducing(new byte[2]);
        VoiceHandle foreign = new VoiceHandle() {
            @Override
            public String modelId() {
                return "other";
            }

            @Override
            public int sampleRate() {
                return 16000;
            }
        };

        assertThatThrownBy(() -> engine.synthesize(foreign, "hi"))
                .hasMessageContaining("was not loaded by this engine");
        VoiceHandle voice = engine.load(writeModel("en_US-amy-low", 22050));
        assertThatThrownBy(() -> engine.synthesize(voice, ""))
                .hasMessageContaining("Text must not be empty");
    }

    @Test
    void closedEngineRefusesWork() throws IOException {
        PiperSynthesisEngine engine = engineProducing(new byte[2]);
        VoiceHandle voice = engine.load(writeModel("en_US-amy-low", 22050));

        engine.close();

        assertThat(engine.isHealthy()).isFalse();
        assertThatThrownBy(() -> engine.synthesize(voice, "hi"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("engine closed");
    }
}
