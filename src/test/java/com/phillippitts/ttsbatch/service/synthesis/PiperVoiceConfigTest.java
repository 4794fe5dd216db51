package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.exception.SynthesisException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PiperVoiceConfigTest {

    @Test
    void readsSampleRateQualityAndSpeakers() {
        PiperVoiceConfig cfg = PiperVoiceConfig.parse("""
                {
                  "audio": {"sample_rate": 22050, "quality": "medium"},
                  "espeak": {"voice": "en-us"},
                  "num_speakers": 4
                }
                """, "voice.onnx.json");

        assertThat(cfg.sampleRate()).isEqualTo(22050);
        assertThat(cfg.quality()).isEqualTo("medium");
        assertThat(cfg.speakers()).isEqualTo(4);
    }

    @Test
    void defaultsOptionalFields() {
        PiperVoiceConfig cfg = PiperVoiceConfig.parse("{\"audio\":{\"sample_rate\":16000}}", "v");

        assertThat(cfg.quality()).isEmpty();
        assertThat(cfg.speakers()).isEqualTo(1);
    }

    @Test
    void rejectsMissingOrInvalidSampleRate() {
        assertThatThrownBy(() -> PiperVoiceConfig.parse("{\"audio\":{}}", "v.json"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("No audio.sample_rate in v.json");
        assertThatThrownBy(() -> PiperVoiceConfig.parse("{\"audio\":{\"sample_rate\":0}}", "v.json"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("Invalid sample rate 0");
    }

    @Test
    void rejectsMalformedJson() {
        assertThatThrownBy(() -> PiperVoiceConfig.parse("{not json", "v.json"))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("Malformed voice config v.json");
    }

    @Test
    void reportsUnreadableFile(@TempDir Path dir) {
        assertThatThrownBy(() -> PiperVoiceConfig.read(dir.resolve("missing.onnx.json")))
                .isInstanceOf(SynthesisException.class)
                .hasMessageContaining("Cannot read voice config missing.onnx.json");
    }
}
