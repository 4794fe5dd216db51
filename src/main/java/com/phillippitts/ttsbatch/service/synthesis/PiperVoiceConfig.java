package com.phillippitts.ttsbatch.service.synthesis;

import com.phillippitts.ttsbatch.exception.SynthesisException;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Fields of a Piper {@code <id>.onnx.json} model config that the service depends on.
 *
 * @param sampleRate native output rate ({@code audio.sample_rate})
 * @param quality voice quality tier ({@code audio.quality}), empty if absent
 * @param speakers number of speakers ({@code num_speakers}), 1 if absent
 */
record PiperVoiceConfig(int sampleRate, String quality, int speakers) {

    static PiperVoiceConfig read(Path configFile) {
        String json;
        try {
            json = Files.readString(configFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SynthesisException("Cannot read voice config " + configFile.getFileName(),
                    PiperSynthesisEngine.ENGINE, e);
        }
        return parse(json, configFile.getFileName().toString());
    }

    static PiperVoiceConfig parse(String json, String source) {
        try {
            JSONObject root = new JSONObject(json);
            JSONObject audio = root.optJSONObject("audio");
            if (audio == null || !audio.has("sample_rate")) {
                throw new SynthesisException("No audio.sample_rate in " + source, PiperSynthesisEngine.ENGINE);
            }
            int sampleRate = audio.getInt("sample_rate");
            if (sampleRate <= 0) {
                throw new SynthesisException("Invalid sample rate " + sampleRate + " in " + source,
                        PiperSynthesisEngine.ENGINE);
            }
            return new PiperVoiceConfig(sampleRate, audio.optString("quality", ""), root.optInt("num_speakers", 1));
        } catch (JSONException e) {
            throw new SynthesisException("Malformed voice config " + source + ": " + e.getMessage(),
                    PiperSynthesisEngine.ENGINE, e);
        }
    }
}
