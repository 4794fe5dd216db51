package com.phillippitts.ttsbatch.presentation.controller;

import com.phillippitts.ttsbatch.domain.SynthesisResult;
import com.phillippitts.ttsbatch.presentation.dto.SynthesizeRequest;
import com.phillippitts.ttsbatch.service.audio.AudioFormat;
import com.phillippitts.ttsbatch.service.orchestration.SynthesisOrchestrator;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Text-to-speech endpoint. Responds with raw mono S16LE PCM ({@code audio/x-raw;format=S16LE;channels=1});
 * the rate is reported in {@code X-Sample-Rate}.
 */
@RestController
class SynthesisController {

    static final MediaType AUDIO_RAW = MediaType.parseMediaType(AudioFormat.MEDIA_TYPE
            + ";format=" + AudioFormat.MEDIA_FORMAT + ";channels=" + AudioFormat.CHANNELS);

    static final String HEADER_MODEL = "X-Model";
    static final String HEADER_SAMPLE_RATE = "X-Sample-Rate";
    static final String HEADER_CACHE = "X-Cache";
    static final String HEADER_RESAMPLING = "X-Resampling";
    static final String HEADER_SYNTHESIS_TIME = "X-Synthesis-Time";
    static final String HEADER_RESAMPLE_TIME = "X-Resample-Time";
    static final String HEADER_TOTAL_TIME = "X-Total-Time";

    private final SynthesisOrchestrator orchestrator;

    SynthesisController(SynthesisOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @PostMapping(path = {"/synthesize", "/synthesizeSpeech"}, consumes = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<byte[]> synthesize(@RequestBody SynthesizeRequest body) {
        SynthesisResult result = orchestrator.synthesize(body.toDomain());
        byte[] pcm = result.payload().pcm();

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(AUDIO_RAW);
        headers.setContentLength(pcm.length);
        headers.set(HEADER_MODEL, result.modelId());
        headers.set(HEADER_SAMPLE_RATE, String.valueOf(result.sampleRate()));
        headers.set(HEADER_CACHE, result.cacheStatus().name());
        headers.set(HEADER_RESAMPLING, result.resampled() ? "APPLIED" : "NONE");
        if (result.resampled()) {
            headers.set(HEADER_RESAMPLE_TIME, result.resampleMs() + "ms");
        }
        if (result.synthesisMs() > 0) {
            headers.set(HEADER_SYNTHESIS_TIME, result.synthesisMs() + "ms");
        }
        headers.set(HEADER_TOTAL_TIME, result.totalMs() + "ms");
        return ResponseEntity.ok().headers(headers).body(pcm);
    }
}
