package com.phillippitts.ttsbatch.service.cache;

import com.phillippitts.ttsbatch.config.properties.CacheProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Derives deterministic cache keys from (model id, text, target sample rate).
 *
 * <p>Key = prefix + hex(SHA-256(len(model) | model | len(text) | text | rate)), where lengths are
 * 4-byte big-endian UTF-8 byte counts and the rate is a 4-byte big-endian int. Length prefixes
 * make field boundaries unambiguous, so {@code ("a", "b:c")} and {@code ("a:b", "c")} never share
 * a key. There is no per-process salt: keys are stable across restarts and deployments.
 *
 * <p>Text is hashed verbatim. Case and whitespace differences produce different keys.
 */
@Component
public class CacheKeyDeriver {

    private static final String ALGORITHM = "SHA-256";

    private final String prefix;

    @Autowired
    public CacheKeyDeriver(CacheProperties props) {
        this(props.getKeyPrefix());
    }

    public CacheKeyDeriver(String prefix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    /**
     * Derives the cache key for a synthesis result.
     *
     * @param modelId effective model id
     * @param text request text, exactly as received
     * @param targetSampleRate effective output sample rate
     * @return prefixed hex digest
     */
    public String derive(String modelId, String text, int targetSampleRate) {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(text, "text");

        byte[] model = modelId.getBytes(StandardCharsets.UTF_8);
        byte[] body = text.getBytes(StandardCharsets.UTF_8);
        ByteBuffer buf = ByteBuffer.allocate(Integer.BYTES * 3 + model.length + body.length);
        buf.putInt(model.length).put(model);
        buf.putInt(body.length).put(body);
        buf.putInt(targetSampleRate);

        return prefix + HexFormat.of().formatHex(newDigest().digest(buf.array()));
    }

    private static MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(ALGORITHM);
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException(ALGORITHM + " not available", e);
        }
    }
}
