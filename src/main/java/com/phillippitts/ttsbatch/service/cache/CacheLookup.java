package com.phillippitts.ttsbatch.service.cache;

import com.phillippitts.ttsbatch.exception.CacheUnavailableException;

/**
 * Result of a cache read. Exactly one of three outcomes: hit (with payload), miss, or
 * unavailable (with the backend error). Callers treat unavailable the same as a miss.
 *
 * @param outcome lookup outcome
 * @param payload cached bytes, non-null only for {@link Outcome#HIT}
 * @param error backend failure, non-null only for {@link Outcome#UNAVAILABLE}
 */
public record CacheLookup(Outcome outcome, byte[] payload, CacheUnavailableException error) {

    public enum Outcome { HIT, MISS, UNAVAILABLE }

    private static final CacheLookup MISS = new CacheLookup(Outcome.MISS, null, null);

    public static CacheLookup hit(byte[] payload) {
        return new CacheLookup(Outcome.HIT, payload, null);
    }

    public static CacheLookup miss() {
        return MISS;
    }

    public static CacheLookup unavailable(CacheUnavailableException error) {
        return new CacheLookup(Outcome.UNAVAILABLE, null, error);
    }

    public boolean isHit() {
        return outcome == Outcome.HIT;
    }
}
