package com.phillippitts.ttsbatch.domain;

/**
 * How the cache participated in serving a request. Reported in the {@code X-Cache} header.
 */
public enum CacheStatus {
    HIT,
    MISS,
    /** Cache backend failed or timed out; request was served by synthesis. */
    ERROR,
    /** Caching turned off by configuration. */
    DISABLED
}
