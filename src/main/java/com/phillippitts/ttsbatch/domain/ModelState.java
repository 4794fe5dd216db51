package com.phillippitts.ttsbatch.domain;

/**
 * Lifecycle of a voice model inside the registry.
 *
 * <p>Transitions are monotonic {@code UNRESOLVED -> RESOLVING -> READY|FAILED}, except
 * {@code FAILED -> RESOLVING} when a later request retries.
 */
public enum ModelState {
    UNRESOLVED,
    RESOLVING,
    READY,
    FAILED
}
