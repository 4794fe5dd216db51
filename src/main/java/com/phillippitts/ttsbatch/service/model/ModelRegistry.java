package com.phillippitts.ttsbatch.service.model;

import com.phillippitts.ttsbatch.domain.VoiceModel;
import com.phillippitts.ttsbatch.exception.InvalidRequestException;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException;

import java.util.Collection;
import java.util.Optional;

/**
 * Owns the voice model table: one {@link VoiceModel} record per distinct id for the process
 * lifetime, acquired lazily on first use.
 *
 * @since 1.0
 */
public interface ModelRegistry {

    /**
     * Returns the ready model for {@code modelId}, acquiring it first if needed.
     *
     * <p>At most one acquisition runs per id; concurrent callers for the same id wait for it and
     * share its outcome. A model that failed is retried on the next call.
     *
     * @param modelId model id
     * @return model in state {@code READY}
     * @throws InvalidRequestException if the id is malformed
     * @throws ModelUnavailableException if the id is not permitted, the registry is full, or
     *         acquisition failed
     */
    VoiceModel resolve(String modelId);

    /**
     * Current record for {@code modelId}, without triggering acquisition.
     */
    Optional<VoiceModel> find(String modelId);

    /**
     * Snapshot of all known models.
     */
    Collection<VoiceModel> models();
}
