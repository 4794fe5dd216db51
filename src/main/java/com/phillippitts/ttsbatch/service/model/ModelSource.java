package com.phillippitts.ttsbatch.service.model;

import com.phillippitts.ttsbatch.exception.ModelUnavailableException;

import java.nio.file.Path;

/**
 * Remote origin of voice model files, used only when a model is not present locally.
 */
public interface ModelSource {

    /**
     * Downloads the model files for {@code modelId} into {@code stagingDir}.
     *
     * <p>The caller owns {@code stagingDir}: it publishes the returned files into the model
     * directory and deletes the staging directory afterwards.
     *
     * @param modelId validated model id
     * @param stagingDir empty, writable directory private to this fetch
     * @return artifact whose files live inside {@code stagingDir}
     * @throws ModelUnavailableException with reason {@code NOT_FOUND} if the source has no such
     *         model, or {@code LOAD_FAILED} on transfer errors
     */
    ModelArtifact fetch(String modelId, Path stagingDir);
}
