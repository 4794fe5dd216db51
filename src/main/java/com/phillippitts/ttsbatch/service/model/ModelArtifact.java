package com.phillippitts.ttsbatch.service.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * On-disk files that make up one voice model.
 *
 * @param modelId logical model id
 * @param modelFile ONNX weights ({@code <id>.onnx})
 * @param configFile model metadata ({@code <id>.onnx.json})
 */
public record ModelArtifact(String modelId, Path modelFile, Path configFile) {

    public static final String MODEL_SUFFIX = ".onnx";
    public static final String CONFIG_SUFFIX = ".onnx.json";

    public ModelArtifact {
        Objects.requireNonNull(modelId, "modelId");
        Objects.requireNonNull(modelFile, "modelFile");
        Objects.requireNonNull(configFile, "configFile");
    }

    /**
     * Artifact layout for {@code modelId} inside {@code dir}.
     */
    public static ModelArtifact in(Path dir, String modelId) {
        return new ModelArtifact(modelId,
                dir.resolve(modelId + MODEL_SUFFIX),
                dir.resolve(modelId + CONFIG_SUFFIX));
    }
}
