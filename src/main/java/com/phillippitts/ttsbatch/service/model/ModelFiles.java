package com.phillippitts.ttsbatch.service.model;

import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import com.phillippitts.ttsbatch.exception.InvalidRequestException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Filesystem layout for voice models: where they are looked up, where downloads land, and how
 * staged downloads are published.
 *
 * <p>Lookup checks the assets directory first, then the fallback directory. Downloads go to the
 * assets directory when it is writable, otherwise to the fallback (read-only container images).
 *
 * <p>Publication moves each staged file into place with an atomic rename, config file last, so a
 * model is only considered present once both files are complete. Staging directories live inside
 * the target directory to keep the rename on one filesystem.
 */
@Component
public class ModelFiles {

    private static final Logger LOG = LogManager.getLogger(ModelFiles.class);

    static final String STAGING_DIR = ".staging";
    private static final Pattern MODEL_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final Path assetsDir;
    private final Path fallbackDir;

    @Autowired
    public ModelFiles(ModelProperties props) {
        this(Path.of(props.getAssetsDir()), Path.of(props.getFallbackDir()));
    }

    public ModelFiles(Path assetsDir, Path fallbackDir) {
        this.assetsDir = assetsDir.toAbsolutePath().normalize();
        this.fallbackDir = fallbackDir.toAbsolutePath().normalize();
    }

    /**
     * Rejects ids that could escape the model directory or are not plain file-name tokens.
     *
     * @throws InvalidRequestException if the id is malformed
     */
    public static String requireValidId(String modelId) {
        if (modelId == null || !MODEL_ID.matcher(modelId).matches()
                || modelId.contains("..") || modelId.startsWith(".")) {
            throw new InvalidRequestException("model", "malformed model id");
        }
        return modelId;
    }

    /**
     * Returns the local artifact for {@code modelId} if both files exist in either directory.
     */
    public Optional<ModelArtifact> findLocal(String modelId) {
        for (Path dir : new Path[]{assetsDir, fallbackDir}) {
            ModelArtifact candidate = ModelArtifact.in(dir, modelId);
            if (isComplete(candidate)) {
                LOG.debug("Model {} found locally at {}", modelId, dir);
                return Optional.of(candidate);
            }
        }
        return Optional.empty();
    }

    /**
     * Picks the directory downloads are published into, creating it if needed.
     */
    public Path downloadDirectory() throws IOException {
        if (isWritableDirectory(assetsDir)) {
            return assetsDir;
        }
        if (!Files.exists(assetsDir)) {
            try {
                Files.createDirectories(assetsDir);
                return assetsDir;
            } catch (IOException e) {
                LOG.debug("Cannot create assets directory {}: {}", assetsDir, e.toString());
            }
        }
        LOG.warn("Assets directory {} is not writable; using fallback directory {}", assetsDir, fallbackDir);
        Files.createDirectories(fallbackDir);
        return fallbackDir;
    }

    /**
     * Creates a private, empty staging directory for one download into {@code targetDir}.
     */
    public Path createStagingDirectory(Path targetDir, String modelId) throws IOException {
        Path staging = targetDir.resolve(STAGING_DIR).resolve(modelId + "-" + UUID.randomUUID());
        return Files.createDirectories(staging);
    }

    /**
     * Moves a staged artifact into {@code targetDir}, replacing any partial leftovers.
     *
     * @return the artifact at its published location
     */
    public ModelArtifact publish(ModelArtifact staged, Path targetDir) throws IOException {
        ModelArtifact target = ModelArtifact.in(targetDir, staged.modelId());
        move(staged.modelFile(), target.modelFile());
        move(staged.configFile(), target.configFile());
        LOG.info("Published model {} to {}", staged.modelId(), targetDir);
        return target;
    }

    /**
     * Best-effort recursive delete; failures are logged, not thrown.
     */
    public void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            LOG.warn("Could not remove staging directory {}: {}", dir, e.toString());
        }
    }

    public Path getAssetsDir() {
        return assetsDir;
    }

    public Path getFallbackDir() {
        return fallbackDir;
    }

    static boolean isComplete(ModelArtifact artifact) {
        return Files.isRegularFile(artifact.modelFile()) && Files.isRegularFile(artifact.configFile());
    }

    private static boolean isWritableDirectory(Path dir) {
        return Files.isDirectory(dir) && Files.isWritable(dir);
    }

    private static void move(Path from, Path to) throws IOException {
        if (!Files.isRegularFile(from)) {
            throw new IOException("Staged file missing: " + from.getFileName());
        }
        try {
            Files.move(from, to, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
