package com.phillippitts.ttsbatch.service.model;

import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import com.phillippitts.ttsbatch.domain.VoiceHandle;
import com.phillippitts.ttsbatch.domain.VoiceModel;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException.Reason;
import com.phillippitts.ttsbatch.service.events.ModelLifecycleEvent;
import com.phillippitts.ttsbatch.service.synthesis.SynthesisEngine;
import com.phillippitts.ttsbatch.util.SingleFlight;
import com.phillippitts.ttsbatch.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Default {@link ModelRegistry}.
 *
 * <p>The model table maps each id to an immutable {@link VoiceModel}; every state change replaces
 * the record with a single map write, so readers never see a half-updated model. Ready models are
 * served from the table without locking. Acquisition is single-flight per id and never blocks
 * other ids.
 *
 * <p>Acquisition sequence:
 * <ol>
 *   <li>Use local files from the assets or fallback directory if both are present</li>
 *   <li>Otherwise fetch from the {@link ModelSource} into a staging directory and publish with
 *       atomic renames</li>
 *   <li>Load the artifact into the {@link SynthesisEngine}</li>
 * </ol>
 *
 * <p>The table holds at most {@code tts.models.max-models} distinct ids. Records are never
 * removed: a failed id keeps its slot and may be retried, ready models are never unloaded.
 */
@Service
public class DefaultModelRegistry implements ModelRegistry {

    private static final Logger LOG = LogManager.getLogger(DefaultModelRegistry.class);

    private final ModelProperties props;
    private final ModelFiles files;
    private final ModelSource source;
    private final SynthesisEngine engine;
    private final ApplicationEventPublisher publisher;

    private final ConcurrentMap<String, VoiceModel> models = new ConcurrentHashMap<>();
    private final SingleFlight<String, VoiceModel> acquisitions = new SingleFlight<>();
    private final Object capacityLock = new Object();

    @Autowired
    public DefaultModelRegistry(ModelProperties props,
                                ModelFiles files,
                                ModelSource source,
                                SynthesisEngine engine,
                                ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props, "props");
        this.files = Objects.requireNonNull(files, "files");
        this.source = Objects.requireNonNull(source, "source");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.publisher = publisher;
    }

    @Override
    public VoiceModel resolve(String modelId) {
        String id = ModelFiles.requireValidId(modelId);
        if (!props.isPermitted(id)) {
            throw new ModelUnavailableException(id, Reason.NOT_PERMITTED, "not in the allowed model list");
        }
        VoiceModel current = models.get(id);
        if (current != null && current.isReady()) {
            return current;
        }
        return acquisitions.execute(id, () -> acquireIfNeeded(id));
    }

    @Override
    public Optional<VoiceModel> find(String modelId) {
        return modelId == null ? Optional.empty() : Optional.ofNullable(models.get(modelId));
    }

    @Override
    public Collection<VoiceModel> models() {
        return List.copyOf(models.values());
    }

    private VoiceModel acquireIfNeeded(String id) {
        // Another flight may have finished between the fast-path check and joining this one
        VoiceModel current = models.get(id);
        if (current != null && current.isReady()) {
            return current;
        }
        startResolving(id);
        return acquire(id);
    }

    /**
     * Claims a slot for {@code id} and marks it resolving in one step, so the table never holds
     * more than {@code max-models} ids.
     */
    private void startResolving(String id) {
        synchronized (capacityLock) {
            VoiceModel existing = models.get(id);
            if (existing == null && models.size() >= props.getMaxModels()) {
                throw new ModelUnavailableException(id, Reason.CAPACITY,
                        "model limit of " + props.getMaxModels() + " reached");
            }
            VoiceModel base = existing != null ? existing : VoiceModel.unresolved(id);
            models.put(id, base.resolving());
        }
    }

    private VoiceModel acquire(String id) {
        long start = System.nanoTime();
        publish(ModelLifecycleEvent.resolving(id));
        LOG.info("Acquiring model {}", id);

        try {
            ModelArtifact artifact = files.findLocal(id).orElseGet(() -> download(id));
            VoiceHandle handle = load(artifact);
            VoiceModel ready = models.get(id).ready(handle);
            models.put(id, ready);
            publish(ModelLifecycleEvent.ready(id, TimeUtils.elapsedMillis(start)));
            return ready;
        } catch (ModelUnavailableException e) {
            throw fail(id, e, start);
        } catch (RuntimeException e) {
            throw fail(id, new ModelUnavailableException(id, Reason.LOAD_FAILED, e.getMessage(), e), start);
        }
    }

    private ModelArtifact download(String id) {
        Path staging = null;
        try {
            Path targetDir = files.downloadDirectory();
            staging = files.createStagingDirectory(targetDir, id);
            LOG.info("Model {} not present locally; fetching into {}", id, targetDir);
            ModelArtifact staged = source.fetch(id, staging);
            return files.publish(staged, targetDir);
        } catch (IOException e) {
            throw new ModelUnavailableException(id, Reason.LOAD_FAILED,
                    "could not store model files: " + e.getMessage(), e);
        } finally {
            files.deleteQuietly(staging);
        }
    }

    private VoiceHandle load(ModelArtifact artifact) {
        try {
            return engine.load(artifact);
        } catch (RuntimeException e) {
            throw new ModelUnavailableException(artifact.modelId(), Reason.LOAD_FAILED,
                    engine.getEngineName() + " could not load model: " + e.getMessage(), e);
        }
    }

    private ModelUnavailableException fail(String id, ModelUnavailableException e, long start) {
        models.put(id, models.get(id).failed(e.getMessage()));
        publish(ModelLifecycleEvent.failed(id, TimeUtils.elapsedMillis(start), e));
        return e;
    }

    private void publish(ModelLifecycleEvent event) {
        if (publisher != null) {
            publisher.publishEvent(event);
        }
    }
}
