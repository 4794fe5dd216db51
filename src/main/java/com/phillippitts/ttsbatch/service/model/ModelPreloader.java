package com.phillippitts.ttsbatch.service.model;

import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Resolves the default and allowed models in the background once the application is ready, so
 * the first request for them does not pay the download and load cost.
 *
 * <p>Failures are logged and leave the model {@code FAILED}; requests retry acquisition.
 */
@Component
class ModelPreloader {

    private static final Logger LOG = LogManager.getLogger(ModelPreloader.class);

    private final ModelRegistry registry;
    private final ModelProperties props;
    private final Executor executor;

    ModelPreloader(ModelRegistry registry,
                   ModelProperties props,
                   @Qualifier("modelExecutor") Executor executor) {
        this.registry = registry;
        this.props = props;
        this.executor = executor;
    }

    @EventListener(ApplicationReadyEvent.class)
    void onApplicationReady() {
        if (!props.isPreload()) {
            LOG.info("Model preload disabled");
            return;
        }
        Set<String> ids = modelsToPreload();
        LOG.info("Preloading models: {}", ids);
        for (String id : ids) {
            executor.execute(() -> preload(id));
        }
    }

    Set<String> modelsToPreload() {
        Set<String> ids = new LinkedHashSet<>();
        ids.add(props.getDefaultModel());
        ids.addAll(props.getAllowed());
        return ids;
    }

    private void preload(String id) {
        try {
            registry.resolve(id);
        } catch (RuntimeException e) {
            LOG.warn("Preload of model {} failed: {}", id, e.getMessage());
        }
    }
}
