package com.phillippitts.ttsbatch.service.health;

import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import com.phillippitts.ttsbatch.domain.ModelState;
import com.phillippitts.ttsbatch.domain.VoiceModel;
import com.phillippitts.ttsbatch.service.model.ModelRegistry;
import com.phillippitts.ttsbatch.service.synthesis.SynthesisEngine;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.TreeMap;

/**
 * Health indicator for the synthesis engine and the voice model table.
 *
 * <ul>
 *   <li>UP: engine healthy and the default model ready</li>
 *   <li>DEGRADED: engine healthy, default model not (yet) ready; requests will try to acquire it</li>
 *   <li>DOWN: engine closed</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint. Never triggers model acquisition.
 */
@Component
public class ModelRegistryHealthIndicator implements HealthIndicator {

    private final ModelRegistry registry;
    private final SynthesisEngine engine;
    private final ModelProperties props;

    public ModelRegistryHealthIndicator(ModelRegistry registry, SynthesisEngine engine, ModelProperties props) {
        this.registry = registry;
        this.engine = engine;
        this.props = props;
    }

    @Override
    public Health health() {
        Map<String, String> models = new TreeMap<>();
        for (VoiceModel model : registry.models()) {
            models.put(model.id(), describe(model));
        }
        ModelState defaultState = registry.find(props.getDefaultModel())
                .map(VoiceModel::state)
                .orElse(ModelState.UNRESOLVED);

        Health.Builder builder;
        if (!engine.isHealthy()) {
            builder = Health.down().withDetail("status", engine.getEngineName() + " engine unavailable");
        } else if (defaultState == ModelState.READY) {
            builder = Health.up().withDetail("status", "Default model ready");
        } else {
            builder = Health.status("DEGRADED").withDetail("status", "Default model " + defaultState);
        }
        return builder
                .withDetail("engine", engine.getEngineName())
                .withDetail("defaultModel", props.getDefaultModel())
                .withDetail("models", models)
                .build();
    }

    private static String describe(VoiceModel model) {
        return switch (model.state()) {
            case READY -> "READY (" + model.nativeSampleRate() + " Hz)";
            case FAILED -> "FAILED: " + model.failureReason();
            default -> model.state().name();
        };
    }
}
