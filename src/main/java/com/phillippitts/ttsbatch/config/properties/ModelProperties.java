package com.phillippitts.ttsbatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Voice model selection, storage and download settings.
 *
 * <p>Example application.properties:
 * <pre>
 * tts.models.default-model=en_US-kathleen-low
 * tts.models.allowed=en_US-kathleen-low,en_US-ryan-medium
 * tts.models.max-models=8
 * tts.models.assets-dir=/app/assets
 * tts.models.source-base-url=https://huggingface.co/rhasspy/piper-voices/resolve/v1.0.0
 * tts.models.preload=true
 * </pre>
 *
 * <p>An empty {@code allowed} list permits any id the model source can provide, bounded only
 * by {@code max-models}.
 */
@ConfigurationProperties(prefix = "tts.models")
@Validated
public class ModelProperties {

    @NotBlank(message = "Default model must not be blank")
    private String defaultModel = "en_US-kathleen-low";

    private List<String> allowed = new ArrayList<>();

    /** Upper bound on distinct model ids held by the registry. */
    @Positive(message = "Max models must be positive")
    private int maxModels = 8;

    @NotBlank(message = "Assets directory must not be blank")
    private String assetsDir = "assets";

    /** Download target when {@code assets-dir} is not writable (read-only container images). */
    private String fallbackDir = Path.of(System.getProperty("user.home"), ".cache", "tts-batch").toString();

    @NotBlank(message = "Model source URL must not be blank")
    private String sourceBaseUrl = "https://huggingface.co/rhasspy/piper-voices/resolve/v1.0.0";

    @Positive(message = "Download timeout must be positive")
    private int downloadTimeoutSeconds = 120;

    /** Resolve the default and allowed models in the background once the application is ready. */
    private boolean preload = true;

    public String getDefaultModel() {
        return defaultModel;
    }

    public void setDefaultModel(String defaultModel) {
        this.defaultModel = defaultModel;
    }

    public List<String> getAllowed() {
        return allowed;
    }

    public void setAllowed(List<String> allowed) {
        this.allowed = allowed == null ? new ArrayList<>() : new ArrayList<>(allowed);
    }

    public int getMaxModels() {
        return maxModels;
    }

    public void setMaxModels(int maxModels) {
        this.maxModels = maxModels;
    }

    public String getAssetsDir() {
        return assetsDir;
    }

    public void setAssetsDir(String assetsDir) {
        this.assetsDir = assetsDir;
    }

    public String getFallbackDir() {
        return fallbackDir;
    }

    public void setFallbackDir(String fallbackDir) {
        this.fallbackDir = fallbackDir;
    }

    public String getSourceBaseUrl() {
        return sourceBaseUrl;
    }

    public void setSourceBaseUrl(String sourceBaseUrl) {
        this.sourceBaseUrl = sourceBaseUrl;
    }

    public int getDownloadTimeoutSeconds() {
        return downloadTimeoutSeconds;
    }

    public void setDownloadTimeoutSeconds(int downloadTimeoutSeconds) {
        this.downloadTimeoutSeconds = downloadTimeoutSeconds;
    }

    public boolean isPreload() {
        return preload;
    }

    public void setPreload(boolean preload) {
        this.preload = preload;
    }

    /**
     * Returns true if {@code modelId} may be resolved under the current allowlist.
     */
    public boolean isPermitted(String modelId) {
        return allowed.isEmpty() || allowed.contains(modelId);
    }
}
