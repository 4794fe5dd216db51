package com.phillippitts.ttsbatch.service.model;

import com.phillippitts.ttsbatch.config.properties.ModelProperties;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException;
import com.phillippitts.ttsbatch.exception.ModelUnavailableException.Reason;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ModelSource} backed by the public Piper voice repository on Hugging Face.
 *
 * <p>Voice ids follow {@code <lang>_<REGION>-<name>-<quality>} and map to
 * {@code <base>/<lang>/<lang>_<REGION>/<name>/<quality>/<id>.onnx} plus the matching
 * {@code .onnx.json}. Ids that do not follow the pattern, and HTTP 404 responses, are reported as
 * {@link Reason#NOT_FOUND}; every other failure as {@link Reason#LOAD_FAILED}.
 */
@Component
public class HuggingFaceModelSource implements ModelSource {

    private static final Logger LOG = LogManager.getLogger(HuggingFaceModelSource.class);

    private static final Pattern VOICE_ID =
            Pattern.compile("([a-z]{2,3})_([A-Z]{2})-([A-Za-z0-9_]+)-(x_low|low|medium|high)");

    private final RestClient client;
    private final String baseUrl;

    @Autowired
    public HuggingFaceModelSource(RestClient.Builder builder, ModelProperties props) {
        this(builder.requestFactory(requestFactory(props.getDownloadTimeoutSeconds())).build(), props);
    }

    HuggingFaceModelSource(RestClient client, ModelProperties props) {
        this.client = Objects.requireNonNull(client, "client");
        this.baseUrl = stripTrailingSlash(props.getSourceBaseUrl());
    }

    @Override
    public ModelArtifact fetch(String modelId, Path stagingDir) {
        String remoteDir = remoteDirectory(modelId);
        ModelArtifact staged = ModelArtifact.in(stagingDir, modelId);

        download(modelId, remoteDir + "/" + modelId + ModelArtifact.MODEL_SUFFIX, staged.modelFile());
        download(modelId, remoteDir + "/" + modelId + ModelArtifact.CONFIG_SUFFIX, staged.configFile());
        return staged;
    }

    /**
     * Repository directory URL for a voice id.
     *
     * @throws ModelUnavailableException with {@code NOT_FOUND} if the id is not a Piper voice id
     */
    String remoteDirectory(String modelId) {
        Matcher m = VOICE_ID.matcher(modelId);
        if (!m.matches()) {
            throw new ModelUnavailableException(modelId, Reason.NOT_FOUND,
                    "not a Piper voice id (expected <lang>_<REGION>-<name>-<quality>)");
        }
        String family = m.group(1);
        String locale = family + "_" + m.group(2);
        return baseUrl + "/" + family + "/" + locale + "/" + m.group(3) + "/" + m.group(4);
    }

    private void download(String modelId, String url, Path target) {
        LOG.info("Downloading {}", url);
        long bytes;
        try {
            bytes = client.get()
                    .uri(url)
                    .exchange((request, response) -> {
                        if (response.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
                            throw new ModelUnavailableException(modelId, Reason.NOT_FOUND,
                                    "model source has no " + target.getFileName());
                        }
                        if (response.getStatusCode().isError()) {
                            throw new ModelUnavailableException(modelId, Reason.LOAD_FAILED,
                                    "model source returned HTTP " + response.getStatusCode().value());
                        }
                        try (InputStream body = response.getBody()) {
                            return Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
                        }
                    });
        } catch (RestClientException e) {
            throw new ModelUnavailableException(modelId, Reason.LOAD_FAILED,
                    "download failed: " + e.getMessage(), e);
        }
        if (bytes == 0) {
            throw new ModelUnavailableException(modelId, Reason.LOAD_FAILED,
                    "model source returned an empty " + target.getFileName());
        }
        LOG.debug("Downloaded {} bytes to {}", bytes, target);
    }

    private static SimpleClientHttpRequestFactory requestFactory(int timeoutSeconds) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutSeconds * 1000);
        factory.setReadTimeout(timeoutSeconds * 1000);
        return factory;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = Objects.requireNonNull(url, "sourceBaseUrl").trim();
        return trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }
}
