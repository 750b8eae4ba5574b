package com.sentient.secrets;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentient.exception.SecretResolutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Process-wide memo of the secret bundle.
 *
 * The bundle is fetched on first use and kept for the lifetime of the process.
 * There is no invalidation: rotating a secret requires a restart. A failed
 * fetch is not cached, so the next caller tries again.
 *
 * Accepted document keys:
 * <ul>
 *   <li>{@code JWT_SECRET} - token signing secret (required)</li>
 *   <li>{@code GEMINI_KEY} or {@code INFERENCE_API_KEY} - inference key (optional)</li>
 * </ul>
 */
@Component
@Slf4j
public class SecretCache {

    static final String SIGNING_SECRET_KEY = "JWT_SECRET";
    static final String INFERENCE_KEY = "GEMINI_KEY";
    static final String INFERENCE_KEY_ALIAS = "INFERENCE_API_KEY";

    private final SecretsSource secretsSource;
    private final ObjectMapper objectMapper;
    private final String secretName;

    private volatile SecretBundle bundle;

    public SecretCache(
            SecretsSource secretsSource,
            ObjectMapper objectMapper,
            @Value("${app.secrets.name:app-secrets}") String secretName
    ) {
        this.secretsSource = secretsSource;
        this.objectMapper = objectMapper;
        this.secretName = secretName;
    }

    /**
     * Returns the cached bundle, fetching it on first call.
     *
     * @return the secret bundle
     * @throws SecretResolutionException if the document is missing, malformed or lacks a signing secret
     */
    public SecretBundle get() {
        SecretBundle current = bundle;
        if (current != null) {
            return current;
        }
        synchronized (this) {
            if (bundle == null) {
                bundle = load();
            }
            return bundle;
        }
    }

    private SecretBundle load() {
        log.info("Fetching secret bundle: name={}", secretName);
        String document = secretsSource.fetch(secretName);

        JsonNode root;
        try {
            root = objectMapper.readTree(document);
        } catch (JsonProcessingException e) {
            throw new SecretResolutionException("Secret '" + secretName + "' is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new SecretResolutionException("Secret '" + secretName + "' must be a JSON object");
        }

        String signingSecret = root.path(SIGNING_SECRET_KEY).asText("");
        if (signingSecret.isBlank()) {
            throw new SecretResolutionException("Secret '" + secretName + "' has no " + SIGNING_SECRET_KEY);
        }

        String inferenceKey = root.path(INFERENCE_KEY).asText("");
        if (inferenceKey.isBlank()) {
            inferenceKey = root.path(INFERENCE_KEY_ALIAS).asText("");
        }
        if (inferenceKey.isBlank()) {
            log.warn("Secret bundle has no inference key, analysis will use the fallback plan");
        }

        SecretBundle loaded = new SecretBundle(inferenceKey, signingSecret);
        log.info("Secret bundle loaded: {}", loaded);
        return loaded;
    }
}
