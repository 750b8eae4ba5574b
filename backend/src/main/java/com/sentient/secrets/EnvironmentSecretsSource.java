package com.sentient.secrets;

import com.sentient.exception.SecretResolutionException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Reads the secret document from the Spring environment.
 *
 * Relaxed binding applies, so the default name {@code app-secrets} resolves
 * the {@code APP_SECRETS} environment variable as well as an
 * {@code app-secrets} property.
 */
@Component
@ConditionalOnProperty(name = "app.secrets.source", havingValue = "environment", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class EnvironmentSecretsSource implements SecretsSource {

    private final Environment environment;

    @Override
    public String fetch(String secretName) {
        String value = environment.getProperty(secretName);
        if (value == null || value.isBlank()) {
            throw new SecretResolutionException("Secret '" + secretName + "' is not set in the environment");
        }
        log.debug("Resolved secret document from environment: name={}", secretName);
        return value;
    }
}
