package com.sentient.secrets;

/**
 * Backing store for the JSON secret document.
 *
 * Implementations return the raw document for a secret name and throw
 * {@link com.sentient.exception.SecretResolutionException} when it cannot be read.
 */
public interface SecretsSource {

    String fetch(String secretName);
}
