package com.sentient.secrets;

/**
 * Credentials resolved once per process.
 *
 * @param inferenceApiKey key for the inference provider, may be blank (enrichment then degrades to the fallback plan)
 * @param signingSecret HMAC secret for bearer tokens, never blank
 */
public record SecretBundle(String inferenceApiKey, String signingSecret) {

    public boolean hasInferenceKey() {
        return inferenceApiKey != null && !inferenceApiKey.isBlank();
    }

    @Override
    public String toString() {
        return "SecretBundle[inferenceApiKey=" + (hasInferenceKey() ? "***" : "<none>")
                + ", signingSecret=***]";
    }
}
