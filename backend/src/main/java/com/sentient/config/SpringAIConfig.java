package com.sentient.config;

import com.sentient.service.InferenceClientFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Spring AI configuration for reflection analysis.
 *
 * The inference API key lives in the secret bundle, not in application
 * properties, so this configuration exposes a factory rather than ready-made
 * ChatClient beans. Everything except the key is configured here.
 *
 * Configuration Details:
 * - Provider: {@code app.inference.provider} (openai | anthropic)
 * - Base URL: OpenAI-compatible endpoint, defaults to OpenRouter
 * - Model: {@code app.inference.model}
 * - Temperature / max tokens: sampling settings for the plan document
 * - Timeout / max attempts: per-call read timeout and bounded retries
 *
 * @see com.sentient.service.PlanAnalysisService
 */
@Configuration
@Slf4j
public class SpringAIConfig {

    @Value("${app.inference.provider:openai}")
    private String provider;

    @Value("${app.inference.base-url:https://openrouter.ai/api}")
    private String baseUrl;

    @Value("${app.inference.model:google/gemini-flash-1.5}")
    private String model;

    @Value("${app.inference.temperature:0.7}")
    private double temperature;

    @Value("${app.inference.max-tokens:2048}")
    private int maxTokens;

    @Value("${app.inference.timeout-ms:30000}")
    private long timeoutMs;

    @Value("${app.inference.max-attempts:2}")
    private int maxAttempts;

    @Bean
    public InferenceClientFactory inferenceClientFactory() {
        log.info("Configuring inference client factory: provider={}, model={}, baseUrl={}, timeoutMs={}, maxAttempts={}",
                provider, model, baseUrl, timeoutMs, maxAttempts);

        return new InferenceClientFactory(
                InferenceClientFactory.Provider.from(provider),
                baseUrl,
                model,
                temperature,
                maxTokens,
                Duration.ofMillis(timeoutMs),
                maxAttempts
        );
    }
}
