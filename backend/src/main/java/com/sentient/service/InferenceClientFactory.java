package com.sentient.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.anthropic.AnthropicChatModel;
import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.anthropic.api.AnthropicApi;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.openai.OpenAiChatModel;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.web.client.RestClient;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Builds and caches one {@link ChatClient} per inference API key.
 *
 * The key is only known once the secret bundle has been resolved, so clients
 * cannot be plain singleton beans. Clients are created on first use and reused
 * for the rest of the process.
 *
 * Providers:
 * <ul>
 *   <li>{@code openai} - any OpenAI-compatible endpoint (OpenRouter, Gemini's OpenAI surface)</li>
 *   <li>{@code anthropic} - Anthropic messages API</li>
 * </ul>
 *
 * @see com.sentient.config.SpringAIConfig
 */
@Slf4j
public class InferenceClientFactory {

    public enum Provider {
        OPENAI,
        ANTHROPIC;

        public static Provider from(String value) {
            if (value == null || value.isBlank()) {
                return OPENAI;
            }
            return Provider.valueOf(value.trim().toUpperCase(Locale.ROOT));
        }
    }

    private final Provider provider;
    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final int maxTokens;
    private final Duration timeout;
    private final int maxAttempts;

    private final Map<String, ChatClient> clients = new ConcurrentHashMap<>();

    public InferenceClientFactory(
            Provider provider,
            String baseUrl,
            String model,
            double temperature,
            int maxTokens,
            Duration timeout,
            int maxAttempts
    ) {
        this.provider = provider;
        this.baseUrl = baseUrl;
        this.model = model;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
        this.timeout = timeout;
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    /**
     * Get the chat client bound to the given key, creating it on first use.
     *
     * @param apiKey inference API key, must not be blank
     * @return cached chat client
     */
    public ChatClient clientFor(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalArgumentException("Inference API key cannot be blank");
        }
        return clients.computeIfAbsent(apiKey, key -> ChatClient.create(createModel(key)));
    }

    public String getModel() {
        return model;
    }

    private ChatModel createModel(String apiKey) {
        log.info("Configuring inference ChatModel: provider={}, model={}, baseUrl={}", provider, model, baseUrl);

        RestClient.Builder restClientBuilder = RestClient.builder().requestFactory(requestFactory());
        RetryTemplate retryTemplate = RetryTemplate.builder()
                .maxAttempts(maxAttempts)
                .fixedBackoff(500)
                .build();

        if (provider == Provider.ANTHROPIC) {
            AnthropicApi anthropicApi = AnthropicApi.builder()
                    .baseUrl(baseUrl)
                    .apiKey(apiKey)
                    .restClientBuilder(restClientBuilder)
                    .build();

            AnthropicChatOptions options = AnthropicChatOptions.builder()
                    .model(model)
                    .temperature(temperature)
                    .maxTokens(maxTokens)
                    .build();

            return AnthropicChatModel.builder()
                    .anthropicApi(anthropicApi)
                    .defaultOptions(options)
                    .retryTemplate(retryTemplate)
                    .build();
        }

        OpenAiApi openAiApi = OpenAiApi.builder()
                .baseUrl(baseUrl)
                .apiKey(apiKey)
                .restClientBuilder(restClientBuilder)
                .build();

        OpenAiChatOptions options = OpenAiChatOptions.builder()
                .model(model)
                .temperature(temperature)
                .maxTokens(maxTokens)
                .build();

        return OpenAiChatModel.builder()
                .openAiApi(openAiApi)
                .defaultOptions(options)
                .retryTemplate(retryTemplate)
                .build();
    }

    private SimpleClientHttpRequestFactory requestFactory() {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeout);
        factory.setReadTimeout(timeout);
        return factory;
    }
}
