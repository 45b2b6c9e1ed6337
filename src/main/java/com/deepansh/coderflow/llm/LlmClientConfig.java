package com.deepansh.coderflow.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the active model client from llm.provider (groq | openai | gemini).
 * All three speak the OpenAI chat-completions dialect, so one client class serves them.
 */
@Configuration
@Slf4j
public class LlmClientConfig {

    @Value("${llm.provider:groq}")
    private String provider;

    // OpenAI
    @Value("${openai.api-key:}") private String openAiKey;
    @Value("${openai.base-url:https://api.openai.com/v1}") private String openAiBaseUrl;
    @Value("${openai.model:gpt-4o-mini}") private String openAiModel;
    @Value("${openai.max-tokens:2048}") private int openAiMaxTokens;
    @Value("${openai.temperature:0.2}") private double openAiTemp;

    // Groq
    @Value("${groq.api-key:}") private String groqKey;
    @Value("${groq.base-url:https://api.groq.com/openai/v1}") private String groqBaseUrl;
    @Value("${groq.model:llama-3.3-70b-versatile}") private String groqModel;
    @Value("${groq.max-tokens:2048}") private int groqMaxTokens;
    @Value("${groq.temperature:0.2}") private double groqTemp;

    // Gemini
    @Value("${gemini.api-key:}") private String geminiKey;
    @Value("${gemini.base-url:https://generativelanguage.googleapis.com/v1beta/openai}") private String geminiBaseUrl;
    @Value("${gemini.model:gemini-2.0-flash}") private String geminiModel;
    @Value("${gemini.max-tokens:2048}") private int geminiMaxTokens;
    @Value("${gemini.temperature:0.2}") private double geminiTemp;

    @PostConstruct
    public void logActiveProvider() {
        log.info("Active LLM provider: {} [model={}]", provider.toUpperCase(), activeModel());
    }

    /**
     * The raw client for the configured provider. Callers get it through
     * {@code ResilientLlmClient}, which adds retry and circuit breaking.
     */
    @Bean("activeLlmClient")
    public LlmClient activeLlmClient(ObjectMapper objectMapper, RestClient.Builder builder) {
        return switch (provider.toLowerCase()) {
            case "openai" -> {
                logKey("OPENAI", openAiKey, "OPENAI_API_KEY");
                yield new GenericLlmClient(props(openAiKey, openAiBaseUrl, openAiModel, openAiMaxTokens, openAiTemp),
                        objectMapper, "openai", builder.clone());
            }
            case "gemini" -> {
                logKey("GEMINI", geminiKey, "GEMINI_API_KEY");
                yield new GenericLlmClient(props(geminiKey, geminiBaseUrl, geminiModel, geminiMaxTokens, geminiTemp),
                        objectMapper, "gemini", builder.clone());
            }
            default -> { // groq
                logKey("GROQ", groqKey, "GROQ_API_KEY");
                yield new GenericLlmClient(props(groqKey, groqBaseUrl, groqModel, groqMaxTokens, groqTemp),
                        objectMapper, "groq", builder.clone());
            }
        };
    }

    private static LlmProviderProperties props(String key, String baseUrl, String model,
                                               int maxTokens, double temperature) {
        LlmProviderProperties p = new LlmProviderProperties();
        p.setApiKey(key);
        p.setBaseUrl(baseUrl);
        p.setModel(model);
        p.setMaxTokens(maxTokens);
        p.setTemperature(temperature);
        return p;
    }

    private String activeModel() {
        return switch (provider.toLowerCase()) {
            case "openai" -> openAiModel;
            case "gemini" -> geminiModel;
            default -> groqModel;
        };
    }

    private void logKey(String name, String key, String envVar) {
        if (key == null || key.isBlank()) {
            log.error("{} API key not set! Set env var: {}", name, envVar);
        } else {
            log.info("{} key: {}...{}", name, key.substring(0, Math.min(4, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
