/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.personanexus.state.Turn;
import com.personanexus.utils.JacksonConfig;
import com.personanexus.utils.LoggerUtil;
import org.apache.hc.client5.http.classic.methods.HttpPost;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.classic.CloseableHttpClient;
import org.apache.hc.client5.http.impl.classic.HttpClients;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManager;
import org.apache.hc.client5.http.impl.io.PoolingHttpClientConnectionManagerBuilder;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.http.HttpEntity;
import org.apache.hc.core5.http.io.entity.StringEntity;
import org.apache.hc.core5.util.Timeout;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Properties;

/**
 * Client for an OpenAI-compatible {@code /chat/completions} endpoint.
 *
 * <p>Configured per provider name from {@code completion.provider.<name>.*} properties:
 * {@code base.url}, {@code api.key} (optional for local backends), {@code model},
 * {@code timeout.ms}, {@code enabled}, {@code max.tokens} and {@code temperature}.
 */
public class ChatCompletionClient implements CompletionClient, AutoCloseable {

    private static final String DEFAULT_MODEL = "gpt-4o-mini";
    private static final int DEFAULT_TIMEOUT_MS = 15000;
    private static final int DEFAULT_MAX_TOKENS = 800;
    private static final double DEFAULT_TEMPERATURE = 0.8;
    private static final int MAX_ERROR_BODY_CHARS = 200;

    private final String name;
    private final String baseUrl;
    private final String apiKey;
    private final String model;
    private final int timeoutMs;
    private final int maxTokens;
    private final double temperature;
    private final boolean enabled;
    private final CloseableHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public ChatCompletionClient(String name, Properties properties) {
        this(name,
             requireProperty(properties, prefix(name) + "base.url"),
             properties.getProperty(prefix(name) + "api.key"),
             properties.getProperty(prefix(name) + "model", DEFAULT_MODEL),
             Integer.parseInt(properties.getProperty(prefix(name) + "timeout.ms", String.valueOf(DEFAULT_TIMEOUT_MS)).trim()),
             Integer.parseInt(properties.getProperty(prefix(name) + "max.tokens", String.valueOf(DEFAULT_MAX_TOKENS)).trim()),
             Double.parseDouble(properties.getProperty(prefix(name) + "temperature", String.valueOf(DEFAULT_TEMPERATURE)).trim()),
             Boolean.parseBoolean(properties.getProperty(prefix(name) + "enabled", "true").trim()));
    }

    public ChatCompletionClient(String name, String baseUrl, String apiKey, String model, int timeoutMs) {
        this(name, baseUrl, apiKey, model, timeoutMs, DEFAULT_MAX_TOKENS, DEFAULT_TEMPERATURE, true);
    }

    public ChatCompletionClient(String name, String baseUrl, String apiKey, String model, int timeoutMs,
                                int maxTokens, double temperature, boolean enabled) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Provider name cannot be null or empty");
        }
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("Base URL for provider '" + name + "' cannot be null or empty");
        }
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeout.ms for provider '" + name + "' must be positive");
        }
        this.name = name;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
        this.model = model;
        this.timeoutMs = timeoutMs;
        this.maxTokens = maxTokens;
        this.temperature = temperature;
        this.enabled = enabled;
        this.objectMapper = JacksonConfig.mapper();

        PoolingHttpClientConnectionManager connectionManager = PoolingHttpClientConnectionManagerBuilder.create()
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(Timeout.ofMilliseconds(timeoutMs))
                        .setSocketTimeout(Timeout.ofMilliseconds(timeoutMs))
                        .build())
                .build();
        this.httpClient = HttpClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setResponseTimeout(Timeout.ofMilliseconds(timeoutMs))
                        .setConnectionRequestTimeout(Timeout.ofMilliseconds(timeoutMs))
                        .build())
                .build();

        LoggerUtil.info("ChatCompletionClient '" + name + "' initialized: enabled=" + enabled
                + ", model=" + model + ", baseUrl=" + this.baseUrl + ", timeoutMs=" + timeoutMs);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public CompletionResult complete(String systemPrompt, List<Turn> conversation) {
        if (!enabled) {
            LoggerUtil.debug(() -> "Provider '" + name + "' disabled, skipping call");
            return CompletionResult.failure(CompletionResult.FailureKind.DISABLED,
                    "provider disabled via configuration", name);
        }

        long startTime = System.currentTimeMillis();
        String requestJson;
        try {
            requestJson = objectMapper.writeValueAsString(createRequest(systemPrompt, conversation));
        } catch (JsonProcessingException e) {
            return CompletionResult.failure(CompletionResult.FailureKind.TRANSPORT_ERROR,
                    "could not encode request: " + e.getOriginalMessage(), name);
        }

        HttpPost post = new HttpPost(baseUrl + "/chat/completions");
        if (apiKey != null) {
            post.setHeader("Authorization", "Bearer " + apiKey);
        }
        post.setEntity(new StringEntity(requestJson, ContentType.APPLICATION_JSON));
        LoggerUtil.debug(() -> "[" + name + "] request: " + LoggerUtil.truncate(requestJson, 500));

        RawResponse raw;
        try {
            raw = httpClient.execute(post, httpResponse -> {
                HttpEntity entity = httpResponse.getEntity();
                String body = entity == null
                        ? ""
                        : new String(entity.getContent().readAllBytes(), StandardCharsets.UTF_8);
                return new RawResponse(httpResponse.getCode(), body);
            });
        } catch (InterruptedIOException e) {
            LoggerUtil.warn(String.format("[%s] request timed out after %dms", name, elapsed(startTime)));
            return CompletionResult.failure(CompletionResult.FailureKind.TIMEOUT,
                    "no response within " + timeoutMs + "ms", name);
        } catch (IOException e) {
            LoggerUtil.warn(String.format("[%s] request failed after %dms: %s", name, elapsed(startTime), e.getMessage()));
            return CompletionResult.failure(CompletionResult.FailureKind.TRANSPORT_ERROR,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), name);
        }

        if (raw.status() < 200 || raw.status() >= 300) {
            LoggerUtil.warn("[" + name + "] HTTP " + raw.status() + " - " + LoggerUtil.truncate(raw.body(), MAX_ERROR_BODY_CHARS));
            return CompletionResult.failure(CompletionResult.FailureKind.HTTP_ERROR,
                    "HTTP " + raw.status(), name);
        }

        String content = extractContent(raw.body());
        if (content == null || content.isBlank()) {
            LoggerUtil.warn("[" + name + "] response carried no content");
            return CompletionResult.failure(CompletionResult.FailureKind.EMPTY_RESPONSE,
                    "no content in response", name);
        }

        LoggerUtil.info(String.format("[%s] completion finished in %.1fs", name, elapsed(startTime) / 1000.0));
        return CompletionResult.success(content.trim(), name);
    }

    /**
     * Build the wire request: the system prompt first, then the conversation in order.
     */
    public ChatCompletionRequest createRequest(String systemPrompt, List<Turn> conversation) {
        ChatCompletionRequest request = new ChatCompletionRequest();
        request.setModel(model);
        request.setTemperature(temperature);
        request.setMaxTokens(maxTokens);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            request.addMessage("system", systemPrompt);
        }
        for (Turn turn : conversation) {
            request.addMessage(turn.role().getWireName(), turn.content());
        }
        return request;
    }

    private String extractContent(String body) {
        try {
            ChatCompletionResponse response = objectMapper.readValue(body, ChatCompletionResponse.class);
            return response != null ? response.firstContent() : null;
        } catch (JsonProcessingException e) {
            LoggerUtil.warn("[" + name + "] unparseable response: " + e.getOriginalMessage());
            return null;
        }
    }

    public String getModel() {
        return model;
    }

    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void close() throws IOException {
        LoggerUtil.info("Closing ChatCompletionClient '" + name + "'");
        httpClient.close();
    }

    private static long elapsed(long startTime) {
        return System.currentTimeMillis() - startTime;
    }

    private static String prefix(String name) {
        return "completion.provider." + name + ".";
    }

    private static String requireProperty(Properties properties, String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " must be configured in application.properties");
        }
        return value.trim();
    }

    private record RawResponse(int status, String body) {
    }
}
