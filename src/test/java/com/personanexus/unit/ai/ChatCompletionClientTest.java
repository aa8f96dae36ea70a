/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.unit.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.personanexus.ai.ChatCompletionClient;
import com.personanexus.ai.ChatCompletionRequest;
import com.personanexus.ai.CompletionResult;
import com.personanexus.state.Turn;
import com.personanexus.utils.JacksonConfig;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ChatCompletionClient against a local stub of the completions endpoint.
 */
class ChatCompletionClientTest {

    private static final String OK_BODY =
            "{\"model\":\"stub\",\"choices\":[{\"index\":0,\"message\":{\"role\":\"assistant\",\"content\":\"  the realm answers  \"},\"finish_reason\":\"stop\"}]}";

    private Javalin stub;
    private volatile int status = 200;
    private volatile String responseBody = OK_BODY;
    private volatile long delayMs = 0;
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private final AtomicReference<String> lastAuthorization = new AtomicReference<>();

    private ChatCompletionClient client;

    @BeforeEach
    void setUp() {
        stub = Javalin.create(config -> config.showJavalinBanner = false)
                .post("/v1/chat/completions", ctx -> {
                    lastRequest.set(ctx.body());
                    lastAuthorization.set(ctx.header("Authorization"));
                    if (delayMs > 0) {
                        Thread.sleep(delayMs);
                    }
                    ctx.status(status).contentType("application/json").result(responseBody);
                })
                .start(0);
        client = new ChatCompletionClient("stub", baseUrl(), "test-key", "stub-model", 2000);
    }

    @AfterEach
    void tearDown() throws Exception {
        client.close();
        stub.stop();
    }

    private String baseUrl() {
        return "http://localhost:" + stub.port() + "/v1";
    }

    private static List<Turn> conversation() {
        return List.of(Turn.user("hi"), Turn.assistant("hello"), Turn.user("what is fate?"));
    }

    @Test
    void shouldReturnTrimmedContentOnSuccess() {
        CompletionResult result = client.complete("You are a narrator.", conversation());

        assertTrue(result.isSuccess(), "Expected success but got " + result);
        assertEquals("the realm answers", result.text().orElseThrow());
        assertEquals("stub", result.provider());
    }

    @Test
    void shouldSendSystemPromptFirstThenConversationInOrder() throws Exception {
        client.complete("You are a narrator.", conversation());

        JsonNode request = JacksonConfig.mapper().readTree(lastRequest.get());
        JsonNode messages = request.get("messages");
        assertEquals("stub-model", request.get("model").asText());
        assertEquals(4, messages.size());
        assertEquals("system", messages.get(0).get("role").asText());
        assertEquals("You are a narrator.", messages.get(0).get("content").asText());
        assertEquals("user", messages.get(1).get("role").asText());
        assertEquals("assistant", messages.get(2).get("role").asText());
        assertEquals("what is fate?", messages.get(3).get("content").asText());
        assertEquals("Bearer test-key", lastAuthorization.get());
    }

    @Test
    void shouldClassifyNon2xxAsHttpError() {
        status = 503;
        responseBody = "{\"error\":\"overloaded\"}";

        CompletionResult result = client.complete("prompt", conversation());

        assertFalse(result.isSuccess());
        assertEquals(CompletionResult.FailureKind.HTTP_ERROR, result.failureKind().orElseThrow());
        assertTrue(result.detail().contains("503"));
    }

    @Test
    void shouldClassifyMissingChoicesAsEmptyResponse() {
        responseBody = "{\"choices\":[]}";

        CompletionResult result = client.complete("prompt", conversation());

        assertEquals(CompletionResult.FailureKind.EMPTY_RESPONSE, result.failureKind().orElseThrow());
    }

    @Test
    void shouldClassifyBlankContentAsEmptyResponse() {
        responseBody = "{\"choices\":[{\"message\":{\"role\":\"assistant\",\"content\":\"   \"}}]}";

        assertEquals(CompletionResult.FailureKind.EMPTY_RESPONSE,
                client.complete("prompt", conversation()).failureKind().orElseThrow());
    }

    @Test
    void shouldClassifyUnparseableBodyAsEmptyResponse() {
        responseBody = "<html>gateway</html>";

        assertEquals(CompletionResult.FailureKind.EMPTY_RESPONSE,
                client.complete("prompt", conversation()).failureKind().orElseThrow());
    }

    @Test
    void shouldClassifySlowBackendAsTimeout() throws Exception {
        delayMs = 1500;
        try (ChatCompletionClient impatient = new ChatCompletionClient("slow", baseUrl(), null, "m", 300)) {
            CompletionResult result = impatient.complete("prompt", conversation());

            assertEquals(CompletionResult.FailureKind.TIMEOUT, result.failureKind().orElseThrow());
        }
    }

    @Test
    void shouldClassifyRefusedConnectionAsTransportError() throws Exception {
        try (ChatCompletionClient unreachable = new ChatCompletionClient("down", "http://127.0.0.1:1/v1", null, "m", 1000)) {
            CompletionResult result = unreachable.complete("prompt", conversation());

            assertEquals(CompletionResult.FailureKind.TRANSPORT_ERROR, result.failureKind().orElseThrow());
        }
    }

    @Test
    void disabledProviderShouldNotCallBackend() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("completion.provider.off.base.url", baseUrl());
        properties.setProperty("completion.provider.off.enabled", "false");

        try (ChatCompletionClient disabled = new ChatCompletionClient("off", properties)) {
            CompletionResult result = disabled.complete("prompt", conversation());

            assertEquals(CompletionResult.FailureKind.DISABLED, result.failureKind().orElseThrow());
            assertNull(lastRequest.get(), "Disabled provider must not send a request");
        }
    }

    @Test
    void shouldReadSettingsFromProperties() throws Exception {
        Properties properties = new Properties();
        properties.setProperty("completion.provider.p1.base.url", baseUrl() + "/");
        properties.setProperty("completion.provider.p1.model", "custom-model");
        properties.setProperty("completion.provider.p1.max.tokens", "64");
        properties.setProperty("completion.provider.p1.temperature", "0.2");

        try (ChatCompletionClient configured = new ChatCompletionClient("p1", properties)) {
            ChatCompletionRequest request = configured.createRequest("sys", List.of(Turn.user("x")));

            assertEquals("custom-model", request.getModel());
            assertEquals(64, request.getMaxTokens());
            assertEquals(0.2, request.getTemperature());
            assertTrue(configured.complete("sys", List.of(Turn.user("x"))).isSuccess(),
                    "Trailing slash in base URL should be tolerated");
            assertNull(lastAuthorization.get(), "No Authorization header without an API key");
        }
    }

    @Test
    void shouldRequireBaseUrl() {
        Properties properties = new Properties();

        assertThrows(IllegalArgumentException.class, () -> new ChatCompletionClient("missing", properties));
    }
}
