/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.unit.web.api;

import com.personanexus.admin.AuditEntry;
import com.personanexus.admin.AuditTrail;
import com.personanexus.admin.ChannelAdminService;
import com.personanexus.ai.CompletionResult;
import com.personanexus.ai.FallbackChainCompletionClient;
import com.personanexus.ai.ProviderDiagnostic;
import com.personanexus.engine.MemoryManager;
import com.personanexus.persona.PersonaRegistry;
import com.personanexus.state.ChannelStateManager;
import com.personanexus.state.InMemoryStateStore;
import com.personanexus.web.api.SharedErrorResponse;
import com.personanexus.web.api.SystemController;
import com.personanexus.web.api.SystemController.AuditResponse;
import com.personanexus.web.api.SystemController.DiagnosticsResponse;
import com.personanexus.web.api.SystemController.HealthResponse;
import com.personanexus.web.api.SystemController.PersonaListResponse;
import io.javalin.http.Context;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for SystemController.
 */
@DisplayName("System Controller Tests")
class SystemControllerTest {

    @Mock
    private Context ctx;

    @Mock
    private FallbackChainCompletionClient completionChain;

    private AuditTrail auditTrail;
    private SystemController controller;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        ChannelStateManager stateManager = new ChannelStateManager(new InMemoryStateStore<>(),
                new InMemoryStateStore<>(), 10);
        auditTrail = new AuditTrail(5);
        ChannelAdminService adminService = new ChannelAdminService(stateManager, PersonaRegistry.loadDefault(),
                new MemoryManager(stateManager), auditTrail);
        controller = new SystemController(adminService, auditTrail, completionChain);
        when(ctx.status(anyInt())).thenReturn(ctx);
    }

    private <T> T capturedJson(Class<T> type) {
        ArgumentCaptor<Object> captor = ArgumentCaptor.forClass(Object.class);
        verify(ctx).json(captor.capture());
        assertInstanceOf(type, captor.getValue());
        return type.cast(captor.getValue());
    }

    @Test
    @DisplayName("Health should list configured providers")
    void healthShouldListProviders() {
        when(completionChain.providerNames()).thenReturn(List.of("primary", "backup"));

        controller.health(ctx);

        HealthResponse health = capturedJson(HealthResponse.class);
        assertEquals("OK", health.status());
        assertEquals(List.of("primary", "backup"), health.providers());
    }

    @Test
    @DisplayName("Should list the persona catalog")
    void shouldListPersonas() {
        controller.listPersonas(ctx);

        PersonaListResponse response = capturedJson(PersonaListResponse.class);
        assertEquals(10, response.count());
        assertEquals(response.count(), response.personas().size());
    }

    @Test
    @DisplayName("Audit listing should honor limit and render ISO timestamps")
    void auditShouldHonorLimit() {
        // Given
        auditTrail.record(AuditEntry.adminAction("c1", "admin", "first"));
        auditTrail.record(AuditEntry.adminAction("c1", "admin", "second"));
        when(ctx.queryParam("limit")).thenReturn("1");

        // When
        controller.recentAudit(ctx);

        // Then
        AuditResponse response = capturedJson(AuditResponse.class);
        assertEquals(1, response.entries().size());
        assertEquals("second", response.entries().get(0).summary());
        assertEquals(2, response.size());
        assertEquals(5, response.capacity());
        assertTrue(response.entries().get(0).timestamp().endsWith("Z"), "Timestamp should be ISO-8601 UTC");
    }

    @Test
    @DisplayName("Audit listing should answer 400 for a non-numeric limit")
    void auditShouldRejectBadLimit() {
        when(ctx.queryParam("limit")).thenReturn("lots");

        controller.recentAudit(ctx);

        verify(ctx).status(400);
        verify(ctx).json(any(SharedErrorResponse.class));
    }

    @Test
    @DisplayName("Diagnostics with reorder should apply the new order")
    void diagnosticsShouldReorder() {
        // Given
        List<ProviderDiagnostic> results = List.of(
                new ProviderDiagnostic("primary", false, 900, CompletionResult.FailureKind.TIMEOUT, "timed out"),
                new ProviderDiagnostic("backup", true, 120, null, null));
        when(completionChain.diagnose()).thenReturn(results);
        when(completionChain.reorderByLatency(results)).thenReturn(List.of("backup", "primary"));
        when(ctx.queryParam("reorder")).thenReturn("true");

        // When
        controller.runDiagnostics(ctx);

        // Then
        DiagnosticsResponse response = capturedJson(DiagnosticsResponse.class);
        assertTrue(response.reordered());
        assertEquals(List.of("backup", "primary"), response.order());
        assertEquals(results, response.results());
    }

    @Test
    @DisplayName("Diagnostics without reorder should leave the chain alone")
    void diagnosticsShouldNotReorderByDefault() {
        when(completionChain.diagnose()).thenReturn(List.of());
        when(completionChain.providerNames()).thenReturn(List.of("primary"));

        controller.runDiagnostics(ctx);

        verify(completionChain, never()).reorderByLatency(any());
        assertFalse(capturedJson(DiagnosticsResponse.class).reordered());
    }
}
