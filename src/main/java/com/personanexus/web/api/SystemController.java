/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.web.api;

import com.personanexus.admin.AuditEntry;
import com.personanexus.admin.AuditTrail;
import com.personanexus.admin.ChannelAdminService;
import com.personanexus.admin.PersonaSummary;
import com.personanexus.ai.FallbackChainCompletionClient;
import com.personanexus.ai.ProviderDiagnostic;
import com.personanexus.utils.LoggerUtil;
import io.javalin.http.Context;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Service-wide endpoints: health, persona catalog, audit trail and provider diagnostics.
 */
public class SystemController {
    private static final int DEFAULT_AUDIT_LIMIT = 50;
    private static final int MAX_AUDIT_LIMIT = 500;

    private final ChannelAdminService adminService;
    private final AuditTrail auditTrail;
    private final FallbackChainCompletionClient completionChain;

    public SystemController(ChannelAdminService adminService, AuditTrail auditTrail,
                            FallbackChainCompletionClient completionChain) {
        this.adminService = adminService;
        this.auditTrail = auditTrail;
        this.completionChain = completionChain;
    }

    /**
     * GET /api/health
     */
    public void health(Context ctx) {
        ctx.json(new HealthResponse("OK", System.currentTimeMillis(), completionChain.providerNames()));
    }

    /**
     * GET /api/personas
     */
    public void listPersonas(Context ctx) {
        List<PersonaSummary> personas = adminService.listPersonas();
        ctx.json(new PersonaListResponse(personas, personas.size()));
    }

    /**
     * GET /api/audit/recent?limit=n
     */
    public void recentAudit(Context ctx) {
        try {
            String limitParam = ctx.queryParam("limit");
            int limit = Math.min(Math.max(Integer.parseInt(limitParam != null ? limitParam : String.valueOf(DEFAULT_AUDIT_LIMIT)), 1), MAX_AUDIT_LIMIT);

            List<AuditEntryView> entries = auditTrail.recent(limit).stream()
                    .map(AuditEntryView::of)
                    .collect(Collectors.toList());
            ctx.json(new AuditResponse(entries, auditTrail.size(), auditTrail.getCapacity()));
        } catch (NumberFormatException e) {
            ctx.status(400).json(SharedErrorResponse.badRequest("Invalid limit parameter"));
        }
    }

    /**
     * POST /api/providers/diagnostics?reorder=true
     *
     * Probes every provider; with reorder=true the chain is reordered by the results.
     */
    public void runDiagnostics(Context ctx) {
        try {
            boolean reorder = Boolean.parseBoolean(ctx.queryParam("reorder"));
            List<ProviderDiagnostic> results = completionChain.diagnose();
            List<String> order = reorder ? completionChain.reorderByLatency(results) : completionChain.providerNames();
            ctx.json(new DiagnosticsResponse(results, order, reorder));
        } catch (Exception e) {
            LoggerUtil.error("Provider diagnostics failed: " + e.getMessage());
            ctx.status(500).json(SharedErrorResponse.serverError("Provider diagnostics failed"));
        }
    }

    public record HealthResponse(String status, long timestamp, List<String> providers) {}

    public record PersonaListResponse(List<PersonaSummary> personas, int count) {}

    public record AuditEntryView(String timestamp, String type, String scope, String actor, String summary) {
        static AuditEntryView of(AuditEntry entry) {
            return new AuditEntryView(entry.timestamp().toString(), entry.type().name(), entry.scope(),
                    entry.actor(), entry.summary());
        }
    }

    public record AuditResponse(List<AuditEntryView> entries, int size, int capacity) {}

    public record DiagnosticsResponse(List<ProviderDiagnostic> results, List<String> order, boolean reordered) {}
}
