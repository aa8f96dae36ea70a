/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.web.api;

import com.personanexus.admin.ChannelAdminService;
import com.personanexus.admin.ChannelStatus;
import com.personanexus.engine.MemoryManager;
import com.personanexus.state.ChannelScope;
import com.personanexus.state.Turn;
import com.personanexus.utils.LoggerUtil;
import io.javalin.http.Context;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Per-scope administrative endpoints. The scope path parameter is the canonical
 * key, {@code channel} or {@code guild:channel}. The acting admin is taken from the
 * {@code X-Actor} header and only used for the audit trail.
 */
public class ChannelAdminController {
    static final String ACTOR_HEADER = "X-Actor";

    private final ChannelAdminService adminService;
    private final MemoryManager memoryManager;

    public ChannelAdminController(ChannelAdminService adminService, MemoryManager memoryManager) {
        this.adminService = adminService;
        this.memoryManager = memoryManager;
    }

    /**
     * GET /api/channels/{scope}/status
     */
    public void getStatus(Context ctx) {
        handle(ctx, "get status", () -> adminService.getStatus(scope(ctx)));
    }

    /**
     * PUT /api/channels/{scope}/lock with body {"persona": "key"}
     */
    public void lockPersona(Context ctx) {
        handle(ctx, "lock persona", () -> {
            LockRequest request = ctx.bodyAsClass(LockRequest.class);
            if (request.persona() == null || request.persona().isBlank()) {
                throw new IllegalArgumentException("persona is required");
            }
            return adminService.lockPersona(scope(ctx), request.persona().trim(), actor(ctx));
        });
    }

    /**
     * DELETE /api/channels/{scope}/lock
     */
    public void unlockPersona(Context ctx) {
        handle(ctx, "unlock persona", () -> adminService.unlockPersona(scope(ctx), actor(ctx)));
    }

    /**
     * PUT /api/channels/{scope}/enabled with body {"enabled": bool}
     */
    public void setEnabled(Context ctx) {
        handle(ctx, "toggle listener", () -> adminService.setEnabled(scope(ctx), toggle(ctx), actor(ctx)));
    }

    /**
     * PUT /api/channels/{scope}/audit with body {"enabled": bool}
     */
    public void setAuditEnabled(Context ctx) {
        handle(ctx, "toggle audit", () -> adminService.setAuditEnabled(scope(ctx), toggle(ctx), actor(ctx)));
    }

    /**
     * POST /api/channels/{scope}/reset
     */
    public void reset(Context ctx) {
        handle(ctx, "reset", () -> adminService.reset(scope(ctx), actor(ctx)));
    }

    /**
     * GET /api/channels/{scope}/memory
     */
    public void getMemory(Context ctx) {
        try {
            ChannelScope scope = scope(ctx);
            List<TurnView> turns = memoryManager.getMemory(scope).getTurns().stream()
                    .map(TurnView::of)
                    .collect(Collectors.toList());
            ctx.json(new MemoryResponse(scope.key(), memoryManager.getMaxTurns(), turns));
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(SharedErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            LoggerUtil.error("Failed to read memory: " + e.getMessage());
            ctx.status(500).json(SharedErrorResponse.serverError("Failed to read memory"));
        }
    }

    /**
     * DELETE /api/channels/{scope}/memory
     */
    public void clearMemory(Context ctx) {
        handle(ctx, "clear memory", () -> adminService.clearMemory(scope(ctx), actor(ctx)));
    }

    private void handle(Context ctx, String operation, StatusAction action) {
        try {
            ctx.json(action.run());
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(SharedErrorResponse.badRequest(e.getMessage()));
        } catch (Exception e) {
            LoggerUtil.error("Failed to " + operation + ": " + e.getMessage());
            ctx.status(500).json(SharedErrorResponse.serverError("Failed to " + operation));
        }
    }

    private static ChannelScope scope(Context ctx) {
        return ChannelScope.parse(ctx.pathParam("scope"));
    }

    private static String actor(Context ctx) {
        return ctx.header(ACTOR_HEADER);
    }

    private static boolean toggle(Context ctx) {
        ToggleRequest request = ctx.bodyAsClass(ToggleRequest.class);
        if (request.enabled() == null) {
            throw new IllegalArgumentException("enabled is required");
        }
        return request.enabled();
    }

    @FunctionalInterface
    private interface StatusAction {
        ChannelStatus run();
    }

    public record LockRequest(String persona) {}

    public record ToggleRequest(Boolean enabled) {}

    public record TurnView(String role, String content) {
        static TurnView of(Turn turn) {
            return new TurnView(turn.role().getWireName(), turn.content());
        }
    }

    public record MemoryResponse(String scope, int maxTurns, List<TurnView> turns) {}
}
