/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.web;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.personanexus.utils.LoggerUtil;
import com.personanexus.web.api.ChannelAdminController;
import com.personanexus.web.api.MessageController;
import com.personanexus.web.api.SharedErrorResponse;
import com.personanexus.web.api.SystemController;
import io.javalin.Javalin;

/**
 * HTTP surface of the service: the platform gateway endpoint plus the JSON admin API.
 */
public class PersonaNexusWebServer {
    private static final long MAX_REQUEST_BYTES = 64 * 1024;

    private final MessageController messageController;
    private final ChannelAdminController channelAdminController;
    private final SystemController systemController;
    private final Gson gson;
    private Javalin app;

    public PersonaNexusWebServer(MessageController messageController,
                                 ChannelAdminController channelAdminController,
                                 SystemController systemController) {
        this.messageController = messageController;
        this.channelAdminController = channelAdminController;
        this.systemController = systemController;
        this.gson = new GsonBuilder().disableHtmlEscaping().create();
    }

    /**
     * Starts the web server. Port 0 picks a free port; see {@link #port()}.
     */
    public void start(int port) {
        app = Javalin.create(javalinConfig -> {
            javalinConfig.jsonMapper(new GsonJsonMapper(gson));
            javalinConfig.http.maxRequestSize = MAX_REQUEST_BYTES;
            javalinConfig.showJavalinBanner = false;
        });

        configureRoutes();
        configureErrorHandlers();

        app.start(port);
        LoggerUtil.info("Persona Nexus web server started on port " + app.port());
    }

    public void stop() {
        if (app != null) {
            app.stop();
            LoggerUtil.info("Persona Nexus web server stopped");
        }
    }

    public int port() {
        if (app == null) {
            throw new IllegalStateException("Web server not started");
        }
        return app.port();
    }

    private void configureRoutes() {
        app.get("/api/health", systemController::health);

        // Platform gateway
        app.post("/api/messages", messageController::postMessage);

        app.get("/api/personas", systemController::listPersonas);

        // Per-scope administration
        app.get("/api/channels/{scope}/status", channelAdminController::getStatus);
        app.put("/api/channels/{scope}/lock", channelAdminController::lockPersona);
        app.delete("/api/channels/{scope}/lock", channelAdminController::unlockPersona);
        app.put("/api/channels/{scope}/enabled", channelAdminController::setEnabled);
        app.put("/api/channels/{scope}/audit", channelAdminController::setAuditEnabled);
        app.post("/api/channels/{scope}/reset", channelAdminController::reset);
        app.get("/api/channels/{scope}/memory", channelAdminController::getMemory);
        app.delete("/api/channels/{scope}/memory", channelAdminController::clearMemory);

        app.get("/api/audit/recent", systemController::recentAudit);
        app.post("/api/providers/diagnostics", systemController::runDiagnostics);
    }

    private void configureErrorHandlers() {
        app.exception(IllegalArgumentException.class, (e, ctx) -> {
            ctx.status(400).json(SharedErrorResponse.badRequest(e.getMessage()));
        });

        app.exception(Exception.class, (e, ctx) -> {
            LoggerUtil.error("Unhandled exception in web request " + ctx.path(), e);
            ctx.status(500).json(SharedErrorResponse.serverError(e.getMessage()));
        });

        app.error(404, ctx -> {
            ctx.json(SharedErrorResponse.notFound("API endpoint not found: " + ctx.path()));
        });
    }
}
