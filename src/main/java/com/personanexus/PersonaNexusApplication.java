/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus;

import com.personanexus.admin.AuditTrail;
import com.personanexus.admin.ChannelAdminService;
import com.personanexus.ai.FallbackChainCompletionClient;
import com.personanexus.chat.ConversationEngine;
import com.personanexus.engine.MemoryManager;
import com.personanexus.engine.PersonaSelector;
import com.personanexus.engine.ReentrancyGuard;
import com.personanexus.engine.TriggerEvaluator;
import com.personanexus.persona.PersonaRegistry;
import com.personanexus.state.ChannelStateManager;
import com.personanexus.utils.LoggerUtil;
import com.personanexus.web.PersonaNexusWebServer;
import com.personanexus.web.api.ChannelAdminController;
import com.personanexus.web.api.MessageController;
import com.personanexus.web.api.SystemController;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;

/**
 * Launcher: loads configuration, wires the engine and starts the web server.
 */
public class PersonaNexusApplication {

    private static PersonaNexusWebServer webServer;
    private static ConversationEngine engine;
    private static FallbackChainCompletionClient completionChain;
    private static final CountDownLatch shutdownLatch = new CountDownLatch(1);

    public static void main(String[] args) {
        try {
            Properties config = loadConfiguration();
            LoggerUtil.setDebugEnabled(Boolean.parseBoolean(config.getProperty("logging.debug", "false").trim()));

            PersonaRegistry registry = PersonaRegistry.loadDefault();
            ChannelStateManager stateManager = ChannelStateManager.fromProperties(config);
            MemoryManager memoryManager = new MemoryManager(stateManager);
            AuditTrail auditTrail = AuditTrail.fromProperties(config);
            completionChain = FallbackChainCompletionClient.fromProperties(config);

            engine = new ConversationEngine(
                    stateManager,
                    new TriggerEvaluator(registry, config.getProperty("bot.user.id")),
                    new PersonaSelector(registry),
                    memoryManager,
                    completionChain,
                    new ReentrancyGuard(),
                    auditTrail,
                    Integer.parseInt(config.getProperty("engine.worker.threads", "4").trim()),
                    Long.parseLong(config.getProperty("completion.timeout.ms",
                            String.valueOf(ConversationEngine.DEFAULT_COMPLETION_TIMEOUT_MS)).trim()),
                    config.getProperty("engine.fallback.reply"));

            ChannelAdminService adminService = new ChannelAdminService(stateManager, registry, memoryManager, auditTrail);

            webServer = new PersonaNexusWebServer(
                    new MessageController(engine),
                    new ChannelAdminController(adminService, memoryManager),
                    new SystemController(adminService, auditTrail, completionChain));
            webServer.start(Integer.parseInt(config.getProperty("web.port", "5300").trim()));

            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                LoggerUtil.info("Shutting down Persona Nexus...");
                shutdown();
            }));

            LoggerUtil.info("Persona Nexus started with " + registry.size() + " personas");

            shutdownLatch.await();

        } catch (Exception e) {
            LoggerUtil.error("Failed to start Persona Nexus: " + e.getMessage(), e);
            System.exit(1);
        }
    }

    /**
     * Classpath defaults, overridden by {@code resources/application.properties} when present.
     */
    static Properties loadConfiguration() throws IOException {
        Properties config = new Properties();

        try (InputStream inputStream = PersonaNexusApplication.class.getClassLoader()
                .getResourceAsStream("application.properties")) {
            if (inputStream == null) {
                throw new IOException("application.properties not found in classpath");
            }
            config.load(inputStream);
        }

        Path externalConfigPath = Paths.get("resources", "application.properties");
        if (Files.exists(externalConfigPath)) {
            LoggerUtil.info("Loading configuration overrides from " + externalConfigPath.toAbsolutePath());
            try (InputStream inputStream = Files.newInputStream(externalConfigPath)) {
                Properties externalConfig = new Properties();
                externalConfig.load(inputStream);
                config.putAll(externalConfig);
                LoggerUtil.info("Applied " + externalConfig.size() + " configuration overrides");
            } catch (IOException e) {
                LoggerUtil.warn("Failed to load configuration overrides: " + e.getMessage());
            }
        }

        return config;
    }

    private static void shutdown() {
        try {
            if (webServer != null) {
                webServer.stop();
            }
            if (engine != null) {
                engine.close();
            }
            if (completionChain != null) {
                completionChain.close();
            }
            LoggerUtil.info("Persona Nexus shutdown complete");
        } catch (Exception e) {
            LoggerUtil.error("Error during shutdown: " + e.getMessage());
        } finally {
            shutdownLatch.countDown();
        }
    }
}
