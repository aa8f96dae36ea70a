/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.chat;

import com.personanexus.admin.AuditEntry;
import com.personanexus.admin.AuditTrail;
import com.personanexus.ai.CompletionClient;
import com.personanexus.ai.CompletionResult;
import com.personanexus.engine.InboundMessage;
import com.personanexus.engine.MemoryManager;
import com.personanexus.engine.PersonaScoring;
import com.personanexus.engine.PersonaSelector;
import com.personanexus.engine.ReentrancyGuard;
import com.personanexus.engine.TriggerEvaluator;
import com.personanexus.persona.PersonaDefinition;
import com.personanexus.state.ChannelConfig;
import com.personanexus.state.ChannelScope;
import com.personanexus.state.ChannelStateManager;
import com.personanexus.state.Turn;
import com.personanexus.utils.LoggerUtil;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Handles one inbound message end to end: deduplicate, decide whether to answer,
 * pick a persona, ask the completion backend, record the exchange and build the reply.
 *
 * <p>Messages in different scopes are processed in parallel. Within one scope each
 * message's read-history, complete, record-exchange sequence runs only after the
 * previous message's has finished, so two messages cannot interleave their turns.
 * A failed or slow completion never surfaces as an error: the fallback text is sent
 * and recorded instead.
 */
public class ConversationEngine implements AutoCloseable {

    public static final String DEFAULT_FALLBACK_REPLY = "(pseudo) i'm on fallback juice, here's a quick take.";
    public static final long DEFAULT_COMPLETION_TIMEOUT_MS = 30000;

    private final ChannelStateManager stateManager;
    private final TriggerEvaluator triggerEvaluator;
    private final PersonaSelector personaSelector;
    private final MemoryManager memoryManager;
    private final CompletionClient completionClient;
    private final ReentrancyGuard guard;
    private final AuditTrail auditTrail;
    private final long completionTimeoutMs;
    private final String fallbackReply;

    private final ExecutorService workerExecutor;
    private final ExecutorService completionExecutor;
    private final ConcurrentHashMap<String, CompletableFuture<?>> scopeTails = new ConcurrentHashMap<>();

    public ConversationEngine(ChannelStateManager stateManager,
                              TriggerEvaluator triggerEvaluator,
                              PersonaSelector personaSelector,
                              MemoryManager memoryManager,
                              CompletionClient completionClient,
                              ReentrancyGuard guard,
                              AuditTrail auditTrail,
                              int workerThreads,
                              long completionTimeoutMs,
                              String fallbackReply) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("engine.worker.threads must be at least 1, got " + workerThreads);
        }
        if (completionTimeoutMs <= 0) {
            throw new IllegalArgumentException("completion.timeout.ms must be positive, got " + completionTimeoutMs);
        }
        this.stateManager = stateManager;
        this.triggerEvaluator = triggerEvaluator;
        this.personaSelector = personaSelector;
        this.memoryManager = memoryManager;
        this.completionClient = completionClient;
        this.guard = guard;
        this.auditTrail = auditTrail;
        this.completionTimeoutMs = completionTimeoutMs;
        this.fallbackReply = fallbackReply == null || fallbackReply.isBlank() ? DEFAULT_FALLBACK_REPLY : fallbackReply;
        this.workerExecutor = Executors.newFixedThreadPool(workerThreads, namedThreads("engine-worker"));
        this.completionExecutor = Executors.newCachedThreadPool(namedThreads("engine-completion"));

        LoggerUtil.info("ConversationEngine initialized: workers=" + workerThreads
                + ", completionTimeoutMs=" + completionTimeoutMs + ", provider=" + completionClient.name());
    }

    /**
     * Handle a message on the engine's worker pool.
     *
     * <p>Messages for the same scope run one after another in arrival order. A message
     * waiting for its turn holds no worker thread, so a busy scope cannot starve others.
     */
    public CompletableFuture<Optional<BotReply>> handleAsync(InboundMessage message) {
        if (message.authorIsBot()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }

        Optional<ReentrancyGuard.Admission> admitted = guard.admit(message.messageId());
        if (admitted.isEmpty()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        ReentrancyGuard.Admission admission = admitted.get();

        CompletableFuture<Optional<BotReply>> reply;
        try {
            // Messages that cannot trigger under the current settings are dropped without queueing
            if (!triggerEvaluator.shouldRespond(message, stateManager.getConfig(message.scope()))) {
                admission.close();
                return CompletableFuture.completedFuture(Optional.empty());
            }
            reply = runInScope(message.scope(), () -> respond(message));
        } catch (RuntimeException e) {
            admission.close();
            LoggerUtil.error("Failed to queue message " + message.messageId(), e);
            return CompletableFuture.completedFuture(Optional.empty());
        }

        return reply
                .whenComplete((result, ex) -> admission.close())
                .exceptionally(ex -> {
                    LoggerUtil.error("Unhandled failure processing message " + message.messageId(), ex);
                    return Optional.empty();
                });
    }

    /**
     * Handle a message and wait for the outcome.
     *
     * @return the reply to post, or empty if the bot stays silent
     */
    public Optional<BotReply> handle(InboundMessage message) {
        return handleAsync(message).join();
    }

    /**
     * Number of scopes with queued or running work.
     */
    public int activeScopeCount() {
        return scopeTails.size();
    }

    // Runs once earlier work for the scope has finished, so settings are read fresh here.
    private Optional<BotReply> respond(InboundMessage message) {
        ChannelScope scope = message.scope();
        ChannelConfig config = stateManager.getConfig(scope);
        if (!triggerEvaluator.shouldRespond(message, config)) {
            LoggerUtil.debug(() -> "Message " + message.messageId() + " no longer triggers in " + scope + ", skipping");
            return Optional.empty();
        }

        BotReply reply = generateAndRecord(message, config);

        if (config.auditEnabled()) {
            auditTrail.record(AuditEntry.autoReply(scope.key(), message.authorId(),
                    reply.personaKey() + " replied via " + (reply.isFallback() ? "fallback" : reply.provider())));
        }
        return Optional.of(reply);
    }

    /**
     * Chain a task behind the scope's previous task. The tail entry is dropped once the
     * last queued task for the scope finishes.
     */
    private <T> CompletableFuture<T> runInScope(ChannelScope scope, Supplier<T> task) {
        String key = scope.key();
        CompletableFuture<T> result = new CompletableFuture<>();
        CompletableFuture<?> previous = scopeTails.put(key, result);
        CompletableFuture<?> ready = previous != null ? previous : CompletableFuture.completedFuture(null);

        ready.handle((ignored, error) -> (Void) null)
                .thenApplyAsync(v -> task.get(), workerExecutor)
                .whenComplete((value, error) -> {
                    scopeTails.remove(key, result);
                    if (error != null) {
                        result.completeExceptionally(error);
                    } else {
                        result.complete(value);
                    }
                });
        return result;
    }

    private BotReply generateAndRecord(InboundMessage message, ChannelConfig config) {
        ChannelScope scope = message.scope();
        long startTime = System.currentTimeMillis();

        PersonaScoring scoring = personaSelector.selectPersona(message, config, memoryManager.getMemory(scope));
        PersonaDefinition persona = scoring.persona();

        String replyText = fallbackReply;
        String provider = null;
        try {
            List<Turn> conversation = memoryManager.buildConversation(scope, message.text());
            CompletionResult result = completeBounded(persona.getSystemPrompt(), conversation);
            if (result.isSuccess()) {
                replyText = result.text().orElse(fallbackReply);
                provider = result.provider();
            } else {
                LoggerUtil.warn(String.format("Completion failed for %s (%s): %s, using fallback reply",
                        scope, result.failureKind().orElse(null), result.detail()));
            }
        } catch (RuntimeException e) {
            LoggerUtil.error("Reply generation failed for " + scope + ", using fallback reply", e);
        }

        memoryManager.recordExchange(scope, message.text(), replyText);

        long elapsedMs = System.currentTimeMillis() - startTime;
        LoggerUtil.info(String.format("Reply in %s by %s%s in %dms", scope, persona.getKey(),
                scoring.locked() ? " (locked)" : "", elapsedMs));
        return BotReply.of(persona, replyText, provider);
    }

    private CompletionResult completeBounded(String systemPrompt, List<Turn> conversation) {
        return CompletableFuture.supplyAsync(() -> completionClient.complete(systemPrompt, conversation), completionExecutor)
                .orTimeout(completionTimeoutMs, TimeUnit.MILLISECONDS)
                .exceptionally(ex -> {
                    Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
                    if (cause instanceof TimeoutException) {
                        return CompletionResult.failure(CompletionResult.FailureKind.TIMEOUT,
                                "no completion within " + completionTimeoutMs + "ms", completionClient.name());
                    }
                    return CompletionResult.failure(CompletionResult.FailureKind.TRANSPORT_ERROR,
                            cause.getClass().getSimpleName() + ": " + cause.getMessage(), completionClient.name());
                })
                .join();
    }

    public String getFallbackReply() {
        return fallbackReply;
    }

    @Override
    public void close() {
        workerExecutor.shutdown();
        completionExecutor.shutdownNow();
        try {
            if (!workerExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        LoggerUtil.info("ConversationEngine stopped");
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
