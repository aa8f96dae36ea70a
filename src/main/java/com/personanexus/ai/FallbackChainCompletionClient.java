/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.ai;

import com.personanexus.state.Turn;
import com.personanexus.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Tries an ordered list of providers until one produces text.
 *
 * <p>The order can be changed at runtime from probe results with
 * {@link #reorderByLatency(List)}: healthy providers move to the front, fastest first.
 */
public class FallbackChainCompletionClient implements CompletionClient, AutoCloseable {

    static final String PROBE_SYSTEM_PROMPT = "You are a health check. Reply with one word.";
    static final String PROBE_MESSAGE = "ping";

    private volatile List<CompletionClient> providers;

    public FallbackChainCompletionClient(List<? extends CompletionClient> providers) {
        this.providers = List.copyOf(providers);
        LoggerUtil.info("FallbackChainCompletionClient initialized with providers: " + providerNames());
    }

    /**
     * Build the chain from {@code completion.providers}, a comma-separated list of
     * provider names each configured under {@code completion.provider.<name>.*}.
     */
    public static FallbackChainCompletionClient fromProperties(Properties properties) {
        String names = properties.getProperty("completion.providers", "").trim();
        List<CompletionClient> clients = new ArrayList<>();
        if (!names.isEmpty()) {
            for (String name : Arrays.asList(names.split(","))) {
                String trimmed = name.trim();
                if (!trimmed.isEmpty()) {
                    clients.add(new ChatCompletionClient(trimmed, properties));
                }
            }
        }
        if (clients.isEmpty()) {
            LoggerUtil.warn("No completion providers configured (completion.providers); every reply will use the fallback text");
        }
        return new FallbackChainCompletionClient(clients);
    }

    @Override
    public String name() {
        return "chain";
    }

    @Override
    public CompletionResult complete(String systemPrompt, List<Turn> conversation) {
        List<CompletionClient> snapshot = providers;
        if (snapshot.isEmpty()) {
            return CompletionResult.failure(CompletionResult.FailureKind.DISABLED, "no providers configured", name());
        }

        CompletionResult last = null;
        for (CompletionClient provider : snapshot) {
            CompletionResult result = provider.complete(systemPrompt, conversation);
            if (result.isSuccess()) {
                return result;
            }
            LoggerUtil.warn("Provider '" + provider.name() + "' failed (" + result.failureKind().orElse(null)
                    + "): " + result.detail());
            last = result;
        }
        return last;
    }

    /**
     * Send a short probe to every provider, in the current order, and time each one.
     */
    public List<ProviderDiagnostic> diagnose() {
        List<ProviderDiagnostic> diagnostics = new ArrayList<>();
        List<Turn> probe = List.of(Turn.user(PROBE_MESSAGE));
        for (CompletionClient provider : providers) {
            long start = System.nanoTime();
            CompletionResult result = provider.complete(PROBE_SYSTEM_PROMPT, probe);
            long latencyMs = (System.nanoTime() - start) / 1_000_000;
            ProviderDiagnostic diagnostic = ProviderDiagnostic.of(result, provider.name(), latencyMs);
            LoggerUtil.info(String.format("Provider diagnostic: %s ok=%s latency=%dms",
                    provider.name(), diagnostic.success(), latencyMs));
            diagnostics.add(diagnostic);
        }
        return diagnostics;
    }

    /**
     * Reorder the chain: successful providers first by ascending latency, then the rest
     * in their current relative order. Providers without a diagnostic keep their place
     * among the unsuccessful ones.
     *
     * @return provider names in the new order
     */
    public synchronized List<String> reorderByLatency(List<ProviderDiagnostic> diagnostics) {
        List<String> healthy = diagnostics.stream()
                .filter(ProviderDiagnostic::success)
                .sorted(Comparator.comparingLong(ProviderDiagnostic::latencyMs))
                .map(ProviderDiagnostic::provider)
                .collect(Collectors.toList());

        List<CompletionClient> reordered = new ArrayList<>(providers.size());
        for (String name : healthy) {
            providers.stream().filter(p -> p.name().equals(name)).findFirst().ifPresent(reordered::add);
        }
        for (CompletionClient provider : providers) {
            if (!reordered.contains(provider)) {
                reordered.add(provider);
            }
        }

        providers = List.copyOf(reordered);
        List<String> order = providerNames();
        LoggerUtil.info("Provider order updated: " + order);
        return order;
    }

    public List<String> providerNames() {
        return providers.stream().map(CompletionClient::name).collect(Collectors.toList());
    }

    @Override
    public void close() {
        for (CompletionClient provider : providers) {
            if (provider instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) provider).close();
                } catch (Exception e) {
                    LoggerUtil.warn("Failed to close provider '" + provider.name() + "': " + e.getMessage());
                }
            }
        }
    }
}
