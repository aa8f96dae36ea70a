/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.ai;

import com.personanexus.state.Turn;

import java.util.List;

/**
 * A language-model backend.
 *
 * <p>Implementations never throw for backend problems; every outcome, including
 * timeouts and transport errors, is reported through {@link CompletionResult}.
 */
public interface CompletionClient {

    /**
     * @param systemPrompt persona instructions sent ahead of the conversation
     * @param conversation prior turns plus the pending user message, oldest first
     */
    CompletionResult complete(String systemPrompt, List<Turn> conversation);

    /**
     * Short provider name used in logs, replies and diagnostics.
     */
    String name();
}
