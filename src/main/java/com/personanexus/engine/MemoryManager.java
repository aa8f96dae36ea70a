/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.engine;

import com.personanexus.state.ChannelScope;
import com.personanexus.state.ChannelStateManager;
import com.personanexus.state.ConversationMemory;
import com.personanexus.state.Turn;
import com.personanexus.utils.LoggerUtil;

import java.util.ArrayList;
import java.util.List;

/**
 * Bounded per-scope conversation history.
 *
 * <p>Each scope keeps at most {@link #getMaxTurns()} turns; appending beyond that
 * evicts the oldest. Every append is handed to the {@link ChannelStateManager},
 * which persists it before returning.
 */
public class MemoryManager {

    private final ChannelStateManager stateManager;

    public MemoryManager(ChannelStateManager stateManager) {
        this.stateManager = stateManager;
    }

    /**
     * Stored history for the scope followed by the pending user message.
     * Does not modify the stored history.
     */
    public List<Turn> buildConversation(ChannelScope scope, String userText) {
        List<Turn> stored = stateManager.getMemory(scope).getTurns();
        List<Turn> conversation = new ArrayList<>(stored.size() + 1);
        conversation.addAll(stored);
        conversation.add(Turn.user(userText));
        return conversation;
    }

    public ConversationMemory recordTurn(ChannelScope scope, Turn.Role role, String content) {
        int cap = stateManager.getMaxTurns();
        ConversationMemory updated = stateManager.updateMemory(scope, m -> m.append(new Turn(role, content), cap));
        LoggerUtil.debug(() -> "[MemoryManager] " + scope + " now holds " + updated.size() + " turns");
        return updated;
    }

    /**
     * Record the user message, then the reply, as two successive turns.
     */
    public ConversationMemory recordExchange(ChannelScope scope, String userText, String replyText) {
        recordTurn(scope, Turn.Role.USER, userText);
        return recordTurn(scope, Turn.Role.ASSISTANT, replyText);
    }

    public ConversationMemory getMemory(ChannelScope scope) {
        return stateManager.getMemory(scope);
    }

    public void clear(ChannelScope scope) {
        stateManager.clearMemory(scope);
        LoggerUtil.info("[MemoryManager] Cleared memory for " + scope);
    }

    public int getMaxTurns() {
        return stateManager.getMaxTurns();
    }
}
