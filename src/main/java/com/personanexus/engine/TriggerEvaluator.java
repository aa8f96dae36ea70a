/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.engine;

import com.personanexus.persona.PersonaRegistry;
import com.personanexus.state.ChannelConfig;

import java.util.Locale;

/**
 * Decides whether a message warrants a reply at all.
 */
public class TriggerEvaluator {

    private final PersonaRegistry registry;
    private final String botUserId;

    /**
     * @param botUserId this bot's platform user id, used to detect replies to the bot; may be null
     */
    public TriggerEvaluator(PersonaRegistry registry, String botUserId) {
        this.registry = registry;
        this.botUserId = botUserId == null || botUserId.isBlank() ? null : botUserId;
    }

    /**
     * A message triggers a reply when the scope is enabled, the author is not a bot,
     * and the message mentions the bot, replies to the bot, or contains any persona
     * keyword as a whole word.
     */
    public boolean shouldRespond(InboundMessage message, ChannelConfig config) {
        if (!config.enabled()) {
            return false;
        }
        if (message.authorIsBot()) {
            return false;
        }
        if (message.mentionsBot()) {
            return true;
        }
        if (isReplyToBot(message)) {
            return true;
        }
        String text = message.text();
        if (text.isBlank()) {
            return false;
        }
        return registry.anyKeywordMatches(text.toLowerCase(Locale.ROOT));
    }

    private boolean isReplyToBot(InboundMessage message) {
        return botUserId != null && botUserId.equals(message.repliedToAuthorId());
    }
}
