/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.engine;

import com.personanexus.state.ChannelScope;

/**
 * A chat message as delivered by the platform gateway.
 *
 * @param messageId platform id, unique per message; used for deduplication
 * @param scope channel the message was posted in
 * @param authorId platform id of the author
 * @param authorIsBot true when the author is a bot account (including this bot)
 * @param text raw message text, may be empty
 * @param mentionsBot true when the message mentions this bot
 * @param repliedToAuthorId author of the message this one replies to, or null
 */
public record InboundMessage(
        String messageId,
        ChannelScope scope,
        String authorId,
        boolean authorIsBot,
        String text,
        boolean mentionsBot,
        String repliedToAuthorId) {

    public InboundMessage {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("Message id cannot be null or empty");
        }
        if (scope == null) {
            throw new IllegalArgumentException("Message scope cannot be null");
        }
        text = text != null ? text : "";
    }
}
