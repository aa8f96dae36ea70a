/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.web.api;

import com.personanexus.chat.BotReply;
import com.personanexus.chat.ConversationEngine;
import com.personanexus.engine.InboundMessage;
import com.personanexus.state.ChannelScope;
import com.personanexus.utils.LoggerUtil;
import io.javalin.http.Context;

import java.util.Optional;

/**
 * Gateway endpoint through which the chat platform delivers messages.
 *
 * POST /api/messages answers 200 with a {@link BotReply} when the bot replies and
 * 204 when it stays silent.
 */
public class MessageController {
    private final ConversationEngine engine;

    public MessageController(ConversationEngine engine) {
        this.engine = engine;
    }

    /**
     * POST /api/messages
     */
    public void postMessage(Context ctx) {
        InboundMessage parsed;
        try {
            parsed = ctx.bodyAsClass(MessageRequest.class).toInboundMessage();
        } catch (IllegalArgumentException e) {
            ctx.status(400).json(SharedErrorResponse.badRequest(e.getMessage()));
            return;
        }
        InboundMessage message = parsed;

        LoggerUtil.debug(() -> "Inbound message " + message.messageId() + " in " + message.scope()
                + ": " + LoggerUtil.truncate(message.text(), 80));

        ctx.future(() -> engine.handleAsync(message).thenAccept(reply -> respond(ctx, reply)));
    }

    private void respond(Context ctx, Optional<BotReply> reply) {
        if (reply.isPresent()) {
            ctx.status(200).json(reply.get());
        } else {
            ctx.status(204);
        }
    }

    public record MessageRequest(String messageId, String guildId, String channelId, String authorId,
                                 boolean authorIsBot, String text, boolean mentionsBot,
                                 String repliedToAuthorId) {

        InboundMessage toInboundMessage() {
            return new InboundMessage(messageId, ChannelScope.of(guildId, channelId), authorId, authorIsBot,
                    text, mentionsBot, repliedToAuthorId);
        }
    }
}
