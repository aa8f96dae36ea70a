/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

import java.util.Objects;

/**
 * Identifies one conversation context: a bare channel, or a channel inside a guild.
 *
 * <p>The canonical key is {@code <channel>} or {@code <guild>:<channel>} and is what
 * every store and cache is keyed by.
 */
public record ChannelScope(String guildId, String channelId) {

    private static final char SEPARATOR = ':';

    public ChannelScope {
        if (channelId == null || channelId.isBlank()) {
            throw new IllegalArgumentException("Channel id cannot be null or empty");
        }
        if (channelId.indexOf(SEPARATOR) >= 0) {
            throw new IllegalArgumentException("Channel id cannot contain '" + SEPARATOR + "': " + channelId);
        }
        if (guildId != null) {
            if (guildId.isBlank()) {
                guildId = null;
            } else if (guildId.indexOf(SEPARATOR) >= 0) {
                throw new IllegalArgumentException("Guild id cannot contain '" + SEPARATOR + "': " + guildId);
            }
        }
    }

    public static ChannelScope of(String channelId) {
        return new ChannelScope(null, channelId);
    }

    public static ChannelScope of(String guildId, String channelId) {
        return new ChannelScope(guildId, channelId);
    }

    /**
     * Parse a canonical key back into a scope.
     *
     * @param key {@code channel} or {@code guild:channel}
     * @throws IllegalArgumentException if the key is empty or malformed
     */
    public static ChannelScope parse(String key) {
        Objects.requireNonNull(key, "key");
        int idx = key.indexOf(SEPARATOR);
        if (idx < 0) {
            return of(key);
        }
        return of(key.substring(0, idx), key.substring(idx + 1));
    }

    public boolean hasGuild() {
        return guildId != null;
    }

    public String key() {
        return guildId == null ? channelId : guildId + SEPARATOR + channelId;
    }

    @Override
    public String toString() {
        return key();
    }
}
