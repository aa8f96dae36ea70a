/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Optional;

/**
 * Per-scope behaviour settings. Immutable; the with-methods return modified copies.
 *
 * @param enabled whether the bot answers in this scope at all
 * @param lockedPersona persona key forced for every reply, or null for automatic selection
 * @param auditEnabled whether auto-replies in this scope are written to the audit trail
 */
public record ChannelConfig(
        @JsonProperty("enabled") boolean enabled,
        @JsonProperty("locked_persona") String lockedPersona,
        @JsonProperty("audit_enabled") boolean auditEnabled) {

    private static final ChannelConfig DEFAULTS = new ChannelConfig(true, null, true);

    public static ChannelConfig defaults() {
        return DEFAULTS;
    }

    /**
     * Deserialization entry point. Fields missing from older files take their default values.
     */
    @JsonCreator
    public static ChannelConfig fromJson(@JsonProperty("enabled") Boolean enabled,
                                         @JsonProperty("locked_persona") String lockedPersona,
                                         @JsonProperty("audit_enabled") Boolean auditEnabled) {
        return new ChannelConfig(
                enabled == null || enabled,
                lockedPersona == null || lockedPersona.isBlank() ? null : lockedPersona,
                auditEnabled == null || auditEnabled);
    }

    public Optional<String> lockedPersonaKey() {
        return Optional.ofNullable(lockedPersona);
    }

    public boolean hasLock() {
        return lockedPersona != null;
    }

    public ChannelConfig withEnabled(boolean value) {
        return new ChannelConfig(value, lockedPersona, auditEnabled);
    }

    public ChannelConfig withLockedPersona(String personaKey) {
        return new ChannelConfig(enabled, personaKey, auditEnabled);
    }

    public ChannelConfig withoutLock() {
        return new ChannelConfig(enabled, null, auditEnabled);
    }

    public ChannelConfig withAuditEnabled(boolean value) {
        return new ChannelConfig(enabled, lockedPersona, value);
    }
}
