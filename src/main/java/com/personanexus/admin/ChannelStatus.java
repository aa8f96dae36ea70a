/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.admin;

/**
 * Snapshot of a scope's settings as reported to administrators.
 */
public record ChannelStatus(String scope, boolean enabled, String lockedPersona, boolean auditEnabled, int memoryTurns) {

    public String mode() {
        return lockedPersona == null ? "auto" : "locked";
    }
}
