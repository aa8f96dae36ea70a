/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.admin;

import com.personanexus.engine.MemoryManager;
import com.personanexus.persona.PersonaRegistry;
import com.personanexus.state.ChannelConfig;
import com.personanexus.state.ChannelScope;
import com.personanexus.state.ChannelStateManager;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Administrative operations on a scope's settings.
 *
 * <p>Every change goes through {@link ChannelStateManager#updateConfig}, so it is
 * persisted before the method returns and seen by the next message handled in the
 * scope. Every change is written to the audit trail.
 */
public class ChannelAdminService {

    private final ChannelStateManager stateManager;
    private final PersonaRegistry registry;
    private final MemoryManager memoryManager;
    private final AuditTrail auditTrail;

    public ChannelAdminService(ChannelStateManager stateManager, PersonaRegistry registry,
                               MemoryManager memoryManager, AuditTrail auditTrail) {
        this.stateManager = stateManager;
        this.registry = registry;
        this.memoryManager = memoryManager;
        this.auditTrail = auditTrail;
    }

    /**
     * Force every reply in the scope to use one persona. Locking also enables the scope.
     *
     * @throws IllegalArgumentException if the persona key is not in the registry
     */
    public ChannelStatus lockPersona(ChannelScope scope, String personaKey, String actor) {
        if (!registry.contains(personaKey)) {
            throw new IllegalArgumentException("Unknown persona: " + personaKey
                    + ". Valid personas: " + String.join(", ", registry.keys()));
        }
        stateManager.updateConfig(scope, c -> c.withLockedPersona(personaKey).withEnabled(true));
        audit(scope, actor, "persona locked to " + personaKey);
        return getStatus(scope);
    }

    /**
     * Return the scope to automatic persona selection.
     */
    public ChannelStatus unlockPersona(ChannelScope scope, String actor) {
        stateManager.updateConfig(scope, ChannelConfig::withoutLock);
        audit(scope, actor, "persona unlocked (auto)");
        return getStatus(scope);
    }

    public ChannelStatus setEnabled(ChannelScope scope, boolean enabled, String actor) {
        stateManager.updateConfig(scope, c -> c.withEnabled(enabled));
        audit(scope, actor, "listener " + (enabled ? "enabled" : "disabled"));
        return getStatus(scope);
    }

    public ChannelStatus setAuditEnabled(ChannelScope scope, boolean enabled, String actor) {
        stateManager.updateConfig(scope, c -> c.withAuditEnabled(enabled));
        audit(scope, actor, "reply audit " + (enabled ? "enabled" : "disabled"));
        return getStatus(scope);
    }

    /**
     * Restore the scope's settings to defaults. Conversation memory is kept.
     */
    public ChannelStatus reset(ChannelScope scope, String actor) {
        stateManager.updateConfig(scope, c -> ChannelConfig.defaults());
        audit(scope, actor, "settings reset");
        return getStatus(scope);
    }

    /**
     * Drop the scope's conversation history.
     */
    public ChannelStatus clearMemory(ChannelScope scope, String actor) {
        memoryManager.clear(scope);
        audit(scope, actor, "memory cleared");
        return getStatus(scope);
    }

    public ChannelStatus getStatus(ChannelScope scope) {
        ChannelConfig config = stateManager.getConfig(scope);
        return new ChannelStatus(scope.key(), config.enabled(), config.lockedPersona(), config.auditEnabled(),
                memoryManager.getMemory(scope).size());
    }

    public List<PersonaSummary> listPersonas() {
        return registry.all().stream().map(PersonaSummary::of).collect(Collectors.toList());
    }

    private void audit(ChannelScope scope, String actor, String summary) {
        auditTrail.record(AuditEntry.adminAction(scope.key(), actor, summary));
    }
}
