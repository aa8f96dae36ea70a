/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.admin;

import java.time.Instant;

/**
 * One line of the audit trail.
 *
 * @param timestamp when the event happened
 * @param type what kind of event this is
 * @param scope canonical scope key the event applies to
 * @param actor who caused it: an admin id for admin actions, the message author for replies
 * @param summary human-readable description
 */
public record AuditEntry(Instant timestamp, Type type, String scope, String actor, String summary) {

    public enum Type {
        ADMIN_ACTION,
        AUTO_REPLY
    }

    public static AuditEntry adminAction(String scope, String actor, String summary) {
        return new AuditEntry(Instant.now(), Type.ADMIN_ACTION, scope, actorOrUnknown(actor), summary);
    }

    public static AuditEntry autoReply(String scope, String actor, String summary) {
        return new AuditEntry(Instant.now(), Type.AUTO_REPLY, scope, actorOrUnknown(actor), summary);
    }

    private static String actorOrUnknown(String actor) {
        return actor == null || actor.isBlank() ? "unknown" : actor;
    }
}
