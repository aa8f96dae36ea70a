/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.unit.admin;

import com.fasterxml.jackson.databind.JsonNode;
import com.personanexus.admin.AuditEntry;
import com.personanexus.admin.AuditTrail;
import com.personanexus.utils.JacksonConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for AuditTrail.
 */
class AuditTrailTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldKeepOnlyNewestEntriesUpToCapacity() {
        AuditTrail trail = new AuditTrail(3);

        for (int i = 0; i < 5; i++) {
            trail.record(AuditEntry.adminAction("c1", "admin", "change " + i));
        }

        assertEquals(3, trail.size());
        List<AuditEntry> recent = trail.recent(10);
        assertEquals(List.of("change 4", "change 3", "change 2"),
                recent.stream().map(AuditEntry::summary).toList(), "Newest entries first");
    }

    @Test
    void recentShouldHonorLimit() {
        AuditTrail trail = new AuditTrail(10);
        trail.record(AuditEntry.autoReply("c1", "u1", "a"));
        trail.record(AuditEntry.autoReply("c1", "u1", "b"));

        assertEquals(1, trail.recent(1).size());
        assertEquals("b", trail.recent(1).get(0).summary());
    }

    @Test
    void shouldAppendJsonLinesToLogFile() throws Exception {
        Path logFile = tempDir.resolve("logs").resolve("audit.jsonl");
        AuditTrail trail = new AuditTrail(10, logFile);

        trail.record(AuditEntry.adminAction("g1:c1", "admin", "persona locked to rogue"));
        trail.record(AuditEntry.autoReply("g1:c1", "u1", "rogue replied"));

        List<String> lines = Files.readAllLines(logFile);
        assertEquals(2, lines.size());
        JsonNode first = JacksonConfig.mapper().readTree(lines.get(0));
        assertEquals("ADMIN_ACTION", first.get("type").asText());
        assertEquals("g1:c1", first.get("scope").asText());
        assertTrue(first.get("timestamp").isTextual(), "Timestamps are written as ISO strings");
    }

    @Test
    void shouldReadCapacityFromProperties() {
        Properties properties = new Properties();
        properties.setProperty("audit.capacity", "7");

        AuditTrail trail = AuditTrail.fromProperties(properties);

        assertEquals(7, trail.getCapacity());
    }

    @Test
    void shouldRejectNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new AuditTrail(0));
    }
}
