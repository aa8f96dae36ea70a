/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.unit.state;

import com.personanexus.state.ChannelConfig;
import com.personanexus.state.ChannelScope;
import com.personanexus.state.ConversationMemory;
import com.personanexus.state.JsonFileStateStore;
import com.personanexus.state.StateStoreException;
import com.personanexus.state.Turn;
import com.personanexus.utils.JacksonConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for JsonFileStateStore.
 */
class JsonFileStateStoreTest {

    @TempDir
    Path tempDir;

    private JsonFileStateStore<ChannelConfig> configStore;
    private JsonFileStateStore<ConversationMemory> memoryStore;

    @BeforeEach
    void setUp() {
        configStore = new JsonFileStateStore<>(tempDir.resolve("config"), ChannelConfig.class, JacksonConfig.stateMapper());
        memoryStore = new JsonFileStateStore<>(tempDir.resolve("memory"), ConversationMemory.class, JacksonConfig.stateMapper());
    }

    @Test
    void shouldCreateDirectoryOnInitialization() {
        assertTrue(Files.isDirectory(tempDir.resolve("config")));
        assertTrue(Files.isDirectory(tempDir.resolve("memory")));
    }

    @Test
    void shouldReturnEmptyForUnknownKey() {
        assertTrue(configStore.get("nothing-here").isEmpty());
    }

    @Test
    void shouldPersistConfigUsingSnakeCaseFields() throws Exception {
        // Given
        ChannelConfig config = new ChannelConfig(true, "rogue", false);

        // When
        configStore.put("c1", config);

        // Then
        String json = Files.readString(tempDir.resolve("config").resolve("c1.json"));
        assertTrue(json.contains("\"locked_persona\""), "Should use locked_persona field name: " + json);
        assertTrue(json.contains("\"audit_enabled\""), "Should use audit_enabled field name: " + json);
        assertEquals(Optional.of(config), configStore.get("c1"));
    }

    @Test
    void shouldPersistMemoryTurnsInOrder() {
        ConversationMemory memory = new ConversationMemory(List.of(Turn.user("hi"), Turn.assistant("hello")));

        memoryStore.put("c1", memory);

        ConversationMemory loaded = memoryStore.get("c1").orElseThrow();
        assertEquals(memory, loaded);
        assertEquals(Turn.Role.ASSISTANT, loaded.getTurns().get(1).role());
    }

    @Test
    void shouldWriteRoleAsLowercaseWireName() throws Exception {
        memoryStore.put("c1", new ConversationMemory(List.of(Turn.user("hi"))));

        String json = Files.readString(tempDir.resolve("memory").resolve("c1.json"));
        assertTrue(json.contains("\"user\""), "Role should be written as 'user': " + json);
    }

    @Test
    void shouldApplyDefaultsForFieldsMissingFromOlderFiles() throws Exception {
        Files.writeString(tempDir.resolve("config").resolve("legacy.json"), "{\"enabled\": false}");

        ChannelConfig config = configStore.get("legacy").orElseThrow();

        assertFalse(config.enabled());
        assertNull(config.lockedPersona());
        assertTrue(config.auditEnabled(), "Missing audit_enabled should default to true");
    }

    @Test
    void shouldThrowCorruptStateForMalformedJson() throws Exception {
        Files.writeString(tempDir.resolve("config").resolve("broken.json"), "{not json");

        StateStoreException.CorruptStateException e = assertThrows(StateStoreException.CorruptStateException.class,
                () -> configStore.get("broken"));
        assertEquals("broken", e.getKey());
    }

    @Test
    void shouldThrowCorruptStateForUnknownRole() throws Exception {
        Files.writeString(tempDir.resolve("memory").resolve("weird.json"),
                "{\"turns\": [{\"role\": \"wizard\", \"content\": \"x\"}]}");

        assertThrows(StateStoreException.CorruptStateException.class, () -> memoryStore.get("weird"));
    }

    @Test
    void shouldStoreGuildScopedKeysAndListThem() {
        String key = ChannelScope.of("guild1", "chan1").key();

        configStore.put(key, ChannelConfig.defaults());
        configStore.put("solo", ChannelConfig.defaults());

        assertEquals(Set.of("guild1:chan1", "solo"), configStore.keys());
        assertTrue(configStore.get(key).isPresent());
    }

    @Test
    void shouldReplaceValueWithoutLeavingTempFiles() throws Exception {
        configStore.put("c1", ChannelConfig.defaults());
        configStore.put("c1", ChannelConfig.defaults().withEnabled(false));

        assertFalse(configStore.get("c1").orElseThrow().enabled());
        try (Stream<Path> files = Files.list(tempDir.resolve("config"))) {
            assertEquals(List.of("c1.json"), files.map(p -> p.getFileName().toString()).toList());
        }
    }

    @Test
    void shouldRemoveValue() {
        configStore.put("c1", ChannelConfig.defaults());

        configStore.remove("c1");

        assertTrue(configStore.get("c1").isEmpty());
        assertTrue(configStore.keys().isEmpty());
    }

    @Test
    void shouldRejectEmptyKey() {
        assertThrows(IllegalArgumentException.class, () -> configStore.put("", ChannelConfig.defaults()));
    }
}
