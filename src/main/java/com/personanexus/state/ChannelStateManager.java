/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

import com.personanexus.utils.JacksonConfig;
import com.personanexus.utils.LoggerUtil;

import java.nio.file.Path;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Owns the per-scope configuration and conversation memory.
 *
 * <p>Values are cached in {@link ConcurrentHashMap}s and every update runs inside
 * {@code compute} for its key, so a read-modify-write on one scope is atomic with
 * respect to other updates of the same scope. Each new value is written through to
 * the backing {@link StateStore} before the update returns. A failed write is logged
 * and the in-memory value is kept; a corrupt stored value resets that scope to defaults.
 */
public class ChannelStateManager {

    public static final int DEFAULT_MAX_TURNS = 10;

    private final StateStore<ChannelConfig> configStore;
    private final StateStore<ConversationMemory> memoryStore;
    private final int maxTurns;

    private final ConcurrentHashMap<String, ChannelConfig> configs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ConversationMemory> memories = new ConcurrentHashMap<>();

    public ChannelStateManager(StateStore<ChannelConfig> configStore,
                               StateStore<ConversationMemory> memoryStore,
                               int maxTurns) {
        if (maxTurns < 1) {
            throw new IllegalArgumentException("memory.max.turns must be at least 1, got " + maxTurns);
        }
        this.configStore = configStore;
        this.memoryStore = memoryStore;
        this.maxTurns = maxTurns;
    }

    /**
     * Build a manager from application properties. When {@code state.dir} is blank the
     * state lives in memory only.
     */
    public static ChannelStateManager fromProperties(Properties properties) {
        int maxTurns = Integer.parseInt(properties.getProperty("memory.max.turns", String.valueOf(DEFAULT_MAX_TURNS)).trim());
        String stateDir = properties.getProperty("state.dir", "data").trim();

        if (stateDir.isEmpty()) {
            LoggerUtil.warn("[ChannelStateManager] state.dir is empty; channel state will not survive a restart");
            return new ChannelStateManager(new InMemoryStateStore<>(), new InMemoryStateStore<>(), maxTurns);
        }

        Path root = Path.of(stateDir);
        return new ChannelStateManager(
                new JsonFileStateStore<>(root.resolve("config"), ChannelConfig.class, JacksonConfig.stateMapper()),
                new JsonFileStateStore<>(root.resolve("memory"), ConversationMemory.class, JacksonConfig.stateMapper()),
                maxTurns);
    }

    public int getMaxTurns() {
        return maxTurns;
    }

    // ==================== Configuration ====================

    /**
     * Current configuration for a scope, created with defaults on first access.
     *
     * <p>If the store cannot be read the defaults are returned for this call only and
     * are not cached, so the stored value is picked up once the store recovers.
     */
    public ChannelConfig getConfig(ChannelScope scope) {
        try {
            return configs.computeIfAbsent(scope.key(), this::loadConfig);
        } catch (StateStoreException e) {
            LoggerUtil.warn("[ChannelStateManager] Could not read config for " + scope.key()
                    + ", using defaults for now: " + causeMessage(e));
            return ChannelConfig.defaults();
        }
    }

    /**
     * Atomically replace a scope's configuration.
     *
     * @return the configuration now in effect
     * @throws StateStoreException if the stored configuration cannot be read, in which
     *         case nothing is changed
     */
    public ChannelConfig updateConfig(ChannelScope scope, UnaryOperator<ChannelConfig> update) {
        return configs.compute(scope.key(), (key, current) -> {
            ChannelConfig base = current != null ? current : loadConfig(key);
            ChannelConfig next = update.apply(base);
            persist(configStore, key, next, "config");
            return next;
        });
    }

    // Read failures other than corruption propagate and leave the cache untouched.
    private ChannelConfig loadConfig(String key) {
        try {
            Optional<ChannelConfig> stored = configStore.get(key);
            if (stored.isPresent()) {
                return stored.get();
            }
        } catch (StateStoreException.CorruptStateException e) {
            LoggerUtil.warn("[ChannelStateManager] Corrupt config for " + key + ", resetting to defaults: " + causeMessage(e));
        }

        ChannelConfig defaults = ChannelConfig.defaults();
        persist(configStore, key, defaults, "config");
        return defaults;
    }

    // ==================== Memory ====================

    /**
     * Current conversation memory for a scope. Stored histories longer than the
     * configured cap are truncated to their most recent turns on load.
     */
    public ConversationMemory getMemory(ChannelScope scope) {
        return memories.computeIfAbsent(scope.key(), this::loadMemory);
    }

    /**
     * Atomically replace a scope's memory. The result is truncated to the cap.
     *
     * @return the memory now in effect
     */
    public ConversationMemory updateMemory(ChannelScope scope, UnaryOperator<ConversationMemory> update) {
        return memories.compute(scope.key(), (key, current) -> {
            ConversationMemory base = current != null ? current : loadMemory(key);
            ConversationMemory next = update.apply(base).truncate(maxTurns);
            persist(memoryStore, key, next, "memory");
            return next;
        });
    }

    /**
     * Forget a scope's conversation history.
     */
    public void clearMemory(ChannelScope scope) {
        updateMemory(scope, m -> ConversationMemory.empty());
    }

    private ConversationMemory loadMemory(String key) {
        try {
            Optional<ConversationMemory> stored = memoryStore.get(key);
            if (stored.isEmpty()) {
                return ConversationMemory.empty();
            }
            ConversationMemory memory = stored.get();
            if (memory.size() > maxTurns) {
                LoggerUtil.info("[ChannelStateManager] Truncating stored memory for " + key
                        + " from " + memory.size() + " to " + maxTurns + " turns");
                return memory.truncate(maxTurns);
            }
            return memory;
        } catch (StateStoreException.CorruptStateException e) {
            LoggerUtil.warn("[ChannelStateManager] Corrupt memory for " + key + ", starting empty: " + causeMessage(e));
            persist(memoryStore, key, ConversationMemory.empty(), "memory");
            return ConversationMemory.empty();
        } catch (StateStoreException e) {
            LoggerUtil.warn("[ChannelStateManager] Could not read memory for " + key + ", starting empty: " + e.getMessage());
            return ConversationMemory.empty();
        }
    }

    // ==================== Persistence ====================

    private <V> void persist(StateStore<V> store, String key, V value, String table) {
        try {
            store.put(key, value);
        } catch (StateStoreException e) {
            LoggerUtil.warn("[ChannelStateManager] Durability warning: " + table + " for " + key
                    + " kept in memory only: " + causeMessage(e));
        }
    }

    private static String causeMessage(Exception e) {
        Throwable cause = e.getCause();
        return cause != null && cause.getMessage() != null ? cause.getMessage() : e.getMessage();
    }
}
