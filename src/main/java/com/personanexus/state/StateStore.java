/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

import java.util.Optional;
import java.util.Set;

/**
 * Durable key-value table for one kind of per-scope state.
 *
 * <p>{@link #put} replaces the whole value atomically: a reader never observes a
 * partially written value.
 *
 * @param <V> stored value type
 */
public interface StateStore<V> {

    /**
     * @return the stored value, or empty if nothing was ever stored for the key
     * @throws StateStoreException.CorruptStateException if a stored value cannot be decoded
     */
    Optional<V> get(String key);

    /**
     * @throws StateStoreException.WriteFailedException if the value could not be persisted
     */
    void put(String key, V value);

    void remove(String key);

    Set<String> keys();
}
