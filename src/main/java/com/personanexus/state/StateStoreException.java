/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

/**
 * Base exception for state store operations.
 */
public class StateStoreException extends RuntimeException {

    public StateStoreException(String message) {
        super(message);
    }

    public StateStoreException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Thrown when a persisted value exists but cannot be decoded.
     */
    public static class CorruptStateException extends StateStoreException {
        private final String key;

        public CorruptStateException(String key, Throwable cause) {
            super("Corrupt persisted state for key: " + key, cause);
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    /**
     * Thrown when a value could not be durably written.
     */
    public static class WriteFailedException extends StateStoreException {
        private final String key;

        public WriteFailedException(String key, Throwable cause) {
            super("Failed to persist state for key: " + key, cause);
            this.key = key;
        }

        public String getKey() {
            return key;
        }
    }

    /**
     * Thrown when the store's backing location cannot be prepared.
     */
    public static class StoreInitializationException extends StateStoreException {
        public StoreInitializationException(String message, Throwable cause) {
            super("State store initialization failed: " + message, cause);
        }
    }
}
