/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.state;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * One stored message in a channel's conversation history.
 */
public record Turn(@JsonProperty("role") Role role, @JsonProperty("content") String content) {

    public Turn {
        if (role == null) {
            throw new IllegalArgumentException("Turn role cannot be null");
        }
        content = content != null ? content : "";
    }

    public static Turn user(String content) {
        return new Turn(Role.USER, content);
    }

    public static Turn assistant(String content) {
        return new Turn(Role.ASSISTANT, content);
    }

    public enum Role {
        USER("user"),
        ASSISTANT("assistant");

        private final String wireName;

        Role(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String getWireName() {
            return wireName;
        }

        @JsonCreator
        public static Role fromWire(String value) {
            for (Role role : values()) {
                if (role.wireName.equalsIgnoreCase(value)) {
                    return role;
                }
            }
            throw new IllegalArgumentException("Unknown turn role: " + value);
        }
    }
}
