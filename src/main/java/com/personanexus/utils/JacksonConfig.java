/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.utils;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared ObjectMapper instances. ObjectMapper is thread-safe after configuration,
 * so a single instance can be reused across the application.
 */
public final class JacksonConfig {

    private static final ObjectMapper INSTANCE = new ObjectMapper();

    private static final ObjectMapper STATE_INSTANCE = new ObjectMapper();

    static {
        INSTANCE.registerModule(new JavaTimeModule());
        INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        INSTANCE.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        STATE_INSTANCE.registerModule(new JavaTimeModule());
        STATE_INSTANCE.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        STATE_INSTANCE.enable(SerializationFeature.INDENT_OUTPUT);
        STATE_INSTANCE.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    private JacksonConfig() {}

    /** Compact, lenient ObjectMapper for wire formats and the audit log (unknown fields ignored). */
    public static ObjectMapper mapper() {
        return INSTANCE;
    }

    /** Pretty-printing ObjectMapper with JavaTimeModule for the on-disk state documents. */
    public static ObjectMapper stateMapper() {
        return STATE_INSTANCE;
    }
}
