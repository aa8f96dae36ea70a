/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.web;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import io.javalin.json.JsonMapper;
import org.jetbrains.annotations.NotNull;

import java.lang.reflect.Type;

/**
 * Gson-based JSON mapper for Javalin.
 *
 * Malformed request bodies surface as {@link IllegalArgumentException}, which the
 * server maps to a 400 response.
 */
public class GsonJsonMapper implements JsonMapper {
    private final Gson gson;

    public GsonJsonMapper(Gson gson) {
        this.gson = gson;
    }

    @Override
    public String toJsonString(@NotNull Object obj, @NotNull Type type) {
        return gson.toJson(obj, type);
    }

    @Override
    public <T> T fromJsonString(@NotNull String json, @NotNull Type targetType) {
        try {
            T value = gson.fromJson(json, targetType);
            if (value == null) {
                throw new IllegalArgumentException("Request body is empty");
            }
            return value;
        } catch (JsonParseException e) {
            throw new IllegalArgumentException("Failed to parse JSON: " + e.getMessage(), e);
        }
    }
}
