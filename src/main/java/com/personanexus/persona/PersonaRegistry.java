/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.persona;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.personanexus.utils.JacksonConfig;
import com.personanexus.utils.LoggerUtil;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ordered, immutable catalog of personas.
 *
 * <p>Iteration order is the catalog order and is significant: persona scoring
 * breaks ties in favour of the persona listed first. The registry always
 * contains a persona keyed {@value #DEFAULT_KEY}, used as the fallback voice.
 */
public class PersonaRegistry {

    public static final String DEFAULT_KEY = "default";
    public static final String DEFAULT_CATALOG_RESOURCE = "/personas/catalog.json";

    private final Map<String, PersonaDefinition> personas;

    public PersonaRegistry(List<PersonaDefinition> definitions) {
        if (definitions == null || definitions.isEmpty()) {
            throw new IllegalArgumentException("Persona catalog cannot be empty");
        }

        Map<String, PersonaDefinition> ordered = new LinkedHashMap<>();
        for (PersonaDefinition definition : definitions) {
            PersonaDefinition existing = ordered.putIfAbsent(definition.getKey(), definition);
            if (existing != null) {
                throw new IllegalArgumentException("Duplicate persona key: " + definition.getKey());
            }
        }

        if (!ordered.containsKey(DEFAULT_KEY)) {
            throw new IllegalArgumentException("Persona catalog must contain a '" + DEFAULT_KEY + "' persona");
        }

        this.personas = Collections.unmodifiableMap(ordered);
        LoggerUtil.info("PersonaRegistry initialized with " + personas.size() + " personas: " + personas.keySet());
    }

    /**
     * Load the built-in catalog shipped on the classpath.
     */
    public static PersonaRegistry loadDefault() {
        return loadFromClasspath(DEFAULT_CATALOG_RESOURCE);
    }

    /**
     * Load a persona catalog from a classpath JSON resource.
     *
     * @param resource absolute classpath location, e.g. {@code /personas/catalog.json}
     * @return the registry
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static PersonaRegistry loadFromClasspath(String resource) {
        try (InputStream is = PersonaRegistry.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Persona catalog not found: " + resource);
            }
            return fromJson(is, JacksonConfig.mapper());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read persona catalog " + resource + ": " + e.getMessage(), e);
        }
    }

    static PersonaRegistry fromJson(InputStream json, ObjectMapper mapper) throws IOException {
        CatalogJson catalog = mapper.readValue(json, CatalogJson.class);
        if (catalog.personas == null) {
            throw new IOException("Catalog has no 'personas' array");
        }

        List<PersonaDefinition> definitions = new ArrayList<>(catalog.personas.size());
        for (PersonaJson p : catalog.personas) {
            Presentation presentation = p.presentation == null
                    ? null
                    : new Presentation(p.presentation.emoji, parseColor(p.presentation.color),
                                       p.presentation.footer, p.presentation.style);
            definitions.add(new PersonaDefinition(p.key, p.displayName, p.systemPrompt, p.triggers, presentation));
        }
        return new PersonaRegistry(definitions);
    }

    private static int parseColor(String color) {
        if (color == null || color.isBlank()) {
            return 0;
        }
        String hex = color.trim();
        if (hex.startsWith("#")) {
            hex = hex.substring(1);
        } else if (hex.startsWith("0x") || hex.startsWith("0X")) {
            hex = hex.substring(2);
        }
        try {
            return Integer.parseInt(hex, 16);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid persona color: " + color, e);
        }
    }

    public Optional<PersonaDefinition> get(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(personas.get(key));
    }

    public boolean contains(String key) {
        return key != null && personas.containsKey(key);
    }

    /**
     * Look up a persona, falling back to {@value #DEFAULT_KEY} for unknown keys.
     */
    public PersonaDefinition resolve(String key) {
        PersonaDefinition definition = key != null ? personas.get(key) : null;
        return definition != null ? definition : getDefault();
    }

    public PersonaDefinition getDefault() {
        return personas.get(DEFAULT_KEY);
    }

    /**
     * @return all personas in catalog order
     */
    public List<PersonaDefinition> all() {
        return List.copyOf(personas.values());
    }

    public List<String> keys() {
        return List.copyOf(personas.keySet());
    }

    public int size() {
        return personas.size();
    }

    /**
     * @param lowerText message text, already lowercased
     * @return true if any persona's trigger keyword occurs as a whole word
     */
    public boolean anyKeywordMatches(String lowerText) {
        for (PersonaDefinition definition : personas.values()) {
            if (definition.matchesAnyKeyword(lowerText)) {
                return true;
            }
        }
        return false;
    }

    private static class CatalogJson {
        @JsonProperty("personas")
        public List<PersonaJson> personas;
    }

    private static class PersonaJson {
        @JsonProperty("key")
        public String key;

        @JsonProperty("displayName")
        public String displayName;

        @JsonProperty("systemPrompt")
        public String systemPrompt;

        @JsonProperty("triggers")
        public List<String> triggers;

        @JsonProperty("presentation")
        public PresentationJson presentation;
    }

    private static class PresentationJson {
        @JsonProperty("emoji")
        public String emoji;

        @JsonProperty("color")
        public String color;

        @JsonProperty("footer")
        public String footer;

        @JsonProperty("style")
        public String style;
    }
}
