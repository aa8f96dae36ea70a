/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.admin;

import com.personanexus.persona.PersonaDefinition;

import java.util.List;

/**
 * Public view of a persona for listings.
 */
public record PersonaSummary(String key, String displayName, String emoji, String color, String style,
                             List<String> triggers) {

    public static PersonaSummary of(PersonaDefinition persona) {
        return new PersonaSummary(
                persona.getKey(),
                persona.getDisplayName(),
                persona.getPresentation().emoji(),
                persona.getPresentation().hexColor(),
                persona.getPresentation().style(),
                List.copyOf(persona.getTriggerKeywords()));
    }
}
