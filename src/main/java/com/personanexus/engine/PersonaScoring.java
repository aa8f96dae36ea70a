/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.engine;

import com.personanexus.persona.PersonaDefinition;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of persona selection.
 *
 * @param persona the persona that will answer
 * @param scores score per persona key in registry order; empty when the scope is locked
 * @param locked true when the persona came from the scope's lock rather than scoring
 */
public record PersonaScoring(PersonaDefinition persona, Map<String, Integer> scores, boolean locked) {

    public PersonaScoring {
        scores = Collections.unmodifiableMap(new LinkedHashMap<>(scores));
    }

    public String personaKey() {
        return persona.getKey();
    }

    public int scoreOf(String personaKey) {
        return scores.getOrDefault(personaKey, 0);
    }
}
