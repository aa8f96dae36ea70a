/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.engine;

import com.personanexus.persona.PersonaDefinition;
import com.personanexus.persona.PersonaRegistry;
import com.personanexus.state.ChannelConfig;
import com.personanexus.state.ConversationMemory;
import com.personanexus.state.Turn;
import com.personanexus.utils.LoggerUtil;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Chooses which persona answers a message.
 *
 * <p>A locked scope always gets its locked persona. Otherwise every persona is scored:
 * <ul>
 *   <li>+2 for each of its trigger keywords present as a whole word</li>
 *   <li>+1 to {@code default} when the trimmed text ends with {@code ?}</li>
 *   <li>+1 to {@code manhua} and {@code oracle} when the text contains {@code !}</li>
 *   <li>+1 to {@code default} when the latest stored turn was the bot's</li>
 * </ul>
 * The highest score wins, ties going to the persona listed first in the registry.
 * If nothing scores, {@code default} answers.
 */
public class PersonaSelector {

    static final String QUESTION_PERSONA = PersonaRegistry.DEFAULT_KEY;
    static final List<String> EXCLAMATION_PERSONAS = List.of("manhua", "oracle");
    static final String CONTINUATION_PERSONA = PersonaRegistry.DEFAULT_KEY;

    private static final int KEYWORD_WEIGHT = 2;

    private final PersonaRegistry registry;

    public PersonaSelector(PersonaRegistry registry) {
        this.registry = registry;
    }

    public PersonaScoring selectPersona(InboundMessage message, ChannelConfig config, ConversationMemory memory) {
        return selectPersona(message.text(), config, memory);
    }

    public PersonaScoring selectPersona(String text, ChannelConfig config, ConversationMemory memory) {
        if (config.hasLock()) {
            String lockedKey = config.lockedPersona();
            if (!registry.contains(lockedKey)) {
                LoggerUtil.warn("[PersonaSelector] Locked persona '" + lockedKey + "' is not in the registry, using "
                        + PersonaRegistry.DEFAULT_KEY);
            }
            return new PersonaScoring(registry.resolve(lockedKey), Map.of(), true);
        }

        Map<String, Integer> scores = score(text == null ? "" : text, memory);

        PersonaDefinition winner = null;
        int best = 0;
        for (PersonaDefinition persona : registry.all()) {
            int score = scores.get(persona.getKey());
            if (score > best) {
                best = score;
                winner = persona;
            }
        }
        if (winner == null) {
            winner = registry.getDefault();
        }

        PersonaDefinition chosen = winner;
        LoggerUtil.debug(() -> "[PersonaSelector] Selected " + chosen.getKey() + " from scores " + scores);
        return new PersonaScoring(chosen, scores, false);
    }

    private Map<String, Integer> score(String text, ConversationMemory memory) {
        String lower = text.toLowerCase(Locale.ROOT);

        Map<String, Integer> scores = new LinkedHashMap<>();
        for (PersonaDefinition persona : registry.all()) {
            scores.put(persona.getKey(), KEYWORD_WEIGHT * persona.countKeywordMatches(lower));
        }

        if (text.trim().endsWith("?")) {
            bump(scores, QUESTION_PERSONA);
        }
        if (text.indexOf('!') >= 0) {
            EXCLAMATION_PERSONAS.forEach(key -> bump(scores, key));
        }
        boolean lastWasAssistant = memory.getLastTurn()
                .map(turn -> turn.role() == Turn.Role.ASSISTANT)
                .orElse(false);
        if (lastWasAssistant) {
            bump(scores, CONTINUATION_PERSONA);
        }
        return scores;
    }

    // Bonuses only apply to personas the registry actually has.
    private static void bump(Map<String, Integer> scores, String key) {
        scores.computeIfPresent(key, (k, v) -> v + 1);
    }
}
