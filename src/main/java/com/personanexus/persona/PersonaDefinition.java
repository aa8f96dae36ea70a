/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.persona;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Immutable definition of a persona: identity, system prompt, trigger keywords
 * and presentation metadata.
 *
 * <p>Trigger keywords are stored lowercased and matched as whole words
 * against already-lowercased message text.
 */
public final class PersonaDefinition {

    private final String key;
    private final String displayName;
    private final String systemPrompt;
    private final Set<String> triggerKeywords;
    private final Presentation presentation;
    private final List<Pattern> keywordPatterns;

    public PersonaDefinition(String key, String displayName, String systemPrompt,
                             List<String> triggerKeywords, Presentation presentation) {
        if (key == null || key.trim().isEmpty()) {
            throw new IllegalArgumentException("Persona key cannot be null or empty");
        }
        if (systemPrompt == null || systemPrompt.trim().isEmpty()) {
            throw new IllegalArgumentException("Persona '" + key + "' has no system prompt");
        }

        this.key = key.trim();
        this.displayName = (displayName == null || displayName.isBlank()) ? this.key : displayName;
        this.systemPrompt = systemPrompt;
        this.presentation = presentation != null ? presentation : new Presentation("", 0, "", "");

        Set<String> keywords = new LinkedHashSet<>();
        if (triggerKeywords != null) {
            for (String keyword : triggerKeywords) {
                if (keyword != null && !keyword.isBlank()) {
                    keywords.add(keyword.trim().toLowerCase(Locale.ROOT));
                }
            }
        }
        this.triggerKeywords = Collections.unmodifiableSet(keywords);

        List<Pattern> patterns = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            patterns.add(Pattern.compile("\\b" + Pattern.quote(keyword) + "\\b"));
        }
        this.keywordPatterns = List.copyOf(patterns);
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public Set<String> getTriggerKeywords() {
        return triggerKeywords;
    }

    public Presentation getPresentation() {
        return presentation;
    }

    /**
     * Count how many of this persona's keywords occur as whole words.
     * Each keyword counts at most once regardless of how often it appears.
     *
     * @param lowerText message text, already lowercased
     * @return number of distinct keywords found
     */
    public int countKeywordMatches(String lowerText) {
        if (lowerText == null || lowerText.isEmpty()) {
            return 0;
        }
        int matches = 0;
        for (Pattern pattern : keywordPatterns) {
            if (pattern.matcher(lowerText).find()) {
                matches++;
            }
        }
        return matches;
    }

    /**
     * @param lowerText message text, already lowercased
     * @return true if at least one keyword occurs as a whole word
     */
    public boolean matchesAnyKeyword(String lowerText) {
        if (lowerText == null || lowerText.isEmpty()) {
            return false;
        }
        for (Pattern pattern : keywordPatterns) {
            if (pattern.matcher(lowerText).find()) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return String.format("PersonaDefinition{key='%s', keywords=%d}", key, triggerKeywords.size());
    }
}
