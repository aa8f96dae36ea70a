/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.chat;

import com.personanexus.persona.PersonaDefinition;
import com.personanexus.persona.Presentation;

/**
 * A reply ready to be rendered by the chat platform.
 *
 * @param title persona emoji followed by its display name
 * @param description reply text
 * @param color persona color as a 24-bit RGB integer
 * @param footerText persona footer
 * @param personaKey key of the persona that answered
 * @param provider completion provider that produced the text, or null for the fallback reply
 */
public record BotReply(String title, String description, int color, String footerText,
                       String personaKey, String provider) {

    public static BotReply of(PersonaDefinition persona, String text, String provider) {
        Presentation presentation = persona.getPresentation();
        String title = presentation.emoji().isEmpty()
                ? persona.getDisplayName()
                : presentation.emoji() + " " + persona.getDisplayName();
        return new BotReply(title, text, presentation.color(), presentation.footer(), persona.getKey(), provider);
    }

    public boolean isFallback() {
        return provider == null;
    }
}
