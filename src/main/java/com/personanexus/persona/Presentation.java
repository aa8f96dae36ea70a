/*
 * Copyright (c) 2025 iconidentify. MIT License. See LICENSE file.
 */

package com.personanexus.persona;

/**
 * Display metadata for a persona. The engine never interprets these values;
 * they are copied onto outgoing replies.
 *
 * @param emoji short marker shown in front of the persona name
 * @param color RGB color as a 24-bit integer (e.g. 0x8B0000)
 * @param footer footer line attached to every reply
 * @param style free-form description of the voice, shown in persona listings
 */
public record Presentation(String emoji, int color, String footer, String style) {

    public Presentation {
        emoji = emoji != null ? emoji : "";
        footer = footer != null ? footer : "";
        style = style != null ? style : "";
    }

    /**
     * Color as a {@code #RRGGBB} string.
     */
    public String hexColor() {
        return String.format("#%06X", color & 0xFFFFFF);
    }
}
