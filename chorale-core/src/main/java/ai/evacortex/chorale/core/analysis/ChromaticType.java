/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

/**
 * Chromatic chords recognised ahead of the plain diatonic reading.
 */
public enum ChromaticType {
    SECONDARY_DOMINANT("secondary-dominant"),
    NEAPOLITAN("neapolitan"),
    ITALIAN_SIXTH("italian-sixth"),
    FRENCH_SIXTH("french-sixth"),
    GERMAN_SIXTH("german-sixth"),
    BORROWED("borrowed");

    private final String tag;

    ChromaticType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public boolean isAugmentedSixth() {
        return this == ITALIAN_SIXTH || this == FRENCH_SIXTH || this == GERMAN_SIXTH;
    }
}
