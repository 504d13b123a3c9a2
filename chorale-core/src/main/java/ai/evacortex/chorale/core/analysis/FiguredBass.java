/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

import ai.evacortex.chorale.core.chord.ChordQuality;
import ai.evacortex.chorale.core.chord.ChordStructure;

import java.util.List;

/**
 * Figured-bass ciphers by chord category and inversion. Inversions a
 * category does not have (a triad in third inversion) read as root position.
 */
public final class FiguredBass {

    public static final String NINTH = "9";

    public enum Category {
        TRIAD(List.of("", "6", "6/4")),
        DOMINANT_SEVENTH(List.of("7,+", "6,5t", "+6", "+4")),
        DIMINISHED_SEVENTH(List.of("7t", "+6,5t", "+4,3", "+2")),
        HALF_DIMINISHED_SEVENTH(List.of("7,5t", "+6,5", "+4,3", "4,+2")),
        SEVENTH(List.of("7", "6,5", "4,3", "2"));

        private final List<String> ciphers;

        Category(List<String> ciphers) {
            this.ciphers = ciphers;
        }

        public String cipher(int inversion) {
            if (inversion < 0 || inversion >= ciphers.size()) {
                return ciphers.get(0);
            }
            return ciphers.get(inversion);
        }
    }

    private FiguredBass() {}

    public static Category categoryOf(ChordQuality quality) {
        return switch (quality) {
            case DOMINANT_SEVENTH -> Category.DOMINANT_SEVENTH;
            case DIMINISHED_SEVENTH -> Category.DIMINISHED_SEVENTH;
            case HALF_DIMINISHED_SEVENTH -> Category.HALF_DIMINISHED_SEVENTH;
            case MAJOR_SEVENTH, MINOR_SEVENTH -> Category.SEVENTH;
            default -> Category.TRIAD;
        };
    }

    public static String cipher(ChordStructure structure) {
        if (structure.ninth()) {
            return NINTH;
        }
        return categoryOf(structure.quality()).cipher(structure.inversion());
    }

    /** Cipher ignoring the specific seventh type: generic seventh or triad table. */
    public static String genericCipher(ChordStructure structure) {
        if (structure.ninth()) {
            return NINTH;
        }
        Category c = structure.quality().isSeventh() ? Category.SEVENTH : Category.TRIAD;
        return c.cipher(structure.inversion());
    }
}
