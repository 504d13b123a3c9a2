/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.key;

import java.util.List;

public enum Mode {
    MAJOR(new int[]{0, 2, 4, 5, 7, 9, 11},
            List.of("I", "ii", "iii", "IV", "V", "vi", "vii°")),
    // harmonic minor: the raised seventh is the diatonic leading tone
    MINOR(new int[]{0, 2, 3, 5, 7, 8, 11},
            List.of("i", "ii°", "III", "iv", "V", "VI", "vii°"));

    private final int[] degreeOffsets;
    private final List<String> degreeNumerals;

    Mode(int[] degreeOffsets, List<String> degreeNumerals) {
        this.degreeOffsets = degreeOffsets;
        this.degreeNumerals = degreeNumerals;
    }

    /** Semitones above the tonic of scale degree {@code degree} (1-7). */
    public int offset(int degree) {
        return degreeOffsets[degree - 1];
    }

    /** Expected roman numeral of the diatonic chord on {@code degree} (1-7). */
    public String numeral(int degree) {
        return degreeNumerals.get(degree - 1);
    }

    public Mode parallel() {
        return this == MAJOR ? MINOR : MAJOR;
    }

    public static Mode fromName(String name) {
        if (name == null) {
            throw new NullPointerException("mode must not be null");
        }
        return switch (name.trim().toLowerCase()) {
            case "major", "maj" -> MAJOR;
            case "minor", "min" -> MINOR;
            default -> throw new IllegalArgumentException("Unknown mode: " + name);
        };
    }
}
