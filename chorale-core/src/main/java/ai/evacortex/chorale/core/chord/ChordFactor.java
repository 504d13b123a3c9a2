/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.chord;

/**
 * Role a pitch plays above its chord root.
 */
public enum ChordFactor {
    ROOT("1"),
    THIRD("3"),
    FIFTH("5"),
    SEVENTH("7"),
    NINTH("9"),
    UNKNOWN("?");

    private final String symbol;

    ChordFactor(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * Buckets the semitone distance above the root, octave-reduced. Thirds and
     * fifths include their altered forms; the minor and major sevenths share a
     * bucket, as do the minor and major ninths.
     */
    public static ChordFactor fromInterval(int semitonesAboveRoot) {
        return switch (Math.floorMod(semitonesAboveRoot, 12)) {
            case 0 -> ROOT;
            case 3, 4 -> THIRD;
            case 6, 7, 8 -> FIFTH;
            case 10, 11 -> SEVENTH;
            case 1, 2 -> NINTH;
            default -> UNKNOWN;
        };
    }

    /** Inversion implied by this factor sounding in the bass; 0 for anything unmatched. */
    public int inversionInBass() {
        return switch (this) {
            case THIRD -> 1;
            case FIFTH -> 2;
            case SEVENTH -> 3;
            default -> 0;
        };
    }
}
