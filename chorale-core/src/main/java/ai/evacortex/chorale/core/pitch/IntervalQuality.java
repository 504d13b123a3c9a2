/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.pitch;

public enum IntervalQuality {
    DOUBLY_DIMINISHED("dd"),
    DIMINISHED("d"),
    MINOR("m"),
    PERFECT("P"),
    MAJOR("M"),
    AUGMENTED("A"),
    DOUBLY_AUGMENTED("AA"),
    UNKNOWN("?");

    private final String symbol;

    IntervalQuality(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    /** Quality of a unison, fourth, fifth or octave deviating by {@code delta} semitones. */
    static IntervalQuality perfectFamily(int delta) {
        return switch (delta) {
            case -2 -> DOUBLY_DIMINISHED;
            case -1 -> DIMINISHED;
            case 0 -> PERFECT;
            case 1 -> AUGMENTED;
            case 2 -> DOUBLY_AUGMENTED;
            default -> UNKNOWN;
        };
    }

    /** Quality of a second, third, sixth or seventh deviating from major by {@code delta} semitones. */
    static IntervalQuality imperfectFamily(int delta) {
        return switch (delta) {
            case -3 -> DOUBLY_DIMINISHED;
            case -2 -> DIMINISHED;
            case -1 -> MINOR;
            case 0 -> MAJOR;
            case 1 -> AUGMENTED;
            case 2 -> DOUBLY_AUGMENTED;
            default -> UNKNOWN;
        };
    }
}
