/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.pitch;

/**
 * Relative motion of two voices between consecutive chords, judged from the
 * sign of each voice's movement.
 */
public enum MotionType {
    PARALLEL("parallel"),
    CONTRARY("contrary"),
    OBLIQUE("oblique"),
    STATIC("static");

    private final String tag;

    MotionType(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static MotionType of(Pitch first1, Pitch first2, Pitch second1, Pitch second2) {
        return ofMovements(Interval.semitones(first1, first2), Interval.semitones(second1, second2));
    }

    public static MotionType ofMovements(int move1, int move2) {
        if (move1 == 0 && move2 == 0) {
            return STATIC;
        }
        if (move1 == 0 || move2 == 0) {
            return OBLIQUE;
        }
        return Integer.signum(move1) == Integer.signum(move2) ? PARALLEL : CONTRARY;
    }
}
