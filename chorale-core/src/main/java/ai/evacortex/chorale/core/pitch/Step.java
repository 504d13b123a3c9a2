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
 * Diatonic letter name of a pitch, with its position in the C-based letter
 * cycle and the semitone offset of the natural note above C.
 */
public enum Step {
    C(0, 0),
    D(1, 2),
    E(2, 4),
    F(3, 5),
    G(4, 7),
    A(5, 9),
    B(6, 11);

    private static final Step[] BY_INDEX = values();

    private final int index;
    private final int naturalSemitone;

    Step(int index, int naturalSemitone) {
        this.index = index;
        this.naturalSemitone = naturalSemitone;
    }

    public int index() {
        return index;
    }

    public int naturalSemitone() {
        return naturalSemitone;
    }

    /** Letter reached after moving {@code steps} letters upwards (negative moves down). */
    public Step plus(int steps) {
        return BY_INDEX[Math.floorMod(index + steps, 7)];
    }

    public static Step fromChar(char c) {
        return switch (Character.toUpperCase(c)) {
            case 'C' -> C;
            case 'D' -> D;
            case 'E' -> E;
            case 'F' -> F;
            case 'G' -> G;
            case 'A' -> A;
            case 'B' -> B;
            default -> throw new IllegalArgumentException("Not a pitch letter: " + c);
        };
    }
}
