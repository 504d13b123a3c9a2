/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

public enum HarmonicFunction {
    TONIC("T"),
    SUBDOMINANT("S"),
    DOMINANT("D");

    private final String code;

    HarmonicFunction(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /** Degrees 1, 3 and 6 are tonic (3 is ambiguous and kept tonic), 2 and 4 subdominant, 5 and 7 dominant. */
    public static HarmonicFunction forDegree(int degree) {
        return switch (degree) {
            case 2, 4 -> SUBDOMINANT;
            case 5, 7 -> DOMINANT;
            default -> TONIC;
        };
    }
}
