/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.chord;

import java.util.List;

/**
 * The four SATB parts. Declaration order runs top-down, matching the way
 * voice pairs are scanned by the pairwise rules.
 */
public enum Voice {
    SOPRANO("S", "Soprano", 3),
    ALTO("A", "Alto", 2),
    TENOR("T", "Tenor", 1),
    BASS("B", "Bass", 0);

    /** Bass first, soprano last. */
    public static final List<Voice> BOTTOM_UP = List.of(BASS, TENOR, ALTO, SOPRANO);

    private final String code;
    private final String displayName;
    private final int rankFromBass;

    Voice(String code, String displayName, int rankFromBass) {
        this.code = code;
        this.displayName = displayName;
        this.rankFromBass = rankFromBass;
    }

    public String code() {
        return code;
    }

    public String displayName() {
        return displayName;
    }

    public int rankFromBass() {
        return rankFromBass;
    }

    /** The part sounding immediately above this one, or {@code null} for the soprano. */
    public Voice above() {
        return switch (this) {
            case BASS -> TENOR;
            case TENOR -> ALTO;
            case ALTO -> SOPRANO;
            case SOPRANO -> null;
        };
    }

    public static Voice fromCode(String code) {
        for (Voice v : values()) {
            if (v.code.equalsIgnoreCase(code)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown voice: " + code);
    }
}
