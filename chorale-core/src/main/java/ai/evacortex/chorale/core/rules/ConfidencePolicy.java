/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.chord.Voice;

/**
 * Deterministic confidence (0-100) attached to a violation.
 */
public enum ConfidencePolicy {
    CERTAIN(100),
    HIGH(90),
    OMISSION(85),
    MEDIUM(80),
    /** Outer voices 100, any pair with the bass 90, soprano with an inner voice 80, inner voices 70. */
    BY_VOICE_PAIR(-1);

    private final int fixed;

    ConfidencePolicy(int fixed) {
        this.fixed = fixed;
    }

    public int score(Detection detection) {
        if (this != BY_VOICE_PAIR) {
            return fixed;
        }
        boolean bass = detection.involves(Voice.BASS);
        boolean soprano = detection.involves(Voice.SOPRANO);
        if (bass && soprano) {
            return 100;
        }
        if (bass) {
            return 90;
        }
        if (soprano && (detection.involves(Voice.ALTO) || detection.involves(Voice.TENOR))) {
            return 80;
        }
        return 70;
    }
}
