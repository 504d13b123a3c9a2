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
import ai.evacortex.chorale.core.pitch.MotionType;

import java.util.List;

/**
 * A rule broken between two chords.
 *
 * @param pairIndex  index of the first chord of the pair in the progression
 * @param chordIndex 0 or 1: which chord of the pair the problem is reported on
 * @param motion     {@code null} for rules that do not compare two moving voices
 */
public record RuleViolation(RuleId rule,
                            RuleTier tier,
                            Severity severity,
                            int confidence,
                            List<Voice> voices,
                            MotionType motion,
                            int pairIndex,
                            int chordIndex,
                            String message) {

    public RuleViolation {
        voices = List.copyOf(voices);
    }

    public String ruleName() {
        return rule.id();
    }

    /** Position in the progression the violation is reported at. */
    public int position() {
        return pairIndex + chordIndex;
    }
}
