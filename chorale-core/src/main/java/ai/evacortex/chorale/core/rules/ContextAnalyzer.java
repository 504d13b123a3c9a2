/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.analysis.HarmonicFunction;

import java.util.Set;

/**
 * Context tests shared by several rules.
 */
public final class ContextAnalyzer {

    private ContextAnalyzer() {}

    /**
     * Same harmony, redistributed: root, quality, inversion and pitch-class
     * set all agree while the concrete pitches differ.
     */
    public static boolean isVoicingChange(ChordAnalysis first, ChordAnalysis second) {
        if (first.isIndeterminate() || second.isIndeterminate()) {
            return false;
        }
        if (first.rootPitchClass() != second.rootPitchClass()
                || first.quality() != second.quality()
                || first.inversion() != second.inversion()) {
            return false;
        }
        if (!first.snapshot().pitchClasses().equals(second.snapshot().pitchClasses())) {
            return false;
        }
        return !first.snapshot().voices().equals(second.snapshot().voices());
    }

    /**
     * Dominant and leading-tone chords in succession (degrees 5 and 7, either
     * order) with at least one of them dominant in function.
     */
    public static boolean isVToViiPair(ChordAnalysis first, ChordAnalysis second) {
        if (!Set.of(first.degree(), second.degree()).equals(Set.of(5, 7))) {
            return false;
        }
        return first.function() == HarmonicFunction.DOMINANT || second.function() == HarmonicFunction.DOMINANT;
    }
}
