/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules.detect;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.chord.ChordFactor;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.Severity;
import ai.evacortex.chorale.core.rules.ViolationDetector;

import java.util.List;
import java.util.SortedSet;

/**
 * Missing third (critical) or missing seventh of a seventh chord (warning)
 * in the first chord of the pair; the second chord is checked when it
 * becomes the first of the next pair. The fifth may be left out.
 *
 * <p>Chromatic chords are exempt. So are chords no template fits when
 * their intervals above the stand-in root look chromatic: an augmented
 * sixth, or a tritone without a perfect fifth.</p>
 */
public final class FactorOmissionDetector implements ViolationDetector {

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        ChordAnalysis chord = pair.first();
        if (chord.isChromaticSpecial()) {
            return List.of();
        }
        if (chord.isIndeterminate() && looksChromatic(chord)) {
            return List.of();
        }

        boolean third = chord.structure().hasFactor(ChordFactor.THIRD);
        if (!third) {
            return List.of(Detection.of(0, List.of()).withSeverity(Severity.CRITICAL, "third"));
        }
        if (chord.quality().isSeventh() && !chord.structure().hasFactor(ChordFactor.SEVENTH)) {
            return List.of(Detection.of(0, List.of()).withSeverity(Severity.WARNING, "seventh"));
        }
        return List.of();
    }

    private static boolean looksChromatic(ChordAnalysis chord) {
        SortedSet<Integer> intervals = chord.structure().intervalsFromRoot(chord.snapshot());
        if (intervals.contains(10)) {
            return true;
        }
        return intervals.contains(6) && intervals.size() >= 3 && !intervals.contains(7);
    }
}
