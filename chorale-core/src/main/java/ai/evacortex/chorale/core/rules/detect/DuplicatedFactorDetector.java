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
import ai.evacortex.chorale.core.chord.ChordQuality;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;

import java.util.ArrayList;
import java.util.List;

/**
 * A chord factor carried by more than one voice. The first chord is checked
 * before the second; each chord yields at most one candidate.
 */
public final class DuplicatedFactorDetector implements ViolationDetector {

    private final ChordFactor factor;
    private final boolean dominantOnly;

    /**
     * @param factor       factor that must not be doubled
     * @param dominantOnly only check dominant chords: V, vii or a secondary dominant
     */
    public DuplicatedFactorDetector(ChordFactor factor, boolean dominantOnly) {
        this.factor = factor;
        this.dominantOnly = dominantOnly;
    }

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Detection> out = new ArrayList<>(2);
        check(pair.first(), 0, out);
        check(pair.second(), 1, out);
        return out;
    }

    private void check(ChordAnalysis chord, int chordIndex, List<Detection> out) {
        if (chord.isIndeterminate()) {
            return;
        }
        if (dominantOnly && !isDominantChord(chord)) {
            return;
        }
        List<Voice> carriers = new ArrayList<>();
        for (Voice v : Voice.values()) {
            if (chord.factor(v) == factor) {
                carriers.add(v);
            }
        }
        if (carriers.size() > 1) {
            out.add(Detection.of(chordIndex, carriers));
        }
    }

    /**
     * A major or dominant-seventh chord on degree 5, a diminished chord on
     * degree 7, or a secondary dominant. A borrowed minor v does not count.
     */
    static boolean isDominantChord(ChordAnalysis chord) {
        if (chord.isSecondaryDominant()) {
            return true;
        }
        if (chord.isChromaticSpecial()) {
            return false;
        }
        ChordQuality q = chord.quality();
        return switch (chord.degree()) {
            case 5 -> q == ChordQuality.MAJOR || q == ChordQuality.DOMINANT_SEVENTH;
            case 7 -> q == ChordQuality.DIMINISHED
                    || q == ChordQuality.DIMINISHED_SEVENTH
                    || q == ChordQuality.HALF_DIMINISHED_SEVENTH;
            default -> false;
        };
    }
}
