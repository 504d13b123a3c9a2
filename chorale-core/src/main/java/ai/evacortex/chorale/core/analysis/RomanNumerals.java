/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

import ai.evacortex.chorale.core.chord.ChordQuality;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.pitch.Pitch;

import java.util.OptionalInt;

final class RomanNumerals {

    private static final String[] UPPER = {"I", "II", "III", "IV", "V", "VI", "VII"};

    private RomanNumerals() {}

    /** Numeral for {@code degree} cased and marked by the chord's own quality. */
    static String numeral(int degree, ChordQuality quality) {
        String base = UPPER[degree - 1];
        if (quality == ChordQuality.UNKNOWN) {
            return base;
        }
        String cased = quality.isMajorFamily() ? base : base.toLowerCase();
        return cased + quality.glyph();
    }

    /**
     * Degree label of a root, cased and marked by the chord's quality.
     * Chromatic roots take the letter degree with a flat or sharp prefix.
     */
    static String label(Tonality tonality, Pitch root, ChordQuality quality) {
        OptionalInt diatonic = tonality.scaleDegree(root);
        if (diatonic.isPresent()) {
            return numeral(diatonic.getAsInt(), quality);
        }
        int offset = tonality.chromaticOffset(root);
        String prefix = offset < 0 ? "b".repeat(-offset) : "#".repeat(offset);
        return prefix + numeral(tonality.letterDegree(root), quality);
    }

    /** Degree of the root: the scale degree when diatonic, the letter degree otherwise. */
    static int degree(Tonality tonality, Pitch root) {
        OptionalInt diatonic = tonality.scaleDegree(root);
        return diatonic.isPresent() ? diatonic.getAsInt() : tonality.letterDegree(root);
    }
}
