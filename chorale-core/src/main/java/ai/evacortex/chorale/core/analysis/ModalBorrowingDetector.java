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
import ai.evacortex.chorale.core.chord.ChordSnapshot;
import ai.evacortex.chorale.core.chord.ChordStructure;
import ai.evacortex.chorale.core.key.Mode;
import ai.evacortex.chorale.core.key.Tonality;

import java.util.Optional;
import java.util.Set;

/**
 * Chords of a major key taken from its parallel natural minor:
 * i, iv, ii°, v, bIII, bVI and bVII.
 */
public final class ModalBorrowingDetector implements ChromaticDetector {

    private static final int[] NATURAL_MINOR = {0, 2, 3, 5, 7, 8, 10};
    private static final Set<String> PREDOMINANT = Set.of("iv", "ii°", "iiø", "bVI", "bVII");

    @Override
    public Optional<ChromaticMatch> detect(ChordStructure structure, ChordSnapshot snapshot, Tonality tonality) {
        if (tonality.mode() != Mode.MAJOR) {
            return Optional.empty();
        }
        int tonic = tonality.tonicPitchClass();
        for (int pc : snapshot.pitchClasses()) {
            if (!inNaturalMinor(Math.floorMod(pc - tonic, 12))) {
                return Optional.empty();
            }
        }

        int rel = Math.floorMod(structure.rootPitchClass() - tonic, 12);
        String numeral = numeral(rel, structure.quality());
        if (numeral == null) {
            return Optional.empty();
        }

        String cipher = FiguredBass.genericCipher(structure);
        HarmonicFunction function = PREDOMINANT.contains(numeral)
                ? HarmonicFunction.SUBDOMINANT
                : HarmonicFunction.forDegree(degreeOf(rel));
        return Optional.of(new ChromaticMatch(ChromaticType.BORROWED, numeral, cipher, numeral + cipher, function));
    }

    private static boolean inNaturalMinor(int rel) {
        for (int s : NATURAL_MINOR) {
            if (s == rel) {
                return true;
            }
        }
        return false;
    }

    private static String numeral(int rel, ChordQuality q) {
        boolean minor = q == ChordQuality.MINOR || q == ChordQuality.MINOR_SEVENTH;
        boolean major = q == ChordQuality.MAJOR || q == ChordQuality.MAJOR_SEVENTH || q == ChordQuality.DOMINANT_SEVENTH;
        return switch (rel) {
            case 0 -> minor ? "i" : null;
            case 2 -> q == ChordQuality.DIMINISHED ? "ii°"
                    : q == ChordQuality.HALF_DIMINISHED_SEVENTH ? "iiø" : null;
            case 3 -> major ? "bIII" : null;
            case 5 -> minor ? "iv" : null;
            case 7 -> minor ? "v" : null;
            case 8 -> major ? "bVI" : null;
            case 10 -> major ? "bVII" : null;
            default -> null;
        };
    }

    private static int degreeOf(int rel) {
        return switch (rel) {
            case 0 -> 1;
            case 2 -> 2;
            case 3 -> 3;
            case 5 -> 4;
            case 7 -> 5;
            case 8 -> 6;
            default -> 7;
        };
    }
}
