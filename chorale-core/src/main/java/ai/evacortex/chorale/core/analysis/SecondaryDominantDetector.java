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
import ai.evacortex.chorale.core.key.Tonality;

import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Applied dominants and leading-tone chords: a major or dominant-seventh
 * chord a fifth above a diatonic target, or a diminished chord a semitone
 * below it, carrying at least one chromatic pitch.
 */
public final class SecondaryDominantDetector implements ChromaticDetector {

    private static final Set<Integer> TARGET_DEGREES = Set.of(2, 3, 4, 5, 6);

    @Override
    public Optional<ChromaticMatch> detect(ChordStructure structure, ChordSnapshot snapshot, Tonality tonality) {
        ChordQuality q = structure.quality();
        String kind;
        int target;
        switch (q) {
            case MAJOR, DOMINANT_SEVENTH -> {
                kind = "V";
                target = structure.rootPitchClass() + 5;
            }
            case DIMINISHED, DIMINISHED_SEVENTH -> {
                kind = "vii°";
                target = structure.rootPitchClass() + 1;
            }
            case HALF_DIMINISHED_SEVENTH -> {
                kind = "viiø";
                target = structure.rootPitchClass() + 1;
            }
            default -> {
                return Optional.empty();
            }
        }

        boolean chromatic = false;
        for (int pc : snapshot.pitchClasses()) {
            if (!tonality.isDiatonic(pc)) {
                chromatic = true;
                break;
            }
        }
        if (!chromatic) {
            return Optional.empty();
        }

        OptionalInt targetDegree = tonality.scaleDegree(target);
        if (targetDegree.isEmpty() || !TARGET_DEGREES.contains(targetDegree.getAsInt())) {
            return Optional.empty();
        }

        String targetLabel = tonality.mode().numeral(targetDegree.getAsInt());
        String cipher = FiguredBass.cipher(structure);
        String label = kind + "/" + targetLabel;
        String full = kind + cipher + "/" + targetLabel;
        return Optional.of(new ChromaticMatch(ChromaticType.SECONDARY_DOMINANT, label, cipher, full,
                HarmonicFunction.DOMINANT));
    }
}
