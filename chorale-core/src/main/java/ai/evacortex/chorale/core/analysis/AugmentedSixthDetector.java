/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

import ai.evacortex.chorale.core.chord.ChordSnapshot;
import ai.evacortex.chorale.core.chord.ChordStructure;
import ai.evacortex.chorale.core.key.Tonality;

import java.util.Optional;
import java.util.Set;

/**
 * Italian, French and German sixths, recognised from the pitch-class set
 * alone: lowered sixth, tonic and raised fourth, plus the second degree
 * (French) or the lowered third (German).
 *
 * <p>Works on chords no template fits, so the French sixth is found even
 * though its root is indeterminate.</p>
 */
public final class AugmentedSixthDetector implements ChromaticDetector {

    @Override
    public Optional<ChromaticMatch> detect(ChordStructure structure, ChordSnapshot snapshot, Tonality tonality) {
        Set<Integer> pcs = snapshot.pitchClasses();
        int tonic = tonality.tonicPitchClass();
        if (!pcs.contains(tonic)
                || !pcs.contains(Math.floorMod(tonic - 4, 12))
                || !pcs.contains(Math.floorMod(tonic + 6, 12))) {
            return Optional.empty();
        }

        ChromaticType type = null;
        String label = null;
        if (pcs.size() == 3) {
            type = ChromaticType.ITALIAN_SIXTH;
            label = "It+6";
        } else if (pcs.size() == 4 && pcs.contains(Math.floorMod(tonic + 2, 12))) {
            type = ChromaticType.FRENCH_SIXTH;
            label = "Fr+6";
        } else if (pcs.size() == 4 && pcs.contains(Math.floorMod(tonic + 3, 12))) {
            type = ChromaticType.GERMAN_SIXTH;
            label = "Ger+6";
        }
        if (type == null) {
            return Optional.empty();
        }
        return Optional.of(new ChromaticMatch(type, label, "", label, HarmonicFunction.SUBDOMINANT));
    }

    @Override
    public boolean requiresTemplate() {
        return false;
    }
}
