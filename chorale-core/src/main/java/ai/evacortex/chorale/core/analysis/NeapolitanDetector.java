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

/** Major triad on the lowered second degree. */
public final class NeapolitanDetector implements ChromaticDetector {

    public static final String LABEL = "N";

    @Override
    public Optional<ChromaticMatch> detect(ChordStructure structure, ChordSnapshot snapshot, Tonality tonality) {
        if (structure.quality() != ChordQuality.MAJOR) {
            return Optional.empty();
        }
        if (Math.floorMod(structure.rootPitchClass() - tonality.tonicPitchClass(), 12) != 1) {
            return Optional.empty();
        }
        String cipher = FiguredBass.Category.TRIAD.cipher(structure.inversion());
        return Optional.of(new ChromaticMatch(ChromaticType.NEAPOLITAN, LABEL, cipher, LABEL + cipher,
                HarmonicFunction.SUBDOMINANT));
    }
}
