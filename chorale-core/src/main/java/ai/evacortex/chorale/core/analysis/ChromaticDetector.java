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

/**
 * One recogniser of chromatic chords. The classifier runs detectors in a
 * fixed priority order and keeps the first match.
 *
 * <p>Implementations must be stateless and thread-safe.</p>
 */
public interface ChromaticDetector {

    /**
     * @param structure key-independent reading of the chord
     * @param snapshot  sounding pitches
     * @param tonality  active key
     * @return the chromatic labelling, or empty when the chord is not of this kind
     */
    Optional<ChromaticMatch> detect(ChordStructure structure, ChordSnapshot snapshot, Tonality tonality);

    /**
     * Whether this detector needs a matched root and quality. Chords no
     * template fits are offered only to detectors returning {@code false}.
     */
    default boolean requiresTemplate() {
        return true;
    }
}
