/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

import ai.evacortex.chorale.core.chord.ChordFactor;
import ai.evacortex.chorale.core.chord.ChordQuality;
import ai.evacortex.chorale.core.chord.ChordSnapshot;
import ai.evacortex.chorale.core.chord.ChordStructure;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.pitch.Pitch;

import java.util.Objects;

/**
 * Functional reading of one chord in a key.
 *
 * @param snapshot      the pitches analysed
 * @param structure     root, quality, factors and inversion
 * @param degree        degree of the root (1-7), 0 when indeterminate
 * @param label         degree label, e.g. {@code V}, {@code vii°}, {@code V/V}, {@code N}, {@code bVI}, {@code #IV?}
 * @param cipher        figured-bass cipher
 * @param fullLabel     label and cipher combined, e.g. {@code V7,+} or {@code V6,5t/V}
 * @param function      harmonic function
 * @param diatonic      every pitch class belongs to the key
 * @param chromaticType chromatic classification, {@code null} for ordinary chords
 * @param seventh       chord contains a seventh
 * @param ninth         chord contains a ninth
 */
public record ChordAnalysis(ChordSnapshot snapshot,
                            ChordStructure structure,
                            int degree,
                            String label,
                            String cipher,
                            String fullLabel,
                            HarmonicFunction function,
                            boolean diatonic,
                            ChromaticType chromaticType,
                            boolean seventh,
                            boolean ninth) {

    public static final String UNKNOWN_LABEL = "?";

    public ChordAnalysis {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(structure, "structure must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(cipher, "cipher must not be null");
        Objects.requireNonNull(fullLabel, "fullLabel must not be null");
        Objects.requireNonNull(function, "function must not be null");
    }

    public int rootPitchClass() {
        return structure.rootPitchClass();
    }

    public ChordQuality quality() {
        return structure.quality();
    }

    public int inversion() {
        return structure.inversion();
    }

    public ChordFactor factor(Voice voice) {
        return structure.factor(voice);
    }

    public Pitch pitch(Voice voice) {
        return snapshot.pitch(voice);
    }

    public boolean isChromaticSpecial() {
        return chromaticType != null;
    }

    public boolean isSecondaryDominant() {
        return chromaticType == ChromaticType.SECONDARY_DOMINANT;
    }

    public boolean isIndeterminate() {
        return structure.isIndeterminate();
    }
}
