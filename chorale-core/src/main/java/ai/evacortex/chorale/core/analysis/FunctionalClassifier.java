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
import ai.evacortex.chorale.core.chord.ChordSnapshot;
import ai.evacortex.chorale.core.chord.ChordSpeller;
import ai.evacortex.chorale.core.chord.ChordStructure;
import ai.evacortex.chorale.core.key.Tonality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Assigns degree, roman-numeral label, figured-bass cipher and harmonic
 * function to a chord in a key.
 *
 * <p>Chromatic detectors run first, in priority order (secondary dominant,
 * Neapolitan, augmented sixth, modal borrowing), and the first match
 * replaces the plain diatonic label. A chromatic chord none of them
 * explains keeps its degree label with a trailing {@code ?}.</p>
 *
 * <p>Stateless; one instance may serve any number of keys and threads.</p>
 */
public final class FunctionalClassifier {

    private static final Logger log = LoggerFactory.getLogger(FunctionalClassifier.class);

    private final List<ChromaticDetector> detectors;

    public FunctionalClassifier() {
        this(defaultDetectors());
    }

    public FunctionalClassifier(List<ChromaticDetector> detectors) {
        this.detectors = List.copyOf(Objects.requireNonNull(detectors, "detectors must not be null"));
    }

    public static List<ChromaticDetector> defaultDetectors() {
        return List.of(
                new SecondaryDominantDetector(),
                new NeapolitanDetector(),
                new AugmentedSixthDetector(),
                new ModalBorrowingDetector());
    }

    /**
     * @throws IllegalArgumentException if the snapshot has no sounding voice
     */
    public ChordAnalysis classify(ChordSnapshot snapshot, Tonality tonality) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(tonality, "tonality must not be null");

        int leadingTone = tonality.leadingTone();
        ChordStructure structure = ChordSpeller.spell(snapshot, pc -> pc == leadingTone);

        boolean diatonic = true;
        for (int pc : snapshot.pitchClasses()) {
            if (!tonality.isDiatonic(pc)) {
                diatonic = false;
                break;
            }
        }
        boolean seventh = structure.quality().isSeventh() || structure.hasFactor(ChordFactor.SEVENTH);
        boolean ninth = structure.ninth();

        Optional<ChromaticMatch> match = detectChromatic(structure, snapshot, tonality);
        ChordAnalysis analysis;
        if (match.isPresent()) {
            ChromaticMatch m = match.get();
            analysis = new ChordAnalysis(snapshot, structure, RomanNumerals.degree(tonality, structure.rootPitch()),
                    m.label(), m.cipher(), m.fullLabel(), m.function(), diatonic, m.type(), seventh, ninth);
        } else if (structure.isIndeterminate()) {
            analysis = new ChordAnalysis(snapshot, structure, 0, ChordAnalysis.UNKNOWN_LABEL, "",
                    ChordAnalysis.UNKNOWN_LABEL, HarmonicFunction.TONIC, diatonic, null, seventh, ninth);
        } else {
            int degree = RomanNumerals.degree(tonality, structure.rootPitch());
            String label = RomanNumerals.label(tonality, structure.rootPitch(), structure.quality());
            if (!diatonic) {
                label = label + "?";
            }
            String cipher = FiguredBass.cipher(structure);
            analysis = new ChordAnalysis(snapshot, structure, degree, label, cipher, label + cipher,
                    HarmonicFunction.forDegree(degree), diatonic, null, seventh, ninth);
        }

        if (log.isDebugEnabled()) {
            log.debug("{} in {} -> {} ({}, {})", snapshot, tonality, analysis.fullLabel(),
                    structure.quality().tag(), analysis.function());
        }
        return analysis;
    }

    private Optional<ChromaticMatch> detectChromatic(ChordStructure structure, ChordSnapshot snapshot, Tonality tonality) {
        for (ChromaticDetector detector : detectors) {
            if (structure.isIndeterminate() && detector.requiresTemplate()) {
                continue;
            }
            Optional<ChromaticMatch> m = detector.detect(structure, snapshot, tonality);
            if (m.isPresent()) {
                return m;
            }
        }
        return Optional.empty();
    }
}
