/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.chord.ChordFactor;
import ai.evacortex.chorale.core.exceptions.UnknownRuleException;
import ai.evacortex.chorale.core.rules.detect.DirectPerfectDetector;
import ai.evacortex.chorale.core.rules.detect.DuplicatedFactorDetector;
import ai.evacortex.chorale.core.rules.detect.ExcessiveMotionDetector;
import ai.evacortex.chorale.core.rules.detect.FactorOmissionDetector;
import ai.evacortex.chorale.core.rules.detect.LeadingToneResolutionDetector;
import ai.evacortex.chorale.core.rules.detect.MaximumDistanceDetector;
import ai.evacortex.chorale.core.rules.detect.ParallelPerfectDetector;
import ai.evacortex.chorale.core.rules.detect.PerfectKind;
import ai.evacortex.chorale.core.rules.detect.SeventhResolutionDetector;
import ai.evacortex.chorale.core.rules.detect.UnequalFifthsDetector;
import ai.evacortex.chorale.core.rules.detect.VoiceCrossingDetector;
import ai.evacortex.chorale.core.rules.detect.VoiceOverlapDetector;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static ai.evacortex.chorale.core.rules.ExceptionPredicate.*;

/**
 * The built-in rule catalogue, in evaluation order.
 */
public final class RuleCatalog {

    private static final List<RuleDefinition> DEFAULTS = List.of(
            new RuleDefinition(RuleId.PARALLEL_FIFTHS, RuleTier.CRITICAL,
                    "Parallel fifths", "Consecutive fifths",
                    "Two voices move from one perfect fifth to another. The voices lose their independence.",
                    List.of(V_VII_PAIR, VOICING_CHANGE, SECOND_FIFTH_DIMINISHED),
                    ConfidencePolicy.CERTAIN, new ParallelPerfectDetector(PerfectKind.FIFTH)),
            new RuleDefinition(RuleId.PARALLEL_OCTAVES, RuleTier.CRITICAL,
                    "Parallel octaves", "Consecutive octaves",
                    "Two voices move from one octave or unison to another, merging into a single line.",
                    List.of(V_VII_PAIR, VOICING_CHANGE),
                    ConfidencePolicy.CERTAIN, new ParallelPerfectDetector(PerfectKind.OCTAVE)),
            new RuleDefinition(RuleId.DIRECT_FIFTHS, RuleTier.CRITICAL,
                    "Direct fifths", null,
                    "Two voices reach a perfect fifth in similar motion with a leap.",
                    List.of(OUTER_FIFTH_APPROACH, STEP_AGAINST_LEAP, VOICING_CHANGE),
                    ConfidencePolicy.BY_VOICE_PAIR, new DirectPerfectDetector(PerfectKind.FIFTH)),
            new RuleDefinition(RuleId.DIRECT_OCTAVES, RuleTier.CRITICAL,
                    "Direct octaves", null,
                    "Two voices reach an octave in similar motion with a leap.",
                    List.of(OUTER_OCTAVE_APPROACH, STEP_AGAINST_LEAP, VOICING_CHANGE),
                    ConfidencePolicy.BY_VOICE_PAIR, new DirectPerfectDetector(PerfectKind.OCTAVE)),
            new RuleDefinition(RuleId.UNEQUAL_FIFTHS, RuleTier.CRITICAL,
                    "Unequal fifths", null,
                    "A diminished fifth against the bass moves to a perfect fifth.",
                    List.of(BASS_SOPRANO_TENTHS),
                    ConfidencePolicy.HIGH, new UnequalFifthsDetector()),
            new RuleDefinition(RuleId.LEADING_TONE_RESOLUTION, RuleTier.CRITICAL,
                    "Unresolved leading tone", null,
                    "The leading tone of a dominant chord should rise a semitone to the tonic.",
                    List.of(RESOLUTION_NOT_EXPECTED, V_VII_PAIR, DECEPTIVE_BASS_TO_ROOT, INDIRECT_RESOLUTION),
                    ConfidencePolicy.CERTAIN, new LeadingToneResolutionDetector()),
            new RuleDefinition(RuleId.SEVENTH_RESOLUTION, RuleTier.CRITICAL,
                    "Unresolved seventh", null,
                    "The seventh of a chord should resolve down by step.",
                    List.of(VOICING_CHANGE),
                    ConfidencePolicy.CERTAIN, new SeventhResolutionDetector()),
            new RuleDefinition(RuleId.VOICE_CROSSING, RuleTier.CRITICAL,
                    "Voice crossing", null,
                    "A lower voice sounds above the voice that should be higher.",
                    List.of(),
                    ConfidencePolicy.CERTAIN, new VoiceCrossingDetector()),
            new RuleDefinition(RuleId.MAXIMUM_DISTANCE, RuleTier.IMPORTANT,
                    "Voices too far apart", null,
                    "Soprano and alto, or alto and tenor, are more than an octave apart.",
                    List.of(),
                    ConfidencePolicy.MEDIUM, new MaximumDistanceDetector()),
            new RuleDefinition(RuleId.VOICE_OVERLAP, RuleTier.IMPORTANT,
                    "Voice overlap", null,
                    "A voice moves past the pitch its neighbour held in the previous chord.",
                    List.of(),
                    ConfidencePolicy.MEDIUM, new VoiceOverlapDetector()),
            new RuleDefinition(RuleId.DUPLICATED_LEADING_TONE, RuleTier.CRITICAL,
                    "Doubled leading tone", null,
                    "The third of a dominant chord is the leading tone and should not be doubled.",
                    List.of(),
                    ConfidencePolicy.CERTAIN, new DuplicatedFactorDetector(ChordFactor.THIRD, true)),
            new RuleDefinition(RuleId.DUPLICATED_SEVENTH, RuleTier.CRITICAL,
                    "Doubled seventh", null,
                    "The chord seventh is a tendency tone and should not be doubled.",
                    List.of(),
                    ConfidencePolicy.CERTAIN, new DuplicatedFactorDetector(ChordFactor.SEVENTH, false)),
            new RuleDefinition(RuleId.EXCESSIVE_MELODIC_MOTION, RuleTier.IMPORTANT,
                    "Leap larger than an octave", null,
                    "A voice leaps by more than an octave between two chords.",
                    List.of(),
                    ConfidencePolicy.HIGH, new ExcessiveMotionDetector()),
            new RuleDefinition(RuleId.IMPROPER_OMISSION, RuleTier.IMPORTANT,
                    "Omitted chord factor", null,
                    "The chord leaves out an essential factor. The third defines the chord's quality; "
                            + "a seventh chord needs its seventh. Only the fifth may be omitted.",
                    List.of(),
                    ConfidencePolicy.OMISSION, new FactorOmissionDetector()));

    private RuleCatalog() {}

    public static List<RuleDefinition> defaults() {
        return DEFAULTS;
    }

    public static Optional<RuleDefinition> find(String name) {
        return RuleId.fromName(name).map(RuleCatalog::get);
    }

    /**
     * @throws UnknownRuleException if no built-in rule has this name
     */
    public static RuleDefinition require(String name) {
        return find(name).orElseThrow(() -> new UnknownRuleException(String.valueOf(name)));
    }

    public static RuleDefinition get(RuleId id) {
        for (RuleDefinition r : DEFAULTS) {
            if (r.id() == id) {
                return r;
            }
        }
        throw new UnknownRuleException(id.id());
    }

    /** One line per rule: name, tier, short message and explanation. */
    public static List<String> describe() {
        List<String> lines = new ArrayList<>(DEFAULTS.size());
        for (RuleDefinition r : DEFAULTS) {
            lines.add(String.format("%-26s %-9s %s: %s", r.name(), r.tier(), r.shortMessage(), r.explanation()));
        }
        return lines;
    }
}
