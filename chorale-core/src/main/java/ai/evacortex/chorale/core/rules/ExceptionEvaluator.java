/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.chord.ChordFactor;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.key.Mode;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.pitch.MotionType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Evaluates {@link ExceptionPredicate} constants against a candidate
 * violation. A predicate that throws is reported as
 * {@link PredicateResult#FAILED} and logged.
 */
public final class ExceptionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExceptionEvaluator.class);

    private ExceptionEvaluator() {}

    public static PredicateResult evaluate(ExceptionPredicate predicate,
                                           ProgressionPair pair,
                                           Detection detection,
                                           Tonality tonality) {
        try {
            return PredicateResult.of(test(predicate, pair, detection, tonality));
        } catch (RuntimeException e) {
            log.warn("Exception predicate {} failed on pair {}: {}", predicate, pair.index(), e.toString());
            return PredicateResult.FAILED;
        }
    }

    private static boolean test(ExceptionPredicate predicate, ProgressionPair pair, Detection d, Tonality tonality) {
        return switch (predicate) {
            case VOICING_CHANGE -> ContextAnalyzer.isVoicingChange(pair.first(), pair.second());
            case V_VII_PAIR -> ContextAnalyzer.isVToViiPair(pair.first(), pair.second());
            case SECOND_FIFTH_DIMINISHED -> secondFifthDiminished(pair, d);
            case OUTER_FIFTH_APPROACH -> outerApproach(pair, d, false);
            case OUTER_OCTAVE_APPROACH -> outerApproach(pair, d, true);
            case STEP_AGAINST_LEAP -> stepAgainstLeap(pair, d);
            case BASS_SOPRANO_TENTHS -> bassSopranoTenths(pair);
            case RESOLUTION_NOT_EXPECTED -> resolutionNotExpected(pair, d);
            case DECEPTIVE_BASS_TO_ROOT -> deceptiveBassToRoot(pair, d, tonality);
            case INDIRECT_RESOLUTION -> indirectResolution(pair, d);
        };
    }

    private static VoicePair pairOf(Detection d) {
        List<Voice> v = d.voices();
        if (v.size() != 2) {
            throw new IllegalStateException("expected a voice pair, got " + v);
        }
        return new VoicePair(v.get(0), v.get(1));
    }

    private static boolean secondFifthDiminished(ProgressionPair pair, Detection d) {
        return pair.intervalAfter(pairOf(d)).isDiminishedFifth();
    }

    private static boolean outerApproach(ProgressionPair pair, Detection d, boolean octave) {
        VoicePair vp = pairOf(d);
        if (!vp.isOuter()) {
            return false;
        }
        int soprano = pair.movement(Voice.SOPRANO);
        int bass = pair.movement(Voice.BASS);
        if (octave) {
            return soprano == 1 && bass == 5;
        }
        int leap = Math.abs(bass);
        return Math.abs(soprano) <= 2 && leap >= 3 && leap <= 7;
    }

    private static boolean stepAgainstLeap(ProgressionPair pair, Detection d) {
        VoicePair vp = pairOf(d);
        if (vp.isOuter()) {
            return false;
        }
        boolean firstStep = Math.abs(pair.movement(vp.first())) <= 2;
        boolean secondStep = Math.abs(pair.movement(vp.second())) <= 2;
        return firstStep != secondStep;
    }

    private static boolean bassSopranoTenths(ProgressionPair pair) {
        VoicePair outer = new VoicePair(Voice.BASS, Voice.SOPRANO);
        if (!pair.sounds(outer)) {
            return false;
        }
        return pair.intervalBefore(outer).isThird()
                && pair.intervalAfter(outer).isThird()
                && pair.motion(outer) == MotionType.PARALLEL;
    }

    private static boolean resolutionNotExpected(ProgressionPair pair, Detection d) {
        if (d.has(Detection.Tag.LOCAL_LEADING_TONE)) {
            return false;
        }
        ChordAnalysis next = pair.second();
        if (next.isIndeterminate()) {
            return false;
        }
        int degree = next.degree();
        return degree != 1 && degree != 6;
    }

    private static boolean deceptiveBassToRoot(ProgressionPair pair, Detection d, Tonality tonality) {
        if (!d.involves(Voice.BASS) || d.has(Detection.Tag.LOCAL_LEADING_TONE)) {
            return false;
        }
        if (tonality.mode() != Mode.MAJOR) {
            return false;
        }
        ChordAnalysis next = pair.second();
        return next.degree() == 6 && next.factor(Voice.BASS) == ChordFactor.ROOT;
    }

    private static boolean indirectResolution(ProgressionPair pair, Detection d) {
        for (Voice v : d.voices()) {
            if (v != Voice.ALTO && v != Voice.TENOR) {
                continue;
            }
            Voice above = v.above();
            ChordAnalysis next = pair.second();
            if (next.factor(v) == ChordFactor.FIFTH && next.factor(above) == ChordFactor.ROOT) {
                return true;
            }
        }
        return false;
    }
}
