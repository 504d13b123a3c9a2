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
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.pitch.MotionType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static ai.evacortex.chorale.core.ChordTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ExceptionEvaluatorTest {

    private static final ChordAnalysis V7 = inC("F4", "D4", "B3", "G2");
    private static final ChordAnalysis I = inC("E4", "C4", "C4", "C3");

    @Test
    void testStepAgainstLeap_innerPairOnly() {
        Detection tenorBass = Detection.pair(new VoicePair(Voice.TENOR, Voice.BASS), MotionType.PARALLEL);
        assertEquals(PredicateResult.APPLIES,
                ExceptionEvaluator.evaluate(ExceptionPredicate.STEP_AGAINST_LEAP, pair(V7, I), tenorBass, C_MAJOR));

        Detection outer = Detection.pair(new VoicePair(Voice.SOPRANO, Voice.BASS), MotionType.PARALLEL);
        assertEquals(PredicateResult.DOES_NOT_APPLY,
                ExceptionEvaluator.evaluate(ExceptionPredicate.STEP_AGAINST_LEAP, pair(V7, I), outer, C_MAJOR));
    }

    @Test
    void testOuterOctaveApproach_stepUpAgainstFourthUp() {
        ChordAnalysis v = inC("B4", "D4", "G3", "G2");
        ChordAnalysis i = inC("C5", "E4", "G3", "C3");
        Detection outer = Detection.pair(new VoicePair(Voice.SOPRANO, Voice.BASS), MotionType.PARALLEL);
        assertEquals(PredicateResult.APPLIES,
                ExceptionEvaluator.evaluate(ExceptionPredicate.OUTER_OCTAVE_APPROACH, pair(v, i), outer, C_MAJOR));
    }

    @Test
    void testResolutionNotExpected_localLeadingToneAlwaysResolves() {
        ChordAnalysis iv = inC("A4", "F4", "C4", "F3");
        Detection key = Detection.of(0, List.of(Voice.SOPRANO));
        Detection local = key.withTag(Detection.Tag.LOCAL_LEADING_TONE);
        assertEquals(PredicateResult.APPLIES,
                ExceptionEvaluator.evaluate(ExceptionPredicate.RESOLUTION_NOT_EXPECTED, pair(V7, iv), key, C_MAJOR));
        assertEquals(PredicateResult.DOES_NOT_APPLY,
                ExceptionEvaluator.evaluate(ExceptionPredicate.RESOLUTION_NOT_EXPECTED, pair(V7, iv), local, C_MAJOR));
    }

    @Test
    void testDeceptiveBassToRoot() {
        ChordAnalysis v = inC("D5", "B4", "G4", "B2");
        ChordAnalysis vi = inC("C5", "C5", "E4", "A2");
        Detection bass = Detection.of(0, List.of(Voice.BASS));
        assertEquals(PredicateResult.APPLIES,
                ExceptionEvaluator.evaluate(ExceptionPredicate.DECEPTIVE_BASS_TO_ROOT, pair(v, vi), bass, C_MAJOR));
        assertEquals(PredicateResult.DOES_NOT_APPLY,
                ExceptionEvaluator.evaluate(ExceptionPredicate.DECEPTIVE_BASS_TO_ROOT, pair(v, vi), bass, A_MINOR));
    }

    @Test
    void testBassSopranoTenths() {
        ChordAnalysis one = inC("D4", "B3", "G3", "B2");
        ChordAnalysis two = inC("E4", "C4", "G3", "C3");
        Detection any = Detection.pair(new VoicePair(Voice.BASS, Voice.TENOR), MotionType.PARALLEL);
        assertEquals(PredicateResult.APPLIES,
                ExceptionEvaluator.evaluate(ExceptionPredicate.BASS_SOPRANO_TENTHS, pair(one, two), any, C_MAJOR));
    }

    @Test
    void testFailingPredicateReportsFailed() {
        Detection threeVoices = Detection.of(0, List.of(Voice.SOPRANO, Voice.ALTO, Voice.TENOR));
        assertEquals(PredicateResult.FAILED,
                ExceptionEvaluator.evaluate(ExceptionPredicate.STEP_AGAINST_LEAP, pair(V7, I), threeVoices, C_MAJOR));
    }
}
