/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.report;

import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.rules.RuleId;
import ai.evacortex.chorale.core.rules.RuleTier;
import ai.evacortex.chorale.core.rules.RuleViolation;
import ai.evacortex.chorale.core.rules.Severity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ViolationFormatterTest {

    private static RuleViolation violation(List<Voice> voices, int pairIndex, int chordIndex, String message) {
        return new RuleViolation(RuleId.VOICE_CROSSING, RuleTier.CRITICAL, Severity.CRITICAL, 100,
                voices, null, pairIndex, chordIndex, message);
    }

    @Test
    void testFormat_placesViolationOnBeatGrid() {
        ViolationFormatter f = new ViolationFormatter(4);
        FormattedViolation v = f.format(violation(List.of(Voice.TENOR, Voice.ALTO), 4, 1, "Voice crossing"));

        assertEquals("err-5", v.id());
        assertEquals(5, v.position());
        assertEquals(2, v.measure());
        assertEquals(2, v.beat());
        assertEquals("voice_crossing", v.rule());
        assertEquals("CRITICAL", v.tier());
        assertEquals("Tenor-Alto", v.voices());
        assertEquals("Measure 2, beat 2: Voice crossing (Tenor-Alto)", v.message());
    }

    @Test
    void testFormat_voicesAreListedFromTheBass() {
        ViolationFormatter f = new ViolationFormatter(3);
        FormattedViolation v = f.format(violation(List.of(Voice.SOPRANO, Voice.BASS), 0, 0, "Direct fifths"));
        assertEquals("Bass-Soprano", v.voices());
        assertEquals("Measure 1, beat 1: Direct fifths (Bass-Soprano)", v.message());

        FormattedViolation third = f.format(violation(List.of(), 2, 1, "Omitted chord factor (third)"));
        assertEquals("?", third.voices());
        assertEquals(2, third.measure(), "position 3 with three beats per measure");
        assertEquals(1, third.beat());
    }

    @Test
    void testConstructor_rejectsEmptyMeasure() {
        assertThrows(IllegalArgumentException.class, () -> new ViolationFormatter(0));
    }
}
