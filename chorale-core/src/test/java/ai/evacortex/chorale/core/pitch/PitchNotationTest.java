/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.pitch;

import ai.evacortex.chorale.core.exceptions.InvalidPitchException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PitchNotationTest {

    @Test
    @DisplayName("Letters, accidentals and octave are read")
    void testParse_readsAllParts() {
        Pitch p = PitchNotation.parse("F#4");
        assertEquals(Step.F, p.step());
        assertEquals(1, p.accidental());
        assertEquals(4, p.octave());
        assertEquals(66, p.semitoneValue());

        assertEquals(-1, PitchNotation.parse("Bb3").accidental());
        assertEquals(-1, PitchNotation.parse("E-5").accidental(), "'-' is an alias for flat");
        assertEquals(2, PitchNotation.parse("Cx4").accidental());
        assertEquals(-2, PitchNotation.parse("Dbb2").accidental());
        assertEquals(Step.A, PitchNotation.parse("  a3 ").step(), "lower-case letters and padding accepted");
    }

    @Test
    void testSemitoneValue_middleCIsSixty() {
        assertEquals(60, Pitch.parse("C4").semitoneValue());
        assertEquals(69, Pitch.parse("A4").semitoneValue());
        assertEquals(59, Pitch.parse("Cb4").semitoneValue());
        assertEquals(11, Pitch.parse("Cb4").pitchClass());
        assertEquals(72, Pitch.parse("B#4").semitoneValue(), "B#4 sounds as C5");
    }

    @Test
    void testToString_roundTripsSpelling() {
        assertEquals("C#4", Pitch.parse("C#4").toString());
        assertEquals("Bb3", Pitch.parse("B-3").toString());
        assertEquals("Eb", Pitch.parse("Eb5").name());
    }

    @Test
    @DisplayName("Malformed names are rejected with InvalidPitchException")
    void testParse_rejectsMalformedInput() {
        assertThrows(InvalidPitchException.class, () -> PitchNotation.parse(null));
        assertThrows(InvalidPitchException.class, () -> PitchNotation.parse(""));
        assertThrows(InvalidPitchException.class, () -> PitchNotation.parse("H4"));
        assertThrows(InvalidPitchException.class, () -> PitchNotation.parse("C"));
        assertThrows(InvalidPitchException.class, () -> PitchNotation.parse("C#x4"));
        assertThrows(InvalidPitchException.class, () -> PitchNotation.parse("C4z"));
        InvalidPitchException e = assertThrows(InvalidPitchException.class, () -> PitchNotation.parse("Q4"));
        assertTrue(e.getMessage().startsWith("Invalid pitch: "));
    }

    @Test
    @DisplayName("A minus sign before the octave is a flat, not a negative octave")
    void testParse_minusIsFlatBeforeOctave() {
        Pitch p = PitchNotation.parse("C-1");
        assertEquals(-1, p.accidental());
        assertEquals(1, p.octave());
        assertEquals(-2, PitchNotation.parse("C--1").accidental());
        assertEquals(0, PitchNotation.parse("A0").octave());
        assertEquals(9, PitchNotation.parse("G9").octave());
        assertThrows(InvalidPitchException.class, () -> PitchNotation.parse("C10"));
    }
}
