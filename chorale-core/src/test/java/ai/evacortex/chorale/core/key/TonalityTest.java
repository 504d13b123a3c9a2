/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.key;

import ai.evacortex.chorale.core.exceptions.InvalidKeyException;
import ai.evacortex.chorale.core.pitch.Pitch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.OptionalInt;

import static org.junit.jupiter.api.Assertions.*;

class TonalityTest {

    @Test
    void testDiatonicSet_major() {
        Tonality c = Tonality.major("C");
        assertEquals(List.of(0, 2, 4, 5, 7, 9, 11), List.copyOf(c.diatonicSet()));
        assertEquals(List.of(7, 9, 11, 0, 2, 4, 6), List.copyOf(Tonality.major("G").diatonicSet()));
        assertEquals(11, c.leadingTone());
    }

    @Test
    @DisplayName("Minor keys use the harmonic form and accept the subtonic as degree 7")
    void testDiatonicSet_minorIsHarmonic() {
        Tonality a = Tonality.minor("A");
        assertEquals(List.of(9, 11, 0, 2, 4, 5, 8, 7), List.copyOf(a.diatonicSet()));
        assertEquals(OptionalInt.of(7), a.scaleDegree(8), "G# is the leading tone");
        assertEquals(OptionalInt.of(7), a.scaleDegree(7), "G natural is the subtonic");
        assertTrue(a.isDiatonic(7));
        assertFalse(a.isDiatonic(10));
    }

    @Test
    @DisplayName("A pitch class has a scale degree exactly when it is in the diatonic set")
    void testScaleDegree_agreesWithDiatonicSet() {
        for (Tonality t : List.of(Tonality.major("C"), Tonality.minor("A"), Tonality.minor("C#"), Tonality.major("Bb"))) {
            for (int pc = 0; pc < 12; pc++) {
                boolean member = t.diatonicSet().contains(pc);
                assertEquals(member, t.scaleDegree(pc).isPresent(), t + " pc " + pc);
                assertEquals(member, t.isDiatonic(pc), t + " pc " + pc);
            }
        }
        assertTrue(KeyContext.of("A", Mode.MINOR).diatonicSet().contains(7), "context exposes the subtonic");
    }

    @Test
    void testScaleDegree_ofPitches() {
        Tonality eb = Tonality.major("Eb");
        assertEquals(3, eb.tonicPitchClass());
        assertEquals(OptionalInt.of(5), eb.scaleDegree(Pitch.parse("Bb3")));
        assertEquals(OptionalInt.empty(), eb.scaleDegree(Pitch.parse("B3")));
        assertEquals(5, eb.letterDegree(Pitch.parse("B3")));
        assertEquals(1, eb.chromaticOffset(Pitch.parse("B3")));
        assertEquals(-1, Tonality.major("C").chromaticOffset(Pitch.parse("Ab4")));
    }

    @Test
    void testFactories_parseTonicNames() {
        assertEquals(6, Tonality.major("F#").tonicPitchClass());
        assertEquals(10, Tonality.minor("B-").tonicPitchClass());
        assertEquals("F# major", Tonality.major("F#").toString());
        assertEquals(Mode.MINOR, Tonality.of("d", Mode.fromName("min")).mode());
        assertEquals(Tonality.minor("C"), Tonality.major("C").parallel());
    }

    @Test
    void testFactories_rejectInvalidKeys() {
        assertThrows(InvalidKeyException.class, () -> Tonality.major(""));
        assertThrows(InvalidKeyException.class, () -> Tonality.major("H"));
        assertThrows(InvalidKeyException.class, () -> Tonality.major("C##"));
        assertThrows(InvalidKeyException.class, () -> Tonality.major(null));
    }

    @Test
    @DisplayName("Snapshots taken before a key change keep the old key")
    void testKeyContext_snapshotIsStable() {
        KeyContext ctx = KeyContext.of("C", Mode.MAJOR);
        Tonality before = ctx.snapshot();
        ctx.setTonality(Tonality.minor("E"));
        assertEquals(Tonality.major("C"), before);
        assertEquals(Mode.MINOR, ctx.mode());
        assertEquals(4, ctx.tonicPitchClass());
        assertThrows(NullPointerException.class, () -> ctx.setTonality(null));
    }
}
