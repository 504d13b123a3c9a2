/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.chord;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static ai.evacortex.chorale.core.ChordTestUtils.satb;
import static org.junit.jupiter.api.Assertions.*;

class ChordSpellerTest {

    @Test
    void testSpell_rootPositionTriad() {
        ChordStructure s = ChordSpeller.spell(satb("G4", "D4", "B3", "G2"));
        assertEquals(7, s.rootPitchClass());
        assertEquals(ChordQuality.MAJOR, s.quality());
        assertEquals(0, s.inversion());
        assertEquals("G2", s.rootPitch().toString(), "lowest root pitch is kept");
        assertEquals(ChordFactor.THIRD, s.factor(Voice.TENOR));
        assertEquals(ChordFactor.FIFTH, s.factor(Voice.ALTO));
        assertEquals(2, s.count(ChordFactor.ROOT));
    }

    @Test
    void testSpell_inversionFollowsBassVoice() {
        assertEquals(1, ChordSpeller.spell(satb("C5", "G4", "C4", "E3")).inversion());
        assertEquals(2, ChordSpeller.spell(satb("E5", "C5", "G4", "G3")).inversion());
        ChordStructure v42 = ChordSpeller.spell(satb("G4", "D4", "B3", "F3"));
        assertEquals(ChordQuality.DOMINANT_SEVENTH, v42.quality());
        assertEquals(3, v42.inversion());
        assertEquals(ChordFactor.SEVENTH, v42.factor(Voice.BASS));
    }

    @Test
    void testSpell_seventhTemplates() {
        assertEquals(ChordQuality.MAJOR_SEVENTH, ChordSpeller.spell(satb("B4", "G4", "E4", "C3")).quality());
        assertEquals(ChordQuality.MINOR_SEVENTH, ChordSpeller.spell(satb("C5", "A4", "F4", "D3")).quality());
        assertEquals(ChordQuality.HALF_DIMINISHED_SEVENTH, ChordSpeller.spell(satb("A4", "F4", "D4", "B2")).quality());
    }

    @Test
    @DisplayName("Omitted fifth still yields the template")
    void testSpell_omittedFifth() {
        ChordStructure s = ChordSpeller.spell(satb("E4", "C4", "C4", "C3"));
        assertEquals(ChordQuality.MAJOR, s.quality());
        assertEquals(0, s.rootPitchClass());
        assertFalse(s.hasFactor(ChordFactor.FIFTH));

        ChordStructure v7 = ChordSpeller.spell(satb("F4", "B3", "G3", "G2"));
        assertEquals(ChordQuality.DOMINANT_SEVENTH, v7.quality());
        assertEquals(7, v7.rootPitchClass());
    }

    @Test
    void testSpell_ninthIsSetAside() {
        ChordStructure s = ChordSpeller.spell(satb("D4", "B3", "A3", "G2"));
        assertEquals(ChordQuality.MAJOR, s.quality());
        assertEquals(7, s.rootPitchClass());
        assertTrue(s.ninth());
        assertEquals(ChordFactor.NINTH, s.factor(Voice.TENOR));
    }

    @Test
    @DisplayName("Diminished seventh: preferred root wins and its seventh reads as a seventh")
    void testSpell_diminishedSeventhPreference() {
        ChordStructure s = ChordSpeller.spell(satb("Ab4", "F4", "D4", "B2"), pc -> pc == 11);
        assertEquals(ChordQuality.DIMINISHED_SEVENTH, s.quality());
        assertEquals(11, s.rootPitchClass());
        assertEquals(ChordFactor.SEVENTH, s.factor(Voice.SOPRANO));

        ChordStructure plain = ChordSpeller.spell(satb("Ab4", "F4", "D4", "B2"));
        assertEquals(11, plain.rootPitchClass(), "without preference the bass is tried first");
    }

    @Test
    void testSpell_unknownFallsBackToBass() {
        ChordStructure s = ChordSpeller.spell(satb("D4", "C4", "C4", "C3"));
        assertTrue(s.isIndeterminate());
        assertEquals(0, s.rootPitchClass());
        assertEquals(ChordFactor.NINTH, s.factor(Voice.SOPRANO));
    }

    @Test
    void testSpell_partialChords() {
        ChordStructure single = ChordSpeller.spell(satb(null, null, null, "A2"));
        assertTrue(single.isIndeterminate());
        assertEquals(9, single.rootPitchClass());

        ChordStructure noBass = ChordSpeller.spell(satb("E5", "C5", "G4", null));
        assertEquals(ChordQuality.MAJOR, noBass.quality());
        assertEquals(0, noBass.inversion(), "no bass voice means root position");

        assertThrows(IllegalArgumentException.class, () -> ChordSpeller.spell(new ChordSnapshot(Map.of())));
    }
}
