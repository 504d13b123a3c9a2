/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

import ai.evacortex.chorale.core.chord.ChordQuality;
import ai.evacortex.chorale.core.chord.ChordSpeller;
import org.junit.jupiter.api.Test;

import static ai.evacortex.chorale.core.ChordTestUtils.satb;
import static org.junit.jupiter.api.Assertions.*;

class FiguredBassTest {

    @Test
    void testCategoryTables() {
        assertEquals("", FiguredBass.Category.TRIAD.cipher(0));
        assertEquals("6", FiguredBass.Category.TRIAD.cipher(1));
        assertEquals("6/4", FiguredBass.Category.TRIAD.cipher(2));
        assertEquals("", FiguredBass.Category.TRIAD.cipher(3), "missing inversion reads as root position");
        assertEquals("7,+", FiguredBass.Category.DOMINANT_SEVENTH.cipher(0));
        assertEquals("+4,3", FiguredBass.Category.DIMINISHED_SEVENTH.cipher(2));
        assertEquals("4,+2", FiguredBass.Category.HALF_DIMINISHED_SEVENTH.cipher(3));
        assertEquals("6,5", FiguredBass.Category.SEVENTH.cipher(1));
    }

    @Test
    void testCategoryOf() {
        assertEquals(FiguredBass.Category.SEVENTH, FiguredBass.categoryOf(ChordQuality.MAJOR_SEVENTH));
        assertEquals(FiguredBass.Category.SEVENTH, FiguredBass.categoryOf(ChordQuality.MINOR_SEVENTH));
        assertEquals(FiguredBass.Category.TRIAD, FiguredBass.categoryOf(ChordQuality.AUGMENTED));
        assertEquals(FiguredBass.Category.TRIAD, FiguredBass.categoryOf(ChordQuality.UNKNOWN));
    }

    @Test
    void testCipher_fromStructure() {
        assertEquals("6,5t", FiguredBass.cipher(ChordSpeller.spell(satb("G4", "F4", "D4", "B2"))));
        assertEquals("6,5", FiguredBass.genericCipher(ChordSpeller.spell(satb("G4", "F4", "D4", "B2"))));
        assertEquals("9", FiguredBass.cipher(ChordSpeller.spell(satb("D4", "B3", "A3", "G2"))));
    }
}
