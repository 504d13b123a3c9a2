/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.chord;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;

import static org.junit.jupiter.api.Assertions.*;

class ChordFactorPropertiesTest {

    @Property
    void factorIgnoresOctaves(@ForAll @IntRange(min = 0, max = 11) int semitones,
                              @ForAll @IntRange(min = -4, max = 4) int octaves) {
        assertEquals(ChordFactor.fromInterval(semitones), ChordFactor.fromInterval(semitones + 12 * octaves));
    }

    @Property
    void templateFactorsAgreeWithBucketsExceptDiminishedSeventh(@ForAll ChordQuality quality,
                                                                @ForAll @IntRange(min = 0, max = 11) int semitones) {
        if (quality == ChordQuality.DIMINISHED_SEVENTH && semitones == 9) {
            assertEquals(ChordFactor.SEVENTH, quality.factorOf(semitones));
            return;
        }
        assertEquals(ChordFactor.fromInterval(semitones), quality.factorOf(semitones));
    }
}
