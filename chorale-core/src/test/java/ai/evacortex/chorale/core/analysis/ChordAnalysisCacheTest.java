/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

import ai.evacortex.chorale.core.chord.ChordSnapshot;
import org.junit.jupiter.api.Test;

import static ai.evacortex.chorale.core.ChordTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ChordAnalysisCacheTest {

    @Test
    void testGet_reusesAnalysisPerKeyAndChord() {
        ChordAnalysisCache cache = new ChordAnalysisCache(new FunctionalClassifier(), 100);
        ChordSnapshot e = satb("B4", "G#4", "E4", "E3");

        ChordAnalysis first = cache.get(A_MINOR, e);
        ChordAnalysis again = cache.get(A_MINOR, satb("B4", "G#4", "E4", "E3"));
        assertSame(first, again, "equal snapshots hit the same entry");
        assertEquals(1, cache.hitCount());

        ChordAnalysis inMajor = cache.get(C_MAJOR, e);
        assertNotSame(first, inMajor);
        assertEquals("V", first.label());
        assertEquals("V/vi", inMajor.label());
        assertEquals(2, cache.estimatedSize());

        cache.invalidateAll();
        assertEquals(0, cache.estimatedSize());
    }

    @Test
    void testConstructor_rejectsNegativeSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChordAnalysisCache(new FunctionalClassifier(), -1));
    }
}
