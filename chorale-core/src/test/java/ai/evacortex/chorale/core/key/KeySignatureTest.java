/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.key;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class KeySignatureTest {

    @Test
    void testMajorKeys_countSharpsAndFlats() {
        assertEquals(0, KeySignature.of(Tonality.major("C")));
        assertEquals(1, KeySignature.of(Tonality.major("G")));
        assertEquals(6, KeySignature.of(Tonality.major("F#")));
        assertEquals(7, KeySignature.of(Tonality.major("C#")));
        assertEquals(-1, KeySignature.of(Tonality.major("F")));
        assertEquals(-3, KeySignature.of(Tonality.major("Eb")));
        assertEquals(-3, KeySignature.of(Tonality.major("E-")), "'-' spelling maps to the same key");
    }

    @Test
    void testMinorKeys_reportNoSignature() {
        assertEquals(0, KeySignature.of(Tonality.minor("A")));
        assertEquals(0, KeySignature.of(Tonality.minor("C")));
        assertEquals(0, KeyContext.of("G", Mode.MINOR).keySignature());
    }
}
