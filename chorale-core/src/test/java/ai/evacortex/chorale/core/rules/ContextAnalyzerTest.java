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
import org.junit.jupiter.api.Test;

import static ai.evacortex.chorale.core.ChordTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class ContextAnalyzerTest {

    @Test
    void testVoicingChange_sameHarmonyDifferentPitches() {
        ChordAnalysis close = inC("G4", "E4", "C4", "C3");
        ChordAnalysis open = inC("E5", "G4", "C4", "C3");
        assertTrue(ContextAnalyzer.isVoicingChange(close, open));
        assertFalse(ContextAnalyzer.isVoicingChange(close, close), "identical voicing is not a change");
    }

    @Test
    void testVoicingChange_requiresSameInversionAndPitchClasses() {
        ChordAnalysis root = inC("G4", "E4", "C4", "C3");
        ChordAnalysis sixth = inC("G4", "C4", "C4", "E3");
        assertFalse(ContextAnalyzer.isVoicingChange(root, sixth));

        ChordAnalysis noFifth = inC("E4", "C4", "C4", "C3");
        assertFalse(ContextAnalyzer.isVoicingChange(root, noFifth), "pitch-class sets differ");

        ChordAnalysis unknown = inC("C5", "G4", "C4", "C3");
        assertFalse(ContextAnalyzer.isVoicingChange(unknown, inC("G4", "C4", "G3", "C3")));
    }

    @Test
    void testVToVii_eitherOrder() {
        ChordAnalysis v = inC("G4", "D4", "B3", "G2");
        ChordAnalysis vii = inC("F4", "D4", "B3", "B2");
        assertTrue(ContextAnalyzer.isVToViiPair(v, vii));
        assertTrue(ContextAnalyzer.isVToViiPair(vii, v));
        assertFalse(ContextAnalyzer.isVToViiPair(v, inC("E4", "C4", "G3", "C3")));
        assertFalse(ContextAnalyzer.isVToViiPair(v, v));
    }
}
