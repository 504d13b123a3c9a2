/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core;

import ai.evacortex.chorale.core.chord.ChordSnapshot;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.key.KeyContext;
import ai.evacortex.chorale.core.key.Mode;
import ai.evacortex.chorale.core.rules.RuleId;
import ai.evacortex.chorale.core.rules.RuleSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static ai.evacortex.chorale.core.ChordTestUtils.*;
import static org.junit.jupiter.api.Assertions.*;

class HarmonyAnalyzerTest {

    private static Map<Voice, String> beat(String s, String a, String t, String b) {
        return Map.of(Voice.SOPRANO, s, Voice.ALTO, a, Voice.TENOR, t, Voice.BASS, b);
    }

    @Test
    void testAnalyze_classifiesAndValidates() {
        ProgressionAnalysis result = new HarmonyAnalyzer().analyze(C_MAJOR, List.of(
                satb("E4", "C4", "C4", "C3"),
                satb("F4", "D4", "B3", "G2"),
                satb("G4", "C4", "C4", "C3")));

        assertEquals(3, result.beatCount());
        assertEquals("I", result.chord(0).label());
        assertEquals("V7,+", result.chord(1).fullLabel());
        assertEquals(1, result.violations().size());
        assertEquals(RuleId.SEVENTH_RESOLUTION, result.violations().get(0).rule());
        assertEquals(1, result.violations().get(0).pairIndex());
        assertFalse(result.isClean());
        assertTrue(result.failures().isEmpty());
    }

    @Test
    @DisplayName("A beat with an unreadable pitch is excluded and its pairs skipped")
    void testAnalyzeNotation_invalidPitchExcludesBeat() {
        ProgressionAnalysis result = new HarmonyAnalyzer().analyzeNotation(C_MAJOR, List.of(
                beat("F4", "D4", "B3", "G2"),
                beat("G4", "H4", "C4", "C3"),
                beat("E4", "C4", "C4", "C3")));

        assertEquals(Set.of(0, 2), result.chords().keySet());
        assertEquals(1, result.issues().size());
        BeatIssue issue = result.issues().get(0);
        assertEquals(1, issue.beat());
        assertEquals(Voice.ALTO, issue.voice());
        assertEquals("H4", issue.input());
        assertTrue(result.violations().isEmpty(), "no pair touches two valid beats");
    }

    @Test
    void testAnalyze_emptyBeatIsReported() {
        ProgressionAnalysis result = new HarmonyAnalyzer().analyze(C_MAJOR, List.of(
                satb("E4", "C4", "C4", "C3"),
                new ChordSnapshot(Map.of())));
        assertEquals(1, result.chords().size());
        assertEquals(1, result.issues().size());
        assertNull(result.issues().get(0).voice());
    }

    @Test
    @DisplayName("A missing beat is reported like an empty one")
    void testAnalyze_nullBeatIsReported() {
        ProgressionAnalysis result = new HarmonyAnalyzer().analyze(C_MAJOR, Arrays.asList(
                satb("E4", "C4", "C4", "C3"),
                null,
                satb("F4", "D4", "B3", "G2")));
        assertEquals(Set.of(0, 2), result.chords().keySet());
        assertEquals(1, result.issues().size(), "the null beat yields one issue");
        BeatIssue issue = result.issues().get(0);
        assertEquals(1, issue.beat());
        assertNull(issue.voice());
        assertEquals("no sounding voice", issue.reason());

        ProgressionAnalysis fromNotation = new HarmonyAnalyzer().analyzeNotation(C_MAJOR, Arrays.asList(
                beat("E4", "C4", "C4", "C3"),
                null));
        assertEquals(1, fromNotation.issues().size());
        assertEquals(1, fromNotation.issues().get(0).beat());
    }

    @Test
    void testOptions_disabledRulesAreHonoured() {
        AnalyzerOptions options = new AnalyzerOptions(16, Set.of("seventh_resolution"), 4);
        HarmonyAnalyzer analyzer = new HarmonyAnalyzer(options);
        assertFalse(analyzer.rules().isEnabled("seventh_resolution"));

        ProgressionAnalysis result = analyzer.analyze(KeyContext.of("C", Mode.MAJOR), List.of(
                satb("F4", "D4", "B3", "G2"),
                satb("G4", "C4", "C4", "C3")));
        assertTrue(result.isClean());

        HarmonyAnalyzer strict = analyzer.withRules(RuleSet.defaults());
        assertEquals(1, strict.analyze(C_MAJOR, List.of(
                satb("F4", "D4", "B3", "G2"),
                satb("G4", "C4", "C4", "C3"))).violations().size());
    }

    @Test
    void testOptions_fromSystemProperties() {
        System.setProperty(AnalyzerOptions.CACHE_SIZE_PROPERTY, "32");
        System.setProperty(AnalyzerOptions.DISABLED_RULES_PROPERTY, "voice_overlap, maximum_distance,");
        System.setProperty(AnalyzerOptions.BEATS_PER_MEASURE_PROPERTY, "3");
        try {
            AnalyzerOptions options = AnalyzerOptions.fromSystemProperties();
            assertEquals(32, options.cacheSize());
            assertEquals(Set.of("voice_overlap", "maximum_distance"), options.disabledRules());
            assertEquals(3, options.beatsPerMeasure());
        } finally {
            System.clearProperty(AnalyzerOptions.CACHE_SIZE_PROPERTY);
            System.clearProperty(AnalyzerOptions.DISABLED_RULES_PROPERTY);
            System.clearProperty(AnalyzerOptions.BEATS_PER_MEASURE_PROPERTY);
        }
        assertEquals(AnalyzerOptions.defaultOptions(), AnalyzerOptions.fromSystemProperties());
    }

    @Test
    void testOptions_rejectInvalidValues() {
        assertThrows(IllegalArgumentException.class, () -> new AnalyzerOptions(-1, Set.of(), 4));
        assertThrows(IllegalArgumentException.class, () -> new AnalyzerOptions(10, Set.of(), 0));
    }
}
