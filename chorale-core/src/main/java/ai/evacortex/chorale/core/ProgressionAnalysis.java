/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.rules.RuleOutcome;
import ai.evacortex.chorale.core.rules.RuleViolation;

import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Everything produced for one progression.
 *
 * @param chords     analysis per beat index; excluded beats are absent
 * @param violations violations of every evaluated pair, in order
 * @param issues     beats excluded from the analysis
 * @param failures   rule evaluations that failed and were skipped
 */
public record ProgressionAnalysis(Tonality tonality,
                                  int beatCount,
                                  SortedMap<Integer, ChordAnalysis> chords,
                                  List<RuleViolation> violations,
                                  List<BeatIssue> issues,
                                  List<RuleOutcome> failures) {

    public ProgressionAnalysis {
        chords = Collections.unmodifiableSortedMap(new TreeMap<>(chords));
        violations = List.copyOf(violations);
        issues = List.copyOf(issues);
        failures = List.copyOf(failures);
    }

    public ChordAnalysis chord(int beat) {
        return chords.get(beat);
    }

    public boolean isClean() {
        return violations.isEmpty();
    }
}
