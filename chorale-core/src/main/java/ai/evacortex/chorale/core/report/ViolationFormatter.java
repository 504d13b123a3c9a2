/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.report;

import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.rules.RuleViolation;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns {@link RuleViolation}s into user-facing text on a fixed beat grid.
 */
public class ViolationFormatter {

    public static final String ID_PREFIX = "err-";
    public static final String NO_VOICES = "?";

    private final int beatsPerMeasure;

    public ViolationFormatter(int beatsPerMeasure) {
        if (beatsPerMeasure <= 0) {
            throw new IllegalArgumentException("beatsPerMeasure must be > 0: " + beatsPerMeasure);
        }
        this.beatsPerMeasure = beatsPerMeasure;
    }

    public int beatsPerMeasure() {
        return beatsPerMeasure;
    }

    public FormattedViolation format(RuleViolation v) {
        int position = v.position();
        int measure = position / beatsPerMeasure + 1;
        int beat = position % beatsPerMeasure + 1;
        String voices = voices(v.voices());
        String message = "Measure " + measure + ", beat " + beat + ": " + v.message() + " (" + voices + ")";
        return new FormattedViolation(ID_PREFIX + position, position, measure, beat,
                v.ruleName(), v.tier().name(), v.severity().name(), v.confidence(), voices, message);
    }

    public List<FormattedViolation> formatAll(List<RuleViolation> violations) {
        return violations.stream().map(this::format).collect(Collectors.toList());
    }

    static String voices(List<Voice> voices) {
        if (voices.isEmpty()) {
            return NO_VOICES;
        }
        return voices.stream()
                .sorted(Comparator.comparingInt(Voice::rankFromBass))
                .map(Voice::displayName)
                .collect(Collectors.joining("-"));
    }
}
