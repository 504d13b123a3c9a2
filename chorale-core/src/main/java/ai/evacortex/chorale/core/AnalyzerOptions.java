/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Tuning knobs for {@link HarmonyAnalyzer}.
 */
public record AnalyzerOptions(
        long cacheSize,              // max cached chord analyses
        Set<String> disabledRules,   // rule names removed from the default rule set
        int beatsPerMeasure          // grid used to place violations in measures
) {
    public static final String CACHE_SIZE_PROPERTY = "chorale.analysis.cacheSize";
    public static final String DISABLED_RULES_PROPERTY = "chorale.rules.disabled";
    public static final String BEATS_PER_MEASURE_PROPERTY = "chorale.report.beatsPerMeasure";

    public AnalyzerOptions {
        if (cacheSize < 0) {
            throw new IllegalArgumentException("cacheSize must be >= 0: " + cacheSize);
        }
        if (beatsPerMeasure <= 0) {
            throw new IllegalArgumentException("beatsPerMeasure must be > 0: " + beatsPerMeasure);
        }
        disabledRules = Set.copyOf(disabledRules);
    }

    public static AnalyzerOptions defaultOptions() {
        return new AnalyzerOptions(4096, Set.of(), 4);
    }

    public static AnalyzerOptions fromSystemProperties() {
        long cacheSize = Long.parseLong(System.getProperty(CACHE_SIZE_PROPERTY, "4096"));
        int beats = Integer.parseInt(System.getProperty(BEATS_PER_MEASURE_PROPERTY, "4"));
        Set<String> disabled = new LinkedHashSet<>();
        Arrays.stream(System.getProperty(DISABLED_RULES_PROPERTY, "").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .forEach(disabled::add);
        return new AnalyzerOptions(cacheSize, disabled, beats);
    }
}
