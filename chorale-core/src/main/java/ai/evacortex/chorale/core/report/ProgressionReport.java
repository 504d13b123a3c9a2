/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.report;

import java.util.List;

/**
 * Serialisable view of a progression analysis.
 */
public record ProgressionReport(String key,
                                int keySignature,
                                int beatCount,
                                List<ChordEntry> chords,
                                List<FormattedViolation> violations,
                                List<IssueEntry> issues,
                                List<FailureEntry> failures) {

    public record ChordEntry(int beat,
                             String notes,
                             String root,
                             String quality,
                             int inversion,
                             int degree,
                             String label,
                             String cipher,
                             String fullLabel,
                             String function,
                             boolean diatonic,
                             String chromaticType) {}

    public record IssueEntry(int beat, String voice, String input, String reason) {}

    public record FailureEntry(String rule, String error) {}
}
