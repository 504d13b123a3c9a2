/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.report;

/**
 * A violation placed on the measure/beat grid, ready for display.
 *
 * @param id      stable identifier, {@code err-<position>}
 * @param measure 1-based measure number
 * @param beat    1-based beat within the measure
 * @param voices  voice names bass to soprano joined with {@code -}, {@code ?} when none
 */
public record FormattedViolation(String id,
                                 int position,
                                 int measure,
                                 int beat,
                                 String rule,
                                 String tier,
                                 String severity,
                                 int confidence,
                                 String voices,
                                 String message) {
}
