/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core;

import ai.evacortex.chorale.core.chord.Voice;

/**
 * A beat left out of the analysis.
 *
 * @param beat   position in the progression
 * @param voice  offending voice, or {@code null} when the whole beat is at fault
 * @param input  raw text that could not be read, or {@code null}
 * @param reason human-readable cause
 */
public record BeatIssue(int beat, Voice voice, String input, String reason) {
}
