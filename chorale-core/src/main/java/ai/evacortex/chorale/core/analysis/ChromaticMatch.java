/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.analysis;

/**
 * Result of a {@link ChromaticDetector}: the labelling that replaces the
 * plain diatonic one.
 */
public record ChromaticMatch(ChromaticType type,
                             String label,
                             String cipher,
                             String fullLabel,
                             HarmonicFunction function) {
}
