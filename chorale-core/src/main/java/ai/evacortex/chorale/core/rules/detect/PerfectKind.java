/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules.detect;

import ai.evacortex.chorale.core.pitch.Interval;

/**
 * Interval class watched by the parallel and direct motion rules.
 */
public enum PerfectKind {
    FIFTH,
    OCTAVE;

    public boolean matches(Interval interval) {
        return this == FIFTH ? interval.isFifth() : interval.isOctave();
    }

    /** Arrival test for direct motion: only a perfect fifth counts as reaching the fifth. */
    public boolean reachedBy(Interval interval) {
        return this == FIFTH ? interval.isPerfectFifth() : interval.isOctave();
    }
}
