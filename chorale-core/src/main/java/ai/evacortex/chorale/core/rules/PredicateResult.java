/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

/**
 * Outcome of one exception predicate. {@link #FAILED} never suppresses.
 */
public enum PredicateResult {
    APPLIES,
    DOES_NOT_APPLY,
    FAILED;

    public static PredicateResult of(boolean applies) {
        return applies ? APPLIES : DOES_NOT_APPLY;
    }
}
