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
 * Pedagogical weight of a rule: critical rules are taught first.
 */
public enum RuleTier {
    CRITICAL(1),
    IMPORTANT(2),
    ADVANCED(3);

    private final int level;

    RuleTier(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }
}
