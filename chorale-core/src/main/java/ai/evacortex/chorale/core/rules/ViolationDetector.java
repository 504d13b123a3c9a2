/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.key.Tonality;

import java.util.List;

/**
 * Base detection of one rule.
 */
@FunctionalInterface
public interface ViolationDetector {

    /**
     * Returns every candidate violation in scan order. The engine reports the
     * first candidate that no exception predicate suppresses.
     *
     * @param pair     chords under test
     * @param tonality active key
     * @return candidates, empty when the rule is satisfied
     */
    List<Detection> detect(ProgressionPair pair, Tonality tonality);
}
