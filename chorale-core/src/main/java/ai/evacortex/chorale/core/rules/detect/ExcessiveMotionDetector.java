/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules.detect;

import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;

import java.util.ArrayList;
import java.util.List;

/** Melodic leaps wider than an octave; every offending voice is reported together. */
public final class ExcessiveMotionDetector implements ViolationDetector {

    public static final int MAX_LEAP = 12;

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Voice> leaping = new ArrayList<>();
        for (Voice v : Voice.values()) {
            if (pair.sounds(v) && Math.abs(pair.movement(v)) > MAX_LEAP) {
                leaping.add(v);
            }
        }
        return leaping.isEmpty() ? List.of() : List.of(Detection.of(1, leaping));
    }
}
