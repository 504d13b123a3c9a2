/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules.detect;

import ai.evacortex.chorale.core.chord.ChordFactor;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;

import java.util.ArrayList;
import java.util.List;

/** Chord sevenths that do not fall by a half or whole step. */
public final class SeventhResolutionDetector implements ViolationDetector {

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Detection> out = new ArrayList<>();
        for (Voice v : Voice.values()) {
            if (pair.first().factor(v) != ChordFactor.SEVENTH || !pair.sounds(v)) {
                continue;
            }
            int move = pair.movement(v);
            if (move != -1 && move != -2) {
                out.add(Detection.of(0, List.of(v)));
            }
        }
        return out;
    }
}
