/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules.detect;

import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;
import ai.evacortex.chorale.core.rules.VoicePair;

import java.util.ArrayList;
import java.util.List;

/**
 * A voice moving past the pitch its neighbour held in the previous chord:
 * the upper voice dropping below the lower voice's old pitch, or the lower
 * voice climbing above the upper voice's old pitch.
 */
public final class VoiceOverlapDetector implements ViolationDetector {

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Detection> out = new ArrayList<>();
        for (VoicePair vp : VoicePair.ADJACENT) {
            if (!pair.sounds(vp)) {
                continue;
            }
            int lowerBefore = pair.before(vp.first()).semitoneValue();
            int upperBefore = pair.before(vp.second()).semitoneValue();
            int lowerAfter = pair.after(vp.first()).semitoneValue();
            int upperAfter = pair.after(vp.second()).semitoneValue();
            if (upperAfter < lowerBefore || lowerAfter > upperBefore) {
                out.add(Detection.of(1, vp.asList()));
            }
        }
        return out;
    }
}
