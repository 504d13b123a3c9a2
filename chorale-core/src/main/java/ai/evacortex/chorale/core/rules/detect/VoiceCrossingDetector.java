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
import ai.evacortex.chorale.core.pitch.Pitch;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;
import ai.evacortex.chorale.core.rules.VoicePair;

import java.util.ArrayList;
import java.util.List;

/** Neighbouring voices out of B &lt; T &lt; A &lt; S order in the first chord. */
public final class VoiceCrossingDetector implements ViolationDetector {

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Detection> out = new ArrayList<>();
        for (VoicePair vp : VoicePair.ADJACENT) {
            Pitch lower = pair.before(vp.first());
            Pitch upper = pair.before(vp.second());
            if (lower == null || upper == null) {
                continue;
            }
            if (lower.semitoneValue() > upper.semitoneValue()) {
                out.add(Detection.of(0, vp.asList()));
            }
        }
        return out;
    }
}
