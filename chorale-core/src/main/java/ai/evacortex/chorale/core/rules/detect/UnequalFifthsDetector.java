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

/** Diminished fifth to perfect fifth against the bass. */
public final class UnequalFifthsDetector implements ViolationDetector {

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Detection> out = new ArrayList<>();
        for (VoicePair vp : VoicePair.WITH_BASS) {
            if (!pair.sounds(vp)) {
                continue;
            }
            if (pair.intervalBefore(vp).isDiminishedFifth() && pair.intervalAfter(vp).isFifth()) {
                out.add(Detection.pair(vp, pair.motion(vp)));
            }
        }
        return out;
    }
}
