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
import ai.evacortex.chorale.core.pitch.Interval;
import ai.evacortex.chorale.core.pitch.MotionType;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;
import ai.evacortex.chorale.core.rules.VoicePair;

import java.util.ArrayList;
import java.util.List;

/**
 * Arrival at a perfect fifth (or octave) in similar motion from another
 * interval. Arriving at an augmented fifth does not count.
 * A diminished fifth moving to a perfect one is left to the unequal-fifths
 * rule. Which step/leap combinations are tolerated is decided by the rule's
 * exception predicates.
 */
public final class DirectPerfectDetector implements ViolationDetector {

    private final PerfectKind kind;

    public DirectPerfectDetector(PerfectKind kind) {
        this.kind = kind;
    }

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Detection> out = new ArrayList<>();
        for (VoicePair vp : VoicePair.ALL) {
            if (!pair.sounds(vp)) {
                continue;
            }
            if (!kind.reachedBy(pair.intervalAfter(vp))) {
                continue;
            }
            Interval before = pair.intervalBefore(vp);
            if (kind.matches(before)) {
                continue;
            }
            if (kind == PerfectKind.FIFTH && before.isDiminishedFifth()) {
                continue;
            }
            if (pair.motion(vp) == MotionType.PARALLEL) {
                out.add(Detection.pair(vp, MotionType.PARALLEL));
            }
        }
        return out;
    }
}
