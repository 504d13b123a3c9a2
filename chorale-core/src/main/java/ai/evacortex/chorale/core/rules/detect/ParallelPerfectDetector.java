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
import ai.evacortex.chorale.core.pitch.MotionType;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;
import ai.evacortex.chorale.core.rules.VoicePair;

import java.util.ArrayList;
import java.util.List;

/**
 * Two voices holding a fifth (or octave) in both chords while both move,
 * either in the same direction or in opposite directions.
 */
public final class ParallelPerfectDetector implements ViolationDetector {

    private final PerfectKind kind;

    public ParallelPerfectDetector(PerfectKind kind) {
        this.kind = kind;
    }

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        List<Detection> out = new ArrayList<>();
        for (VoicePair vp : VoicePair.ALL) {
            if (!pair.sounds(vp)) {
                continue;
            }
            if (!kind.matches(pair.intervalBefore(vp)) || !kind.matches(pair.intervalAfter(vp))) {
                continue;
            }
            MotionType motion = pair.motion(vp);
            if (motion == MotionType.PARALLEL || motion == MotionType.CONTRARY) {
                out.add(Detection.pair(vp, motion));
            }
        }
        return out;
    }
}
