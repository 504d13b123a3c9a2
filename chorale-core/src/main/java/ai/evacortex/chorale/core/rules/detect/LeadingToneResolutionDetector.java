/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules.detect;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.key.Tonality;
import ai.evacortex.chorale.core.pitch.Pitch;
import ai.evacortex.chorale.core.rules.Detection;
import ai.evacortex.chorale.core.rules.ProgressionPair;
import ai.evacortex.chorale.core.rules.ViolationDetector;

import java.util.ArrayList;
import java.util.List;

/**
 * Leading tones that neither rise a semitone nor reach the tonic.
 *
 * <p>Two kinds are tracked. The key's leading tone counts inside chords on
 * the fifth or seventh degree. A local leading tone is the major third of a
 * secondary or otherwise chromatic chord whose root then moves by fourth or
 * fifth. In a mediant chord the key's leading tone is only the fifth and
 * carries no obligation.</p>
 */
public final class LeadingToneResolutionDetector implements ViolationDetector {

    @Override
    public List<Detection> detect(ProgressionPair pair, Tonality tonality) {
        ChordAnalysis first = pair.first();
        ChordAnalysis second = pair.second();
        List<Detection> out = new ArrayList<>();
        if (first.isIndeterminate()) {
            return out;
        }

        int rootMotion = Math.floorMod(second.rootPitchClass() - first.rootPitchClass(), 12);
        boolean dominantDegree = first.degree() == 5 || first.degree() == 7;
        boolean tonicizing = (first.isSecondaryDominant() || !first.diatonic())
                && (rootMotion == 5 || rootMotion == 7);

        for (Voice v : Voice.values()) {
            if (!pair.sounds(v)) {
                continue;
            }
            Pitch note = pair.before(v);
            boolean keyLeadingTone = dominantDegree && note.pitchClass() == tonality.leadingTone();
            boolean localLeadingTone = !keyLeadingTone && tonicizing
                    && Math.floorMod(note.pitchClass() - first.rootPitchClass(), 12) == 4;
            if (!keyLeadingTone && !localLeadingTone) {
                continue;
            }

            Pitch target = pair.after(v);
            if (target.pitchClass() == tonality.tonicPitchClass() || pair.movement(v) == 1) {
                continue;
            }

            Detection d = Detection.of(0, List.of(v));
            out.add(localLeadingTone ? d.withTag(Detection.Tag.LOCAL_LEADING_TONE) : d);
        }
        return out;
    }
}
