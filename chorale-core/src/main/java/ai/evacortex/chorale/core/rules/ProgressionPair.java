/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.chord.Voice;
import ai.evacortex.chorale.core.pitch.Interval;
import ai.evacortex.chorale.core.pitch.MotionType;
import ai.evacortex.chorale.core.pitch.Pitch;

import java.util.Objects;

/**
 * Two adjacent analysed chords, the unit every rule evaluates.
 *
 * @param index position of the first chord in the progression
 */
public record ProgressionPair(ChordAnalysis first, ChordAnalysis second, int index) {

    public ProgressionPair {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0: " + index);
        }
    }

    public static ProgressionPair of(ChordAnalysis first, ChordAnalysis second) {
        return new ProgressionPair(first, second, 0);
    }

    public Pitch before(Voice v) {
        return first.pitch(v);
    }

    public Pitch after(Voice v) {
        return second.pitch(v);
    }

    /** True when every given voice sounds in both chords. */
    public boolean sounds(Voice... voices) {
        for (Voice v : voices) {
            if (before(v) == null || after(v) == null) {
                return false;
            }
        }
        return true;
    }

    public boolean sounds(VoicePair pair) {
        return sounds(pair.first(), pair.second());
    }

    /** Signed semitone movement of one voice. Requires the voice to sound in both chords. */
    public int movement(Voice v) {
        return Interval.semitones(before(v), after(v));
    }

    public Interval intervalBefore(VoicePair pair) {
        return Interval.between(before(pair.first()), before(pair.second()));
    }

    public Interval intervalAfter(VoicePair pair) {
        return Interval.between(after(pair.first()), after(pair.second()));
    }

    public MotionType motion(VoicePair pair) {
        return MotionType.ofMovements(movement(pair.first()), movement(pair.second()));
    }
}
