/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.chord.Voice;

import java.util.List;
import java.util.Objects;

/**
 * Two voices compared by a pairwise rule, in reporting order.
 */
public record VoicePair(Voice first, Voice second) {

    /** Every pair, upper voice first, in scan order. */
    public static final List<VoicePair> ALL = List.of(
            new VoicePair(Voice.SOPRANO, Voice.ALTO),
            new VoicePair(Voice.SOPRANO, Voice.TENOR),
            new VoicePair(Voice.SOPRANO, Voice.BASS),
            new VoicePair(Voice.ALTO, Voice.TENOR),
            new VoicePair(Voice.ALTO, Voice.BASS),
            new VoicePair(Voice.TENOR, Voice.BASS));

    /** Bass against each upper voice. */
    public static final List<VoicePair> WITH_BASS = List.of(
            new VoicePair(Voice.BASS, Voice.SOPRANO),
            new VoicePair(Voice.BASS, Voice.ALTO),
            new VoicePair(Voice.BASS, Voice.TENOR));

    /** Neighbouring voices, lower voice first, from the bottom up. */
    public static final List<VoicePair> ADJACENT = List.of(
            new VoicePair(Voice.BASS, Voice.TENOR),
            new VoicePair(Voice.TENOR, Voice.ALTO),
            new VoicePair(Voice.ALTO, Voice.SOPRANO));

    /** Neighbouring upper voices whose spacing is limited to an octave. */
    public static final List<VoicePair> SPACED = List.of(
            new VoicePair(Voice.ALTO, Voice.SOPRANO),
            new VoicePair(Voice.TENOR, Voice.ALTO));

    public VoicePair {
        Objects.requireNonNull(first, "first must not be null");
        Objects.requireNonNull(second, "second must not be null");
    }

    public boolean contains(Voice v) {
        return first == v || second == v;
    }

    /** Soprano against bass, in either order. */
    public boolean isOuter() {
        return contains(Voice.SOPRANO) && contains(Voice.BASS);
    }

    public List<Voice> asList() {
        return List.of(first, second);
    }
}
