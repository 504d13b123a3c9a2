/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.key;

import ai.evacortex.chorale.core.pitch.Pitch;

import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Session-scoped holder of the active key. The tonality can only change
 * through {@link #setTonality(Tonality)}; engines and classifiers take an
 * immutable {@link #snapshot()} so a later change never leaks into work
 * already in progress.
 */
public final class KeyContext {

    private volatile Tonality tonality;

    public KeyContext(Tonality tonality) {
        this.tonality = Objects.requireNonNull(tonality, "tonality must not be null");
    }

    public static KeyContext of(String tonic, Mode mode) {
        return new KeyContext(Tonality.of(tonic, mode));
    }

    public void setTonality(Tonality tonality) {
        this.tonality = Objects.requireNonNull(tonality, "tonality must not be null");
    }

    public Tonality snapshot() {
        return tonality;
    }

    public Mode mode() {
        return tonality.mode();
    }

    public int tonicPitchClass() {
        return tonality.tonicPitchClass();
    }

    public Set<Integer> diatonicSet() {
        return tonality.diatonicSet();
    }

    public OptionalInt scaleDegree(Pitch pitch) {
        return tonality.scaleDegree(pitch);
    }

    public int keySignature() {
        return KeySignature.of(tonality);
    }

    @Override
    public String toString() {
        return "KeyContext[" + tonality + "]";
    }
}
