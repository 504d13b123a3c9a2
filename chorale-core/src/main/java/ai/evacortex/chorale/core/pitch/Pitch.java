/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.pitch;

import java.util.Objects;

/**
 * Immutable spelled pitch: letter, accidental count (sharps positive, flats
 * negative) and octave in scientific pitch notation (C4 = middle C).
 *
 * <p>The continuous value is the MIDI-style semitone number, so {@code C4}
 * maps to 60 and the pitch class is that value reduced modulo 12.</p>
 */
public record Pitch(Step step, int accidental, int octave) implements Comparable<Pitch> {

    public static final int MAX_ACCIDENTAL = 2;

    public Pitch {
        Objects.requireNonNull(step, "step must not be null");
        if (Math.abs(accidental) > MAX_ACCIDENTAL) {
            throw new IllegalArgumentException("Accidental out of range: " + accidental);
        }
    }

    public static Pitch of(Step step, int accidental, int octave) {
        return new Pitch(step, accidental, octave);
    }

    /** Parses note-name text such as {@code "F#4"}, {@code "Bb3"} or {@code "E-5"}. */
    public static Pitch parse(String text) {
        return PitchNotation.parse(text);
    }

    /** Continuous semitone value (C4 = 60). */
    public int semitoneValue() {
        return (octave + 1) * 12 + step.naturalSemitone() + accidental;
    }

    public int pitchClass() {
        return Math.floorMod(semitoneValue(), 12);
    }

    /** Position on the diatonic staff, seven letters per octave. */
    public int diatonicIndex() {
        return octave * 7 + step.index();
    }

    public Pitch withOctave(int newOctave) {
        return new Pitch(step, accidental, newOctave);
    }

    /** Letter plus accidental, without octave. */
    public String name() {
        return step.name() + PitchNotation.accidentalText(accidental);
    }

    public boolean sameSpelling(Pitch other) {
        return other != null && step == other.step && accidental == other.accidental;
    }

    @Override
    public int compareTo(Pitch o) {
        int c = Integer.compare(semitoneValue(), o.semitoneValue());
        return c != 0 ? c : Integer.compare(diatonicIndex(), o.diatonicIndex());
    }

    @Override
    public String toString() {
        return name() + octave;
    }
}
