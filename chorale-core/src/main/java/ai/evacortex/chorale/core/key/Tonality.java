/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.key;

import ai.evacortex.chorale.core.exceptions.InvalidKeyException;
import ai.evacortex.chorale.core.pitch.Pitch;
import ai.evacortex.chorale.core.pitch.Step;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable key descriptor: spelled tonic and mode. Everything that depends
 * on the key (diatonic pitch-class set, scale degrees, expected numerals) is
 * derived from these three fields, so two equal tonalities always agree.
 *
 * <p>In minor the diatonic set is the harmonic form (raised seventh). The
 * natural subtonic is also accepted as diatonic and maps to degree 7, since
 * both forms of the seventh degree occur in minor-key writing.</p>
 */
public record Tonality(Step tonicStep, int tonicAccidental, Mode mode) {

    public Tonality {
        Objects.requireNonNull(tonicStep, "tonicStep must not be null");
        Objects.requireNonNull(mode, "mode must not be null");
        if (Math.abs(tonicAccidental) > 1) {
            throw new InvalidKeyException("tonic accidental out of range: " + tonicAccidental);
        }
    }

    public static Tonality major(String tonic) {
        return of(tonic, Mode.MAJOR);
    }

    public static Tonality minor(String tonic) {
        return of(tonic, Mode.MINOR);
    }

    /** Builds a tonality from a tonic name such as {@code "C"}, {@code "F#"}, {@code "Bb"} or {@code "E-"}. */
    public static Tonality of(String tonic, Mode mode) {
        if (tonic == null || tonic.isBlank()) {
            throw new InvalidKeyException("tonic must not be empty");
        }
        String s = tonic.trim();
        Step step;
        try {
            step = Step.fromChar(s.charAt(0));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeyException("'" + tonic + "'", e);
        }
        String rest = s.substring(1);
        int accidental = switch (rest) {
            case "" -> 0;
            case "#" -> 1;
            case "b", "-" -> -1;
            default -> throw new InvalidKeyException("'" + tonic + "' has an unsupported accidental");
        };
        return new Tonality(step, accidental, mode);
    }

    public int tonicPitchClass() {
        return Math.floorMod(tonicStep.naturalSemitone() + tonicAccidental, 12);
    }

    public String tonicName() {
        return tonicStep.name() + (tonicAccidental > 0 ? "#" : tonicAccidental < 0 ? "b" : "");
    }

    /** Pitch class of scale degree {@code degree} (1-7). */
    public int degreePitchClass(int degree) {
        if (degree < 1 || degree > 7) {
            throw new IllegalArgumentException("degree must be in 1..7: " + degree);
        }
        return Math.floorMod(tonicPitchClass() + mode.offset(degree), 12);
    }

    public int leadingTone() {
        return Math.floorMod(tonicPitchClass() + 11, 12);
    }

    public int subtonic() {
        return Math.floorMod(tonicPitchClass() + 10, 12);
    }

    /**
     * Pitch classes of the key in degree order, tonic first. Minor keys end
     * with the natural subtonic after the raised seventh, so the set has
     * eight members there.
     */
    public Set<Integer> diatonicSet() {
        Set<Integer> set = new LinkedHashSet<>();
        for (int d = 1; d <= 7; d++) {
            set.add(degreePitchClass(d));
        }
        if (mode == Mode.MINOR) {
            set.add(subtonic());
        }
        return Collections.unmodifiableSet(set);
    }

    public boolean isDiatonic(int pitchClass) {
        return diatonicSet().contains(Math.floorMod(pitchClass, 12));
    }

    /** Scale degree 1-7 of a member of {@link #diatonicSet()}; empty for chromatic ones. */
    public OptionalInt scaleDegree(int pitchClass) {
        int pc = Math.floorMod(pitchClass, 12);
        for (int d = 1; d <= 7; d++) {
            if (degreePitchClass(d) == pc) {
                return OptionalInt.of(d);
            }
        }
        if (mode == Mode.MINOR && pc == subtonic()) {
            return OptionalInt.of(7);
        }
        return OptionalInt.empty();
    }

    public OptionalInt scaleDegree(Pitch pitch) {
        return scaleDegree(pitch.pitchClass());
    }

    /** Degree by letter name alone, defined for every pitch including chromatic ones. */
    public int letterDegree(Pitch pitch) {
        return Math.floorMod(pitch.step().index() - tonicStep.index(), 7) + 1;
    }

    /**
     * Semitones from the key's own pitch on the pitch's letter degree, in the
     * range -6..5. Negative means lowered, positive raised.
     */
    public int chromaticOffset(Pitch pitch) {
        int expected = degreePitchClass(letterDegree(pitch));
        int diff = Math.floorMod(pitch.pitchClass() - expected, 12);
        return diff > 5 ? diff - 12 : diff;
    }

    public Tonality parallel() {
        return new Tonality(tonicStep, tonicAccidental, mode.parallel());
    }

    @Override
    public String toString() {
        return tonicName() + " " + mode.name().toLowerCase();
    }
}
