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
import java.util.Set;

/**
 * Ordered pair of pitches. The generic size comes from the letter distance,
 * the quality from how far the semitone span deviates from the diatonic
 * size. Naming is octave-reduced: compound intervals collapse to their
 * simple form, while octaves and their multiples stay {@code P8} so a unison
 * ({@code P1}) can still be told apart from an octave.
 *
 * <p>Names are direction-insensitive ({@code C4->G4} and {@code G4->C4} are
 * both {@code P5}); {@link #semitones()} keeps the sign.</p>
 */
public record Interval(Pitch from, Pitch to) {

    private static final int[] MAJOR_SCALE_SPAN = {0, 2, 4, 5, 7, 9, 11};
    private static final Set<String> FIFTH_NAMES = Set.of("P5", "A5");
    private static final Set<String> OCTAVE_NAMES = Set.of("P8", "P1");
    private static final Set<String> THIRD_NAMES = Set.of("M3", "m3", "A3", "d3");

    public Interval {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
    }

    public static Interval between(Pitch from, Pitch to) {
        return new Interval(from, to);
    }

    /** Signed semitone distance, positive when {@code p2} is higher. */
    public static int semitones(Pitch p1, Pitch p2) {
        return p2.semitoneValue() - p1.semitoneValue();
    }

    public static String name(Pitch p1, Pitch p2) {
        return new Interval(p1, p2).simpleName();
    }

    public int semitones() {
        return semitones(from, to);
    }

    /** Letter distance in steps, signed like {@link #semitones()}. */
    public int diatonicSteps() {
        return to.diatonicIndex() - from.diatonicIndex();
    }

    private Pitch lower() {
        int d = diatonicSteps();
        if (d != 0) {
            return d > 0 ? from : to;
        }
        return semitones() >= 0 ? from : to;
    }

    private Pitch upper() {
        return lower() == from ? to : from;
    }

    /** Generic size with compounds reduced: 1 (unison) to 7, or 8 for any non-zero octave multiple. */
    public int simpleSize() {
        int steps = upper().diatonicIndex() - lower().diatonicIndex();
        int reduced = steps % 7;
        if (reduced == 0 && steps > 0) {
            return 8;
        }
        return reduced + 1;
    }

    public IntervalQuality quality() {
        Pitch low = lower();
        Pitch high = upper();
        int steps = high.diatonicIndex() - low.diatonicIndex();
        int span = high.semitoneValue() - low.semitoneValue();
        int octaves = steps / 7;
        int reduced = steps % 7;
        int delta = span - octaves * 12 - MAJOR_SCALE_SPAN[reduced];
        if (reduced == 0 || reduced == 3 || reduced == 4) {
            return IntervalQuality.perfectFamily(delta);
        }
        return IntervalQuality.imperfectFamily(delta);
    }

    public String simpleName() {
        return quality().symbol() + simpleSize();
    }

    public boolean isFifth() {
        return FIFTH_NAMES.contains(simpleName());
    }

    public boolean isPerfectFifth() {
        return "P5".equals(simpleName());
    }

    public boolean isDiminishedFifth() {
        return "d5".equals(simpleName());
    }

    public boolean isOctave() {
        return OCTAVE_NAMES.contains(simpleName());
    }

    /** Thirds and their compounds (tenths). */
    public boolean isThird() {
        return THIRD_NAMES.contains(simpleName());
    }

    @Override
    public String toString() {
        return from + "->" + to + " (" + simpleName() + ")";
    }
}
