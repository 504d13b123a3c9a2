/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.chord;

/**
 * Chord templates, in matching priority: seventh chords before triads.
 * Intervals are semitones above the root, listed by factor (1, 3, 5, 7).
 */
public enum ChordQuality {
    DOMINANT_SEVENTH("dominant-seventh", 0, 4, 7, 10),
    DIMINISHED_SEVENTH("diminished-seventh", 0, 3, 6, 9),
    HALF_DIMINISHED_SEVENTH("half-diminished-seventh", 0, 3, 6, 10),
    MAJOR_SEVENTH("major-seventh", 0, 4, 7, 11),
    MINOR_SEVENTH("minor-seventh", 0, 3, 7, 10),
    MAJOR("major", 0, 4, 7),
    MINOR("minor", 0, 3, 7),
    DIMINISHED("diminished", 0, 3, 6),
    AUGMENTED("augmented", 0, 4, 8),
    UNKNOWN("unknown");

    private static final ChordFactor[] ROLES = {
            ChordFactor.ROOT, ChordFactor.THIRD, ChordFactor.FIFTH, ChordFactor.SEVENTH
    };

    private final String tag;
    private final int[] intervals;
    private final int mask;

    ChordQuality(String tag, int... intervals) {
        this.tag = tag;
        this.intervals = intervals;
        int m = 0;
        for (int i : intervals) {
            m |= 1 << i;
        }
        this.mask = m;
    }

    public String tag() {
        return tag;
    }

    /** Bit set of root-relative pitch classes. */
    int mask() {
        return mask;
    }

    public int size() {
        return intervals.length;
    }

    public boolean isSeventh() {
        return intervals.length == 4;
    }

    public boolean isTriad() {
        return intervals.length == 3;
    }

    public int fifthInterval() {
        return intervals.length > 2 ? intervals[2] : -1;
    }

    /**
     * Factor of a root-relative interval. Template members keep their
     * template role, so the diminished seventh (9 semitones) reads as a
     * seventh; anything else falls back to {@link ChordFactor#fromInterval}.
     */
    public ChordFactor factorOf(int semitonesAboveRoot) {
        int pc = Math.floorMod(semitonesAboveRoot, 12);
        for (int i = 0; i < intervals.length; i++) {
            if (intervals[i] == pc) {
                return ROLES[i];
            }
        }
        return ChordFactor.fromInterval(pc);
    }

    /** Roman numerals for this quality are written in upper case. */
    public boolean isMajorFamily() {
        return this == MAJOR || this == AUGMENTED || this == DOMINANT_SEVENTH || this == MAJOR_SEVENTH;
    }

    /** Glyph appended to a roman numeral: °, ø, + or nothing. */
    public String glyph() {
        return switch (this) {
            case DIMINISHED, DIMINISHED_SEVENTH -> "°";
            case HALF_DIMINISHED_SEVENTH -> "ø";
            case AUGMENTED -> "+";
            default -> "";
        };
    }
}
