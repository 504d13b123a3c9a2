/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.pitch;

import ai.evacortex.chorale.core.exceptions.InvalidPitchException;

/**
 * Note-name reader. Accepts a letter, any number of accidentals
 * ({@code #}, {@code x}, {@code b}, {@code -}) and an octave in 0-9.
 *
 * <p>A minus sign is always read as a flat, so {@code "C-1"} is C flat in
 * octave 1. Negative octaves cannot be written; octaves above 9 are
 * rejected.</p>
 */
public final class PitchNotation {

    private PitchNotation() {}

    public static Pitch parse(String text) {
        if (text == null) {
            throw new InvalidPitchException("null");
        }
        String s = text.trim();
        if (s.isEmpty()) {
            throw new InvalidPitchException("empty note name");
        }

        Step step;
        try {
            step = Step.fromChar(s.charAt(0));
        } catch (IllegalArgumentException e) {
            throw new InvalidPitchException("'" + text + "' does not start with a letter A-G", e);
        }

        int pos = 1;
        int accidental = 0;
        while (pos < s.length()) {
            char c = s.charAt(pos);
            if (c == '#') {
                accidental += 1;
            } else if (c == 'x') {
                accidental += 2;
            } else if (c == 'b' || c == '-') {
                accidental -= 1;
            } else {
                break;
            }
            pos++;
        }
        if (Math.abs(accidental) > Pitch.MAX_ACCIDENTAL) {
            throw new InvalidPitchException("'" + text + "' has more than two accidentals");
        }

        String octaveText = s.substring(pos);
        if (octaveText.isEmpty()) {
            throw new InvalidPitchException("'" + text + "' has no octave");
        }
        int octave;
        try {
            octave = Integer.parseInt(octaveText);
        } catch (NumberFormatException e) {
            throw new InvalidPitchException("'" + text + "' has a malformed octave", e);
        }
        if (octave < 0 || octave > 9) {
            throw new InvalidPitchException("'" + text + "' octave out of range 0-9");
        }
        return new Pitch(step, accidental, octave);
    }

    static String accidentalText(int accidental) {
        if (accidental > 0) {
            return "#".repeat(accidental);
        }
        if (accidental < 0) {
            return "b".repeat(-accidental);
        }
        return "";
    }
}
