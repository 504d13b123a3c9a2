/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.key;

import java.util.List;

/**
 * Accidental count of a key signature: positive for sharps, negative for flats.
 */
public final class KeySignature {

    private static final List<String> SHARP_KEYS = List.of("C", "G", "D", "A", "E", "B", "F#", "C#");
    private static final List<String> FLAT_KEYS = List.of("C", "F", "Bb", "Eb", "Ab", "Db", "Gb", "Cb");

    private KeySignature() {}

    public static int of(Tonality tonality) {
        if (tonality.mode() == Mode.MINOR) {
            // TODO derive minor signatures from the relative major once the expected counts are confirmed
            return 0;
        }
        String tonic = tonality.tonicName();
        int sharps = SHARP_KEYS.indexOf(tonic);
        if (sharps >= 0) {
            return sharps;
        }
        int flats = FLAT_KEYS.indexOf(tonic);
        return flats >= 0 ? -flats : 0;
    }
}
