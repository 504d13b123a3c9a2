/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.chord;

import ai.evacortex.chorale.core.pitch.Pitch;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Key-independent reading of a chord: root, template quality, the factor
 * each voice carries and the inversion implied by the bass voice.
 *
 * @param rootPitchClass root pitch class (0-11); for an {@link ChordQuality#UNKNOWN}
 *                       chord this is the bass, used as a stand-in
 * @param rootPitch      lowest sounding pitch spelling the root
 * @param quality        matched template
 * @param factors        factor per sounding voice
 * @param inversion      0-3, from the factor found in the bass voice
 * @param ninth          a voice sits a minor or major ninth above the root
 */
public record ChordStructure(int rootPitchClass,
                             Pitch rootPitch,
                             ChordQuality quality,
                             Map<Voice, ChordFactor> factors,
                             int inversion,
                             boolean ninth) {

    public ChordStructure {
        Objects.requireNonNull(rootPitch, "rootPitch must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
        EnumMap<Voice, ChordFactor> copy = new EnumMap<>(Voice.class);
        copy.putAll(factors);
        factors = Collections.unmodifiableMap(copy);
    }

    public boolean isIndeterminate() {
        return quality == ChordQuality.UNKNOWN;
    }

    public ChordFactor factor(Voice voice) {
        return factors.get(voice);
    }

    public boolean hasFactor(ChordFactor factor) {
        return factors.containsValue(factor);
    }

    public int count(ChordFactor factor) {
        int n = 0;
        for (ChordFactor f : factors.values()) {
            if (f == factor) {
                n++;
            }
        }
        return n;
    }

    /** Distinct pitch-class distances above the root present in {@code snapshot}. */
    public SortedSet<Integer> intervalsFromRoot(ChordSnapshot snapshot) {
        SortedSet<Integer> out = new TreeSet<>();
        for (int pc : snapshot.pitchClasses()) {
            out.add(Math.floorMod(pc - rootPitchClass, 12));
        }
        return out;
    }
}
