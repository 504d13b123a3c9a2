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

import java.util.*;

/**
 * The pitches sounding on one beat, keyed by voice. Any voice may be absent.
 */
public record ChordSnapshot(Map<Voice, Pitch> voices) {

    public ChordSnapshot {
        Objects.requireNonNull(voices, "voices must not be null");
        EnumMap<Voice, Pitch> copy = new EnumMap<>(Voice.class);
        for (Map.Entry<Voice, Pitch> e : voices.entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                copy.put(e.getKey(), e.getValue());
            }
        }
        voices = Collections.unmodifiableMap(copy);
    }

    /** Builds a snapshot from soprano, alto, tenor and bass pitches; {@code null} marks a silent voice. */
    public static ChordSnapshot of(Pitch soprano, Pitch alto, Pitch tenor, Pitch bass) {
        Map<Voice, Pitch> map = new EnumMap<>(Voice.class);
        map.put(Voice.SOPRANO, soprano);
        map.put(Voice.ALTO, alto);
        map.put(Voice.TENOR, tenor);
        map.put(Voice.BASS, bass);
        return new ChordSnapshot(map);
    }

    /** Same as {@link #of(Pitch, Pitch, Pitch, Pitch)} from note names. */
    public static ChordSnapshot parse(String soprano, String alto, String tenor, String bass) {
        return of(parseOrNull(soprano), parseOrNull(alto), parseOrNull(tenor), parseOrNull(bass));
    }

    private static Pitch parseOrNull(String text) {
        return text == null ? null : Pitch.parse(text);
    }

    public Pitch pitch(Voice voice) {
        return voices.get(voice);
    }

    public boolean has(Voice voice) {
        return voices.containsKey(voice);
    }

    public boolean isEmpty() {
        return voices.isEmpty();
    }

    public int size() {
        return voices.size();
    }

    /** Sounding voices ordered from bass to soprano. */
    public List<Voice> soundingBottomUp() {
        List<Voice> out = new ArrayList<>(4);
        for (Voice v : Voice.BOTTOM_UP) {
            if (voices.containsKey(v)) {
                out.add(v);
            }
        }
        return out;
    }

    /** Distinct pitch classes in bass-to-soprano order of first appearance. */
    public List<Integer> pitchClassesBottomUp() {
        LinkedHashSet<Integer> pcs = new LinkedHashSet<>();
        for (Voice v : soundingBottomUp()) {
            pcs.add(voices.get(v).pitchClass());
        }
        return new ArrayList<>(pcs);
    }

    public Set<Integer> pitchClasses() {
        return new TreeSet<>(pitchClassesBottomUp());
    }

    /** Lowest sounding pitch, regardless of which voice carries it. */
    public Pitch lowest() {
        Pitch low = null;
        for (Pitch p : voices.values()) {
            if (low == null || p.compareTo(low) < 0) {
                low = p;
            }
        }
        return low;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("{");
        for (Voice v : Voice.values()) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            Pitch p = voices.get(v);
            sb.append(v.code()).append(':').append(p == null ? "-" : p.toString());
        }
        return sb.append('}').toString();
    }
}
