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
import ai.evacortex.chorale.core.pitch.MotionType;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A candidate violation found by a detector, before exception predicates
 * have been consulted.
 *
 * @param chordIndex 0 when the problem sits in the first chord, 1 in the second
 * @param voices     voices involved, in reporting order; empty when no single voice is to blame
 * @param motion     motion of the voice pair, {@code null} when not applicable
 * @param severity   severity of the resulting violation
 * @param tags       facts exception predicates may need
 * @param detail     short qualifier appended to the rule message, or {@code null}
 */
public record Detection(int chordIndex,
                        List<Voice> voices,
                        MotionType motion,
                        Severity severity,
                        Set<Tag> tags,
                        String detail) {

    public enum Tag {
        /** The leading tone belongs to a tonicized chord rather than the key. */
        LOCAL_LEADING_TONE
    }

    public Detection {
        voices = List.copyOf(voices);
        Objects.requireNonNull(severity, "severity must not be null");
        tags = tags.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(tags));
    }

    public static Detection pair(VoicePair pair, MotionType motion) {
        return new Detection(0, pair.asList(), motion, Severity.CRITICAL, Set.of(), null);
    }

    public static Detection of(int chordIndex, List<Voice> voices) {
        return new Detection(chordIndex, voices, null, Severity.CRITICAL, Set.of(), null);
    }

    public Detection withTag(Tag tag) {
        EnumSet<Tag> t = tags.isEmpty() ? EnumSet.noneOf(Tag.class) : EnumSet.copyOf(tags);
        t.add(tag);
        return new Detection(chordIndex, voices, motion, severity, t, detail);
    }

    public Detection withSeverity(Severity newSeverity, String newDetail) {
        return new Detection(chordIndex, voices, motion, newSeverity, tags, newDetail);
    }

    public boolean has(Tag tag) {
        return tags.contains(tag);
    }

    public boolean involves(Voice v) {
        return voices.contains(v);
    }
}
