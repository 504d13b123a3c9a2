/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import java.util.Optional;

/**
 * Stable rule names, in default evaluation order.
 */
public enum RuleId {
    PARALLEL_FIFTHS("parallel_fifths"),
    PARALLEL_OCTAVES("parallel_octaves"),
    DIRECT_FIFTHS("direct_fifths"),
    DIRECT_OCTAVES("direct_octaves"),
    UNEQUAL_FIFTHS("unequal_fifths"),
    LEADING_TONE_RESOLUTION("leading_tone_resolution"),
    SEVENTH_RESOLUTION("seventh_resolution"),
    VOICE_CROSSING("voice_crossing"),
    MAXIMUM_DISTANCE("maximum_distance"),
    VOICE_OVERLAP("voice_overlap"),
    DUPLICATED_LEADING_TONE("duplicated_leading_tone"),
    DUPLICATED_SEVENTH("duplicated_seventh"),
    EXCESSIVE_MELODIC_MOTION("excessive_melodic_motion"),
    IMPROPER_OMISSION("improper_omission");

    private final String id;

    RuleId(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<RuleId> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String n = name.trim();
        for (RuleId r : values()) {
            if (r.id.equals(n)) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
