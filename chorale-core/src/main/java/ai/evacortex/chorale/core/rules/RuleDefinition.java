/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.pitch.MotionType;

import java.util.List;
import java.util.Objects;

/**
 * One voice-leading rule: identity, tier, messages, base detector, the
 * exceptions tried in order when the detector fires, and how confidence is
 * scored.
 *
 * @param contraryMessage message used when the voices move in contrary motion, or {@code null}
 */
public record RuleDefinition(RuleId id,
                             RuleTier tier,
                             String shortMessage,
                             String contraryMessage,
                             String explanation,
                             List<ExceptionPredicate> exceptions,
                             ConfidencePolicy confidence,
                             ViolationDetector detector) {

    public RuleDefinition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(tier, "tier must not be null");
        Objects.requireNonNull(shortMessage, "shortMessage must not be null");
        Objects.requireNonNull(confidence, "confidence must not be null");
        Objects.requireNonNull(detector, "detector must not be null");
        exceptions = List.copyOf(exceptions);
        explanation = explanation == null ? shortMessage : explanation;
    }

    public String name() {
        return id.id();
    }

    public String message(Detection detection) {
        String base = detection.motion() == MotionType.CONTRARY && contraryMessage != null
                ? contraryMessage
                : shortMessage;
        return detection.detail() == null ? base : base + " (" + detection.detail() + ")";
    }
}
