/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

/**
 * Result of evaluating one rule on one pair.
 */
public record RuleOutcome(RuleId rule,
                          Status status,
                          RuleViolation violation,
                          ExceptionPredicate suppressedBy,
                          Throwable failure) {

    public enum Status {
        /** The rule fired and no exception applied. */
        VIOLATION,
        /** The detector found nothing. */
        CLEAN,
        /** The detector fired but an exception predicate applied to every candidate. */
        SUPPRESSED,
        /** The detector threw; no violation is reported. */
        FAILED
    }

    public static RuleOutcome violation(RuleViolation violation) {
        return new RuleOutcome(violation.rule(), Status.VIOLATION, violation, null, null);
    }

    public static RuleOutcome clean(RuleId rule) {
        return new RuleOutcome(rule, Status.CLEAN, null, null, null);
    }

    public static RuleOutcome suppressed(RuleId rule, ExceptionPredicate by) {
        return new RuleOutcome(rule, Status.SUPPRESSED, null, by, null);
    }

    public static RuleOutcome failed(RuleId rule, Throwable failure) {
        return new RuleOutcome(rule, Status.FAILED, null, null, failure);
    }

    public boolean isViolation() {
        return status == Status.VIOLATION;
    }
}
