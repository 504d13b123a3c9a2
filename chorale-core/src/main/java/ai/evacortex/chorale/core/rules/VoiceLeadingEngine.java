/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import ai.evacortex.chorale.core.analysis.ChordAnalysis;
import ai.evacortex.chorale.core.key.Tonality;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs a {@link RuleSet} over chord pairs in one key.
 *
 * <p>For each rule the detector proposes candidates in scan order. Each
 * candidate is checked against the rule's exception predicates in
 * registration order; the first predicate that applies suppresses it. The
 * first candidate left standing becomes the rule's violation. Rules are
 * independent: every active rule runs on every pair.</p>
 *
 * <p>A detector that throws yields a {@link RuleOutcome.Status#FAILED}
 * outcome and no violation; a predicate that throws does not suppress.
 * Both are logged and evaluation moves on.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class VoiceLeadingEngine {

    private static final Logger log = LoggerFactory.getLogger(VoiceLeadingEngine.class);

    private final Tonality tonality;
    private final RuleSet rules;

    public VoiceLeadingEngine(Tonality tonality) {
        this(tonality, RuleSet.defaults());
    }

    public VoiceLeadingEngine(Tonality tonality, RuleSet rules) {
        this.tonality = Objects.requireNonNull(tonality, "tonality must not be null");
        this.rules = Objects.requireNonNull(rules, "rules must not be null");
    }

    public Tonality tonality() {
        return tonality;
    }

    public RuleSet rules() {
        return rules;
    }

    /** Violations of every active rule between two chords. */
    public List<RuleViolation> validate(ProgressionPair pair) {
        List<RuleViolation> out = new ArrayList<>();
        for (RuleOutcome outcome : evaluate(pair)) {
            if (outcome.isViolation()) {
                out.add(outcome.violation());
            }
        }
        return out;
    }

    public List<RuleViolation> validate(ChordAnalysis first, ChordAnalysis second) {
        return validate(ProgressionPair.of(first, second));
    }

    /** One outcome per active rule, in rule order. */
    public List<RuleOutcome> evaluate(ProgressionPair pair) {
        Objects.requireNonNull(pair, "pair must not be null");
        List<RuleDefinition> active = rules.activeRules();
        List<RuleOutcome> out = new ArrayList<>(active.size());
        for (RuleDefinition rule : active) {
            out.add(evaluate(rule, pair));
        }
        return out;
    }

    public RuleOutcome evaluate(RuleDefinition rule, ProgressionPair pair) {
        List<Detection> candidates;
        try {
            candidates = rule.detector().detect(pair, tonality);
        } catch (RuntimeException e) {
            log.warn("Rule {} failed on pair {}, treating as no violation", rule.name(), pair.index(), e);
            return RuleOutcome.failed(rule.id(), e);
        }

        ExceptionPredicate firstSuppression = null;
        for (Detection candidate : candidates) {
            ExceptionPredicate by = firstApplying(rule, pair, candidate);
            if (by == null) {
                RuleViolation v = toViolation(rule, candidate, pair);
                log.debug("Rule {} fired on pair {}: {}", rule.name(), pair.index(), v.voices());
                return RuleOutcome.violation(v);
            }
            if (firstSuppression == null) {
                firstSuppression = by;
            }
        }
        if (firstSuppression != null) {
            log.debug("Rule {} suppressed on pair {} by {}", rule.name(), pair.index(), firstSuppression);
            return RuleOutcome.suppressed(rule.id(), firstSuppression);
        }
        return RuleOutcome.clean(rule.id());
    }

    /**
     * Validates every consecutive pair of a progression.
     *
     * @param chords analysed chords in order
     * @return violations of all pairs, pair by pair
     */
    public List<RuleViolation> validateProgression(List<ChordAnalysis> chords) {
        Objects.requireNonNull(chords, "chords must not be null");
        List<RuleViolation> out = new ArrayList<>();
        for (int i = 0; i + 1 < chords.size(); i++) {
            out.addAll(validate(new ProgressionPair(chords.get(i), chords.get(i + 1), i)));
        }
        return out;
    }

    private ExceptionPredicate firstApplying(RuleDefinition rule, ProgressionPair pair, Detection candidate) {
        for (ExceptionPredicate p : rule.exceptions()) {
            if (ExceptionEvaluator.evaluate(p, pair, candidate, tonality) == PredicateResult.APPLIES) {
                return p;
            }
        }
        return null;
    }

    private static RuleViolation toViolation(RuleDefinition rule, Detection d, ProgressionPair pair) {
        return new RuleViolation(rule.id(), rule.tier(), d.severity(), rule.confidence().score(d),
                d.voices(), d.motion(), pair.index(), d.chordIndex(), rule.message(d));
    }
}
