/*
 * Chorale — Four-Part Harmony Engine
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.chorale.core.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable selection of rules. Toggling a rule returns a new set; an
 * engine built from a set keeps that selection for its whole life.
 */
public final class RuleSet {

    private static final Logger log = LoggerFactory.getLogger(RuleSet.class);

    private final List<RuleDefinition> rules;
    private final Set<RuleId> disabled;

    private RuleSet(List<RuleDefinition> rules, Set<RuleId> disabled) {
        this.rules = List.copyOf(rules);
        EnumSet<RuleId> copy = EnumSet.noneOf(RuleId.class);
        copy.addAll(disabled);
        this.disabled = Collections.unmodifiableSet(copy);
    }

    public static RuleSet defaults() {
        return of(RuleCatalog.defaults());
    }

    public static RuleSet of(List<RuleDefinition> rules) {
        Objects.requireNonNull(rules, "rules must not be null");
        return new RuleSet(rules, Set.of());
    }

    /** Default rules minus the named ones; unknown names are logged and ignored. */
    public static RuleSet defaultsWithout(Collection<String> names) {
        RuleSet set = defaults();
        for (String name : names) {
            set = set.withDisabled(name);
        }
        return set;
    }

    public RuleSet withDisabled(String name) {
        Optional<RuleDefinition> rule = find(name);
        if (rule.isEmpty()) {
            log.warn("Cannot disable unknown rule '{}'", name);
            return this;
        }
        return withDisabled(rule.get().id());
    }

    public RuleSet withDisabled(RuleId id) {
        if (disabled.contains(id)) {
            return this;
        }
        EnumSet<RuleId> next = EnumSet.of(id);
        next.addAll(disabled);
        return new RuleSet(rules, next);
    }

    public RuleSet withEnabled(String name) {
        Optional<RuleDefinition> rule = find(name);
        if (rule.isEmpty()) {
            log.warn("Cannot enable unknown rule '{}'", name);
            return this;
        }
        return withEnabled(rule.get().id());
    }

    public RuleSet withEnabled(RuleId id) {
        if (!disabled.contains(id)) {
            return this;
        }
        EnumSet<RuleId> next = EnumSet.noneOf(RuleId.class);
        next.addAll(disabled);
        next.remove(id);
        return new RuleSet(rules, next);
    }

    public boolean isEnabled(String name) {
        return find(name).map(r -> !disabled.contains(r.id())).orElse(false);
    }

    public List<RuleDefinition> activeRules() {
        List<RuleDefinition> out = new ArrayList<>(rules.size());
        for (RuleDefinition r : rules) {
            if (!disabled.contains(r.id())) {
                out.add(r);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public List<RuleDefinition> activeRules(RuleTier tier) {
        List<RuleDefinition> out = new ArrayList<>();
        for (RuleDefinition r : activeRules()) {
            if (r.tier() == tier) {
                out.add(r);
            }
        }
        return Collections.unmodifiableList(out);
    }

    public List<RuleDefinition> allRules() {
        return rules;
    }

    private Optional<RuleDefinition> find(String name) {
        Optional<RuleId> id = RuleId.fromName(name);
        if (id.isEmpty()) {
            return Optional.empty();
        }
        for (RuleDefinition r : rules) {
            if (r.id() == id.get()) {
                return Optional.of(r);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return "RuleSet[" + activeRules().size() + "/" + rules.size() + " active, disabled=" + disabled + "]";
    }
}
