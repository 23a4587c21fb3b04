package com.tradepilot.strategy;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.Getter;

/** Immutable, ordered rule set the {@link SignalEvaluator} applies to every instrument. */
@Getter
public class StrategyRuleBook {

    private final String name;
    private final List<StrategyRule> rules;

    public StrategyRuleBook(String name, List<StrategyRule> rules) {
        if (rules.isEmpty()) {
            throw new IllegalArgumentException("Rule book " + name + " has no rules");
        }
        this.name = name;
        this.rules = List.copyOf(rules);
    }

    public Set<String> inputKeys() {
        Set<String> keys = new LinkedHashSet<>();
        rules.forEach(rule -> keys.addAll(rule.inputKeys()));
        return keys;
    }
}
