package com.dimensio.domain.extraction.rule;

import java.util.List;
import java.util.Objects;

/**
 * Rules active for one locale and request, in declaration order.
 * The declaration index of a rule is its position in {@link #rules()}.
 */
public final class RuleSet {

    private final String locale;
    private final List<Rule> rules;

    public RuleSet(String locale, List<Rule> rules) {
        this.locale = Objects.requireNonNull(locale, "locale");
        if (rules == null || rules.stream().anyMatch(Objects::isNull)) {
            throw new RuleConfigurationException("Rule set for locale '" + locale + "' contains null rules");
        }
        this.rules = List.copyOf(rules);
    }

    public String locale() {
        return locale;
    }

    public List<Rule> rules() {
        return rules;
    }

    public Rule rule(int index) {
        return rules.get(index);
    }

    public int size() {
        return rules.size();
    }

    public boolean isEmpty() {
        return rules.isEmpty();
    }

    @Override
    public String toString() {
        return "RuleSet[" + locale + ", " + rules.size() + " rules]";
    }
}
