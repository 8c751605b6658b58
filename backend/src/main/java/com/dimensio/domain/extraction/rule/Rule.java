package com.dimensio.domain.extraction.rule;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Named pattern plus the production that turns a match into a payload.
 * Rules are configuration: immutable and shared by every parse.
 *
 * @param name       diagnostic name, not used for correctness
 * @param items      ordered pattern items, at least one
 * @param production pure function from matched tokens to an optional payload
 * @param latent     true if tokens of this rule are low-confidence candidates
 */
public record Rule(String name, List<PatternItem> items, Production production, boolean latent) {

    public Rule {
        if (name == null || name.isBlank()) {
            throw new RuleConfigurationException("Rule name is required");
        }
        items = PatternItem.requireItems(items, name);
        if (production == null) {
            throw new RuleConfigurationException("Rule '" + name + "' has no production");
        }
        for (PatternItem item : items) {
            PatternItem.validate(item, name);
        }
    }

    public static Builder named(String name) {
        return new Builder(name);
    }

    public PatternItem first() {
        return items.get(0);
    }

    /** True if every item matches raw text, so the rule cannot depend on other tokens. */
    public boolean textOnly() {
        return items.stream().allMatch(PatternItem::matchesText);
    }

    @Override
    public String toString() {
        return "Rule[" + name + "]";
    }

    public static final class Builder {

        private final String name;
        private List<PatternItem> items = List.of();
        private boolean latent;

        private Builder(String name) {
            this.name = name;
        }

        public Builder pattern(PatternItem... items) {
            this.items = Arrays.asList(Objects.requireNonNull(items, "items"));
            return this;
        }

        public Builder latent() {
            this.latent = true;
            return this;
        }

        public Rule produce(Production production) {
            return new Rule(name, items, production, latent);
        }
    }
}
