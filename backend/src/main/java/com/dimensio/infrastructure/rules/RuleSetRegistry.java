package com.dimensio.infrastructure.rules;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.domain.extraction.rule.RuleConfigurationException;
import com.dimensio.domain.extraction.rule.RuleSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Locale × dimension dispatch table, built once from the rule books.
 * <p>
 * A request for some dimensions gets the rules of those dimensions and of
 * everything they depend on, dependencies first, each dimension's rules in
 * declaration order. Locale-independent rules are merged into every
 * locale. Rule sets are cached per (locale, dimensions).
 * </p>
 */
@Slf4j
@Component
public class RuleSetRegistry {

    private final Map<String, Map<Dimension<?>, List<Rule>>> rulesByLocale = new LinkedHashMap<>();
    private final Map<String, Dimension<?>> dimensionsByName = new LinkedHashMap<>();
    private final Map<RuleSetKey, RuleSet> cache = new ConcurrentHashMap<>();

    public RuleSetRegistry(List<LocaleRuleBook> ruleBooks) {
        Dimensions.builtIn().forEach(this::registerDimension);

        List<LocaleRuleBook> common = ruleBooks.stream()
                .filter(book -> LocaleRuleBook.ALL_LOCALES.equals(book.locale()))
                .toList();
        for (LocaleRuleBook book : ruleBooks) {
            if (LocaleRuleBook.ALL_LOCALES.equals(book.locale())) {
                continue;
            }
            Map<Dimension<?>, List<Rule>> target = rulesByLocale.computeIfAbsent(
                    normalize(book.locale()), locale -> new LinkedHashMap<>());
            merge(target, book);
        }
        if (rulesByLocale.isEmpty()) {
            throw new RuleConfigurationException("No locale rule books registered");
        }
        for (Map<Dimension<?>, List<Rule>> target : rulesByLocale.values()) {
            common.forEach(book -> merge(target, book));
        }

        rulesByLocale.forEach((locale, rules) -> {
            RuleSet all = ruleSet(locale, Set.of());
            log.info("[Registry] Locale '{}' loaded: {} rules over {} dimensions", locale, all.size(), rules.size());
        });
    }

    public Set<String> locales() {
        return Set.copyOf(rulesByLocale.keySet());
    }

    /**
     * Maps a caller locale ("en_US", "en-GB", "EN") onto a loaded rule locale.
     */
    public Optional<String> resolveLocale(String requested) {
        if (requested == null || requested.isBlank()) {
            return Optional.empty();
        }
        String normalized = normalize(requested);
        if (rulesByLocale.containsKey(normalized)) {
            return Optional.of(normalized);
        }
        String language = normalized.split("[_-]")[0];
        return rulesByLocale.containsKey(language) ? Optional.of(language) : Optional.empty();
    }

    public Optional<Dimension<?>> dimension(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(dimensionsByName.get(name.trim().toLowerCase(Locale.ROOT)));
    }

    /**
     * Public dimensions the locale has rules for.
     */
    public Set<Dimension<?>> dimensions(String locale) {
        Map<Dimension<?>, List<Rule>> rules = rulesFor(locale);
        Set<Dimension<?>> dimensions = new LinkedHashSet<>();
        rules.forEach((dimension, list) -> {
            if (!dimension.isInternal() && !list.isEmpty()) {
                dimensions.add(dimension);
            }
        });
        return dimensions;
    }

    /**
     * @param locale     a loaded locale, see {@link #resolveLocale(String)}
     * @param dimensions requested dimensions; empty means all
     */
    public RuleSet ruleSet(String locale, Set<Dimension<?>> dimensions) {
        return cache.computeIfAbsent(new RuleSetKey(locale, Set.copyOf(dimensions)), key -> build(locale, dimensions));
    }

    private RuleSet build(String locale, Set<Dimension<?>> requested) {
        Map<Dimension<?>, List<Rule>> rules = rulesFor(locale);
        List<Dimension<?>> roots = new ArrayList<>(requested.isEmpty() ? rules.keySet() : requested);
        roots.sort(Comparator.comparing(d -> d.name()));

        List<Dimension<?>> ordered = new ArrayList<>();
        for (Dimension<?> root : roots) {
            addWithDependencies(root, ordered);
        }
        List<Rule> selected = new ArrayList<>();
        for (Dimension<?> dimension : ordered) {
            selected.addAll(rules.getOrDefault(dimension, List.of()));
        }
        return new RuleSet(locale, selected);
    }

    // dependencies before dependents
    private static void addWithDependencies(Dimension<?> dimension, List<Dimension<?>> ordered) {
        if (ordered.contains(dimension)) {
            return;
        }
        for (Dimension<?> dependency : dimension.dependencies()) {
            addWithDependencies(dependency, ordered);
        }
        ordered.add(dimension);
    }

    private Map<Dimension<?>, List<Rule>> rulesFor(String locale) {
        Map<Dimension<?>, List<Rule>> rules = rulesByLocale.get(locale);
        if (rules == null) {
            throw new IllegalArgumentException("Locale not loaded: " + locale);
        }
        return rules;
    }

    private void merge(Map<Dimension<?>, List<Rule>> target, LocaleRuleBook book) {
        book.rules().forEach((dimension, rules) -> {
            registerDimension(dimension);
            target.computeIfAbsent(dimension, d -> new ArrayList<>()).addAll(rules);
        });
    }

    private void registerDimension(Dimension<?> dimension) {
        Dimension<?> previous = dimensionsByName.putIfAbsent(dimension.name(), dimension);
        if (previous != null && previous.payloadType() != dimension.payloadType()) {
            throw new RuleConfigurationException("Dimension '" + dimension.name()
                    + "' declared with two payload types");
        }
        dimension.dependencies().forEach(this::registerDimension);
    }

    private static String normalize(String locale) {
        return locale.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }

    private record RuleSetKey(String locale, Set<Dimension<?>> dimensions) {}
}
