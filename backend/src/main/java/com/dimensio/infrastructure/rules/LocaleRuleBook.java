package com.dimensio.infrastructure.rules;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.rule.Rule;

import java.util.List;
import java.util.Map;

/**
 * Rules a locale contributes, grouped by the dimension they produce.
 * Rule books are read once, when the registry is built.
 */
public interface LocaleRuleBook {

    /** Locale applying to every other locale. */
    String ALL_LOCALES = "*";

    /** Language code ("en"), or {@link #ALL_LOCALES}. */
    String locale();

    /**
     * Rules by dimension, each list in declaration order. A dimension with
     * no rules for this locale is simply absent.
     */
    Map<Dimension<?>, List<Rule>> rules();
}
