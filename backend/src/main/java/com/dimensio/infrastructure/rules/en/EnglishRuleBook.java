package com.dimensio.infrastructure.rules.en;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.rules.LocaleRuleBook;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * English rules for every built-in dimension except the locale-independent ones.
 */
@Component
public class EnglishRuleBook implements LocaleRuleBook {

    @Override
    public String locale() {
        return "en";
    }

    @Override
    public Map<Dimension<?>, List<Rule>> rules() {
        Map<Dimension<?>, List<Rule>> rules = new LinkedHashMap<>();
        rules.put(Dimensions.NUMERAL, EnglishNumeralRules.RULES);
        rules.put(Dimensions.ORDINAL, EnglishOrdinalRules.RULES);
        rules.put(Dimensions.TIME_GRAIN, EnglishTimeRules.GRAINS);
        rules.put(Dimensions.DURATION, EnglishTimeRules.DURATIONS);
        rules.put(Dimensions.TIME, EnglishTimeRules.TIMES);
        rules.put(Dimensions.TEMPERATURE, EnglishMeasureRules.TEMPERATURES);
        rules.put(Dimensions.DISTANCE, EnglishMeasureRules.DISTANCES);
        rules.put(Dimensions.VOLUME, EnglishMeasureRules.VOLUMES);
        rules.put(Dimensions.QUANTITY, EnglishMeasureRules.QUANTITIES);
        rules.put(Dimensions.FINANCE, EnglishMeasureRules.FINANCE);
        return rules;
    }
}
