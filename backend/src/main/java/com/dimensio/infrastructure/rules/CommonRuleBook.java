package com.dimensio.infrastructure.rules;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.TextData;
import com.dimensio.domain.extraction.rule.Rule;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dimensio.domain.extraction.rule.Patterns.regex;

/**
 * Rules that read the same in every language: digit integers, emails, URLs
 * and phone numbers.
 */
@Component
public class CommonRuleBook implements LocaleRuleBook {

    static final Rule INTEGER_NUMERIC = Rule.named("integer (numeric)")
            .pattern(regex("(\\d{1,18})"))
            .produce(tokens -> NumeralHelpers.parseInt(NumeralHelpers.group(tokens.get(0), 0))
                    .flatMap(NumeralHelpers::integer));

    static final Rule EMAIL = Rule.named("email")
            .pattern(regex("[\\w]+(?:[.+\\-][\\w]+)*@[\\w]+(?:[\\-][\\w]+)*(?:\\.[\\w]+(?:[\\-][\\w]+)*)*\\.[a-z]{2,}"))
            .produce(tokens -> text(Dimensions.EMAIL, tokens.get(0)));

    static final Rule URL = Rule.named("url")
            .pattern(regex("(?:https?://|www\\.)[\\w\\-.~:/?#\\[\\]@!$&'()*+,;=%]+[\\w/=]"))
            .produce(tokens -> text(Dimensions.URL, tokens.get(0)));

    // local "02-123-4567", North American "(555) 123-4567", international "+47 22 12 34 56"
    static final Rule PHONE_NUMBER = Rule.named("phone number")
            .pattern(regex("0\\d{1,2}[\\-.]\\d{3,4}[\\-.]\\d{4}"
                    + "|\\(\\d{3}\\)\\s?\\d{3}[\\-.]\\d{4}"
                    + "|\\d{3}[\\-.]\\d{3}[\\-.]\\d{4}"
                    + "|\\+\\d{1,3}(?:[\\s.\\-]?\\d{1,4}){2,5}"))
            .produce(tokens -> {
                String number = tokens.get(0).payload(Dimensions.REGEX_MATCH).text();
                long digits = number.chars().filter(Character::isDigit).count();
                return digits >= 7 && digits <= 15 ? Optional.of(new TextData(Dimensions.PHONE_NUMBER, number)) : Optional.empty();
            });

    @Override
    public String locale() {
        return ALL_LOCALES;
    }

    @Override
    public Map<Dimension<?>, List<Rule>> rules() {
        return Map.of(
                Dimensions.NUMERAL, List.of(INTEGER_NUMERIC),
                Dimensions.EMAIL, List.of(EMAIL),
                Dimensions.URL, List.of(URL),
                Dimensions.PHONE_NUMBER, List.of(PHONE_NUMBER)
        );
    }

    private static Optional<TextData> text(Dimension<TextData> dimension, Token capture) {
        return Optional.of(new TextData(dimension, capture.payload(Dimensions.REGEX_MATCH).text()));
    }
}
