package com.dimensio.infrastructure.rules.en;

import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.DistanceData;
import com.dimensio.domain.extraction.model.payload.FinanceData;
import com.dimensio.domain.extraction.model.payload.QuantityData;
import com.dimensio.domain.extraction.model.payload.TemperatureData;
import com.dimensio.domain.extraction.model.payload.VolumeData;
import com.dimensio.domain.extraction.rule.Rule;
import com.dimensio.infrastructure.rules.NumeralHelpers;

import java.util.List;
import java.util.Optional;

import static com.dimensio.domain.extraction.model.Dimensions.NUMERAL;
import static com.dimensio.domain.extraction.model.Dimensions.QUANTITY;
import static com.dimensio.domain.extraction.model.Dimensions.TEMPERATURE;
import static com.dimensio.domain.extraction.rule.Patterns.dimension;
import static com.dimensio.domain.extraction.rule.Patterns.regex;

/**
 * Temperatures, distances, volumes, quantities and amounts of money.
 */
final class EnglishMeasureRules {

    private static final String CURRENCY =
            "(\\$|€|£|¥|usd|eur|gbp|jpy|inr|nok|dollars?|bucks?|euros?|pounds?|cents?|yen|rupees?|kroner|kr)";

    static final List<Rule> TEMPERATURES = List.of(
            Rule.named("number as temp")
                    .pattern(dimension(NUMERAL))
                    .latent()
                    .produce(tokens -> Optional.of(new TemperatureData(NumeralHelpers.value(tokens.get(0)), null))),
            Rule.named("<latent temp> degrees")
                    .pattern(dimension(TEMPERATURE, td -> td.unit() == null), regex("deg(ree?)?s?\\.?|°"))
                    .produce(tokens -> Optional.of(tokens.get(0).payload(TEMPERATURE).withUnit("degree"))),
            Rule.named("<temp> Celsius")
                    .pattern(dimension(TEMPERATURE, EnglishMeasureRules::isBareDegree), regex("c(el[cs]?(ius)?)?\\.?"))
                    .produce(tokens -> Optional.of(tokens.get(0).payload(TEMPERATURE).withUnit("celsius"))),
            Rule.named("<temp> Fahrenheit")
                    .pattern(dimension(TEMPERATURE, EnglishMeasureRules::isBareDegree), regex("f(ah?rh?eh?n(h?eit)?)?\\.?"))
                    .produce(tokens -> Optional.of(tokens.get(0).payload(TEMPERATURE).withUnit("fahrenheit"))),
            Rule.named("<temp> below zero")
                    .pattern(dimension(TEMPERATURE, td -> td.value() > 0), regex("below zero"))
                    .produce(tokens -> {
                        TemperatureData temperature = tokens.get(0).payload(TEMPERATURE);
                        return Optional.of(new TemperatureData(-temperature.value(),
                                temperature.unit() == null ? "degree" : temperature.unit()));
                    })
    );

    static final List<Rule> DISTANCES = List.of(
            Rule.named("<number> <distance unit>")
                    .pattern(dimension(NUMERAL), regex("(kilomet(?:er|re)s?|km|millimet(?:er|re)s?|mm"
                            + "|centimet(?:er|re)s?|cm|met(?:er|re)s?|miles?|mi|m|feet|foot|ft|inch(?:es)?"
                            + "|yards?|yd|'|\")"))
                    .produce(tokens -> distanceUnit(NumeralHelpers.group(tokens.get(1), 0))
                            .map(unit -> new DistanceData(NumeralHelpers.value(tokens.get(0)), unit)))
    );

    static final List<Rule> VOLUMES = List.of(
            Rule.named("<number> <volume unit>")
                    .pattern(dimension(NUMERAL), regex("(millilit(?:er|re)s?|ml|hectolit(?:er|re)s?|hl"
                            + "|lit(?:er|re)s?|l|gal(?:lon)?s?)"))
                    .produce(tokens -> volumeUnit(NumeralHelpers.group(tokens.get(1), 0))
                            .map(unit -> new VolumeData(NumeralHelpers.value(tokens.get(0)), unit)))
    );

    static final List<Rule> QUANTITIES = List.of(
            Rule.named("<number> <unit>")
                    .pattern(dimension(NUMERAL), regex("(cups?|kilograms?|kg|milligrams?|mg|grams?|g"
                            + "|pounds?|lbs?|ounces?|oz)"))
                    .produce(tokens -> quantity(NumeralHelpers.value(tokens.get(0)), NumeralHelpers.group(tokens.get(1), 0))),
            Rule.named("<quantity> of product")
                    .pattern(dimension(QUANTITY, qd -> qd.product() == null), regex("of (\\p{L}+)"))
                    .produce(tokens -> Optional.of(tokens.get(0).payload(QUANTITY)
                            .withProduct(NumeralHelpers.group(tokens.get(1), 0))))
    );

    static final List<Rule> FINANCE = List.of(
            Rule.named("<currency> <amount>")
                    .pattern(regex(CURRENCY), dimension(NUMERAL))
                    .produce(tokens -> money(tokens.get(1), NumeralHelpers.group(tokens.get(0), 0))),
            Rule.named("<amount> <currency>")
                    .pattern(dimension(NUMERAL), regex(CURRENCY))
                    .produce(tokens -> money(tokens.get(0), NumeralHelpers.group(tokens.get(1), 0)))
    );

    private EnglishMeasureRules() {
    }

    private static boolean isBareDegree(TemperatureData temperature) {
        return temperature.unit() == null || "degree".equals(temperature.unit());
    }

    static Optional<String> distanceUnit(String unit) {
        if (unit.startsWith("kilo") || unit.equals("km")) {
            return Optional.of("kilometre");
        } else if (unit.startsWith("milli") || unit.equals("mm")) {
            return Optional.of("millimetre");
        } else if (unit.startsWith("centi") || unit.equals("cm")) {
            return Optional.of("centimetre");
        } else if (unit.startsWith("mi")) {
            return Optional.of("mile");
        } else if (unit.equals("m") || unit.startsWith("met")) {
            return Optional.of("metre");
        } else if (unit.startsWith("f") || unit.equals("'")) {
            return Optional.of("foot");
        } else if (unit.startsWith("inch") || unit.equals("\"")) {
            return Optional.of("inch");
        } else if (unit.startsWith("y")) {
            return Optional.of("yard");
        }
        return Optional.empty();
    }

    static Optional<String> volumeUnit(String unit) {
        if (unit.startsWith("milli") || unit.equals("ml")) {
            return Optional.of("millilitre");
        } else if (unit.startsWith("hecto") || unit.equals("hl")) {
            return Optional.of("hectolitre");
        } else if (unit.startsWith("l")) {
            return Optional.of("litre");
        } else if (unit.startsWith("gal")) {
            return Optional.of("gallon");
        }
        return Optional.empty();
    }

    /** Weights are normalized to grams. */
    static Optional<QuantityData> quantity(double value, String unit) {
        if (unit.startsWith("cup")) {
            return Optional.of(new QuantityData(value, "cup", null));
        } else if (unit.startsWith("kilo") || unit.equals("kg")) {
            return Optional.of(new QuantityData(value * 1000, "gram", null));
        } else if (unit.startsWith("milli") || unit.equals("mg")) {
            return Optional.of(new QuantityData(value / 1000, "gram", null));
        } else if (unit.startsWith("g")) {
            return Optional.of(new QuantityData(value, "gram", null));
        } else if (unit.startsWith("pound") || unit.startsWith("lb")) {
            return Optional.of(new QuantityData(value, "pound", null));
        } else if (unit.startsWith("ounce") || unit.equals("oz")) {
            return Optional.of(new QuantityData(value, "ounce", null));
        }
        return Optional.empty();
    }

    static Optional<String> currency(String symbol) {
        if (symbol.equals("$") || symbol.equals("usd") || symbol.startsWith("dollar") || symbol.startsWith("buck")) {
            return Optional.of("USD");
        } else if (symbol.equals("€") || symbol.startsWith("eur")) {
            return Optional.of("EUR");
        } else if (symbol.equals("£") || symbol.equals("gbp") || symbol.startsWith("pound")) {
            return Optional.of("GBP");
        } else if (symbol.equals("¥") || symbol.equals("jpy") || symbol.equals("yen")) {
            return Optional.of("JPY");
        } else if (symbol.equals("inr") || symbol.startsWith("rupee")) {
            return Optional.of("INR");
        } else if (symbol.equals("nok") || symbol.startsWith("kr")) {
            return Optional.of("NOK");
        } else if (symbol.startsWith("cent")) {
            return Optional.of("cent");
        }
        return Optional.empty();
    }

    private static Optional<FinanceData> money(Token amount, String symbol) {
        return currency(symbol).map(code -> new FinanceData(NumeralHelpers.value(amount), code));
    }
}
