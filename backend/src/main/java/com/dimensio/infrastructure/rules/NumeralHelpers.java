package com.dimensio.infrastructure.rules;

import com.dimensio.domain.extraction.model.Dimensions;
import com.dimensio.domain.extraction.model.Token;
import com.dimensio.domain.extraction.model.payload.NumeralData;
import com.dimensio.domain.extraction.model.payload.TextMatch;
import com.dimensio.domain.extraction.model.payload.TextMatch.GroupMatch;
import com.dimensio.domain.extraction.model.payload.TextMatch.LiteralMatch;

import java.util.Locale;
import java.util.Optional;

/**
 * Building blocks shared by the numeral rules of every locale.
 */
public final class NumeralHelpers {

    private NumeralHelpers() {
    }

    public static Optional<NumeralData> integer(long value) {
        return Optional.of(NumeralData.of(value));
    }

    public static Optional<NumeralData> decimal(double value) {
        return Double.isFinite(value) ? Optional.of(NumeralData.of(value)) : Optional.empty();
    }

    /**
     * Capture group {@code index} of a text token, lower-cased; "" when absent.
     */
    public static String group(Token token, int index) {
        TextMatch match = token.payload(Dimensions.REGEX_MATCH);
        if (match instanceof GroupMatch groups) {
            return groups.group(index).toLowerCase(Locale.ROOT);
        }
        return index == 0 ? match.text().toLowerCase(Locale.ROOT) : "";
    }

    /** Value a literal-set item mapped the matched form to. */
    public static double literalValue(Token token) {
        TextMatch match = token.payload(Dimensions.REGEX_MATCH);
        if (match instanceof LiteralMatch literal) {
            return literal.value();
        }
        throw new IllegalStateException("Not a literal match: " + match);
    }

    public static NumeralData numeral(Token token) {
        return token.payload(Dimensions.NUMERAL);
    }

    public static double value(Token token) {
        return numeral(token).value();
    }

    public static Optional<Long> parseInt(String text) {
        try {
            return Optional.of(Long.parseLong(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static Optional<Double> parseDouble(String text) {
        try {
            return Optional.of(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /**
     * Parses a decimal written with a dot or, when {@code dotDecimal} is
     * false, with a comma (",5" is 0.5).
     */
    public static Optional<NumeralData> parseDecimal(boolean dotDecimal, String text) {
        String normalized = dotDecimal ? text : text.replace(',', '.');
        return parseDouble(normalized).flatMap(NumeralHelpers::decimal);
    }

    /**
     * Removes thousands separators, then parses with {@code decimalSeparator}.
     */
    public static Optional<NumeralData> parseGrouped(String text, char thousandsSeparator, char decimalSeparator) {
        String plain = text.replace(String.valueOf(thousandsSeparator), "").replace(decimalSeparator, '.');
        return parseDouble(plain).flatMap(NumeralHelpers::decimal);
    }

    /**
     * "two hundred": a grain-less multiplier scales any number; a multiplier
     * with a grain only scales a smaller number and keeps the grain.
     */
    public static Optional<NumeralData> multiply(Token left, Token right) {
        double v1 = value(left);
        NumeralData multiplier = numeral(right);
        double v2 = multiplier.value();
        if (!multiplier.hasGrain()) {
            return decimal(v1 * v2);
        }
        if (v2 > v1) {
            return decimal(v1 * v2).map(nd -> nd.withGrain(multiplier.grain()));
        }
        return Optional.empty();
    }

    /**
     * "two hundred three": a number with grain g absorbs a following number
     * smaller than 10^g.
     */
    public static Optional<NumeralData> intersect(Token left, Token right) {
        NumeralData high = numeral(left);
        double low = value(right);
        if (high.hasGrain() && Math.pow(10, high.grain()) > low) {
            return decimal(high.value() + low);
        }
        return Optional.empty();
    }

    /**
     * Reads the digits of {@code x} as a fraction: 5 → 0.5, 25 → 0.25, 10 → 0.1.
     */
    public static double decimalsToDouble(double x) {
        double multiplier = 1;
        for (int i = 0; i < 10; i++, multiplier *= 10) {
            if (x - multiplier < 0) {
                return x / multiplier;
            }
        }
        return 0;
    }

    /** Scale of a K, M or G suffix; 0 when unknown. */
    public static double suffixScale(String suffix) {
        return switch (suffix.toLowerCase(Locale.ROOT)) {
            case "k" -> 1e3;
            case "m" -> 1e6;
            case "g" -> 1e9;
            default -> 0;
        };
    }
}
