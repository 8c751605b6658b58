package com.dimensio.domain.extraction.model.payload;

import com.dimensio.domain.extraction.model.Dimension;
import com.dimensio.domain.extraction.model.DimensionPayload;
import com.dimensio.domain.extraction.model.Dimensions;

import java.util.List;

/**
 * Raw text captured by a text pattern item, handed to the rule's production.
 */
public sealed interface TextMatch extends DimensionPayload permits TextMatch.GroupMatch, TextMatch.LiteralMatch {

    /** Captured text the production usually looks at. */
    String text();

    @Override
    default Dimension<TextMatch> dimension() {
        return Dimensions.REGEX_MATCH;
    }

    /**
     * Regex capture groups 1..n; the whole match when the regex has no groups.
     * Groups that did not participate are empty strings.
     */
    record GroupMatch(List<String> groups) implements TextMatch {

        public GroupMatch {
            groups = List.copyOf(groups);
        }

        public String group(int index) {
            return index < groups.size() ? groups.get(index) : "";
        }

        @Override
        public String text() {
            return group(0);
        }
    }

    /**
     * Literal form accepted by a literal-set item and the value it maps to.
     */
    record LiteralMatch(String literal, double value) implements TextMatch {

        @Override
        public String text() {
            return literal;
        }
    }
}
