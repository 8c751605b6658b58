package com.dimensio.domain.extraction.model;

/**
 * Where a token came from.
 *
 * @param rule      name of the producing rule (diagnostic only)
 * @param ruleIndex declaration index of the rule within its rule set
 * @param pass      1-based pass in which the token was produced
 */
public record Provenance(String rule, int ruleIndex, int pass) {

    /** Provenance of transient text captures. */
    public static Provenance capture(int pass) {
        return new Provenance("<capture>", -1, pass);
    }
}
