package com.dimensio.infrastructure.engine;

/**
 * Last-resort order between candidates with the same span length and start.
 */
public enum TieBreak {

    /** The candidate from the rule declared first wins. */
    RULE_DECLARATION_ORDER,

    /** The candidate produced in the latest pass wins, then declaration order. */
    COMPOSITION_DEPTH
}
