package com.fintech.reconciliation.domain.matcher;

/**
 * How {@link CompositeMatcher} turns the strategies' results into one ranking.
 */
public enum MergeMode {

    /**
     * One weighted amount/date/description score per candidate that at least one
     * strategy proposed.
     */
    WEIGHTED,

    /**
     * Strategies' own results, keeping the highest confidence per candidate.
     */
    STRATEGY_DEDUP
}
