package com.fintech.reconciliation.domain.model;

/**
 * Algorithm that produced a {@link MatchResult}.
 */
public enum MatchType {
    EXACT,
    FUZZY,
    IBAN,
    DATE_WINDOW,
    COMPOSITE
}
