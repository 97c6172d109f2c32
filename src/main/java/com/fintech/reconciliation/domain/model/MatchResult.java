package com.fintech.reconciliation.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A candidate payment proposed as the counterpart of a bank transaction.
 *
 * Holds references to the transaction and candidate; it never owns or modifies them.
 * Consumed by the auto-apply policy, the review queue and audit logging.
 */
@Value
public class MatchResult {

    BankTransaction transaction;
    PaymentCandidate candidate;
    Confidence confidence;
    MatchType matchType;
    String matchReason;
    Set<String> matchedFields;
    BigDecimal amountDifference;

    @Builder(toBuilder = true)
    private MatchResult(@NonNull BankTransaction transaction,
                        @NonNull PaymentCandidate candidate,
                        @NonNull Confidence confidence,
                        @NonNull MatchType matchType,
                        String matchReason,
                        Collection<String> matchedFields,
                        BigDecimal amountDifference) {
        this.transaction = transaction;
        this.candidate = candidate;
        this.confidence = confidence;
        this.matchType = matchType;
        this.matchReason = matchReason == null ? "" : matchReason;
        this.matchedFields = matchedFields == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(matchedFields));
        this.amountDifference = amountDifference == null
                ? transaction.absoluteAmount().subtract(candidate.outstandingAmount()).abs()
                : amountDifference.abs();
    }

    public String getCandidateId() {
        return candidate.getId();
    }

    /**
     * Copy of this result with a different score.
     *
     * @throws IllegalArgumentException if the score is outside [0.0, 1.0]
     */
    public MatchResult withConfidence(double value) {
        return toBuilder().confidence(Confidence.of(value)).build();
    }
}
