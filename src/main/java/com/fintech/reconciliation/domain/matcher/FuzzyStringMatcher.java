package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.exception.MatchingConfigurationException;
import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.Confidence;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.MatchType;
import com.fintech.reconciliation.domain.model.PaymentCandidate;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Matches on approximate text similarity between the transaction's description,
 * reference and counterparty and the candidate's invoice texts.
 *
 * Useful when:
 * - bank descriptions differ slightly from invoice descriptions
 * - counterparty names carry typos or abbreviations
 * - references embed the invoice number among other text
 *
 * Candidates are pre-filtered by date window and amount tolerance, which bounds the
 * cost of the pairwise comparisons. Per candidate, the best field similarity (0-100)
 * is mapped to a confidence:
 * - 95+ → 0.95
 * - 90+ → 0.90
 * - 85+ → 0.85
 * - 80+ → 0.80
 * - 75+ → 0.75
 * - below → 0.70
 * Candidates whose best similarity is under {@code minSimilarity} are dropped.
 */
@Slf4j
@Getter
@ToString
public class FuzzyStringMatcher implements MatcherStrategy {

    public static final double DEFAULT_MIN_SIMILARITY = 85.0;
    public static final int DEFAULT_WINDOW_DAYS = 14;
    public static final double DEFAULT_AMOUNT_TOLERANCE_PCT = 5.0;

    static final String DESCRIPTION = "description";
    static final String REFERENCE = "reference";
    static final String COUNTERPARTY = "counterparty";
    static final String PARTIAL_REFERENCE = "partial_reference";

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final double minSimilarity;
    private final int dateWindowDays;
    private final double amountTolerancePct;

    public FuzzyStringMatcher() {
        this(DEFAULT_MIN_SIMILARITY, DEFAULT_WINDOW_DAYS, DEFAULT_AMOUNT_TOLERANCE_PCT);
    }

    public FuzzyStringMatcher(double minSimilarity, int dateWindowDays, double amountTolerancePct) {
        if (Double.isNaN(minSimilarity) || minSimilarity < 0 || minSimilarity > 100) {
            throw new MatchingConfigurationException("minSimilarity must be between 0 and 100, got " + minSimilarity);
        }
        if (dateWindowDays < 0) {
            throw new MatchingConfigurationException("dateWindowDays must be >= 0, got " + dateWindowDays);
        }
        if (Double.isNaN(amountTolerancePct) || amountTolerancePct < 0 || amountTolerancePct > 100) {
            throw new MatchingConfigurationException(
                    "amountTolerancePct must be between 0 and 100, got " + amountTolerancePct);
        }
        this.minSimilarity = minSimilarity;
        this.dateWindowDays = dateWindowDays;
        this.amountTolerancePct = amountTolerancePct;
    }

    @Override
    public List<MatchResult> match(BankTransaction transaction, List<PaymentCandidate> candidates) {
        List<MatchResult> results = new ArrayList<>();

        for (PaymentCandidate candidate : prefilter(transaction, candidates)) {
            Map<String, Double> similarities = similarities(transaction, candidate);
            if (similarities.isEmpty()) {
                continue;
            }

            // first field wins ties, so the reason is stable
            Map.Entry<String, Double> best = null;
            for (Map.Entry<String, Double> entry : similarities.entrySet()) {
                if (best == null || entry.getValue() > best.getValue()) {
                    best = entry;
                }
            }

            double maxSimilarity = best.getValue();
            if (maxSimilarity < minSimilarity) {
                continue;
            }

            List<String> matchedFields = new ArrayList<>();
            similarities.forEach((field, score) -> {
                if (score >= minSimilarity) {
                    matchedFields.add(field);
                }
            });

            results.add(MatchResult.builder()
                    .transaction(transaction)
                    .candidate(candidate)
                    .confidence(Confidence.of(MatchScoring.similarityToConfidence(maxSimilarity)))
                    .matchType(MatchType.FUZZY)
                    .matchReason(String.format(Locale.ROOT, "Fuzzy match: %s similarity %.1f%%",
                            best.getKey(), maxSimilarity))
                    .matchedFields(matchedFields)
                    .amountDifference(MatchScoring.amountDifference(transaction, candidate))
                    .build());
        }

        results.sort(MatchScoring.BY_CONFIDENCE_DESC);
        log.debug("Fuzzy matches for transaction {}: {}", transaction.getId(), results.size());
        return results;
    }

    List<PaymentCandidate> prefilter(BankTransaction transaction, List<PaymentCandidate> candidates) {
        BigDecimal amount = transaction.absoluteAmount();
        BigDecimal tolerance = amount.multiply(BigDecimal.valueOf(amountTolerancePct)).divide(HUNDRED);
        BigDecimal min = amount.subtract(tolerance);
        BigDecimal max = amount.add(tolerance);

        List<PaymentCandidate> filtered = new ArrayList<>();
        for (PaymentCandidate candidate : candidates) {
            if (!MatchScoring.withinDays(transaction.getDate(), candidate.getDueDate(), dateWindowDays)) {
                continue;
            }
            BigDecimal outstanding = candidate.outstandingAmount();
            if (outstanding.compareTo(min) < 0 || outstanding.compareTo(max) > 0) {
                continue;
            }
            filtered.add(candidate);
        }
        return filtered;
    }

    /**
     * Best similarity per transaction field across all candidate texts.
     * Fields that are absent on the transaction do not appear.
     */
    Map<String, Double> similarities(BankTransaction transaction, PaymentCandidate candidate) {
        Map<String, Double> scores = new LinkedHashMap<>();
        List<String> candidateTexts = new ArrayList<>();
        for (String text : candidate.searchableTexts()) {
            String normalized = TextSimilarity.normalize(text);
            if (!normalized.isEmpty()) {
                candidateTexts.add(normalized);
            }
        }
        if (candidateTexts.isEmpty()) {
            return scores;
        }

        String description = TextSimilarity.normalize(transaction.getDescription());
        String reference = TextSimilarity.normalize(transaction.getReference());
        String counterparty = TextSimilarity.normalize(transaction.getCounterparty());

        if (!description.isEmpty()) {
            scores.put(DESCRIPTION, best(description, candidateTexts, false));
        }
        if (!reference.isEmpty()) {
            scores.put(REFERENCE, best(reference, candidateTexts, false));
        }
        if (!counterparty.isEmpty()) {
            scores.put(COUNTERPARTY, best(counterparty, candidateTexts, false));
        }
        if (!reference.isEmpty()) {
            scores.put(PARTIAL_REFERENCE, best(reference, candidateTexts, true));
        }
        return scores;
    }

    private static double best(String text, List<String> candidateTexts, boolean partial) {
        double best = 0.0;
        for (String candidateText : candidateTexts) {
            double score = partial
                    ? TextSimilarity.partialRatio(text, candidateText)
                    : TextSimilarity.similarity(text, candidateText);
            best = Math.max(best, score);
        }
        return best;
    }
}
