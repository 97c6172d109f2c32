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
import java.util.List;
import java.util.Locale;

/**
 * Proposes candidates that are close in both amount and date.
 *
 * A candidate qualifies when its due date is inside the window and both the
 * amount score and the date score from {@link MatchScoring} are non-zero.
 * Confidence = 0.60 + 0.20 * amountScore * dateScore, so it stays within 0.60-0.80.
 */
@Slf4j
@Getter
@ToString
public class DateWindowMatcher implements MatcherStrategy {

    public static final int DEFAULT_WINDOW_DAYS = 7;

    private static final BigDecimal BASE = new BigDecimal("0.60");
    private static final BigDecimal SPREAD = new BigDecimal("0.20");

    private final int dateWindowDays;

    public DateWindowMatcher() {
        this(DEFAULT_WINDOW_DAYS);
    }

    public DateWindowMatcher(int dateWindowDays) {
        if (dateWindowDays < 0) {
            throw new MatchingConfigurationException("dateWindowDays must be >= 0, got " + dateWindowDays);
        }
        this.dateWindowDays = dateWindowDays;
    }

    @Override
    public List<MatchResult> match(BankTransaction transaction, List<PaymentCandidate> candidates) {
        List<MatchResult> results = new ArrayList<>();

        for (PaymentCandidate candidate : candidates) {
            if (!MatchScoring.withinDays(transaction.getDate(), candidate.getDueDate(), dateWindowDays)) {
                continue;
            }

            double amountScore = MatchScoring.amountScore(transaction, candidate);
            double dateScore = MatchScoring.dateScore(transaction.getDate(), candidate.getDueDate());
            if (amountScore == 0.0 || dateScore == 0.0) {
                continue;
            }

            BigDecimal confidence = BASE.add(SPREAD
                    .multiply(BigDecimal.valueOf(amountScore))
                    .multiply(BigDecimal.valueOf(dateScore)));

            List<String> fields = new ArrayList<>(2);
            fields.add("amount");
            fields.add("date");

            long days = MatchScoring.daysBetween(transaction.getDate(), candidate.getDueDate());
            results.add(MatchResult.builder()
                    .transaction(transaction)
                    .candidate(candidate)
                    .confidence(Confidence.of(confidence))
                    .matchType(MatchType.DATE_WINDOW)
                    .matchReason(String.format(Locale.ROOT, "Date window match: amount score %.2f, %d days apart (window %d)",
                            amountScore, days, dateWindowDays))
                    .matchedFields(fields)
                    .amountDifference(MatchScoring.amountDifference(transaction, candidate))
                    .build());
        }

        results.sort(MatchScoring.BY_CONFIDENCE_DESC);
        log.debug("Date window matches for transaction {}: {}", transaction.getId(), results.size());
        return results;
    }
}
