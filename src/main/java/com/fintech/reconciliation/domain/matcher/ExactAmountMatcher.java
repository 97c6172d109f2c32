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
 * Proposes every candidate whose outstanding amount equals the transaction's
 * absolute amount within one cent, with confidence 1.0.
 *
 * An optional date window (days either side of the transaction date) excludes
 * candidates before the amount is compared; null means unrestricted.
 */
@Slf4j
@Getter
@ToString
public class ExactAmountMatcher implements MatcherStrategy {

    private final Integer dateWindowDays;

    public ExactAmountMatcher() {
        this(null);
    }

    public ExactAmountMatcher(Integer dateWindowDays) {
        if (dateWindowDays != null && dateWindowDays < 0) {
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
            if (!MatchScoring.isExactAmount(transaction, candidate)) {
                continue;
            }

            List<String> fields = new ArrayList<>(2);
            fields.add("amount");
            long days = MatchScoring.daysBetween(transaction.getDate(), candidate.getDueDate());
            if (days == 0) {
                fields.add("date");
            }

            BigDecimal outstanding = candidate.outstandingAmount();
            results.add(MatchResult.builder()
                    .transaction(transaction)
                    .candidate(candidate)
                    .confidence(Confidence.CERTAIN)
                    .matchType(MatchType.EXACT)
                    .matchReason(String.format(Locale.ROOT, "Exact amount match: %s (%d days from due date)",
                            outstanding.toPlainString(), days))
                    .matchedFields(fields)
                    .amountDifference(MatchScoring.amountDifference(transaction, candidate))
                    .build());
        }

        log.debug("Exact amount matches for transaction {}: {}", transaction.getId(), results.size());
        return results;
    }
}
