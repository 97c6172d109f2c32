package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.exception.MatchingConfigurationException;
import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.MatchType;
import com.fintech.reconciliation.domain.model.PaymentCandidate;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class DateWindowMatcherTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 15);

    @Test
    void match_scoresAmountAndDateProximity() {
        DateWindowMatcher matcher = new DateWindowMatcher();

        List<MatchResult> results = matcher.match(transaction("99.00"), List.of(
                candidate("NEAR", "100.00", DATE.plusDays(2)),
                candidate("EXACT", "99.00", DATE)));

        assertEquals(List.of("EXACT", "NEAR"),
                results.stream().map(MatchResult::getCandidateId).collect(Collectors.toList()));
        assertEquals(0.80, results.get(0).getConfidence().getValue(), 1e-9);
        assertEquals(0.7615, results.get(1).getConfidence().getValue(), 1e-9);
        assertEquals(MatchType.DATE_WINDOW, results.get(1).getMatchType());
        assertEquals(
                "Date window match: amount score 0.95, 2 days apart (window 7)",
                results.get(1).getMatchReason());
    }

    @Test
    void match_excludesOutsideWindowOrAmountTolerance() {
        DateWindowMatcher matcher = new DateWindowMatcher(7);

        List<MatchResult> results = matcher.match(transaction("100.00"), List.of(
                candidate("LATE", "100.00", DATE.plusDays(8)),
                candidate("FAR_AMOUNT", "150.00", DATE)));

        assertTrue(results.isEmpty());
    }

    @Test
    void match_confidenceStaysInBand() {
        DateWindowMatcher matcher = new DateWindowMatcher(14);

        List<MatchResult> results = matcher.match(transaction("100.00"), List.of(
                candidate("A", "109.00", DATE.plusDays(14)),
                candidate("B", "100.00", DATE)));

        for (MatchResult result : results) {
            assertTrue(result.getConfidence().getValue() >= 0.60);
            assertTrue(result.getConfidence().getValue() <= 0.80);
        }
        assertEquals(2, results.size());
    }

    @Test
    void constructor_rejectsNegativeWindow() {
        assertThrows(MatchingConfigurationException.class, () -> new DateWindowMatcher(-3));
    }

    private static BankTransaction transaction(String amount) {
        return BankTransaction.builder()
                .id("TX-1")
                .amount(new BigDecimal(amount))
                .date(DATE)
                .description("SEPA CREDIT")
                .build();
    }

    private static PaymentCandidate candidate(String id, String amountDue, LocalDate dueDate) {
        return PaymentCandidate.builder()
                .id(id)
                .amountDue(new BigDecimal(amountDue))
                .dueDate(dueDate)
                .build();
    }
}
