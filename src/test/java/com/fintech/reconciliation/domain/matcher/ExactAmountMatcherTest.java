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
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExactAmountMatcherTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 15);

    @Test
    void match_sameAmountSameDay_isCertain() {
        ExactAmountMatcher matcher = new ExactAmountMatcher();

        List<MatchResult> results = matcher.match(
                transaction("1000.00"), List.of(candidate("INV-1", "1000.00", DATE)));

        assertEquals(1, results.size());
        MatchResult result = results.get(0);
        assertEquals(1.0, result.getConfidence().getValue());
        assertEquals(MatchType.EXACT, result.getMatchType());
        assertEquals(Set.of("amount", "date"), result.getMatchedFields());
        assertEquals("Exact amount match: 1000.00 (0 days from due date)", result.getMatchReason());
    }

    @Test
    void match_toleratesOneCentAndSign() {
        ExactAmountMatcher matcher = new ExactAmountMatcher();

        List<MatchResult> results = matcher.match(transaction("-1000.01"), List.of(
                candidate("INV-1", "1000.00", DATE.plusDays(40)),
                candidate("INV-2", "1000.03", DATE)));

        assertEquals(1, results.size());
        assertEquals("INV-1", results.get(0).getCandidateId());
        assertEquals(Set.of("amount"), results.get(0).getMatchedFields());
    }

    @Test
    void match_usesOutstandingAmount() {
        ExactAmountMatcher matcher = new ExactAmountMatcher();
        PaymentCandidate partiallyPaid = PaymentCandidate.builder()
                .id("INV-3")
                .amountDue(new BigDecimal("1500.00"))
                .amountPaid(new BigDecimal("500.00"))
                .dueDate(DATE)
                .build();

        assertEquals(1, matcher.match(transaction("1000.00"), List.of(partiallyPaid)).size());
    }

    @Test
    void match_dateWindowExcludesDistantCandidates() {
        ExactAmountMatcher matcher = new ExactAmountMatcher(5);

        List<MatchResult> results = matcher.match(transaction("1000.00"), List.of(
                candidate("INV-1", "1000.00", DATE.plusDays(6)),
                candidate("INV-2", "1000.00", DATE.minusDays(5))));

        assertEquals(1, results.size());
        assertEquals("INV-2", results.get(0).getCandidateId());
    }

    @Test
    void match_emptyCandidates() {
        assertTrue(new ExactAmountMatcher().match(transaction("10.00"), List.of()).isEmpty());
    }

    @Test
    void constructor_rejectsNegativeWindow() {
        assertThrows(MatchingConfigurationException.class, () -> new ExactAmountMatcher(-1));
    }

    private static BankTransaction transaction(String amount) {
        return BankTransaction.builder()
                .id("TX-1")
                .amount(new BigDecimal(amount))
                .date(DATE)
                .description("BONIFICO")
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
