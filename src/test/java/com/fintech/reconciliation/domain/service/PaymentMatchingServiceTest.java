package com.fintech.reconciliation.domain.service;

import com.fintech.reconciliation.domain.matcher.CompositeMatcher;
import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.Confidence;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.MatchType;
import com.fintech.reconciliation.domain.model.PaymentCandidate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.MDC;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PaymentMatchingServiceTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 15);

    @Mock private CompositeMatcher compositeMatcher;

    private MeterRegistry meterRegistry;
    private PaymentMatchingService matchingService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        matchingService = new PaymentMatchingService(compositeMatcher, meterRegistry);
    }

    @Test
    void match_success_recordsMetrics() {
        BankTransaction transaction = createTransaction("TX-1");
        PaymentCandidate candidate = createCandidate("INV-1");
        MatchResult result = createResult(transaction, candidate, 0.91);
        when(compositeMatcher.match(transaction, List.of(candidate))).thenReturn(List.of(result));

        List<MatchResult> results = matchingService.match(transaction, List.of(candidate));

        assertEquals(List.of(result), results);
        assertEquals(1.0, meterRegistry.get("payment.matching.processed").tag("result", "matched").counter().count());
        assertEquals(1, meterRegistry.get("payment.matching.latency").timer().count());
        assertEquals(0.91, meterRegistry.get("payment.matching.confidence")
                .tag("match_type", "COMPOSITE").summary().totalAmount(), 1e-9);
        assertNull(MDC.get("transactionId"));
    }

    @Test
    void match_noResults_countsUnmatched() {
        BankTransaction transaction = createTransaction("TX-2");
        when(compositeMatcher.match(eq(transaction), anyList())).thenReturn(Collections.emptyList());

        List<MatchResult> results = matchingService.match(transaction, null);

        assertTrue(results.isEmpty());
        assertEquals(1.0, meterRegistry.get("payment.matching.processed").tag("result", "unmatched").counter().count());
        assertNull(meterRegistry.find("payment.matching.confidence").summary());
    }

    @Test
    void match_unexpectedError_returnsEmptyAndCounts() {
        BankTransaction transaction = createTransaction("TX-3");
        when(compositeMatcher.match(any(), anyList())).thenThrow(new IllegalStateException("pool closed"));

        List<MatchResult> results = matchingService.match(transaction, List.of(createCandidate("INV-1")));

        assertTrue(results.isEmpty());
        assertEquals(1.0, meterRegistry.get("payment.matching.processed").tag("result", "error").counter().count());
    }

    @Test
    void match_runsWithTransactionIdInMdc() {
        BankTransaction transaction = createTransaction("TX-4");
        when(compositeMatcher.match(any(), anyList())).thenAnswer(invocation -> {
            assertEquals("TX-4", MDC.get("transactionId"));
            return Collections.emptyList();
        });

        matchingService.match(transaction, List.of());

        verify(compositeMatcher).match(any(), anyList());
    }

    @Test
    void bestMatch_returnsTopResult() {
        BankTransaction transaction = createTransaction("TX-5");
        PaymentCandidate first = createCandidate("INV-1");
        PaymentCandidate second = createCandidate("INV-2");
        List<MatchResult> ranked = List.of(
                createResult(transaction, first, 0.95), createResult(transaction, second, 0.7));
        when(compositeMatcher.match(eq(transaction), anyList())).thenReturn(ranked);

        Optional<MatchResult> best = matchingService.bestMatch(transaction, List.of(first, second));

        assertTrue(best.isPresent());
        assertEquals("INV-1", best.get().getCandidateId());
    }

    @Test
    void bestMatch_emptyWhenNothingMatches() {
        when(compositeMatcher.match(any(), anyList())).thenReturn(Collections.emptyList());

        assertEquals(Optional.empty(), matchingService.bestMatch(createTransaction("TX-6"), List.of()));
    }

    @Test
    void matchBatch_keyedByTransactionInInputOrder() {
        BankTransaction tx1 = createTransaction("TX-B");
        BankTransaction tx2 = createTransaction("TX-A");
        PaymentCandidate candidate = createCandidate("INV-1");
        MatchResult result = createResult(tx1, candidate, 1.0);
        when(compositeMatcher.match(eq(tx1), anyList())).thenReturn(List.of(result));
        when(compositeMatcher.match(eq(tx2), anyList())).thenReturn(Collections.emptyList());

        Map<String, List<MatchResult>> results = matchingService.matchBatch(List.of(tx1, tx2), List.of(candidate));

        assertEquals(List.of("TX-B", "TX-A"), List.copyOf(results.keySet()));
        assertEquals(List.of(result), results.get("TX-B"));
        assertTrue(results.get("TX-A").isEmpty());
        assertTrue(matchingService.matchBatch(null, List.of(candidate)).isEmpty());
    }

    private BankTransaction createTransaction(String id) {
        return BankTransaction.builder()
                .id(id)
                .amount(new BigDecimal("100.00"))
                .date(DATE)
                .description("BONIFICO MARIO ROSSI")
                .build();
    }

    private PaymentCandidate createCandidate(String id) {
        return PaymentCandidate.builder()
                .id(id)
                .amountDue(new BigDecimal("100.00"))
                .dueDate(DATE)
                .description("Mario Rossi invoice")
                .build();
    }

    private MatchResult createResult(BankTransaction transaction, PaymentCandidate candidate, double confidence) {
        return MatchResult.builder()
                .transaction(transaction)
                .candidate(candidate)
                .confidence(Confidence.of(confidence))
                .matchType(MatchType.COMPOSITE)
                .matchReason("Composite match")
                .build();
    }
}
