package com.fintech.reconciliation.domain.service;

import com.fintech.reconciliation.domain.matcher.CompositeMatcher;
import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.PaymentCandidate;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for reconciling bank transactions against open payments.
 *
 * Flow:
 * 1. Tag the MDC with the transaction id
 * 2. Run the composite matcher over the candidates
 * 3. Record latency, outcome and confidence metrics
 * 4. Return the ranked results
 *
 * Failure Handling:
 * - Failing strategies are isolated inside the composite matcher
 * - Any other error is logged and counted; the transaction gets no results
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PaymentMatchingService {

    static final String MDC_TRANSACTION_ID = "transactionId";

    private static final double[] CONFIDENCE_BUCKETS =
            {0.0, 0.5, 0.6, 0.7, 0.75, 0.8, 0.85, 0.9, 0.95, 1.0};

    private final CompositeMatcher compositeMatcher;
    private final MeterRegistry meterRegistry;

    /**
     * Ranked matches for one transaction, best first. Never null.
     */
    public List<MatchResult> match(BankTransaction transaction, List<PaymentCandidate> candidates) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String previousId = MDC.get(MDC_TRANSACTION_ID);
        MDC.put(MDC_TRANSACTION_ID, transaction.getId());

        try {
            List<MatchResult> results = compositeMatcher.match(
                    transaction, candidates == null ? Collections.emptyList() : candidates);

            String outcome = results.isEmpty() ? "unmatched" : "matched";
            sample.stop(Timer.builder("payment.matching.latency")
                    .tag("result", outcome)
                    .register(meterRegistry));

            Counter.builder("payment.matching.processed")
                    .tag("result", outcome)
                    .register(meterRegistry)
                    .increment();

            if (results.isEmpty()) {
                log.info("No match for transaction {} (amount: {}, candidates: {})",
                        transaction.getId(), transaction.getAmount(), sizeOf(candidates));
            } else {
                MatchResult best = results.get(0);
                recordConfidence(best);
                log.info("Transaction {} matched to payment {} ({} {}, {} alternatives)",
                        transaction.getId(), best.getCandidateId(), best.getMatchType(),
                        best.getConfidence(), results.size() - 1);
            }
            return results;

        } catch (RuntimeException e) {
            log.error("Error matching transaction {}: {}", transaction.getId(), e.getMessage(), e);

            Counter.builder("payment.matching.processed")
                    .tag("result", "error")
                    .register(meterRegistry)
                    .increment();

            return Collections.emptyList();
        } finally {
            if (previousId != null) {
                MDC.put(MDC_TRANSACTION_ID, previousId);
            } else {
                MDC.remove(MDC_TRANSACTION_ID);
            }
        }
    }

    /**
     * Highest-ranked match, if any.
     */
    public Optional<MatchResult> bestMatch(BankTransaction transaction, List<PaymentCandidate> candidates) {
        List<MatchResult> results = match(transaction, candidates);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    /**
     * Matches every transaction against the same candidate pool.
     *
     * @return results keyed by transaction id, in input order
     */
    public Map<String, List<MatchResult>> matchBatch(List<BankTransaction> transactions,
                                                    List<PaymentCandidate> candidates) {
        Map<String, List<MatchResult>> results = new LinkedHashMap<>();
        if (transactions == null) {
            return results;
        }
        for (BankTransaction transaction : transactions) {
            results.put(transaction.getId(), match(transaction, candidates));
        }
        log.info("Batch matching completed: {} transactions, {} matched",
                results.size(), results.values().stream().filter(r -> !r.isEmpty()).count());
        return results;
    }

    private void recordConfidence(MatchResult result) {
        DistributionSummary.builder("payment.matching.confidence")
                .tag("match_type", result.getMatchType().name())
                .serviceLevelObjectives(CONFIDENCE_BUCKETS)
                .register(meterRegistry)
                .record(result.getConfidence().getValue());
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
