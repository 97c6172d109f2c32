package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.PaymentCandidate;

import java.util.List;

/**
 * Algorithm that proposes candidate payments for a bank transaction.
 *
 * Implementations:
 * - must not modify the transaction, the candidates or the supplied list
 * - must hold no mutable state shared between calls (they run concurrently)
 * - return results sorted by confidence, highest first, or an empty list
 */
public interface MatcherStrategy {

    List<MatchResult> match(BankTransaction transaction, List<PaymentCandidate> candidates);

    /**
     * Name used in logs when this strategy fails or contributes a match.
     */
    default String name() {
        return getClass().getSimpleName();
    }
}
