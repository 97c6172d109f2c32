package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.PaymentCandidate;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Step functions shared by the matchers.
 *
 * Amount score (difference relative to the candidate's outstanding amount):
 * - within 1 cent → 1.0
 * - within 1% → 0.95
 * - within 5% → 0.85
 * - within 10% → 0.70
 * - otherwise → 0.0
 *
 * Date score (absolute days between transaction and due date):
 * - same day → 1.0
 * - 1 day → 0.95
 * - up to 3 → 0.85
 * - up to 7 → 0.70
 * - up to 14 → 0.50
 * - otherwise → 0.0
 */
public final class MatchScoring {

    public static final BigDecimal ONE_CENT = new BigDecimal("0.01");

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    /** Highest confidence first; {@link List#sort} keeps ties in input order. */
    public static final Comparator<MatchResult> BY_CONFIDENCE_DESC =
            Comparator.comparing(MatchResult::getConfidence).reversed();

    private MatchScoring() {
    }

    public static BigDecimal amountDifference(BankTransaction transaction, PaymentCandidate candidate) {
        return transaction.absoluteAmount().subtract(candidate.outstandingAmount()).abs();
    }

    public static boolean isExactAmount(BankTransaction transaction, PaymentCandidate candidate) {
        return amountDifference(transaction, candidate).compareTo(ONE_CENT) <= 0;
    }

    /**
     * Difference as a percentage of the candidate's outstanding amount, or null when
     * nothing is outstanding.
     */
    public static BigDecimal amountDifferencePercent(BankTransaction transaction, PaymentCandidate candidate) {
        BigDecimal outstanding = candidate.outstandingAmount();
        if (outstanding.signum() == 0) {
            return null;
        }
        return amountDifference(transaction, candidate)
                .multiply(HUNDRED)
                .divide(outstanding, MathContext.DECIMAL64);
    }

    public static double amountScore(BankTransaction transaction, PaymentCandidate candidate) {
        BigDecimal pct = amountDifferencePercent(transaction, candidate);
        if (pct == null) {
            return 0.0;
        }
        if (isExactAmount(transaction, candidate)) {
            return 1.0;
        }
        if (pct.compareTo(BigDecimal.ONE) <= 0) {
            return 0.95;
        }
        if (pct.compareTo(BigDecimal.valueOf(5)) <= 0) {
            return 0.85;
        }
        if (pct.compareTo(BigDecimal.TEN) <= 0) {
            return 0.70;
        }
        return 0.0;
    }

    public static long daysBetween(LocalDate transactionDate, LocalDate dueDate) {
        return Math.abs(ChronoUnit.DAYS.between(transactionDate, dueDate));
    }

    public static double dateScore(LocalDate transactionDate, LocalDate dueDate) {
        long days = daysBetween(transactionDate, dueDate);
        if (days == 0) {
            return 1.0;
        }
        if (days <= 1) {
            return 0.95;
        }
        if (days <= 3) {
            return 0.85;
        }
        if (days <= 7) {
            return 0.70;
        }
        if (days <= 14) {
            return 0.50;
        }
        return 0.0;
    }

    /**
     * Description component of the composite score, from a 0-100 similarity.
     */
    public static double descriptionScore(double similarity) {
        if (similarity >= 95) {
            return 1.0;
        }
        if (similarity >= 85) {
            return 0.85;
        }
        if (similarity >= 75) {
            return 0.70;
        }
        if (similarity >= 60) {
            return 0.50;
        }
        return 0.0;
    }

    /**
     * Fuzzy matcher confidence from a 0-100 similarity, floored at 0.70.
     */
    public static double similarityToConfidence(double similarity) {
        if (similarity >= 95) {
            return 0.95;
        }
        if (similarity >= 90) {
            return 0.90;
        }
        if (similarity >= 85) {
            return 0.85;
        }
        if (similarity >= 80) {
            return 0.80;
        }
        if (similarity >= 75) {
            return 0.75;
        }
        return 0.70;
    }

    public static boolean withinDays(LocalDate transactionDate, LocalDate dueDate, Integer windowDays) {
        return windowDays == null || daysBetween(transactionDate, dueDate) <= windowDays;
    }
}
