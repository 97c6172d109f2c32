package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.exception.MatchingConfigurationException;
import com.fintech.reconciliation.domain.iban.IbanFormatRegistry;
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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches a candidate's IBAN against the IBANs found in the transaction.
 *
 * IBANs are extracted from the description and reference with the registry's combined
 * pattern, plus the structured counterparty IBAN, then normalized and length-checked.
 * European statements often carry the beneficiary IBAN in the memo field.
 *
 * Confidence:
 * - full IBAN found → 0.90
 * - only the last four digits found as a separate number → 0.75 (if enabled)
 * - +0.05 exact amount, or +0.02 within the amount tolerance
 * - +0.05 same day, or +0.02 within three days
 * - never above 0.95
 */
@Slf4j
@Getter
@ToString
public class IbanMatcher implements MatcherStrategy {

    public static final int DEFAULT_WINDOW_DAYS = 30;
    public static final double DEFAULT_AMOUNT_TOLERANCE_PCT = 5.0;

    static final BigDecimal FULL_MATCH_BASE = new BigDecimal("0.90");
    static final BigDecimal PARTIAL_MATCH_BASE = new BigDecimal("0.75");
    static final BigDecimal CEILING = new BigDecimal("0.95");

    private static final BigDecimal STRONG_BOOST = new BigDecimal("0.05");
    private static final BigDecimal WEAK_BOOST = new BigDecimal("0.02");
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int CLOSE_DATE_DAYS = 3;

    private final int dateWindowDays;
    private final double amountTolerancePct;
    private final boolean partialMatchEnabled;

    public IbanMatcher() {
        this(DEFAULT_WINDOW_DAYS, DEFAULT_AMOUNT_TOLERANCE_PCT, true);
    }

    public IbanMatcher(int dateWindowDays, double amountTolerancePct, boolean partialMatchEnabled) {
        if (dateWindowDays < 0) {
            throw new MatchingConfigurationException("dateWindowDays must be >= 0, got " + dateWindowDays);
        }
        if (Double.isNaN(amountTolerancePct) || amountTolerancePct < 0 || amountTolerancePct > 100) {
            throw new MatchingConfigurationException(
                    "amountTolerancePct must be between 0 and 100, got " + amountTolerancePct);
        }
        this.dateWindowDays = dateWindowDays;
        this.amountTolerancePct = amountTolerancePct;
        this.partialMatchEnabled = partialMatchEnabled;
    }

    @Override
    public List<MatchResult> match(BankTransaction transaction, List<PaymentCandidate> candidates) {
        List<MatchResult> results = new ArrayList<>();

        Set<String> transactionIbans = extractIbans(transaction);
        String transactionText = partialMatchEnabled ? collectText(transaction) : "";

        for (PaymentCandidate candidate : candidates) {
            String candidateIban = IbanFormatRegistry.normalize(candidate.getIban());
            if (candidateIban.isEmpty() || !IbanFormatRegistry.validateLength(candidateIban)) {
                continue;
            }

            boolean fullMatch = transactionIbans.contains(candidateIban);
            boolean partialMatch = !fullMatch && partialMatchEnabled
                    && containsLastFourDigits(transactionText, candidateIban);
            if (!fullMatch && !partialMatch) {
                continue;
            }

            if (!MatchScoring.withinDays(transaction.getDate(), candidate.getDueDate(), dateWindowDays)) {
                continue;
            }

            BigDecimal confidence = confidence(transaction, candidate,
                    fullMatch ? FULL_MATCH_BASE : PARTIAL_MATCH_BASE);

            List<String> fields = new ArrayList<>(2);
            fields.add("iban");
            if (partialMatch) {
                fields.add("iban_last4");
            }

            results.add(MatchResult.builder()
                    .transaction(transaction)
                    .candidate(candidate)
                    .confidence(Confidence.of(confidence))
                    .matchType(MatchType.IBAN)
                    .matchReason(reason(transaction, candidate, candidateIban, partialMatch))
                    .matchedFields(fields)
                    .amountDifference(MatchScoring.amountDifference(transaction, candidate))
                    .build());
        }

        results.sort(MatchScoring.BY_CONFIDENCE_DESC);
        log.debug("IBAN matches for transaction {}: {} (extracted {} IBANs)",
                transaction.getId(), results.size(), transactionIbans.size());
        return results;
    }

    /**
     * Normalized, length-valid IBANs mentioned by the transaction.
     */
    Set<String> extractIbans(BankTransaction transaction) {
        Set<String> found = new LinkedHashSet<>();
        collect(transaction.getDescription(), found);
        collect(transaction.getReference(), found);

        String counterpartyIban = IbanFormatRegistry.normalize(transaction.getCounterpartyIban());
        if (!counterpartyIban.isEmpty()) {
            found.add(counterpartyIban);
        }

        found.removeIf(iban -> !IbanFormatRegistry.validateLength(iban));
        return found;
    }

    private static void collect(String text, Set<String> found) {
        if (text == null || text.isEmpty()) {
            return;
        }
        Matcher matcher = IbanFormatRegistry.IBAN_PATTERN.matcher(text);
        while (matcher.find()) {
            found.add(IbanFormatRegistry.normalize(matcher.group()));
        }
    }

    private static String collectText(BankTransaction transaction) {
        StringBuilder text = new StringBuilder(transaction.getDescription());
        if (transaction.getReference() != null) {
            text.append(' ').append(transaction.getReference());
        }
        return text.toString().toUpperCase(Locale.ROOT);
    }

    private static boolean containsLastFourDigits(String text, String iban) {
        if (text.isEmpty()) {
            return false;
        }
        String tail = iban.substring(iban.length() - 4);
        if (!tail.chars().allMatch(Character::isDigit)) {
            return false;
        }
        return Pattern.compile("(?<!\\d)" + tail + "(?!\\d)").matcher(text).find();
    }

    private BigDecimal confidence(BankTransaction transaction, PaymentCandidate candidate, BigDecimal base) {
        BigDecimal confidence = base;

        BigDecimal difference = MatchScoring.amountDifference(transaction, candidate);
        BigDecimal tolerance = candidate.outstandingAmount()
                .multiply(BigDecimal.valueOf(amountTolerancePct))
                .divide(HUNDRED);
        if (difference.compareTo(MatchScoring.ONE_CENT) <= 0) {
            confidence = confidence.add(STRONG_BOOST);
        } else if (difference.compareTo(tolerance) <= 0) {
            confidence = confidence.add(WEAK_BOOST);
        }

        long days = MatchScoring.daysBetween(transaction.getDate(), candidate.getDueDate());
        if (days == 0) {
            confidence = confidence.add(STRONG_BOOST);
        } else if (days <= CLOSE_DATE_DAYS) {
            confidence = confidence.add(WEAK_BOOST);
        }

        return confidence.min(CEILING);
    }

    private static String reason(BankTransaction transaction, PaymentCandidate candidate,
                                 String iban, boolean partial) {
        String country = IbanFormatRegistry.countryName(iban).orElse("Unknown");

        StringBuilder reason = new StringBuilder();
        if (partial) {
            reason.append("IBAN partial match (").append(country).append("): last 4 digits ")
                    .append(iban.substring(iban.length() - 4)).append(" detected in transaction");
        } else {
            reason.append("IBAN match (").append(country).append("): ")
                    .append(IbanFormatRegistry.mask(iban)).append(" found in transaction");
        }

        BigDecimal difference = MatchScoring.amountDifference(transaction, candidate);
        if (difference.compareTo(MatchScoring.ONE_CENT) <= 0) {
            reason.append(", exact amount");
        } else {
            reason.append(", amount diff ").append(difference.toPlainString());
        }

        long days = MatchScoring.daysBetween(transaction.getDate(), candidate.getDueDate());
        if (days == 0) {
            reason.append(", same date");
        } else {
            reason.append(", ").append(days).append(" days apart");
        }
        return reason.toString();
    }
}
