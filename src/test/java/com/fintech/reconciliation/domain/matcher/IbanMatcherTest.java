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

class IbanMatcherTest {

    private static final LocalDate DATE = LocalDate.of(2025, 1, 15);
    private static final String IT_IBAN = "IT60X0542811101000000123456";
    private static final String DE_IBAN = "DE89370400440532013000";

    @Test
    void match_fullIbanInDescription_cappedConfidence() {
        IbanMatcher matcher = new IbanMatcher();
        BankTransaction transaction = transaction("1200.00", "Bonifico da " + IT_IBAN, null);

        List<MatchResult> results = matcher.match(transaction, List.of(
                candidate("INV-1", "1200.00", "IT60 X054 2811 1010 0000 0123 456", DATE)));

        assertEquals(1, results.size());
        MatchResult result = results.get(0);
        assertEquals(MatchType.IBAN, result.getMatchType());
        assertEquals(0.95, result.getConfidence().getValue());
        assertEquals(Set.of("iban"), result.getMatchedFields());
        assertEquals("IBAN match (Italy): IT60X0...3456 found in transaction, exact amount, same date",
                result.getMatchReason());
    }

    @Test
    void match_structuredCounterpartyIban_withSmallBoosts() {
        IbanMatcher matcher = new IbanMatcher();
        BankTransaction transaction = BankTransaction.builder()
                .id("TX-2")
                .amount(new BigDecimal("1210.00"))
                .date(DATE)
                .description("SEPA CREDIT TRANSFER")
                .counterpartyIban("DE89 3704 0044 0532 0130 00")
                .build();

        List<MatchResult> results = matcher.match(transaction, List.of(
                candidate("INV-2", "1200.00", DE_IBAN, DATE.plusDays(5))));

        assertEquals(1, results.size());
        assertEquals(0.92, results.get(0).getConfidence().getValue(), 1e-9);
        assertEquals("IBAN match (Germany): DE8937...3000 found in transaction, amount diff 10.00, 5 days apart",
                results.get(0).getMatchReason());
    }

    @Test
    void match_lastFourDigits_isPartialMatch() {
        IbanMatcher matcher = new IbanMatcher();
        BankTransaction transaction = transaction("1200.00", "Bonifico conto 3456 fattura 7", null);

        List<MatchResult> results = matcher.match(transaction, List.of(
                candidate("INV-1", "1200.00", IT_IBAN, DATE.plusDays(2))));

        assertEquals(1, results.size());
        assertEquals(0.82, results.get(0).getConfidence().getValue(), 1e-9);
        assertEquals(List.of("iban", "iban_last4"), List.copyOf(results.get(0).getMatchedFields()));
        assertTrue(results.get(0).getMatchReason().startsWith("IBAN partial match (Italy): last 4 digits 3456"));
    }

    @Test
    void match_lastFourDigitsInsideLongerNumber_isIgnored() {
        IbanMatcher matcher = new IbanMatcher();

        assertTrue(matcher.match(transaction("1200.00", "Ordine 123456", null),
                List.of(candidate("INV-1", "1200.00", IT_IBAN, DATE))).isEmpty());
    }

    @Test
    void match_partialDisabled() {
        IbanMatcher matcher = new IbanMatcher(30, 5.0, false);

        assertTrue(matcher.match(transaction("1200.00", "Bonifico conto 3456", null),
                List.of(candidate("INV-1", "1200.00", IT_IBAN, DATE))).isEmpty());
    }

    @Test
    void match_skipsMissingOrMalformedCandidateIban() {
        IbanMatcher matcher = new IbanMatcher();
        BankTransaction transaction = transaction("1200.00", "Bonifico da " + IT_IBAN, null);

        List<MatchResult> results = matcher.match(transaction, List.of(
                candidate("NO_IBAN", "1200.00", null, DATE),
                candidate("SHORT", "1200.00", "IT60X05428", DATE),
                candidate("UNKNOWN", "1200.00", "GB29NWBK60161331926819", DATE)));

        assertTrue(results.isEmpty());
    }

    @Test
    void match_outsideDateWindow() {
        IbanMatcher matcher = new IbanMatcher();

        assertTrue(matcher.match(transaction("1200.00", "Bonifico da " + IT_IBAN, null),
                List.of(candidate("INV-1", "1200.00", IT_IBAN, DATE.minusDays(31)))).isEmpty());
    }

    @Test
    void extractIbans_fromDescriptionReferenceAndCounterparty() {
        IbanMatcher matcher = new IbanMatcher();
        BankTransaction transaction = BankTransaction.builder()
                .id("TX-3")
                .amount(new BigDecimal("10.00"))
                .date(DATE)
                .description("Da " + IT_IBAN.toLowerCase())
                .reference("Rif " + DE_IBAN)
                .counterpartyIban("DE8937040044")
                .build();

        assertEquals(Set.of(IT_IBAN, DE_IBAN), matcher.extractIbans(transaction));
    }

    @Test
    void constructor_validatesSettings() {
        assertThrows(MatchingConfigurationException.class, () -> new IbanMatcher(-1, 5.0, true));
        assertThrows(MatchingConfigurationException.class, () -> new IbanMatcher(30, 150.0, true));
    }

    private static BankTransaction transaction(String amount, String description, String reference) {
        return BankTransaction.builder()
                .id("TX-1")
                .amount(new BigDecimal(amount))
                .date(DATE)
                .description(description)
                .reference(reference)
                .build();
    }

    private static PaymentCandidate candidate(String id, String amountDue, String iban, LocalDate dueDate) {
        return PaymentCandidate.builder()
                .id(id)
                .amountDue(new BigDecimal(amountDue))
                .dueDate(dueDate)
                .iban(iban)
                .build();
    }
}
