package com.fintech.reconciliation.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Outstanding payment that a bank transaction may settle.
 *
 * The {@code id} is the candidate's identity: results from different strategies
 * that reference the same id are the same candidate.
 */
@Value
@Builder
public class PaymentCandidate {

    @NonNull String id;

    @NonNull BigDecimal amountDue;

    /** Partial payments already received against this candidate. */
    @Builder.Default
    BigDecimal amountPaid = BigDecimal.ZERO;

    @NonNull LocalDate dueDate;

    String iban;

    /** Invoice description used for text matching. */
    String description;

    String invoiceNumber;

    String counterpartyName;

    /**
     * Residual amount still to be collected, never negative.
     */
    public BigDecimal outstandingAmount() {
        BigDecimal paid = amountPaid == null ? BigDecimal.ZERO : amountPaid;
        BigDecimal outstanding = amountDue.subtract(paid);
        return outstanding.signum() < 0 ? BigDecimal.ZERO : outstanding;
    }

    /**
     * Non-blank free-text fields a transaction's text may be compared against.
     */
    public List<String> searchableTexts() {
        List<String> texts = new ArrayList<>(3);
        for (String text : new String[]{description, invoiceNumber, counterpartyName}) {
            if (text != null && !text.isBlank()) {
                texts.add(text);
            }
        }
        return texts;
    }
}
