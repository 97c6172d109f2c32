package com.fintech.reconciliation.domain.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Bank statement line to be reconciled.
 *
 * Populated by the statement importers or manual entry. Read-only for the
 * duration of matching.
 */
@Value
@Builder
public class BankTransaction {

    @NonNull String id;

    /** Signed amount: positive = incoming, negative = outgoing. */
    @NonNull BigDecimal amount;

    @NonNull LocalDate date;

    @NonNull String description;

    String reference;

    String counterparty;

    String counterpartyIban;

    public BigDecimal absoluteAmount() {
        return amount.abs();
    }

    public boolean isIncoming() {
        return amount.signum() > 0;
    }

    public boolean isOutgoing() {
        return amount.signum() < 0;
    }
}
