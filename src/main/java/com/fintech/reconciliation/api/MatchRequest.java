package com.fintech.reconciliation.api;

import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.PaymentCandidate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Request body of {@code POST /api/v1/matches}: one bank transaction and the open
 * payments it may settle.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchRequest {

    @NotNull
    @Valid
    private TransactionPayload transaction;

    @NotNull
    @Builder.Default
    private List<@Valid @NotNull CandidatePayload> candidates = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TransactionPayload {

        @NotBlank
        private String id;

        @NotNull
        private BigDecimal amount;

        @NotNull
        private LocalDate date;

        @NotNull
        private String description;

        private String reference;
        private String counterparty;
        private String counterpartyIban;

        public BankTransaction toDomain() {
            return BankTransaction.builder()
                    .id(id)
                    .amount(amount)
                    .date(date)
                    .description(description)
                    .reference(reference)
                    .counterparty(counterparty)
                    .counterpartyIban(counterpartyIban)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CandidatePayload {

        @NotBlank
        private String id;

        @NotNull
        @PositiveOrZero
        private BigDecimal amountDue;

        @PositiveOrZero
        private BigDecimal amountPaid;

        @NotNull
        private LocalDate dueDate;

        private String iban;
        private String description;
        private String invoiceNumber;
        private String counterpartyName;

        public PaymentCandidate toDomain() {
            return PaymentCandidate.builder()
                    .id(id)
                    .amountDue(amountDue)
                    .amountPaid(amountPaid == null ? BigDecimal.ZERO : amountPaid)
                    .dueDate(dueDate)
                    .iban(iban)
                    .description(description)
                    .invoiceNumber(invoiceNumber)
                    .counterpartyName(counterpartyName)
                    .build();
        }
    }
}
