package com.fintech.reconciliation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Payment Reconciliation Matcher
 *
 * Ranks open payments against incoming bank statement lines.
 *
 * Architecture:
 * - Pluggable matcher strategies (exact amount, date window, fuzzy text, IBAN)
 * - Composite matcher running the strategies concurrently
 * - Weighted amount/date/description scoring
 * - REST adapter and Micrometer metrics
 */
@SpringBootApplication
public class PaymentMatchingApplication {

    public static void main(String[] args) {
        SpringApplication.run(PaymentMatchingApplication.class, args);
    }
}
