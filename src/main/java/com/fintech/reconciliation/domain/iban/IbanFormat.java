package com.fintech.reconciliation.domain.iban;

import lombok.Value;

/**
 * IBAN layout of a single country, as published in the SWIFT IBAN registry.
 */
@Value
public class IbanFormat {

    /** ISO 3166-1 alpha-2 code, e.g. "IT". */
    String countryCode;

    String countryName;

    /** Total length including country code and check digits. */
    int length;

    /** Structure after the country code, as a regular expression. */
    String pattern;

    String example;

    public String fullPattern() {
        return countryCode + pattern;
    }
}
