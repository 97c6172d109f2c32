package com.fintech.reconciliation.domain.exception;

/**
 * Raised when a matcher or the composite orchestrator is built with invalid settings
 * (weights not summing to 1.0, thresholds out of range, negative windows).
 *
 * Always thrown at construction time, never while matching.
 */
public class MatchingConfigurationException extends IllegalArgumentException {

    public MatchingConfigurationException(String message) {
        super(message);
    }
}
