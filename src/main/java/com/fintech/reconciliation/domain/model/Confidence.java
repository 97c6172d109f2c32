package com.fintech.reconciliation.domain.model;

import lombok.EqualsAndHashCode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Locale;

/**
 * Calibrated likelihood that a candidate payment is the counterpart of a transaction.
 *
 * Instances only exist inside the closed interval [0.0, 1.0]; the factory rejects
 * anything else, so a {@link MatchResult} can never carry an invalid score.
 */
@EqualsAndHashCode
public final class Confidence implements Comparable<Confidence> {

    public static final Confidence ZERO = new Confidence(0.0);
    public static final Confidence CERTAIN = new Confidence(1.0);

    private static final int SCALE = 4;

    private final double value;

    private Confidence(double value) {
        this.value = value;
    }

    /**
     * Create a confidence score.
     *
     * @throws IllegalArgumentException if value is NaN or outside [0.0, 1.0]
     */
    public static Confidence of(double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got " + value);
        }
        return new Confidence(value);
    }

    /**
     * Create a confidence score from decimal scoring arithmetic, rounded to four places.
     */
    public static Confidence of(BigDecimal value) {
        if (value == null) {
            throw new IllegalArgumentException("Confidence must not be null");
        }
        return of(value.setScale(SCALE, RoundingMode.HALF_UP).doubleValue());
    }

    public double getValue() {
        return value;
    }

    public boolean isAtLeast(double threshold) {
        return value >= threshold;
    }

    @Override
    public int compareTo(Confidence other) {
        return Double.compare(value, other.value);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%.0f%%", value * 100);
    }
}
