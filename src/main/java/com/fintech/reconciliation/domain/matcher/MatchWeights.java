package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.exception.MatchingConfigurationException;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Weights of the amount, date and description components of the composite score.
 *
 * Each weight is in [0, 1] and the three sum to exactly 1.0, which keeps the weighted
 * score between the smallest and largest component.
 */
@Value
public class MatchWeights {

    public static final MatchWeights DEFAULT = of(0.4, 0.3, 0.3);

    BigDecimal amount;
    BigDecimal date;
    BigDecimal description;

    /**
     * @throws MatchingConfigurationException if a weight is out of range or the sum is not 1.0
     */
    public static MatchWeights of(double amount, double date, double description) {
        BigDecimal a = toWeight("amount", amount);
        BigDecimal d = toWeight("date", date);
        BigDecimal s = toWeight("description", description);

        BigDecimal sum = a.add(d).add(s);
        if (sum.compareTo(BigDecimal.ONE) != 0) {
            throw new MatchingConfigurationException("Weights must sum to 1.0, got " + sum.toPlainString());
        }
        return new MatchWeights(a, d, s);
    }

    private static BigDecimal toWeight(String name, double value) {
        if (Double.isNaN(value) || Double.isInfinite(value) || value < 0.0 || value > 1.0) {
            throw new MatchingConfigurationException(name + " weight must be between 0.0 and 1.0, got " + value);
        }
        return BigDecimal.valueOf(value);
    }

    /**
     * {@code amount * wa + date * wd + description * ws}
     */
    public BigDecimal combine(double amountScore, double dateScore, double descriptionScore) {
        return BigDecimal.valueOf(amountScore).multiply(amount)
                .add(BigDecimal.valueOf(dateScore).multiply(date))
                .add(BigDecimal.valueOf(descriptionScore).multiply(description));
    }
}
