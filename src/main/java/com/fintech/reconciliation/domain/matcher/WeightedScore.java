package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.model.Confidence;
import lombok.Value;

/**
 * Component scores of one candidate and their weighted combination.
 */
@Value
public class WeightedScore {

    double amountScore;
    double dateScore;
    double descriptionScore;
    Confidence confidence;

    public double minComponent() {
        return Math.min(amountScore, Math.min(dateScore, descriptionScore));
    }

    public double maxComponent() {
        return Math.max(amountScore, Math.max(dateScore, descriptionScore));
    }
}
