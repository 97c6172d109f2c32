package com.fintech.reconciliation.api;

import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.MatchType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON view of one ranked match.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchView {

    private String candidateId;
    private double confidence;
    private MatchType matchType;
    private String matchReason;
    private List<String> matchedFields;
    private BigDecimal amountDifference;

    public static MatchView from(MatchResult result) {
        return MatchView.builder()
                .candidateId(result.getCandidateId())
                .confidence(result.getConfidence().getValue())
                .matchType(result.getMatchType())
                .matchReason(result.getMatchReason())
                .matchedFields(new ArrayList<>(result.getMatchedFields()))
                .amountDifference(result.getAmountDifference())
                .build();
    }
}
