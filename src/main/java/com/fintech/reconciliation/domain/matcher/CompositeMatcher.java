package com.fintech.reconciliation.domain.matcher;

import com.fintech.reconciliation.domain.exception.MatchingConfigurationException;
import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.Confidence;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.MatchType;
import com.fintech.reconciliation.domain.model.PaymentCandidate;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Metrics;
import io.micrometer.core.instrument.Timer;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs every configured strategy concurrently and merges their proposals into one
 * ranked list.
 *
 * Flow:
 * 1. Keep candidates whose due date is within {@code dateToleranceDays}
 * 2. Dispatch each strategy on the executor with the same inputs
 * 3. Wait for all of them; a failing strategy is logged and contributes nothing
 * 4. Merge according to {@link MergeMode}:
 *    - WEIGHTED: every candidate in the window is scored directly,
 *      confidence = amount * wa + date * wd + description * ws;
 *      the strategies' proposals only feed the match reason
 *    - STRATEGY_DEDUP: highest strategy confidence per candidate
 * 5. Drop results below {@code minConfidence}
 * 6. Sort by confidence descending; ties keep the order candidates were supplied in
 *
 * The merge walks strategies and candidates in their configured order, never in
 * completion order, so the ranking is deterministic.
 *
 * Description score (best similarity of transaction text to candidate text):
 * - 95+ → 1.0
 * - 85+ → 0.85
 * - 75+ → 0.70
 * - 60+ → 0.50
 * - below → 0.0
 *
 * Each strategy run is timed as {@code payment.matching.strategy.latency}, tagged with
 * the strategy name and its outcome.
 */
@Slf4j
@Getter
@ToString
public class CompositeMatcher implements MatcherStrategy {

    public static final double DEFAULT_MIN_CONFIDENCE = 0.6;
    public static final int DEFAULT_DATE_TOLERANCE_DAYS = 30;

    private static final double FIELD_THRESHOLD = 0.85;

    private final List<MatcherStrategy> strategies;
    private final MatchWeights weights;
    private final double minConfidence;
    private final int dateToleranceDays;
    private final MergeMode mergeMode;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final Executor executor;

    @Getter(AccessLevel.NONE)
    @ToString.Exclude
    private final MeterRegistry meterRegistry;

    @Builder
    private CompositeMatcher(List<MatcherStrategy> strategies,
                             MatchWeights weights,
                             Double minConfidence,
                             Integer dateToleranceDays,
                             MergeMode mergeMode,
                             Executor executor,
                             MeterRegistry meterRegistry) {
        if (executor == null) {
            throw new MatchingConfigurationException("executor is required");
        }
        double min = minConfidence == null ? DEFAULT_MIN_CONFIDENCE : minConfidence;
        if (Double.isNaN(min) || min < 0.0 || min > 1.0) {
            throw new MatchingConfigurationException("minConfidence must be between 0.0 and 1.0, got " + min);
        }
        int tolerance = dateToleranceDays == null ? DEFAULT_DATE_TOLERANCE_DAYS : dateToleranceDays;
        if (tolerance < 0) {
            throw new MatchingConfigurationException("dateToleranceDays must be >= 0, got " + tolerance);
        }
        if (strategies != null) {
            for (MatcherStrategy strategy : strategies) {
                if (strategy == null) {
                    throw new MatchingConfigurationException("strategies must not contain null");
                }
            }
        }

        this.strategies = strategies == null ? Collections.emptyList() : List.copyOf(strategies);
        this.weights = weights == null ? MatchWeights.DEFAULT : weights;
        this.minConfidence = min;
        this.dateToleranceDays = tolerance;
        this.mergeMode = mergeMode == null ? MergeMode.WEIGHTED : mergeMode;
        this.executor = executor;
        this.meterRegistry = meterRegistry == null ? Metrics.globalRegistry : meterRegistry;
    }

    @Override
    public List<MatchResult> match(BankTransaction transaction, List<PaymentCandidate> candidates) {
        if (candidates == null || candidates.isEmpty() || strategies.isEmpty()) {
            return Collections.emptyList();
        }

        List<PaymentCandidate> inWindow = new ArrayList<>();
        for (PaymentCandidate candidate : candidates) {
            if (MatchScoring.withinDays(transaction.getDate(), candidate.getDueDate(), dateToleranceDays)) {
                inWindow.add(candidate);
            }
        }
        if (inWindow.isEmpty()) {
            return Collections.emptyList();
        }
        List<PaymentCandidate> shared = Collections.unmodifiableList(inWindow);

        List<CompletableFuture<List<MatchResult>>> futures = new ArrayList<>(strategies.size());
        for (MatcherStrategy strategy : strategies) {
            futures.add(dispatch(strategy, transaction, shared));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<List<MatchResult>> perStrategy = new ArrayList<>(futures.size());
        for (CompletableFuture<List<MatchResult>> future : futures) {
            perStrategy.add(future.join());
        }

        List<MatchResult> merged = mergeMode == MergeMode.WEIGHTED
                ? mergeWeighted(transaction, shared, perStrategy)
                : mergeDedup(shared, perStrategy);

        merged.sort(MatchScoring.BY_CONFIDENCE_DESC);

        log.debug("Composite matching for transaction {}: {} candidates in window, {} results ({})",
                transaction.getId(), shared.size(), merged.size(), mergeMode);
        return merged;
    }

    private CompletableFuture<List<MatchResult>> dispatch(MatcherStrategy strategy,
                                                          BankTransaction transaction,
                                                          List<PaymentCandidate> candidates) {
        try {
            return CompletableFuture
                    .supplyAsync(() -> timedMatch(strategy, transaction, candidates), executor)
                    .handle((results, ex) -> {
                        if (ex != null) {
                            Throwable cause = ex instanceof CompletionException && ex.getCause() != null
                                    ? ex.getCause()
                                    : ex;
                            log.warn("Matcher strategy {} failed for transaction {}: {}",
                                    strategy.name(), transaction.getId(), cause.getMessage(), cause);
                            return Collections.<MatchResult>emptyList();
                        }
                        return results == null ? Collections.<MatchResult>emptyList() : results;
                    });
        } catch (RejectedExecutionException e) {
            log.warn("Matcher strategy {} rejected by executor for transaction {}: {}",
                    strategy.name(), transaction.getId(), e.getMessage());
            return CompletableFuture.completedFuture(Collections.emptyList());
        }
    }

    private List<MatchResult> timedMatch(MatcherStrategy strategy,
                                         BankTransaction transaction,
                                         List<PaymentCandidate> candidates) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "error";
        try {
            List<MatchResult> results = strategy.match(transaction, candidates);
            outcome = "success";
            return results;
        } finally {
            sample.stop(Timer.builder("payment.matching.strategy.latency")
                    .tag("strategy", strategy.name())
                    .tag("result", outcome)
                    .register(meterRegistry));
        }
    }

    private List<MatchResult> mergeWeighted(BankTransaction transaction,
                                            List<PaymentCandidate> candidates,
                                            List<List<MatchResult>> perStrategy) {
        Map<String, Set<String>> proposedBy = new LinkedHashMap<>();
        for (int i = 0; i < perStrategy.size(); i++) {
            String strategyName = strategies.get(i).name();
            for (MatchResult result : perStrategy.get(i)) {
                proposedBy.computeIfAbsent(result.getCandidateId(), id -> new LinkedHashSet<>()).add(strategyName);
            }
        }

        List<MatchResult> results = new ArrayList<>();
        Set<String> emitted = new HashSet<>();
        for (PaymentCandidate candidate : candidates) {
            if (!emitted.add(candidate.getId())) {
                continue;
            }
            Set<String> sources = proposedBy.getOrDefault(candidate.getId(), Collections.emptySet());

            WeightedScore score = score(transaction, candidate);
            if (score.getConfidence().getValue() < minConfidence) {
                continue;
            }

            List<String> fields = new ArrayList<>(3);
            if (score.getAmountScore() >= FIELD_THRESHOLD) {
                fields.add("amount");
            }
            if (score.getDateScore() >= FIELD_THRESHOLD) {
                fields.add("date");
            }
            if (score.getDescriptionScore() >= FIELD_THRESHOLD) {
                fields.add("description");
            }

            results.add(MatchResult.builder()
                    .transaction(transaction)
                    .candidate(candidate)
                    .confidence(score.getConfidence())
                    .matchType(MatchType.COMPOSITE)
                    .matchReason(reason(score, sources))
                    .matchedFields(fields)
                    .amountDifference(MatchScoring.amountDifference(transaction, candidate))
                    .build());
        }
        return results;
    }

    private List<MatchResult> mergeDedup(List<PaymentCandidate> candidates, List<List<MatchResult>> perStrategy) {
        Map<String, MatchResult> best = new LinkedHashMap<>();
        for (List<MatchResult> results : perStrategy) {
            for (MatchResult result : results) {
                MatchResult current = best.get(result.getCandidateId());
                if (current == null || result.getConfidence().compareTo(current.getConfidence()) > 0) {
                    best.put(result.getCandidateId(), result);
                }
            }
        }

        List<MatchResult> merged = new ArrayList<>();
        for (PaymentCandidate candidate : candidates) {
            MatchResult result = best.remove(candidate.getId());
            if (result != null && result.getConfidence().getValue() >= minConfidence) {
                merged.add(result);
            }
        }
        return merged;
    }

    /**
     * Amount, date and description scores of a candidate and their weighted sum.
     */
    public WeightedScore score(BankTransaction transaction, PaymentCandidate candidate) {
        double amountScore = MatchScoring.amountScore(transaction, candidate);
        double dateScore = MatchScoring.dateScore(transaction.getDate(), candidate.getDueDate());
        double descriptionScore = MatchScoring.descriptionScore(bestSimilarity(transaction, candidate));

        Confidence confidence = Confidence.of(weights.combine(amountScore, dateScore, descriptionScore));
        return new WeightedScore(amountScore, dateScore, descriptionScore, confidence);
    }

    private static double bestSimilarity(BankTransaction transaction, PaymentCandidate candidate) {
        List<String> candidateTexts = candidate.searchableTexts();
        double best = 0.0;
        for (String text : new String[]{
                transaction.getDescription(), transaction.getReference(), transaction.getCounterparty()}) {
            if (text == null || text.isBlank()) {
                continue;
            }
            for (String candidateText : candidateTexts) {
                best = Math.max(best, TextSimilarity.similarity(text, candidateText));
            }
        }
        return best;
    }

    private static String reason(WeightedScore score, Set<String> sources) {
        List<String> components = new ArrayList<>(3);
        if (score.getAmountScore() >= FIELD_THRESHOLD) {
            components.add(percent("amount", score.getAmountScore()));
        }
        if (score.getDateScore() >= FIELD_THRESHOLD) {
            components.add(percent("date", score.getDateScore()));
        }
        if (score.getDescriptionScore() >= FIELD_THRESHOLD) {
            components.add(percent("desc", score.getDescriptionScore()));
        }

        String summary = components.isEmpty()
                ? "Composite match: " + score.getConfidence() + " weighted score"
                : "Composite match (" + String.join(", ", components) + ") -> " + score.getConfidence();
        return sources.isEmpty()
                ? summary
                : summary + " [proposed by " + String.join(", ", sources) + "]";
    }

    private static String percent(String label, double score) {
        return String.format(Locale.ROOT, "%s %.0f%%", label, score * 100);
    }
}
