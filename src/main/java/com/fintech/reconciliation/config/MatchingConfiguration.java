package com.fintech.reconciliation.config;

import com.fintech.reconciliation.domain.matcher.CompositeMatcher;
import com.fintech.reconciliation.domain.matcher.DateWindowMatcher;
import com.fintech.reconciliation.domain.matcher.ExactAmountMatcher;
import com.fintech.reconciliation.domain.matcher.FuzzyStringMatcher;
import com.fintech.reconciliation.domain.matcher.IbanMatcher;
import com.fintech.reconciliation.domain.matcher.MatchWeights;
import com.fintech.reconciliation.domain.matcher.MergeMode;
import com.fintech.reconciliation.infrastructure.concurrent.MdcAwareExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Wiring of the matcher strategies and the composite matcher.
 *
 * All thresholds come from {@code app.matching.*} in application.yml; the defaults
 * below apply when a property is absent. Invalid values fail context start-up with
 * a {@code MatchingConfigurationException}.
 */
@Slf4j
@Configuration
public class MatchingConfiguration {

    @Bean(name = "matchingTaskExecutor")
    public ThreadPoolTaskExecutor matchingTaskExecutor(
            @Value("${app.matching.executor.pool-size:4}") int poolSize,
            @Value("${app.matching.executor.queue-capacity:1000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("matcher-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }

    @Bean
    public ExactAmountMatcher exactAmountMatcher(
            @Value("${app.matching.exact.date-window-days:#{null}}") Integer dateWindowDays) {
        return new ExactAmountMatcher(dateWindowDays);
    }

    @Bean
    public DateWindowMatcher dateWindowMatcher(
            @Value("${app.matching.date-window.window-days:7}") int windowDays) {
        return new DateWindowMatcher(windowDays);
    }

    @Bean
    public FuzzyStringMatcher fuzzyStringMatcher(
            @Value("${app.matching.fuzzy.min-similarity:85.0}") double minSimilarity,
            @Value("${app.matching.fuzzy.date-window-days:14}") int dateWindowDays,
            @Value("${app.matching.fuzzy.amount-tolerance-pct:5.0}") double amountTolerancePct) {
        return new FuzzyStringMatcher(minSimilarity, dateWindowDays, amountTolerancePct);
    }

    @Bean
    public IbanMatcher ibanMatcher(
            @Value("${app.matching.iban.date-window-days:30}") int dateWindowDays,
            @Value("${app.matching.iban.amount-tolerance-pct:5.0}") double amountTolerancePct,
            @Value("${app.matching.iban.partial-match-enabled:true}") boolean partialMatchEnabled) {
        return new IbanMatcher(dateWindowDays, amountTolerancePct, partialMatchEnabled);
    }

    @Bean
    public MatchWeights matchWeights(
            @Value("${app.matching.composite.weights.amount:0.4}") double amount,
            @Value("${app.matching.composite.weights.date:0.3}") double date,
            @Value("${app.matching.composite.weights.description:0.3}") double description) {
        return MatchWeights.of(amount, date, description);
    }

    @Bean
    public CompositeMatcher compositeMatcher(
            ExactAmountMatcher exactAmountMatcher,
            FuzzyStringMatcher fuzzyStringMatcher,
            IbanMatcher ibanMatcher,
            DateWindowMatcher dateWindowMatcher,
            MatchWeights matchWeights,
            @Qualifier("matchingTaskExecutor") Executor matchingTaskExecutor,
            MeterRegistry meterRegistry,
            @Value("${app.matching.composite.min-confidence:0.6}") double minConfidence,
            @Value("${app.matching.composite.date-tolerance-days:30}") int dateToleranceDays,
            @Value("${app.matching.composite.merge-mode:WEIGHTED}") MergeMode mergeMode) {
        CompositeMatcher matcher = CompositeMatcher.builder()
                .strategies(List.of(exactAmountMatcher, fuzzyStringMatcher, ibanMatcher, dateWindowMatcher))
                .weights(matchWeights)
                .minConfidence(minConfidence)
                .dateToleranceDays(dateToleranceDays)
                .mergeMode(mergeMode)
                .executor(new MdcAwareExecutor(matchingTaskExecutor))
                .meterRegistry(meterRegistry)
                .build();

        log.info("Configured {}", matcher);
        return matcher;
    }
}
