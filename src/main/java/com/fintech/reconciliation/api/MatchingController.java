package com.fintech.reconciliation.api;

import com.fintech.reconciliation.domain.model.BankTransaction;
import com.fintech.reconciliation.domain.model.MatchResult;
import com.fintech.reconciliation.domain.model.PaymentCandidate;
import com.fintech.reconciliation.domain.service.PaymentMatchingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * REST API for payment matching.
 *
 * Synchronous entry point for statement importers and manual reconciliation screens.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/matches")
@RequiredArgsConstructor
public class MatchingController {

    private final PaymentMatchingService matchingService;

    /**
     * Rank the candidates for a transaction.
     *
     * POST /api/v1/matches
     *
     * Request body: MatchRequest
     * Response: MatchView list, best first
     */
    @PostMapping
    public ResponseEntity<List<MatchView>> match(@Valid @RequestBody MatchRequest request) {
        BankTransaction transaction = request.getTransaction().toDomain();
        List<PaymentCandidate> candidates = request.getCandidates().stream()
                .map(MatchRequest.CandidatePayload::toDomain)
                .collect(Collectors.toList());

        log.info("Received match request: {} ({} candidates)", transaction.getId(), candidates.size());

        List<MatchResult> results = matchingService.match(transaction, candidates);

        return ResponseEntity.ok(results.stream().map(MatchView::from).collect(Collectors.toList()));
    }

    /**
     * Health check endpoint.
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
