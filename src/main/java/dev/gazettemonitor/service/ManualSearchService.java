package dev.gazettemonitor.service;

import dev.gazettemonitor.client.MonitorApiClient;
import dev.gazettemonitor.exception.ValidationException;
import dev.gazettemonitor.metrics.MonitorMetrics;
import dev.gazettemonitor.model.SearchLimits;
import dev.gazettemonitor.model.SearchOutcome;
import dev.gazettemonitor.model.SearchRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs an immediate search. The whole round trip holds the {@link ExecutionMutex}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ManualSearchService {

    private final MonitorApiClient apiClient;
    private final ExecutionMutex executionMutex;
    private final SessionGuard sessionGuard;
    private final MonitorMetrics metrics;

    /**
     * @return the classified outcome; fails with
     * {@link dev.gazettemonitor.exception.AlreadyRunningException} when another search is running
     */
    public Mono<SearchOutcome> search(SearchRequest request) {
        return executionMutex.guard(() -> {
            SearchRequest normalized = normalize(request);
            sessionGuard.requireSession();
            log.info("Manual search {} from {} to {}", normalized.getTerms(),
                    normalized.getFromDate(), normalized.getToDate());
            return apiClient.executeSearch(normalized)
                    .doOnNext(this::report);
        });
    }

    SearchRequest normalize(SearchRequest request) {
        List<String> violations = new ArrayList<>();

        List<String> terms = ScheduleValidator.normalizeTerms(request.getTerms());
        if (terms.isEmpty()) {
            violations.add("At least one search term is required");
        }
        if (request.getFromDate() == null || request.getToDate() == null) {
            violations.add("Both dates are required");
        } else if (request.getFromDate().isAfter(request.getToDate())) {
            violations.add("Start date must not be after end date");
        }
        String email = EmailAddresses.normalize(request.getEmail());
        if (email != null && !EmailAddresses.isValid(email)) {
            violations.add("Invalid email: " + email);
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return request.toBuilder()
                .terms(terms)
                .email(email)
                .build();
    }

    private void report(SearchOutcome outcome) {
        metrics.recordSearch(outcome.getKind());
        switch (outcome.getKind()) {
            case SUCCESS -> log.info("Search succeeded: {} result(s)", outcome.resultCount());
            case LIMITED -> log.info("Search hit the {}-result limit: {} found, {} emailed",
                    SearchLimits.MAX_RESULTS_PER_SEARCH, outcome.getTotalResults(), outcome.getSent());
            case NO_RESULTS -> log.info("Search found no results");
            default -> log.warn("Unrecognized search status: {}", outcome.getStatus());
        }
        if (outcome.hasLinkDeliveries()) {
            log.info("{} attachment(s) over the per-email limit of {} (or above {} MB) were sent as links",
                    outcome.getExcess(), SearchLimits.MAX_ATTACHMENTS_PER_EMAIL,
                    SearchLimits.MAX_ATTACHMENT_BYTES / (1024 * 1024));
        }
    }
}
