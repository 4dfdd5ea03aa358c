package dev.gazettemonitor.service;

import dev.gazettemonitor.model.ExecutionWindow;
import dev.gazettemonitor.model.ScheduledJob;
import dev.gazettemonitor.model.SearchRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Turns a scheduled job into the search it would run on a given day.
 */
@Component
@RequiredArgsConstructor
public class SearchPlanner {

    private final WindowResolver windowResolver;

    /**
     * @param primaryEmail fallback recipient when the job has no notification email
     * @return the request, or empty when the job is inactive or does not fire that day
     */
    public Optional<SearchRequest> plan(ScheduledJob job, LocalDate date, String primaryEmail) {
        if (!job.isActive()) {
            return Optional.empty();
        }
        ExecutionWindow window = windowResolver.resolve(job, date);
        if (!window.fires()) {
            return Optional.empty();
        }
        String recipient = job.getNotifyEmail() != null ? job.getNotifyEmail() : EmailAddresses.normalize(primaryEmail);
        return Optional.of(SearchRequest.builder()
                .terms(job.getSearchTerms())
                .fromDate(window.fromDate())
                .toDate(window.toDate())
                .email(recipient)
                .build());
    }
}
