package dev.gazettemonitor.service;

import dev.gazettemonitor.exception.ValidationException;
import dev.gazettemonitor.model.ScheduledJob;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Validates and normalizes a job before it is sent to the backend.
 */
@Component
public class ScheduleValidator {

    /**
     * @return the normalized job: terms trimmed, blanks dropped, duplicates removed keeping
     * the first occurrence, blank email cleared
     * @throws ValidationException listing every violation found
     */
    public ScheduledJob normalize(ScheduledJob draft) {
        List<String> violations = new ArrayList<>();

        List<String> terms = normalizeTerms(draft.getSearchTerms());
        if (terms.isEmpty()) {
            violations.add("At least one search term is required");
        }
        if (draft.getTriggerTime() == null) {
            violations.add("Trigger time is required");
        }
        if (draft.getLookbackDays() < 0) {
            violations.add("Lookback days cannot be negative");
        }
        String email = EmailAddresses.normalize(draft.getNotifyEmail());
        if (email != null && !EmailAddresses.isValid(email)) {
            violations.add("Invalid notification email: " + email);
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }

        return draft.toBuilder()
                .searchTerms(terms)
                .weekdays(draft.getWeekdays() == null ? Set.of() : Set.copyOf(draft.getWeekdays()))
                .notifyEmail(email)
                .build();
    }

    public static List<String> normalizeTerms(Collection<String> raw) {
        if (raw == null) {
            return List.of();
        }
        Set<String> unique = new LinkedHashSet<>();
        for (String term : raw) {
            if (term != null && !term.isBlank()) {
                unique.add(term.trim());
            }
        }
        return List.copyOf(unique);
    }
}
