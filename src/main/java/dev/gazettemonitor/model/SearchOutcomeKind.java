package dev.gazettemonitor.model;

import java.util.Locale;

/**
 * Classification of the backend's free-text search status.
 */
public enum SearchOutcomeKind {
    SUCCESS,
    LIMITED,
    NO_RESULTS,
    UNKNOWN;

    public static SearchOutcomeKind classify(String status) {
        if (status == null || status.isBlank()) {
            return UNKNOWN;
        }
        String normalized = status.toLowerCase(Locale.ROOT);
        if (normalized.contains("sucesso")) {
            return SUCCESS;
        }
        if (normalized.contains("limite")) {
            return LIMITED;
        }
        if (normalized.contains("nenhum resultado")) {
            return NO_RESULTS;
        }
        return UNKNOWN;
    }

    public boolean delivered() {
        return this == SUCCESS || this == LIMITED;
    }
}
