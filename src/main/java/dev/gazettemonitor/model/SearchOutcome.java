package dev.gazettemonitor.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SearchOutcome {

    String status;
    Integer results;
    Integer totalResults;
    Integer sent;
    Integer excess;
    String message;

    public SearchOutcomeKind getKind() {
        return SearchOutcomeKind.classify(status);
    }

    /**
     * Results reported by the backend, preferring the per-search count over the total.
     */
    public int resultCount() {
        if (results != null && results > 0) {
            return results;
        }
        return totalResults != null ? totalResults : 0;
    }

    /**
     * True when some attachments exceeded the per-email limit and were delivered as links.
     */
    public boolean hasLinkDeliveries() {
        return excess != null && excess > 0;
    }
}
