package dev.gazettemonitor.model;

/**
 * Business limits enforced by the search backend. The client only reports them.
 */
public final class SearchLimits {

    public static final int MAX_RESULTS_PER_SEARCH = 20;
    public static final int MAX_ATTACHMENTS_PER_EMAIL = 6;
    public static final long MAX_ATTACHMENT_BYTES = 25L * 1024 * 1024;

    private SearchLimits() {
    }
}
