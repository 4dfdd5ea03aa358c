package dev.gazettemonitor.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Backend-wide notification settings. The primary email receives search results,
 * alert emails only receive status notices.
 */
@Value
@Builder(toBuilder = true)
public class SystemSettings {

    String primaryEmail;

    @Builder.Default
    List<String> alertEmails = List.of();

    // Read-only, filled in by the backend
    String lastModifiedBy;
    String lastModifiedAt;
    String accessedBy;
}
