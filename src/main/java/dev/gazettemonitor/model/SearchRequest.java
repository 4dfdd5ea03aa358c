package dev.gazettemonitor.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;

@Value
@Builder(toBuilder = true)
public class SearchRequest {

    @Builder.Default
    List<String> terms = List.of();

    LocalDate fromDate;

    LocalDate toDate;

    // Optional; the backend uses its primary email when absent
    String email;
}
