package dev.gazettemonitor.client;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.gazettemonitor.config.ApiConfig;
import dev.gazettemonitor.exception.BackendException;
import dev.gazettemonitor.exception.MonitorException;
import dev.gazettemonitor.exception.NetworkException;
import dev.gazettemonitor.exception.NotFoundException;
import dev.gazettemonitor.exception.ValidationException;
import dev.gazettemonitor.metrics.MonitorMetrics;
import dev.gazettemonitor.model.JobCollection;
import dev.gazettemonitor.model.ScheduledJob;
import dev.gazettemonitor.model.SearchOutcome;
import dev.gazettemonitor.model.SearchRequest;
import dev.gazettemonitor.model.SystemSettings;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * Client for the search backend: schedules, settings, manual search and the activity log.
 * Every request goes through {@link BearerTokenFilter}; no request is retried.
 */
@Slf4j
@Component
public class MonitorApiClient {

    private static final DateTimeFormatter TRIGGER_TIME = DateTimeFormatter.ofPattern("HH:mm");

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final MonitorMetrics metrics;
    private final Duration timeout;

    public MonitorApiClient(WebClient.Builder webClientBuilder, ApiConfig apiConfig,
                            BearerTokenFilter bearerTokenFilter, ObjectMapper objectMapper,
                            MonitorMetrics metrics) {
        HttpClient httpClient = HttpClient.create()
                .httpResponseDecoder(decoder -> decoder.maxHeaderSize(32768));

        this.webClient = webClientBuilder
                .baseUrl(apiConfig.getBaseUrl())
                .codecs(config -> config.defaultCodecs().maxInMemorySize(apiConfig.getMaxInMemoryBytes()))
                .clientConnector(new ReactorClientHttpConnector(Objects.requireNonNull(httpClient)))
                .defaultHeader(HttpHeaders.ACCEPT, "application/json, text/plain, */*")
                .filter(bearerTokenFilter)
                .build();
        this.objectMapper = objectMapper;
        this.metrics = metrics;
        this.timeout = Duration.ofSeconds(apiConfig.getRequestTimeoutSeconds());
    }

    // ---------------------------------------------------------------- schedules

    /**
     * List scheduled jobs. Accepts both the bare array and the wrapped
     * {@code {jobs: [...], total_jobs, ...}} shapes.
     */
    public Mono<JobCollection> listJobs() {
        return timed("cron.list", webClient.get()
                .uri("/cron")
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .bodyToMono(JsonNode.class)
                .map(this::parseJobCollection)
                .defaultIfEmpty(JobCollection.empty()));
    }

    /**
     * Create a job. Emits the job carrying the backend-assigned id when the answer includes one.
     */
    public Mono<ScheduledJob> createJob(ScheduledJob job) {
        CronJobPayload payload = CronJobPayload.from(job);
        payload.setId(null);
        return timed("cron.create", webClient.post()
                .uri("/cron")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .bodyToMono(JsonNode.class)
                .map(body -> assignedId(body).map(job::withId).orElse(job))
                .defaultIfEmpty(job));
    }

    public Mono<Void> updateJob(ScheduledJob job) {
        return timed("cron.update", webClient.put()
                .uri("/cron")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(CronJobPayload.from(job))
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .toBodilessEntity()
                .then());
    }

    public Mono<Void> deleteJob(long id) {
        return timed("cron.delete", webClient.method(HttpMethod.DELETE)
                .uri("/cron")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", id))
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .toBodilessEntity()
                .then());
    }

    // ---------------------------------------------------------------- settings

    public Mono<SystemSettings> getSettings() {
        return timed("config.get", webClient.get()
                .uri("/config")
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .bodyToMono(SettingsPayload.class)
                .map(SettingsPayload::toSettings));
    }

    /**
     * Replace the writable settings. Emits the backend's confirmation message, if any.
     */
    public Mono<String> replaceSettings(SystemSettings settings) {
        SettingsPayload payload = SettingsPayload.builder()
                .emailPrincipal(settings.getPrimaryEmail())
                .emailsAviso(settings.getAlertEmails())
                .build();
        return timed("config.replace", webClient.put()
                .uri("/config")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .bodyToMono(MessageBody.class)
                .mapNotNull(MessageBody::getMessage));
    }

    // ---------------------------------------------------------------- search

    public Mono<SearchOutcome> executeSearch(SearchRequest request) {
        SearchPayload payload = SearchPayload.builder()
                .searchQuery(request.getTerms())
                .fromDate(request.getFromDate().toString())
                .toDate(request.getToDate().toString())
                .emailEnvio(request.getEmail())
                .build();
        return timed("executar-busca", webClient.post()
                .uri("/executar-busca")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(payload)
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .bodyToMono(SearchResultPayload.class)
                .map(SearchResultPayload::toOutcome));
    }

    // ---------------------------------------------------------------- account and log

    public Mono<String> downloadActivityLog() {
        return timed("registro", webClient.get()
                .uri("/registro")
                .accept(MediaType.TEXT_PLAIN, MediaType.APPLICATION_OCTET_STREAM)
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .bodyToMono(String.class)
                .defaultIfEmpty(""));
    }

    public Mono<String> changePassword(String currentPassword, String newPassword) {
        return timed("change-password", webClient.put()
                .uri("/change-password")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("current_password", currentPassword, "new_password", newPassword))
                .retrieve()
                .onStatus(status -> status.isError(), this::toException)
                .bodyToMono(MessageBody.class)
                .mapNotNull(MessageBody::getMessage));
    }

    // ---------------------------------------------------------------- helpers

    /**
     * Latency is measured from subscription, not from when the call was assembled.
     */
    private <T> Mono<T> timed(String endpoint, Mono<T> call) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return call
                    .timeout(timeout)
                    .onErrorMap(e -> !(e instanceof MonitorException), e -> translate(endpoint, e))
                    .doOnTerminate(() -> metrics.recordRequestLatency(endpoint, System.currentTimeMillis() - start));
        });
    }

    private Throwable translate(String endpoint, Throwable e) {
        if (e instanceof WebClientRequestException || e instanceof TimeoutException) {
            log.warn("{} - transport failure: {}", endpoint, e.getMessage());
            return new NetworkException("Could not reach the search backend", e);
        }
        return e;
    }

    private Mono<? extends Throwable> toException(ClientResponse response) {
        int status = response.statusCode().value();
        return response.bodyToMono(MessageBody.class)
                .onErrorResume(e -> Mono.empty())
                .mapNotNull(MessageBody::getMessage)
                .defaultIfEmpty("")
                .map(message -> {
                    String text = message.isBlank() ? "Request failed (HTTP " + status + ")" : message;
                    if (status == HttpStatus.NOT_FOUND.value()) {
                        return new NotFoundException(text);
                    }
                    if (status == HttpStatus.BAD_REQUEST.value() || status == HttpStatus.UNPROCESSABLE_ENTITY.value()) {
                        return new ValidationException(text);
                    }
                    return new BackendException(status, text);
                });
    }

    JobCollection parseJobCollection(JsonNode body) {
        if (body.isArray()) {
            return JobCollection.of(toJobs(body));
        }
        if (body.isObject() && body.path("jobs").isArray()) {
            return JobCollection.withCounters(
                    toJobs(body.get("jobs")),
                    intOrNull(body, "total_jobs"),
                    intOrNull(body, "jobs_ativos"),
                    intOrNull(body, "jobs_inativos"),
                    body.hasNonNull("ultima_execucao") ? body.get("ultima_execucao").asText() : null);
        }
        log.warn("Unexpected /cron response shape: {}", body.getNodeType());
        return JobCollection.empty();
    }

    private List<ScheduledJob> toJobs(JsonNode array) {
        List<ScheduledJob> jobs = new ArrayList<>();
        for (JsonNode node : array) {
            try {
                jobs.add(objectMapper.treeToValue(node, CronJobPayload.class).toJob());
            } catch (Exception e) {
                log.warn("Skipping unreadable job entry: {}", e.getMessage());
            }
        }
        return jobs;
    }

    private static Integer intOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.canConvertToInt() ? value.asInt() : null;
    }

    private static Optional<Long> assignedId(JsonNode body) {
        JsonNode id = body.path("id");
        if (id.canConvertToLong()) {
            return Optional.of(id.asLong());
        }
        JsonNode nested = body.path("job").path("id");
        return nested.canConvertToLong() ? Optional.of(nested.asLong()) : Optional.empty();
    }

    /**
     * Wire form of a scheduled job on the {@code /cron} endpoint.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class CronJobPayload {
        private Long id;
        @JsonProperty("search_query")
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<String> searchQuery;
        private String schedule;
        private List<String> weekdays;
        private Boolean active;
        @JsonProperty("quant_dias")
        private Integer quantDias;
        @JsonProperty("email_envio")
        private String emailEnvio;

        static CronJobPayload from(ScheduledJob job) {
            List<String> days = job.getWeekdays() == null ? List.of() : job.getWeekdays().stream()
                    .sorted()
                    .map(day -> day.name().toLowerCase(Locale.ROOT))
                    .toList();
            return CronJobPayload.builder()
                    .id(job.getId())
                    .searchQuery(job.getSearchTerms())
                    .schedule(job.getTriggerTime() != null ? TRIGGER_TIME.format(job.getTriggerTime()) : null)
                    .weekdays(days)
                    .active(job.isActive())
                    .quantDias(job.getLookbackDays())
                    .emailEnvio(job.getNotifyEmail())
                    .build();
        }

        ScheduledJob toJob() {
            return ScheduledJob.builder()
                    .id(id)
                    .searchTerms(searchQuery != null ? List.copyOf(searchQuery) : List.of())
                    .triggerTime(parseTime(schedule))
                    .weekdays(parseWeekdays(weekdays))
                    .lookbackDays(quantDias != null ? quantDias : 0)
                    .notifyEmail(emailEnvio != null && !emailEnvio.isBlank() ? emailEnvio.trim() : null)
                    .active(Boolean.TRUE.equals(active))
                    .build();
        }

        private static LocalTime parseTime(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return LocalTime.parse(value.trim());
            } catch (DateTimeParseException e) {
                log.warn("Unreadable trigger time '{}'", value);
                return null;
            }
        }

        private static Set<DayOfWeek> parseWeekdays(List<String> values) {
            if (values == null || values.isEmpty()) {
                return Set.of();
            }
            EnumSet<DayOfWeek> days = EnumSet.noneOf(DayOfWeek.class);
            for (String value : values) {
                try {
                    days.add(DayOfWeek.valueOf(value.trim().toUpperCase(Locale.ROOT)));
                } catch (IllegalArgumentException e) {
                    log.warn("Ignoring unknown weekday '{}'", value);
                }
            }
            return Set.copyOf(days);
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class SettingsPayload {
        @JsonProperty("email_principal")
        private String emailPrincipal;
        @JsonProperty("emails_aviso")
        private List<String> emailsAviso;
        @JsonProperty("ultima_alteracao_por")
        private String ultimaAlteracaoPor;
        @JsonProperty("ultima_alteracao_em")
        private String ultimaAlteracaoEm;
        @JsonProperty("acessado_por")
        private String acessadoPor;

        SystemSettings toSettings() {
            return SystemSettings.builder()
                    .primaryEmail(emailPrincipal != null ? emailPrincipal : "")
                    .alertEmails(emailsAviso != null ? List.copyOf(emailsAviso) : List.of())
                    .lastModifiedBy(ultimaAlteracaoPor)
                    .lastModifiedAt(ultimaAlteracaoEm)
                    .accessedBy(acessadoPor)
                    .build();
        }
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class SearchPayload {
        @JsonProperty("search_query")
        private List<String> searchQuery;
        @JsonProperty("from_date")
        private String fromDate;
        @JsonProperty("to_date")
        private String toDate;
        @JsonProperty("email_envio")
        private String emailEnvio;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class SearchResultPayload {
        private String status;
        private Integer resultados;
        @JsonProperty("resultados_totais")
        private Integer resultadosTotais;
        private Integer enviados;
        private Integer excedentes;
        private String message;

        SearchOutcome toOutcome() {
            return SearchOutcome.builder()
                    .status(status)
                    .results(resultados)
                    .totalResults(resultadosTotais)
                    .sent(enviados)
                    .excess(excedentes)
                    .message(message)
                    .build();
        }
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class MessageBody {
        private String message;
    }
}
