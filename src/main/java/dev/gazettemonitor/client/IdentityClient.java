package dev.gazettemonitor.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.gazettemonitor.config.ApiConfig;
import dev.gazettemonitor.exception.LoginFailedException;
import dev.gazettemonitor.exception.NetworkException;
import dev.gazettemonitor.metrics.MonitorMetrics;
import dev.gazettemonitor.model.UserInfo;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Unauthenticated client for the identity server: login and token verification.
 * Kept apart from {@link MonitorApiClient} so a rejected login never reads as a session expiry.
 */
@Slf4j
@Component
public class IdentityClient {

    private final WebClient webClient;
    private final MonitorMetrics metrics;
    private final Duration timeout;

    public IdentityClient(WebClient.Builder webClientBuilder, ApiConfig apiConfig, MonitorMetrics metrics) {
        this.webClient = webClientBuilder
                .baseUrl(apiConfig.getIdentityBaseUrl())
                .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.metrics = metrics;
        this.timeout = Duration.ofSeconds(apiConfig.getRequestTimeoutSeconds());
    }

    /**
     * Exchange credentials for a bearer token.
     * A rejection surfaces the server's message verbatim as {@link LoginFailedException}.
     */
    public Mono<LoginResponse> login(String username, String password) {
        return timed("login", webClient.post()
                .uri("/login")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(new LoginRequest(username, password))
                .exchangeToMono(response -> {
                    if (response.statusCode().is2xxSuccessful()) {
                        return response.bodyToMono(LoginResponse.class);
                    }
                    int status = response.statusCode().value();
                    return response.bodyToMono(ErrorBody.class)
                            .onErrorResume(e -> Mono.empty())
                            .map(ErrorBody::getMessage)
                            .defaultIfEmpty("")
                            .flatMap(message -> Mono.<LoginResponse>error(new LoginFailedException(
                                    message.isBlank() ? "Login rejected (HTTP " + status + ")" : message)));
                }));
    }

    /**
     * One verification round trip. Emits true only for a 2xx answer.
     * Transport failures are propagated; the caller decides how to treat them.
     */
    public Mono<Boolean> verify(String token) {
        return timed("verify-token", webClient.get()
                .uri("/verify-token")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + token)
                .exchangeToMono(response -> response.releaseBody()
                        .thenReturn(response.statusCode().is2xxSuccessful())));
    }

    private <T> Mono<T> timed(String endpoint, Mono<T> call) {
        return Mono.defer(() -> {
            long start = System.currentTimeMillis();
            return call
                    .timeout(timeout)
                    .onErrorMap(this::isTransportFailure,
                            e -> new NetworkException("Could not reach the identity server", e))
                    .doOnTerminate(() -> metrics.recordRequestLatency(endpoint, System.currentTimeMillis() - start));
        });
    }

    private boolean isTransportFailure(Throwable e) {
        return e instanceof WebClientRequestException || e instanceof TimeoutException;
    }

    record LoginRequest(String username, String password) {
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class LoginResponse {
        @JsonProperty("access_token")
        private String accessToken;
        private UserInfo user;
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ErrorBody {
        private String message;
    }
}
