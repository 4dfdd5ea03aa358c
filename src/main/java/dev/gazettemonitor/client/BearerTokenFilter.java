package dev.gazettemonitor.client;

import dev.gazettemonitor.exception.AuthException;
import dev.gazettemonitor.service.SessionGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import reactor.core.publisher.Mono;

/**
 * Attaches the current session token to every backend request and turns any
 * 401 answer into a session teardown, whichever request surfaced it.
 * Requests issued without a session fail before reaching the network.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BearerTokenFilter implements ExchangeFilterFunction {

    private final SessionGuard sessionGuard;

    @Override
    public Mono<ClientResponse> filter(ClientRequest request, ExchangeFunction next) {
        return Mono.defer(() -> {
            String token = sessionGuard.currentToken().orElse(null);
            if (token == null) {
                return Mono.error(new AuthException("No active session"));
            }

            ClientRequest authorized = ClientRequest.from(request)
                    .headers(headers -> headers.set(HttpHeaders.AUTHORIZATION, "Bearer " + token))
                    .build();

            return next.exchange(authorized)
                    .flatMap(response -> {
                        if (response.statusCode().value() != HttpStatus.UNAUTHORIZED.value()) {
                            return Mono.just(response);
                        }
                        log.warn("{} {} answered 401 - tearing down session",
                                request.method(), request.url().getPath());
                        return response.releaseBody()
                                .then(Mono.fromRunnable(() -> sessionGuard.expire()))
                                .then(Mono.error(new AuthException("Session expired")));
                    });
        });
    }
}
