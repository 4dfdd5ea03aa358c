package dev.gazettemonitor.service;

import dev.gazettemonitor.client.MonitorApiClient;
import dev.gazettemonitor.exception.ValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator account maintenance and the backend's activity log.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private final MonitorApiClient apiClient;
    private final SessionGuard sessionGuard;

    public Mono<String> changePassword(String currentPassword, String newPassword) {
        return Mono.defer(() -> {
            List<String> violations = new ArrayList<>();
            if (currentPassword == null || currentPassword.isEmpty()) {
                violations.add("Current password is required");
            }
            if (newPassword == null || newPassword.isBlank()) {
                violations.add("New password is required");
            } else if (newPassword.equals(currentPassword)) {
                violations.add("New password must differ from the current one");
            }
            if (!violations.isEmpty()) {
                return Mono.error(new ValidationException(violations));
            }
            String username = sessionGuard.requireSession().username();
            return apiClient.changePassword(currentPassword, newPassword)
                    .doOnSuccess(message -> log.info("Password changed for {}", username));
        });
    }

    public Mono<String> activityLog() {
        return Mono.defer(() -> {
            sessionGuard.requireSession();
            return apiClient.downloadActivityLog();
        });
    }
}
