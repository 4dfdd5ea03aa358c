package dev.gazettemonitor.service;

import dev.gazettemonitor.client.MonitorApiClient;
import dev.gazettemonitor.exception.ValidationException;
import dev.gazettemonitor.model.SystemSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Reads and replaces the backend's notification settings.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SettingsService {

    private final MonitorApiClient apiClient;
    private final ExecutionMutex executionMutex;
    private final SessionGuard sessionGuard;

    public Mono<SystemSettings> get() {
        return Mono.defer(() -> {
            sessionGuard.requireSession();
            return apiClient.getSettings();
        });
    }

    /**
     * Validate and replace the settings, then read them back so the backend's
     * "last modified" fields are current.
     */
    public Mono<SystemSettings> replace(SystemSettings settings) {
        return Mono.defer(() -> {
            executionMutex.ensureIdle("change settings");
            sessionGuard.requireSession();
            SystemSettings normalized = normalize(settings);
            return apiClient.replaceSettings(normalized)
                    .doOnNext(message -> log.info("Settings saved: {}", message))
                    .then(apiClient.getSettings());
        });
    }

    SystemSettings normalize(SystemSettings settings) {
        List<String> violations = new ArrayList<>();

        String primary = EmailAddresses.normalize(settings.getPrimaryEmail());
        if (primary == null) {
            violations.add("Primary email is required");
        } else if (!EmailAddresses.isValid(primary)) {
            violations.add("Primary email is invalid: " + primary);
        }

        Set<String> alerts = new LinkedHashSet<>();
        if (settings.getAlertEmails() != null) {
            for (String raw : settings.getAlertEmails()) {
                String email = EmailAddresses.normalize(raw);
                if (email == null) {
                    continue;
                }
                if (!EmailAddresses.isValid(email)) {
                    violations.add("Alert email is invalid: " + email);
                } else if (!alerts.add(email)) {
                    violations.add("Alert email listed twice: " + email);
                }
            }
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
        return settings.toBuilder()
                .primaryEmail(primary)
                .alertEmails(List.copyOf(alerts))
                .build();
    }
}
