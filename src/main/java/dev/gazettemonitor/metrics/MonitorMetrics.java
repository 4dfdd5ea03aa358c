package dev.gazettemonitor.metrics;

import dev.gazettemonitor.model.SearchOutcomeKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Locale;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Prometheus metrics for operator sessions, schedule mutations and manual searches.
 */
@Component
public class MonitorMetrics {

    private static final String TAG_ENDPOINT = "endpoint";
    private final MeterRegistry registry;

    private final Counter busyRejectionsCounter;
    private final Counter sessionExpirationsCounter;

    private final ConcurrentHashMap<String, Timer> endpointTimers = new ConcurrentHashMap<>();

    public MonitorMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.busyRejectionsCounter = Counter.builder("gazette_monitor_busy_rejections_total")
                .description("Operations discarded because a manual search was running")
                .register(registry);

        this.sessionExpirationsCounter = Counter.builder("gazette_monitor_session_expirations_total")
                .description("Sessions torn down after an authorization failure")
                .register(registry);
    }

    public void recordBusyRejection() {
        busyRejectionsCounter.increment();
    }

    public void recordSessionExpired() {
        sessionExpirationsCounter.increment();
    }

    /**
     * Record a login attempt, tagged with its result (success, rejected, error).
     */
    public void recordLogin(String result) {
        Counter.builder("gazette_monitor_logins_total")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordScheduleMutation(String operation) {
        Counter.builder("gazette_monitor_schedule_mutations_total")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    public void recordSearch(SearchOutcomeKind kind) {
        Counter.builder("gazette_monitor_searches_total")
                .tag("outcome", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public Timer getEndpointTimer(String endpoint) {
        return endpointTimers.computeIfAbsent(endpoint, name ->
                Timer.builder("gazette_monitor_request_duration")
                        .description("Round trip time of backend requests")
                        .tag(TAG_ENDPOINT, name)
                        .register(registry)
        );
    }

    public void recordRequestLatency(String endpoint, long latencyMs) {
        getEndpointTimer(endpoint).record(Duration.ofMillis(latencyMs));
    }
}
