package dev.gazettemonitor.metrics;

import dev.gazettemonitor.model.SearchOutcomeKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MonitorMetricsTest {

    private MeterRegistry meterRegistry;
    private MonitorMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        metrics = new MonitorMetrics(meterRegistry);
    }

    @Nested
    @DisplayName("Counters")
    class CounterTests {

        @Test
        @DisplayName("Should count busy rejections")
        void shouldCountBusyRejections() {
            metrics.recordBusyRejection();
            metrics.recordBusyRejection();

            assertThat(meterRegistry.get("gazette_monitor_busy_rejections_total").counter().count())
                    .isEqualTo(2.0);
        }

        @Test
        @DisplayName("Should count session expirations")
        void shouldCountExpirations() {
            metrics.recordSessionExpired();

            assertThat(meterRegistry.get("gazette_monitor_session_expirations_total").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should tag logins by result")
        void shouldTagLogins() {
            metrics.recordLogin("success");
            metrics.recordLogin("rejected");
            metrics.recordLogin("rejected");

            assertThat(meterRegistry.get("gazette_monitor_logins_total").tag("result", "rejected").counter().count())
                    .isEqualTo(2.0);
            assertThat(meterRegistry.get("gazette_monitor_logins_total").tag("result", "success").counter().count())
                    .isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should tag searches by outcome in lowercase")
        void shouldTagSearches() {
            metrics.recordSearch(SearchOutcomeKind.NO_RESULTS);

            assertThat(meterRegistry.get("gazette_monitor_searches_total").tag("outcome", "no_results").counter().count())
                    .isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Request timers")
    class TimerTests {

        @Test
        @DisplayName("Should reuse one timer per endpoint")
        void shouldReuseTimer() {
            Timer first = metrics.getEndpointTimer("cron.list");
            Timer second = metrics.getEndpointTimer("cron.list");

            assertThat(first).isSameAs(second);
        }

        @Test
        @DisplayName("Should record latency")
        void shouldRecordLatency() {
            metrics.recordRequestLatency("executar-busca", 250);

            Timer timer = meterRegistry.get("gazette_monitor_request_duration").tag("endpoint", "executar-busca").timer();
            assertThat(timer.count()).isEqualTo(1);
            assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(250.0);
        }
    }
}
