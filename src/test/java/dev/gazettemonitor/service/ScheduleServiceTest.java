package dev.gazettemonitor.service;

import dev.gazettemonitor.client.MonitorApiClient;
import dev.gazettemonitor.exception.AuthException;
import dev.gazettemonitor.exception.BusyException;
import dev.gazettemonitor.exception.NotFoundException;
import dev.gazettemonitor.exception.ValidationException;
import dev.gazettemonitor.metrics.MonitorMetrics;
import dev.gazettemonitor.model.JobCollection;
import dev.gazettemonitor.model.ScheduledJob;
import dev.gazettemonitor.model.Session;
import dev.gazettemonitor.model.UserInfo;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ScheduleServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-10T11:00:00Z");

    @Mock
    private MonitorApiClient apiClient;

    @Mock
    private SessionGuard sessionGuard;

    @Mock
    private AuditService auditService;

    private MeterRegistry meterRegistry;
    private ExecutionMutex executionMutex;
    private ScheduleService scheduleService;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        MonitorMetrics metrics = new MonitorMetrics(meterRegistry);
        executionMutex = new ExecutionMutex(metrics);
        scheduleService = new ScheduleService(apiClient, new ScheduleValidator(), executionMutex,
                sessionGuard, auditService, metrics, Clock.fixed(NOW, WindowResolver.ZONE));
    }

    private void signedIn() {
        when(sessionGuard.requireSession())
                .thenReturn(new Session("tok", new UserInfo("ana", "admin"), NOW));
    }

    private ScheduledJob draft() {
        return ScheduledJob.builder()
                .searchTerms(List.of(" licitação ", "pregão", "licitação"))
                .triggerTime(LocalTime.of(8, 0))
                .weekdays(Set.of(DayOfWeek.MONDAY))
                .lookbackDays(2)
                .notifyEmail(" juridico@cpis.com.br ")
                .active(true)
                .build();
    }

    private double mutations(String operation) {
        return meterRegistry.get("gazette_monitor_schedule_mutations_total")
                .tag("operation", operation)
                .counter()
                .count();
    }

    @Nested
    @DisplayName("Create")
    class CreateTests {

        @Test
        @DisplayName("Should normalize, create and stamp the job")
        void shouldCreateNormalizedJob() {
            signedIn();
            when(apiClient.createJob(any(ScheduledJob.class)))
                    .thenAnswer(invocation -> Mono.just(((ScheduledJob) invocation.getArgument(0)).withId(12L)));

            StepVerifier.create(scheduleService.create(draft()))
                    .assertNext(created -> {
                        assertThat(created.getId()).isEqualTo(12L);
                        assertThat(created.getSearchTerms()).containsExactly("licitação", "pregão");
                        assertThat(created.getNotifyEmail()).isEqualTo("juridico@cpis.com.br");
                        assertThat(created.getLastModifiedBy()).isEqualTo("ana");
                        assertThat(created.getLastModifiedAt()).isEqualTo(NOW);
                    })
                    .verifyComplete();

            ArgumentCaptor<ScheduledJob> sent = ArgumentCaptor.forClass(ScheduledJob.class);
            verify(apiClient).createJob(sent.capture());
            assertThat(sent.getValue().getId()).isNull();
            verify(auditService).record("create", 12L, "ana", NOW);
            assertThat(mutations("create")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should report a committed create as successful when the audit write fails")
        void shouldSurviveAuditFailureOnCreate() {
            signedIn();
            when(apiClient.createJob(any(ScheduledJob.class)))
                    .thenAnswer(invocation -> Mono.just(((ScheduledJob) invocation.getArgument(0)).withId(42L)));
            doThrow(new DataAccessResourceFailureException("database is locked"))
                    .when(auditService).record(anyString(), any(), anyString(), any(Instant.class));

            StepVerifier.create(scheduleService.create(draft()))
                    .assertNext(created -> {
                        assertThat(created.getId()).isEqualTo(42L);
                        assertThat(created.getLastModifiedBy()).isEqualTo("ana");
                    })
                    .verifyComplete();

            assertThat(mutations("create")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reject an invalid job without calling the backend")
        void shouldRejectInvalidJob() {
            signedIn();
            ScheduledJob invalid = draft().toBuilder().searchTerms(List.of("  ")).build();

            StepVerifier.create(scheduleService.create(invalid))
                    .expectError(ValidationException.class)
                    .verify();

            verifyNoInteractions(apiClient, auditService);
        }

        @Test
        @DisplayName("Should refuse to create while a manual search runs")
        void shouldRefuseWhileBusy() {
            executionMutex.acquire();

            StepVerifier.create(scheduleService.create(draft()))
                    .expectError(BusyException.class)
                    .verify();

            verifyNoInteractions(apiClient, sessionGuard);
            assertThat(executionMutex.isHeld()).isTrue();
        }

        @Test
        @DisplayName("Should refuse to create without a session")
        void shouldRefuseWithoutSession() {
            when(sessionGuard.requireSession()).thenThrow(new AuthException("Not authenticated"));

            StepVerifier.create(scheduleService.create(draft()))
                    .expectError(AuthException.class)
                    .verify();

            verifyNoInteractions(apiClient);
        }
    }

    @Nested
    @DisplayName("Update and delete")
    class UpdateDeleteTests {

        @Test
        @DisplayName("Should send the job under the given id")
        void shouldUpdateUnderId() {
            signedIn();
            when(apiClient.updateJob(any(ScheduledJob.class))).thenReturn(Mono.empty());

            StepVerifier.create(scheduleService.update(5L, draft()))
                    .assertNext(updated -> {
                        assertThat(updated.getId()).isEqualTo(5L);
                        assertThat(updated.getLastModifiedBy()).isEqualTo("ana");
                    })
                    .verifyComplete();

            verify(auditService).record("update", 5L, "ana", NOW);
        }

        @Test
        @DisplayName("Should not stamp or audit when the backend rejects the update")
        void shouldNotAuditFailedUpdate() {
            signedIn();
            when(apiClient.updateJob(any(ScheduledJob.class)))
                    .thenReturn(Mono.error(new ValidationException("Horário inválido")));

            StepVerifier.create(scheduleService.update(5L, draft()))
                    .expectError(ValidationException.class)
                    .verify();

            verifyNoInteractions(auditService);
        }

        @Test
        @DisplayName("Should delete and record the deletion")
        void shouldDelete() {
            signedIn();
            when(apiClient.deleteJob(9L)).thenReturn(Mono.empty());

            StepVerifier.create(scheduleService.delete(9L)).verifyComplete();

            verify(auditService).record("delete", 9L, "ana", NOW);
            assertThat(mutations("delete")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should complete a committed delete when the audit write fails")
        void shouldSurviveAuditFailureOnDelete() {
            signedIn();
            when(apiClient.deleteJob(9L)).thenReturn(Mono.empty());
            doThrow(new DataAccessResourceFailureException("database is locked"))
                    .when(auditService).record(anyString(), any(), anyString(), any(Instant.class));

            StepVerifier.create(scheduleService.delete(9L)).verifyComplete();

            assertThat(mutations("delete")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should surface NotFound for an unknown id")
        void shouldSurfaceNotFoundOnDelete() {
            signedIn();
            when(apiClient.deleteJob(404L)).thenReturn(Mono.error(new NotFoundException("Job não encontrado")));

            StepVerifier.create(scheduleService.delete(404L))
                    .expectError(NotFoundException.class)
                    .verify();

            verify(auditService, never()).record(anyString(), anyLong(), anyString(), any(Instant.class));
        }

        @Test
        @DisplayName("Should refuse to delete while a manual search runs")
        void shouldRefuseDeleteWhileBusy() {
            executionMutex.acquire();

            StepVerifier.create(scheduleService.delete(9L))
                    .expectError(BusyException.class)
                    .verify();

            verify(apiClient, never()).deleteJob(anyLong());
        }
    }

    @Nested
    @DisplayName("Toggle")
    class ToggleTests {

        private final ScheduledJob stored = ScheduledJob.builder()
                .id(3L)
                .searchTerms(List.of("edital"))
                .triggerTime(LocalTime.of(18, 30))
                .active(true)
                .build();

        @Test
        @DisplayName("Should flip the stored active flag")
        void shouldFlipActive() {
            signedIn();
            when(apiClient.listJobs()).thenReturn(Mono.just(JobCollection.of(List.of(stored))));
            when(apiClient.updateJob(any(ScheduledJob.class))).thenReturn(Mono.empty());

            StepVerifier.create(scheduleService.toggle(3L))
                    .assertNext(toggled -> assertThat(toggled.isActive()).isFalse())
                    .verifyComplete();

            ArgumentCaptor<ScheduledJob> sent = ArgumentCaptor.forClass(ScheduledJob.class);
            verify(apiClient).updateJob(sent.capture());
            assertThat(sent.getValue().getId()).isEqualTo(3L);
            assertThat(sent.getValue().isActive()).isFalse();
            assertThat(sent.getValue().getSearchTerms()).containsExactly("edital");
            verify(auditService).record("toggle", 3L, "ana", NOW);
        }

        @Test
        @DisplayName("Should restore the original state after two toggles")
        void shouldRestoreAfterTwoToggles() {
            signedIn();
            ScheduledJob[] current = {stored};
            when(apiClient.listJobs()).thenAnswer(invocation -> Mono.just(JobCollection.of(List.of(current[0]))));
            when(apiClient.updateJob(any(ScheduledJob.class))).thenAnswer(invocation -> {
                current[0] = invocation.getArgument(0);
                return Mono.empty();
            });

            scheduleService.toggle(3L).block();
            scheduleService.toggle(3L).block();

            assertThat(current[0].isActive()).isTrue();
        }

        @Test
        @DisplayName("Should fail with NotFound when the id is not listed")
        void shouldFailForUnknownId() {
            signedIn();
            when(apiClient.listJobs()).thenReturn(Mono.just(JobCollection.of(List.of(stored))));

            StepVerifier.create(scheduleService.toggle(77L))
                    .expectError(NotFoundException.class)
                    .verify();

            verify(apiClient, never()).updateJob(any(ScheduledJob.class));
        }
    }

    @Test
    @DisplayName("Listing requires a session")
    void listRequiresSession() {
        when(sessionGuard.requireSession()).thenThrow(new AuthException("Not authenticated"));

        StepVerifier.create(scheduleService.list())
                .expectError(AuthException.class)
                .verify();

        verifyNoInteractions(apiClient);
    }
}
