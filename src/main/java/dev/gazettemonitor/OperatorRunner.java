package dev.gazettemonitor;

import dev.gazettemonitor.config.OperatorConfig;
import dev.gazettemonitor.model.ExecutionWindow;
import dev.gazettemonitor.model.JobCollection;
import dev.gazettemonitor.model.Screen;
import dev.gazettemonitor.model.ScheduledJob;
import dev.gazettemonitor.model.SearchOutcome;
import dev.gazettemonitor.model.SearchRequest;
import dev.gazettemonitor.model.SessionState;
import dev.gazettemonitor.model.SystemSettings;
import dev.gazettemonitor.service.AccountService;
import dev.gazettemonitor.service.ManualSearchService;
import dev.gazettemonitor.service.ScheduleService;
import dev.gazettemonitor.service.ScreenNavigator;
import dev.gazettemonitor.service.SearchPlanner;
import dev.gazettemonitor.service.SessionGuard;
import dev.gazettemonitor.service.SettingsService;
import dev.gazettemonitor.service.WindowResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;

/**
 * One unattended operator session: restore or log in, report which schedules fire today
 * and over which window, optionally run the configured manual search, then save the
 * backend's activity log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class OperatorRunner {

    private static final String SEPARATOR = "========================================";

    private final SessionGuard sessionGuard;
    private final ScheduleService scheduleService;
    private final SettingsService settingsService;
    private final SearchPlanner searchPlanner;
    private final WindowResolver windowResolver;
    private final ManualSearchService manualSearchService;
    private final AccountService accountService;
    private final ScreenNavigator navigator;
    private final OperatorConfig operatorConfig;
    private final Clock clock;

    @Value("${monitor.metrics-wait-seconds:0}")
    private int metricsWaitSeconds;

    /**
     * @return number of active schedules that fire today
     */
    public int execute() {
        log.info(SEPARATOR);
        log.info("Gazette Monitor Starting");
        log.info(SEPARATOR);

        try {
            if (!establishSession()) {
                log.warn("No valid session and no operator credentials configured - nothing to do");
                return 0;
            }

            LocalDate today = LocalDate.now(clock);
            navigator.switchTo(Screen.SCHEDULES);
            JobCollection jobs = scheduleService.list().blockOptional().orElse(JobCollection.empty());
            SystemSettings settings = settingsService.get().blockOptional()
                    .orElse(SystemSettings.builder().build());

            int firing = reportSchedules(jobs, settings, today);
            runConfiguredSearch(today);
            saveActivityLog();

            log.info(SEPARATOR);
            log.info("Gazette Monitor Completed");
            log.info("Schedules firing today ({}): {}", today, firing);
            log.info(SEPARATOR);

            handleMetricsWait();
            return firing;
        } catch (Exception e) {
            log.error("Operator run failed: {}", e.getMessage(), e);
            throw new IllegalStateException("Operator run failed", e);
        }
    }

    private boolean establishSession() {
        SessionState state = sessionGuard.restore().blockOptional().orElse(SessionState.ANONYMOUS);
        if (state == SessionState.AUTHENTICATED) {
            return true;
        }
        if (!operatorConfig.hasCredentials()) {
            return false;
        }
        sessionGuard.login(operatorConfig.getUsername(), operatorConfig.getPassword()).block();
        return sessionGuard.isAuthenticated();
    }

    private int reportSchedules(JobCollection jobs, SystemSettings settings, LocalDate today) {
        log.info("Schedules: {} total, {} active, {} inactive (last execution: {})",
                jobs.totalJobs(), jobs.activeJobs(), jobs.inactiveJobs(),
                jobs.lastExecution() != null ? jobs.lastExecution() : "unknown");

        int firing = 0;
        for (ScheduledJob job : jobs.jobs()) {
            if (!job.isActive()) {
                log.debug("  - #{} inactive", job.getId());
                continue;
            }
            ExecutionWindow window = windowResolver.resolve(job, today);
            if (!window.fires()) {
                log.info("  - #{} {} does not fire on {}", job.getId(), job.getSearchTerms(), today.getDayOfWeek());
                continue;
            }
            firing++;
            String recipient = searchPlanner.plan(job, today, settings.getPrimaryEmail())
                    .map(SearchRequest::getEmail)
                    .orElse(null);
            log.info("  - #{} {} at {} covering {} to {} ({} day(s)) -> {}",
                    job.getId(), job.getSearchTerms(), job.getTriggerTime(),
                    window.fromDate(), window.toDate(), window.days(),
                    recipient != null ? recipient : "backend default");
        }
        return firing;
    }

    private void runConfiguredSearch(LocalDate today) {
        if (operatorConfig.getSearchTerms() == null || operatorConfig.getSearchTerms().isEmpty()) {
            return;
        }
        navigator.switchTo(Screen.MANUAL_SEARCH);
        SearchRequest request = SearchRequest.builder()
                .terms(operatorConfig.getSearchTerms())
                .fromDate(today.minusDays(Math.max(0, operatorConfig.getSearchLookbackDays())))
                .toDate(today)
                .email(operatorConfig.getSearchEmail())
                .build();
        SearchOutcome outcome = manualSearchService.search(request).block();
        if (outcome != null) {
            log.info("Manual search status: {} ({})", outcome.getStatus(), outcome.getKind());
        }
    }

    private void saveActivityLog() {
        String target = operatorConfig.getActivityLogPath();
        if (target == null || target.isBlank()) {
            return;
        }
        navigator.switchTo(Screen.ACTIVITY_LOG);
        String content = accountService.activityLog().blockOptional().orElse("");
        try {
            Path path = Path.of(target);
            if (path.getParent() != null) {
                Files.createDirectories(path.getParent());
            }
            Files.writeString(path, content, StandardCharsets.UTF_8);
            log.info("Activity log saved to {} ({} chars)", path, content.length());
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void handleMetricsWait() {
        if (metricsWaitSeconds > 0) {
            log.info("Keeping alive for {} seconds (metrics scrape)...", metricsWaitSeconds);
            try {
                Thread.sleep(metricsWaitSeconds * 1000L);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                log.warn("Metrics wait interrupted");
            }
        }
    }
}
