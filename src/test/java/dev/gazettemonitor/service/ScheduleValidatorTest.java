package dev.gazettemonitor.service;

import dev.gazettemonitor.exception.ValidationException;
import dev.gazettemonitor.model.ScheduledJob;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Arrays;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScheduleValidatorTest {

    private final ScheduleValidator validator = new ScheduleValidator();

    private ScheduledJob.ScheduledJobBuilder validJob() {
        return ScheduledJob.builder()
                .searchTerms(List.of("licitação"))
                .triggerTime(LocalTime.of(8, 0))
                .active(true);
    }

    @Test
    @DisplayName("Should trim terms and drop duplicates keeping first occurrence")
    void shouldNormalizeTerms() {
        ScheduledJob draft = validJob()
                .searchTerms(Arrays.asList("  pregão ", "edital", "pregão", " ", null, "edital  "))
                .build();

        ScheduledJob normalized = validator.normalize(draft);

        assertThat(normalized.getSearchTerms()).containsExactly("pregão", "edital");
    }

    @Test
    @DisplayName("Should reject empty terms")
    void shouldRejectEmptyTerms() {
        ScheduledJob draft = validJob().searchTerms(List.of("   ")).build();

        assertThatThrownBy(() -> validator.normalize(draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("search term");
    }

    @Test
    @DisplayName("Should reject missing trigger time")
    void shouldRejectMissingTriggerTime() {
        ScheduledJob draft = validJob().triggerTime(null).build();

        assertThatThrownBy(() -> validator.normalize(draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Trigger time");
    }

    @Test
    @DisplayName("Should reject malformed notification email")
    void shouldRejectInvalidEmail() {
        ScheduledJob draft = validJob().notifyEmail("ops@localhost").build();

        assertThatThrownBy(() -> validator.normalize(draft))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("ops@localhost");
    }

    @Test
    @DisplayName("Should treat blank email as absent")
    void shouldClearBlankEmail() {
        ScheduledJob normalized = validator.normalize(validJob().notifyEmail("   ").build());

        assertThat(normalized.getNotifyEmail()).isNull();
    }

    @Test
    @DisplayName("Should report every violation at once")
    void shouldCollectAllViolations() {
        ScheduledJob draft = ScheduledJob.builder()
                .lookbackDays(-1)
                .notifyEmail("not-an-email")
                .build();

        assertThatThrownBy(() -> validator.normalize(draft))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getViolations()).hasSize(4));
    }

    @Test
    @DisplayName("Should keep weekdays and active flag untouched")
    void shouldPreserveOtherFields() {
        ScheduledJob draft = validJob()
                .weekdays(Set.of(DayOfWeek.FRIDAY))
                .lookbackDays(3)
                .active(false)
                .notifyEmail(" juridico@cpis.com.br ")
                .build();

        ScheduledJob normalized = validator.normalize(draft);

        assertThat(normalized.getWeekdays()).containsExactly(DayOfWeek.FRIDAY);
        assertThat(normalized.getLookbackDays()).isEqualTo(3);
        assertThat(normalized.isActive()).isFalse();
        assertThat(normalized.getNotifyEmail()).isEqualTo("juridico@cpis.com.br");
    }
}
