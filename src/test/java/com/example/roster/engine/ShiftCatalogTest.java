package com.example.roster.engine;

import com.example.roster.exception.ScheduleValidationException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShiftCatalogTest {

    @Test
    void fromKey_resolvesAliasesIgnoringCase() {
        assertThat(ShiftType.fromKey("Morning")).contains(ShiftType.MORNING);
        assertThat(ShiftType.fromKey(" noon ")).contains(ShiftType.AFTERNOON);
        assertThat(ShiftType.fromKey("EVENING")).contains(ShiftType.AFTERNOON);
        assertThat(ShiftType.fromKey("overnight")).contains(ShiftType.NIGHT);
        assertThat(ShiftType.fromKey("brunch")).isEmpty();
        assertThat(ShiftType.fromKey(null)).isEmpty();
    }

    @Test
    void defaults_useEightHourWindows() {
        ShiftCatalog catalog = ShiftCatalog.defaults();

        assertThat(catalog.durationMinutes(ShiftType.MORNING)).isEqualTo(480);
        assertThat(catalog.durationMinutes(ShiftType.AFTERNOON)).isEqualTo(480);
        assertThat(catalog.durationMinutes(ShiftType.NIGHT)).isEqualTo(480);
        assertThat(catalog.templateOf(ShiftType.MORNING).start()).isEqualTo(LocalTime.of(6, 0));
    }

    @Test
    void nightShift_endsOnFollowingDay() {
        ShiftTemplate night = ShiftCatalog.defaults().templateOf(ShiftType.NIGHT);
        LocalDate date = LocalDate.of(2024, 7, 1);

        assertThat(night.crossesMidnight()).isTrue();
        assertThat(night.startOn(date)).isEqualTo(LocalDateTime.of(2024, 7, 1, 22, 0));
        assertThat(night.endOn(date)).isEqualTo(LocalDateTime.of(2024, 7, 2, 6, 0));
    }

    @Test
    void of_overridesSingleTypeAndKeepsOthers() {
        ShiftCatalog catalog = ShiftCatalog.of(List.of(
                new ShiftTemplate(ShiftType.MORNING, LocalTime.of(7, 0), LocalTime.of(12, 30))));

        assertThat(catalog.durationMinutes(ShiftType.MORNING)).isEqualTo(330);
        assertThat(catalog.durationMinutes(ShiftType.NIGHT)).isEqualTo(480);
    }

    @Test
    void of_rejectsShiftsLongerThanSixteenHours() {
        List<ShiftTemplate> tooLong = List.of(
                new ShiftTemplate(ShiftType.NIGHT, LocalTime.of(18, 0), LocalTime.of(12, 0)));

        assertThatThrownBy(() -> ShiftCatalog.of(tooLong))
                .isInstanceOf(ScheduleValidationException.class)
                .extracting("errorCode")
                .isEqualTo(ScheduleValidationException.INVALID_SHIFT_TEMPLATE);
    }

    @Test
    void of_acceptsExactlySixteenHours() {
        ShiftCatalog catalog = ShiftCatalog.of(List.of(
                new ShiftTemplate(ShiftType.AFTERNOON, LocalTime.of(8, 0), LocalTime.of(0, 0))));

        assertThat(catalog.durationMinutes(ShiftType.AFTERNOON)).isEqualTo(16 * 60);
    }
}
