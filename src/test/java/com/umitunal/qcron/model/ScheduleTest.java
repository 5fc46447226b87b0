package com.umitunal.qcron.model;

import com.umitunal.qcron.exception.InvalidCronSpecException;
import com.umitunal.qcron.exception.InvalidIntervalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class ScheduleTest {

    @Test
    @DisplayName("Should accept the minimum interval and reject anything shorter")
    void testIntervalBounds() {
        assertThat(Schedule.interval(1000).getIntervalMs()).isEqualTo(1000);

        assertThatThrownBy(() -> Schedule.interval(999))
                .isInstanceOf(InvalidIntervalException.class)
                .hasMessageContaining("999");
        assertThatThrownBy(() -> Schedule.interval(0))
                .isInstanceOf(InvalidIntervalException.class);
        assertThatThrownBy(() -> Schedule.interval(-5000))
                .isInstanceOf(InvalidIntervalException.class);
    }

    @Test
    @DisplayName("Should reject blank cron expressions")
    void testBlankCron() {
        assertThatThrownBy(() -> Schedule.cron(null)).isInstanceOf(InvalidCronSpecException.class);
        assertThatThrownBy(() -> Schedule.cron("   ")).isInstanceOf(InvalidCronSpecException.class);
    }

    @Test
    @DisplayName("Should expose only the fields of its kind")
    void testKinds() {
        Schedule interval = Schedule.interval(5000);
        Schedule cron = Schedule.cron("  0 0 * * *  ");

        assertThat(interval.isInterval()).isTrue();
        assertThat(interval.isCron()).isFalse();
        assertThat(interval.getCronspec()).isNull();

        assertThat(cron.isCron()).isTrue();
        assertThat(cron.getKind()).isEqualTo(Schedule.Kind.CRON);
        assertThat(cron.getCronspec()).isEqualTo("0 0 * * *");
    }

    @Test
    @DisplayName("Should compare by value")
    void testEquality() {
        assertThat(Schedule.interval(2000)).isEqualTo(Schedule.interval(2000))
                .hasSameHashCodeAs(Schedule.interval(2000))
                .isNotEqualTo(Schedule.interval(3000));
        assertThat(Schedule.cron("*/5 * * * *")).isEqualTo(Schedule.cron("*/5 * * * *"))
                .isNotEqualTo(Schedule.cron("*/10 * * * *"));
    }
}
