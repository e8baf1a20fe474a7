package com.libragraph.cadence.core.scheduler;

import com.libragraph.cadence.core.job.Frequency;
import com.libragraph.cadence.core.job.TriggerSpec;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class TriggerCalculatorTest {

    private static Instant next(TriggerSpec trigger, String now) {
        return TriggerCalculator.nextFireTime(trigger, Instant.parse(now));
    }

    @Test
    void weeklyFromWednesdayIsFollowingMonday() {
        TriggerSpec.Cron weekly = TriggerSpec.Cron.parse("weekly", "09:00");

        // 2024-01-03 is a Wednesday
        assertThat(next(weekly, "2024-01-03T12:00:00Z")).isEqualTo(Instant.parse("2024-01-08T09:00:00Z"));
    }

    @Test
    void weeklyOnMondayBeforeTimeFiresSameDay() {
        TriggerSpec.Cron weekly = new TriggerSpec.Cron(Frequency.WEEKLY, 9, 0);

        assertThat(next(weekly, "2024-01-08T08:59:00Z")).isEqualTo(Instant.parse("2024-01-08T09:00:00Z"));
        assertThat(next(weekly, "2024-01-08T09:00:00Z")).isEqualTo(Instant.parse("2024-01-15T09:00:00Z"));
    }

    @Test
    void dailyRollsOverAfterTime() {
        TriggerSpec.Cron daily = new TriggerSpec.Cron(Frequency.DAILY, 7, 30);

        assertThat(next(daily, "2024-01-01T07:00:00Z")).isEqualTo(Instant.parse("2024-01-01T07:30:00Z"));
        assertThat(next(daily, "2024-01-01T07:30:00Z")).isEqualTo(Instant.parse("2024-01-02T07:30:00Z"));
        assertThat(next(daily, "2024-12-31T23:00:00Z")).isEqualTo(Instant.parse("2025-01-01T07:30:00Z"));
    }

    @Test
    void monthlyFiresOnTheFirst() {
        TriggerSpec.Cron monthly = new TriggerSpec.Cron(Frequency.MONTHLY, 0, 0);

        assertThat(next(monthly, "2024-01-15T10:00:00Z")).isEqualTo(Instant.parse("2024-02-01T00:00:00Z"));
        assertThat(next(monthly, "2024-12-01T00:00:00Z")).isEqualTo(Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void monthlyOnTheFirstBeforeTimeFiresToday() {
        TriggerSpec.Cron monthly = new TriggerSpec.Cron(Frequency.MONTHLY, 18, 0);

        assertThat(next(monthly, "2024-03-01T06:00:00Z")).isEqualTo(Instant.parse("2024-03-01T18:00:00Z"));
    }

    @Test
    void oneOffAnswersItsOwnInstant() {
        Instant runAt = Instant.parse("2024-01-01T12:00:00Z");

        assertThat(next(new TriggerSpec.At(runAt), "2024-06-01T00:00:00Z")).isEqualTo(runAt);
    }
}
