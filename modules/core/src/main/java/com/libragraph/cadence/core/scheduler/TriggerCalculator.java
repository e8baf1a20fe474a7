package com.libragraph.cadence.core.scheduler;

import com.libragraph.cadence.core.job.TriggerSpec;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneOffset;
import java.time.temporal.TemporalAdjusters;

/** Computes fire times in UTC. */
public final class TriggerCalculator {

    private TriggerCalculator() {
    }

    /**
     * Next time {@code trigger} fires strictly after {@code after}. A one-off trigger
     * always answers its own instant, past or not.
     */
    public static Instant nextFireTime(TriggerSpec trigger, Instant after) {
        if (trigger instanceof TriggerSpec.At at) {
            return at.runAt();
        }
        TriggerSpec.Cron cron = (TriggerSpec.Cron) trigger;
        LocalDateTime now = LocalDateTime.ofInstant(after, ZoneOffset.UTC);
        LocalTime time = LocalTime.of(cron.hour(), cron.minute());

        LocalDateTime candidate;
        switch (cron.frequency()) {
            case DAILY:
                candidate = now.toLocalDate().atTime(time);
                if (!candidate.isAfter(now)) {
                    candidate = candidate.plusDays(1);
                }
                break;
            case WEEKLY:
                candidate = now.toLocalDate()
                        .with(TemporalAdjusters.nextOrSame(DayOfWeek.MONDAY))
                        .atTime(time);
                if (!candidate.isAfter(now)) {
                    candidate = candidate.plusWeeks(1);
                }
                break;
            case MONTHLY:
                candidate = now.toLocalDate().withDayOfMonth(1).atTime(time);
                if (!candidate.isAfter(now)) {
                    candidate = candidate.plusMonths(1);
                }
                break;
            default:
                throw new IllegalArgumentException("Unhandled frequency: " + cron.frequency());
        }
        return candidate.toInstant(ZoneOffset.UTC);
    }
}
