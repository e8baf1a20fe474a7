package com.libragraph.cadence.core.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonTypeName;
import com.libragraph.cadence.core.error.ValidationException;

import java.time.Instant;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * When a job fires: a recurring {@link Cron} time of day, or a one-off {@link At}.
 * All times are UTC.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TriggerSpec.Cron.class, name = "cron"),
        @JsonSubTypes.Type(value = TriggerSpec.At.class, name = "at")
})
public sealed interface TriggerSpec {

    /** Value of the persisted {@code trigger_type} column. */
    String typeName();

    /** Daily at hour:minute, weekly on Monday, or monthly on day 1. */
    @JsonTypeName("cron")
    record Cron(
            @JsonProperty("frequency") Frequency frequency,
            @JsonProperty("hour") int hour,
            @JsonProperty("minute") int minute
    ) implements TriggerSpec {

        private static final Pattern TIME = Pattern.compile("(\\d{1,2}):(\\d{2})");

        public Cron {
            if (frequency == null) {
                throw new ValidationException("frequency is required", "frequency");
            }
            if (hour < 0 || hour > 23) {
                throw new ValidationException("hour must be between 0 and 23, got " + hour, "time");
            }
            if (minute < 0 || minute > 59) {
                throw new ValidationException("minute must be between 0 and 59, got " + minute, "time");
            }
        }

        /** Parses the {@code {frequency, time: "HH:MM"}} form tenants submit. */
        public static Cron parse(String frequency, String time) {
            Frequency parsed = Frequency.parse(frequency);
            if (time == null) {
                throw new ValidationException("time is required", "time");
            }
            Matcher m = TIME.matcher(time.trim());
            if (!m.matches()) {
                throw new ValidationException("time must be HH:MM, got '" + time + "'", "time");
            }
            return new Cron(parsed, Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)));
        }

        public String time() {
            return String.format("%02d:%02d", hour, minute);
        }

        @Override
        public String typeName() {
            return "cron";
        }
    }

    /** Fires once at {@code runAt}. */
    @JsonTypeName("at")
    record At(@JsonProperty("run_at") Instant runAt) implements TriggerSpec {

        public At {
            Objects.requireNonNull(runAt, "runAt");
        }

        @Override
        public String typeName() {
            return "at";
        }
    }
}
