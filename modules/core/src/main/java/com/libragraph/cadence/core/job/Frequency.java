package com.libragraph.cadence.core.job;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.libragraph.cadence.core.error.ValidationException;

import java.util.Locale;

public enum Frequency {
    @JsonProperty("daily") DAILY,
    @JsonProperty("weekly") WEEKLY,
    @JsonProperty("monthly") MONTHLY;

    public static Frequency parse(String value) {
        if (value != null) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ValidationException(
                        "frequency must be one of daily, weekly, monthly; got '" + value + "'", "frequency");
            }
        }
        throw new ValidationException("frequency is required", "frequency");
    }
}
