package com.instaclustr.bulkrestore.measure;

import java.time.Duration;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.google.common.base.MoreObjects;

import static java.lang.String.format;

/**
 * Amount of time with a unit, written as "20s", "10m", "1h" or "2d" on the command line and in JSON.
 */
public class Time {

    public final Long value;
    public final TimeUnit unit;

    public Time(final Long value, final TimeUnit unit) {
        if (value == null || value < 0) {
            throw new IllegalArgumentException(format("Time value has to be a non-negative number, it is %s", value));
        }
        this.value = value;
        this.unit = unit == null ? TimeUnit.SECONDS : unit;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Time parse(final String time) {
        if (time == null || time.trim().isEmpty()) {
            throw new IllegalArgumentException("Time can not be null nor empty.");
        }

        final String trimmed = time.trim();
        final char last = trimmed.charAt(trimmed.length() - 1);

        if (Character.isDigit(last)) {
            return new Time(Long.parseLong(trimmed), TimeUnit.SECONDS);
        }

        return new Time(Long.parseLong(trimmed.substring(0, trimmed.length() - 1).trim()), TimeUnit.parse(String.valueOf(last)));
    }

    public static Time seconds(final long seconds) {
        return new Time(seconds, TimeUnit.SECONDS);
    }

    public static Time minutes(final long minutes) {
        return new Time(minutes, TimeUnit.MINUTES);
    }

    public long toMilliseconds() {
        return unit.toMilliseconds(value);
    }

    public Duration toDuration() {
        return Duration.ofMillis(toMilliseconds());
    }

    @JsonValue
    public String toValue() {
        return value + unit.unit;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof Time)) {
            return false;
        }

        final Time other = (Time) obj;

        return this.value.equals(other.value) && this.unit == other.unit;
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, unit);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("value", value)
            .add("unit", unit)
            .toString();
    }

    public enum TimeUnit {
        SECONDS("s") {
            @Override
            long toMilliseconds(final long value) {
                return value * 1000;
            }
        },
        MINUTES("m") {
            @Override
            long toMilliseconds(final long value) {
                return value * 60 * 1000;
            }
        },
        HOURS("h") {
            @Override
            long toMilliseconds(final long value) {
                return value * 60 * 60 * 1000;
            }
        },
        DAYS("d") {
            @Override
            long toMilliseconds(final long value) {
                return value * 24 * 60 * 60 * 1000;
            }
        };

        final String unit;

        TimeUnit(final String unit) {
            this.unit = unit;
        }

        abstract long toMilliseconds(long value);

        static TimeUnit parse(final String unit) {
            for (final TimeUnit timeUnit : values()) {
                if (timeUnit.unit.equalsIgnoreCase(unit)) {
                    return timeUnit;
                }
            }
            throw new IllegalArgumentException(format("Unknown time unit '%s', use one of s, m, h or d", unit));
        }

        @Override
        public String toString() {
            return unit;
        }
    }
}
