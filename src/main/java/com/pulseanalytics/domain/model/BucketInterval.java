package com.pulseanalytics.domain.model;

import com.pulseanalytics.domain.exception.InvalidQueryException;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Locale;

/**
 * Histogram interval for time-series analytics. Buckets are aligned to UTC.
 */
public enum BucketInterval {
    MINUTE("minute", ChronoUnit.MINUTES),
    HOUR("hour", ChronoUnit.HOURS),
    DAY("day", ChronoUnit.DAYS);

    private final String calendarName;
    private final ChronoUnit unit;

    BucketInterval(String calendarName, ChronoUnit unit) {
        this.calendarName = calendarName;
        this.unit = unit;
    }

    /**
     * Name the index uses for its calendar_interval.
     */
    public String calendarName() {
        return calendarName;
    }

    public Duration duration() {
        return unit.getDuration();
    }

    public Instant truncate(Instant instant) {
        return instant.truncatedTo(unit);
    }

    public static BucketInterval parse(String value) {
        if (value == null || value.isBlank()) {
            return DAY;
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "minute":
            case "1m":
                return MINUTE;
            case "hour":
            case "1h":
                return HOUR;
            case "day":
            case "1d":
                return DAY;
            default:
                throw new InvalidQueryException("Unsupported interval: " + value);
        }
    }
}
