package com.asiainfo.insights.core.model;

import com.asiainfo.insights.core.exception.InvalidTimeUnitException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * 时间粒度。label pattern 必须与各方言的 bucket 格式化结果逐字一致
 */
public enum DateUnit {
    MINUTE("yyyy-MM-dd HH:mm:00", ChronoUnit.MINUTES),
    HOUR("yyyy-MM-dd HH:00:00", ChronoUnit.HOURS),
    DAY("yyyy-MM-dd", ChronoUnit.DAYS),
    MONTH("yyyy-MM-01", ChronoUnit.MONTHS),
    YEAR("yyyy-01-01", ChronoUnit.YEARS);

    private final DateTimeFormatter labelFormatter;
    private final ChronoUnit step;

    DateUnit(String labelPattern, ChronoUnit step) {
        this.labelFormatter = DateTimeFormatter.ofPattern(labelPattern);
        this.step = step;
    }

    public boolean isSubDay() {
        return this == MINUTE || this == HOUR;
    }

    /**
     * Truncates a local date-time to the start of the bucket that contains it.
     */
    public LocalDateTime truncate(LocalDateTime time) {
        return switch (this) {
            case MINUTE -> time.truncatedTo(ChronoUnit.MINUTES);
            case HOUR -> time.truncatedTo(ChronoUnit.HOURS);
            case DAY -> time.truncatedTo(ChronoUnit.DAYS);
            case MONTH -> time.truncatedTo(ChronoUnit.DAYS).withDayOfMonth(1);
            case YEAR -> time.truncatedTo(ChronoUnit.DAYS).withDayOfYear(1);
        };
    }

    public LocalDateTime next(LocalDateTime bucketStart) {
        return bucketStart.plus(1, step);
    }

    public String label(LocalDateTime bucketStart) {
        return labelFormatter.format(bucketStart);
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static DateUnit fromWireName(String name) {
        if (name != null) {
            for (DateUnit unit : values()) {
                if (unit.name().equalsIgnoreCase(name.trim())) {
                    return unit;
                }
            }
        }
        throw new InvalidTimeUnitException(name);
    }
}
