package com.asiainfo.insights.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * How a time column is physically stored.
 */
public enum DateEncoding {
    // 1739203200
    TIMESTAMP("timestamp"),
    // 1739203200000
    TIMESTAMP_MS("timestampMs"),
    // 2025-08-01
    DATE("date"),
    // 2025-08-01 00:00:00, naive UTC
    DATETIME("datetime");

    public static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    public static final DateTimeFormatter DATETIME_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final String wireName;

    DateEncoding(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Converts an instant into the literal a column of this encoding compares against.
     * Date strings use the calendar day in {@code zone}; datetime strings are UTC.
     */
    public Object encode(Instant instant, ZoneId zone) {
        return switch (this) {
            case TIMESTAMP -> instant.getEpochSecond();
            case TIMESTAMP_MS -> instant.toEpochMilli();
            case DATE -> DATE_FORMAT.format(instant.atZone(zone));
            case DATETIME -> DATETIME_FORMAT.format(instant.atZone(ZoneOffset.UTC));
        };
    }

    @JsonCreator
    public static DateEncoding fromWireName(String name) {
        for (DateEncoding encoding : values()) {
            if (encoding.wireName.equalsIgnoreCase(name)) {
                return encoding;
            }
        }
        throw new IllegalArgumentException("Unknown date encoding: " + name);
    }
}
