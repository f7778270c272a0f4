package com.asiainfo.insights.core.model;

import com.asiainfo.insights.core.InsightsConstants;
import com.asiainfo.insights.core.exception.InvalidQueryException;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;

/**
 * @param timezone IANA zone id; may be null, then the request context decides
 */
public record TimeWindow(Instant startAt, Instant endAt, DateUnit unit, String timezone) {

    public TimeWindow {
        if (startAt == null || endAt == null) {
            throw new InvalidQueryException("time window requires startAt and endAt");
        }
        if (startAt.isAfter(endAt)) {
            throw new InvalidQueryException("time window startAt is after endAt");
        }
    }

    /**
     * At least one full day between start and end.
     */
    public boolean spansAtLeastOneDay() {
        return Duration.between(startAt, endAt).toDays() >= 1;
    }

    public ZoneId zone(InsightsContext context) {
        String id = timezone;
        if (id == null || id.isBlank()) {
            id = context != null ? context.timezone() : null;
        }
        if (id == null || id.isBlank()) {
            id = InsightsConstants.DEFAULT_TIMEZONE;
        }
        try {
            return ZoneId.of(id);
        } catch (DateTimeException e) {
            throw new InvalidQueryException("Invalid timezone: " + id);
        }
    }
}
