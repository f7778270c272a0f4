package com.asiainfo.insights.api.dto;

import com.asiainfo.insights.core.model.DateUnit;
import com.asiainfo.insights.core.model.TimeWindow;

import java.time.Instant;

/**
 * @param startAt epoch millis
 * @param endAt   epoch millis
 * @param unit    minute/hour/day/month/year
 */
public record TimeRequest(Long startAt, Long endAt, String unit, String timezone) {

    public TimeWindow toTimeWindow() {
        return new TimeWindow(
                startAt == null ? null : Instant.ofEpochMilli(startAt),
                endAt == null ? null : Instant.ofEpochMilli(endAt),
                DateUnit.fromWireName(unit),
                timezone);
    }
}
