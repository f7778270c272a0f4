package com.asiainfo.insights.core.model;

import com.asiainfo.insights.core.exception.InvalidQueryException;

import java.util.List;

/**
 * Raw event listing request, paged by cursor.
 */
public record EventsQuery(
        String insightId,
        InsightType insightType,
        List<FilterInfo> filters,
        TimeWindow time,
        String cursor,
        int limit,
        SortOrder order
) {

    public EventsQuery {
        if (insightId == null || insightId.isBlank()) {
            throw new InvalidQueryException("insightId is required");
        }
        if (insightType == null) {
            throw new InvalidQueryException("insightType is required");
        }
        if (time == null) {
            throw new InvalidQueryException("time window is required");
        }
        if (limit < 1) {
            throw new InvalidQueryException("limit must be at least 1, got " + limit);
        }
        filters = filters == null ? List.of() : List.copyOf(filters);
        order = order == null ? SortOrder.DESC : order;
    }

    /**
     * Same scope as an aggregation over the window, without metrics or groups.
     */
    public InsightsQuery toInsightsQuery() {
        return new InsightsQuery(insightId, insightType, List.of(), filters, List.of(), time);
    }
}
