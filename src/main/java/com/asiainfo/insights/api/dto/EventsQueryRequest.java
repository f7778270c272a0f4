package com.asiainfo.insights.api.dto;

import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.EventsQuery;
import com.asiainfo.insights.core.model.FilterInfo;
import com.asiainfo.insights.core.model.InsightsContext;
import com.asiainfo.insights.core.model.SortOrder;

import java.util.List;

/**
 * 事件明细分页请求
 *
 * @param cursor nextCursor of the previous page, absent for the first page
 * @param order  asc or desc, desc by default
 */
public record EventsQueryRequest(
        String insightId,
        String insightType,
        List<FilterInfo> filters,
        TimeRequest time,
        String cursor,
        Integer limit,
        String order,
        String timezone
) {

    private static final int DEFAULT_LIMIT = 20;

    public EventsQuery toQuery() {
        if (time == null) {
            throw new InvalidQueryException("time window is required");
        }
        SortOrder sortOrder = SortOrder.DESC;
        if (order != null && !order.isBlank()) {
            try {
                sortOrder = SortOrder.valueOf(order.trim().toUpperCase());
            } catch (IllegalArgumentException e) {
                throw new InvalidQueryException("Invalid order: " + order);
            }
        }
        return new EventsQuery(insightId, RequestSupport.insightType(insightType), filters, time.toTimeWindow(),
                cursor, limit == null ? DEFAULT_LIMIT : limit, sortOrder);
    }

    public InsightsContext toContext() {
        return new InsightsContext(timezone);
    }
}
