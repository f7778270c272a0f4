package com.asiainfo.insights.core.model;

import com.asiainfo.insights.core.exception.InvalidQueryException;

import java.util.List;

/**
 * 聚合查询请求 (每个请求新建，不可变)
 */
public record InsightsQuery(
        String insightId,
        InsightType insightType,
        List<MetricInfo> metrics,
        List<FilterInfo> filters,
        List<GroupInfo> groups,
        TimeWindow time
) {

    public InsightsQuery {
        if (insightId == null || insightId.isBlank()) {
            throw new InvalidQueryException("insightId is required");
        }
        if (insightType == null) {
            throw new InvalidQueryException("insightType is required");
        }
        if (time == null) {
            throw new InvalidQueryException("time window is required");
        }
        metrics = metrics == null ? List.of() : List.copyOf(metrics);
        filters = filters == null ? List.of() : List.copyOf(filters);
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public boolean hasAllEvent() {
        return metrics.stream().anyMatch(MetricInfo::isAllEvent);
    }
}
