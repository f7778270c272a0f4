package com.asiainfo.insights.api.dto;

import com.asiainfo.insights.core.exception.InvalidQueryException;
import com.asiainfo.insights.core.model.FilterInfo;
import com.asiainfo.insights.core.model.GroupInfo;
import com.asiainfo.insights.core.model.InsightsContext;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.core.model.MetricInfo;

import java.util.List;

/**
 * 聚合查询请求
 *
 * @param timezone request context timezone, used when time.timezone is absent
 */
public record InsightsQueryRequest(
        String insightId,
        String insightType,
        List<MetricInfo> metrics,
        List<FilterInfo> filters,
        List<GroupInfo> groups,
        TimeRequest time,
        String timezone
) {

    public InsightsQuery toQuery() {
        if (time == null) {
            throw new InvalidQueryException("time window is required");
        }
        return new InsightsQuery(insightId, RequestSupport.insightType(insightType), metrics, filters, groups,
                time.toTimeWindow());
    }

    public InsightsContext toContext() {
        return new InsightsContext(timezone);
    }
}
