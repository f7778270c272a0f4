package com.asiainfo.insights.core.model;

import com.asiainfo.insights.core.InsightsConstants;

/**
 * 请求的度量：事件数或会话数
 */
public record MetricInfo(String name, MetricMath math) {

    public static MetricInfo events(String name) {
        return new MetricInfo(name, MetricMath.EVENTS);
    }

    public static MetricInfo sessions(String name) {
        return new MetricInfo(name, MetricMath.SESSIONS);
    }

    public boolean isAllEvent() {
        return InsightsConstants.ALL_EVENT.equals(name);
    }
}
