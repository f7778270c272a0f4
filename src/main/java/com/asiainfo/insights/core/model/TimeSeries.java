package com.asiainfo.insights.core.model;

import java.util.List;
import java.util.Map;

/**
 * 一条时间序列：一个指标，或指标 × 一组分组取值
 *
 * @param groups decoded group value per group field, in declared order
 */
public record TimeSeries(String name, Map<String, String> groups, List<SeriesPoint> data) {
}
