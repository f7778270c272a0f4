package com.asiainfo.insights.core.engine;

import com.asiainfo.insights.core.InsightsConstants;
import com.asiainfo.insights.core.generator.GroupAlias;
import com.asiainfo.insights.core.model.GroupInfo;
import com.asiainfo.insights.core.model.InsightsQuery;
import com.asiainfo.insights.core.model.MetricInfo;
import com.asiainfo.insights.core.model.SeriesPoint;
import com.asiainfo.insights.core.model.TimeSeries;
import com.asiainfo.insights.core.model.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * 把稀疏的 (date, 指标列..., 分组列...) 行重组为稠密的时间序列。
 * <p>
 * 列的角色只靠列名区分：{@code date} 为时间桶，{@code %} 开头为分组列 (按别名编码解码)，
 * 其余为指标列。每条序列覆盖窗口内全部时间桶，缺失补 0
 */
public class InsightsResultReshaper {

    private static final Logger log = LoggerFactory.getLogger(InsightsResultReshaper.class);

    // 大约 34 天的分钟粒度
    static final int MAX_ENUMERATED_BUCKETS = 50_000;

    static final String OTHER_BUCKET = "other";

    private static final Comparator<List<String>> COMBINATION_ORDER = (a, b) -> {
        for (int i = 0; i < Math.min(a.size(), b.size()); i++) {
            int c = a.get(i).compareTo(b.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(a.size(), b.size());
    };

    private InsightsResultReshaper() {}

    public static List<TimeSeries> reshape(InsightsQuery query, ZoneId zone, List<Map<String, Object>> rows) {
        List<String> dates = new ArrayList<>(dateAxis(query.time(), zone, rows));

        // metric -> combination -> date -> value
        Map<String, Map<List<String>, Map<String, Long>>> values = new LinkedHashMap<>();
        for (MetricInfo metric : query.metrics()) {
            values.put(metric.name(), new HashMap<>());
        }
        List<String> groupOrder = groupOrder(query, rows);

        for (Map<String, Object> row : rows) {
            String date = String.valueOf(row.get(InsightsConstants.DATE_COLUMN));
            List<String> combination = combination(row, groupOrder);
            for (Map.Entry<String, Object> column : row.entrySet()) {
                if (!isMetricColumn(column.getKey())) {
                    continue;
                }
                values.computeIfAbsent(column.getKey(), k -> new HashMap<>())
                        .computeIfAbsent(combination, k -> new HashMap<>())
                        .merge(date, toLong(column.getValue()), Long::sum);
            }
        }

        List<TimeSeries> series = new ArrayList<>();
        for (Map.Entry<String, Map<List<String>, Map<String, Long>>> metric : values.entrySet()) {
            Map<List<String>, Map<String, Long>> byCombination = metric.getValue();
            if (groupOrder.isEmpty() && byCombination.isEmpty()) {
                byCombination.put(List.of(), Map.of());
            }
            List<List<String>> combinations = new ArrayList<>(byCombination.keySet());
            combinations.sort(COMBINATION_ORDER);
            for (List<String> combination : combinations) {
                series.add(toSeries(metric.getKey(), groupOrder, combination, dates, byCombination.get(combination)));
            }
        }
        return series;
    }

    /**
     * Every bucket of the window plus any date observed in the rows, ascending.
     */
    static Set<String> dateAxis(TimeWindow window, ZoneId zone, List<Map<String, Object>> rows) {
        Set<String> dates = new TreeSet<>();
        LocalDateTime end = LocalDateTime.ofInstant(window.endAt(), zone);
        LocalDateTime bucket = window.unit().truncate(LocalDateTime.ofInstant(window.startAt(), zone));
        int count = 0;
        do {
            dates.add(window.unit().label(bucket));
            bucket = window.unit().next(bucket);
            count++;
        } while (bucket.isBefore(end) && count < MAX_ENUMERATED_BUCKETS);
        if (bucket.isBefore(end)) {
            log.warn("Window {} - {} exceeds {} {} buckets, only observed dates are added beyond it",
                    window.startAt(), window.endAt(), MAX_ENUMERATED_BUCKETS, window.unit().wireName());
        }
        for (Map<String, Object> row : rows) {
            Object date = row.get(InsightsConstants.DATE_COLUMN);
            if (date != null) {
                dates.add(String.valueOf(date));
            }
        }
        return dates;
    }

    /**
     * Group values in declared order; groups only seen in the result columns follow.
     */
    private static List<String> groupOrder(InsightsQuery query, List<Map<String, Object>> rows) {
        Set<String> order = new LinkedHashSet<>();
        for (GroupInfo group : query.groups()) {
            order.add(group.value());
        }
        if (!rows.isEmpty()) {
            for (String column : rows.get(0).keySet()) {
                if (GroupAlias.isGroupColumn(column)) {
                    order.add(GroupAlias.decode(column).value());
                }
            }
        }
        return new ArrayList<>(order);
    }

    /**
     * Dimension values of one row. A custom-grouped dimension takes the label of
     * its first matching entry, in column order, or {@value #OTHER_BUCKET}.
     */
    private static List<String> combination(Map<String, Object> row, List<String> groupOrder) {
        if (groupOrder.isEmpty()) {
            return List.of();
        }
        Map<String, String> resolved = new HashMap<>();
        for (Map.Entry<String, Object> column : row.entrySet()) {
            if (!GroupAlias.isGroupColumn(column.getKey())) {
                continue;
            }
            GroupAlias alias = GroupAlias.decode(column.getKey());
            if (!alias.isCustom()) {
                resolved.put(alias.value(), String.valueOf(column.getValue()));
            } else if (!resolved.containsKey(alias.value()) && isMatch(column.getValue())) {
                resolved.put(alias.value(), alias.label());
            }
        }
        List<String> combination = new ArrayList<>(groupOrder.size());
        for (String group : groupOrder) {
            combination.add(resolved.getOrDefault(group, OTHER_BUCKET));
        }
        return combination;
    }

    private static TimeSeries toSeries(String metric, List<String> groupOrder, List<String> combination,
                                       List<String> dates, Map<String, Long> values) {
        Map<String, String> groups = new LinkedHashMap<>();
        for (int i = 0; i < combination.size(); i++) {
            groups.put(groupOrder.get(i), combination.get(i));
        }
        String name = combination.isEmpty() ? metric : metric + "-" + String.join("-", combination);
        List<SeriesPoint> points = new ArrayList<>(dates.size());
        for (String date : dates) {
            points.add(new SeriesPoint(date, values.getOrDefault(date, 0L)));
        }
        return new TimeSeries(name, groups, points);
    }

    private static boolean isMetricColumn(String column) {
        return !InsightsConstants.DATE_COLUMN.equals(column) && !GroupAlias.isGroupColumn(column);
    }

    private static boolean isMatch(Object flag) {
        if (flag instanceof Boolean b) {
            return b;
        }
        return flag != null && toLong(flag) != 0;
    }

    /**
     * SQL NULL aggregates mean no matching rows and count as 0; any other non-numeric value is a failure.
     */
    static long toLong(Object value) {
        if (value == null) {
            return 0L;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return new BigDecimal(String.valueOf(value).trim()).longValue();
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Non-numeric metric value: " + value, e);
        }
    }
}
